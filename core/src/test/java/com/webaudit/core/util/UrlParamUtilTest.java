package com.webaudit.core.util;

import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class UrlParamUtilTest {

    @Test
    void override_first_replaces_all_case_insensitive_and_moves_to_front() {
        URI out = UrlParamUtil.withParamOverrideFirst(
                URI.create("http://ex.com/p?a=1&q=old&Q=x&b=%20"), "q", "<v>");
        assertEquals("http://ex.com/p?q=%3Cv%3E&a=1&b=%20", out.toString());
    }

    @Test
    void override_on_url_without_query() {
        URI out = UrlParamUtil.withParamOverrideFirst(URI.create("http://ex.com"), "id", "1' AND '1'='1");
        assertEquals("http://ex.com/?id=1%27+AND+%271%27%3D%271", out.toString());
        assertEquals("1' AND '1'='1", UrlParamUtil.parseQuery(out).get("id"));
    }

    @Test
    void parse_query_decodes_and_keeps_order() {
        URI u = URI.create("http://ex.com/?z=a+b&x=%27&z=last&flag");
        Map<String, String> single = UrlParamUtil.parseQuery(u);
        assertThat(single).containsExactly(
                Map.entry("z", "last"), Map.entry("x", "'"), Map.entry("flag", ""));

        Map<String, List<String>> multi = UrlParamUtil.parseQueryMulti(u);
        assertEquals(List.of("a b", "last"), multi.get("z"));
    }

    @Test
    void form_encode_and_with_query() {
        Map<String, String> p = new LinkedHashMap<>();
        p.put("user", "a b");
        p.put("pw", "x&y");
        assertEquals("user=a+b&pw=x%26y", UrlParamUtil.formEncode(p));

        URI action = URI.create("http://ex.com/login?old=1");
        assertEquals("http://ex.com/login?user=a+b&pw=x%26y", UrlParamUtil.withQuery(action, p).toString());
        assertEquals("http://ex.com/login", UrlParamUtil.withoutQuery(action).toString());
        assertEquals("http://ex.com/login", UrlParamUtil.withQuery(action, Map.of()).toString());
    }

    @Test
    void blank_key_is_rejected() {
        assertThrows(IllegalArgumentException.class,
                () -> UrlParamUtil.withParamOverrideFirst(URI.create("http://ex.com/"), " ", "v"));
    }
}
