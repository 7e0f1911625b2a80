package com.webaudit.core.scanner;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.webaudit.core.model.FetchRequest;
import com.webaudit.core.model.FormSpec;
import com.webaudit.core.model.PageRecord;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class InjectionPointsTest {

    private static Map<String, String> inputs(String... kv) {
        Map<String, String> m = new LinkedHashMap<>();
        for (int i = 0; i + 1 < kv.length; i += 2) m.put(kv[i], kv[i + 1]);
        return m;
    }

    @Test
    void query_and_form_points_are_deduplicated_in_order() {
        FormSpec search = new FormSpec("http://site.test/search", "get", null, inputs("q", ""));
        List<PageRecord> pages = List.of(
                new PageRecord("http://site.test/item?id=1&ref=home", 200, List.of(search)),
                new PageRecord("http://site.test/item?id=2", 200, List.of(search)));

        List<InjectionPoint> points = InjectionPoints.collect(pages);

        assertThat(points).extracting(InjectionPoint::param).containsExactly("id", "ref", "q");
        assertThat(points).extracting(InjectionPoint::source).containsExactly(
                InjectionPoint.Source.QUERY, InjectionPoint.Source.QUERY, InjectionPoint.Source.FORM);
    }

    @Test
    void same_param_different_method_is_distinct() {
        FormSpec get = new FormSpec("http://site.test/a", "get", null, inputs("x", "1"));
        FormSpec post = new FormSpec("http://site.test/a", "post", null, inputs("x", "1"));
        List<InjectionPoint> points = InjectionPoints.collect(
                List.of(new PageRecord("http://site.test/", 200, List.of(get, post))));
        assertEquals(2, points.size());
    }

    @Test
    void query_request_overrides_only_target_param() {
        InjectionPoint p = InjectionPoint.query(java.net.URI.create("http://site.test/item?id=1&ref=home"), "id");
        assertEquals("1", p.originalValue());

        FetchRequest r = p.request("1'");
        assertEquals("GET", r.getMethod());
        assertEquals("http://site.test/item?id=1%27&ref=home", r.getUri().toString());
        assertNull(r.getBody());
    }

    @Test
    void urlencoded_post_form_keeps_other_defaults() {
        InjectionPoint p = InjectionPoint.form(
                new FormSpec("http://site.test/login?next=/", "post", null, inputs("user", "guest", "pw", "")), "pw");

        FetchRequest r = p.request("x y");

        assertEquals("POST", r.getMethod());
        assertEquals("http://site.test/login", r.getUri().toString());
        assertEquals(FormSpec.URLENCODED, r.getHeaders().get("Content-Type"));
        assertEquals("user=guest&pw=x+y", r.getBody());
        assertEquals("http://site.test/login", p.location());
    }

    @Test
    void json_post_form_sends_json_body() throws Exception {
        InjectionPoint p = InjectionPoint.form(
                new FormSpec("http://site.test/api", "post", "application/json", inputs("id", "7", "q", "")), "q");
        assertTrue(p.json());

        FetchRequest r = p.request("\"'><x>");

        assertEquals("application/json", r.getHeaders().get("Content-Type"));
        JsonNode body = new ObjectMapper().readTree(r.getBody());
        assertEquals("7", body.get("id").asText());
        assertEquals("\"'><x>", body.get("q").asText());
    }

    @Test
    void get_form_moves_values_to_query() {
        InjectionPoint p = InjectionPoint.form(
                new FormSpec("http://site.test/search", null, null, inputs("q", "", "lang", "ko")), "q");
        FetchRequest r = p.request("abc");
        assertEquals("GET", r.getMethod());
        assertEquals("http://site.test/search?q=abc&lang=ko", r.getUri().toString());
    }
}
