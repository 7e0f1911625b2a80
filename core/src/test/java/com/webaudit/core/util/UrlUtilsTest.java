package com.webaudit.core.util;

import org.junit.jupiter.api.Test;

import java.net.URI;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class UrlUtilsTest {

    @Test
    void normalize_lowercases_drops_default_port_fragment_and_double_slashes() {
        assertEquals("http://example.com/a/b",
                UrlUtils.normalize(URI.create("HTTP://Example.COM:80//a//b#frag")).toString());
        assertEquals("https://ex.com/", UrlUtils.normalize(URI.create("https://ex.com:443")).toString());
        assertEquals("http://ex.com:8080/p?q=1", UrlUtils.normalize(URI.create("http://ex.com:8080/p?q=1#x")).toString());
    }

    @Test
    void normalize_keeps_percent_encoded_query_and_path() {
        URI n = UrlUtils.normalize(URI.create("HTTP://H.test:80/a%2Fb/x?q=a%26b&n=1%2B1&e=k%3Dv#frag"));

        assertEquals("http://h.test/a%2Fb/x?q=a%26b&n=1%2B1&e=k%3Dv", n.toString());
        assertEquals("q=a%26b&n=1%2B1&e=k%3Dv", n.getRawQuery());
        assertEquals(3, UrlParamUtil.parseQuery(n).size());
        assertEquals("a&b", UrlParamUtil.parseQuery(n).get("q"));
        assertEquals("1+1", UrlParamUtil.parseQuery(n).get("n"));
    }

    @Test
    void normalize_string_rejects_non_http_and_garbage() {
        assertNull(UrlUtils.normalize("mailto:someone@example.com"));
        assertNull(UrlUtils.normalize("javascript:void(0)"));
        assertNull(UrlUtils.normalize("ftp://example.com/file"));
        assertNull(UrlUtils.normalize("http://bad host/"));
        assertNull(UrlUtils.normalize("   "));
        assertNotNull(UrlUtils.normalize(" http://ex.com/ "));
    }

    @Test
    void dedupe_key_ignores_values_and_key_order() {
        String k1 = UrlUtils.dedupeKey(URI.create("http://ex.com/x?id=1"));
        String k2 = UrlUtils.dedupeKey(URI.create("http://EX.com:80/x?id=2#frag"));
        assertEquals(k1, k2);
        assertNotEquals(k1, UrlUtils.dedupeKey(URI.create("http://ex.com/x?page=1")));
        assertNotEquals(k1, UrlUtils.dedupeKey(URI.create("http://ex.com/x")));

        assertThat(UrlUtils.dedupeKey(URI.create("http://ex.com/x?b=1&a=2&b=3")))
                .isEqualTo("http://ex.com/x?a&b");
    }

    @Test
    void same_host_ignores_case_and_port() {
        assertTrue(UrlUtils.sameHost(URI.create("http://Ex.com/"), URI.create("https://ex.com:8443/a")));
        assertFalse(UrlUtils.sameHost(URI.create("http://ex.com/"), URI.create("http://other.com/")));
        assertFalse(UrlUtils.sameHost(URI.create("http://ex.com/"), URI.create("/relative")));
    }
}
