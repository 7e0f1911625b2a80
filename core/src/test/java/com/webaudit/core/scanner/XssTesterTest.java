package com.webaudit.core.scanner;

import com.webaudit.core.model.FormSpec;
import com.webaudit.core.model.PageRecord;
import com.webaudit.core.model.Severity;
import com.webaudit.core.model.XssFinding;
import com.webaudit.core.testsupport.FakeFetcher;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class XssTesterTest {

    private static String escape(String s) {
        return s.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;")
                .replace("\"", "&quot;").replace("'", "&#39;");
    }

    /** /echo: 그대로 반사, /shout: 대문자로 반사, /escaped: 엔티티 인코딩 반사, 나머지: 고정 본문 */
    private static final FakeFetcher SITE = new FakeFetcher(req -> {
        String path = req.getUri().getPath();
        String q = FakeFetcher.param(req, "q");
        String body = FakeFetcher.param(req, "body");
        switch (path) {
            case "/echo":
                return FakeFetcher.html(req, 200, "<html><p>Results for " + q + "</p></html>");
            case "/shout":
                return FakeFetcher.html(req, 200, "<html><p>RESULTS FOR " + q.toUpperCase(Locale.ROOT) + "</p></html>");
            case "/escaped":
                return FakeFetcher.html(req, 200, "<html><p>Results for " + escape(q) + "</p></html>");
            case "/comment":
                return FakeFetcher.html(req, 201, "<div class='c'>" + body + "</div>");
            default:
                return FakeFetcher.html(req, 200, "<html><p>static</p></html>");
        }
    });

    @Test
    void detect_distinguishes_verbatim_normalized_and_absent() {
        XssTester.Marker m = XssTester.Marker.of("wa0123456789");

        XssTester.Reflection raw = XssTester.detect("<p>" + m.raw() + "</p>", m);
        assertTrue(raw.verbatim());
        assertTrue(raw.reflected());

        XssTester.Reflection upper = XssTester.detect("<p>\"'>< WA0123456789 ></p>", m);
        assertFalse(upper.verbatim());
        assertTrue(upper.normalized());
        assertTrue(upper.reflected());

        assertFalse(XssTester.detect("<p>nothing</p>", m).reflected());
        assertFalse(XssTester.detect(null, m).reflected());
    }

    @Test
    @DisplayName("엔티티 이스케이프되어 토큰만 남은 반사는 반사로 보지 않는다")
    void escaped_reflection_is_not_reflected() {
        XssTester.Marker m = XssTester.Marker.of("wa0123456789");

        XssTester.Reflection encoded = XssTester.detect("<p>&quot;&#39;&gt;&lt;wa0123456789&gt;</p>", m);
        assertFalse(encoded.verbatim());
        assertFalse(encoded.normalized());
        assertFalse(encoded.reflected());

        assertFalse(XssTester.detect("<input value=\"wa0123456789\">", m).reflected());
        assertFalse(XssTester.detect("<p>WA0123456789</p>", m).reflected());
    }

    @Test
    void fresh_markers_are_unique_and_shaped() {
        XssTester.Marker a = XssTester.Marker.fresh();
        XssTester.Marker b = XssTester.Marker.fresh();
        assertNotEquals(a.token(), b.token());
        assertThat(a.token()).matches("wa[0-9a-f]{10}");
        assertThat(a.raw()).startsWith("\"'><").endsWith(">").contains(a.token());
    }

    @Test
    @DisplayName("반사 방식에 따라 심각도 구분, 반사 없으면 finding 없음")
    void query_parameters_are_classified() throws Exception {
        List<PageRecord> pages = List.of(
                new PageRecord("http://site.test/echo?q=hello", 200, List.of()),
                new PageRecord("http://site.test/shout?q=hello", 200, List.of()),
                new PageRecord("http://site.test/escaped?q=hello", 200, List.of()),
                new PageRecord("http://site.test/static?q=hello", 200, List.of()));

        List<XssFinding> out = new XssTester(SITE, 3).test(pages);

        assertEquals(2, out.size());
        assertThat(out).noneMatch(f -> f.url().contains("/escaped"));
        XssFinding echo = byUrl(out, "http://site.test/echo?q=hello");
        assertTrue(echo.verbatim());
        assertEquals(Severity.HIGH, echo.severity());
        assertEquals("q", echo.param());
        assertEquals("GET", echo.method());
        assertThat(echo.snippet()).contains(echo.marker());

        XssFinding shout = byUrl(out, "http://site.test/shout?q=hello");
        assertFalse(shout.verbatim());
        assertTrue(shout.reflected());
        assertEquals(Severity.LOW, shout.severity());
        assertThat(shout.snippet()).contains("WA");
    }

    @Test
    void post_form_inputs_are_tested_individually() throws Exception {
        Map<String, String> inputs = new LinkedHashMap<>();
        inputs.put("body", "");
        inputs.put("name", "anon");
        FormSpec form = new FormSpec("http://site.test/comment", "post", null, inputs);
        List<PageRecord> pages = List.of(new PageRecord("http://site.test/", 200, List.of(form)));

        List<XssFinding> out = new XssTester(SITE, 2).test(pages);

        assertEquals(1, out.size());
        XssFinding f = out.get(0);
        assertEquals("body", f.param());
        assertEquals("POST", f.method());
        assertEquals(201, f.status());
        assertEquals("http://site.test/comment", f.url());
    }

    @Test
    void pages_without_parameters_produce_nothing() throws Exception {
        FakeFetcher fetcher = new FakeFetcher(req -> FakeFetcher.html(req, 200, "x"));
        List<XssFinding> out = new XssTester(fetcher, 2)
                .test(List.of(new PageRecord("http://site.test/plain", 200, List.of())));
        assertTrue(out.isEmpty());
        assertTrue(fetcher.requests().isEmpty());
    }

    private static XssFinding byUrl(List<XssFinding> out, String url) {
        return out.stream().filter(f -> f.url().equals(url)).findFirst()
                .orElseThrow(() -> new AssertionError("no finding for " + url));
    }
}
