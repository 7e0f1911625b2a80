package com.webaudit.core.service.export;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class ReportNamingTest {

    private static final Instant T = Instant.parse("2024-03-05T07:08:09Z");

    @Test
    void path_is_grouped_by_host_with_utc_timestamp() {
        Path p = ReportNaming.jsonPath(Path.of("out"), "https://Shop.Example.com/a?b=1",
                "3F2A9C1E-77b0-4d2e-9a51-0c6f1d2e3b4a", T);

        assertEquals(Path.of("out", "reports", "shop.example.com",
                "report_shop.example.com-a-b-1_3f2a9c1e_20240305T070809Z.json"), p);
    }

    @Test
    @DisplayName("같은 대상, 같은 초의 두 잡은 다른 파일")
    void jobs_finishing_in_same_second_get_distinct_files() {
        Instant a = Instant.parse("2026-01-01T00:00:00.100Z");
        Instant b = Instant.parse("2026-01-01T00:00:00.900Z");

        Path pa = ReportNaming.jsonPath(Path.of("out"), "http://h/", "aaaa1111-0000-0000-0000-000000000000", a);
        Path pb = ReportNaming.jsonPath(Path.of("out"), "http://h/", "bbbb2222-0000-0000-0000-000000000000", b);

        assertNotEquals(pa, pb);
        assertEquals(pa.getParent(), pb.getParent());
    }

    @Test
    void short_id_is_sanitized() {
        assertEquals("abc", ReportNaming.shortId("a/b..c"));
        assertEquals("noid", ReportNaming.shortId(null));
        assertEquals("noid", ReportNaming.shortId("--"));
    }

    @Test
    void slug_keeps_port_and_trims_dashes() {
        assertEquals("127.0.0.1-8080", ReportNaming.slug("http://127.0.0.1:8080/"));
        assertEquals("no-url", ReportNaming.slug(" "));
        assertThat(ReportNaming.slug("http://site.test/" + "a".repeat(100))).hasSizeLessThanOrEqualTo(60);
    }

    @Test
    void unparsable_target_goes_to_unknown_host() {
        assertEquals("unknown-host", ReportNaming.host("not a url"));
        assertEquals("unknown-host", ReportNaming.host(null));
        assertEquals(Path.of("out", "reports", "unknown-host"), ReportNaming.reportsDir(null, "::"));
    }
}
