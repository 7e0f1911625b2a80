package com.webaudit.core.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class ReportTest {

    private static SqlmapRun run(String... messages) {
        List<SqlmapFinding> fs = new ArrayList<>();
        for (String m : messages) fs.add(SqlmapFinding.raw(m, false));
        return new SqlmapRun(SqlmapRun.Status.COMPLETED, 0, Instant.now(), Instant.now(), List.of("-u", "x"), false, fs);
    }

    @Test
    void base_groups_are_write_once() {
        Report r = new Report();
        r.setPorts(PortTable.error("h", "unknown host: h"));
        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> r.setPorts(PortTable.error("h", "again")));
        assertThat(ex.getMessage()).contains("ports");

        r.setXss(List.of());
        assertThrows(IllegalStateException.class, () -> r.setXss(List.of()));
    }

    @Test
    void base_complete_needs_all_five_groups() {
        Report r = new Report();
        assertFalse(r.isBaseComplete());
        r.setPorts(new PortTable("h", new TreeMap<>(Map.of(80, true)), null));
        r.setCrawl(CrawlResult.empty());
        r.setHeaders(HeaderReport.error("http://h/", "timed out"));
        r.setXss(List.of());
        assertFalse(r.isBaseComplete());
        r.setSqli(List.of());
        assertTrue(r.isBaseComplete());
    }

    @Test
    void sqlmap_runs_append_in_order() {
        Report r = new Report();
        r.appendSqlmapRun(run("a", "b"));
        r.appendSqlmapRun(run("c"));

        assertEquals(2, r.getSqlmapRuns().size());
        assertThat(r.getSqlmapFindings()).extracting(SqlmapFinding::message).containsExactly("a", "b", "c");
    }

    @Test
    void all_findings_flatten_groups() {
        Report r = new Report();
        r.setPorts(new PortTable("h", new TreeMap<>(Map.of(22, true, 80, false)), null));
        r.setHeaders(HeaderReport.error("http://h/", "x"));
        r.setXss(List.of(new XssFinding("http://h/?q=1", "q", "GET", "m", true, true, 200, "s")));
        r.appendSqlmapRun(run("line"));

        assertThat(r.allFindings()).extracting(Finding::kind)
                .containsExactly(FindingKind.PORT, FindingKind.XSS, FindingKind.SQLMAP);
        assertTrue(r.getSqli().isEmpty());
    }
}
