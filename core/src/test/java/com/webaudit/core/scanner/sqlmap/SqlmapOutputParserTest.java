package com.webaudit.core.scanner.sqlmap;

import com.webaudit.core.model.Severity;
import com.webaudit.core.model.SqlmapFinding;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class SqlmapOutputParserTest {

    private static final String SAMPLE = String.join("\n",
            "        ___",
            "[*] starting @ 10:00:00 /2024-05-01/",
            "",
            "[10:00:01] [INFO] testing connection to the target URL",
            "[10:00:02] [WARNING] GET parameter 'id' does not appear to be dynamic. Continuing anyway.",
            "[10:00:05] [INFO] GET parameter 'id' appears to be 'AND boolean-based blind' injectable",
            "sqlmap identified the following injection point(s) with a total of 42 HTTP(s) requests:",
            "---",
            "Parameter: id (GET)",
            "    Type: boolean-based blind",
            "    Payload: id=1 AND 1=1",
            "---",
            "[10:00:06] [CRITICAL] connection dropped or unknown HTTP status code received.",
            "[10:00:07] [INFO] testing connection to the target URL",
            "[10:00:08] [ERROR] user quit");

    private final SqlmapOutputParser parser = new SqlmapOutputParser();

    @Test
    void levels_map_to_severity() {
        List<SqlmapFinding> out = parser.parse(SAMPLE);

        SqlmapFinding warn = find(out, "WARNING");
        assertEquals(Severity.MEDIUM, warn.severity());
        assertEquals("GET parameter 'id' does not appear to be dynamic.", warn.message());
        assertEquals("GET parameter 'id' does not appear to be dynamic. Continuing anyway.", warn.detail());

        assertEquals(Severity.CRITICAL, find(out, "CRITICAL").severity());
        assertEquals(Severity.HIGH, find(out, "ERROR").severity());
        assertEquals(Severity.INFO, find(out, "INFO").severity());
    }

    @Test
    void injection_block_is_critical_and_actionable() {
        SqlmapFinding vuln = find(parser.parse(SAMPLE), "VULN");

        assertEquals("Parameter: id (GET)", vuln.message());
        assertEquals(Severity.CRITICAL, vuln.severity());
        assertTrue(vuln.actionable());
        assertThat(vuln.detail()).contains("Type: boolean-based blind").contains("Payload: id=1 AND 1=1");
    }

    @Test
    void raw_lines_are_kept_and_fences_dropped() {
        List<SqlmapFinding> out = parser.parse(SAMPLE);

        assertThat(out).extracting(SqlmapFinding::message)
                .contains("___", "[*] starting @ 10:00:00 /2024-05-01/")
                .doesNotContain("---", "");
        SqlmapFinding identified = out.stream()
                .filter(f -> f.message().startsWith("sqlmap identified")).findFirst().orElseThrow();
        assertEquals("RAW", identified.level());
        assertTrue(identified.actionable());
        assertTrue(find(out, "INFO", "appears to be").actionable());
    }

    @Test
    void duplicate_level_and_message_collapse() {
        List<SqlmapFinding> out = parser.parse(SAMPLE);
        assertEquals(1, out.stream()
                .filter(f -> f.message().equals("testing connection to the target URL")).count());
    }

    @Test
    void output_is_capped() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < SqlmapOutputParser.MAX_FINDINGS + 50; i++) {
            sb.append("[INFO] line ").append(i).append('\n');
        }
        assertEquals(SqlmapOutputParser.MAX_FINDINGS, parser.parse(sb.toString()).size());
    }

    @Test
    void empty_output_is_empty() {
        assertTrue(parser.parse(null).isEmpty());
        assertTrue(parser.parse("\n \n").isEmpty());
    }

    @Test
    void unterminated_fence_is_ignored() {
        List<SqlmapFinding> out = parser.parse("---\nParameter: q (POST)\n    Type: time-based blind");
        assertThat(out).extracting(SqlmapFinding::level).doesNotContain("VULN");
        assertThat(out).extracting(SqlmapFinding::message).contains("Parameter: q (POST)");
    }

    @Test
    @DisplayName("Parameter 블록을 열지 않는 구분선은 RAW 로 보존")
    void lone_fence_is_kept_as_raw() {
        List<SqlmapFinding> out = parser.parse("[INFO] a\n---\n[INFO] b\n---\nno parameter here\n");

        assertThat(out).extracting(SqlmapFinding::level).doesNotContain("VULN");
        SqlmapFinding fence = out.stream().filter(f -> f.message().equals("---")).findFirst().orElseThrow();
        assertEquals("RAW", fence.level());
        assertEquals(Severity.INFO, fence.severity());
        assertFalse(fence.actionable());
        assertThat(out).extracting(SqlmapFinding::message).contains("a", "b", "no parameter here");
    }

    private static SqlmapFinding find(List<SqlmapFinding> out, String level) {
        return out.stream().filter(f -> f.level().equals(level)).findFirst()
                .orElseThrow(() -> new AssertionError("no " + level));
    }

    private static SqlmapFinding find(List<SqlmapFinding> out, String level, String contains) {
        return out.stream().filter(f -> f.level().equals(level) && f.message().contains(contains)).findFirst()
                .orElseThrow(() -> new AssertionError("no " + level + " with " + contains));
    }
}
