package com.webaudit.core.scanner.sqlmap;

import com.webaudit.core.model.Severity;
import com.webaudit.core.model.SqlmapFinding;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * sqlmap stdout → SqlmapFinding 목록.
 * - "[HH:MM:SS] [LEVEL] msg" 라인은 레벨별 심각도
 * - "---" 로 둘러싸인 "Parameter:" 블록은 CRITICAL(injection point), 블록이 아닌 "---" 는 RAW
 * - 나머지 비어있지 않은 라인은 RAW/INFO 로 보존
 * (level, message) 중복 제거, 최대 MAX_FINDINGS 개.
 */
public final class SqlmapOutputParser {

    public static final int MAX_FINDINGS = 500;

    private static final Pattern LEVELED =
            Pattern.compile("^(?:\\[\\d{2}:\\d{2}:\\d{2}\\]\\s*)?\\[([A-Za-z]+)\\]\\s*(.*)$");
    private static final Pattern SENTENCE_END = Pattern.compile("[.!?](?:\\s|$)");

    public List<SqlmapFinding> parse(String output) {
        List<SqlmapFinding> out = new ArrayList<>();
        if (output == null || output.isBlank()) return out;

        Set<String> seen = new HashSet<>();
        String[] lines = output.split("\\r?\\n");
        for (int i = 0; i < lines.length && out.size() < MAX_FINDINGS; i++) {
            String line = lines[i];
            if (line.isBlank()) continue;

            if (line.trim().equals("---")) {
                int end = closingFence(lines, i + 1);
                if (end > 0 && startsWithParameter(lines, i + 1, end)) {
                    add(out, seen, injectionPoint(lines, i + 1, end));
                    i = end;
                    continue;
                }
                // 블록을 열지 않는 구분선은 RAW 로 남긴다
            }
            add(out, seen, parseLine(line));
        }
        return out;
    }

    /** 한 줄 해석(블록 밖) */
    SqlmapFinding parseLine(String line) {
        Matcher m = LEVELED.matcher(line.trim());
        if (!m.matches()) {
            String raw = line.strip();
            return SqlmapFinding.raw(raw, isActionable(raw));
        }
        String level = m.group(1).toUpperCase(Locale.ROOT);
        String full = m.group(2).trim();
        String message = firstSentence(full);
        return new SqlmapFinding(level, message, message.equals(full) ? null : full, line.strip(),
                severityOf(level), isActionable(full));
    }

    static Severity severityOf(String level) {
        switch (level) {
            case "CRITICAL": return Severity.CRITICAL;
            case "ERROR":    return Severity.HIGH;
            case "WARNING":  return Severity.MEDIUM;
            default:         return Severity.INFO;
        }
    }

    static boolean isActionable(String text) {
        String lc = text.toLowerCase(Locale.ROOT);
        return lc.contains("is vulnerable")
                || (lc.contains("appears to be") && lc.contains("injectable"))
                || lc.contains("identified the following injection point");
    }

    // ---------- helpers ----------
    private static void add(List<SqlmapFinding> out, Set<String> seen, SqlmapFinding f) {
        if (out.size() >= MAX_FINDINGS) return;
        if (seen.add(f.level() + "\u0000" + f.message())) out.add(f);
    }

    private static int closingFence(String[] lines, int from) {
        for (int j = from; j < lines.length; j++) {
            if (lines[j].trim().equals("---")) return j;
        }
        return -1;
    }

    private static boolean startsWithParameter(String[] lines, int from, int end) {
        for (int j = from; j < end; j++) {
            if (lines[j].isBlank()) continue;
            return lines[j].trim().startsWith("Parameter:");
        }
        return false;
    }

    private static SqlmapFinding injectionPoint(String[] lines, int from, int end) {
        StringBuilder detail = new StringBuilder();
        String head = null;
        for (int j = from; j < end; j++) {
            if (lines[j].isBlank()) continue;
            if (head == null) head = lines[j].trim();
            if (detail.length() > 0) detail.append('\n');
            detail.append(lines[j].stripTrailing());
        }
        return new SqlmapFinding("VULN", head, detail.toString(), head, Severity.CRITICAL, true);
    }

    private static String firstSentence(String s) {
        Matcher m = SENTENCE_END.matcher(s);
        return m.find() ? s.substring(0, m.start() + 1) : s;
    }
}
