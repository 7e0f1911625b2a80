package com.webaudit.core.model;

/**
 * sqlmap 출력 한 줄(또는 injection point 블록) 단위 결과.
 * level 은 sqlmap 원래 태그(INFO/WARNING/CRITICAL…) 또는 RAW/VULN/ERROR.
 */
public record SqlmapFinding(
        String level,
        String message,
        String detail,
        String line,
        Severity severity,
        boolean actionable
) implements Finding {

    @Override public FindingKind kind() { return FindingKind.SQLMAP; }

    @Override public String location() { return "sqlmap"; }

    @Override public String evidence() { return line != null ? line : (detail != null ? detail : message); }

    /** 파싱 불가 라인은 버리지 않고 INFO로 보존 */
    public static SqlmapFinding raw(String line, boolean actionable) {
        return new SqlmapFinding("RAW", line, null, line, Severity.INFO, actionable);
    }

    public static SqlmapFinding failure(String level, String message, Severity severity) {
        return new SqlmapFinding(level, message, null, null, severity, false);
    }
}
