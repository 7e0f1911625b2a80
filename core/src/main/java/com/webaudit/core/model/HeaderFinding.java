package com.webaudit.core.model;

import java.util.Locale;

/** 보안 헤더 누락/취약 설정 */
public record HeaderFinding(String url, String header, Gap gap, Severity severity, String evidence)
        implements Finding {

    public enum Gap { MISSING, WEAK }

    @Override public FindingKind kind() { return FindingKind.HEADER; }

    @Override public String location() { return url; }

    @Override public boolean actionable() { return severity.atLeast(Severity.LOW); }

    /** 누락 헤더별 기본 심각도. HSTS는 https일 때만 의미가 있다. */
    public static Severity severityForMissing(String header, boolean https) {
        String h = header.toLowerCase(Locale.ROOT);
        return switch (h) {
            case "content-security-policy" -> Severity.MEDIUM;
            case "strict-transport-security" -> https ? Severity.MEDIUM : Severity.INFO;
            case "x-frame-options", "x-content-type-options" -> Severity.LOW;
            default -> Severity.INFO;
        };
    }
}
