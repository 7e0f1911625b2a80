package com.webaudit.core.model;

/**
 * 반사형 XSS 테스트 결과(파라미터 단위).
 * verbatim=true 면 마커가 이스케이프 없이 그대로 돌아온 경우.
 */
public record XssFinding(
        String url,
        String param,
        String method,
        String marker,
        boolean reflected,
        boolean verbatim,
        int status,
        String snippet
) implements Finding {

    @Override public FindingKind kind() { return FindingKind.XSS; }

    @Override public String location() { return url; }

    @Override public Severity severity() {
        if (!reflected) return Severity.INFO;
        return verbatim ? Severity.HIGH : Severity.LOW;
    }

    @Override public String evidence() {
        return method + " " + param + "=" + marker + (snippet == null ? "" : " | " + snippet);
    }

    @Override public boolean actionable() { return reflected; }
}
