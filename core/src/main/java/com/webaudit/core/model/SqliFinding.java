package com.webaudit.core.model;

import java.util.Locale;

/** 차등 비교 기반 SQLi 의심 결과(파라미터 단위). */
public record SqliFinding(
        String url,
        String param,
        String method,
        String payload,
        double similarity,
        int status,
        int baselineStatus,
        boolean suspected,
        Reason reason
) implements Finding {

    public enum Reason { SIMILARITY, STATUS_SHIFT }

    @Override public FindingKind kind() { return FindingKind.SQLI; }

    @Override public String location() { return url; }

    @Override public Severity severity() {
        if (!suspected) return Severity.INFO;
        return reason == Reason.STATUS_SHIFT ? Severity.HIGH : Severity.MEDIUM;
    }

    @Override public String evidence() {
        return String.format(Locale.ROOT, "%s=%s similarity=%.3f status=%d (baseline %d)",
                param, payload, similarity, status, baselineStatus);
    }

    @Override public boolean actionable() { return suspected; }
}
