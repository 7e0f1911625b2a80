package com.webaudit.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 헤더 점검 결과. fetch 자체가 실패하면 error 하나만 담긴다(부분 맵 없음).
 */
public record HeaderReport(String url,
                           Map<String, String> present,
                           List<String> missing,
                           List<HeaderFinding> findings,
                           String error) {

    public HeaderReport {
        present = Collections.unmodifiableMap(new LinkedHashMap<>(present == null ? Map.of() : present));
        missing = (missing == null) ? List.of() : List.copyOf(missing);
        findings = (findings == null) ? List.of() : List.copyOf(findings);
    }

    public static HeaderReport error(String url, String message) {
        return new HeaderReport(url, Map.of(), List.of(), List.of(), message);
    }

    public boolean isError() { return error != null; }
}
