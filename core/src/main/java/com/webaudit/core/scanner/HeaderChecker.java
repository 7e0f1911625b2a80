package com.webaudit.core.scanner;

import com.webaudit.core.api.IFetcher;
import com.webaudit.core.http.FetchException;
import com.webaudit.core.model.FetchRequest;
import com.webaudit.core.model.FetchResponse;
import com.webaudit.core.model.HeaderFinding;
import com.webaudit.core.model.HeaderReport;
import com.webaudit.core.model.Severity;
import com.webaudit.core.util.Evidence;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/** 대표 응답 1개의 보안 헤더 점검 */
public final class HeaderChecker {

    public static final List<String> REQUIRED = List.of(
            "Content-Security-Policy",
            "Strict-Transport-Security",
            "X-Content-Type-Options",
            "X-Frame-Options",
            "Referrer-Policy"
    );

    static final Set<String> WEAK_CSP_SOURCES = Set.of("*", "'unsafe-inline'", "'unsafe-eval'");

    private final IFetcher fetcher;

    public HeaderChecker(IFetcher fetcher) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
    }

    /** fetch 실패 시 error 하나만 담긴 리포트 */
    public HeaderReport check(URI url) throws InterruptedException {
        FetchResponse resp;
        try {
            resp = fetcher.fetch(FetchRequest.get(url));
        } catch (FetchException e) {
            return HeaderReport.error(url.toString(), e.getMessage());
        }
        return evaluate(url, resp.getHeaders());
    }

    /** 헤더 맵만으로 판정(네트워크 없음) */
    public static HeaderReport evaluate(URI url, Map<String, List<String>> headers) {
        Map<String, String> present = new LinkedHashMap<>();
        Map<String, String> lower = new LinkedHashMap<>();
        for (var e : headers.entrySet()) {
            String name = e.getKey();
            if (name == null || name.startsWith(":")) continue; // HTTP/2 pseudo header
            String value = (e.getValue() == null) ? "" : String.join(", ", e.getValue());
            present.put(name, value);
            lower.put(name.toLowerCase(Locale.ROOT), value);
        }

        boolean https = "https".equalsIgnoreCase(url.getScheme());
        List<String> missing = new ArrayList<>();
        List<HeaderFinding> findings = new ArrayList<>();
        for (String h : REQUIRED) {
            String v = lower.get(h.toLowerCase(Locale.ROOT));
            if (v == null) {
                missing.add(h);
                findings.add(new HeaderFinding(url.toString(), h, HeaderFinding.Gap.MISSING,
                        HeaderFinding.severityForMissing(h, https), h + ": (absent)"));
            }
        }

        String csp = lower.get("content-security-policy");
        if (csp != null && isWeakCsp(csp)) {
            findings.add(new HeaderFinding(url.toString(), "Content-Security-Policy", HeaderFinding.Gap.WEAK,
                    Severity.MEDIUM, "Content-Security-Policy: " + Evidence.elide(csp, 180)));
        }
        return new HeaderReport(url.toString(), present, missing, findings, null);
    }

    /** 어느 directive 든 source 에 *, 'unsafe-inline', 'unsafe-eval' 이 있으면 약한 정책 */
    static boolean isWeakCsp(String csp) {
        for (String directive : csp.toLowerCase(Locale.ROOT).split(";")) {
            String[] tokens = directive.trim().split("\\s+");
            for (int i = 1; i < tokens.length; i++) {   // tokens[0] 은 directive 이름
                if (WEAK_CSP_SOURCES.contains(tokens[i])) return true;
            }
        }
        return false;
    }
}
