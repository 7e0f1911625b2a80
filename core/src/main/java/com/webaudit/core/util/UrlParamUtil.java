package com.webaudit.core.util;

import java.net.URI;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * URL 쿼리 / form 파라미터 유틸
 * - withParamOverrideFirst: 주어진 키의 기존 값들을 제거하고 key=value를 쿼리 선두로 배치(주입용).
 * - withoutQuery: 쿼리 제거(form action 기준 URL).
 * - parseQuery: 단일값 맵(마지막 값을 채택). parseQueryMulti: 다값 맵.
 * - formEncode: application/x-www-form-urlencoded 본문 생성.
 */
public final class UrlParamUtil {
    private UrlParamUtil() {}

    /**
     * 1) 해당 key의 기존 항목을 모두 제거(대소문자 무시)하고
     * 2) enc(key)=enc(value) 쌍을 쿼리의 "선두"에 배치.
     * 서버가 "첫 번째 값"만 읽는 케이스를 커버한다.
     */
    public static URI withParamOverrideFirst(URI base, String key, String value) {
        Objects.requireNonNull(base, "base");
        if (key == null || key.isBlank()) throw new IllegalArgumentException("key must not be blank");
        String raw = base.getRawQuery();

        List<String> preserved = new ArrayList<>();
        if (raw != null && !raw.isBlank()) {
            for (String part : raw.split("&")) {
                if (part.isBlank()) continue;
                int eq = part.indexOf('=');
                String kDec = dec(eq >= 0 ? part.substring(0, eq) : part);
                if (!kDec.equalsIgnoreCase(key)) {
                    preserved.add(part); // 원본 형식 그대로 보존
                }
            }
        }

        StringBuilder q = new StringBuilder();
        q.append(enc(key)).append('=').append(enc(value == null ? "" : value));
        for (String part : preserved) {
            q.append('&').append(part);
        }
        return rebuild(base, q.toString());
    }

    /** 쿼리/프래그먼트 제거 */
    public static URI withoutQuery(URI base) {
        Objects.requireNonNull(base, "base");
        return rebuild(base, null);
    }

    /** 단일값 쿼리 파싱(마지막 값을 채택). 입력 순서 유지. */
    public static Map<String, String> parseQuery(URI url) {
        Map<String, String> single = new LinkedHashMap<>();
        for (var e : parseQueryMulti(url).entrySet()) {
            List<String> vals = e.getValue();
            single.put(e.getKey(), vals.isEmpty() ? "" : vals.get(vals.size() - 1));
        }
        return single;
    }

    /** 다값 쿼리 파싱. 입력 순서 유지. */
    public static Map<String, List<String>> parseQueryMulti(URI url) {
        Objects.requireNonNull(url, "url");
        Map<String, List<String>> m = new LinkedHashMap<>();
        String q = url.getRawQuery();
        if (q == null || q.isEmpty()) return m;

        for (String p : q.split("&")) {
            if (p.isEmpty()) continue;
            int i = p.indexOf('=');
            String k = (i < 0) ? dec(p) : dec(p.substring(0, i));
            String v = (i < 0) ? "" : dec(p.substring(i + 1));
            if (k.isEmpty()) continue;
            m.computeIfAbsent(k, __ -> new ArrayList<>()).add(v);
        }
        return m;
    }

    /** k1=v1&k2=v2 (순서 유지) */
    public static String formEncode(Map<String, String> params) {
        StringBuilder sb = new StringBuilder();
        for (var e : params.entrySet()) {
            if (e.getKey() == null) continue;
            if (sb.length() > 0) sb.append('&');
            sb.append(enc(e.getKey())).append('=').append(enc(e.getValue() == null ? "" : e.getValue()));
        }
        return sb.toString();
    }

    /** 기존 쿼리를 params 로 교체 */
    public static URI withQuery(URI base, Map<String, String> params) {
        Objects.requireNonNull(base, "base");
        String q = formEncode(params);
        return rebuild(base, q.isEmpty() ? null : q);
    }

    // ---------- helpers ----------
    private static String enc(String s) { return URLEncoder.encode(s, StandardCharsets.UTF_8); }

    private static String dec(String s) {
        try {
            return URLDecoder.decode(s, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return s; // 잘못된 % 시퀀스는 원문 유지
        }
    }

    /** rawQuery 를 그대로 붙여 재조립(재인코딩 방지). */
    private static URI rebuild(URI base, String rawQuery) {
        StringBuilder sb = new StringBuilder();
        sb.append(base.getScheme()).append("://").append(base.getRawAuthority());
        String path = base.getRawPath();
        sb.append((path == null || path.isEmpty()) ? "/" : path);
        if (rawQuery != null && !rawQuery.isEmpty()) sb.append('?').append(rawQuery);
        try {
            return URI.create(sb.toString());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Failed to rebuild URI", e);
        }
    }
}
