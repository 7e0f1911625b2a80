package com.webaudit.core.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.TreeSet;

/** URL 정규화 + same-host 판정 + 페이지 중복 키 */
public final class UrlUtils {
    private UrlUtils(){}

    /**
     * 정규화 규칙:
     * - fragment 제거(#... 제거)
     * - scheme/host 소문자
     * - 기본 포트 제거(http:80, https:443)
     * - 빈/누락 경로를 "/"로, 중복 슬래시 축소
     * - path/query 의 percent-encoding 은 그대로 유지
     */
    public static URI normalize(URI u) {
        if (u == null) return null;

        String scheme = (u.getScheme() == null ? "http" : u.getScheme()).toLowerCase(Locale.ROOT);
        String host = u.getHost();
        if (host == null) return null; // mailto:, 상대경로 등은 대상 아님
        host = host.toLowerCase(Locale.ROOT);

        int port = u.getPort();
        if ((scheme.equals("http") && port == 80) || (scheme.equals("https") && port == 443)) {
            port = -1;
        }

        String path = (u.getRawPath() == null || u.getRawPath().isEmpty()) ? "/" : u.getRawPath();
        path = path.replaceAll("/{2,}", "/");

        // raw 성분으로 조립: %26, %2B 같은 인코딩이 풀리면 다른 URL 이 된다
        StringBuilder sb = new StringBuilder();
        sb.append(scheme).append("://");
        if (u.getRawUserInfo() != null) sb.append(u.getRawUserInfo()).append('@');
        sb.append(host);
        if (port != -1) sb.append(':').append(port);
        sb.append(path);
        if (u.getRawQuery() != null) sb.append('?').append(u.getRawQuery());
        try {
            return new URI(sb.toString());
        } catch (URISyntaxException e) {
            return u;
        }
    }

    /** 문자열 버전. 파싱 실패/비 http(s)는 null. */
    public static URI normalize(String raw) {
        if (raw == null || raw.isBlank()) return null;
        try {
            URI u = URI.create(raw.trim());
            if (!isHttp(u)) return null;
            return normalize(u);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    public static boolean isHttp(URI u) {
        if (u == null || u.getScheme() == null) return false;
        String s = u.getScheme().toLowerCase(Locale.ROOT);
        return s.equals("http") || s.equals("https");
    }

    /** host 기준 동일 판정(소문자 비교, 포트 무시) */
    public static boolean sameHost(URI a, URI b) {
        if (a == null || b == null) return false;
        String ha = a.getHost() == null ? "" : a.getHost().toLowerCase(Locale.ROOT);
        String hb = b.getHost() == null ? "" : b.getHost().toLowerCase(Locale.ROOT);
        return !ha.isEmpty() && ha.equals(hb);
    }

    /**
     * 페이지 중복 키: scheme://host[:port]/path?k1&k2 (쿼리 키만, 정렬).
     * /x?id=1 과 /x?id=2 는 같은 키.
     */
    public static String dedupeKey(URI u) {
        URI n = normalize(u);
        if (n == null) return String.valueOf(u);
        StringBuilder sb = new StringBuilder();
        sb.append(n.getScheme()).append("://").append(n.getHost());
        if (n.getPort() != -1) sb.append(':').append(n.getPort());
        sb.append(n.getPath());
        TreeSet<String> keys = new TreeSet<>(UrlParamUtil.parseQueryMulti(n).keySet());
        if (!keys.isEmpty()) sb.append('?').append(String.join("&", keys));
        return sb.toString();
    }
}
