package com.webaudit.core.util;

import java.util.Locale;

/** 리포트 evidence 문자열 유틸 */
public final class Evidence {
    private Evidence() {}

    /**
     * token 주변 radius 글자. token 이 없으면(대소문자 무시 재탐색 후) 본문 앞부분.
     * 개행은 공백으로 치환.
     */
    public static String snippetAround(String body, String token, int radius) {
        if (body == null || body.isEmpty()) return "";
        int r = (radius <= 0) ? 80 : radius;
        int i = (token == null || token.isEmpty()) ? -1 : body.indexOf(token);
        if (i < 0 && token != null && !token.isEmpty()) {
            i = body.toLowerCase(Locale.ROOT).indexOf(token.toLowerCase(Locale.ROOT));
        }
        if (i < 0) return oneLine(body.substring(0, Math.min(body.length(), r * 2)));
        int from = Math.max(0, i - r);
        int to = Math.min(body.length(), i + token.length() + r);
        return oneLine(body.substring(from, to));
    }

    public static String elide(String s, int max) {
        if (s == null) return "";
        return s.length() <= max ? s : s.substring(0, max) + "…";
    }

    private static String oneLine(String s) {
        return s.replace('\r', ' ').replace('\n', ' ');
    }
}
