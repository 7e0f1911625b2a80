package com.webaudit.core.util;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 응답 비교 전 정규화.
 * 매 요청마다 바뀌는 값(타임스탬프, 긴 숫자, nonce, 긴 id)을 마스킹해서 유사도 오탐을 줄인다.
 */
public final class HtmlNormalizer {
    private HtmlNormalizer() {}

    private static final Pattern SCRIPT_STYLE =
            Pattern.compile("(?is)<(script|style)\\b[^>]*>.*?</\\1\\s*>");
    private static final Pattern ISO_TS =
            Pattern.compile("\\d{4}-\\d{2}-\\d{2}[t ]\\d{2}:\\d{2}:\\d{2}(?:\\.\\d+)?(?:z|[+-]\\d{2}:?\\d{2})?");
    private static final Pattern LONG_DIGITS = Pattern.compile("\\d{6,}");
    private static final Pattern NONCE = Pattern.compile("nonce=\"[^\"]*\"");
    private static final Pattern LONG_ID = Pattern.compile("id=\"[^\"]{8,}\"");
    private static final Pattern WS = Pattern.compile("\\s+");

    /** script/style 제거 + 동적 토큰 마스킹 + 공백 축약 + 소문자 */
    public static String normalize(String html) {
        if (html == null || html.isEmpty()) return "";
        String s = SCRIPT_STYLE.matcher(html).replaceAll(" ");
        s = s.toLowerCase(Locale.ROOT);
        s = ISO_TS.matcher(s).replaceAll("<ts>");
        s = LONG_DIGITS.matcher(s).replaceAll("<num>");
        s = NONCE.matcher(s).replaceAll("nonce=\"\"");
        s = LONG_ID.matcher(s).replaceAll("id=\"\"");
        return WS.matcher(s).replaceAll(" ").trim();
    }

    /** 반사 판정용: 공백 전부 제거 + 소문자 (마커/본문 양쪽에 동일 적용) */
    public static String squash(String s) {
        if (s == null || s.isEmpty()) return "";
        return WS.matcher(s).replaceAll("").toLowerCase(Locale.ROOT);
    }
}
