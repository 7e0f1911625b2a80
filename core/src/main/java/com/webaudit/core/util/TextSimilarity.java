package com.webaudit.core.util;

import java.util.HashMap;
import java.util.Map;

/**
 * 두 응답 본문의 유사도(0.0 ~ 1.0).
 * score = 길이 비율 × 토큰 멀티셋 Dice 계수. 둘 다 비어 있으면 1.0.
 */
public final class TextSimilarity {
    private TextSimilarity() {}

    public static double score(String a, String b) {
        String na = HtmlNormalizer.normalize(a);
        String nb = HtmlNormalizer.normalize(b);
        if (na.isEmpty() && nb.isEmpty()) return 1.0;
        if (na.isEmpty() || nb.isEmpty()) return 0.0;
        if (na.equals(nb)) return 1.0;

        double lengthRatio = (double) Math.min(na.length(), nb.length()) / Math.max(na.length(), nb.length());
        return clamp01(lengthRatio * dice(tokens(na), tokens(nb)));
    }

    static Map<String, Integer> tokens(String s) {
        Map<String, Integer> m = new HashMap<>();
        for (String t : s.split("[^\\p{L}\\p{N}<>_-]+")) {
            if (t.isEmpty()) continue;
            m.merge(t, 1, Integer::sum);
        }
        return m;
    }

    static double dice(Map<String, Integer> a, Map<String, Integer> b) {
        int sizeA = a.values().stream().mapToInt(Integer::intValue).sum();
        int sizeB = b.values().stream().mapToInt(Integer::intValue).sum();
        if (sizeA + sizeB == 0) return 1.0;
        int common = 0;
        for (var e : a.entrySet()) {
            Integer other = b.get(e.getKey());
            if (other != null) common += Math.min(e.getValue(), other);
        }
        return (2.0 * common) / (sizeA + sizeB);
    }

    private static double clamp01(double v) { return Math.max(0.0, Math.min(1.0, v)); }
}
