package com.webaudit.core.model;

import com.webaudit.core.api.ScanArgumentException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * sqlmap 실행 인자(검증 완료 상태만 존재).
 * 커맨드라인에는 여기서 만든 값만 올라가며, 사용자 문자열을 그대로 넘기지 않는다.
 */
public final class SqlmapArgs {

    public static final int MIN_LEVEL = 1, MAX_LEVEL = 5;
    public static final int MIN_RISK = 1, MAX_RISK = 3;
    public static final int MIN_THREADS = 1, MAX_THREADS = 10;

    /** 항상 붙는 비대화형/랜덤 UA 플래그 */
    public static final List<String> FIXED_FLAGS =
            List.of("--batch", "--random-agent", "--smart", "--flush-session");

    static final int MAX_OPTIONS = 20;
    static final int MAX_OPTION_LENGTH = 120;

    private static final Pattern TAMPER_NAME = Pattern.compile("[a-z0-9_]+");

    /** sqlmap 기본 배포본의 tamper 스크립트 중 허용 목록 */
    static final Set<String> KNOWN_TAMPERS = Set.of(
            "apostrophemask", "apostrophenullencode", "appendnullbyte", "base64encode", "between",
            "bluecoat", "chardoubleencode", "charencode", "charunicodeencode", "equaltolike",
            "greatest", "halfversionedmorekeywords", "ifnull2ifisnull", "lowercase",
            "modsecurityversioned", "modsecurityzeroversioned", "multiplespaces", "percentage",
            "randomcase", "randomcomments", "space2comment", "space2dash", "space2hash",
            "space2morehash", "space2mssqlblank", "space2mssqlhash", "space2mysqlblank",
            "space2mysqldash", "space2plus", "space2randomblank", "sp_password",
            "unionalltounion", "unmagicquotes", "uppercase", "versionedkeywords",
            "versionedmorekeywords"
    );

    private final int level;
    private final int risk;
    private final int threads;
    private final List<String> tamper;

    private SqlmapArgs(int level, int risk, int threads, List<String> tamper) {
        this.level = level;
        this.risk = risk;
        this.threads = threads;
        this.tamper = List.copyOf(tamper);
    }

    public static SqlmapArgs defaults() {
        return new SqlmapArgs(3, 2, 5, List.of());
    }

    /** null 인 항목은 기본값. 범위를 벗어나면 ScanArgumentException. */
    public static SqlmapArgs of(Integer level, Integer risk, Integer threads, String tamper) {
        SqlmapArgs d = defaults();
        int lv = (level == null) ? d.level : level;
        int rk = (risk == null) ? d.risk : risk;
        int th = (threads == null) ? d.threads : threads;
        checkRange("level", lv, MIN_LEVEL, MAX_LEVEL);
        checkRange("risk", rk, MIN_RISK, MAX_RISK);
        checkRange("threads", th, MIN_THREADS, MAX_THREADS);
        return new SqlmapArgs(lv, rk, th, parseTamper(tamper));
    }

    /**
     * 대시보드 클라이언트가 보내는 문자열 배열 형태("--level=3" 등)를 해석.
     * 허용 목록 밖의 옵션이 하나라도 있으면 전체를 거부한다.
     */
    public static SqlmapArgs fromOptions(List<String> options) {
        if (options == null || options.isEmpty()) return defaults();
        if (options.size() > MAX_OPTIONS) {
            throw new ScanArgumentException("too many sqlmap options (max " + MAX_OPTIONS + ")");
        }
        Integer level = null, risk = null, threads = null;
        String tamper = null;
        for (String raw : options) {
            if (raw == null) continue;
            String opt = raw.trim();
            if (opt.isEmpty()) continue;
            if (opt.length() > MAX_OPTION_LENGTH) {
                throw new ScanArgumentException("sqlmap option too long");
            }
            if (FIXED_FLAGS.contains(opt)) continue; // 어차피 항상 붙음

            int eq = opt.indexOf('=');
            String key = (eq < 0 ? opt : opt.substring(0, eq)).toLowerCase(Locale.ROOT);
            String val = (eq < 0 ? null : opt.substring(eq + 1).trim());
            if (val == null || val.isEmpty()) {
                throw new ScanArgumentException("unsupported sqlmap option: " + opt);
            }
            switch (key) {
                case "--level" -> level = parseInt("level", val);
                case "--risk" -> risk = parseInt("risk", val);
                case "--threads" -> threads = parseInt("threads", val);
                case "--tamper" -> tamper = val;
                default -> throw new ScanArgumentException("unsupported sqlmap option: " + key);
            }
        }
        return of(level, risk, threads, tamper);
    }

    /** FIXED_FLAGS + --level/--risk/--threads(+--tamper) */
    public List<String> toCommandArgs() {
        List<String> out = new ArrayList<>(FIXED_FLAGS);
        out.add("--level=" + level);
        out.add("--risk=" + risk);
        out.add("--threads=" + threads);
        if (!tamper.isEmpty()) out.add("--tamper=" + String.join(",", tamper));
        return out;
    }

    public int getLevel() { return level; }
    public int getRisk() { return risk; }
    public int getThreads() { return threads; }
    public List<String> getTamper() { return tamper; }

    // ---------- helpers ----------
    private static void checkRange(String name, int v, int min, int max) {
        if (v < min || v > max) {
            throw new ScanArgumentException(name + " must be between " + min + " and " + max);
        }
    }

    private static int parseInt(String name, String v) {
        try {
            return Integer.parseInt(v);
        } catch (NumberFormatException e) {
            throw new ScanArgumentException(name + " must be an integer", e);
        }
    }

    private static List<String> parseTamper(String tamper) {
        if (tamper == null || tamper.isBlank()) return List.of();
        List<String> out = new ArrayList<>();
        for (String t : Arrays.asList(tamper.split(","))) {
            String name = t.trim().toLowerCase(Locale.ROOT);
            if (name.isEmpty()) continue;
            if (!TAMPER_NAME.matcher(name).matches() || !KNOWN_TAMPERS.contains(name)) {
                throw new ScanArgumentException("unknown tamper script: " + t.trim());
            }
            if (!out.contains(name)) out.add(name);
        }
        return out;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SqlmapArgs a)) return false;
        return level == a.level && risk == a.risk && threads == a.threads && tamper.equals(a.tamper);
    }

    @Override public int hashCode() { return Objects.hash(level, risk, threads, tamper); }

    @Override public String toString() {
        return "SqlmapArgs{level=" + level + ", risk=" + risk + ", threads=" + threads + ", tamper=" + tamper + "}";
    }
}
