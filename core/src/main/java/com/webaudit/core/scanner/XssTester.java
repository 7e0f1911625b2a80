package com.webaudit.core.scanner;

import com.webaudit.core.api.IFetcher;
import com.webaudit.core.api.IParamTester;
import com.webaudit.core.model.FetchResponse;
import com.webaudit.core.model.PageRecord;
import com.webaudit.core.model.XssFinding;
import com.webaudit.core.util.Evidence;
import com.webaudit.core.util.HtmlNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Consumer;

/**
 * 반사형 XSS 테스터.
 * - 지점마다 새 마커("'&gt;&lt;wa + hex10&gt;")를 넣고 응답 본문에서 찾는다
 * - verbatim: 원문 마커 그대로 / normalized: 공백 제거+소문자 본문에 같은 처리를 한 원문 마커 존재
 * - 엔티티 이스케이프된 반사(토큰만 남음)는 반사로 보지 않는다
 * - 반사된 경우에만 finding (verbatim=HIGH, 대소문자/공백만 바뀐 반사=LOW)
 */
public final class XssTester implements IParamTester<XssFinding> {

    private static final Logger LOG = LoggerFactory.getLogger(XssTester.class);
    private static final int SNIPPET_RADIUS = 80;

    /** 주입 마커. token 은 영숫자 부분, raw 는 실제로 보내는 문자열. */
    public record Marker(String token, String raw) {
        public static Marker of(String token) {
            return new Marker(token, "\"'><" + token + ">");
        }

        public static Marker fresh() {
            long bits = ThreadLocalRandom.current().nextLong() & 0xFF_FFFF_FFFFL; // 40bit
            return of("wa" + String.format("%010x", bits));
        }
    }

    /** 반사 판정 결과 */
    public record Reflection(boolean verbatim, boolean normalized) {
        public boolean reflected() { return verbatim || normalized; }
    }

    private final IFetcher fetcher;
    private final ParamTestRunner runner;

    public XssTester(IFetcher fetcher, int concurrency) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.runner = new ParamTestRunner("xss", concurrency);
    }

    @Override
    public void test(List<PageRecord> pages, Consumer<? super XssFinding> sink) throws InterruptedException {
        List<InjectionPoint> points = InjectionPoints.collect(pages);
        LOG.debug("XSS test: {} injection points", points.size());
        runner.run(points, this::testPoint, sink);
    }

    Optional<XssFinding> testPoint(InjectionPoint point) throws Exception {
        Marker marker = Marker.fresh();
        FetchResponse resp = fetcher.fetch(point.request(marker.raw()));
        Reflection r = detect(resp.getBody(), marker);
        if (!r.reflected()) return Optional.empty();

        String snippetKey = r.verbatim() ? marker.raw() : marker.token();   // normalized 면 원문 위치를 토큰으로 찾는다
        return Optional.of(new XssFinding(point.location(), point.param(), point.method(), marker.raw(),
                true, r.verbatim(), resp.getStatusCode(),
                Evidence.snippetAround(resp.getBody(), snippetKey, SNIPPET_RADIUS)));
    }

    /** 네트워크 없이 본문만으로 판정 */
    public static Reflection detect(String body, Marker marker) {
        if (body == null || body.isEmpty()) return new Reflection(false, false);
        boolean verbatim = body.contains(marker.raw());
        boolean normalized = HtmlNormalizer.squash(body).contains(HtmlNormalizer.squash(marker.raw()));
        return new Reflection(verbatim, normalized);
    }
}
