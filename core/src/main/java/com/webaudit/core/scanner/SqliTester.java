package com.webaudit.core.scanner;

import com.webaudit.core.api.IFetcher;
import com.webaudit.core.api.IParamTester;
import com.webaudit.core.http.FetchException;
import com.webaudit.core.model.FetchResponse;
import com.webaudit.core.model.PageRecord;
import com.webaudit.core.model.SqliFinding;
import com.webaudit.core.util.TextSimilarity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * 차등 비교 SQLi 테스터.
 * 원래 값으로 baseline 을 받고, 페이로드를 원래 값 뒤에 붙여 응답을 비교한다.
 * 처음으로 걸린 페이로드 하나만 보고한다.
 */
public final class SqliTester implements IParamTester<SqliFinding> {

    private static final Logger LOG = LoggerFactory.getLogger(SqliTester.class);

    public static final List<String> PAYLOADS = List.of("' AND '1'='1", "' AND '1'='2", "'", "\"");

    private final IFetcher fetcher;
    private final ParamTestRunner runner;
    private final double threshold;

    public SqliTester(IFetcher fetcher, int concurrency, double threshold) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.runner = new ParamTestRunner("sqli", concurrency);
        this.threshold = threshold;
    }

    @Override
    public void test(List<PageRecord> pages, Consumer<? super SqliFinding> sink) throws InterruptedException {
        List<InjectionPoint> points = InjectionPoints.collect(pages);
        LOG.debug("SQLi test: {} injection points, threshold={}", points.size(), threshold);
        runner.run(points, this::testPoint, sink);
    }

    Optional<SqliFinding> testPoint(InjectionPoint point) throws Exception {
        String original = point.originalValue();
        // baseline 실패 시 예외 → 러너가 지점을 건너뜀
        FetchResponse baseline = fetcher.fetch(point.request(original));

        for (String payload : PAYLOADS) {
            FetchResponse resp;
            try {
                resp = fetcher.fetch(point.request(original + payload));
            } catch (FetchException e) {
                LOG.debug("SQLi payload request failed: {} {} ({})", point.location(), point.param(), e.getMessage());
                continue;
            }
            double sim = TextSimilarity.score(baseline.getBody(), resp.getBody());
            Optional<SqliFinding.Reason> reason =
                    judge(baseline.getStatusCode(), resp.getStatusCode(), sim, threshold);
            if (reason.isPresent()) {
                return Optional.of(new SqliFinding(point.location(), point.param(), point.method(), payload,
                        sim, resp.getStatusCode(), baseline.getStatusCode(), true, reason.get()));
            }
        }
        return Optional.empty();
    }

    /**
     * 의심 판정. 상태코드 급변(baseline &lt;400 → payload &gt;=400)을 먼저 보고,
     * 아니면 유사도가 threshold 미만인지 본다.
     */
    public static Optional<SqliFinding.Reason> judge(int baselineStatus, int payloadStatus,
                                                     double similarity, double threshold) {
        if (payloadStatus >= 400 && baselineStatus < 400) return Optional.of(SqliFinding.Reason.STATUS_SHIFT);
        if (similarity < threshold) return Optional.of(SqliFinding.Reason.SIMILARITY);
        return Optional.empty();
    }
}
