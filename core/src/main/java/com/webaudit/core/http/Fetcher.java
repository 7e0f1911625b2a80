package com.webaudit.core.http;

import com.webaudit.core.api.IFetcher;
import com.webaudit.core.model.FetchRequest;
import com.webaudit.core.model.FetchResponse;
import com.webaudit.core.model.ScanConfig;
import com.webaudit.core.model.ScanStats;
import com.webaudit.core.util.DefaultSleeper;
import com.webaudit.core.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Objects;

/**
 * HttpClient 기반 Fetcher.
 * - 응답은 상태코드와 무관하게 그대로 반환(4xx/5xx 재시도 없음)
 * - 일시적 네트워크 오류만 RetryPolicy 에 따라 재시도
 * - 타임아웃은 즉시 FetchTimeoutException
 * - 본문은 maxBodyChars 를 넘는지 알 수 있는 만큼만 받고 잘라낸다
 */
public class Fetcher implements IFetcher {

    private static final Logger LOG = LoggerFactory.getLogger(Fetcher.class);

    /** 테스트/모킹용 송신 훅 */
    @FunctionalInterface
    public interface HttpSender {
        HttpResponse<String> send(HttpRequest req) throws IOException, InterruptedException;
    }

    private final ScanConfig config;
    private final HttpSender sender;
    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;
    private final ScanStats stats;

    public Fetcher(ScanConfig config) {
        this(config, clientSender(config), new DefaultRetryPolicy(config.getFetchMaxAttempts(), config.getFetchBackoffMs()),
                new DefaultSleeper(), new ScanStats());
    }

    public Fetcher(ScanConfig config, ScanStats stats) {
        this(config, clientSender(config), new DefaultRetryPolicy(config.getFetchMaxAttempts(), config.getFetchBackoffMs()),
                new DefaultSleeper(), stats);
    }

    /** 송신 훅/정책/슬리퍼 주입 */
    public Fetcher(ScanConfig config, HttpSender sender, RetryPolicy retryPolicy, Sleeper sleeper, ScanStats stats) {
        this.config = Objects.requireNonNull(config, "config");
        this.sender = Objects.requireNonNull(sender, "sender");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.stats = Objects.requireNonNull(stats, "stats");
    }

    private static HttpSender clientSender(ScanConfig config) {
        HttpClient client = HttpClient.newBuilder()
                .followRedirects(config.isFollowRedirects() ? HttpClient.Redirect.NORMAL : HttpClient.Redirect.NEVER)
                .connectTimeout(config.getTimeout())
                .build();
        HttpResponse.BodyHandler<String> body = LimitedBodySubscriber.handler(config.getMaxBodyChars());
        return req -> client.send(req, body);
    }

    @Override
    public FetchResponse fetch(FetchRequest request) throws FetchException, InterruptedException {
        Objects.requireNonNull(request, "request");
        Duration timeout = (request.getTimeout() != null) ? request.getTimeout() : config.getTimeout();
        HttpRequest httpReq = toHttpRequest(request, timeout);
        URI uri = request.getUri();

        stats.enter();
        long t0 = System.nanoTime();
        try {
            int attempt = 1;
            while (true) {
                stats.addAttempt();
                try {
                    HttpResponse<String> resp = sender.send(httpReq);
                    return toResponse(uri, resp, elapsedMs(t0));
                } catch (HttpTimeoutException te) {
                    stats.addFailure();
                    throw new FetchTimeoutException(uri, timeout, te);
                } catch (IOException ioe) {
                    if (!retryPolicy.shouldRetry(ioe, attempt)) {
                        stats.addFailure();
                        throw new NetworkException(uri, attempt, ioe);
                    }
                    Duration delay = retryPolicy.nextDelay(attempt);
                    LOG.debug("Transient failure on {} (attempt {}): {} -> retry in {}ms",
                            request.requestLine(), attempt, ioe.toString(), delay.toMillis());
                    stats.addRetry();
                    sleeper.sleep(delay);
                    attempt++;
                }
            }
        } finally {
            stats.exit(elapsedMs(t0));
        }
    }

    public ScanStats getStats() { return stats; }

    // ---------- helpers ----------
    private HttpRequest toHttpRequest(FetchRequest r, Duration timeout) {
        HttpRequest.Builder b = HttpRequest.newBuilder(r.getUri())
                .timeout(timeout)
                .header("User-Agent", config.getUserAgent())
                .header("Accept", "text/html,application/xhtml+xml,application/json;q=0.9,*/*;q=0.8");
        r.getHeaders().forEach(b::setHeader);
        HttpRequest.BodyPublisher body = (r.getBody() == null)
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofString(r.getBody());
        return b.method(r.getMethod(), body).build();
    }

    private FetchResponse toResponse(URI uri, HttpResponse<String> resp, long elapsedMs) {
        HttpHeaders hh = resp.headers();
        String body = resp.body() == null ? "" : resp.body();
        boolean truncated = body.length() > config.getMaxBodyChars();
        if (truncated) body = body.substring(0, config.getMaxBodyChars());
        return FetchResponse.builder()
                .url(uri)
                .statusCode(resp.statusCode())
                .headers(hh.map())
                .body(body)
                .contentType(hh.firstValue("Content-Type").orElse(null))
                .elapsedMs(elapsedMs)
                .truncated(truncated)
                .build();
    }

    private static long elapsedMs(long t0) {
        return (System.nanoTime() - t0) / 1_000_000;
    }
}
