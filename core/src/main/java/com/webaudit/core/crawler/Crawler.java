package com.webaudit.core.crawler;

import com.webaudit.core.api.ICrawler;
import com.webaudit.core.api.IFetcher;
import com.webaudit.core.http.FetchException;
import com.webaudit.core.model.FetchRequest;
import com.webaudit.core.model.FetchResponse;
import com.webaudit.core.model.PageRecord;
import com.webaudit.core.util.NamedThreadFactory;
import com.webaudit.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * BFS 기반 Crawler
 * - 시작 URL 과 같은 host 만 방문(타 도메인 링크는 기록만)
 * - 방문(디스패치) 수가 maxPages 에 도달하거나 frontier 가 비면 종료
 * - fetch 는 최대 concurrency 개 동시, 링크/폼 추출은 fetch 끝난 워커에서
 * - frontier/seen 은 코디네이터 스레드(호출 스레드)만 만진다
 */
public class Crawler implements ICrawler {

    private static final Logger LOG = LoggerFactory.getLogger(Crawler.class);

    private final IFetcher fetcher;
    private final LinkExtractor extractor;

    public Crawler(IFetcher fetcher) {
        this(fetcher, new JsoupLinkExtractor());
    }

    public Crawler(IFetcher fetcher, LinkExtractor extractor) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
    }

    @Override
    public void crawl(URI start, int maxPages, int concurrency, CrawlAccumulator acc) throws InterruptedException {
        Objects.requireNonNull(acc, "acc");
        URI seed = UrlUtils.normalize(start);
        if (seed == null || !UrlUtils.isHttp(seed)) {
            throw new IllegalArgumentException("start URL must be absolute http(s): " + start);
        }
        final int limit = Math.max(1, maxPages);
        final int cc = Math.max(1, concurrency);

        Set<String> seen = new HashSet<>();
        Deque<URI> frontier = new ArrayDeque<>();
        seen.add(UrlUtils.dedupeKey(seed));
        frontier.addLast(seed);
        acc.discovered(seed);

        ExecutorService pool = Executors.newFixedThreadPool(cc, new NamedThreadFactory("crawl"));
        CompletionService<Visit> cs = new ExecutorCompletionService<>(pool);
        int dispatched = 0;
        int inFlight = 0;
        try {
            while (true) {
                while (inFlight < cc && dispatched < limit && !frontier.isEmpty()) {
                    URI next = frontier.pollFirst();
                    cs.submit(() -> visit(next));
                    dispatched++;
                    inFlight++;
                }
                if (inFlight == 0) break;

                Future<Visit> done = cs.take();
                inFlight--;
                Visit v;
                try {
                    v = done.get();
                } catch (ExecutionException e) {
                    Throwable cause = (e.getCause() != null ? e.getCause() : e);
                    if (cause instanceof InterruptedException ie) throw ie;
                    LOG.warn("Crawl task failed: {}", cause.toString());
                    continue;
                }

                if (v.error != null) {
                    acc.error(v.uri, v.error);
                    continue;
                }
                acc.page(v.page);

                for (URI raw : v.links) {
                    URI n = UrlUtils.normalize(raw);
                    if (n == null) continue;
                    acc.discovered(n);
                    if (!UrlUtils.sameHost(seed, n)) continue;     // 기록만, 방문 안 함
                    if (seen.add(UrlUtils.dedupeKey(n))) {
                        frontier.addLast(n);
                    }
                }
            }
        } finally {
            pool.shutdownNow();
        }
        LOG.info("Crawl done: seed={}, visited={}, pages={}, frontierLeft={}",
                seed, dispatched, acc.pageCount(), frontier.size());
    }

    /** 워커: fetch + 추출. 실패는 Visit.error 로 돌려주고 크롤은 계속된다. */
    private Visit visit(URI uri) throws InterruptedException {
        FetchResponse resp;
        try {
            resp = fetcher.fetch(FetchRequest.get(uri));
        } catch (FetchException e) {
            LOG.debug("Crawl fetch failed: {} ({})", uri, e.getMessage());
            return Visit.failed(uri, e.getMessage());
        }
        try {
            LinkExtractor.Extracted ex = resp.isHtmlLike()
                    ? extractor.extract(uri, resp.getBody())
                    : LinkExtractor.Extracted.empty();
            return new Visit(uri, new PageRecord(uri.toString(), resp.getStatusCode(), ex.forms()), ex.links(), null);
        } catch (RuntimeException e) {
            LOG.debug("Crawl parse failed: {} ({})", uri, e.toString());
            return Visit.failed(uri, "parse error: " + e.getMessage());
        }
    }

    private static final class Visit {
        final URI uri;
        final PageRecord page;
        final List<URI> links;
        final String error;

        Visit(URI uri, PageRecord page, List<URI> links, String error) {
            this.uri = uri; this.page = page; this.links = links; this.error = error;
        }

        static Visit failed(URI uri, String error) {
            return new Visit(uri, null, List.of(), error == null ? "unknown error" : error);
        }
    }
}
