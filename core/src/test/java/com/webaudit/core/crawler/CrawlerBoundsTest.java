package com.webaudit.core.crawler;

import com.webaudit.core.model.CrawlResult;
import com.webaudit.core.testsupport.FakeFetcher;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class CrawlerBoundsTest {

    /** 모든 페이지가 /p0 ~ /p39 로 링크하는 사이트 */
    private static String fanOut() {
        StringBuilder sb = new StringBuilder("<html>");
        for (int i = 0; i < 40; i++) sb.append("<a href='/p").append(i).append("'>p</a>");
        return sb.append("</html>").toString();
    }

    @Test
    @DisplayName("방문 수는 maxPages 를 넘지 않는다")
    void visits_never_exceed_max_pages() throws Exception {
        String html = fanOut();
        FakeFetcher fetcher = new FakeFetcher(req -> FakeFetcher.html(req, 200, html));

        CrawlResult r = new Crawler(fetcher).crawl(URI.create("http://site.test/"), 5, 3);

        assertEquals(5, fetcher.requests().size());
        assertEquals(5, r.pages().size());
        assertThat(r.urls()).hasSize(41);
    }

    @Test
    @DisplayName("동시 fetch 수는 concurrency 이하")
    void in_flight_fetches_bounded_by_concurrency() throws Exception {
        final int cc = 3;
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        String html = fanOut();
        FakeFetcher fetcher = new FakeFetcher(req -> {
            int now = inFlight.incrementAndGet();
            peak.accumulateAndGet(now, Math::max);
            try {
                Thread.sleep(40);
                return FakeFetcher.html(req, 200, html);
            } finally {
                inFlight.decrementAndGet();
            }
        });

        CrawlResult r = new Crawler(fetcher).crawl(URI.create("http://site.test/"), 20, cc);

        assertEquals(20, r.pages().size());
        assertThat(peak.get()).isBetween(1, cc);
    }

    @Test
    @DisplayName("maxPages=1 이면 시드만")
    void single_page_budget_visits_seed_only() throws Exception {
        FakeFetcher fetcher = new FakeFetcher(req -> FakeFetcher.html(req, 200, fanOut()));

        CrawlResult r = new Crawler(fetcher).crawl(URI.create("http://site.test/"), 1, 5);

        assertEquals(1, r.pages().size());
        assertEquals("http://site.test/", r.pages().get(0).url());
    }

    @Test
    @DisplayName("accumulator 는 크롤 중에도 스냅샷 가능")
    void accumulator_holds_partial_progress() throws Exception {
        CrawlAccumulator acc = new CrawlAccumulator();
        FakeFetcher fetcher = new FakeFetcher(req -> FakeFetcher.html(req, 200, "<a href='/next'>n</a>"));

        new Crawler(fetcher).crawl(URI.create("http://site.test/"), 2, 1, acc);

        assertEquals(2, acc.pageCount());
        assertThat(acc.snapshot().urls()).containsExactly("http://site.test/", "http://site.test/next");
    }
}
