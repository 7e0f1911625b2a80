package com.webaudit.core.api;

import com.webaudit.core.crawler.CrawlAccumulator;
import com.webaudit.core.model.CrawlResult;

import java.net.URI;

public interface ICrawler {

    /** start 에서 BFS. maxPages/concurrency 는 이미 검증된 값. */
    default CrawlResult crawl(URI start, int maxPages, int concurrency) throws InterruptedException {
        CrawlAccumulator acc = new CrawlAccumulator();
        crawl(start, maxPages, concurrency, acc);
        return acc.snapshot();
    }

    /** 진행 중 결과를 acc 에 누적(타임아웃 시 호출자가 스냅샷 사용) */
    void crawl(URI start, int maxPages, int concurrency, CrawlAccumulator acc) throws InterruptedException;
}
