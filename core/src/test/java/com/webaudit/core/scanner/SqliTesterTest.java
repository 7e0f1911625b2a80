package com.webaudit.core.scanner;

import com.webaudit.core.http.NetworkException;
import com.webaudit.core.model.PageRecord;
import com.webaudit.core.model.Severity;
import com.webaudit.core.model.SqliFinding;
import com.webaudit.core.testsupport.FakeFetcher;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class SqliTesterTest {

    private static final String LIST_PAGE =
            "<html><body><h1>Category</h1><ul><li>red shirt</li><li>blue jeans</li><li>green hat</li></ul></body></html>";
    private static final String EMPTY_PAGE = "<html><body><p>No items</p></body></html>";

    private static List<PageRecord> page(String url) {
        return List.of(new PageRecord(url, 200, List.of()));
    }

    @Test
    void judge_status_shift_wins_over_similarity() {
        assertEquals(Optional.of(SqliFinding.Reason.STATUS_SHIFT), SqliTester.judge(200, 500, 0.1, 0.9));
        assertEquals(Optional.of(SqliFinding.Reason.SIMILARITY), SqliTester.judge(200, 200, 0.5, 0.9));
        assertEquals(Optional.empty(), SqliTester.judge(200, 200, 0.95, 0.9));
        // baseline 이 이미 에러면 상태 급변 아님
        assertEquals(Optional.empty(), SqliTester.judge(500, 500, 1.0, 0.9));
        assertEquals(Optional.empty(), SqliTester.judge(200, 302, 0.9, 0.9));
    }

    @Test
    void raising_threshold_never_clears_a_suspicion() {
        double[] sims = {0.0, 0.3, 0.6, 0.85, 0.9, 0.99, 1.0};
        double[] thresholds = {0.5, 0.8, 0.9, 0.95, 1.0};
        for (double sim : sims) {
            for (int i = 0; i < thresholds.length - 1; i++) {
                boolean low = SqliTester.judge(200, 200, sim, thresholds[i]).isPresent();
                boolean high = SqliTester.judge(200, 200, sim, thresholds[i + 1]).isPresent();
                assertTrue(!low || high, "sim=" + sim + " t=" + thresholds[i]);
            }
        }
    }

    @Test
    void error_status_on_quote_is_status_shift() throws Exception {
        FakeFetcher fetcher = new FakeFetcher(req -> {
            String id = FakeFetcher.param(req, "id");
            return id.contains("'") ? FakeFetcher.html(req, 500, "SQL syntax error") : FakeFetcher.html(req, 200, LIST_PAGE);
        });

        List<SqliFinding> out = new SqliTester(fetcher, 2, 0.9).test(page("http://site.test/item?id=1"));

        assertEquals(1, out.size());
        SqliFinding f = out.get(0);
        assertEquals(SqliFinding.Reason.STATUS_SHIFT, f.reason());
        assertEquals("' AND '1'='1", f.payload());
        assertEquals(500, f.status());
        assertEquals(200, f.baselineStatus());
        assertEquals(Severity.HIGH, f.severity());
        assertTrue(f.suspected());
    }

    @Test
    void false_condition_changing_body_is_similarity() throws Exception {
        FakeFetcher fetcher = new FakeFetcher(req -> {
            String cat = FakeFetcher.param(req, "cat");
            return FakeFetcher.html(req, 200, cat.contains("'1'='2") ? EMPTY_PAGE : LIST_PAGE);
        });

        List<SqliFinding> out = new SqliTester(fetcher, 1, 0.9).test(page("http://site.test/list?cat=2"));

        assertEquals(1, out.size());
        SqliFinding f = out.get(0);
        assertEquals(SqliFinding.Reason.SIMILARITY, f.reason());
        assertEquals("' AND '1'='2", f.payload());
        assertThat(f.similarity()).isLessThan(0.9);
        assertEquals(Severity.MEDIUM, f.severity());
        // baseline, 1=1, 1=2 까지만
        assertEquals(3, fetcher.requests().size());
    }

    @Test
    void stable_page_has_no_finding() throws Exception {
        FakeFetcher fetcher = new FakeFetcher(req -> FakeFetcher.html(req, 200, LIST_PAGE));

        List<SqliFinding> out = new SqliTester(fetcher, 1, 0.9).test(page("http://site.test/static?id=1"));

        assertTrue(out.isEmpty());
        assertEquals(1 + SqliTester.PAYLOADS.size(), fetcher.requests().size());
    }

    @Test
    void payloads_are_appended_to_original_value() throws Exception {
        FakeFetcher fetcher = new FakeFetcher(req -> FakeFetcher.html(req, 200, LIST_PAGE));

        new SqliTester(fetcher, 1, 0.9).test(page("http://site.test/p?id=7&sort=asc"));

        assertThat(fetcher.requests())
                .filteredOn(r -> "7' AND '1'='2".equals(FakeFetcher.param(r, "id")))
                .hasSize(1)
                .allSatisfy(r -> assertEquals("asc", FakeFetcher.param(r, "sort")));
    }

    @Test
    void baseline_failure_skips_point() throws Exception {
        FakeFetcher fetcher = new FakeFetcher(req -> {
            if ("1".equals(FakeFetcher.param(req, "id"))) {
                throw new NetworkException(req.getUri(), 2, new IOException("Connection reset"));
            }
            return FakeFetcher.html(req, 500, "boom");
        });

        List<SqliFinding> out = new SqliTester(fetcher, 1, 0.9).test(page("http://site.test/item?id=1"));

        assertTrue(out.isEmpty());
        assertEquals(1, fetcher.requests().size());
    }
}
