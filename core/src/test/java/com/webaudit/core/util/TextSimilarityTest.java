package com.webaudit.core.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class TextSimilarityTest {

    private static final String LIST_PAGE =
            "<html><body><h1>Products</h1><ul><li>apple pie</li><li>banana bread</li><li>cherry tart</li></ul></body></html>";

    @Test
    void identical_and_empty_bodies() {
        assertEquals(1.0, TextSimilarity.score(LIST_PAGE, LIST_PAGE));
        assertEquals(1.0, TextSimilarity.score("", null));
        assertEquals(0.0, TextSimilarity.score(LIST_PAGE, ""));
    }

    @Test
    void dynamic_tokens_do_not_lower_similarity() {
        String a = "<p>generated 2024-01-01T10:00:00Z req 1234567</p><script>var t=1;</script>";
        String b = "<p>generated 2025-02-02T11:11:11Z req 7654321</p><script>var t=2;</script>";
        assertEquals(1.0, TextSimilarity.score(a, b));
    }

    @Test
    void different_pages_score_low_and_symmetric() {
        String empty = "<html><body><p>No results found</p></body></html>";
        double s = TextSimilarity.score(LIST_PAGE, empty);
        assertThat(s).isLessThan(0.5);
        assertEquals(s, TextSimilarity.score(empty, LIST_PAGE));
    }

    @Test
    void small_change_stays_high() {
        String b = LIST_PAGE.replace("cherry tart", "cherry cake");
        assertThat(TextSimilarity.score(LIST_PAGE, b)).isBetween(0.7, 1.0);
    }

    @Test
    void normalizer_strips_scripts_and_masks() {
        assertEquals("<p>hi <num></p>",
                HtmlNormalizer.normalize("<P>Hi   <script>alert(1)</script>\n 99999999</P>"));
        assertEquals("'><wa1>", HtmlNormalizer.squash("' >\n<WA1 >"));
    }
}
