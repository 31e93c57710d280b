package com.gigpulse.core.util;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HtmlUtilsTest {
    @Test
    void linkExtractionSkipsUnsafeSchemesAndFragments() {
        String html = """
                <html><body>
                  <a href="/e/jazz-night-123456789012">rel</a>
                  <a class='card' href='https://www.eventbrite.com/e/expo-998877665544?aff=x'>abs</a>
                  <a href="mailto:test@example.com">mail</a>
                  <a href="javascript:void(0)">js</a>
                  <a href="#top">top</a>
                </body></html>
                """;

        assertEquals(
                List.of("/e/jazz-night-123456789012", "https://www.eventbrite.com/e/expo-998877665544?aff=x"),
                HtmlUtils.extractLinks(html)
        );
    }

    @Test
    void jsonLdBlocksAndTimeTagsAreFound() {
        String html = """
                <head>
                <script type="application/ld+json">{"@type":"Event","startDate":"2026-03-06T19:00:00-08:00"}</script>
                <script type="text/javascript">var x = 1;</script>
                </head>
                <body><time class="start" datetime="2026-03-06">Fri</time></body>
                """;

        List<String> blocks = HtmlUtils.extractJsonLdBlocks(html);
        assertEquals(1, blocks.size());
        assertTrue(blocks.get(0).contains("startDate"));
        assertEquals("2026-03-06", HtmlUtils.extractFirstTimeDatetime(html).orElseThrow());
        assertTrue(HtmlUtils.extractFirstTimeDatetime("<p>no time</p>").isEmpty());
    }

    @Test
    void dollarAmountsRespectDecimalPrecision() {
        String html = "<td>$4.859</td><td>$ 5.129</td><td>$2.20</td><td>$12.345</td>";

        assertEquals(List.of(4.859, 5.129, 12.345), HtmlUtils.extractDollarAmounts(html, 3));
        assertEquals(List.of(2.20), HtmlUtils.extractDollarAmounts(html, 2));
    }
}
