package com.sitemonitor.core.util;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HtmlUtilsTest {
    @Test
    void titleExtractionHandlesEdgeCases() {
        assertTrue(HtmlUtils.extractTitle("<html><body>No title</body></html>").isEmpty());
        assertEquals("UPPER", HtmlUtils.extractTitle("<html><head><TITLE>UPPER</TITLE></head></html>").orElseThrow());
        assertEquals(
                "Hello World",
                HtmlUtils.extractTitle("<html><head><title>\n  Hello   World \n</title></head></html>").orElseThrow()
        );
        assertTrue(HtmlUtils.extractTitle("<html><head><title>Broken").isEmpty());
    }

    @Test
    void linkExtractionSkipsUnsafeSchemes() {
        String html = """
                <html><body>
                  <a href="/foo">rel</a>
                  <a href="https://example.com/x">abs</a>
                  <a href="mailto:test@example.com">mail</a>
                  <a href="javascript:void(0)">js</a>
                </body></html>
                """;

        assertEquals(List.of("/foo", "https://example.com/x"), HtmlUtils.extractLinks(html));
    }

    @Test
    void visibleTextDropsMarkupScriptsAndStyles() {
        String html = "<html><head><style>p{color:red}</style><script>var v = 1;</script></head>"
                + "<body><p>Hello</p>\n\n<b>world</b></body></html>";

        assertEquals("Hello world", HtmlUtils.visibleText(html));
    }
}
