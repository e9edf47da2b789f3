package io.lighting.quill.view;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

import org.junit.jupiter.api.Test;

class HtmlEscaperTest {

    @Test
    void escapesMarkupCharacters() {
        assertEquals("&lt;a href=&quot;&#x2F;x&quot;&gt;Tom &amp; Jerry&#x27;s&lt;&#x2F;a&gt;",
            HtmlEscaper.escape("<a href=\"/x\">Tom & Jerry's</a>"));
    }

    @Test
    void attributeEscapingKeepsSlashes() {
        assertEquals("/a?b=1&amp;c=&quot;2&quot;", HtmlEscaper.escapeAttribute("/a?b=1&c=\"2\""));
    }

    @Test
    void returnsCleanInputUnchanged() {
        String clean = "plain text";
        assertSame(clean, HtmlEscaper.escape(clean));
        assertEquals("", HtmlEscaper.escape(null));
    }
}
