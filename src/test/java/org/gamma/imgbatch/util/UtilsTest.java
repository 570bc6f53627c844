package org.gamma.imgbatch.util;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class UtilsTest {

    @Test
    void testEscapeField() {
        assertEquals("", Utils.escapeField(null, ','));
        assertEquals("plain", Utils.escapeField("plain", ','));
        assertEquals("\"a,b\"", Utils.escapeField("a,b", ','));
        assertEquals("a,b", Utils.escapeField("a,b", '\t'));
        assertEquals("\"say \"\"hi\"\"\"", Utils.escapeField("say \"hi\"", ','));
        assertEquals("\"two\nlines\"", Utils.escapeField("two\nlines", ','));
    }

    @Test
    void testSplitDelimitedLine_honoursQuotes() {
        assertEquals(List.of("a", "b,c", "d \"q\""), Utils.splitDelimitedLine("a,\"b,c\",\"d \"\"q\"\"\"", ','));
        assertEquals(List.of("a", "", "c"), Utils.splitDelimitedLine("a\t\tc", '\t'));
    }

    @Test
    void testBaseName() {
        assertEquals("img", Utils.baseName("img.png"));
        assertEquals("img.tar", Utils.baseName("img.tar.png"));
        assertEquals("noext", Utils.baseName("noext"));
        assertEquals(".hidden", Utils.baseName(".hidden"));
    }

    @Test
    void testFormatName() {
        assertEquals("png", Utils.formatName(".png"));
        assertEquals("jpeg", Utils.formatName(".JPG"));
        assertEquals("tiff", Utils.formatName("tif"));
    }
}
