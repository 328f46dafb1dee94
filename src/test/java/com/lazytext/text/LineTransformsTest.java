package com.lazytext.text;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class LineTransformsTest {

    @Test
    @DisplayName("BlankNormalizer: 折叠连续空白")
    void testBlankNormalizer() {
        BlankNormalizer normalizer = new BlankNormalizer();

        assertEquals("a b c ", normalizer.pre("a \t b\n\nc  "));
        assertEquals("a  b", normalizer.post("a  b"));
        assertEquals("a b c", normalizer.pre("a\u00A0\u00A0b\u3000c"));
    }

    @Test
    @DisplayName("CharLevelSegmenter: 不换行空格视为词边界")
    void testCharLevelSegmenterUnicodeBlanks() {
        assertEquals("a b @@ c", new CharLevelSegmenter("@@").pre("\u00A0ab\u00A0c\u00A0"));
    }

    @Test
    @DisplayName("Lowercaser: 按语言小写化")
    void testLowercaser() {
        assertEquals("hello world", new Lowercaser("en").pre("Hello WORLD"));
        assertEquals("ıi", new Lowercaser("tr").pre("Iİ"));
        assertEquals("Hello", new Lowercaser(null).post("Hello"));
    }

    @ParameterizedTest
    @CsvSource({
        "'this is a string', 't h i s @@ i s @@ a @@ s t r i n g'",
        "'  padded   words ', 'p a d d e d @@ w o r d s'",
        "'x', 'x'"
    })
    @DisplayName("CharLevelSegmenter: 字符切分")
    void testCharLevelSegmenterPre(String input, String expected) {
        assertEquals(expected, new CharLevelSegmenter("@@").pre(input));
    }

    @Test
    @DisplayName("CharLevelSegmenter: post 还原词级文本")
    void testCharLevelSegmenterRoundTrip() {
        CharLevelSegmenter segmenter = new CharLevelSegmenter(" @@ ");

        assertEquals("@@", segmenter.separator());
        assertEquals("this is a string", segmenter.post("t h i s @@ i s @@ a @@ s t r i n g"));
        assertEquals("naïve café", segmenter.post(segmenter.pre("naïve café")));
    }

    @Test
    void testCharLevelSegmenterRejectsBlankSeparator() {
        assertThrows(IllegalArgumentException.class, () -> new CharLevelSegmenter(" "));
    }

    @ParameterizedTest
    @CsvSource({
        "'un@@ believ@@ able', 'unbelievable'",
        "'the cat@@ s sat', 'the cats sat'",
        "'plain text', 'plain text'",
        "'trailing@@', 'trailing'"
    })
    @DisplayName("SubwordDesegmenter: 去除续接标记")
    void testSubwordDesegmenter(String input, String expected) {
        SubwordDesegmenter desegmenter = new SubwordDesegmenter("@@");

        assertEquals(expected, desegmenter.post(input));
        assertEquals(input, desegmenter.pre(input));
    }

    @ParameterizedTest
    @CsvSource({
        "'hello world', 'Hello world'",
        "'\" quoted', '\" Quoted'",
        "'Already', 'Already'",
        "'123', '123'"
    })
    @DisplayName("Recaser: 行首字母大写")
    void testRecaser(String input, String expected) {
        assertEquals(expected, new Recaser().post(input));
    }
}
