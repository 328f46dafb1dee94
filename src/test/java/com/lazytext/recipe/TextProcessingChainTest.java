package com.lazytext.recipe;

import com.lazytext.config.CorpusConfig;
import com.lazytext.stream.BoundedLines;
import com.lazytext.stream.LengthBounder;
import com.lazytext.stream.LineStreams;
import com.lazytext.stream.SentenceResegmenter;
import com.lazytext.text.BlankNormalizer;
import com.lazytext.text.Pipeline;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * 处理链端到端测试：分句、预处理、长度约束与还原。
 */
class TextProcessingChainTest {

    @Test
    @DisplayName("切分模式：下游逐片处理后按账本拼回原始行")
    void testSplitAndJoin() {
        TextProcessingChain chain = new TextProcessingChain(null, Pipeline.of(new BlankNormalizer()),
            new LengthBounder(3, true));

        BoundedLines bounded = chain.preprocess(List.of("a b c d e f g", "x  y").iterator());
        Iterator<String> processed = LineStreams.map(bounded, part -> part.toUpperCase(Locale.ROOT));

        assertEquals(List.of("A B C D E F G", "X Y"), drain(chain.postprocess(bounded, processed)));
        assertEquals(2, bounded.ledger().size());
        assertEquals(3, bounded.ledger().get(0));
    }

    @Test
    @DisplayName("max_length=3 丢弃模式只保留不超长的行")
    void testDropMode() {
        TextProcessingChain chain = new TextProcessingChain(null, Pipeline.of(), new LengthBounder(3, false));

        BoundedLines bounded = chain.preprocess(List.of("a b", "a b c d", "c", "d e f").iterator());

        assertEquals(List.of("a b", "c", "d e f"), drain(bounded));
    }

    @Test
    @DisplayName("不限制长度时原样透传，空行也保留")
    void testDisabledRoundTrip() {
        TextProcessingChain chain = new TextProcessingChain(null, Pipeline.of(), new LengthBounder(-1, true));
        List<String> raw = List.of("keep  this", "", "as is");

        assertEquals(raw, drain(chain.roundTrip(raw.iterator())));
    }

    @Test
    @DisplayName("字符级配方经切分后可还原，并恢复行首大写")
    void testCharLevelRoundTrip() {
        CorpusConfig config = CorpusConfig.defaults();
        config.setMaxLength(4);
        config.setSplit(true);
        TextProcessingChain chain = MonolingualRecipe.charLevel("en", true, false, "@@", true).chain(null, config);

        BoundedLines bounded = chain.preprocess(List.of("hello world").iterator());
        List<String> parts = new ArrayList<>();
        bounded.forEachRemaining(parts::add);

        assertEquals(List.of("h e l l", "o @@ w o", "r l d"), parts);
        assertEquals(List.of("Hello world"), drain(chain.postprocess(bounded, parts.iterator())));
    }

    @Test
    @DisplayName("先分句再预处理，分句结果参与长度约束")
    void testWithSentenceSegmentation() {
        SentenceResegmenter resegmenter = new SentenceResegmenter(
            lines -> lines.stream().flatMap(line -> Arrays.stream(line.split("(?<=\\.)\\s+"))).toList(), 1);
        TextProcessingChain chain = new TextProcessingChain(resegmenter, Pipeline.of(new BlankNormalizer()),
            new LengthBounder(2, false));

        List<String> output = drain(chain.preprocess(List.of("Go now. It is very late.", "", "Stop.").iterator()));

        assertEquals(List.of("Go now.", "Stop."), output);
    }

    private static List<String> drain(Iterator<String> iterator) {
        List<String> lines = new ArrayList<>();
        iterator.forEachRemaining(lines::add);
        return lines;
    }
}
