package com.lazytext.text;

import java.text.BreakIterator;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 基于 {@link BreakIterator} 的分句器。
 *
 * 每个输入行独立切分，句子不跨行拼接。
 */
public class BreakIteratorSentenceSegmenter implements SentenceSegmenter {

    private final Locale locale;

    public BreakIteratorSentenceSegmenter(String languageCode) {
        if (languageCode == null || languageCode.isBlank()) {
            throw new IllegalArgumentException("语言代码不能为空");
        }
        this.locale = Locale.forLanguageTag(languageCode);
    }

    @Override
    public List<String> segment(List<String> lines) {
        List<String> sentences = new ArrayList<>();
        BreakIterator sentenceIterator = BreakIterator.getSentenceInstance(locale);
        for (String line : lines) {
            if (line.isBlank()) {
                throw new IllegalArgumentException("分句器不接受空白行");
            }
            sentenceIterator.setText(line);
            int start = sentenceIterator.first();
            for (int end = sentenceIterator.next(); end != BreakIterator.DONE; start = end, end = sentenceIterator.next()) {
                String sentence = line.substring(start, end).strip();
                if (!sentence.isEmpty()) {
                    sentences.add(sentence);
                }
            }
        }
        return List.copyOf(sentences);
    }
}
