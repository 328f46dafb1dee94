package com.lazytext.stream;

import com.lazytext.config.Constants;
import com.lazytext.text.SentenceSegmenter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * 按批读取输入行并交给分句器重新切分，输出行数与输入行数无关。
 *
 * readN 控制单批行数；{@link Constants#UNBOUNDED} 表示将剩余输入整体读入内存后一次性切分。
 */
public class SentenceResegmenter {

    private static final Logger logger = LoggerFactory.getLogger(SentenceResegmenter.class);

    private final SentenceSegmenter segmenter;
    private final int readN;

    /**
     * 创建分句重组器。
     *
     * @param segmenter 分句能力
     * @param readN 每批行数，正整数或 -1
     */
    public SentenceResegmenter(SentenceSegmenter segmenter, int readN) {
        if (segmenter == null) {
            throw new IllegalArgumentException("分句器不能为空");
        }
        if (readN == 0 || readN < Constants.UNBOUNDED) {
            throw new IllegalArgumentException("readN 必须为 -1 或正整数: " + readN);
        }
        this.segmenter = segmenter;
        this.readN = readN;
        if (readN == Constants.UNBOUNDED) {
            logger.warn("readN=-1: 剩余输入将整体载入内存后分句，超大语料可能耗尽内存");
        }
    }

    public int readN() {
        return readN;
    }

    /**
     * 惰性地对输入行流分句。
     */
    public Iterator<String> apply(Iterator<String> lines) {
        return new LookaheadIterator<>() {
            private final ArrayDeque<String> sentences = new ArrayDeque<>();

            @Override
            protected String computeNext() {
                while (sentences.isEmpty()) {
                    if (!lines.hasNext()) {
                        return endOfData();
                    }
                    sentences.addAll(segmentBatch(readBatch(lines)));
                }
                return sentences.removeFirst();
            }
        };
    }

    private List<String> readBatch(Iterator<String> lines) {
        List<String> batch = new ArrayList<>(readN > 0 ? readN : 16);
        while (lines.hasNext() && (readN == Constants.UNBOUNDED || batch.size() < readN)) {
            batch.add(lines.next());
        }
        return batch;
    }

    private List<String> segmentBatch(List<String> batch) {
        List<String> nonBlank = new ArrayList<>(batch.size());
        for (String line : batch) {
            if (!line.isBlank()) {
                nonBlank.add(line);
            }
        }
        if (nonBlank.isEmpty()) {
            return List.of();
        }
        return segmenter.segment(nonBlank);
    }
}
