package com.lazytext.recipe;

import com.lazytext.stream.BoundedLines;
import com.lazytext.stream.LengthBounder;
import com.lazytext.stream.LineStreams;
import com.lazytext.stream.SentenceResegmenter;
import com.lazytext.text.LineTransform;

import java.util.Iterator;
import java.util.Objects;

/**
 * 完整的惰性处理链：
 * 原始行 → 分句（可选）→ pre → 长度约束，以及反向的 join → post。
 */
public class TextProcessingChain {

    private final SentenceResegmenter resegmenter;
    private final LineTransform transform;
    private final LengthBounder bounder;

    /**
     * @param resegmenter 分句重组器，null 表示不重新分句
     * @param transform 行变换（通常是 {@link com.lazytext.text.Pipeline}）
     * @param bounder 长度约束器
     */
    public TextProcessingChain(SentenceResegmenter resegmenter, LineTransform transform, LengthBounder bounder) {
        this.resegmenter = resegmenter;
        this.transform = Objects.requireNonNull(transform, "transform 不能为空");
        this.bounder = Objects.requireNonNull(bounder, "bounder 不能为空");
    }

    /**
     * 预处理原始行流，返回的流持有还原分片所需的账本。
     */
    public BoundedLines preprocess(Iterator<String> rawLines) {
        Iterator<String> lines = resegmenter == null ? rawLines : resegmenter.apply(rawLines);
        return bounder.pre(LineStreams.preprocess(lines, transform));
    }

    /**
     * 将经过下游处理的分片流还原为完整行并执行 post。
     *
     * @param bounded {@link #preprocess} 返回的流，提供分片账本
     * @param processedParts 与 bounded 输出一一对应的分片流
     */
    public Iterator<String> postprocess(BoundedLines bounded, Iterator<String> processedParts) {
        return LineStreams.postprocess(bounded.join(processedParts), transform);
    }

    /**
     * 预处理后立即还原，用于检查处理链是否可逆。
     */
    public Iterator<String> roundTrip(Iterator<String> rawLines) {
        BoundedLines bounded = preprocess(rawLines);
        return postprocess(bounded, bounded);
    }

    public LineTransform transform() {
        return transform;
    }

    public LengthBounder bounder() {
        return bounder;
    }
}
