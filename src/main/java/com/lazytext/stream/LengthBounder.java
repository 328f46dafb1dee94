package com.lazytext.stream;

import com.lazytext.config.Constants;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * 按词数约束行长度。
 *
 * <ul>
 *   <li>maxLength 为 -1：不做处理，原样透传；</li>
 *   <li>split 为 false：丢弃超长行；</li>
 *   <li>split 为 true：将超长行按 maxLength 个词切成连续分片依次输出，
 *       并在 {@link PartLedger} 中记录分片数，供 {@link BoundedLines#join} 还原。</li>
 * </ul>
 */
public class LengthBounder {

    private final int maxLength;
    private final boolean split;

    /**
     * 创建长度约束器。
     *
     * @param maxLength 单行最大词数，-1 表示不限制
     * @param split 超长行是否切分（否则丢弃）
     * @throws IllegalArgumentException maxLength 为 0 或小于 -1 时抛出
     */
    public LengthBounder(int maxLength, boolean split) {
        if (maxLength == 0 || maxLength < Constants.UNBOUNDED) {
            throw new IllegalArgumentException("maxLength 必须为 -1（不限制）或正整数: " + maxLength);
        }
        this.maxLength = maxLength;
        this.split = split;
    }

    public int maxLength() {
        return maxLength;
    }

    public boolean isSplit() {
        return split;
    }

    public boolean isDisabled() {
        return maxLength == Constants.UNBOUNDED;
    }

    /**
     * join 是否需要账本还原；透传模式与丢弃模式下 join 为恒等映射。
     */
    boolean joinsParts() {
        return !isDisabled() && split;
    }

    /**
     * 惰性地对行流施加长度约束，每次调用都返回带独立账本的新流。
     */
    public BoundedLines pre(Iterator<String> lines) {
        if (lines == null) {
            throw new IllegalArgumentException("输入行流不能为空");
        }
        return new BoundedLines(this, lines);
    }

    /**
     * 将词列表切成每段至多 size 个词的连续分片，最后一段取余下部分。
     *
     * @param size 分片大小，-1 表示不切分
     */
    public static List<List<String>> partition(List<String> tokens, int size) {
        if (size == 0 || size < Constants.UNBOUNDED) {
            throw new IllegalArgumentException("分片大小必须为 -1 或正整数: " + size);
        }
        if (size == Constants.UNBOUNDED || tokens.size() <= size) {
            return List.of(tokens);
        }
        List<List<String>> parts = new ArrayList<>((tokens.size() + size - 1) / size);
        for (int start = 0; start < tokens.size(); start += size) {
            parts.add(tokens.subList(start, Math.min(start + size, tokens.size())));
        }
        return parts;
    }
}
