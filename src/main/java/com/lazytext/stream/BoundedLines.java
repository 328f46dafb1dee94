package com.lazytext.stream;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * {@link LengthBounder#pre} 的输出流，持有本次切分的分片账本。
 *
 * 账本在消费本流的过程中逐步增长；{@link #join} 只能用于还原由本流产出的行，
 * 且只能调用一次。
 */
public final class BoundedLines extends LookaheadIterator<String> {

    private final LengthBounder bounder;
    private final Iterator<String> source;
    private final PartLedger ledger = new PartLedger();
    private final ArrayDeque<String> pendingParts = new ArrayDeque<>();
    private boolean joined;

    BoundedLines(LengthBounder bounder, Iterator<String> source) {
        this.bounder = bounder;
        this.source = source;
    }

    public PartLedger ledger() {
        return ledger;
    }

    @Override
    protected String computeNext() {
        if (!pendingParts.isEmpty()) {
            return pendingParts.removeFirst();
        }
        if (bounder.isDisabled()) {
            return source.hasNext() ? source.next() : endOfData();
        }
        while (source.hasNext()) {
            String line = LineStreams.trimBlank(source.next());
            List<String> tokens = LineStreams.whitespaceTokens(line);
            if (tokens.size() <= bounder.maxLength()) {
                // 先记账再输出
                ledger.append(1);
                return line;
            }
            if (bounder.isSplit()) {
                List<List<String>> parts = LengthBounder.partition(tokens, bounder.maxLength());
                ledger.append(parts.size());
                for (List<String> part : parts) {
                    pendingParts.addLast(String.join(" ", part));
                }
                return pendingParts.removeFirst();
            }
        }
        return endOfData();
    }

    /**
     * 将分片流按账本重新拼接为原始行。
     *
     * 分片必须按输出顺序到达；透传与丢弃模式下原样返回输入流。
     *
     * @param parts 分片流，通常是本流（或其下游变换）的输出
     * @throws IllegalStateException 重复调用时抛出
     */
    public Iterator<String> join(Iterator<String> parts) {
        if (parts == null) {
            throw new IllegalArgumentException("分片流不能为空");
        }
        if (joined) {
            throw new IllegalStateException("同一账本只能 join 一次");
        }
        joined = true;
        if (!bounder.joinsParts()) {
            return parts;
        }
        return new LookaheadIterator<>() {
            private final List<String> buffer = new ArrayList<>();

            @Override
            protected String computeNext() {
                while (parts.hasNext()) {
                    buffer.add(parts.next());
                    if (buffer.size() == ledger.current()) {
                        String original = String.join(" ", buffer);
                        buffer.clear();
                        ledger.advance();
                        return original;
                    }
                }
                if (!buffer.isEmpty()) {
                    throw new IllegalStateException("分片流提前结束: 第 " + ledger.consumed()
                        + " 行还缺少 " + (ledger.current() - buffer.size()) + " 个分片");
                }
                return endOfData();
            }
        };
    }
}
