package com.lazytext.stream;

import com.lazytext.config.Constants;
import com.lazytext.text.LineTransform;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * 惰性行流的组合工具：变换、分词、按列抽取与多流对齐。
 *
 * 所有方法只包装迭代器，不提前消费上游。
 */
public final class LineStreams {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern EDGE_WHITESPACE = Pattern.compile("^\\s+|\\s+$", Pattern.UNICODE_CHARACTER_CLASS);

    private LineStreams() {
    }

    /**
     * 去除首尾的 Unicode 空白（含不换行空格）。
     */
    public static String trimBlank(String line) {
        return EDGE_WHITESPACE.matcher(line).replaceAll("");
    }

    /**
     * 按 Unicode 空白切分一行，首尾空白忽略，空行返回空列表。
     */
    public static List<String> whitespaceTokens(String line) {
        String stripped = trimBlank(line);
        if (stripped.isEmpty()) {
            return List.of();
        }
        return Arrays.asList(WHITESPACE.split(stripped));
    }

    public static <T, R> Iterator<R> map(Iterator<T> source, Function<? super T, ? extends R> mapper) {
        return new Iterator<>() {
            @Override
            public boolean hasNext() {
                return source.hasNext();
            }

            @Override
            public R next() {
                return mapper.apply(source.next());
            }
        };
    }

    /**
     * 对每一行执行 {@link LineTransform#pre}。
     */
    public static Iterator<String> preprocess(Iterator<String> lines, LineTransform transform) {
        return map(lines, transform::pre);
    }

    /**
     * 对每一行执行 {@link LineTransform#post}。
     */
    public static Iterator<String> postprocess(Iterator<String> lines, LineTransform transform) {
        return map(lines, transform::post);
    }

    /**
     * 将行流切分为词列表流，maxLength 为正时丢弃超长行。
     */
    public static Iterator<List<String>> tokenize(Iterator<String> lines, int maxLength) {
        return new LookaheadIterator<>() {
            @Override
            protected List<String> computeNext() {
                while (lines.hasNext()) {
                    List<String> tokens = whitespaceTokens(lines.next());
                    if (maxLength == Constants.UNBOUNDED || tokens.size() <= maxLength) {
                        return tokens;
                    }
                }
                return endOfData();
            }
        };
    }

    /**
     * 并行读取多个行流，逐行组成元组。
     *
     * 任一流耗尽即停止；maxLength 为正时，元组中任一句超长则整组丢弃以保持对齐。
     */
    public static Iterator<List<List<String>>> zipTokenized(List<? extends Iterator<String>> streams, int maxLength) {
        if (streams == null || streams.isEmpty()) {
            throw new IllegalArgumentException("至少需要一个输入流");
        }
        List<Iterator<String>> sources = List.copyOf(streams);
        return new LookaheadIterator<>() {
            @Override
            protected List<List<String>> computeNext() {
                while (allHaveNext()) {
                    List<List<String>> tuple = new ArrayList<>(sources.size());
                    int longest = 0;
                    for (Iterator<String> source : sources) {
                        List<String> tokens = whitespaceTokens(source.next());
                        longest = Math.max(longest, tokens.size());
                        tuple.add(tokens);
                    }
                    if (maxLength == Constants.UNBOUNDED || longest <= maxLength) {
                        return List.copyOf(tuple);
                    }
                }
                return endOfData();
            }

            private boolean allHaveNext() {
                for (Iterator<String> source : sources) {
                    if (!source.hasNext()) {
                        return false;
                    }
                }
                return true;
            }
        };
    }

    /**
     * 从元组流中抽取第 column 个分量。
     */
    public static <T> Iterator<T> column(Iterator<? extends List<T>> tuples, int column) {
        if (column < 0) {
            throw new IllegalArgumentException("列号不能为负: " + column);
        }
        return map(tuples, tuple -> tuple.get(column));
    }
}
