package com.lazytext.text;

import java.util.List;

/**
 * 分句能力：将一批文本行重新切分为句子，输出行数与输入无需一致。
 *
 * 实现可以拒绝空白输入，调用方负责在调用前过滤空行。
 */
@FunctionalInterface
public interface SentenceSegmenter {

    List<String> segment(List<String> lines);
}
