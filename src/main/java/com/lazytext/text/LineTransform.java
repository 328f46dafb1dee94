package com.lazytext.text;

import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * 可逆的单行文本变换。
 *
 * pre 用于预处理（如分词、小写化、子词切分），post 用于后处理，通常是 pre 的逆操作。
 * 实现出错时直接抛出异常，调用方不做重试。
 */
public interface LineTransform {

    /**
     * 预处理一行文本。
     */
    String pre(String line);

    /**
     * 后处理一行文本，默认原样返回。
     */
    default String post(String line) {
        return line;
    }

    /**
     * 由两个字符串函数组装变换。
     */
    static LineTransform of(UnaryOperator<String> pre, UnaryOperator<String> post) {
        Objects.requireNonNull(pre, "pre 不能为空");
        Objects.requireNonNull(post, "post 不能为空");
        return new LineTransform() {
            @Override
            public String pre(String line) {
                return pre.apply(line);
            }

            @Override
            public String post(String line) {
                return post.apply(line);
            }
        };
    }
}
