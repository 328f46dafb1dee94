package com.lazytext.text;

import java.util.regex.Pattern;

/**
 * 去除 BPE 风格的子词续接标记（如 "@@ "），预处理原样返回。
 *
 * 子词切分本身依赖外部训练的合并表，由调用方以 {@link LineTransform} 形式接入流水线。
 */
public class SubwordDesegmenter implements LineTransform {

    private final Pattern separatorPattern;

    /**
     * 创建子词还原器。
     *
     * @param separator 续接标记，首尾空白会被去除
     */
    public SubwordDesegmenter(String separator) {
        if (separator == null || separator.isBlank()) {
            throw new IllegalArgumentException("分隔符不能为空");
        }
        String quoted = Pattern.quote(separator.strip());
        this.separatorPattern = Pattern.compile(
            "(" + quoted + " )|(" + quoted + " ?$)|( " + quoted + ")|(^ ?" + quoted + ")");
    }

    @Override
    public String pre(String line) {
        return line;
    }

    @Override
    public String post(String line) {
        return separatorPattern.matcher(line).replaceAll("");
    }
}
