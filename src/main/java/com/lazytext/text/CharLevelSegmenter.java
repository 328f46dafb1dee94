package com.lazytext.text;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * 字符级切分：将 "this is" 转换为 "t h i s @@ i s"，后处理还原为词级文本。
 *
 * 原文中恰好等于分隔符的字符不可逆，调用方需选择语料中不出现的分隔符。
 */
public class CharLevelSegmenter implements LineTransform {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private final String separator;

    /**
     * 创建字符级切分器。
     *
     * @param separator 词边界标记，首尾空白会被去除
     */
    public CharLevelSegmenter(String separator) {
        if (separator == null || separator.isBlank()) {
            throw new IllegalArgumentException("分隔符不能为空");
        }
        this.separator = separator.strip();
    }

    @Override
    public String pre(String line) {
        String[] words = WHITESPACE.split(line);
        List<String> segmentedWords = new ArrayList<>(words.length);
        for (String word : words) {
            if (word.isEmpty()) {
                continue;
            }
            List<String> characters = new ArrayList<>(word.length());
            word.codePoints().forEach(codePoint -> characters.add(new String(Character.toChars(codePoint))));
            segmentedWords.add(String.join(" ", characters));
        }
        return String.join(" " + separator + " ", segmentedWords);
    }

    @Override
    public String post(String line) {
        StringBuilder builder = new StringBuilder(line.length());
        for (String unit : WHITESPACE.split(line)) {
            if (unit.isEmpty()) {
                continue;
            }
            builder.append(unit.equals(separator) ? " " : unit);
        }
        return builder.toString();
    }

    public String separator() {
        return separator;
    }
}
