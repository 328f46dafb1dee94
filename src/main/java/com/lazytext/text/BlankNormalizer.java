package com.lazytext.text;

import java.util.regex.Pattern;

/**
 * 将连续空白折叠为单个空格，后处理不做还原。
 */
public class BlankNormalizer implements LineTransform {

    private static final Pattern BLANK_PATTERN = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    @Override
    public String pre(String line) {
        return BLANK_PATTERN.matcher(line).replaceAll(" ");
    }
}
