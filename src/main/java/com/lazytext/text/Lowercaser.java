package com.lazytext.text;

import java.util.Locale;

public class Lowercaser implements LineTransform {

    private final Locale locale;

    /**
     * 按语言代码创建小写化变换，空代码使用 Locale.ROOT。
     */
    public Lowercaser(String languageCode) {
        this.locale = languageCode == null || languageCode.isBlank()
            ? Locale.ROOT
            : Locale.forLanguageTag(languageCode);
    }

    @Override
    public String pre(String line) {
        return line.toLowerCase(locale);
    }
}
