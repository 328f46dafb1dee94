package com.lazytext.text;

/**
 * 后处理时将行首字母恢复为大写，预处理原样返回。
 */
public class Recaser implements LineTransform {

    @Override
    public String pre(String line) {
        return line;
    }

    @Override
    public String post(String line) {
        int cursor = 0;
        while (cursor < line.length()) {
            int codePoint = line.codePointAt(cursor);
            if (Character.isLetter(codePoint)) {
                if (Character.isUpperCase(codePoint)) {
                    return line;
                }
                String head = new String(Character.toChars(Character.toUpperCase(codePoint)));
                return line.substring(0, cursor) + head + line.substring(cursor + Character.charCount(codePoint));
            }
            cursor += Character.charCount(codePoint);
        }
        return line;
    }
}
