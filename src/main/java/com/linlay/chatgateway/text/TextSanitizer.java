package com.linlay.chatgateway.text;

import java.text.Normalizer;

/**
 * 文本清洗工具：Unicode NFKC 归一化，去除控制字符与格式字符（保留换行、回车、制表符），
 * 以及去除无效的 UTF-16 代理项与替换字符。纯静态，无状态。
 */
public final class TextSanitizer {

    private static final char REPLACEMENT_CHAR = '\uFFFD';

    private TextSanitizer() {
    }

    public static String sanitize(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        String normalized = Normalizer.normalize(text, Normalizer.Form.NFKC);
        StringBuilder cleaned = new StringBuilder(normalized.length());
        normalized.codePoints().forEach(codePoint -> {
            if (isAllowedWhitespace(codePoint) || !isControlOrFormat(codePoint)) {
                cleaned.appendCodePoint(codePoint);
            }
        });
        return cleaned.toString();
    }

    /**
     * Drops unpaired surrogates and U+FFFD left behind by a lossy UTF-8 decode.
     */
    public static String stripInvalidSequences(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        StringBuilder cleaned = null;
        int length = text.length();
        for (int i = 0; i < length; i++) {
            char ch = text.charAt(i);
            boolean keep;
            int width = 1;
            if (Character.isHighSurrogate(ch)) {
                keep = i + 1 < length && Character.isLowSurrogate(text.charAt(i + 1));
                if (keep) {
                    width = 2;
                }
            } else {
                keep = !Character.isLowSurrogate(ch) && ch != REPLACEMENT_CHAR;
            }
            if (!keep && cleaned == null) {
                cleaned = new StringBuilder(length);
                cleaned.append(text, 0, i);
            }
            if (keep && cleaned != null) {
                cleaned.append(text, i, i + width);
            }
            i += width - 1;
        }
        return cleaned == null ? text : cleaned.toString();
    }

    private static boolean isAllowedWhitespace(int codePoint) {
        return codePoint == '\n' || codePoint == '\r' || codePoint == '\t';
    }

    private static boolean isControlOrFormat(int codePoint) {
        int type = Character.getType(codePoint);
        return type == Character.CONTROL || type == Character.FORMAT;
    }
}
