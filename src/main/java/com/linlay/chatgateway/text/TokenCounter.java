package com.linlay.chatgateway.text;

import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Token count with the {@code cl100k_base} encoding.
 * Falls back to one token per four characters when the encoder is unavailable or fails.
 */
public final class TokenCounter {

    private static final Logger log = LoggerFactory.getLogger(TokenCounter.class);

    private static final int CHARS_PER_TOKEN = 4;
    private static final Encoding ENCODING = loadEncoding();

    private TokenCounter() {
    }

    public static int count(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        if (ENCODING != null) {
            try {
                return ENCODING.countTokens(text);
            } catch (RuntimeException ex) {
                log.warn("Token encoding error: {}, falling back to approximation", ex.getMessage());
            }
        }
        return approximate(text);
    }

    static int approximate(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return Math.max(1, text.length() / CHARS_PER_TOKEN);
    }

    private static Encoding loadEncoding() {
        try {
            return Encodings.newDefaultEncodingRegistry().getEncoding(EncodingType.CL100K_BASE);
        } catch (RuntimeException ex) {
            log.warn("cl100k_base encoder unavailable, token counts will be approximate: {}", ex.getMessage());
            return null;
        }
    }
}
