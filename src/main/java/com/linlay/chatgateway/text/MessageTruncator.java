package com.linlay.chatgateway.text;

/**
 * Applies the global upstream input length limit, appending a truncation notice when it fits.
 */
public final class MessageTruncator {

    private MessageTruncator() {
    }

    public static Result truncate(String message, int maxLength) {
        if (message == null || maxLength <= 0 || message.length() <= maxLength) {
            return new Result(message, false);
        }
        String notice = "\n\n[TRUNCATED: Original message length was " + message.length()
                + " characters, truncated to " + maxLength + " characters]";
        int available = maxLength - notice.length();
        if (available > 0) {
            return new Result(message.substring(0, available) + notice, true);
        }
        return new Result(message.substring(0, maxLength), true);
    }

    public record Result(
            String text,
            boolean truncated
    ) {
    }
}
