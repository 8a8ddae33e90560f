package com.linlay.chatgateway.text;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 工具调用标记修复。
 * <p>
 * 针对 IDE 插件客户端解析的 XML 风格工具块（如 {@code <attempt_completion>}），
 * 在上游输出于元素中途截断时补齐缺失的闭合标签；若文本不含任何标记，
 * 则整体包裹为单个 {@code <attempt_completion><result>} CDATA 块。
 * <p>
 * 只处理固定的标签词表，不是通用 XML 解析器。重复执行结果不变。
 */
public final class ToolMarkupRepair {

    /**
     * Closing order: innermost names first, outermost containers last.
     */
    private static final List<String> TAG_CLOSE_ORDER = List.of(
            "suggest",
            "question",
            "result",
            "follow_up",
            "ask_followup_question",
            "attempt_completion"
    );

    private static final List<String> TRIGGER_MARKERS = List.of(
            "<ask_followup_question",
            "<attempt_completion",
            "<suggest>",
            "<follow_up>",
            "<question>",
            "<result>"
    );

    private static final Pattern ANY_TAG_PATTERN = Pattern.compile("<\\w+[\\s/>]");
    private static final String CDATA_END = "]]>";
    private static final String CDATA_END_ESCAPED = "]]]]><![CDATA[>";
    private static final String EMPTY_COMPLETION = wrapAttemptCompletion("");

    private ToolMarkupRepair() {
    }

    public static String repair(String text) {
        return ensureToolContract(closeUnbalancedTags(text));
    }

    public static String closeUnbalancedTags(String text) {
        if (text == null || TRIGGER_MARKERS.stream().noneMatch(text::contains)) {
            return text;
        }
        String repaired = text;
        for (String name : TAG_CLOSE_ORDER) {
            int missing = countMatches(openTagPattern(name), repaired) - countMatches(closeTagPattern(name), repaired);
            if (missing > 0) {
                repaired = repaired + ("</" + name + ">").repeat(missing);
            }
        }
        return repaired;
    }

    public static String ensureToolContract(String text) {
        if (text == null || text.isBlank()) {
            return EMPTY_COMPLETION;
        }
        if (ANY_TAG_PATTERN.matcher(text.strip()).find()) {
            return text;
        }
        return wrapAttemptCompletion(text);
    }

    static String escapeCdata(String body) {
        return body == null ? "" : body.replace(CDATA_END, CDATA_END_ESCAPED);
    }

    private static String wrapAttemptCompletion(String body) {
        return "<attempt_completion><result><![CDATA[" + escapeCdata(body) + "]]></result></attempt_completion>";
    }

    private static Pattern openTagPattern(String name) {
        return Pattern.compile("<" + name + "\\b");
    }

    private static Pattern closeTagPattern(String name) {
        return Pattern.compile("</" + name + ">");
    }

    private static int countMatches(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }
}
