package com.linlay.chatgateway.text;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ToolMarkupRepairTest {

    @Test
    void balancedMarkupShouldBeLeftUntouched() {
        String balanced = "<attempt_completion><result>done</result></attempt_completion>";

        assertThat(ToolMarkupRepair.repair(balanced)).isEqualTo(balanced);
    }

    @Test
    void repairShouldBeIdempotent() {
        String truncated = "<ask_followup_question><question>Which file?</question><follow_up><suggest>a.bsl";

        String once = ToolMarkupRepair.repair(truncated);
        String twice = ToolMarkupRepair.repair(once);

        assertThat(twice).isEqualTo(once);
    }

    @Test
    void shouldCloseInnermostTagsFirst() {
        String truncated = "<ask_followup_question><question>Which file?</question><follow_up><suggest>a.bsl";

        assertThat(ToolMarkupRepair.closeUnbalancedTags(truncated)).isEqualTo(
                truncated + "</suggest></follow_up></ask_followup_question>");
    }

    @Test
    void twoUnclosedTagsOfSameNameShouldGetTwoCloses() {
        String truncated = "<follow_up><suggest>first<suggest>second";

        assertThat(ToolMarkupRepair.closeUnbalancedTags(truncated))
                .isEqualTo(truncated + "</suggest></suggest></follow_up>");
    }

    @Test
    void plainTextShouldBeWrappedInCompletionResult() {
        assertThat(ToolMarkupRepair.repair("42"))
                .isEqualTo("<attempt_completion><result><![CDATA[42]]></result></attempt_completion>");
    }

    @Test
    void cdataTerminatorInsidePayloadShouldBeSplit() {
        assertThat(ToolMarkupRepair.repair("a]]>b"))
                .isEqualTo("<attempt_completion><result><![CDATA[a]]]]><![CDATA[>b]]></result></attempt_completion>");
    }

    @Test
    void blankTextShouldYieldEmptyCompletion() {
        assertThat(ToolMarkupRepair.repair("  "))
                .isEqualTo("<attempt_completion><result><![CDATA[]]></result></attempt_completion>");
    }

    @Test
    void textWithUnknownMarkupShouldNotBeWrapped() {
        String html = "Use <b>bold</b> here";

        assertThat(ToolMarkupRepair.repair(html)).isEqualTo(html);
    }
}
