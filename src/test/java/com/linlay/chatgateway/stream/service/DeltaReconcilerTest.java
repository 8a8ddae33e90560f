package com.linlay.chatgateway.stream.service;

import com.linlay.chatgateway.stream.model.DeltaFragment;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DeltaReconcilerTest {

    @Test
    void extensionsShouldConcatenateToFinalText() {
        for (DivergencePolicy policy : DivergencePolicy.values()) {
            DeltaReconciler reconciler = new DeltaReconciler(policy);
            StringBuilder emitted = new StringBuilder();
            for (String raw : List.of("Т", "Тек", "Текст", "Текст про", "Текст про 1С")) {
                reconciler.accept(raw).forEach(fragment -> emitted.append(fragment.text()));
            }

            assertThat(emitted.toString()).isEqualTo("Текст про 1С");
        }
    }

    @Test
    void resetPolicyShouldEmitResetAndFullTextOnDivergence() {
        DeltaReconciler reconciler = new DeltaReconciler(DivergencePolicy.EXPLICIT_RESET);
        reconciler.accept("Hello wor");

        List<DeltaFragment> fragments = reconciler.accept("Hi there");

        assertThat(fragments).containsExactly(DeltaFragment.resetSignal(), DeltaFragment.text("Hi there"));
        assertThat(fragments).extracting(DeltaFragment::reset).containsExactly(true, false);
        assertThat(reconciler.previous()).isEqualTo("Hi there");
    }

    @Test
    void overlapPolicyShouldEmitOnlyNonOverlappingSuffix() {
        DeltaReconciler reconciler = new DeltaReconciler(DivergencePolicy.LONGEST_OVERLAP);
        reconciler.accept("abcdef");

        assertThat(reconciler.accept("defghi")).containsExactly(DeltaFragment.text("ghi"));
    }

    @Test
    void overlapPolicyWithoutOverlapShouldEmitWholeText() {
        DeltaReconciler reconciler = new DeltaReconciler(DivergencePolicy.LONGEST_OVERLAP);
        reconciler.accept("Hello wor");

        assertThat(reconciler.accept("Hi there")).containsExactly(DeltaFragment.text("Hi there"));
    }

    @Test
    void overlapPolicyShouldEmitNothingWhenNewTextIsSuffixOfPrevious() {
        DeltaReconciler reconciler = new DeltaReconciler(DivergencePolicy.LONGEST_OVERLAP);
        reconciler.accept("abcdef");

        assertThat(reconciler.accept("def")).isEmpty();
    }

    @Test
    void repeatedAndEmptyObservationsShouldBeNoOps() {
        DeltaReconciler reconciler = new DeltaReconciler(DivergencePolicy.EXPLICIT_RESET);
        List<DeltaFragment> fragments = new ArrayList<>();

        fragments.addAll(reconciler.accept("Hello"));
        fragments.addAll(reconciler.accept("Hello"));
        fragments.addAll(reconciler.accept(""));
        fragments.addAll(reconciler.accept("Hello!"));

        assertThat(fragments).containsExactly(DeltaFragment.text("Hello"), DeltaFragment.text("!"));
    }

    @Test
    void overlapLengthShouldPickLongestMatch() {
        assertThat(DeltaReconciler.overlapLength("abab", "ababc")).isEqualTo(4);
        assertThat(DeltaReconciler.overlapLength("xaba", "abaz")).isEqualTo(3);
        assertThat(DeltaReconciler.overlapLength("abc", "xyz")).isZero();
    }
}
