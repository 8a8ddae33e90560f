package com.linlay.chatgateway.stream.service;

import com.linlay.chatgateway.stream.model.DeltaFragment;

import java.util.List;
import java.util.Objects;

/**
 * 累计文本到增量片段的转换器。
 * <p>
 * 上游并不保证累计文本单调增长（可能中途从头重答或改写），
 * 此类按 {@link DivergencePolicy} 处理分歧，保证不会输出负长度或静默重复的文本。
 * 同步、非阻塞，每条流一个实例。
 */
public class DeltaReconciler {

    private final DivergencePolicy policy;
    private String previous = "";

    public DeltaReconciler(DivergencePolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy cannot be null");
    }

    public List<DeltaFragment> accept(String raw) {
        if (raw == null || raw.isEmpty() || raw.equals(previous)) {
            return List.of();
        }
        String prev = previous;
        previous = raw;

        if (prev.isEmpty()) {
            return List.of(DeltaFragment.text(raw));
        }
        if (raw.startsWith(prev)) {
            return List.of(DeltaFragment.text(raw.substring(prev.length())));
        }
        if (policy == DivergencePolicy.EXPLICIT_RESET) {
            return List.of(DeltaFragment.resetSignal(), DeltaFragment.text(raw));
        }
        String suffix = raw.substring(overlapLength(prev, raw));
        return suffix.isEmpty() ? List.of() : List.of(DeltaFragment.text(suffix));
    }

    public String previous() {
        return previous;
    }

    /**
     * Longest suffix of {@code prev} that is also a prefix of {@code raw}.
     */
    static int overlapLength(String prev, String raw) {
        int max = Math.min(prev.length(), raw.length());
        for (int length = max; length > 0; length--) {
            if (prev.regionMatches(prev.length() - length, raw, 0, length)) {
                return length;
            }
        }
        return 0;
    }
}
