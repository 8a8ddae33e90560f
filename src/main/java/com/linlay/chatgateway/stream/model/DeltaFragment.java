package com.linlay.chatgateway.stream.model;

public record DeltaFragment(
        String text,
        boolean reset
) {

    private static final DeltaFragment RESET = new DeltaFragment("", true);

    public static DeltaFragment text(String text) {
        if (text == null || text.isEmpty()) {
            throw new IllegalArgumentException("text fragment must not be empty");
        }
        return new DeltaFragment(text, false);
    }

    public static DeltaFragment resetSignal() {
        return RESET;
    }
}
