package com.libsl.asg;

public enum StateKind {
    INIT,
    SIMPLE,
    FINISH;

    /**
     * Maps a state declaration keyword to its kind.
     *
     * @throws IllegalArgumentException for any keyword other than {@code initstate}, {@code state} or
     *     {@code finishstate}
     */
    public static StateKind fromString(String keyword) {
        return switch (keyword) {
            case "initstate" -> INIT;
            case "state" -> SIMPLE;
            case "finishstate" -> FINISH;
            default -> throw new IllegalArgumentException("unknown state kind: " + keyword);
        };
    }
}
