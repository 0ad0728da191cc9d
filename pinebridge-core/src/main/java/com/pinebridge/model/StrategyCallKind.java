package com.pinebridge.model;

public enum StrategyCallKind {
    ENTRY,
    CLOSE,
    EXIT;

    public static StrategyCallKind fromFunction(String function) {
        return switch (function) {
            case "entry", "order" -> ENTRY;
            case "close", "close_all" -> CLOSE;
            case "exit" -> EXIT;
            default -> null;
        };
    }
}
