package com.libsl.asg;

public enum ArithmeticUnaryOp {
    MINUS("-"),
    INVERSION("!");

    private final String symbol;

    ArithmeticUnaryOp(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    public static ArithmeticUnaryOp fromString(String symbol) {
        return switch (symbol) {
            case "-" -> MINUS;
            case "!" -> INVERSION;
            default -> throw new IllegalArgumentException("unknown unary operator: " + symbol);
        };
    }
}
