package com.libsl.asg;

public enum ArithmeticBinaryOps {
    ADD("+"),
    SUB("-"),
    MUL("*"),
    DIV("/"),
    AND("&"),
    OR("|"),
    XOR("^"),
    MOD("%"),
    EQ("="),
    NOT_EQ("!="),
    GT(">"),
    GT_EQ(">="),
    LT("<"),
    LT_EQ("<=");

    private final String symbol;

    ArithmeticBinaryOps(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * @throws IllegalArgumentException if the symbol is not a binary operator
     */
    public static ArithmeticBinaryOps fromString(String symbol) {
        return switch (symbol) {
            case "*" -> MUL;
            case "/" -> DIV;
            case "+" -> ADD;
            case "-" -> SUB;
            case "%" -> MOD;
            case "=" -> EQ;
            case "!=" -> NOT_EQ;
            case ">=" -> GT_EQ;
            case ">" -> GT;
            case "<=" -> LT_EQ;
            case "<" -> LT;
            case "&" -> AND;
            case "|" -> OR;
            case "^" -> XOR;
            default -> throw new IllegalArgumentException("unknown binary operator: " + symbol);
        };
    }
}
