package com.mdtable.app.formula;

import java.util.EnumMap;
import java.util.Map;

/**
 * Binary operators of the formula language, with their source symbol.
 */
public enum BinaryOperator {
    ADD('+', TokenType.PLUS),
    SUBTRACT('-', TokenType.MINUS),
    MULTIPLY('*', TokenType.STAR),
    DIVIDE('/', TokenType.SLASH),
    POWER('^', TokenType.CARET),
    MATRIX_MULTIPLY('@', TokenType.AT);

    private static final Map<TokenType, BinaryOperator> byToken = new EnumMap<>(TokenType.class);

    static {
        for (BinaryOperator op : values()) {
            byToken.put(op.tokenType, op);
        }
    }

    private final char symbol;
    private final TokenType tokenType;

    BinaryOperator(char symbol, TokenType tokenType) {
        this.symbol = symbol;
        this.tokenType = tokenType;
    }

    /**
     * @return the operator written as this token type, or null
     */
    public static BinaryOperator fromToken(TokenType type) {
        return byToken.get(type);
    }

    @Override
    public String toString() {
        return String.valueOf(symbol);
    }
}
