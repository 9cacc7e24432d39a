package com.mdtable.app.formula;

public enum TokenType {
    PLUS,
    MINUS,
    STAR,
    SLASH,
    CARET,
    AT,
    LEFT_PAREN,
    RIGHT_PAREN,
    COLON,
    COMMA,
    DOT,
    STRING,
    // Cell reference, function or variable name, or bare number
    IDENTIFIER
}
