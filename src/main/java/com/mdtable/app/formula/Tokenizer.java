package com.mdtable.app.formula;

import com.mdtable.app.exceptions.FormulaErrorKind;
import com.mdtable.app.exceptions.FormulaException;
import com.mdtable.app.models.Span;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits the right-hand side of a formula into tokens in a single left-to-right pass.
 *
 * - Operators, parentheses, ':' and ',' are single-character tokens.
 * - '.' is a decimal point inside a number ("3.14") and a separate token otherwise,
 *   so "A_.T" becomes "A_", ".", "T".
 * - Quoted text ("sales" or 'sales') is a STRING token.
 * - Every other run of non-blank characters is one IDENTIFIER; the parser decides
 *   whether it is a number, a reference or a name.
 */
public final class Tokenizer {

    private Tokenizer() {
    }

    public static List<Token> tokenize(String expression) {
        List<Token> tokens = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int tokenStart = 0;
        int len = expression.length();

        int i = 0;
        while (i < len) {
            char c = expression.charAt(i);
            TokenType single = singleCharType(c);

            if (single != null) {
                flushIdentifier(tokens, current, tokenStart);
                tokens.add(new Token(single, String.valueOf(c), Span.single(i)));
                i++;
            } else if (c == '.') {
                boolean decimalPoint = current.length() > 0
                        && isAllDigits(current)
                        && i + 1 < len
                        && Character.isDigit(expression.charAt(i + 1));
                if (decimalPoint) {
                    current.append(c);
                } else {
                    flushIdentifier(tokens, current, tokenStart);
                    tokens.add(new Token(TokenType.DOT, ".", Span.single(i)));
                }
                i++;
            } else if (c == '"' || c == '\'') {
                flushIdentifier(tokens, current, tokenStart);
                int close = expression.indexOf(c, i + 1);
                if (close < 0) {
                    throw new FormulaException(FormulaErrorKind.INVALID_TOKEN,
                            "invalid token: unterminated string starting with " + c, new Span(i, len));
                }
                tokens.add(new Token(TokenType.STRING, expression.substring(i + 1, close), new Span(i, close + 1)));
                i = close + 1;
            } else if (Character.isWhitespace(c)) {
                flushIdentifier(tokens, current, tokenStart);
                i++;
            } else {
                if (current.length() == 0) {
                    tokenStart = i;
                }
                current.append(c);
                i++;
            }
        }
        flushIdentifier(tokens, current, tokenStart);

        return tokens;
    }

    private static TokenType singleCharType(char c) {
        switch (c) {
            case '+':
                return TokenType.PLUS;
            case '-':
                return TokenType.MINUS;
            case '*':
                return TokenType.STAR;
            case '/':
                return TokenType.SLASH;
            case '^':
                return TokenType.CARET;
            case '@':
                return TokenType.AT;
            case '(':
                return TokenType.LEFT_PAREN;
            case ')':
                return TokenType.RIGHT_PAREN;
            case ':':
                return TokenType.COLON;
            case ',':
                return TokenType.COMMA;
            default:
                return null;
        }
    }

    private static void flushIdentifier(List<Token> tokens, StringBuilder current, int tokenStart) {
        if (current.length() > 0) {
            tokens.add(new Token(TokenType.IDENTIFIER, current.toString(),
                    new Span(tokenStart, tokenStart + current.length())));
            current.setLength(0);
        }
    }

    private static boolean isAllDigits(CharSequence chars) {
        for (int i = 0; i < chars.length(); i++) {
            if (!Character.isDigit(chars.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
