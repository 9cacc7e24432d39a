package com.mdtable.app.formula;

import com.mdtable.app.exceptions.FormulaErrorKind;
import com.mdtable.app.exceptions.FormulaException;
import com.mdtable.app.models.CellReference;
import com.mdtable.app.models.Span;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Recursive descent parser for formula expressions.
 *
 * Grammar, lowest to highest precedence:
 * <pre>
 * expression : term ( ( "+" | "-" ) term )* ;
 * term       : factor ( ( "*" | "/" | "@" ) factor )* ;
 * factor     : unary ( "^" factor )? ;                 right-associative
 * unary      : primary ( "." "T" )? ;
 * primary    : NUMBER | STRING
 *            | CELLREF ( ":" CELLREF )?
 *            | IDENT "(" expression ( "," expression )* ")"
 *            | IDENT
 *            | "(" expression ")" ;
 * </pre>
 */
public class Parser {

    private static final Pattern NUMBER = Pattern.compile("\\d+(\\.\\d+)?");
    private static final Pattern NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final List<Token> tokens;
    private final int sourceLength;
    private int pos = 0;

    public Parser(List<Token> tokens) {
        this.tokens = tokens;
        this.sourceLength = tokens.isEmpty() ? 0 : tokens.get(tokens.size() - 1).getSpan().getEnd();
    }

    /**
     * Tokenizes and parses an expression in one go.
     */
    public static Expr parse(String expression) {
        return new Parser(Tokenizer.tokenize(expression)).parse();
    }

    public static boolean isValidName(String name) {
        return NAME.matcher(name).matches();
    }

    public Expr parse() {
        if (tokens.isEmpty()) {
            throw new FormulaException(FormulaErrorKind.EMPTY_EXPRESSION, "empty expression");
        }
        Expr expr = parseExpression();
        if (pos < tokens.size()) {
            Token token = tokens.get(pos);
            if (token.is(TokenType.RIGHT_PAREN)) {
                throw new FormulaException(FormulaErrorKind.UNMATCHED_PARENTHESIS,
                        "unmatched closing parenthesis ')'", token.getSpan());
            }
            throw unexpected(token);
        }
        return expr;
    }

    private Expr parseExpression() {
        Expr left = parseTerm();
        while (check(TokenType.PLUS) || check(TokenType.MINUS)) {
            BinaryOperator op = BinaryOperator.fromToken(advance().getType());
            Expr right = parseTerm();
            left = new Expr.BinaryOp(left, op, right);
        }
        return left;
    }

    private Expr parseTerm() {
        Expr left = parseFactor();
        while (check(TokenType.STAR) || check(TokenType.SLASH) || check(TokenType.AT)) {
            BinaryOperator op = BinaryOperator.fromToken(advance().getType());
            Expr right = parseFactor();
            left = new Expr.BinaryOp(left, op, right);
        }
        return left;
    }

    private Expr parseFactor() {
        Expr left = parseUnary();
        if (check(TokenType.CARET)) {
            advance();
            // Recurse into factor, not unary, so 2^3^2 groups as 2^(3^2)
            Expr right = parseFactor();
            return new Expr.BinaryOp(left, BinaryOperator.POWER, right);
        }
        return left;
    }

    private Expr parseUnary() {
        Expr expr = parsePrimary();
        if (check(TokenType.DOT) && pos + 1 < tokens.size()) {
            Token next = tokens.get(pos + 1);
            if (next.is(TokenType.IDENTIFIER) && next.getText().equals("T")) {
                pos += 2;
                expr = new Expr.Transpose(expr, expr.getSpan().merge(next.getSpan()));
            }
        }
        return expr;
    }

    private Expr parsePrimary() {
        if (pos >= tokens.size()) {
            throw new FormulaException(FormulaErrorKind.UNEXPECTED_TOKEN,
                    "unexpected end of expression", Span.single(sourceLength));
        }
        Token token = tokens.get(pos);

        switch (token.getType()) {
            case LEFT_PAREN:
                return parseGroup();
            case STRING:
                advance();
                return new Expr.StringLiteral(token.getText(), token.getSpan());
            case IDENTIFIER:
                if (pos + 1 < tokens.size() && tokens.get(pos + 1).is(TokenType.LEFT_PAREN)) {
                    return parseFunctionCall();
                }
                return parseIdentifier();
            default:
                throw unexpected(token);
        }
    }

    private Expr parseGroup() {
        Token open = advance();
        Expr expr = parseExpression();
        if (!check(TokenType.RIGHT_PAREN)) {
            throw new FormulaException(FormulaErrorKind.UNMATCHED_PARENTHESIS,
                    "unmatched opening parenthesis '(' - missing closing ')'", open.getSpan());
        }
        advance();
        return expr;
    }

    private Expr parseFunctionCall() {
        Token name = advance();
        Token open = advance();
        List<Expr> args = new ArrayList<>();
        args.add(parseExpression());
        while (check(TokenType.COMMA)) {
            advance();
            args.add(parseExpression());
        }
        if (!check(TokenType.RIGHT_PAREN)) {
            if (pos < tokens.size()) {
                throw unexpected(tokens.get(pos));
            }
            throw new FormulaException(FormulaErrorKind.UNMATCHED_PARENTHESIS,
                    "unmatched '(' in function call '" + name.getText() + "'", open.getSpan());
        }
        Token close = advance();
        return new Expr.FunctionCall(name.getText(), args, name.getSpan().merge(close.getSpan()));
    }

    private Expr parseIdentifier() {
        Token token = advance();
        String text = token.getText();

        CellReference ref = References.parse(text);
        if (ref != null) {
            if (check(TokenType.COLON)) {
                return parseRange(ref, token);
            }
            return new Expr.CellRef(ref, token.getSpan());
        }

        if (NUMBER.matcher(text).matches()) {
            return new Expr.Literal(new BigDecimal(text), token.getSpan());
        }

        if (isValidName(text)) {
            return new Expr.Variable(text, token.getSpan());
        }

        throw new FormulaException(FormulaErrorKind.INVALID_TOKEN,
                "invalid token: '" + text + "' is not a valid number, cell reference or name", token.getSpan());
    }

    private Expr parseRange(CellReference start, Token startToken) {
        Token colon = advance();
        if (!check(TokenType.IDENTIFIER)) {
            throw new FormulaException(FormulaErrorKind.INVALID_RANGE,
                    "invalid range: '" + startToken.getText() + ":' must be followed by a cell reference",
                    startToken.getSpan().merge(colon.getSpan()));
        }
        Token endToken = advance();
        Span span = startToken.getSpan().merge(endToken.getSpan());
        CellReference end = References.parse(endToken.getText());
        if (end == null) {
            throw new FormulaException(FormulaErrorKind.INVALID_RANGE,
                    "invalid range: '" + endToken.getText() + "' is not a cell reference", endToken.getSpan());
        }
        CellReference range = CellReference.between(start, end);
        if (range == null) {
            throw new FormulaException(FormulaErrorKind.INVALID_RANGE, String.format(
                    "invalid range '%s:%s': both ends must be cells (A1:C5), columns (A_:C_) or rows (_1:_5)",
                    startToken.getText(), endToken.getText()), span);
        }
        return new Expr.CellRef(range, span);
    }

    private boolean check(TokenType type) {
        return pos < tokens.size() && tokens.get(pos).is(type);
    }

    private Token advance() {
        return tokens.get(pos++);
    }

    private static FormulaException unexpected(Token token) {
        return new FormulaException(FormulaErrorKind.UNEXPECTED_TOKEN,
                "unexpected token: '" + token + "' at position " + token.getSpan().getStart(), token.getSpan());
    }
}
