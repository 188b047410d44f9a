package io.github.manjago.evoformula.expr;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parser for the infix form written by {@link ExpressionPrinter}.
 *
 * <h2>Syntax:</h2>
 * <pre>
 * expr     := operand (op operand)*        ; precedence climbing
 * op       := + | - | * | / | ^            ; ^ is right-associative
 * operand  := number                       ; 1, 2.5, 1.0E-5
 *           | -number                      ; negative literal
 *           | -operand                     ; neg(operand)
 *           | name '(' expr ')'            ; unary function: sin, exp, erf, ...
 *           | pi | e                       ; named constants
 *           | name                         ; variable
 *           | '(' expr ')'
 * </pre>
 *
 * <h2>Example:</h2>
 * <pre>
 * sin(x) * 2.0 + (x - 1.0) ^ 0.5
 * </pre>
 */
public class ExpressionParser {

    private static final Logger log = LoggerFactory.getLogger(ExpressionParser.class);

    private static final Pattern NUMBER_PATTERN =
            Pattern.compile("(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");
    private static final Pattern NAME_PATTERN = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private String source;
    private int pos;

    /**
     * Parse an expression.
     *
     * @param text infix source
     * @return parsed tree
     * @throws ParseException on syntax error
     */
    public Expression parse(String text) throws ParseException {
        this.source = text;
        this.pos = 0;

        Expression result = parseExpression(0);
        skipWhitespace();
        if (pos < source.length()) {
            throw new ParseException("Unexpected '" + source.charAt(pos) + "'", pos);
        }

        log.debug("Parsed '{}' as {}", text, result);
        return result;
    }

    private Expression parseExpression(int minPriority) throws ParseException {
        Expression left = parseOperand();

        while (true) {
            skipWhitespace();
            if (pos >= source.length()) {
                return left;
            }
            BinaryKind kind = BinaryKind.fromSymbol(String.valueOf(source.charAt(pos)));
            if (kind == null || kind.getPriority() < minPriority) {
                return left;
            }
            pos++;

            int nextMin = kind.isRightAssociative() ? kind.getPriority() : kind.getPriority() + 1;
            Expression right = parseExpression(nextMin);
            left = new BinaryOp(kind, left, right);
        }
    }

    private Expression parseOperand() throws ParseException {
        skipWhitespace();
        if (pos >= source.length()) {
            throw new ParseException("Unexpected end of input", pos);
        }

        char c = source.charAt(pos);

        if (c == '(') {
            pos++;
            Expression inner = parseExpression(0);
            expect(')');
            return inner;
        }

        if (c == '-') {
            pos++;
            Matcher number = NUMBER_PATTERN.matcher(source).region(pos, source.length());
            if (number.lookingAt()) {
                pos = number.end();
                return new Const(-Double.parseDouble(number.group()));
            }
            return new UnaryOp(UnaryKind.NEG, parseOperand());
        }

        Matcher number = NUMBER_PATTERN.matcher(source).region(pos, source.length());
        if (number.lookingAt()) {
            pos = number.end();
            return new Const(Double.parseDouble(number.group()));
        }

        Matcher name = NAME_PATTERN.matcher(source).region(pos, source.length());
        if (name.lookingAt()) {
            int start = pos;
            pos = name.end();
            String identifier = name.group();

            skipWhitespace();
            if (pos < source.length() && source.charAt(pos) == '(') {
                UnaryKind kind = UnaryKind.fromSymbol(identifier);
                if (kind == null) {
                    throw new ParseException("Unknown function: " + identifier, start);
                }
                pos++;
                Expression argument = parseExpression(0);
                expect(')');
                return new UnaryOp(kind, argument);
            }

            NamedConstant constant = NamedConstant.fromSymbol(identifier);
            return constant != null ? constant : new Variable(identifier);
        }

        throw new ParseException("Unexpected '" + c + "'", pos);
    }

    private void expect(char expected) throws ParseException {
        skipWhitespace();
        if (pos >= source.length() || source.charAt(pos) != expected) {
            throw new ParseException("Expected '" + expected + "'", pos);
        }
        pos++;
    }

    private void skipWhitespace() {
        while (pos < source.length() && Character.isWhitespace(source.charAt(pos))) {
            pos++;
        }
    }

    /**
     * Syntax error with the character position where it was detected.
     */
    public static class ParseException extends Exception {
        private final int position;

        public ParseException(String message, int position) {
            super("Position " + position + ": " + message);
            this.position = position;
        }

        public int getPosition() {
            return position;
        }
    }
}
