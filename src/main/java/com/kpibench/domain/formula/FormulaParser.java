package com.kpibench.domain.formula;

import com.kpibench.domain.exception.ConfigurationException;

/**
 * Recursive-descent parser for KPI formulas.
 *
 * Grammar:
 * <pre>
 * expression := term (('+' | '-') term)*
 * term       := factor (('*' | '/') factor)*
 * factor     := NUMBER | NAME | 'prev' '(' NAME ')' | '(' expression ')' | '-' factor
 * </pre>
 * Names are aggregate names: letters, digits and '_', not starting with a digit.
 */
public class FormulaParser {

    private static final String PREVIOUS_PERIOD = "prev";

    private final String source;
    private int pos;

    private FormulaParser(String source) {
        this.source = source;
    }

    public static Formula parse(String source) {
        if (source == null || source.isBlank()) {
            throw new ConfigurationException("Formula is empty");
        }
        FormulaParser parser = new FormulaParser(source);
        Expression root = parser.expression();
        parser.skipWhitespace();
        if (parser.pos < source.length()) {
            throw parser.error("Unexpected '" + source.charAt(parser.pos) + "'");
        }
        return new Formula(source.trim(), root);
    }

    private Expression expression() {
        Expression left = term();
        while (true) {
            char op = peek();
            if (op != '+' && op != '-') {
                return left;
            }
            pos++;
            left = new BinaryOperation(op, left, term());
        }
    }

    private Expression term() {
        Expression left = factor();
        while (true) {
            char op = peek();
            if (op != '*' && op != '/') {
                return left;
            }
            pos++;
            left = new BinaryOperation(op, left, factor());
        }
    }

    private Expression factor() {
        char c = peek();
        if (c == '(') {
            pos++;
            Expression inner = expression();
            expect(')');
            return inner;
        }
        if (c == '-') {
            pos++;
            return new Negation(factor());
        }
        if (Character.isDigit(c) || c == '.') {
            return number();
        }
        if (isNameStart(c)) {
            String name = name();
            if (PREVIOUS_PERIOD.equals(name) && peek() == '(') {
                pos++;
                skipWhitespace();
                if (!isNameStart(peek())) {
                    throw error("Expected aggregate name inside prev()");
                }
                String aggregate = name();
                expect(')');
                return new AggregateTerm(aggregate, -1);
            }
            return new AggregateTerm(name, 0);
        }
        if (c == '\0') {
            throw error("Unexpected end of formula");
        }
        throw error("Unexpected '" + c + "'");
    }

    private Expression number() {
        int start = pos;
        while (pos < source.length() && (Character.isDigit(source.charAt(pos)) || source.charAt(pos) == '.')) {
            pos++;
        }
        String text = source.substring(start, pos);
        try {
            return new NumberLiteral(Double.parseDouble(text));
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid number '" + text + "' in formula: " + source, e);
        }
    }

    private String name() {
        int start = pos;
        while (pos < source.length() && isNamePart(source.charAt(pos))) {
            pos++;
        }
        return source.substring(start, pos);
    }

    private void expect(char expected) {
        if (peek() != expected) {
            throw error("Expected '" + expected + "'");
        }
        pos++;
    }

    // Skips whitespace; returns '\0' at end of input
    private char peek() {
        skipWhitespace();
        return pos < source.length() ? source.charAt(pos) : '\0';
    }

    private void skipWhitespace() {
        while (pos < source.length() && Character.isWhitespace(source.charAt(pos))) {
            pos++;
        }
    }

    private ConfigurationException error(String message) {
        return new ConfigurationException(message + " at position " + pos + " in formula: " + source);
    }

    private static boolean isNameStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isNamePart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }
}
