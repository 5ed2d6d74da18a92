package com.coa.config.expression;

import com.coa.condition.ConditionType;
import com.coa.config.ConditionConfig;
import com.coa.exception.ConfigurationException;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser that compiles tokens into a ConditionConfig tree.
 * <p>
 * Grammar (precedence: NOT > AND > OR):
 * <pre>
 * expression := or
 * or         := and ('OR' and)*
 * and        := not ('AND' not)*
 * not        := 'NOT' not | primary
 * primary    := '(' expression ')' | BOOLEAN | comparison
 * comparison := [field] operator value
 * </pre>
 * The field may be omitted when the parser is bound to an implicit field, as in the
 * map form {@code threatLevel: "> 0.4 and <= 0.7"}.
 */
public final class ExpressionParser {

    private final String input;
    private final List<Token> tokens;
    private final String implicitField;
    private int index;

    public ExpressionParser(String input, List<Token> tokens) {
        this(input, tokens, null);
    }

    public ExpressionParser(String input, List<Token> tokens, String implicitField) {
        this.input = input;
        this.tokens = tokens;
        this.implicitField = implicitField;
        this.index = 0;
    }

    /**
     * Parse the token stream.
     *
     * @return Root condition configuration
     */
    public ConditionConfig parse() {
        ConditionConfig result = parseOr();
        expect(TokenType.EOF);
        return result;
    }

    private ConditionConfig parseOr() {
        ConditionConfig left = parseAnd();
        List<ConditionConfig> conditions = new ArrayList<>();
        conditions.add(left);

        while (match(TokenType.OR)) {
            conditions.add(parseAnd());
        }

        return conditions.size() == 1 ? left : ConditionConfig.or(conditions);
    }

    private ConditionConfig parseAnd() {
        ConditionConfig left = parseNot();
        List<ConditionConfig> conditions = new ArrayList<>();
        conditions.add(left);

        while (match(TokenType.AND)) {
            conditions.add(parseNot());
        }

        return conditions.size() == 1 ? left : ConditionConfig.and(conditions);
    }

    private ConditionConfig parseNot() {
        if (match(TokenType.NOT)) {
            return ConditionConfig.not(parseNot());
        }
        return parsePrimary();
    }

    private ConditionConfig parsePrimary() {
        if (match(TokenType.LPAREN)) {
            ConditionConfig expr = parseOr();
            expect(TokenType.RPAREN);
            return expr;
        }

        if (match(TokenType.BOOLEAN)) {
            boolean value = (boolean) previous().literal();
            return value ? ConditionConfig.alwaysTrue() : ConditionConfig.not(ConditionConfig.alwaysTrue());
        }

        return parseComparison();
    }

    private ConditionConfig parseComparison() {
        String field;
        if (implicitField != null && peek().type().isComparison()) {
            field = implicitField;
        } else {
            field = consume(TokenType.IDENT, "Expected field identifier").text();
        }

        if (match(TokenType.EQ)) {
            return ConditionConfig.comparison(ConditionType.EQUALS, field, parseValue());
        }
        if (match(TokenType.NE)) {
            return ConditionConfig.comparison(ConditionType.NOT_EQUALS, field, parseValue());
        }
        if (match(TokenType.GTE)) {
            return ConditionConfig.comparison(ConditionType.GREATER_THAN_OR_EQUALS, field,
                    parseNumericValue(">= requires a numeric value"));
        }
        if (match(TokenType.GT)) {
            return ConditionConfig.comparison(ConditionType.GREATER_THAN, field,
                    parseNumericValue("> requires a numeric value"));
        }
        if (match(TokenType.LTE)) {
            return ConditionConfig.comparison(ConditionType.LESS_THAN_OR_EQUALS, field,
                    parseNumericValue("<= requires a numeric value"));
        }
        if (match(TokenType.LT)) {
            return ConditionConfig.comparison(ConditionType.LESS_THAN, field,
                    parseNumericValue("< requires a numeric value"));
        }

        throw error("Expected operator after field");
    }

    private Object parseValue() {
        if (match(TokenType.STRING, TokenType.NUMBER, TokenType.BOOLEAN, TokenType.IDENT)) {
            return previous().literal();
        }
        throw error("Expected value");
    }

    private Object parseNumericValue(String message) {
        if (match(TokenType.NUMBER)) {
            return previous().literal();
        }
        throw error(message);
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) {
            return advance();
        }
        throw error(message);
    }

    private void expect(TokenType type) {
        if (!check(type)) {
            throw error("Expected " + type);
        }
        advance();
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private Token advance() {
        if (!isAtEnd()) {
            index++;
        }
        return previous();
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.EOF;
    }

    private Token peek() {
        return tokens.get(index);
    }

    private Token previous() {
        return tokens.get(index - 1);
    }

    private ConfigurationException error(String message) {
        int position = peek().position();
        return new ConfigurationException("Invalid condition at position "
                + position + ": " + message + " in '" + input + "'");
    }
}
