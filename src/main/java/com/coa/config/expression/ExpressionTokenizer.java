package com.coa.config.expression;

import com.coa.exception.ConfigurationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.IntPredicate;

/**
 * Splits a condition expression such as {@code threatLevel > 0.7 and forceRatio < 1}
 * into tokens. Identifiers may contain Hangul, digits, {@code _} and {@code .}.
 */
public final class ExpressionTokenizer {

    private final String input;
    private int pos;

    public ExpressionTokenizer(String input) {
        this.input = input;
    }

    /**
     * Tokenize the whole input.
     *
     * @return Tokens, terminated by EOF
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        skip(Character::isWhitespace);

        while (pos < input.length()) {
            char c = input.charAt(pos);
            Token token;
            if (c == '"' || c == '\'') {
                token = quoted(c);
            } else if (startsNumber(c)) {
                token = number();
            } else if (Character.isLetter(c) || c == '_') {
                token = word();
            } else {
                token = symbol();
            }
            tokens.add(token);
            skip(Character::isWhitespace);
        }

        tokens.add(new Token(TokenType.EOF, "", null, pos));
        return tokens;
    }

    private Token symbol() {
        int start = pos;
        for (Map.Entry<String, TokenType> symbol : ExpressionConfig.SYMBOLS.entrySet()) {
            if (input.startsWith(symbol.getKey(), pos)) {
                pos += symbol.getKey().length();
                return new Token(symbol.getValue(), symbol.getKey(), null, start);
            }
        }
        throw error("Unexpected '" + input.charAt(pos) + "'", start);
    }

    private Token word() {
        int start = pos;
        skip(c -> Character.isLetterOrDigit(c) || c == '_' || c == '.');
        String text = input.substring(start, pos);

        TokenType keyword = ExpressionConfig.KEYWORDS.get(text.toUpperCase(Locale.ROOT));
        if (keyword == null) {
            return new Token(TokenType.IDENT, text, text, start);
        }
        Object literal = keyword == TokenType.BOOLEAN ? Boolean.valueOf(text.toLowerCase(Locale.ROOT)) : null;
        return new Token(keyword, text, literal, start);
    }

    // -0.25, 12, .5
    private Token number() {
        int start = pos;
        if (input.charAt(pos) == '-') {
            pos++;
        }
        skip(Character::isDigit);
        boolean fractional = pos < input.length() && input.charAt(pos) == '.';
        if (fractional) {
            pos++;
            skip(Character::isDigit);
        }

        String text = input.substring(start, pos);
        try {
            Object value = fractional ? (Object) Double.valueOf(text) : (Object) Long.valueOf(text);
            return new Token(TokenType.NUMBER, text, value, start);
        } catch (NumberFormatException e) {
            throw error("Invalid number '" + text + "'", start);
        }
    }

    private Token quoted(char quote) {
        int start = pos++;
        StringBuilder value = new StringBuilder();
        while (pos < input.length()) {
            char c = input.charAt(pos++);
            if (c == quote) {
                return new Token(TokenType.STRING, value.toString(), value.toString(), start);
            }
            if (c == ExpressionConfig.ESCAPE && pos < input.length()) {
                c = input.charAt(pos++);
            }
            value.append(c);
        }
        throw error("Unterminated string", start);
    }

    private boolean startsNumber(char c) {
        if (Character.isDigit(c)) {
            return true;
        }
        if (c != '-' && c != '.') {
            return false;
        }
        return pos + 1 < input.length() && (Character.isDigit(input.charAt(pos + 1)) || input.charAt(pos + 1) == '.');
    }

    private void skip(IntPredicate accept) {
        while (pos < input.length() && accept.test(input.charAt(pos))) {
            pos++;
        }
    }

    private ConfigurationException error(String message, int position) {
        return new ConfigurationException("Invalid condition at position "
                + position + ": " + message + " in '" + input + "'");
    }
}
