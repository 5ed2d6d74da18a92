package com.coa.config.expression;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Vocabulary of the condition expression language.
 */
public final class ExpressionConfig {

    private ExpressionConfig() {
    }

    /**
     * Word operators and literals, matched case-insensitively.
     */
    public static final Map<String, TokenType> KEYWORDS = Map.of(
            "AND", TokenType.AND,
            "OR", TokenType.OR,
            "NOT", TokenType.NOT,
            "TRUE", TokenType.BOOLEAN,
            "FALSE", TokenType.BOOLEAN
    );

    /**
     * Symbol operators. Two-character symbols come first so that {@code >=} is not read as {@code >}.
     */
    public static final Map<String, TokenType> SYMBOLS = symbols();

    public static final char ESCAPE = '\\';

    private static Map<String, TokenType> symbols() {
        Map<String, TokenType> symbols = new LinkedHashMap<>();
        symbols.put("==", TokenType.EQ);
        symbols.put("!=", TokenType.NE);
        symbols.put(">=", TokenType.GTE);
        symbols.put("<=", TokenType.LTE);
        symbols.put("=", TokenType.EQ);
        symbols.put(">", TokenType.GT);
        symbols.put("<", TokenType.LT);
        symbols.put("(", TokenType.LPAREN);
        symbols.put(")", TokenType.RPAREN);
        return Collections.unmodifiableMap(symbols);
    }
}
