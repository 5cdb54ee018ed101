package org.kaleido.compiler.frontend.parser;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigValue;
import org.kaleido.compiler.frontend.lexer.Token;
import org.kaleido.compiler.frontend.lexer.TokenType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps single-character binary operators to their precedence. Higher binds tighter;
 * operators of equal precedence associate to the left.
 */
public final class PrecedenceTable {

    /** Precedence of every token that is not a registered binary operator. */
    public static final int NOT_AN_OPERATOR = -1;

    private final Map<Character, Integer> precedences;

    private PrecedenceTable(Map<Character, Integer> precedences) {
        this.precedences = Collections.unmodifiableMap(new LinkedHashMap<>(precedences));
    }

    /**
     * @return The table of the language: {@code <} 10, {@code +} 20, {@code -} 20, {@code *} 40.
     */
    public static PrecedenceTable defaults() {
        Map<Character, Integer> map = new LinkedHashMap<>();
        map.put('<', 10);
        map.put('+', 20);
        map.put('-', 20);
        map.put('*', 40);
        return new PrecedenceTable(map);
    }

    /**
     * Creates a table from explicit operator precedences.
     *
     * @param precedences Operator to precedence; every precedence must be positive.
     * @return The table.
     * @throws IllegalArgumentException if a precedence is not positive or an operator is not ASCII.
     */
    public static PrecedenceTable of(Map<Character, Integer> precedences) {
        precedences.forEach((op, prec) -> {
            if (prec == null || prec <= 0) {
                throw new IllegalArgumentException("Precedence of '" + op + "' must be positive, got " + prec);
            }
            if (op > 127) {
                throw new IllegalArgumentException("Operator '" + op + "' is not an ASCII character");
            }
        });
        return new PrecedenceTable(precedences);
    }

    /**
     * Reads a table from a config object whose keys are single operator characters and
     * whose values are positive integers, e.g. {@code { "<" = 10, "+" = 20 }}.
     *
     * @param config The config object holding the operators.
     * @return The table.
     * @throws ConfigException.BadValue if a key is not a single character or a value is not a positive integer.
     */
    public static PrecedenceTable fromConfig(Config config) {
        Map<Character, Integer> map = new LinkedHashMap<>();
        for (Map.Entry<String, ConfigValue> entry : config.root().entrySet()) {
            String key = entry.getKey();
            if (key.length() != 1 || key.charAt(0) > 127) {
                throw new ConfigException.BadValue(entry.getValue().origin(), key,
                        "operator must be a single ASCII character");
            }
            Object raw = entry.getValue().unwrapped();
            if (!(raw instanceof Number number) || number.intValue() <= 0 || number.doubleValue() != number.intValue()) {
                throw new ConfigException.BadValue(entry.getValue().origin(), key,
                        "precedence must be a positive integer, got " + raw);
            }
            map.put(key.charAt(0), number.intValue());
        }
        return new PrecedenceTable(map);
    }

    /**
     * Looks up the precedence of the binary operator a token stands for.
     *
     * @param token The token to classify.
     * @return The precedence, or {@link #NOT_AN_OPERATOR} if the token is not a registered operator.
     */
    public int precedenceOf(Token token) {
        if (token.type() != TokenType.CHAR) {
            return NOT_AN_OPERATOR;
        }
        return precedenceOf(token.charValue());
    }

    /**
     * @param operator The operator character.
     * @return The precedence, or {@link #NOT_AN_OPERATOR} if the character is not registered.
     */
    public int precedenceOf(char operator) {
        Integer prec = precedences.get(operator);
        if (prec == null || prec <= 0) {
            return NOT_AN_OPERATOR;
        }
        return prec;
    }

    /**
     * @return An unmodifiable view of all registered operators and their precedences.
     */
    public Map<Character, Integer> asMap() {
        return precedences;
    }

    @Override
    public String toString() {
        return "PrecedenceTable" + precedences;
    }
}
