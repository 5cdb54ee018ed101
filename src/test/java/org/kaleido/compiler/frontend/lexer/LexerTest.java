package org.kaleido.compiler.frontend.lexer;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link Lexer}.
 * These tests verify that the lexer turns a character stream into tokens one at a time,
 * classifying keywords, identifiers, numbers and single characters and skipping comments.
 */
public class LexerTest {

    /**
     * Verifies that a definition with a trailing comment and an extern are tokenized into the
     * expected token types and texts.
     */
    @Test
    @Tag("unit")
    void testLexerTokenization() {
        // Arrange
        Lexer lexer = new Lexer("def foo(x y) x+y # sum\nextern sin(a)");

        // Act
        List<Token> tokens = drain(lexer);

        // Assert
        assertThat(tokens).extracting(Token::type).containsExactly(
                TokenType.DEF, TokenType.IDENTIFIER, TokenType.CHAR, TokenType.IDENTIFIER, TokenType.IDENTIFIER,
                TokenType.CHAR, TokenType.IDENTIFIER, TokenType.CHAR, TokenType.IDENTIFIER,
                TokenType.EXTERN, TokenType.IDENTIFIER, TokenType.CHAR, TokenType.IDENTIFIER, TokenType.CHAR,
                TokenType.END_OF_FILE);
        assertThat(tokens).extracting(Token::text).containsExactly(
                "def", "foo", "(", "x", "y", ")", "x", "+", "y", "extern", "sin", "(", "a", ")", "");
    }

    @Test
    @Tag("unit")
    void testKeywordsAreOnlyExactMatches() {
        List<Token> tokens = drain(new Lexer("def defx extern externs x1y2"));

        assertThat(tokens).extracting(Token::type).containsExactly(
                TokenType.DEF, TokenType.IDENTIFIER, TokenType.EXTERN, TokenType.IDENTIFIER, TokenType.IDENTIFIER,
                TokenType.END_OF_FILE);
        assertThat(tokens.get(4).text()).isEqualTo("x1y2");
    }

    /**
     * Verifies that a number token keeps its full text but carries the value of the longest
     * well-formed decimal prefix.
     */
    @Test
    @Tag("unit")
    void testMalformedNumberUsesLongestPrefix() {
        // Act
        Token token = new Lexer("3.4.5").nextToken();

        // Assert
        assertThat(token.type()).isEqualTo(TokenType.NUMBER);
        assertThat(token.text()).isEqualTo("3.4.5");
        assertThat(token.numberValue()).isEqualTo(3.4);
    }

    @Test
    @Tag("unit")
    void testLoneDotIsNumberZero() {
        Token token = new Lexer(".").nextToken();

        assertThat(token.type()).isEqualTo(TokenType.NUMBER);
        assertThat(token.numberValue()).isEqualTo(0.0);
    }

    @ParameterizedTest
    @Tag("unit")
    @ValueSource(strings = {"0", "7", "42", "3.14", "0.5", ".5", "10.", "1234567.0625"})
    void testWellFormedNumeralsMatchStandardConversion(String numeral) {
        Token token = new Lexer(numeral).nextToken();

        assertThat(token.type()).isEqualTo(TokenType.NUMBER);
        assertThat(token.numberValue()).isEqualTo(Double.parseDouble(numeral));
    }

    @Test
    @Tag("unit")
    void testParseDecimalPrefix() {
        assertThat(Lexer.parseDecimalPrefix("12")).isEqualTo(12.0);
        assertThat(Lexer.parseDecimalPrefix("1.2.3")).isEqualTo(1.2);
        assertThat(Lexer.parseDecimalPrefix("..")).isEqualTo(0.0);
        assertThat(Lexer.parseDecimalPrefix("5..")).isEqualTo(5.0);
    }

    /**
     * Verifies that unknown characters are passed through as single-character tokens.
     */
    @Test
    @Tag("unit")
    void testOtherCharactersBecomeCharTokens() {
        List<Token> tokens = drain(new Lexer("+;(/!"));

        assertThat(tokens).hasSize(6);
        assertThat(tokens.subList(0, 5)).allMatch(t -> t.type() == TokenType.CHAR);
        assertThat(tokens.get(0).charValue()).isEqualTo('+');
        assertThat(tokens.get(1).isChar(';')).isTrue();
        assertThat(tokens.get(3).isChar('/')).isTrue();
        assertThat(tokens.get(4).isChar('!')).isTrue();
    }

    @Test
    @Tag("unit")
    void testCommentsAreSkipped() {
        List<Token> tokens = drain(new Lexer("# first line\r\n  x # trailing\n# only a comment"));

        assertThat(tokens).extracting(Token::type).containsExactly(TokenType.IDENTIFIER, TokenType.END_OF_FILE);
        assertThat(tokens.get(0).text()).isEqualTo("x");
    }

    /**
     * Verifies that a long run of comment lines is skipped without growing the call stack.
     */
    @Test
    @Tag("unit")
    void testManyConsecutiveCommentLines() {
        // Arrange
        Lexer lexer = new Lexer("#c\n".repeat(200_000) + "x");

        // Act
        Token token = lexer.nextToken();

        // Assert
        assertThat(token.type()).isEqualTo(TokenType.IDENTIFIER);
        assertThat(token.line()).isEqualTo(200_001);
        assertThat(lexer.nextToken().type()).isEqualTo(TokenType.END_OF_FILE);
    }

    /**
     * Verifies that the end of input is reported again on every further call.
     */
    @Test
    @Tag("unit")
    void testEndOfFileIsIdempotent() {
        // Arrange
        Lexer lexer = new Lexer("  \t\n ");

        // Act & Assert
        for (int i = 0; i < 3; i++) {
            assertThat(lexer.nextToken().type()).isEqualTo(TokenType.END_OF_FILE);
        }
    }

    @Test
    @Tag("unit")
    void testTokenPositions() {
        Lexer lexer = new Lexer(new StringReader("a\n  b"), "pos.k");

        Token a = lexer.nextToken();
        Token b = lexer.nextToken();

        assertThat(a.source().toString()).isEqualTo("pos.k:1:1");
        assertThat(b.line()).isEqualTo(2);
        assertThat(b.column()).isEqualTo(3);
        assertThat(b.fileName()).isEqualTo("pos.k");
    }

    /**
     * Verifies that a failing input stream ends the token sequence instead of throwing, and that
     * the failure stays available to the caller.
     */
    @Test
    @Tag("unit")
    void testReadFailureIsTreatedAsEndOfInput() {
        // Arrange
        IOException failure = new IOException("disk gone");
        Reader failing = new Reader() {
            @Override
            public int read(char[] cbuf, int off, int len) throws IOException {
                throw failure;
            }

            @Override
            public void close() {
            }
        };
        Lexer lexer = new Lexer(failing, "broken");

        // Act & Assert
        assertThat(lexer.readFailure()).isEmpty();
        assertThat(lexer.nextToken().type()).isEqualTo(TokenType.END_OF_FILE);
        assertThat(lexer.nextToken().type()).isEqualTo(TokenType.END_OF_FILE);
        assertThat(lexer.readFailure()).containsSame(failure);
    }

    private static List<Token> drain(Lexer lexer) {
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = lexer.nextToken();
            tokens.add(token);
        } while (token.type() != TokenType.END_OF_FILE);
        return tokens;
    }
}
