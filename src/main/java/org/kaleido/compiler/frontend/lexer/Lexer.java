package org.kaleido.compiler.frontend.lexer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.util.Optional;

/**
 * The Lexer (also known as Tokenizer or Scanner) converts a character stream into a lazy
 * sequence of tokens. Each call to {@link #nextToken()} reads just enough characters to
 * produce one token and keeps exactly one character of lookahead between calls.
 * <p>
 * The lexer never throws: every character produces some token, numbers are converted
 * best-effort, and once the end of the input is reached every further call returns
 * another {@link TokenType#END_OF_FILE} token. A failing reader also ends the token stream;
 * the failure is kept and available from {@link #readFailure()}.
 */
public class Lexer {

    private static final Logger LOG = LoggerFactory.getLogger(Lexer.class);
    private static final int EOF = -1;

    private final Reader input;
    private final String logicalFileName;

    private int lastChar = ' ';
    private boolean exhausted = false;
    private IOException readFailure;
    private int line = 1;
    private int column = 0;
    private int tokenLine;
    private int tokenColumn;

    /**
     * Creates a new Lexer over an in-memory source.
     * @param source The source code as a single string.
     */
    public Lexer(String source) {
        this(new StringReader(source), "<memory>");
    }

    /**
     * Creates a new Lexer with an explicit logical file name.
     * @param input The character stream to tokenize. It is read one character at a time.
     * @param logicalFileName The name of the input, for error reporting.
     */
    public Lexer(Reader input, String logicalFileName) {
        this.input = input;
        this.logicalFileName = logicalFileName;
    }

    /**
     * Reads the next token from the input, advancing the read position.
     * @return The next token; {@link TokenType#END_OF_FILE} once the input is exhausted.
     */
    public Token nextToken() {
        while (true) {
            while (isSpace(lastChar)) {
                lastChar = read();
            }
            if (lastChar != '#') {
                break;
            }
            // A comment goes until the end of the line.
            do {
                lastChar = read();
            } while (lastChar != EOF && lastChar != '\n' && lastChar != '\r');
        }
        tokenLine = line;
        tokenColumn = column;

        if (isAlpha(lastChar)) {
            return identifier();
        }
        if (isDigit(lastChar) || lastChar == '.') {
            return number();
        }
        if (lastChar == EOF) {
            return new Token(TokenType.END_OF_FILE, "", null, tokenLine, tokenColumn, logicalFileName);
        }

        char thisChar = (char) lastChar;
        lastChar = read();
        return new Token(TokenType.CHAR, String.valueOf(thisChar), thisChar, tokenLine, tokenColumn, logicalFileName);
    }

    /**
     * @return The I/O error that ended the input early, or empty if the input ended normally
     *         or has not ended yet.
     */
    public Optional<IOException> readFailure() {
        return Optional.ofNullable(readFailure);
    }

    private Token identifier() {
        StringBuilder text = new StringBuilder();
        text.append((char) lastChar);
        while (isAlphaNumeric(lastChar = read())) {
            text.append((char) lastChar);
        }

        String identifier = text.toString();
        TokenType type = switch (identifier) {
            case "def" -> TokenType.DEF;
            case "extern" -> TokenType.EXTERN;
            default -> TokenType.IDENTIFIER;
        };
        return new Token(type, identifier, null, tokenLine, tokenColumn, logicalFileName);
    }

    private Token number() {
        StringBuilder text = new StringBuilder();
        do {
            text.append((char) lastChar);
            lastChar = read();
        } while (isDigit(lastChar) || lastChar == '.');

        String numberString = text.toString();
        return new Token(TokenType.NUMBER, numberString, parseDecimalPrefix(numberString), tokenLine, tokenColumn, logicalFileName);
    }

    /**
     * Converts the longest leading {@code digits[.digits]} part of the text to a double,
     * ignoring whatever follows it. Text without any digit in that part converts to 0.0.
     * The conversion does not depend on the default locale.
     *
     * @param text A run of digits and dots, e.g. "3.14" or the malformed "3.4.5".
     * @return The converted value.
     */
    static double parseDecimalPrefix(String text) {
        int end = 0;
        boolean sawDigit = false;
        while (end < text.length() && isDigit(text.charAt(end))) {
            end++;
            sawDigit = true;
        }
        if (end < text.length() && text.charAt(end) == '.') {
            end++;
            while (end < text.length() && isDigit(text.charAt(end))) {
                end++;
                sawDigit = true;
            }
        }
        if (!sawDigit) {
            return 0.0;
        }
        return Double.parseDouble(text.substring(0, end));
    }

    private int read() {
        if (exhausted) {
            return EOF;
        }
        int c;
        try {
            c = input.read();
        } catch (IOException e) {
            LOG.warn("Failed to read from '{}', ending input: {}", logicalFileName, e.toString());
            readFailure = e;
            c = EOF;
        }
        if (c == EOF) {
            exhausted = true;
            return EOF;
        }
        if (c == '\n') {
            line++;
            column = 0;
        } else {
            column++;
        }
        return c;
    }

    private static boolean isSpace(int c) {
        return c == ' ' || c == '\t' || c == '\n' || c == '\r' || c == '\u000B' || c == '\f';
    }

    private static boolean isDigit(int c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isAlpha(int c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static boolean isAlphaNumeric(int c) {
        return isAlpha(c) || isDigit(c);
    }
}
