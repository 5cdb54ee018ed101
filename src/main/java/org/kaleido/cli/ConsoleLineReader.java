package org.kaleido.cli;

import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.UserInterruptException;

import java.io.Reader;

/**
 * Exposes an interactive JLine console as a character stream. A new line is requested,
 * with the prompt shown, only when the characters of the previous line are used up.
 * Ctrl-D ends the stream; Ctrl-C discards the line being typed.
 */
public class ConsoleLineReader extends Reader {

    private final LineReader lineReader;
    private final String prompt;
    private String buffer = "";
    private int position = 0;
    private boolean closed = false;

    /**
     * @param lineReader The console to read lines from.
     * @param prompt The prompt shown before each line.
     */
    public ConsoleLineReader(LineReader lineReader, String prompt) {
        this.lineReader = lineReader;
        this.prompt = prompt;
    }

    @Override
    public int read(char[] cbuf, int off, int len) {
        if (len == 0) {
            return 0;
        }
        while (position >= buffer.length()) {
            if (closed || !fill()) {
                closed = true;
                return -1;
            }
        }
        int count = Math.min(len, buffer.length() - position);
        buffer.getChars(position, position + count, cbuf, off);
        position += count;
        return count;
    }

    private boolean fill() {
        while (true) {
            try {
                String line = lineReader.readLine(prompt);
                if (line == null) {
                    return false;
                }
                buffer = line + "\n";
                position = 0;
                return true;
            } catch (UserInterruptException e) {
                // Ctrl-C abandons the current line only; ask again.
            } catch (EndOfFileException e) {
                return false;
            }
        }
    }

    @Override
    public void close() {
        closed = true;
    }
}
