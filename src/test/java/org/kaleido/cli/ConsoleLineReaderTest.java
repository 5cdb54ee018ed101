package org.kaleido.cli;

import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.UserInterruptException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.io.Reader;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Contains unit tests for the {@link ConsoleLineReader} with a mocked JLine console.
 */
@ExtendWith(MockitoExtension.class)
public class ConsoleLineReaderTest {

    @Mock
    private LineReader lineReader;

    private static String readAll(Reader reader) throws IOException {
        StringBuilder sb = new StringBuilder();
        int c;
        while ((c = reader.read()) != -1) {
            sb.append((char) c);
        }
        return sb.toString();
    }

    @Test
    @Tag("unit")
    void testLinesAreJoinedWithNewlines() throws IOException {
        when(lineReader.readLine("ready> "))
                .thenReturn("def f(x) x")
                .thenReturn("f(1)")
                .thenThrow(new EndOfFileException());

        Reader reader = new ConsoleLineReader(lineReader, "ready> ");

        assertThat(readAll(reader)).isEqualTo("def f(x) x\nf(1)\n");
        assertThat(reader.read()).isEqualTo(-1);
        verify(lineReader, times(3)).readLine("ready> ");
    }

    /**
     * Verifies that Ctrl-C drops the line being typed and prompts again instead of ending input.
     */
    @Test
    @Tag("unit")
    void testInterruptRequestsAnotherLine() throws IOException {
        // Arrange
        when(lineReader.readLine("> "))
                .thenThrow(new UserInterruptException("partial"))
                .thenReturn("1")
                .thenReturn(null);

        // Act
        String text = readAll(new ConsoleLineReader(lineReader, "> "));

        // Assert
        assertThat(text).isEqualTo("1\n");
    }

    @Test
    @Tag("unit")
    void testClosedReaderReturnsEndOfStream() throws IOException {
        Reader reader = new ConsoleLineReader(lineReader, "> ");

        reader.close();

        assertThat(reader.read()).isEqualTo(-1);
    }
}
