package org.kaleido.compiler.frontend.parser;

import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.kaleido.compiler.frontend.lexer.Lexer;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class PrecedenceTableTest {

    @Test
    @Tag("unit")
    void testDefaultOperators() {
        PrecedenceTable table = PrecedenceTable.defaults();

        assertThat(table.precedenceOf('<')).isEqualTo(10);
        assertThat(table.precedenceOf('+')).isEqualTo(20);
        assertThat(table.precedenceOf('-')).isEqualTo(20);
        assertThat(table.precedenceOf('*')).isEqualTo(40);
        assertThat(table.precedenceOf('/')).isEqualTo(PrecedenceTable.NOT_AN_OPERATOR);
        assertThat(table.asMap()).containsOnlyKeys('<', '+', '-', '*');
    }

    /**
     * Verifies that only single-character tokens can be operators.
     */
    @Test
    @Tag("unit")
    void testNonCharTokensAreNotOperators() {
        Lexer lexer = new Lexer("plus 20 +");
        PrecedenceTable table = PrecedenceTable.defaults();

        assertThat(table.precedenceOf(lexer.nextToken())).isEqualTo(PrecedenceTable.NOT_AN_OPERATOR);
        assertThat(table.precedenceOf(lexer.nextToken())).isEqualTo(PrecedenceTable.NOT_AN_OPERATOR);
        assertThat(table.precedenceOf(lexer.nextToken())).isEqualTo(20);
        assertThat(table.precedenceOf(lexer.nextToken())).isEqualTo(PrecedenceTable.NOT_AN_OPERATOR);
    }

    @Test
    @Tag("unit")
    void testOfRejectsNonPositivePrecedence() {
        assertThatThrownBy(() -> PrecedenceTable.of(Map.of('+', 0)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("'+'");
    }

    @Test
    @Tag("unit")
    void testFromConfig() {
        PrecedenceTable table = PrecedenceTable.fromConfig(
                ConfigFactory.parseString("\"<\" = 10, \"+\" = 20, \"/\" = 40"));

        assertThat(table.asMap()).containsOnly(
                Map.entry('<', 10), Map.entry('+', 20), Map.entry('/', 40));
    }

    /**
     * Verifies that malformed operator entries are reported as bad config values.
     */
    @ParameterizedTest
    @Tag("unit")
    @ValueSource(strings = {
            "\"<<\" = 10",
            "\"+\" = 0",
            "\"+\" = -5",
            "\"+\" = 2.5",
            "\"+\" = \"high\""
    })
    void testFromConfigRejectsBadEntries(String hocon) {
        assertThatThrownBy(() -> PrecedenceTable.fromConfig(ConfigFactory.parseString(hocon)))
                .isInstanceOf(ConfigException.BadValue.class);
    }
}
