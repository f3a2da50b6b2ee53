package com.filterduck.generator;

import com.filterduck.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("SQL Quoting Tests")
class SQLQuotingTest {

    @ParameterizedTest
    @CsvSource({
        "status, status",
        "_private, _private",
        "order, \"order\"",
        "Order Date, \"Order Date\"",
        "1st, \"1st\"",
        "a\"b, \"a\"\"b\""
    })
    @DisplayName("Identifiers are quoted only when needed")
    void testQuoteIdentifierIfNeeded(String identifier, String expected) {
        assertThat(SQLQuoting.quoteIdentifierIfNeeded(identifier)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Empty identifiers are rejected")
    void testEmptyIdentifier() {
        assertThatThrownBy(() -> SQLQuoting.quoteIdentifier(""))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SQLQuoting.quoteIdentifierIfNeeded(null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Literals escape single quotes")
    void testQuoteLiteral() {
        assertThat(SQLQuoting.quoteLiteral("O'Reilly")).isEqualTo("'O''Reilly'");
        assertThat(SQLQuoting.quoteLiteral(null)).isEqualTo("NULL");
    }

    @ParameterizedTest
    @ValueSource(strings = {"1 day", "2 weeks", "1 year 2 months", "-3 hour", " 5 minute "})
    @DisplayName("Amount/unit intervals are accepted")
    void testValidIntervals(String interval) {
        assertThat(SQLQuoting.isValidInterval(interval)).isTrue();
        assertThat(SQLQuoting.quoteInterval(interval)).isEqualTo("'" + interval.trim() + "'");
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "day", "1", "1day", "1 day'", "1 day; drop table x", "unbounded"})
    @DisplayName("Anything else is rejected")
    void testInvalidIntervals(String interval) {
        assertThat(SQLQuoting.isValidInterval(interval)).isFalse();
        assertThatThrownBy(() -> SQLQuoting.quoteInterval(interval))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Invalid interval");
    }
}
