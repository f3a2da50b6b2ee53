package com.filterduck.exception;

import com.filterduck.exception.FilterCompilationException.ErrorKind;
import com.filterduck.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.*;

@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("Filter Compilation Exception Tests")
class FilterCompilationExceptionTest {

    @ParameterizedTest
    @EnumSource(ErrorKind.class)
    @DisplayName("Every kind has a user message carrying the raw message")
    void testUserMessage(ErrorKind kind) {
        FilterCompilationException e = new FilterCompilationException(kind, "boom", "orders.status");

        assertThat(e.getUserMessage()).isNotBlank().contains("boom");
        assertThat(e.getKind()).isEqualTo(kind);
    }

    @Test
    @DisplayName("User message names the member when known")
    void testUserMessageMember() {
        FilterCompilationException e = new FilterCompilationException(
            ErrorKind.ARGUMENT_COUNT, "Expected one parameter but nothing found", "orders.amount");

        assertThat(e.getUserMessage())
            .isEqualTo("Filter on 'orders.amount' has too few values: Expected one parameter but nothing found");
    }

    @Test
    @DisplayName("Technical message lists kind, member and cause")
    void testTechnicalMessage() {
        FilterCompilationException e = new FilterCompilationException(
            ErrorKind.CONFIGURATION, "bad zone", null, new IllegalStateException("Unknown time-zone ID"));

        assertThat(e.getTechnicalMessage())
            .contains("Kind: CONFIGURATION")
            .contains("Error: bad zone")
            .contains("Cause: Unknown time-zone ID")
            .doesNotContain("Member:");
        assertThat(e.getCause()).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Factories set the kind")
    void testFactories() {
        assertThat(FilterCompilationException.argumentCount("x").getKind()).isEqualTo(ErrorKind.ARGUMENT_COUNT);
        assertThat(FilterCompilationException.template("x").getKind()).isEqualTo(ErrorKind.TEMPLATE);

        FilterCompilationException resolution = FilterCompilationException.resolution("x", "m");
        assertThat(resolution.getKind()).isEqualTo(ErrorKind.RESOLUTION);
        assertThat(resolution.getMemberName()).isEqualTo("m");
    }
}
