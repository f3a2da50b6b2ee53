package com.filterduck.filter;

import com.filterduck.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("Null Semantics Tests")
class NullSemanticsTest {

    @ParameterizedTest(name = "negated={0}, containsNull={1} -> {2}")
    @CsvSource({
        "false, false, false",
        "false, true,  true",
        "true,  false, true",
        "true,  true,  false"
    })
    @DisplayName("Guard truth table")
    void testTruthTable(boolean negated, boolean containsNull, boolean expected) {
        assertThat(NullSemantics.isNeedNullCheck(negated, containsNull)).isEqualTo(expected);
    }
}
