package com.filterduck.filter;

import com.filterduck.expression.ColumnMember;
import com.filterduck.expression.ResolutionContext;
import com.filterduck.test.TestBase;
import com.filterduck.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@TestCategories.Tier1
@TestCategories.Unit
@TestCategories.Filter
@DisplayName("Filter Node Tests")
public class FilterNodeTest extends TestBase {

    @Nested
    @DisplayName("Value Shape")
    class ValueShapeTests {

        @Test
        @DisplayName("Array value means more than one element")
        void testIsArrayValue() {
            assertThat(filter(FilterOperator.EQUAL).isArrayValue()).isFalse();
            assertThat(filter(FilterOperator.EQUAL, "a").isArrayValue()).isFalse();
            assertThat(filter(FilterOperator.EQUAL, "a", null).isArrayValue()).isTrue();
        }

        @Test
        @DisplayName("NULL element is detected, empty list is not NULL")
        void testContainsNull() {
            assertThat(filter(FilterOperator.EQUAL).isValuesContainsNull()).isFalse();
            assertThat(filter(FilterOperator.EQUAL, "a", "b").isValuesContainsNull()).isFalse();
            assertThat(filter(FilterOperator.EQUAL, "a", null).isValuesContainsNull()).isTrue();
        }

        @Test
        @DisplayName("Allocation skips NULLs and keeps order")
        void testFilterAndAllocateValues() {
            List<String> placeholders = filter(FilterOperator.IN, "x", null, "y").filterAndAllocateValues();

            assertThat(placeholders).containsExactly("?", "?");
            assertThat(params()).containsExactly("x", "y");
        }

        @Test
        @DisplayName("Null value list is an empty list")
        void testNullValueList() {
            FilterNode node = new FilterNode(tools, status(), FilterKind.DIMENSION, FilterOperator.SET, null);

            assertThat(node.values()).isEmpty();
            assertThat(node.toSQL(ResolutionContext.empty())).isEqualTo("status IS NOT NULL");
        }

        @Test
        @DisplayName("Values are copied and read-only")
        void testValuesAreImmutable() {
            List<String> source = new ArrayList<>(List.of("a"));
            FilterNode node = filter(status(), FilterOperator.IN, source.toArray(new String[0]));
            FilterNode copied = new FilterNode(tools, status(), FilterKind.DIMENSION, FilterOperator.IN, source);
            source.add("b");

            assertThat(copied.values()).containsExactly("a");
            assertThatThrownBy(() -> node.values().add("c"))
                .isInstanceOf(UnsupportedOperationException.class);
        }
    }

    @Nested
    @DisplayName("Equality")
    class EqualityTests {

        @Test
        @DisplayName("Member is ignored by equality")
        void testEqualityIgnoresMember() {
            FilterNode a = filter(ColumnMember.of("orders.status", "status"), FilterOperator.IN, "x", null);
            FilterNode b = filter(ColumnMember.of("users.city", "city"), FilterOperator.IN, "x", null);

            assertThat(a).isEqualTo(b);
            assertThat(a.hashCode()).isEqualTo(b.hashCode());
        }

        @Test
        @DisplayName("Kind, operator and values distinguish nodes")
        void testEqualityUsesKindOperatorValues() {
            FilterNode base = filter(FilterOperator.IN, "x");

            assertThat(base).isNotEqualTo(filter(FilterOperator.NOT_IN, "x"));
            assertThat(base).isNotEqualTo(filter(FilterOperator.IN, "y"));
            assertThat(base).isNotEqualTo(filter(FilterOperator.IN, "x", null));
            assertThat(base).isNotEqualTo(
                new FilterNode(tools, status(), FilterKind.MEASURE, FilterOperator.IN, list("x")));
        }
    }

    @Nested
    @DisplayName("Deriving Nodes")
    class WithOperatorTests {

        @Test
        @DisplayName("withOperator returns a new node and leaves the source unchanged")
        void testWithOperator() {
            FilterNode source = filter(FilterOperator.EQUAL, "a");

            FilterNode derived = source.withOperator(FilterOperator.NOT_IN, list("b", null));

            assertThat(derived.operator()).isEqualTo(FilterOperator.NOT_IN);
            assertThat(derived.values()).containsExactly("b", null);
            assertThat(derived.member()).isSameAs(source.member());
            assertThat(derived.kind()).isEqualTo(source.kind());
            assertThat(source.operator()).isEqualTo(FilterOperator.EQUAL);
            assertThat(source.values()).containsExactly("a");
        }

        @Test
        @DisplayName("Derived node shares the statement's allocator")
        void testDerivedSharesTools() {
            FilterNode source = filter(FilterOperator.EQUAL, "a");
            source.toSQL(ResolutionContext.empty());

            source.withOperator(FilterOperator.EQUAL, list("b")).toSQL(ResolutionContext.empty());

            assertThat(params()).containsExactly("a", "b");
        }

        @Test
        @DisplayName("Member name comes from the member")
        void testMemberName() {
            assertThat(filter(FilterOperator.SET).memberName()).isEqualTo("orders.status");
        }
    }
}
