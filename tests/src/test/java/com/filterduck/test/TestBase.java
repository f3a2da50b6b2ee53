package com.filterduck.test;

import com.filterduck.expression.ColumnMember;
import com.filterduck.expression.MemberSymbol;
import com.filterduck.filter.FilterKind;
import com.filterduck.filter.FilterNode;
import com.filterduck.filter.FilterOperator;
import com.filterduck.generator.SqlDialect;
import com.filterduck.runtime.FilterCompilerConfig;
import com.filterduck.runtime.QueryTools;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;

/**
 * Base class for filter tests.
 *
 * <p>Gives each test a fresh {@link QueryTools} (PostgreSQL templates,
 * positional placeholders, precision 3, UTC) and helpers to build filters
 * on a {@code status} column.
 */
public abstract class TestBase {

    protected final Logger logger = LoggerFactory.getLogger(getClass());

    protected QueryTools tools;

    @BeforeEach
    protected void initTools(TestInfo testInfo) {
        logger.debug("Running {}", testInfo.getDisplayName());
        tools = QueryTools.fromConfig(FilterCompilerConfig.defaults());
    }

    /**
     * Logs a Given/When/Then step.
     *
     * @param step the step description
     */
    protected void logStep(String step) {
        logger.info("  {}", step);
    }

    protected void useConfig(FilterCompilerConfig config) {
        tools = QueryTools.fromConfig(config);
    }

    protected void useDialect(SqlDialect dialect) {
        useConfig(FilterCompilerConfig.defaults().withDialect(dialect));
    }

    protected static MemberSymbol status() {
        return ColumnMember.of("orders.status", "status");
    }

    protected FilterNode filter(FilterOperator operator, String... values) {
        return filter(status(), operator, values);
    }

    protected FilterNode filter(MemberSymbol member, FilterOperator operator, String... values) {
        return new FilterNode(tools, member, FilterKind.DIMENSION, operator, list(values));
    }

    /**
     * Builds a list that may contain nulls.
     *
     * @param values the values
     * @return a mutable list
     */
    protected static List<String> list(String... values) {
        return Arrays.asList(values);
    }

    protected List<String> params() {
        return tools.paramAllocator().params();
    }
}
