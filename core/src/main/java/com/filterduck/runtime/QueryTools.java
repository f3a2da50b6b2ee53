package com.filterduck.runtime;

import com.filterduck.expression.DefaultExpressionResolver;
import com.filterduck.expression.ExpressionResolver;
import com.filterduck.generator.FilterTemplates;

import java.util.Objects;

/**
 * The collaborators a filter needs to compile, bundled per statement.
 *
 * <p>Filters hold a reference to the bundle and never copy its state. The
 * resolver, templates and time settings may be shared between statements;
 * the {@link ParamAllocator} belongs to a single statement, so build a new
 * bundle (e.g. via {@link #fromConfig}) for each statement compiled.
 */
public final class QueryTools {

    private final ExpressionResolver resolver;
    private final FilterTemplates templates;
    private final ParamAllocator paramAllocator;
    private final TimeSettings timeSettings;

    public QueryTools(ExpressionResolver resolver, FilterTemplates templates,
                      ParamAllocator paramAllocator, TimeSettings timeSettings) {
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
        this.templates = Objects.requireNonNull(templates, "templates must not be null");
        this.paramAllocator = Objects.requireNonNull(paramAllocator, "paramAllocator must not be null");
        this.timeSettings = Objects.requireNonNull(timeSettings, "timeSettings must not be null");
    }

    /**
     * Creates a bundle for one statement from configuration, using the
     * default member resolver and a fresh parameter allocator.
     *
     * @param config the configuration
     * @return the tools
     */
    public static QueryTools fromConfig(FilterCompilerConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        return new QueryTools(
            DefaultExpressionResolver.get(),
            config.dialect().templates(),
            new ParamAllocator(config.placeholderStyle()),
            new ZoneTimeSettings(config.timestampPrecision(), config.queryTimeZone(),
                                 config.databaseTimeZone()));
    }

    public ExpressionResolver resolver() {
        return resolver;
    }

    public FilterTemplates templates() {
        return templates;
    }

    public ParamAllocator paramAllocator() {
        return paramAllocator;
    }

    public TimeSettings timeSettings() {
        return timeSettings;
    }

    /**
     * Allocates a bind parameter on this statement's allocator.
     *
     * @param value the literal value
     * @return the placeholder
     */
    public String allocateParam(String value) {
        return paramAllocator.allocate(value);
    }
}
