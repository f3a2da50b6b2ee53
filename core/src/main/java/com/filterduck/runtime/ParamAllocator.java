package com.filterduck.runtime;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Allocates bind parameters for one SQL statement.
 *
 * <p>Each call to {@link #allocate} records the value and returns the next
 * placeholder. Positions only ever grow, so the values returned by
 * {@link #params()} line up with the placeholders in the order they were
 * handed out.
 *
 * <p>Not thread-safe. Use one allocator per statement being compiled;
 * concurrent compiles of different statements need separate allocators.
 */
public final class ParamAllocator {

    private final PlaceholderStyle style;
    private final List<String> params = new ArrayList<>();

    public ParamAllocator() {
        this(PlaceholderStyle.POSITIONAL);
    }

    public ParamAllocator(PlaceholderStyle style) {
        this.style = Objects.requireNonNull(style, "style must not be null");
    }

    /**
     * Records a parameter value and returns its placeholder.
     *
     * @param value the literal value (never null: SQL NULL is rendered inline)
     * @return the placeholder to embed in SQL
     */
    public String allocate(String value) {
        Objects.requireNonNull(value, "value must not be null");
        params.add(value);
        return style.placeholder(params.size());
    }

    /**
     * Returns the allocated values in allocation order.
     *
     * @return an immutable copy of the parameter values
     */
    public List<String> params() {
        return List.copyOf(params);
    }

    public int size() {
        return params.size();
    }

    public PlaceholderStyle style() {
        return style;
    }

    @Override
    public String toString() {
        return "ParamAllocator(" + style + ", " + params.size() + " params)";
    }
}
