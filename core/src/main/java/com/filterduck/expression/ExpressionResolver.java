package com.filterduck.expression;

import com.filterduck.exception.FilterCompilationException;

/**
 * Turns a member into the SQL text a filter compares against.
 */
@FunctionalInterface
public interface ExpressionResolver {

    /**
     * Resolves a member in the given context.
     *
     * @param member the member to resolve
     * @param context the resolution context
     * @return the SQL text for the member
     * @throws FilterCompilationException with kind RESOLUTION if the member
     *         cannot be resolved in this context
     */
    String resolve(MemberSymbol member, ResolutionContext context);
}
