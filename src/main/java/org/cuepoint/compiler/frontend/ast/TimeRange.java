package org.cuepoint.compiler.frontend.ast;

/**
 * The timing clause of an {@code at} event.
 */
public sealed interface TimeRange permits TimeRange.SpanRange, TimeRange.PointRange {

    /**
     * {@code at T1..T2}.
     */
    record SpanRange(TimeExpression start, TimeExpression end) implements TimeRange {}

    /**
     * {@code at T for D}.
     */
    record PointRange(TimeExpression start, TimeExpression duration) implements TimeRange {}
}
