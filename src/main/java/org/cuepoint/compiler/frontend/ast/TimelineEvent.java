package org.cuepoint.compiler.frontend.ast;

import org.cuepoint.compiler.api.SourceInfo;

import java.util.List;

/**
 * The events a timeline may contain.
 */
public sealed interface TimelineEvent extends AstNode
        permits TimelineEvent.TimedEvent, TimelineEvent.SequenceBlock, TimelineEvent.StaggerBlock {

    /**
     * {@code at 0s..5s fadeIn()} or {@code at 2s for 1s [ ... ] [ ... ]}.
     */
    record TimedEvent(TimeRange range, EventBody body, SourceInfo source) implements TimelineEvent {}

    /**
     * {@code sequence { a() for 1s  b() for 2s }}; steps run back to back.
     */
    record SequenceBlock(List<SequenceItem> items, SourceInfo source) implements TimelineEvent {
        public SequenceBlock {
            items = items != null ? List.copyOf(items) : List.of();
        }
    }

    /**
     * One step of a sequence.
     */
    record SequenceItem(EventBody body, TimeExpression duration, SourceInfo source) implements AstNode {}

    /**
     * {@code stagger 200ms items with highlight() for 1s}; one action per item, each offset by the delay.
     */
    record StaggerBlock(
            TimeExpression delay,
            List<Expression> items,
            EventBody body,
            TimeExpression duration,
            SourceInfo source
    ) implements TimelineEvent {
        public StaggerBlock {
            items = items != null ? List.copyOf(items) : List.of();
        }
    }
}
