package org.cuepoint.compiler.frontend.ast;

import org.cuepoint.compiler.api.SourceInfo;

import java.util.List;

/**
 * A timeline declaration.
 *
 * @param name              The timeline name.
 * @param provider          The provider keyword as written ({@code video}, {@code audio}, {@code raf}, {@code custom}).
 * @param containerSelector The container element selector.
 * @param sourceFile        The media source file, or {@code null}.
 * @param events            The events in source order.
 * @param source            The source position.
 */
public record Timeline(
        String name,
        String provider,
        String containerSelector,
        String sourceFile,
        List<TimelineEvent> events,
        SourceInfo source
) implements AstNode {
    public Timeline {
        events = events != null ? List.copyOf(events) : List.of();
    }
}
