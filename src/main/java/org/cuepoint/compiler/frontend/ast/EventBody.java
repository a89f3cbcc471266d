package org.cuepoint.compiler.frontend.ast;

import java.util.List;

/**
 * What a timeline event does: either a single action call or inline start/end operation blocks.
 *
 * @param startCalls Calls run when the event starts.
 * @param endCalls   Calls run when the event ends.
 */
public record EventBody(List<OperationCall> startCalls, List<OperationCall> endCalls) {
    public EventBody {
        startCalls = startCalls != null ? List.copyOf(startCalls) : List.of();
        endCalls = endCalls != null ? List.copyOf(endCalls) : List.of();
    }

    /**
     * @param call The single call.
     * @return A body that only has a start call.
     */
    public static EventBody of(OperationCall call) {
        return new EventBody(List.of(call), List.of());
    }
}
