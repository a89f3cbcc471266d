package org.cuepoint.compiler.frontend.semantics.analysis;

import org.cuepoint.compiler.api.DiagnosticCode;
import org.cuepoint.compiler.diagnostics.DiagnosticsEngine;
import org.cuepoint.compiler.frontend.semantics.ValidationContext;
import org.cuepoint.compiler.ir.IrTimeline;

import java.util.regex.Pattern;

/**
 * Checks timeline declarations: at least one timeline per document, media providers with a source,
 * other providers without one, a well-formed container selector and at least one event.
 */
public class TimelineValidationHandler implements IValidationHandler {

    private static final Pattern CONTAINER_SELECTOR = Pattern.compile("^[#.\\w\\-:\\[\\]]+$");

    @Override
    public void validate(ValidationContext ctx, DiagnosticsEngine diagnostics) {
        if (ctx.document().timelines().isEmpty()) {
            diagnostics.report(DiagnosticCode.MISSING_TIMELINE,
                    "Document must declare at least one timeline", null);
            return;
        }
        for (IrTimeline timeline : ctx.document().timelines()) {
            String provider = timeline.provider().keyword();
            boolean hasSource = timeline.mediaSource() != null && !timeline.mediaSource().isBlank();

            if (timeline.provider().requiresSource() && !hasSource) {
                diagnostics.report(DiagnosticCode.MISSING_TIMELINE_SOURCE,
                        "Timeline provider '" + provider + "' requires a source file",
                        timeline.source());
            } else if (!timeline.provider().requiresSource() && hasSource) {
                diagnostics.report(DiagnosticCode.UNUSED_TIMELINE_SOURCE,
                        "Timeline provider '" + provider + "' does not use a source file, '" + timeline.mediaSource() + "' is ignored",
                        timeline.source());
            }

            String selector = timeline.containerSelector();
            if (selector == null || !CONTAINER_SELECTOR.matcher(selector).matches()) {
                diagnostics.report(DiagnosticCode.INVALID_CONTAINER_SELECTOR,
                        "Invalid container selector '" + selector + "' for timeline '" + timeline.name() + "'",
                        timeline.source());
            }

            if (timeline.actions().isEmpty()) {
                diagnostics.report(DiagnosticCode.EMPTY_TIMELINE,
                        "Timeline '" + timeline.name() + "' has no events",
                        timeline.source());
            }
        }
    }
}
