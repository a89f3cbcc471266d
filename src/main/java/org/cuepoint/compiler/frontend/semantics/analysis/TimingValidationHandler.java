package org.cuepoint.compiler.frontend.semantics.analysis;

import org.cuepoint.compiler.api.DiagnosticCode;
import org.cuepoint.compiler.diagnostics.DiagnosticsEngine;
import org.cuepoint.compiler.frontend.semantics.ValidationContext;
import org.cuepoint.compiler.ir.ActionOrigin;
import org.cuepoint.compiler.ir.IrDuration;
import org.cuepoint.compiler.ir.IrStaggerBlock;
import org.cuepoint.compiler.ir.IrTimeline;
import org.cuepoint.compiler.ir.IrTimelineAction;

import java.math.BigDecimal;

/**
 * Checks the timing of every timeline action: starts must not be negative, ranges must end after
 * they start, sequence steps need a positive duration and stagger blocks a positive delay and duration.
 * <p>
 * Stagger parameters are shared by all items of a block, so they are checked once per block, also
 * for blocks without items.
 */
public class TimingValidationHandler implements IValidationHandler {

    @Override
    public void validate(ValidationContext ctx, DiagnosticsEngine diagnostics) {
        for (IrTimeline timeline : ctx.document().timelines()) {
            for (IrTimelineAction action : timeline.actions()) {
                checkAction(action, diagnostics);
            }
            for (IrStaggerBlock block : timeline.staggerBlocks()) {
                checkStaggerBlock(block, diagnostics);
            }
        }
    }

    private void checkAction(IrTimelineAction action, DiagnosticsEngine diagnostics) {
        IrDuration d = action.duration();
        if (d.start() < 0) {
            diagnostics.report(DiagnosticCode.NEGATIVE_START_TIME,
                    "Timeline event start time cannot be negative (got " + seconds(d.start()) + ")",
                    action.source());
        }

        ActionOrigin origin = action.origin();
        if (origin instanceof ActionOrigin.SequenceStep step) {
            if (step.stepDuration() <= 0) {
                diagnostics.report(DiagnosticCode.NON_POSITIVE_SEQUENCE_DURATION,
                        "Sequence item duration must be positive (got " + seconds(step.stepDuration()) + ")",
                        action.source());
            }
        } else if (!(origin instanceof ActionOrigin.StaggerItem) && d.end() <= d.start()) {
            diagnostics.report(DiagnosticCode.INVALID_TIME_RANGE,
                    "Timeline event end time (" + seconds(d.end()) + ") must be greater than start time (" + seconds(d.start()) + ")",
                    action.source());
        }
    }

    private void checkStaggerBlock(IrStaggerBlock block, DiagnosticsEngine diagnostics) {
        if (block.delay() <= 0) {
            diagnostics.report(DiagnosticCode.NON_POSITIVE_STAGGER_DELAY,
                    "Stagger delay must be greater than 0 (got " + seconds(block.delay()) + ")",
                    block.source());
        }
        if (block.itemDuration() <= 0) {
            diagnostics.report(DiagnosticCode.NON_POSITIVE_STAGGER_DURATION,
                    "Stagger duration must be positive (got " + seconds(block.itemDuration()) + ")",
                    block.source());
        }
    }

    /**
     * Formats a time in seconds the way it is written in source, e.g. {@code 2s} or {@code 0.25s}.
     */
    static String seconds(double value) {
        if (!Double.isFinite(value)) {
            return value + "s";
        }
        BigDecimal bd = BigDecimal.valueOf(value).stripTrailingZeros();
        if (bd.signum() == 0) {
            return "0s";
        }
        return bd.toPlainString() + "s";
    }
}
