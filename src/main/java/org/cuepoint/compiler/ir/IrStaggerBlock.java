package org.cuepoint.compiler.ir;

import org.cuepoint.compiler.api.SourceInfo;

/**
 * The timing parameters of a {@code stagger} block, kept apart from the actions of its items
 * so that a block without items is still checked.
 *
 * @param delay        The evaluated delay between items.
 * @param itemDuration The evaluated per-item duration.
 * @param itemCount    The number of items.
 * @param source       The source position of the block.
 */
public record IrStaggerBlock(double delay, double itemDuration, int itemCount, SourceInfo source) implements IrItem {}
