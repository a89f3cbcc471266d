package org.cuepoint.compiler.frontend.irgen;

import org.cuepoint.compiler.api.TransformException;
import org.cuepoint.compiler.frontend.ast.AstNode;

/**
 * Lowers one kind of syntax tree node.
 * <p>
 * Converters keep no state. Timeline actions and action definitions are handed to the
 * {@link IrGenContext}, which also tracks the timeline cursor.
 *
 * @param <T> The node type handled by this converter.
 */
public interface IAstNodeToIrConverter<T extends AstNode> {

	/**
	 * @param node The node to lower.
	 * @param ctx  The lowering context receiving the IR.
	 * @throws TransformException if the node lacks a mandatory part.
	 */
	void convert(T node, IrGenContext ctx) throws TransformException;
}
