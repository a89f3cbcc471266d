package org.cuepoint.compiler.frontend.irgen;

import org.cuepoint.compiler.api.TransformException;
import org.cuepoint.compiler.frontend.ast.AstNode;

/**
 * Fallback converter for node types without a registered converter.
 * Every node kind the parser can produce has a converter, so reaching this is a contract violation.
 */
public final class DefaultAstNodeToIrConverter implements IAstNodeToIrConverter<AstNode> {

	@Override
	public void convert(AstNode node, IrGenContext ctx) throws TransformException {
		throw new TransformException("No IR converter registered for node type " + node.getClass().getSimpleName(), node.source());
	}
}
