package org.cuepoint.compiler.frontend.irgen;

/**
 * Produces the IDs of IR elements.
 * <p>
 * Implementations must be deterministic: the same document URI and structural path
 * always yield the same ID, so that compiling an unchanged document produces identical output.
 */
@FunctionalInterface
public interface IdGenerator {

	/**
	 * @param documentUri The URI of the document being lowered.
	 * @param path        The structural path of the element, e.g. {@code timeline[0]/event[2]/start[0]}.
	 * @return The ID.
	 */
	String idFor(String documentUri, String path);
}
