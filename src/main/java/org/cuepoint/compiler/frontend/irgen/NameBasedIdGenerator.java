package org.cuepoint.compiler.frontend.irgen;

import java.nio.charset.StandardCharsets;
import java.util.UUID;

/**
 * Generates name-based (type 3) UUIDs from the document URI and the element path.
 */
public final class NameBasedIdGenerator implements IdGenerator {

	@Override
	public String idFor(String documentUri, String path) {
		String key = (documentUri == null ? "" : documentUri) + "#" + path;
		return UUID.nameUUIDFromBytes(key.getBytes(StandardCharsets.UTF_8)).toString();
	}
}
