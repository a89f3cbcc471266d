package org.cuepoint.compiler.backend.emit;

/**
 * Settings of the emitted configuration that do not come from the document.
 *
 * @param schemaUrl                The value of the {@code $schema} field.
 * @param engineSystemName         The runtime engine name.
 * @param defaultContainerSelector The root container selector.
 * @param defaultLanguage          The language used when the document declares none.
 * @param defaultLayoutTemplate    The layout template used when the document imports none.
 * @param prettyPrint              Whether to indent the output.
 */
public record EmitterOptions(
		String schemaUrl,
		String engineSystemName,
		String defaultContainerSelector,
		String defaultLanguage,
		String defaultLayoutTemplate,
		boolean prettyPrint
) {

	/**
	 * @return The options matching the bundled {@code reference.conf}.
	 */
	public static EmitterOptions defaults() {
		return new EmitterOptions(
		        "https://rolandzwaga.github.io/eligius/jsonschema/eligius-configuration.json",
		        "Eligius",
		        "body",
		        "en-US",
		        "default",
		        true);
	}
}
