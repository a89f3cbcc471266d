package org.cuepoint.compiler.ir;

import java.util.Locale;
import java.util.Optional;

/**
 * The providers that can drive a timeline.
 */
public enum TimelineProvider {
	VIDEO("mediaplayer", true),
	AUDIO("mediaplayer", true),
	RAF("animation", false),
	CUSTOM("custom", false);

	private final String runtimeType;
	private final boolean requiresSource;

	TimelineProvider(String runtimeType, boolean requiresSource) {
		this.runtimeType = runtimeType;
		this.requiresSource = requiresSource;
	}

	/**
	 * @return The timeline type name used in the emitted configuration.
	 */
	public String runtimeType() {
		return runtimeType;
	}

	/**
	 * @return Whether timelines of this provider must declare a source file.
	 */
	public boolean requiresSource() {
		return requiresSource;
	}

	/**
	 * @return The provider keyword.
	 */
	public String keyword() {
		return name().toLowerCase(Locale.ROOT);
	}

	/**
	 * @param keyword A provider keyword, case-insensitive.
	 * @return The provider, or empty if the keyword is unknown.
	 */
	public static Optional<TimelineProvider> fromKeyword(String keyword) {
		if (keyword == null) return Optional.empty();
		for (TimelineProvider p : values()) {
			if (p.keyword().equalsIgnoreCase(keyword)) return Optional.of(p);
		}
		return Optional.empty();
	}
}
