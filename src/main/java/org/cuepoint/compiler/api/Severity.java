package org.cuepoint.compiler.api;

/**
 * The severity of a diagnostic. It is fixed per {@link DiagnosticCode} and not configurable.
 */
public enum Severity {
    /** A problem that makes the emitted configuration provisional. */
    ERROR,
    /** A suspicious construct that does not invalidate the output. */
    WARNING
}
