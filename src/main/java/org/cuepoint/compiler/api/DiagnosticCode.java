package org.cuepoint.compiler.api;

/**
 * Defines unique, testable codes for every diagnostic the compiler can report.
 * This decouples the test logic from the wording of the messages.
 * <p>
 * Each code carries its fixed severity and a default hint that is used when a rule
 * has nothing more specific to suggest.
 */
public enum DiagnosticCode {
    // region Timing
    /** An action starts before zero. */
    NEGATIVE_START_TIME(Severity.ERROR, "Use a start time of 0s or later"),
    /** An action does not end after it starts. */
    INVALID_TIME_RANGE(Severity.ERROR, "Make sure the end time is later than the start time"),
    /** A sequence step has a zero or negative duration. */
    NON_POSITIVE_SEQUENCE_DURATION(Severity.ERROR, "Give every sequence step a positive duration, e.g. 'for 1s'"),
    /** A stagger block has a zero or negative delay. */
    NON_POSITIVE_STAGGER_DELAY(Severity.ERROR, "Use a positive stagger delay, e.g. 'stagger 200ms'"),
    /** A stagger block has a zero or negative item duration. */
    NON_POSITIVE_STAGGER_DURATION(Severity.ERROR, "Give each staggered item a positive duration, e.g. 'for 1s'"),
    // endregion

    // region Imports
    /** More than one default import of the same category. */
    DUPLICATE_DEFAULT_IMPORT(Severity.ERROR, "Remove the duplicate import statement"),
    /** Two named imports share a name. */
    DUPLICATE_IMPORT_NAME(Severity.ERROR, "Rename one of the imports so that every import name is unique"),
    /** A named import uses a reserved keyword. */
    RESERVED_KEYWORD_IMPORT_NAME(Severity.ERROR, "Choose an import name that is not a reserved keyword"),
    /** A named import shadows a built-in operation. */
    OPERATION_NAME_CONFLICT(Severity.ERROR, "Choose an import name that is not the name of a built-in operation"),
    /** An import path is not relative to the document. */
    ABSOLUTE_IMPORT_PATH(Severity.ERROR, "Use a relative path starting with './' or '../'"),
    /** The asset type cannot be inferred from an unknown extension. */
    UNKNOWN_EXTENSION(Severity.ERROR, "Add 'as html', 'as css', or 'as media' to the import"),
    /** The asset type cannot be inferred from an ambiguous extension. */
    AMBIGUOUS_EXTENSION(Severity.ERROR, "Add 'as media' to the import"),
    // endregion

    // region Timelines
    /** The document declares no timeline. */
    MISSING_TIMELINE(Severity.ERROR, "Add a timeline, e.g. timeline \"main\" in \"#container\" using raf { ... }"),
    /** A media timeline has no source file. */
    MISSING_TIMELINE_SOURCE(Severity.ERROR, "Add: from \"<file path>\""),
    /** A non-media timeline declares a source file that is never used. */
    UNUSED_TIMELINE_SOURCE(Severity.WARNING, "Remove the 'from' clause, this provider does not play a source file"),
    /** The container selector is not a valid CSS selector. */
    INVALID_CONTAINER_SELECTOR(Severity.ERROR, "Use a selector such as '#container' or '.stage'"),
    /** A timeline has no events. */
    EMPTY_TIMELINE(Severity.WARNING, "Add at least one timeline event"),
    // endregion

    // region Operations and actions
    /** A call names neither a built-in operation nor a defined action. */
    UNKNOWN_OPERATION(Severity.ERROR, "Check the operation name or define an action with this name"),
    /** A built-in operation is called with the wrong number of arguments. */
    ARGUMENT_COUNT(Severity.ERROR, "Check the parameters of the operation"),
    /** An action is called with more arguments than it declares parameters. */
    ACTION_ARGUMENT_COUNT(Severity.ERROR, "Check the parameters of the action definition"),
    /** Two actions share a name. */
    DUPLICATE_ACTION(Severity.ERROR, "Rename one of the actions"),
    /** addController names a controller that does not exist. */
    UNKNOWN_CONTROLLER(Severity.ERROR, "Check the controller name"),
    // endregion

    // region CSS
    /** A selector references a class no imported stylesheet defines. */
    UNKNOWN_CSS_CLASS(Severity.ERROR, "Define the class in an imported stylesheet"),
    /** A selector references an ID no imported stylesheet defines. */
    UNKNOWN_CSS_ID(Severity.ERROR, "Define the ID in an imported stylesheet"),
    /** A selector string cannot be parsed. */
    INVALID_SELECTOR(Severity.ERROR, "Fix the selector syntax"),
    // endregion

    // region Labels and languages
    /** A label ID is not present in the imported labels. */
    UNKNOWN_LABEL(Severity.ERROR, "Add the label to the imported labels file"),
    /** A label ID is used but no labels file is imported. */
    NO_LABELS_IMPORT(Severity.ERROR, "Add: labels \"./labels.json\""),
    /** A language code is declared twice. */
    DUPLICATE_LANGUAGE(Severity.ERROR, "Remove the duplicate language entry"),
    /** Several languages are declared without a default. */
    MISSING_DEFAULT_LANGUAGE(Severity.ERROR, "Mark exactly one language as default with '*'"),
    /** Several languages are marked as default. */
    MULTIPLE_DEFAULT_LANGUAGES(Severity.ERROR, "Mark exactly one language as default with '*'"),
    /** A declared language has no translations in the imported labels. */
    UNKNOWN_LOCALE(Severity.WARNING, "Add translations for this language to the labels file"),
    // endregion

    // region Asset loading
    /** An imported file could not be read. */
    ASSET_LOAD_FAILED(Severity.ERROR, "Check that the file exists and is readable"),
    /** An imported path escapes the document's directory. */
    PATH_TRAVERSAL(Severity.ERROR, "Keep imported files inside the document's directory"),
    /** A stylesheet could not be parsed. */
    INVALID_STYLESHEET(Severity.ERROR, "Fix the CSS syntax of the stylesheet"),
    /** A labels file is not valid locales JSON. */
    INVALID_LABELS_FILE(Severity.ERROR, "The labels file must be a JSON object keyed by locale code");
    // endregion

    private final Severity severity;
    private final String defaultHint;

    DiagnosticCode(Severity severity, String defaultHint) {
        this.severity = severity;
        this.defaultHint = defaultHint;
    }

    /**
     * @return The fixed severity of this code.
     */
    public Severity severity() {
        return severity;
    }

    /**
     * @return The hint used when the reporting rule supplies none.
     */
    public String defaultHint() {
        return defaultHint;
    }
}
