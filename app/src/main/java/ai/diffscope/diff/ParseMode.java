package ai.diffscope.diff;

/** How {@link DiffParser} reacts to a diff block it cannot make sense of. */
public enum ParseMode {
    /** Drop the offending block and keep going. */
    LENIENT,
    /** Fail the whole parse with a {@link DiffParseException}. */
    STRICT
}
