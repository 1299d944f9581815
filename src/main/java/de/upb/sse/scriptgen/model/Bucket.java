package de.upb.sse.scriptgen.model;

/**
 * The two destinations a top-level declaration can end up in.
 */
public enum Bucket {
    /** Members of the wrapper class; each one reads as an independent block. */
    PROGRAM("\n\n"),
    /** Supporting declarations, packed densely after the program body. */
    EXTENSION(" ");

    private final String separator;

    Bucket(String separator) {
        this.separator = separator;
    }

    public String getSeparator() {
        return separator;
    }
}
