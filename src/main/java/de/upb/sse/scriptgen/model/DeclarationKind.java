package de.upb.sse.scriptgen.model;

/**
 * Closed set of declaration kinds the classifier understands.
 * Every kind except {@link #OTHER} is captured as one opaque block.
 */
public enum DeclarationKind {
    CLASS,
    STRUCT,
    METHOD,
    FIELD,
    PROPERTY,
    EVENT,
    EVENT_FIELD,
    DELEGATE,
    CONSTRUCTOR,
    ENUM,
    /** Not a declaration of interest; traversal passes through to its children. */
    OTHER
}
