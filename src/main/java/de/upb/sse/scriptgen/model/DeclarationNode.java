package de.upb.sse.scriptgen.model;

import de.upb.sse.scriptgen.util.TextUtil;

import java.util.List;

/**
 * Read-only handle into a syntax tree owned by a compilation service.
 * Nodes are only referenced and rendered, never mutated.
 */
public interface DeclarationNode {

    DeclarationKind getKind();

    /** Declared name, possibly namespace-qualified. {@code null} for unnamed nodes. */
    String getName();

    /** Child nodes in source order. */
    List<DeclarationNode> getChildren();

    /** Verbatim source text of the node, including leading comments and interior formatting. */
    String getSourceText();

    /**
     * Whether the last significant token of this node closes a brace.
     * Front ends with token data should override the textual fallback.
     */
    default boolean closesScope() {
        return TextUtil.trim(getSourceText()).endsWith("}");
    }
}
