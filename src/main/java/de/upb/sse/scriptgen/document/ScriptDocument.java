package de.upb.sse.scriptgen.document;

import de.upb.sse.scriptgen.model.DeclarationNode;

import java.util.concurrent.CompletableFuture;

/**
 * A compiled document whose syntax tree is supplied by an external compilation service.
 */
public interface ScriptDocument {
    /** Completes with the root of the document's syntax tree, or exceptionally if it cannot be produced. */
    CompletableFuture<DeclarationNode> getSyntaxRootAsync();
}
