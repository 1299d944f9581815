package de.upb.sse.scriptgen.exceptions;

import de.upb.sse.scriptgen.assembly.ScriptComposer;
import lombok.Getter;

/**
 * Raised under {@code UnstitchedExtensionPolicy.FAIL} when extension declarations exist
 * but their text does not end in a closing brace. The declaration count is
 * {@link ScriptComposer#UNKNOWN_COUNT} when only the extension text was available.
 */
@Getter
public class UnstitchedExtensionException extends RuntimeException {
    private final int extensionDeclarations;

    public UnstitchedExtensionException(int extensionDeclarations) {
        super(ScriptComposer.describe(extensionDeclarations) + " cannot be stitched: text does not end in a closing brace");
        this.extensionDeclarations = extensionDeclarations;
    }
}
