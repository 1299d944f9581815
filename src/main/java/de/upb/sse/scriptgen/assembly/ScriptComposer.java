package de.upb.sse.scriptgen.assembly;

import de.upb.sse.scriptgen.configuration.ScriptGenConfiguration.UnstitchedExtensionPolicy;
import de.upb.sse.scriptgen.exceptions.UnstitchedExtensionException;
import de.upb.sse.scriptgen.util.TextUtil;

import java.util.Objects;
import java.util.logging.Logger;

/**
 * Merges the normalized program part and extension part into the final script.
 * <p>
 * When the extension part closes a brace, that brace is cut off and a closing brace is
 * placed between both parts instead, so the extension declarations continue after the
 * scope that wraps the program body.
 */
public class ScriptComposer {
    public static final String SEAM = "\n\n}\n\n";
    /** Declaration count passed when only the text of the extension part is known. */
    public static final int UNKNOWN_COUNT = -1;
    private static final Logger logger = Logger.getLogger(ScriptComposer.class.getName());

    private final UnstitchedExtensionPolicy policy;

    public ScriptComposer() {
        this(UnstitchedExtensionPolicy.DROP);
    }

    public ScriptComposer(UnstitchedExtensionPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    /** Textual seam detection: the extension part is stitched only if it ends with {@code '}'}. */
    public String compose(String programPart, String extensionPart) {
        return compose(programPart, extensionPart, extensionPart.endsWith("}"), UNKNOWN_COUNT);
    }

    /**
     * @param extensionClosesScope whether the last extension declaration ends with a closing brace token
     * @param extensionDeclarations number of declarations behind {@code extensionPart}, for reporting,
     *                              or {@link #UNKNOWN_COUNT}
     */
    public String compose(String programPart, String extensionPart, boolean extensionClosesScope, int extensionDeclarations) {
        if (isStitchable(extensionPart, extensionClosesScope)) {
            return programPart + SEAM + extensionPart.substring(0, extensionPart.lastIndexOf('}'));
        }
        if (TextUtil.isBlank(extensionPart)) {
            return programPart;
        }

        switch (policy) {
            case APPEND:
                return programPart + "\n\n" + extensionPart;
            case FAIL:
                throw new UnstitchedExtensionException(extensionDeclarations);
            case DROP:
            default:
                logger.warning("Dropping " + describe(extensionDeclarations) + ": text does not end in a closing brace");
                return programPart;
        }
    }

    public static String describe(int extensionDeclarations) {
        return extensionDeclarations < 0 ? "extension content" : extensionDeclarations + " extension declaration(s)";
    }

    public boolean isStitchable(String extensionPart, boolean extensionClosesScope) {
        return extensionClosesScope && extensionPart.lastIndexOf('}') >= 0;
    }

    public UnstitchedExtensionPolicy getPolicy() {
        return policy;
    }
}
