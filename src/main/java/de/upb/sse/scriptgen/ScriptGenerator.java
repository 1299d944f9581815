package de.upb.sse.scriptgen;

import de.upb.sse.scriptgen.assembly.IndentNormalizer;
import de.upb.sse.scriptgen.assembly.ScriptComposer;
import de.upb.sse.scriptgen.assembly.TextAssembler;
import de.upb.sse.scriptgen.classification.DeclarationClassifier;
import de.upb.sse.scriptgen.configuration.ScriptGenConfiguration;
import de.upb.sse.scriptgen.configuration.ScriptGenConfiguration.UnstitchedExtensionPolicy;
import de.upb.sse.scriptgen.document.ScriptDocument;
import de.upb.sse.scriptgen.model.Bucket;
import de.upb.sse.scriptgen.model.ClassifiedDeclarations;
import de.upb.sse.scriptgen.model.DeclarationNode;
import de.upb.sse.scriptgen.model.GeneratedScript;
import de.upb.sse.scriptgen.stats.GenerationStats;
import de.upb.sse.scriptgen.util.TextUtil;
import lombok.Getter;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Logger;

/**
 * Produces the final flat script of a document once the rest of the build is done.
 * <p>
 * Members of the {@code Program} class form the script body; every other declaration is
 * appended after it. Each call works on fresh state, so one generator can serve
 * independent documents concurrently.
 */
public class ScriptGenerator {
    private static final Logger logger = Logger.getLogger(ScriptGenerator.class.getName());

    @Getter private final ScriptGenConfiguration config;

    public ScriptGenerator() {
        this(new ScriptGenConfiguration());
    }

    public ScriptGenerator(ScriptGenConfiguration config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * Waits for the document's syntax root, then flattens it. A failure to obtain the root
     * completes the returned future exceptionally with the same cause.
     */
    public CompletableFuture<String> generate(ScriptDocument document) {
        Objects.requireNonNull(document, "document");
        return document.getSyntaxRootAsync()
                .thenApply(root -> generateScript(root).getScript());
    }

    public GeneratedScript generateScript(DeclarationNode root) {
        ClassifiedDeclarations declarations = new DeclarationClassifier(config.getProgramClassName()).classify(root);
        List<DeclarationNode> programNodes = declarations.getProgramDeclarations();
        List<DeclarationNode> extensionNodes = declarations.getExtensionDeclarations();
        logger.fine("Classified declarations: " + declarations);

        TextAssembler assembler = new TextAssembler();
        IndentNormalizer normalizer = new IndentNormalizer(config.getTabWidth());
        ScriptComposer composer = new ScriptComposer(config.getUnstitchedExtensionPolicy());

        String programPart = normalizer.normalize(assembler.assemble(programNodes, Bucket.PROGRAM));
        String extensionPart = normalizer.normalize(assembler.assemble(extensionNodes, Bucket.EXTENSION));
        boolean closesScope = !extensionNodes.isEmpty() && extensionNodes.get(extensionNodes.size() - 1).closesScope();

        String script = composer.compose(programPart, extensionPart, closesScope, extensionNodes.size());

        GenerationStats stats = new GenerationStats();
        stats.setProgramDeclarations(programNodes.size());
        stats.setExtensionDeclarations(extensionNodes.size());
        stats.setStitched(composer.isStitchable(extensionPart, closesScope));
        if (!stats.isStitched() && !TextUtil.isBlank(extensionPart)
                && config.getUnstitchedExtensionPolicy() == UnstitchedExtensionPolicy.DROP) {
            stats.setDroppedExtensionDeclarations(extensionNodes.size());
        }
        return new GeneratedScript(script, stats);
    }
}
