package de.upb.sse.scriptgen.document.javaparser;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseProblemException;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ast.CompilationUnit;
import de.upb.sse.scriptgen.document.ScriptDocument;
import de.upb.sse.scriptgen.model.DeclarationNode;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.function.Supplier;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * A document made of one or more Java source fragments, parsed with JavaParser.
 * The syntax root is produced once, on the given executor, and shared by later calls.
 */
public class JavaParserDocument implements ScriptDocument {
    private static final Logger logger = Logger.getLogger(JavaParserDocument.class.getName());

    private final List<Fragment> fragments;
    private final ParserConfiguration parserConfiguration;
    private final Executor executor;
    private CompletableFuture<DeclarationNode> root;

    public JavaParserDocument(List<Fragment> fragments, ParserConfiguration parserConfiguration, Executor executor) {
        this.fragments = List.copyOf(Objects.requireNonNull(fragments, "fragments"));
        this.parserConfiguration = Objects.requireNonNull(parserConfiguration, "parserConfiguration");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    public static JavaParserDocument ofSources(String... sources) {
        List<Fragment> fragments = new ArrayList<>();
        for (int i = 0; i < sources.length; i++) {
            String source = sources[i];
            fragments.add(new Fragment("fragment-" + i, () -> source));
        }
        return new JavaParserDocument(fragments, defaultParserConfiguration(), ForkJoinPool.commonPool());
    }

    public static JavaParserDocument ofFiles(Path... files) {
        return ofFiles(Arrays.asList(files));
    }

    public static JavaParserDocument ofFiles(List<Path> files) {
        List<Fragment> fragments = files.stream()
                .map(Fragment::ofFile)
                .collect(Collectors.toList());
        return new JavaParserDocument(fragments, defaultParserConfiguration(), ForkJoinPool.commonPool());
    }

    public static ParserConfiguration defaultParserConfiguration() {
        return new ParserConfiguration().setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17);
    }

    @Override
    public synchronized CompletableFuture<DeclarationNode> getSyntaxRootAsync() {
        if (root == null) {
            root = CompletableFuture.supplyAsync(this::parse, executor);
        }
        return root;
    }

    private DeclarationNode parse() {
        JavaParser parser = new JavaParser(parserConfiguration);
        List<DeclarationNode> units = new ArrayList<>();
        for (Fragment fragment : fragments) {
            ParseResult<CompilationUnit> result = parser.parse(fragment.getSource());
            if (!result.isSuccessful() || !result.getResult().isPresent()) {
                logger.warning("Could not parse " + fragment.getName() + ": " + result.getProblems());
                throw new ParseProblemException(result.getProblems());
            }
            units.add(new JavaParserDeclarationNode(result.getResult().get()));
        }
        logger.fine("Parsed " + units.size() + " fragment(s)");
        return units.size() == 1 ? units.get(0) : new FragmentGroupNode(units);
    }

    /**
     * One source fragment of a document. The source is read lazily, when the document is parsed.
     */
    public static final class Fragment {
        private final String name;
        private final Supplier<String> source;

        public Fragment(String name, Supplier<String> source) {
            this.name = Objects.requireNonNull(name, "name");
            this.source = Objects.requireNonNull(source, "source");
        }

        public static Fragment ofFile(Path file) {
            return new Fragment(file.toString(), () -> {
                try {
                    return Files.readString(file, StandardCharsets.UTF_8);
                } catch (IOException e) {
                    throw new UncheckedIOException("Could not read " + file, e);
                }
            });
        }

        public String getName() {
            return name;
        }

        public String getSource() {
            return source.get();
        }
    }
}
