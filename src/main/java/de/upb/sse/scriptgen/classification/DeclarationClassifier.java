package de.upb.sse.scriptgen.classification;

import de.upb.sse.scriptgen.model.Bucket;
import de.upb.sse.scriptgen.model.ClassifiedDeclarations;
import de.upb.sse.scriptgen.model.DeclarationNode;

import java.util.Objects;

/**
 * Partitions the declarations of a syntax tree into the program and extension buckets.
 * <p>
 * Members of the class named like the wrapper class (default {@code Program}) go to
 * {@link Bucket#PROGRAM}; every other captured declaration goes to {@link Bucket#EXTENSION}.
 * Captured declarations travel whole, their children are not visited.
 * The active bucket is passed down the recursion, so leaving a wrapper scope
 * restores whatever bucket was active before entering it.
 */
public class DeclarationClassifier {
    private final String programClassName;

    public DeclarationClassifier(String programClassName) {
        this.programClassName = Objects.requireNonNull(programClassName, "programClassName");
    }

    public ClassifiedDeclarations classify(DeclarationNode root) {
        Objects.requireNonNull(root, "root");
        ClassifiedDeclarations result = new ClassifiedDeclarations();
        visit(root, Bucket.EXTENSION, result);
        return result;
    }

    private void visit(DeclarationNode node, Bucket active, ClassifiedDeclarations result) {
        switch (node.getKind()) {
            case CLASS:
                if (isProgramClass(node)) {
                    visitChildren(node, Bucket.PROGRAM, result);
                } else {
                    result.add(active, node);
                }
                break;
            case STRUCT:
            case METHOD:
            case FIELD:
            case PROPERTY:
            case EVENT:
            case EVENT_FIELD:
            case DELEGATE:
            case CONSTRUCTOR:
            case ENUM:
                result.add(active, node);
                break;
            case OTHER:
                visitChildren(node, active, result);
                break;
            default:
                throw new IllegalStateException("Unhandled declaration kind: " + node.getKind());
        }
    }

    private void visitChildren(DeclarationNode node, Bucket active, ClassifiedDeclarations result) {
        for (DeclarationNode child : node.getChildren()) {
            visit(child, active, result);
        }
    }

    boolean isProgramClass(DeclarationNode node) {
        String name = node.getName();
        if (name == null) return false;
        return programClassName.equals(name.substring(name.lastIndexOf('.') + 1));
    }
}
