package de.upb.sse.scriptgen.document.javaparser;

import com.github.javaparser.JavaToken;
import com.github.javaparser.Position;
import com.github.javaparser.TokenRange;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.*;
import com.github.javaparser.ast.comments.Comment;
import com.github.javaparser.ast.nodeTypes.NodeWithSimpleName;
import de.upb.sse.scriptgen.model.DeclarationKind;
import de.upb.sse.scriptgen.model.DeclarationNode;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Exposes a JavaParser node as a {@link DeclarationNode}.
 * <p>
 * Classes map to {@link DeclarationKind#CLASS}, records to {@link DeclarationKind#STRUCT},
 * initializer blocks and compact constructors to {@link DeclarationKind#CONSTRUCTOR},
 * annotation members to {@link DeclarationKind#METHOD}. Interfaces, annotation types and
 * everything that is not a member declaration are {@link DeclarationKind#OTHER}.
 */
public final class JavaParserDeclarationNode implements DeclarationNode {
    private final Node node;
    private final DeclarationKind kind;

    public JavaParserDeclarationNode(Node node) {
        this.node = Objects.requireNonNull(node, "node");
        this.kind = kindOf(node);
    }

    static DeclarationKind kindOf(Node node) {
        if (node instanceof ClassOrInterfaceDeclaration) {
            return ((ClassOrInterfaceDeclaration) node).isInterface() ? DeclarationKind.OTHER : DeclarationKind.CLASS;
        }
        if (node instanceof RecordDeclaration) return DeclarationKind.STRUCT;
        if (node instanceof EnumDeclaration) return DeclarationKind.ENUM;
        if (node instanceof MethodDeclaration || node instanceof AnnotationMemberDeclaration) return DeclarationKind.METHOD;
        if (node instanceof FieldDeclaration) return DeclarationKind.FIELD;
        if (node instanceof ConstructorDeclaration
                || node instanceof CompactConstructorDeclaration
                || node instanceof InitializerDeclaration) {
            return DeclarationKind.CONSTRUCTOR;
        }
        return DeclarationKind.OTHER;
    }

    @Override
    public DeclarationKind getKind() {
        return kind;
    }

    @Override
    public String getName() {
        if (node instanceof NodeWithSimpleName) {
            return ((NodeWithSimpleName<?>) node).getNameAsString();
        }
        return null;
    }

    @Override
    public List<DeclarationNode> getChildren() {
        return node.getChildNodes().stream()
                .map(JavaParserDeclarationNode::new)
                .collect(Collectors.toList());
    }

    /**
     * Original tokens of the node, starting at its attached comment if that comment precedes it.
     * A same-line comment after the node is attached to it too, but is not part of its text.
     * Falls back to pretty printing for nodes created without tokens.
     */
    @Override
    public String getSourceText() {
        Optional<TokenRange> range = node.getTokenRange();
        if (!range.isPresent()) {
            return node.toString();
        }
        JavaToken begin = node.getComment()
                .filter(this::precedesNode)
                .flatMap(Comment::getTokenRange)
                .map(TokenRange::getBegin)
                .orElse(range.get().getBegin());
        return new TokenRange(begin, range.get().getEnd()).toString();
    }

    private boolean precedesNode(Comment comment) {
        Optional<Position> commentBegin = comment.getBegin();
        Optional<Position> nodeBegin = node.getBegin();
        return commentBegin.isPresent() && nodeBegin.isPresent() && commentBegin.get().isBefore(nodeBegin.get());
    }

    @Override
    public boolean closesScope() {
        return node.getTokenRange()
                .map(range -> "}".equals(range.getEnd().getText()))
                .orElseGet(DeclarationNode.super::closesScope);
    }

    @Override
    public String toString() {
        return kind + (getName() == null ? "" : " " + getName());
    }
}
