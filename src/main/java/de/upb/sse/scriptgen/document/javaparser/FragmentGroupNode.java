package de.upb.sse.scriptgen.document.javaparser;

import de.upb.sse.scriptgen.model.DeclarationKind;
import de.upb.sse.scriptgen.model.DeclarationNode;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Synthetic root over the compilation units of a multi-fragment document, in fragment order.
 */
final class FragmentGroupNode implements DeclarationNode {
    private final List<DeclarationNode> fragments;

    FragmentGroupNode(List<DeclarationNode> fragments) {
        this.fragments = List.copyOf(fragments);
    }

    @Override
    public DeclarationKind getKind() {
        return DeclarationKind.OTHER;
    }

    @Override
    public String getName() {
        return null;
    }

    @Override
    public List<DeclarationNode> getChildren() {
        return fragments;
    }

    @Override
    public String getSourceText() {
        return fragments.stream().map(DeclarationNode::getSourceText).collect(Collectors.joining("\n"));
    }
}
