package de.upb.sse.scriptgen.assembly;

import de.upb.sse.scriptgen.model.Bucket;
import de.upb.sse.scriptgen.model.DeclarationNode;
import de.upb.sse.scriptgen.util.TextUtil;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders the declarations of one bucket and joins them with the bucket's separator.
 */
public class TextAssembler {

    /** Verbatim text of the node with only the outer whitespace removed. */
    public String render(DeclarationNode node) {
        return TextUtil.trim(node.getSourceText());
    }

    public String join(List<DeclarationNode> nodes, Bucket bucket) {
        return nodes.stream()
                .map(this::render)
                .collect(Collectors.joining(bucket.getSeparator()));
    }

    /** Joined text of the bucket, split on CRLF or LF for the normalizer. */
    public List<String> assemble(List<DeclarationNode> nodes, Bucket bucket) {
        return TextUtil.splitLines(join(nodes, bucket));
    }
}
