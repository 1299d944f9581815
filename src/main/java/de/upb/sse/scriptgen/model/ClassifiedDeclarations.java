package de.upb.sse.scriptgen.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Result of classifying a syntax tree: one ordered list of declarations per {@link Bucket}.
 * Insertion order is traversal order.
 */
public class ClassifiedDeclarations {
    private final Map<Bucket, List<DeclarationNode>> buckets = new EnumMap<>(Bucket.class);

    public ClassifiedDeclarations() {
        for (Bucket bucket : Bucket.values()) {
            buckets.put(bucket, new ArrayList<>());
        }
    }

    public void add(Bucket bucket, DeclarationNode node) {
        buckets.get(bucket).add(node);
    }

    public List<DeclarationNode> get(Bucket bucket) {
        return Collections.unmodifiableList(buckets.get(bucket));
    }

    public List<DeclarationNode> getProgramDeclarations() {
        return get(Bucket.PROGRAM);
    }

    public List<DeclarationNode> getExtensionDeclarations() {
        return get(Bucket.EXTENSION);
    }

    @Override
    public String toString() {
        return "ClassifiedDeclarations{" +
                "program=" + buckets.get(Bucket.PROGRAM).size() +
                ", extension=" + buckets.get(Bucket.EXTENSION).size() +
                '}';
    }
}
