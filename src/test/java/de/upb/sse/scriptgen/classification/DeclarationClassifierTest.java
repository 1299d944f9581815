package de.upb.sse.scriptgen.classification;

import de.upb.sse.scriptgen.model.ClassifiedDeclarations;
import de.upb.sse.scriptgen.model.DeclarationKind;
import de.upb.sse.scriptgen.model.DeclarationNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static de.upb.sse.scriptgen.support.TestNodes.*;
import static org.junit.jupiter.api.Assertions.*;

public class DeclarationClassifierTest {
    private DeclarationClassifier classifier;

    @BeforeEach
    void setup() {
        classifier = new DeclarationClassifier("Program");
    }

    @Test
    @DisplayName("Program members go to the program bucket, other types to the extension bucket")
    void splitsProgramAndExtension() {
        DeclarationNode field = member(DeclarationKind.FIELD, "int x;");
        DeclarationNode main = member(DeclarationKind.METHOD, "void Main() { }");
        DeclarationNode helper = classNode("Helper", "class Helper { }");
        DeclarationNode color = node(DeclarationKind.ENUM, "Color", "enum Color { Red }");
        DeclarationNode root = container(container(classNode("Program", "class Program { }", field, main), helper, color));

        ClassifiedDeclarations result = classifier.classify(root);

        assertEquals(Arrays.asList(field, main), result.getProgramDeclarations());
        assertEquals(Arrays.asList(helper, color), result.getExtensionDeclarations());
    }

    @Test
    @DisplayName("Captured declarations travel whole, their members are not collected")
    void capturedNodesAreOpaque() {
        DeclarationNode inner = member(DeclarationKind.METHOD, "void Inner() { }");
        DeclarationNode struct = node(DeclarationKind.STRUCT, "Point", "struct Point { void Inner() { } }", inner);
        DeclarationNode helper = classNode("Helper", "class Helper { void Inner() { } }", inner);
        DeclarationNode root = container(classNode("Program", "", struct), helper);

        ClassifiedDeclarations result = classifier.classify(root);

        assertEquals(Collections.singletonList(struct), result.getProgramDeclarations());
        assertEquals(Collections.singletonList(helper), result.getExtensionDeclarations());
    }

    @Test
    @DisplayName("Every captured kind lands in the active bucket")
    void allCapturedKinds() {
        DeclarationNode[] members = new DeclarationNode[] {
                member(DeclarationKind.STRUCT, "struct S { }"),
                member(DeclarationKind.METHOD, "void M() { }"),
                member(DeclarationKind.FIELD, "int f;"),
                member(DeclarationKind.PROPERTY, "int P { get; set; }"),
                member(DeclarationKind.EVENT, "event Action E { add { } remove { } }"),
                member(DeclarationKind.EVENT_FIELD, "event Action F;"),
                member(DeclarationKind.DELEGATE, "delegate void D();"),
                member(DeclarationKind.CONSTRUCTOR, "Program() { }"),
                member(DeclarationKind.ENUM, "enum E { A }"),
                classNode("Nested", "class Nested { }")
        };

        ClassifiedDeclarations result = classifier.classify(classNode("Program", "", members));

        assertEquals(Arrays.asList(members), result.getProgramDeclarations());
        assertTrue(result.getExtensionDeclarations().isEmpty());
    }

    @Test
    @DisplayName("Wrapper name is compared without its namespace qualifier")
    void qualifiedNameMatches() {
        DeclarationNode m = member(DeclarationKind.METHOD, "void M() { }");
        ClassifiedDeclarations result = classifier.classify(container(classNode("IngameScript.Program", "", m)));
        assertEquals(Collections.singletonList(m), result.getProgramDeclarations());
    }

    @Test
    @DisplayName("Wrapper name comparison is case-sensitive and applies to classes only")
    void onlyExactClassNameMatches() {
        DeclarationNode lower = classNode("program", "class program { }", member(DeclarationKind.METHOD, "void M() { }"));
        DeclarationNode struct = node(DeclarationKind.STRUCT, "Program", "struct Program { }",
                member(DeclarationKind.METHOD, "void N() { }"));
        DeclarationNode unnamed = classNode(null, "class { }");

        ClassifiedDeclarations result = classifier.classify(container(lower, struct, unnamed));

        assertTrue(result.getProgramDeclarations().isEmpty());
        assertEquals(Arrays.asList(lower, struct, unnamed), result.getExtensionDeclarations());
    }

    @Test
    @DisplayName("Leaving a nested wrapper restores the bucket that was active before it")
    void nestedWrapperRestoresOuterBucket() {
        DeclarationNode first = member(DeclarationKind.METHOD, "void First() { }");
        DeclarationNode inner = member(DeclarationKind.METHOD, "void Inner() { }");
        DeclarationNode last = member(DeclarationKind.METHOD, "void Last() { }");
        DeclarationNode root = classNode("Program", "", first, classNode("Program", "", inner), last);

        ClassifiedDeclarations result = classifier.classify(root);

        assertEquals(Arrays.asList(first, inner, last), result.getProgramDeclarations());
        assertTrue(result.getExtensionDeclarations().isEmpty());
    }

    @Test
    @DisplayName("Declarations after the wrapper class go back to the extension bucket")
    void extensionAfterWrapper() {
        DeclarationNode before = member(DeclarationKind.FIELD, "int before;");
        DeclarationNode inside = member(DeclarationKind.FIELD, "int inside;");
        DeclarationNode after = member(DeclarationKind.FIELD, "int after;");
        DeclarationNode root = container(container(before, classNode("Program", "", inside)), after);

        ClassifiedDeclarations result = classifier.classify(root);

        assertEquals(Collections.singletonList(inside), result.getProgramDeclarations());
        assertEquals(Arrays.asList(before, after), result.getExtensionDeclarations());
    }

    @Test
    @DisplayName("Tree without declarations yields two empty buckets")
    void emptyTree() {
        ClassifiedDeclarations result = classifier.classify(container(container()));
        assertTrue(result.getProgramDeclarations().isEmpty());
        assertTrue(result.getExtensionDeclarations().isEmpty());
    }

    @Test
    @DisplayName("Wrapper class name is configurable")
    void customWrapperName() {
        DeclarationNode m = member(DeclarationKind.METHOD, "void M() { }");
        ClassifiedDeclarations result = new DeclarationClassifier("Script").classify(classNode("Script", "", m));
        assertEquals(Collections.singletonList(m), result.getProgramDeclarations());
    }
}
