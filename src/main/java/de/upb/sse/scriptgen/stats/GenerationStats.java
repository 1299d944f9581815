package de.upb.sse.scriptgen.stats;

import lombok.Data;

@Data
public class GenerationStats {
    private int programDeclarations;
    private int extensionDeclarations;
    private boolean stitched;
    private int droppedExtensionDeclarations;

    public int totalDeclarations() {
        return programDeclarations + extensionDeclarations;
    }

    public boolean droppedContent() {
        return droppedExtensionDeclarations > 0;
    }
}
