package de.upb.sse.scriptgen.configuration;

import lombok.*;

@Getter
@Setter
@ToString
@NoArgsConstructor
@AllArgsConstructor
public class ScriptGenConfiguration {
    public static final String DEFAULT_PROGRAM_CLASS_NAME = "Program";
    public static final int DEFAULT_TAB_WIDTH = 4;

    /**
     * What to do with extension content when its text does not close a brace and
     * therefore cannot be stitched behind the program body.
     */
    public enum UnstitchedExtensionPolicy { DROP, APPEND, FAIL }

    private String programClassName = DEFAULT_PROGRAM_CLASS_NAME;
    private int tabWidth = DEFAULT_TAB_WIDTH;
    private UnstitchedExtensionPolicy unstitchedExtensionPolicy = UnstitchedExtensionPolicy.DROP;
}
