package de.upb.sse.scriptgen.model;

import de.upb.sse.scriptgen.stats.GenerationStats;
import lombok.Getter;

import java.util.Objects;

/**
 * The flattened script together with the statistics of the run that produced it.
 */
@Getter
public final class GeneratedScript {
    private final String script;
    private final GenerationStats stats;

    public GeneratedScript(String script, GenerationStats stats) {
        this.script = Objects.requireNonNull(script, "script");
        this.stats = Objects.requireNonNull(stats, "stats");
    }

    /** True when nothing ended up in the script, which callers may want to treat as a failed build. */
    public boolean isEmpty() {
        return script.isEmpty();
    }

    @Override
    public String toString() {
        return script;
    }
}
