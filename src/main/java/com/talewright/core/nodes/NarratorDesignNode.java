package com.talewright.core.nodes;

import com.talewright.core.engine.RunContext;
import com.talewright.core.model.Phase;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Designs the narrating voice the Writer keeps for every scene.
 */
@Component
public class NarratorDesignNode extends AbstractAgentPhaseNode {

    public NarratorDesignNode() {
        super(Phase.NARRATOR_DESIGN);
    }

    @Override
    public Map<String, Object> execute(RunContext ctx) {
        String task = """
                Design the narrator. Return JSON with: point_of_view, tense, voice, reliability, style_notes.
                """;
        return askPrimary(ctx, task, priorArtifacts(ctx, Phase.CONCEPT, Phase.CHARACTERS));
    }
}
