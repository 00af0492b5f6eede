package com.talewright.core.nodes;

import com.talewright.core.engine.RunContext;
import com.talewright.core.model.Phase;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Layers foreshadowing, subplots and pacing over the scene plan.
 */
@Component
public class AdvancedPlanningNode extends AbstractAgentPhaseNode {

    public AdvancedPlanningNode() {
        super(Phase.ADVANCED_PLANNING);
    }

    @Override
    public Map<String, Object> execute(RunContext ctx) {
        String task = """
                Refine the outline. Return JSON with: foreshadowing (list of {"plant_scene", "payoff_scene",
                "detail"}), subplots (list), pacing_notes (string). Do not add or remove scenes.
                """;
        return askPrimary(ctx, task, priorArtifacts(ctx, Phase.CONCEPT, Phase.CHARACTERS, Phase.OUTLINING));
    }
}
