package com.talewright.core.nodes;

import com.talewright.core.engine.RunContext;
import com.talewright.core.model.Phase;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
public class ImpactAssessmentNode extends AbstractAgentPhaseNode {

    public ImpactAssessmentNode() {
        super(Phase.IMPACT_ASSESSMENT);
    }

    @Override
    public Map<String, Object> execute(RunContext ctx) {
        String task = """
                Assess the manuscript's impact on a reader. Return JSON with: emotional_resonance (0-10),
                pacing (0-10), engagement (0-10), strongest_scenes (list), weakest_scenes (list), notes (string).
                """;
        return askPrimary(ctx, task, "MANUSCRIPT:\n" + manuscript(ctx.state()));
    }
}
