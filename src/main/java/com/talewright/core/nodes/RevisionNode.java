package com.talewright.core.nodes;

import com.talewright.core.engine.RunContext;
import com.talewright.core.model.Phase;
import com.talewright.core.state.RunState;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Summarises the revision budget spent per scene. No agent is called again.
 */
@Component
public class RevisionNode extends AbstractAgentPhaseNode {

    public RevisionNode() {
        super(Phase.REVISION);
    }

    @Override
    public Map<String, Object> execute(RunContext ctx) {
        RunState state = ctx.state();
        Map<String, Object> perScene = new LinkedHashMap<>();
        int total = 0;
        for (int sceneNumber : state.getDrafts().keySet()) {
            int revisions = state.revisionsFor(sceneNumber);
            perScene.put(String.valueOf(sceneNumber), revisions);
            total += revisions;
        }
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("revisionsPerScene", perScene);
        summary.put("totalRevisions", total);
        return summary;
    }
}
