package com.talewright.core.nodes;

import com.talewright.core.engine.RunContext;
import com.talewright.core.model.Critique;
import com.talewright.core.model.Phase;
import com.talewright.core.model.SceneDraft;
import com.talewright.core.state.RunState;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Summarises the critiques the drafting loop collected. No agent is called again.
 */
@Component
public class CritiqueNode extends AbstractAgentPhaseNode {

    public CritiqueNode() {
        super(Phase.CRITIQUE);
    }

    @Override
    public Map<String, Object> execute(RunContext ctx) {
        RunState state = ctx.state();
        List<Map<String, Object>> scenes = new ArrayList<>();
        for (SceneDraft draft : state.getDrafts().values()) {
            List<Critique> critiques = state.critiquesFor(draft.sceneNumber());
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("sceneNumber", draft.sceneNumber());
            entry.put("approved", draft.approved());
            entry.put("critiques", critiques.size());
            entry.put("lastScore", critiques.isEmpty() ? 0.0 : critiques.get(critiques.size() - 1).score());
            scenes.add(entry);
        }
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("scenes", scenes);
        summary.put("approvedScenes", (int) scenes.stream().filter(s -> Boolean.TRUE.equals(s.get("approved"))).count());
        return summary;
    }
}
