package com.talewright.core.nodes;

import com.talewright.core.drafting.ProseText;
import com.talewright.core.engine.RunContext;
import com.talewright.core.model.Phase;
import com.talewright.core.model.SceneDraft;
import com.talewright.core.state.RunState;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Assembles the canonical manuscript from the finalized scenes. Scenes were already polished one
 * by one in the drafting loop, so this phase makes no agent call.
 */
@Component
public class PolishNode extends AbstractAgentPhaseNode {

    public PolishNode() {
        super(Phase.POLISH);
    }

    @Override
    public Map<String, Object> execute(RunContext ctx) {
        RunState state = ctx.state();
        List<Map<String, Object>> scenes = new ArrayList<>();
        for (SceneDraft draft : state.getDrafts().values()) {
            Map<String, Object> scene = new LinkedHashMap<>();
            scene.put("sceneNumber", draft.sceneNumber());
            scene.put("title", state.sceneOutline(draft.sceneNumber()).map(s -> s.title()).orElse(""));
            scene.put("content", draft.content());
            scene.put("wordCount", draft.wordCount());
            scene.put("polished", draft.polished());
            scenes.add(scene);
        }
        String manuscript = manuscript(state);
        Map<String, Object> finalDraft = new LinkedHashMap<>();
        Object title = state.artifact(Phase.CONCEPT.outputArtifact()).get("title");
        finalDraft.put("title", title == null ? "" : title.toString().strip());
        finalDraft.put("scenes", scenes);
        finalDraft.put("wordCount", ProseText.wordCount(manuscript));
        finalDraft.put("manuscript", manuscript);
        return finalDraft;
    }
}
