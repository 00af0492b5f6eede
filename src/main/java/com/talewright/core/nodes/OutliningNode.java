package com.talewright.core.nodes;

import com.talewright.core.drafting.DraftingProperties;
import com.talewright.core.engine.PhaseFailedException;
import com.talewright.core.engine.RunContext;
import com.talewright.core.llm.StructuredReply;
import com.talewright.core.model.Phase;
import com.talewright.core.model.SceneOutline;
import com.talewright.core.model.ScenePlan;
import com.talewright.core.state.RunState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Plans the plot as an ordered list of scenes. The plan fixes the run's scene count.
 */
@Component
public class OutliningNode extends AbstractAgentPhaseNode {

    private static final Logger log = LoggerFactory.getLogger(OutliningNode.class);

    private final DraftingProperties drafting;

    public OutliningNode(DraftingProperties drafting) {
        super(Phase.OUTLINING);
        this.drafting = drafting;
    }

    @Override
    public Map<String, Object> execute(RunContext ctx) {
        String task = """
                Outline the story as an ordered list of scenes. Return JSON {"scenes": [{"title", "summary",
                "characters": [full names], "target_word_count"}]}. Only use characters that were designed.
                """;
        StructuredReply<ScenePlan> plan = askPrimary(ctx, task,
                priorArtifacts(ctx, Phase.CONCEPT, Phase.CHARACTERS, Phase.NARRATOR_DESIGN, Phase.WORLDBUILDING),
                ScenePlan.class);

        List<SceneOutline> outline = new ArrayList<>();
        for (ScenePlan.PlannedScene scene : plan.value().scenes()) {
            if (scene == null) {
                continue;
            }
            int target = scene.targetWordCount() != null && scene.targetWordCount() > 0
                    ? scene.targetWordCount() : drafting.getDefaultTargetWords();
            outline.add(new SceneOutline(
                    outline.size() + 1,
                    nullToEmpty(scene.title()),
                    nullToEmpty(scene.summary()),
                    scene.characters() == null ? List.of()
                            : scene.characters().stream().filter(c -> c != null && !c.isBlank()).toList(),
                    target));
        }
        if (outline.isEmpty()) {
            throw new PhaseFailedException(phase(), "Outline contains no scenes");
        }

        RunState state = ctx.state();
        state.setOutline(outline);
        state.setTotalScenes(outline.size());
        log.info("Outline planned {} scene(s)", outline.size());
        return plan.reply().json();
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
