package com.talewright.core.continuity;

import com.talewright.core.model.Constraint;
import com.talewright.core.model.SceneOutline;
import com.talewright.core.search.SearchHit;
import com.talewright.core.search.SemanticSearch;
import com.talewright.core.state.RunState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Builds the continuity context injected before every Writer and Critic call: the relevant
 * constraints and a few semantically retrieved characters, world facts and earlier scenes.
 */
@Component
public class ContextAssembler {

    private static final Logger log = LoggerFactory.getLogger(ContextAssembler.class);

    static final int PLOT_WINDOW_SCENES = 10;
    static final int HITS_PER_KIND = 3;
    private static final int SNIPPET_CHARS = 400;

    private final SemanticSearch search;

    public ContextAssembler(SemanticSearch search) {
        this.search = search;
    }

    /**
     * Constraints relevant to a scene. Anchored constraints are always included. {@code char_*}
     * keys are limited to characters in the scene when the outline names any, {@code plot_*} keys
     * to the last {@value #PLOT_WINDOW_SCENES} scenes; everything else is included.
     */
    public List<Constraint> relevantConstraints(RunState state, SceneOutline scene) {
        List<Constraint> resolved = new ConstraintStore(state).resolved();
        Set<String> sceneSlugs = scene.characters() == null ? Set.of()
                : scene.characters().stream().map(EntityNames::slug).collect(Collectors.toSet());
        return resolved.stream()
                .filter(c -> c.anchored() || isRelevant(c, scene.sceneNumber(), sceneSlugs))
                .toList();
    }

    public String constraintsBlock(RunState state, SceneOutline scene) {
        return ConstraintStore.render(relevantConstraints(state, scene));
    }

    /**
     * Nearest neighbours of the scene summary among this run's indexed documents, grouped by kind.
     * Returns an empty string when nothing is indexed or the search backend fails.
     */
    public String groundingBlock(RunState state, SceneOutline scene) {
        String query = scene.title() + " " + scene.summary()
                + (scene.characters() == null ? "" : " " + String.join(" ", scene.characters()));
        StringBuilder sb = new StringBuilder();
        try {
            appendKind(sb, "Characters", search.search(query, HITS_PER_KIND,
                    Map.of("runId", state.getRunId(), "kind", "character")));
            appendKind(sb, "World", search.search(query, HITS_PER_KIND,
                    Map.of("runId", state.getRunId(), "kind", "world")));
            List<SearchHit> scenes = search.search(query, HITS_PER_KIND + 1,
                    Map.of("runId", state.getRunId(), "kind", "scene")).stream()
                    .filter(h -> !String.valueOf(scene.sceneNumber()).equals(h.metadata().get("sceneNumber")))
                    .limit(HITS_PER_KIND)
                    .toList();
            appendKind(sb, "Earlier scenes", scenes);
        } catch (RuntimeException e) {
            log.warn("Semantic grounding unavailable for run {} scene {}: {}",
                    state.getRunId(), scene.sceneNumber(), e.getMessage());
            return "";
        }
        return sb.toString().stripTrailing();
    }

    private static boolean isRelevant(Constraint c, int sceneNumber, Set<String> sceneSlugs) {
        String key = c.key();
        if (key.startsWith("char_") && !sceneSlugs.isEmpty()) {
            return sceneSlugs.stream().anyMatch(slug -> key.startsWith("char_" + slug + "_"));
        }
        if (key.startsWith("plot_")) {
            return sceneNumber - c.sceneNumber() <= PLOT_WINDOW_SCENES;
        }
        return true;
    }

    private static void appendKind(StringBuilder sb, String heading, List<SearchHit> hits) {
        if (hits.isEmpty()) {
            return;
        }
        sb.append(heading).append(":\n");
        for (SearchHit hit : hits) {
            String text = hit.text();
            if (text.length() > SNIPPET_CHARS) {
                text = text.substring(0, SNIPPET_CHARS) + "...";
            }
            sb.append("- ").append(text.replace('\n', ' ')).append('\n');
        }
        sb.append('\n');
    }
}
