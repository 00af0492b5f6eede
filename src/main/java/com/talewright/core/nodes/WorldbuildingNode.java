package com.talewright.core.nodes;

import com.talewright.core.engine.RunContext;
import com.talewright.core.llm.StructuredReply;
import com.talewright.core.model.Phase;
import com.talewright.core.model.WorldBible;
import com.talewright.core.model.WorldBible.WorldElement;
import com.talewright.core.search.SemanticSearch;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Defines places, rules and history, and indexes each element for semantic grounding.
 */
@Component
public class WorldbuildingNode extends AbstractAgentPhaseNode {

    private final SemanticSearch search;

    public WorldbuildingNode(SemanticSearch search) {
        super(Phase.WORLDBUILDING);
        this.search = search;
    }

    @Override
    public Map<String, Object> execute(RunContext ctx) {
        String task = """
                Build the story world. Return JSON {"elements": [{"name", "category", "description"}],
                "rules": [string]}. Categories: location, culture, history, technology, magic, other.
                """;
        StructuredReply<WorldBible> reply = askPrimary(ctx, task, priorArtifacts(ctx, Phase.CONCEPT, Phase.CHARACTERS),
                WorldBible.class);
        WorldBible world = reply.value();
        for (WorldElement element : world.elements()) {
            if (element == null) {
                continue;
            }
            String name = nullToEmpty(element.name());
            String description = nullToEmpty(element.description());
            if (name.isEmpty() && description.isEmpty()) {
                continue;
            }
            search.store(name + ": " + description, Map.of(
                    "runId", ctx.runId(), "kind", "world", "name", name,
                    "category", nullToEmpty(element.category())));
        }
        for (String rule : world.rules()) {
            if (rule != null && !rule.isBlank()) {
                search.store(rule, Map.of("runId", ctx.runId(), "kind", "world", "category", "rule"));
            }
        }
        return reply.reply().json();
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s.strip();
    }
}
