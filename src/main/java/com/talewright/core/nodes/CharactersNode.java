package com.talewright.core.nodes;

import com.talewright.core.engine.PhaseFailedException;
import com.talewright.core.engine.RunContext;
import com.talewright.core.llm.StructuredReply;
import com.talewright.core.model.CharacterRoster;
import com.talewright.core.model.CharacterRoster.CharacterProfile;
import com.talewright.core.model.Phase;
import com.talewright.core.search.SemanticSearch;
import com.talewright.core.state.RunState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Designs the cast. Every character name joins the run's canonical-name allow-list, and each
 * profile is indexed for semantic grounding.
 */
@Component
public class CharactersNode extends AbstractAgentPhaseNode {

    private static final Logger log = LoggerFactory.getLogger(CharactersNode.class);

    private final SemanticSearch search;

    public CharactersNode(SemanticSearch search) {
        super(Phase.CHARACTERS);
        this.search = search;
    }

    @Override
    public Map<String, Object> execute(RunContext ctx) {
        String task = """
                Design the main characters. Return JSON {"characters": [{"name", "role", "description",
                "motivation", "voice", "relationships"}]}. Use full names and keep them consistent.
                """;
        StructuredReply<CharacterRoster> reply = askPrimary(ctx, task, priorArtifacts(ctx, Phase.CONCEPT),
                CharacterRoster.class);
        List<CharacterProfile> characters = reply.value().characters();
        if (characters.isEmpty()) {
            throw new PhaseFailedException(phase(), "No characters were designed");
        }

        RunState state = ctx.state();
        for (CharacterProfile character : characters) {
            if (character == null || character.name() == null || character.name().isBlank()) {
                continue;
            }
            String name = character.name().strip();
            state.addCharacterName(name);
            search.store(name + ": " + nullToEmpty(character.description()) + " " + nullToEmpty(character.motivation()),
                    Map.of("runId", ctx.runId(), "kind", "character", "name", name));
        }
        log.info("Registered {} character name(s)", state.getCharacterNames().size());
        return reply.reply().json();
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
