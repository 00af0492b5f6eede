package com.talewright.core.nodes;

import com.talewright.core.engine.PhaseFailedException;
import com.talewright.core.engine.RunContext;
import com.talewright.core.llm.StructuredReply;
import com.talewright.core.model.Constraint;
import com.talewright.core.model.Phase;
import com.talewright.core.model.StoryConcept;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Develops the seed idea into a story concept and anchors its core facts as immutable constraints.
 */
@Component
public class ConceptNode extends AbstractAgentPhaseNode {

    private static final Logger log = LoggerFactory.getLogger(ConceptNode.class);

    public ConceptNode() {
        super(Phase.CONCEPT);
    }

    @Override
    public Map<String, Object> execute(RunContext ctx) {
        String task = """
                Develop a story concept from the seed idea. Return JSON with: title, logline, genre, tone,
                premise, protagonist (name and one-line identity), setting, theme, point_of_view, central_conflict.
                """;
        StructuredReply<StoryConcept> reply = askPrimary(ctx, task, priorArtifacts(ctx), StoryConcept.class);
        Map<String, Object> concept = reply.reply().json();
        if (concept.isEmpty() || reply.value() == null) {
            throw new PhaseFailedException(phase(), "Concept reply was empty");
        }

        Instant now = Instant.now();
        List<Constraint> seeds = new ArrayList<>();
        reply.value().anchors().forEach((key, value) -> seeds.add(Constraint.seed(key, value, "concept", now)));
        seeds.add(Constraint.seed("plot_seed_idea", ctx.state().getSeedIdea(), "seed idea", now));
        int added = ctx.constraints().seed(seeds);
        log.info("Concept anchored {} constraint(s)", added);
        return concept;
    }
}
