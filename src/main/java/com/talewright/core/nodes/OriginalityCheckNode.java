package com.talewright.core.nodes;

import com.talewright.core.engine.RunContext;
import com.talewright.core.model.Phase;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
public class OriginalityCheckNode extends AbstractAgentPhaseNode {

    public OriginalityCheckNode() {
        super(Phase.ORIGINALITY_CHECK);
    }

    @Override
    public Map<String, Object> execute(RunContext ctx) {
        String task = """
                Review the manuscript for originality. Return JSON with: score (0-10), cliches (list),
                derivative_elements (list), notes (string).
                """;
        return askPrimary(ctx, task, "MANUSCRIPT:\n" + manuscript(ctx.state()));
    }
}
