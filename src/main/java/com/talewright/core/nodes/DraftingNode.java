package com.talewright.core.nodes;

import com.talewright.core.drafting.DraftingLoop;
import com.talewright.core.engine.RunContext;
import com.talewright.core.model.Phase;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
public class DraftingNode extends AbstractAgentPhaseNode {

    private final DraftingLoop draftingLoop;

    public DraftingNode(DraftingLoop draftingLoop) {
        super(Phase.DRAFTING);
        this.draftingLoop = draftingLoop;
    }

    @Override
    public Map<String, Object> execute(RunContext ctx) {
        return draftingLoop.run(ctx);
    }
}
