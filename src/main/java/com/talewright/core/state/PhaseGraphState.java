package com.talewright.core.state;

import com.talewright.core.model.Phase;
import org.bsc.langgraph4j.state.AgentState;
import org.bsc.langgraph4j.state.Channel;
import org.bsc.langgraph4j.state.Channels;

import java.util.Map;

/**
 * LangGraph4j state flowing through the phase graph.
 * <p>
 * The graph only carries the routing cursor; the run's real state lives in {@link RunState},
 * looked up by {@code runId}.
 */
public class PhaseGraphState extends AgentState {

    public static final Map<String, Channel<?>> SCHEMA = Map.ofEntries(
        Map.entry("runId",  Channels.base(() -> "")),
        Map.entry("phase",  Channels.base(() -> Phase.CONCEPT.name())),
        Map.entry("halted", Channels.base(() -> false)),
        Map.entry("done",   Channels.base(() -> false))
    );

    public PhaseGraphState(Map<String, Object> initData) {
        super(initData);
    }

    public String runId() {
        return this.<String>value("runId").orElse("");
    }

    public Phase phase() {
        return Phase.valueOf(this.<String>value("phase").orElse(Phase.CONCEPT.name()));
    }

    public boolean halted() {
        return this.<Boolean>value("halted").orElse(false);
    }

    public boolean done() {
        return this.<Boolean>value("done").orElse(false);
    }
}
