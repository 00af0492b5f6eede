package com.talewright.core.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.talewright.core.continuity.ConstraintStore;
import com.talewright.core.continuity.EntityNames;
import com.talewright.core.events.EventBus;
import com.talewright.core.events.RunEvent;
import com.talewright.core.llm.AgentInvoker;
import com.talewright.core.llm.AgentReply;
import com.talewright.core.llm.OutputFormat;
import com.talewright.core.llm.PromptContext;
import com.talewright.core.llm.StructuredReply;
import com.talewright.core.model.AgentMessage;
import com.talewright.core.model.AgentRole;
import com.talewright.core.model.MessageType;
import com.talewright.core.model.Phase;
import com.talewright.core.persistence.ArtifactStore;
import com.talewright.core.state.RunState;
import com.talewright.core.state.RunStateCodec;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * What a phase node sees of its run: the state, the run's constraint store, and the
 * collaborators it may call. One context exists per execution.
 */
public class RunContext {

    private static final int MESSAGE_PREVIEW_CHARS = 500;

    private final RunHandle handle;
    private final EventBus eventBus;
    private final AgentInvoker invoker;
    private final ArtifactStore artifactStore;
    private final RunStateCodec codec;
    private final ObjectMapper mapper;
    private final ConstraintStore constraints;
    private volatile RuntimeException failure;

    public RunContext(RunHandle handle, EventBus eventBus, AgentInvoker invoker, ArtifactStore artifactStore,
                      RunStateCodec codec, ObjectMapper mapper) {
        this.handle = handle;
        this.eventBus = eventBus;
        this.invoker = invoker;
        this.artifactStore = artifactStore;
        this.codec = codec;
        this.mapper = mapper;
        this.constraints = new ConstraintStore(handle.state());
    }

    public RunState state() {
        return handle.state();
    }

    public String runId() {
        return handle.runId();
    }

    public ConstraintStore constraints() {
        return constraints;
    }

    public EntityNames entityNames() {
        return EntityNames.of(state().getCharacterNames());
    }

    /**
     * Checkpoint boundary: records the current state as the last consistent one, then stops the
     * execution if the run was paused or cancelled.
     *
     * @throws RunHaltedException when the run must stop here
     */
    public void checkpoint() {
        RunState state = state();
        state.setUpdatedAt(Instant.now());
        handle.recordCheckpoint(codec.toJson(state));
        if (state.isCancelled()) {
            throw new RunHaltedException(runId(), RunHaltedException.Cause.CANCELLED);
        }
        if (state.isPaused()) {
            throw new RunHaltedException(runId(), RunHaltedException.Cause.PAUSED);
        }
    }

    public RunEvent publish(String type, Map<String, Object> data) {
        return eventBus.publish(runId(), type, data);
    }

    public PromptContext prompt(Phase phase, int sceneNumber, String task, String context, OutputFormat format) {
        return new PromptContext(state().getModelConfig(), phase, sceneNumber, task, context,
                phase.maxOutputTokens(), format);
    }

    /**
     * Calls an agent without recording the turn.
     */
    public AgentReply call(AgentRole role, PromptContext prompt) {
        return invoker.call(role, prompt);
    }

    /**
     * Calls an agent and records its reply as an artifact message addressed to {@code recipient}.
     */
    public AgentReply callAndRecord(AgentRole role, AgentRole recipient, PromptContext prompt) {
        AgentReply reply = invoker.call(role, prompt);
        record(role, recipient, MessageType.ARTIFACT, reply, prompt.phase(), prompt.sceneNumber());
        return reply;
    }

    /**
     * Calls an agent for a reply bound to {@code type}, without recording the turn.
     */
    public <T> StructuredReply<T> callStructured(AgentRole role, PromptContext prompt, Class<T> type) {
        return invoker.callStructured(role, prompt, type);
    }

    /**
     * Calls an agent for a reply bound to {@code type} and records it as an artifact message.
     */
    public <T> StructuredReply<T> callStructuredAndRecord(AgentRole role, AgentRole recipient, PromptContext prompt,
                                                          Class<T> type) {
        StructuredReply<T> reply = invoker.callStructured(role, prompt, type);
        record(role, recipient, MessageType.ARTIFACT, reply.reply(), prompt.phase(), prompt.sceneNumber());
        return reply;
    }

    /**
     * Appends an agent turn to the run's audit trail.
     */
    public void record(AgentRole sender, AgentRole recipient, MessageType type, AgentReply reply, Phase phase,
                       int sceneNumber) {
        String text = reply.text();
        String preview = text.length() > MESSAGE_PREVIEW_CHARS ? text.substring(0, MESSAGE_PREVIEW_CHARS) : text;
        state().appendMessage(new AgentMessage(sender, recipient, type, preview,
                reply.json().isEmpty() ? null : reply.json(), phase, sceneNumber, Instant.now()));
    }

    /**
     * Pretty JSON of an earlier artifact or any other value, for use as prompt context.
     */
    public String render(Object value) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Value is not serializable", e);
        }
    }

    public void fail(RuntimeException e) {
        this.failure = e;
    }

    /** The exception that failed the execution, if any. */
    public Optional<RuntimeException> failure() {
        return Optional.ofNullable(failure);
    }

    /**
     * Persists an artifact as JSON under {@code (runId, artifactType)}.
     *
     * @throws com.talewright.core.persistence.StorageException when the store is unreachable
     */
    public void saveArtifact(String artifactType, Object content) {
        try {
            artifactStore.put(runId(), artifactType, mapper.writeValueAsString(content));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Artifact " + artifactType + " is not serializable", e);
        }
    }
}
