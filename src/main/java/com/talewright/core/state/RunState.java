package com.talewright.core.state;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.talewright.core.model.AgentMessage;
import com.talewright.core.model.Constraint;
import com.talewright.core.model.Critique;
import com.talewright.core.model.ModelConfig;
import com.talewright.core.model.Phase;
import com.talewright.core.model.RawFact;
import com.talewright.core.model.RunStatus;
import com.talewright.core.model.SceneDraft;
import com.talewright.core.model.SceneOutline;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Complete mutable state of one run.
 * <p>
 * Owned by the run registry and advanced only by the execution currently holding the run
 * (single writer). Pause and cancel flags are the only fields written from other threads.
 * All accessors synchronize on the instance and collection getters return copies, so a
 * concurrent reader (status query, snapshot) never observes a half-applied mutation.
 * <p>
 * The class is a plain Jackson bean: {@link RunStateCodec} round-trips it field for field,
 * which is what shutdown snapshots rely on.
 */
public class RunState {

    private String runId;
    private String projectId;
    private String seedIdea;
    private ModelConfig modelConfig;
    private Phase phase = Phase.CONCEPT;
    private int currentScene;
    private int totalScenes;
    private List<SceneOutline> outline = new ArrayList<>();
    private Map<String, Object> artifacts = new LinkedHashMap<>();
    private List<String> characterNames = new ArrayList<>();
    private TreeMap<Integer, SceneDraft> drafts = new TreeMap<>();
    private TreeMap<Integer, List<Critique>> critiques = new TreeMap<>();
    private TreeMap<Integer, Integer> revisionCount = new TreeMap<>();
    private TreeMap<Integer, Integer> expansionCount = new TreeMap<>();
    private List<Constraint> keyConstraints = new ArrayList<>();
    private List<RawFact> rawFactsLog = new ArrayList<>();
    private int lastArchivistScene;
    private List<AgentMessage> messages = new ArrayList<>();
    private volatile boolean paused;
    private volatile boolean cancelled;
    private boolean completed;
    private String error;
    private Instant startedAt;
    private Instant updatedAt;

    public RunState() {
    }

    public static RunState create(String runId, String projectId, String seedIdea, ModelConfig modelConfig,
                                  Instant now) {
        RunState state = new RunState();
        state.runId = runId;
        state.projectId = projectId;
        state.seedIdea = seedIdea;
        state.modelConfig = modelConfig;
        state.startedAt = now;
        state.updatedAt = now;
        return state;
    }

    // ── Derived ─────────────────────────────────────────────────────

    @JsonIgnore
    public synchronized RunStatus status() {
        if (error != null) {
            return RunStatus.FAILED;
        }
        if (cancelled) {
            return RunStatus.CANCELLED;
        }
        if (completed) {
            return RunStatus.COMPLETED;
        }
        return paused ? RunStatus.PAUSED : RunStatus.RUNNING;
    }

    @JsonIgnore
    public boolean isTerminal() {
        return status().terminal();
    }

    // ── Scalars ─────────────────────────────────────────────────────

    public synchronized String getRunId() {
        return runId;
    }

    public synchronized void setRunId(String runId) {
        this.runId = runId;
    }

    public synchronized String getProjectId() {
        return projectId;
    }

    public synchronized void setProjectId(String projectId) {
        this.projectId = projectId;
    }

    public synchronized String getSeedIdea() {
        return seedIdea;
    }

    public synchronized void setSeedIdea(String seedIdea) {
        this.seedIdea = seedIdea;
    }

    public synchronized ModelConfig getModelConfig() {
        return modelConfig;
    }

    public synchronized void setModelConfig(ModelConfig modelConfig) {
        this.modelConfig = modelConfig;
    }

    public synchronized Phase getPhase() {
        return phase;
    }

    public synchronized void setPhase(Phase phase) {
        this.phase = phase;
    }

    public synchronized int getCurrentScene() {
        return currentScene;
    }

    public synchronized void setCurrentScene(int currentScene) {
        this.currentScene = currentScene;
    }

    public synchronized int getTotalScenes() {
        return totalScenes;
    }

    public synchronized void setTotalScenes(int totalScenes) {
        this.totalScenes = totalScenes;
    }

    public synchronized int getLastArchivistScene() {
        return lastArchivistScene;
    }

    public synchronized void setLastArchivistScene(int lastArchivistScene) {
        this.lastArchivistScene = lastArchivistScene;
    }

    public boolean isPaused() {
        return paused;
    }

    public void setPaused(boolean paused) {
        this.paused = paused;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public void setCancelled(boolean cancelled) {
        this.cancelled = cancelled;
    }

    public synchronized boolean isCompleted() {
        return completed;
    }

    public synchronized void setCompleted(boolean completed) {
        this.completed = completed;
    }

    public synchronized String getError() {
        return error;
    }

    public synchronized void setError(String error) {
        this.error = error;
    }

    public synchronized Instant getStartedAt() {
        return startedAt;
    }

    public synchronized void setStartedAt(Instant startedAt) {
        this.startedAt = startedAt;
    }

    public synchronized Instant getUpdatedAt() {
        return updatedAt;
    }

    public synchronized void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    // ── Plan and phase artifacts ────────────────────────────────────

    public synchronized List<SceneOutline> getOutline() {
        return List.copyOf(outline);
    }

    public synchronized void setOutline(List<SceneOutline> outline) {
        this.outline = new ArrayList<>(outline);
    }

    public synchronized Optional<SceneOutline> sceneOutline(int sceneNumber) {
        return outline.stream().filter(s -> s.sceneNumber() == sceneNumber).findFirst();
    }

    public synchronized Map<String, Object> getArtifacts() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(artifacts));
    }

    public synchronized void setArtifacts(Map<String, Object> artifacts) {
        this.artifacts = new LinkedHashMap<>(artifacts);
    }

    public synchronized void putArtifact(String artifactType, Object content) {
        artifacts.put(artifactType, content);
    }

    @SuppressWarnings("unchecked")
    public synchronized Map<String, Object> artifact(String artifactType) {
        Object raw = artifacts.get(artifactType);
        return raw instanceof Map<?, ?> m ? (Map<String, Object>) m : Map.of();
    }

    public synchronized List<String> getCharacterNames() {
        return List.copyOf(characterNames);
    }

    public synchronized void setCharacterNames(List<String> characterNames) {
        this.characterNames = new ArrayList<>(characterNames);
    }

    public synchronized void addCharacterName(String name) {
        if (name != null && !name.isBlank() && !characterNames.contains(name)) {
            characterNames.add(name);
        }
    }

    // ── Scene bookkeeping ───────────────────────────────────────────

    public synchronized Map<Integer, SceneDraft> getDrafts() {
        return Collections.unmodifiableMap(new TreeMap<>(drafts));
    }

    public synchronized void setDrafts(Map<Integer, SceneDraft> drafts) {
        this.drafts = new TreeMap<>(drafts);
    }

    public synchronized Optional<SceneDraft> draft(int sceneNumber) {
        return Optional.ofNullable(drafts.get(sceneNumber));
    }

    public synchronized void putDraft(SceneDraft draft) {
        drafts.put(draft.sceneNumber(), draft);
    }

    public synchronized Map<Integer, List<Critique>> getCritiques() {
        var copy = new TreeMap<Integer, List<Critique>>();
        critiques.forEach((scene, list) -> copy.put(scene, List.copyOf(list)));
        return Collections.unmodifiableMap(copy);
    }

    public synchronized void setCritiques(Map<Integer, List<Critique>> critiques) {
        this.critiques = new TreeMap<>();
        critiques.forEach((scene, list) -> this.critiques.put(scene, new ArrayList<>(list)));
    }

    public synchronized List<Critique> critiquesFor(int sceneNumber) {
        return List.copyOf(critiques.getOrDefault(sceneNumber, List.of()));
    }

    public synchronized void addCritique(int sceneNumber, Critique critique) {
        critiques.computeIfAbsent(sceneNumber, k -> new ArrayList<>()).add(critique);
    }

    public synchronized Map<Integer, Integer> getRevisionCount() {
        return Collections.unmodifiableMap(new TreeMap<>(revisionCount));
    }

    public synchronized void setRevisionCount(Map<Integer, Integer> revisionCount) {
        this.revisionCount = new TreeMap<>(revisionCount);
    }

    public synchronized int revisionsFor(int sceneNumber) {
        return revisionCount.getOrDefault(sceneNumber, 0);
    }

    public synchronized int incrementRevisions(int sceneNumber) {
        return revisionCount.merge(sceneNumber, 1, Integer::sum);
    }

    public synchronized Map<Integer, Integer> getExpansionCount() {
        return Collections.unmodifiableMap(new TreeMap<>(expansionCount));
    }

    public synchronized void setExpansionCount(Map<Integer, Integer> expansionCount) {
        this.expansionCount = new TreeMap<>(expansionCount);
    }

    /** Length expansions already applied to the scene's first draft. */
    public synchronized int expansionsFor(int sceneNumber) {
        return expansionCount.getOrDefault(sceneNumber, 0);
    }

    public synchronized int incrementExpansions(int sceneNumber) {
        return expansionCount.merge(sceneNumber, 1, Integer::sum);
    }

    // ── Continuity ──────────────────────────────────────────────────

    public synchronized List<Constraint> getKeyConstraints() {
        return List.copyOf(keyConstraints);
    }

    public synchronized void setKeyConstraints(List<Constraint> keyConstraints) {
        this.keyConstraints = new ArrayList<>(keyConstraints);
    }

    public synchronized void appendConstraint(Constraint constraint) {
        keyConstraints.add(constraint);
    }

    public synchronized List<RawFact> getRawFactsLog() {
        return List.copyOf(rawFactsLog);
    }

    public synchronized void setRawFactsLog(List<RawFact> rawFactsLog) {
        this.rawFactsLog = new ArrayList<>(rawFactsLog);
    }

    public synchronized void appendRawFacts(List<RawFact> facts) {
        rawFactsLog.addAll(facts);
    }

    // ── Audit trail ─────────────────────────────────────────────────

    public synchronized List<AgentMessage> getMessages() {
        return List.copyOf(messages);
    }

    public synchronized void setMessages(List<AgentMessage> messages) {
        this.messages = new ArrayList<>(messages);
    }

    public synchronized void appendMessage(AgentMessage message) {
        messages.add(message);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RunState other)) return false;
        return getCurrentScene() == other.getCurrentScene()
                && getTotalScenes() == other.getTotalScenes()
                && getLastArchivistScene() == other.getLastArchivistScene()
                && isPaused() == other.isPaused()
                && isCancelled() == other.isCancelled()
                && isCompleted() == other.isCompleted()
                && Objects.equals(getRunId(), other.getRunId())
                && Objects.equals(getProjectId(), other.getProjectId())
                && Objects.equals(getSeedIdea(), other.getSeedIdea())
                && Objects.equals(getModelConfig(), other.getModelConfig())
                && getPhase() == other.getPhase()
                && Objects.equals(getOutline(), other.getOutline())
                && Objects.equals(getArtifacts(), other.getArtifacts())
                && Objects.equals(getCharacterNames(), other.getCharacterNames())
                && Objects.equals(getDrafts(), other.getDrafts())
                && Objects.equals(getCritiques(), other.getCritiques())
                && Objects.equals(getRevisionCount(), other.getRevisionCount())
                && Objects.equals(getExpansionCount(), other.getExpansionCount())
                && Objects.equals(getKeyConstraints(), other.getKeyConstraints())
                && Objects.equals(getRawFactsLog(), other.getRawFactsLog())
                && Objects.equals(getMessages(), other.getMessages())
                && Objects.equals(getError(), other.getError())
                && Objects.equals(getStartedAt(), other.getStartedAt())
                && Objects.equals(getUpdatedAt(), other.getUpdatedAt());
    }

    @Override
    public int hashCode() {
        return Objects.hash(getRunId(), getProjectId(), getPhase(), getCurrentScene(), getTotalScenes(),
                getLastArchivistScene(), isPaused(), isCancelled(), isCompleted(), getError());
    }

    @Override
    public String toString() {
        return "RunState[" + getRunId() + " " + status() + " phase=" + getPhase()
                + " scene=" + getCurrentScene() + "/" + getTotalScenes() + "]";
    }
}
