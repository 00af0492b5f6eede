package com.talewright.core.drafting;

import com.talewright.core.continuity.ConsolidationResult;
import com.talewright.core.continuity.ContextAssembler;
import com.talewright.core.continuity.EntityNames;
import com.talewright.core.continuity.FactExtractor;
import com.talewright.core.engine.RunContext;
import com.talewright.core.events.EventTypes;
import com.talewright.core.llm.AgentReply;
import com.talewright.core.llm.OutputFormat;
import com.talewright.core.llm.StructuredReply;
import com.talewright.core.logging.MdcContext;
import com.talewright.core.metrics.TalewrightMetrics;
import com.talewright.core.model.AgentRole;
import com.talewright.core.model.Constraint;
import com.talewright.core.model.ConstraintUpdates;
import com.talewright.core.model.ConstraintUpdates.ConstraintUpdate;
import com.talewright.core.model.Critique;
import com.talewright.core.model.CritiqueReport;
import com.talewright.core.model.DraftStatus;
import com.talewright.core.model.MessageType;
import com.talewright.core.model.Phase;
import com.talewright.core.model.RawFact;
import com.talewright.core.model.SceneDraft;
import com.talewright.core.model.SceneOutline;
import com.talewright.core.search.SemanticSearch;
import com.talewright.core.state.RunState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-scene Writer, Critic and Archivist loop run by the drafting phase.
 * <p>
 * A scene moves through draft, optional expansion, critique and bounded revision, the archivist
 * pass, an optional polish, and finalization. Every step records its result in {@link RunState}
 * before the next checkpoint, so a paused run re-enters the scene where it stopped: an existing
 * draft is not regenerated, a critique already recorded for the current draft is reused, and the
 * revision budget keeps counting from the recorded value.
 */
@Component
public class DraftingLoop {

    private static final Logger log = LoggerFactory.getLogger(DraftingLoop.class);

    static final double APPROVAL_SCORE = 8.0;

    private final DraftingProperties properties;
    private final PolishValidator polishValidator;
    private final FactExtractor factExtractor;
    private final ContextAssembler contextAssembler;
    private final SemanticSearch search;
    private final TalewrightMetrics metrics;

    public DraftingLoop(DraftingProperties properties, PolishValidator polishValidator, FactExtractor factExtractor,
                        ContextAssembler contextAssembler, SemanticSearch search, TalewrightMetrics metrics) {
        this.properties = properties;
        this.polishValidator = polishValidator;
        this.factExtractor = factExtractor;
        this.contextAssembler = contextAssembler;
        this.search = search;
        this.metrics = metrics;
    }

    /**
     * Runs every planned scene in order. Pause and cancel are honoured before each scene and
     * before each agent call.
     *
     * @return summary of the finalized scenes
     */
    public Map<String, Object> run(RunContext ctx) {
        RunState state = ctx.state();
        for (SceneOutline scene : state.getOutline()) {
            ctx.checkpoint();
            state.setCurrentScene(scene.sceneNumber());
            MdcContext.setScene(scene.sceneNumber());
            try {
                runScene(ctx, scene);
            } finally {
                MdcContext.clearScene();
            }
        }

        Map<String, Object> summary = new LinkedHashMap<>();
        List<SceneDraft> drafts = new ArrayList<>(state.getDrafts().values());
        summary.put("scenes", drafts.size());
        summary.put("approved", (int) drafts.stream().filter(SceneDraft::approved).count());
        summary.put("polished", (int) drafts.stream().filter(SceneDraft::polished).count());
        summary.put("wordCount", drafts.stream().mapToInt(SceneDraft::wordCount).sum());
        return summary;
    }

    void runScene(RunContext ctx, SceneOutline scene) {
        RunState state = ctx.state();
        int n = scene.sceneNumber();
        SceneDraft draft = state.draft(n).orElse(null);
        if (draft != null && draft.status() == DraftStatus.FINAL) {
            log.debug("Scene {} already final, skipping", n);
            return;
        }

        if (draft == null) {
            draft = draft(ctx, scene);
        }
        if (draft.status() == DraftStatus.DRAFTED && state.critiquesFor(n).isEmpty()) {
            draft = expand(ctx, scene, draft);
        }

        boolean approved;
        if (draft.status() == DraftStatus.ACCEPTED) {
            approved = draft.approved();
        } else {
            approved = review(ctx, scene);
            draft = state.draft(n).orElseThrow().accepted(approved, Instant.now());
            state.putDraft(draft);
            metrics.recordRevisions(state.revisionsFor(n));
            log.info("Scene {} accepted after {} revision(s), approved={}", n, state.revisionsFor(n), approved);
        }

        archivistPass(ctx, scene, draft.content());

        String canonical = draft.content();
        boolean polished = false;
        if (approved) {
            ctx.checkpoint();
            ctx.publish(EventTypes.SCENE_POLISH_START, Map.of("sceneNumber", n));
            String candidate = polish(ctx, scene, draft.content());
            PolishValidator.Result result = polishValidator.validate(draft.content(), candidate);
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("sceneNumber", n);
            if (result.valid()) {
                canonical = candidate;
                polished = true;
            } else {
                log.warn("Polish of scene {} rejected ({}): {}", n, result.reason(), result.detail());
                metrics.recordPolishFallback(result.reason().name());
                ctx.publish(EventTypes.SCENE_POLISH_REJECTED, Map.of(
                        "sceneNumber", n, "reason", result.reason().name(), "detail", result.detail()));
                data.put("fallbackReason", result.reason().name());
            }
            data.put("finalContent", canonical);
            data.put("wordCount", ProseText.wordCount(canonical));
            data.put("polished", polished);
            ctx.publish(EventTypes.SCENE_POLISH_COMPLETE, data);
        } else {
            ctx.publish(EventTypes.SCENE_FINAL, Map.of(
                    "sceneNumber", n,
                    "finalContent", canonical,
                    "wordCount", ProseText.wordCount(canonical),
                    "polished", false,
                    "approved", false));
        }

        finalizeScene(ctx, scene, draft, canonical, approved, polished);
    }

    // ── Draft and expand ────────────────────────────────────────────

    private SceneDraft draft(RunContext ctx, SceneOutline scene) {
        int n = scene.sceneNumber();
        int target = targetWords(scene);
        int beats = properties.beatsFor(target);
        ctx.publish(EventTypes.SCENE_DRAFT_START, Map.of(
                "sceneNumber", n, "title", nullToEmpty(scene.title()), "targetWordCount", target, "beats", beats));

        String context = writerContext(ctx, scene);
        String content = "";
        for (int beat = 1; beat <= beats; beat++) {
            ctx.checkpoint();
            String task;
            if (beats == 1) {
                task = "Write scene " + n + " in full, about " + target + " words.\n\n" + describe(scene);
            } else {
                task = "Write part " + beat + " of " + beats + " of scene " + n + ", about " + (target / beats)
                        + " words. " + (beat == 1 ? "Begin the scene." : "Continue directly from the text below "
                        + "without repeating it.\n\nTEXT SO FAR (ending):\n" + ProseText.tail(content, properties.getTailChars()))
                        + (beat == beats ? "\nBring the scene to its ending." : "\nDo not end the scene yet.")
                        + "\n\n" + describe(scene);
            }
            AgentReply reply = ctx.callAndRecord(AgentRole.WRITER, AgentRole.CRITIC,
                    ctx.prompt(Phase.DRAFTING, n, task, context, OutputFormat.PROSE));
            content = ProseText.append(content, ProseText.stripWordCountClaims(reply.text()),
                    properties.getOverlapMinChars(), properties.getOverlapWindowChars());
        }

        int words = ProseText.wordCount(content);
        SceneDraft draft = new SceneDraft(n, content, words, 1, DraftStatus.DRAFTED, false, false, Instant.now());
        ctx.state().putDraft(draft);
        ctx.publish(EventTypes.SCENE_DRAFT_COMPLETE, Map.of("sceneNumber", n, "wordCount", words, "beats", beats));
        log.info("Scene {} drafted: {} words in {} beat(s)", n, words, beats);
        return draft;
    }

    private SceneDraft expand(RunContext ctx, SceneOutline scene, SceneDraft draft) {
        int n = scene.sceneNumber();
        int target = targetWords(scene);
        double threshold = target * properties.getExpansionRatio();
        RunState state = ctx.state();
        boolean expanded = false;
        while (draft.wordCount() < threshold && state.expansionsFor(n) < properties.getMaxExpansions()) {
            ctx.checkpoint();
            int missing = target - draft.wordCount();
            String task = "The scene below is " + draft.wordCount() + " words; it should be about " + target
                    + ". Continue it from exactly where it stops, adding about " + missing
                    + " words. Do not repeat or summarise earlier text.\n\nSCENE SO FAR (ending):\n"
                    + ProseText.tail(draft.content(), properties.getTailChars()) + "\n\n" + describe(scene);
            AgentReply reply = ctx.callAndRecord(AgentRole.WRITER, AgentRole.CRITIC,
                    ctx.prompt(Phase.DRAFTING, n, task, writerContext(ctx, scene), OutputFormat.PROSE));
            String extended = ProseText.append(draft.content(), ProseText.stripWordCountClaims(reply.text()),
                    properties.getOverlapMinChars(), properties.getOverlapWindowChars());
            int words = ProseText.wordCount(extended);
            if (words <= draft.wordCount()) {
                log.info("Expansion of scene {} added nothing, handing off to critique", n);
                break;
            }
            draft = draft.extendedWith(extended, words, Instant.now());
            state.putDraft(draft);
            state.incrementExpansions(n);
            expanded = true;
        }
        if (expanded) {
            ctx.publish(EventTypes.SCENE_EXPANSION_COMPLETE, Map.of(
                    "sceneNumber", n, "expansions", state.expansionsFor(n), "wordCount", draft.wordCount()));
        }
        return draft;
    }

    // ── Critique and revision ───────────────────────────────────────

    /**
     * Critique and revise until the Critic approves or the revision budget is spent. Once the
     * budget is spent the latest revision is accepted without another critique.
     *
     * @return whether the last critique approved the draft
     */
    private boolean review(RunContext ctx, SceneOutline scene) {
        RunState state = ctx.state();
        int n = scene.sceneNumber();
        while (true) {
            if (state.revisionsFor(n) >= properties.getMaxRevisions()) {
                log.info("Scene {} reached the revision limit of {}", n, properties.getMaxRevisions());
                return false;
            }
            Critique critique = critiqueCurrentDraft(ctx, scene);
            if (critique.approved()) {
                return true;
            }
            revise(ctx, scene, critique);
        }
    }

    private Critique critiqueCurrentDraft(RunContext ctx, SceneOutline scene) {
        RunState state = ctx.state();
        int n = scene.sceneNumber();
        List<Critique> recorded = state.critiquesFor(n);
        if (recorded.size() > state.revisionsFor(n)) {
            return recorded.get(recorded.size() - 1);
        }

        ctx.checkpoint();
        ctx.publish(EventTypes.SCENE_CRITIQUE_START, Map.of("sceneNumber", n, "revision", state.revisionsFor(n)));
        SceneDraft draft = state.draft(n).orElseThrow();
        String task = "Critique this draft of scene " + n + " against its outline and the established facts. "
                + "Return JSON with: score (0-10), revision_needed (boolean), strengths (list), issues (list), "
                + "revision_requests (list), feedback (string).\n\n" + describe(scene)
                + "\n\nDRAFT (" + draft.wordCount() + " words):\n" + draft.content();
        StructuredReply<CritiqueReport> reply = ctx.callStructured(AgentRole.CRITIC,
                ctx.prompt(Phase.DRAFTING, n, task, reviewContext(ctx, scene), OutputFormat.JSON), CritiqueReport.class);
        Critique critique = reply.value().toCritique(APPROVAL_SCORE);
        state.addCritique(n, critique);
        ctx.record(AgentRole.CRITIC, AgentRole.WRITER,
                critique.approved() ? MessageType.APPROVAL : MessageType.REVISION_REQUEST, reply.reply(),
                Phase.DRAFTING, n);
        ctx.publish(EventTypes.SCENE_CRITIQUE_COMPLETE, Map.of(
                "sceneNumber", n, "score", critique.score(), "approved", critique.approved(),
                "issues", critique.issues()));
        return critique;
    }

    private void revise(RunContext ctx, SceneOutline scene, Critique critique) {
        RunState state = ctx.state();
        int n = scene.sceneNumber();
        ctx.checkpoint();
        int revision = state.revisionsFor(n) + 1;
        ctx.publish(EventTypes.SCENE_REVISION_START, Map.of("sceneNumber", n, "revision", revision));

        SceneDraft draft = state.draft(n).orElseThrow();
        StringBuilder task = new StringBuilder("Revise scene ").append(n).append(" to address the critique. ")
                .append("Return the complete revised scene.\n\n");
        if (!critique.issues().isEmpty()) {
            task.append("ISSUES:\n");
            critique.issues().forEach(i -> task.append("- ").append(i).append('\n'));
        }
        if (!critique.revisionRequests().isEmpty()) {
            task.append("REQUESTED CHANGES:\n");
            critique.revisionRequests().forEach(r -> task.append("- ").append(r).append('\n'));
        }
        if (critique.feedback() != null && !critique.feedback().isBlank()) {
            task.append("FEEDBACK: ").append(critique.feedback()).append('\n');
        }
        task.append('\n').append(describe(scene)).append("\n\nCURRENT DRAFT:\n").append(draft.content());

        AgentReply reply = ctx.callAndRecord(AgentRole.WRITER, AgentRole.CRITIC,
                ctx.prompt(Phase.DRAFTING, n, task.toString(), writerContext(ctx, scene), OutputFormat.PROSE));
        String revised = ProseText.stripWordCountClaims(reply.text());
        int words = ProseText.wordCount(revised);
        state.putDraft(draft.withContent(revised, words, DraftStatus.REVISED, Instant.now()));
        state.incrementRevisions(n);
        ctx.publish(EventTypes.SCENE_REVISION_COMPLETE, Map.of(
                "sceneNumber", n, "revision", revision, "wordCount", words));
    }

    // ── Archivist ───────────────────────────────────────────────────

    private void archivistPass(RunContext ctx, SceneOutline scene, String acceptedText) {
        RunState state = ctx.state();
        int n = scene.sceneNumber();
        ctx.checkpoint();

        EntityNames names = ctx.entityNames();
        List<RawFact> extracted = factExtractor.extract(acceptedText, n, AgentRole.WRITER, names, Instant.now());
        List<RawFact> known = state.getRawFactsLog();
        List<RawFact> fresh = extracted.stream()
                .filter(f -> known.stream().noneMatch(k -> k.sceneNumber() == f.sceneNumber()
                        && k.key().equals(f.key()) && k.value().equals(f.value())))
                .toList();
        if (!fresh.isEmpty()) {
            state.appendRawFacts(fresh);
        }

        int interval = Math.max(1, properties.getArchivistInterval());
        boolean due = n % interval == 0 || n == state.getTotalScenes();
        if (state.getLastArchivistScene() >= n || !due) {
            return;
        }

        int since = state.getLastArchivistScene();
        List<RawFact> pending = state.getRawFactsLog().stream().filter(f -> f.sceneNumber() > since).toList();
        ctx.publish(EventTypes.ARCHIVIST_START, Map.of("sceneNumber", n, "pendingFacts", pending.size()));

        List<Constraint> candidates = new ArrayList<>();
        for (RawFact fact : pending) {
            candidates.add(new Constraint(fact.key(), fact.value(), fact.source(), fact.sceneNumber(),
                    fact.timestamp(), "extracted: " + fact.fact(), false));
        }
        candidates.addAll(askArchivist(ctx, scene, acceptedText, pending));

        ConsolidationResult result = ctx.constraints().consolidate(candidates, names::admits);
        state.setLastArchivistScene(n);
        log.info("Archivist consolidated scene {}: {} accepted, {} rejected",
                n, result.accepted().size(), result.rejected().size());
        ctx.publish(EventTypes.ARCHIVIST_COMPLETE, Map.of(
                "sceneNumber", n,
                "accepted", result.accepted().size(),
                "rejected", result.rejected().size(),
                "keys", result.accepted().stream().map(Constraint::key).toList()));
    }

    private List<Constraint> askArchivist(RunContext ctx, SceneOutline scene, String text, List<RawFact> pending) {
        int n = scene.sceneNumber();
        StringBuilder facts = new StringBuilder();
        pending.forEach(f -> facts.append("- ").append(f.key()).append(": ").append(f.value()).append('\n'));
        String task = "Update the canonical record after scene " + n + ". Return JSON {\"constraints\": [{\"key\", "
                + "\"value\", \"scene\", \"reasoning\"}]} with only facts that changed or were newly established. "
                + "Keys must start with char_<character>_, world_ or plot_. Known characters: "
                + String.join(", ", ctx.state().getCharacterNames()) + ".\n\nCANDIDATE FACTS:\n"
                + (facts.isEmpty() ? "(none)\n" : facts) + "\nSCENE TEXT:\n" + text;
        StructuredReply<ConstraintUpdates> reply = ctx.callStructuredAndRecord(AgentRole.ARCHIVIST, null,
                ctx.prompt(Phase.DRAFTING, n, task, ctx.constraints().renderBlock(), OutputFormat.JSON),
                ConstraintUpdates.class);

        List<Constraint> result = new ArrayList<>();
        Instant now = Instant.now();
        for (ConstraintUpdate update : reply.value().constraints()) {
            if (update == null || update.key() == null || update.key().isBlank() || update.value() == null) {
                continue;
            }
            result.add(new Constraint(update.key().strip(), update.value(), AgentRole.ARCHIVIST,
                    update.scene() == null ? n : update.scene(), now, nullToEmpty(update.reasoning()), false));
        }
        return result;
    }

    // ── Polish and finalize ─────────────────────────────────────────

    private String polish(RunContext ctx, SceneOutline scene, String content) {
        String task = "Polish scene " + scene.sceneNumber() + ": tighten the prose and fix errors. Keep every event, "
                + "every line of dialogue that matters and the ending. Return the complete scene.\n\nSCENE:\n" + content;
        AgentReply reply = ctx.callAndRecord(AgentRole.WRITER, null,
                ctx.prompt(Phase.DRAFTING, scene.sceneNumber(), task, reviewContext(ctx, scene), OutputFormat.PROSE));
        return ProseText.stripWordCountClaims(reply.text());
    }

    private void finalizeScene(RunContext ctx, SceneOutline scene, SceneDraft draft, String canonical,
                               boolean approved, boolean polished) {
        int n = scene.sceneNumber();
        int words = ProseText.wordCount(canonical);
        SceneDraft finalDraft = draft.finalized(canonical, words, approved, polished, Instant.now());
        ctx.state().putDraft(finalDraft);

        Map<String, Object> artifact = new LinkedHashMap<>();
        artifact.put("sceneNumber", n);
        artifact.put("title", nullToEmpty(scene.title()));
        artifact.put("content", canonical);
        artifact.put("wordCount", words);
        artifact.put("approved", approved);
        artifact.put("polished", polished);
        artifact.put("revisions", ctx.state().revisionsFor(n));
        ctx.saveArtifact("scene_" + n, artifact);

        search.store(canonical, Map.of(
                "runId", ctx.runId(), "kind", "scene", "sceneNumber", String.valueOf(n),
                "title", nullToEmpty(scene.title())));
    }

    // ── Prompt material ─────────────────────────────────────────────

    private String writerContext(RunContext ctx, SceneOutline scene) {
        RunState state = ctx.state();
        StringBuilder sb = new StringBuilder(reviewContext(ctx, scene));
        Map<String, Object> narrator = state.artifact(Phase.NARRATOR_DESIGN.outputArtifact());
        if (!narrator.isEmpty()) {
            sb.append("\n\nNARRATIVE VOICE:\n").append(ctx.render(narrator));
        }
        state.draft(scene.sceneNumber() - 1).ifPresent(previous -> sb.append("\n\nPREVIOUS SCENE ENDING:\n")
                .append(ProseText.tail(previous.content(), properties.getTailChars())));
        return sb.toString();
    }

    /**
     * Continuity facts plus related earlier material, without the voice and previous-ending
     * sections the Writer needs while drafting.
     */
    private String reviewContext(RunContext ctx, SceneOutline scene) {
        RunState state = ctx.state();
        StringBuilder sb = new StringBuilder("CONTINUITY:\n")
                .append(contextAssembler.constraintsBlock(state, scene));
        String grounding = contextAssembler.groundingBlock(state, scene);
        if (!grounding.isBlank()) {
            sb.append("\n\nRELATED MATERIAL:\n").append(grounding);
        }
        return sb.toString();
    }

    private static String describe(SceneOutline scene) {
        StringBuilder sb = new StringBuilder("SCENE ").append(scene.sceneNumber());
        if (scene.title() != null && !scene.title().isBlank()) {
            sb.append(": ").append(scene.title());
        }
        sb.append('\n').append(nullToEmpty(scene.summary()));
        if (scene.characters() != null && !scene.characters().isEmpty()) {
            sb.append("\nCharacters: ").append(String.join(", ", scene.characters()));
        }
        return sb.toString();
    }

    private int targetWords(SceneOutline scene) {
        return scene.targetWordCount() > 0 ? scene.targetWordCount() : properties.getDefaultTargetWords();
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
