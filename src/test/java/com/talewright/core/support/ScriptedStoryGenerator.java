package com.talewright.core.support;

import com.talewright.core.llm.CompletionRequest;
import com.talewright.core.llm.TextGenerator;
import com.talewright.core.model.AgentRole;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Deterministic stand-in for the model provider. Each agent is recognised by its system prompt
 * and answers with a fixed reply shaped like a real one. The Critic rejects the scenes listed in
 * {@link #rejectScene(int)} and approves the rest. Writer replies queued with
 * {@link #queueWriter(String...)} are returned first, in order.
 */
public class ScriptedStoryGenerator implements TextGenerator {

    private static final Pattern WRITER_SCENE =
            Pattern.compile("(?:Write scene|Revise scene|Polish scene|of scene) (\\d+)");
    private static final Pattern CRITIC_SCENE = Pattern.compile("Critique this draft of scene (\\d+)");

    private static final String[] ORDINALS = {"Zeroth", "First", "Second", "Third", "Fourth", "Fifth"};

    private final Map<AgentRole, Integer> calls = new EnumMap<>(AgentRole.class);
    private final List<CompletionRequest> requests = new ArrayList<>();
    private final Set<Integer> rejectedScenes = new HashSet<>();
    private final Deque<String> writerReplies = new ArrayDeque<>();
    private final int scenes;

    private volatile CountDownLatch architectEntered;
    private volatile CountDownLatch architectRelease;

    public ScriptedStoryGenerator(int scenes) {
        this.scenes = scenes;
    }

    public ScriptedStoryGenerator rejectScene(int sceneNumber) {
        rejectedScenes.add(sceneNumber);
        return this;
    }

    public synchronized ScriptedStoryGenerator queueWriter(String... replies) {
        writerReplies.addAll(Arrays.asList(replies));
        return this;
    }

    /**
     * Makes the next Architect call wait until {@link #releaseArchitect()}.
     */
    public void holdArchitect() {
        architectEntered = new CountDownLatch(1);
        architectRelease = new CountDownLatch(1);
    }

    public boolean awaitArchitectEntered(long timeout, TimeUnit unit) throws InterruptedException {
        return architectEntered.await(timeout, unit);
    }

    public void releaseArchitect() {
        architectRelease.countDown();
    }

    public synchronized int callsTo(AgentRole role) {
        return calls.getOrDefault(role, 0);
    }

    public synchronized List<CompletionRequest> requests() {
        return List.copyOf(requests);
    }

    /** The prose the Writer returns for a scene, whatever it is asked to do with it. */
    public static String passage(int sceneNumber) {
        return ORDINALS[Math.min(sceneNumber, ORDINALS.length - 1)] + " night. The lamp room smelled of salt and "
                + "brass as Mara Vell climbed the last stair. Outside the storm pressed against the glass, and the "
                + "old beam turned slowly over the black water. She counted the ships she could not see, listened "
                + "to the wind, and decided that tonight the light would not fail.";
    }

    @Override
    public String complete(CompletionRequest request) {
        AgentRole role = roleOf(request.systemPrompt());
        String queued = null;
        synchronized (this) {
            calls.merge(role, 1, Integer::sum);
            requests.add(request);
            if (role == AgentRole.WRITER) {
                queued = writerReplies.poll();
            }
        }
        if (queued != null) {
            return queued;
        }
        String user = request.userPrompt();
        return switch (role) {
            case ARCHITECT -> architect();
            case PROFILER -> user.contains("Design the narrator")
                    ? "{\"point_of_view\": \"third limited\", \"tense\": \"past\", \"voice\": \"spare\"}"
                    : "{\"characters\": [{\"name\": \"Mara Vell\", \"role\": \"protagonist\", "
                    + "\"description\": \"keeper of the light\", \"motivation\": \"keep the ships safe\"}]}";
            case WORLDBUILDER -> "{\"elements\": [{\"name\": \"Gull Rock\", \"category\": \"location\", "
                    + "\"description\": \"a lighthouse on a reef\"}], \"rules\": [\"The light must burn every night\"]}";
            case STRATEGIST -> user.contains("Refine the outline")
                    ? "{\"foreshadowing\": [], \"subplots\": [], \"pacing_notes\": \"steady\"}"
                    : outline();
            case WRITER -> passage(sceneIn(WRITER_SCENE, user));
            case CRITIC -> critique(sceneIn(CRITIC_SCENE, user));
            case ARCHIVIST -> "{\"constraints\": [{\"key\": \"char_mara_vell_location\", "
                    + "\"value\": \"the lamp room\", \"reasoning\": \"climbed the last stair\"}]}";
            case ORIGINALITY -> "{\"score\": 7, \"cliches\": [\"dark and stormy night\"], \"notes\": \"fine\"}";
            case IMPACT -> "{\"emotional_resonance\": 8, \"pacing\": 7, \"engagement\": 8, \"notes\": \"moving\"}";
        };
    }

    private String architect() {
        CountDownLatch release = architectRelease;
        if (release != null) {
            architectEntered.countDown();
            try {
                if (!release.await(10, TimeUnit.SECONDS)) {
                    throw new IllegalStateException("Architect was never released");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while held", e);
            }
            architectRelease = null;
        }
        return "{\"title\": \"The Keeper\", \"logline\": \"A keeper hears the sea speak\", \"genre\": \"gothic\", "
                + "\"tone\": \"brooding\", \"premise\": \"The sea talks to the last lighthouse keeper\", "
                + "\"protagonist\": \"Mara Vell\", \"setting\": \"Gull Rock\", \"theme\": \"duty\"}";
    }

    private String outline() {
        StringBuilder sb = new StringBuilder("{\"scenes\": [");
        for (int i = 1; i <= scenes; i++) {
            if (i > 1) {
                sb.append(", ");
            }
            sb.append("{\"title\": \"Night ").append(i).append("\", \"summary\": \"Mara keeps the light\", ")
                    .append("\"characters\": [\"Mara Vell\"], \"target_word_count\": 50}");
        }
        return sb.append("]}").toString();
    }

    private String critique(int sceneNumber) {
        if (rejectedScenes.contains(sceneNumber)) {
            return "{\"score\": 5, \"revision_needed\": true, \"issues\": [\"flat ending\"], "
                    + "\"revision_requests\": [\"sharpen the last line\"], \"feedback\": \"close\"}";
        }
        return "{\"score\": 9, \"revision_needed\": false, \"strengths\": [\"mood\"], \"feedback\": \"good\"}";
    }

    private static int sceneIn(Pattern pattern, String prompt) {
        Matcher m = pattern.matcher(prompt);
        return m.find() ? Integer.parseInt(m.group(1)) : 0;
    }

    private static AgentRole roleOf(String systemPrompt) {
        for (AgentRole role : AgentRole.values()) {
            if (systemPrompt.startsWith("You are the " + displayName(role))) {
                return role;
            }
        }
        throw new IllegalArgumentException("Unrecognised system prompt: " + systemPrompt);
    }

    private static String displayName(AgentRole role) {
        return switch (role) {
            case ORIGINALITY -> "Originality";
            case IMPACT -> "Impact";
            default -> role.name().charAt(0) + role.name().substring(1).toLowerCase();
        };
    }
}
