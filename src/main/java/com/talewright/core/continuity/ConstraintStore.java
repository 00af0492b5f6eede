package com.talewright.core.continuity;

import com.talewright.core.model.Constraint;
import com.talewright.core.state.RunState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Continuity constraints of one run, backed by {@link RunState#getKeyConstraints()}.
 * <p>
 * The underlying list is append-only. A key's current value is the entry with the highest
 * scene number (later appends win ties). Scene-0 immutable entries are anchors: once a key is
 * anchored, consolidation never appends another value for it.
 */
public class ConstraintStore {

    private static final Logger log = LoggerFactory.getLogger(ConstraintStore.class);

    static final String EMPTY_BLOCK = "No constraints established yet.";

    private final RunState state;

    public ConstraintStore(RunState state) {
        this.state = state;
    }

    /**
     * Adds anchored constraints from the concept phase. Keys that are already anchored are left alone.
     *
     * @return number of constraints added
     */
    public int seed(Collection<Constraint> seeds) {
        int added = 0;
        for (Constraint seed : seeds) {
            if (seed.value() == null || seed.value().isBlank()) {
                continue;
            }
            if (anchor(seed.key()).isPresent()) {
                continue;
            }
            Constraint anchored = new Constraint(seed.key(), seed.value(), seed.source(), 0,
                    seed.timestamp(), seed.reasoning(), true);
            state.appendConstraint(anchored);
            added++;
        }
        log.debug("Seeded {} anchored constraint(s) for run {}", added, state.getRunId());
        return added;
    }

    /**
     * Merges candidates last-writer-wins by scene number. Anchored keys always keep their seeded value.
     *
     * @param candidates    constraint candidates, in assertion order
     * @param keyAdmissible filter on keys (e.g. the canonical-entity allow-list)
     */
    public ConsolidationResult consolidate(List<Constraint> candidates, Predicate<String> keyAdmissible) {
        List<Constraint> accepted = new ArrayList<>();
        List<Constraint> rejected = new ArrayList<>();
        for (Constraint candidate : candidates) {
            if (candidate.key() == null || candidate.key().isBlank()
                    || candidate.value() == null || candidate.value().isBlank()
                    || !keyAdmissible.test(candidate.key())) {
                rejected.add(candidate);
                continue;
            }
            if (anchor(candidate.key()).isPresent()) {
                log.info("Discarding conflicting fact for anchored key {}: '{}'", candidate.key(), candidate.value());
                rejected.add(candidate);
                continue;
            }
            Optional<Constraint> current = current(candidate.key());
            if (current.isPresent() && candidate.sceneNumber() < current.get().sceneNumber()) {
                rejected.add(candidate);
                continue;
            }
            if (current.isPresent() && current.get().value().equals(candidate.value())) {
                continue;
            }
            Constraint appended = candidate;
            if (candidate.immutable()) {
                log.debug("Storing immutable candidate for key {} from scene {} as mutable; only concept anchors "
                        + "are immutable", candidate.key(), candidate.sceneNumber());
                appended = new Constraint(candidate.key(), candidate.value(), candidate.source(),
                        candidate.sceneNumber(), candidate.timestamp(), candidate.reasoning(), false);
            }
            state.appendConstraint(appended);
            accepted.add(appended);
        }
        return new ConsolidationResult(accepted, rejected);
    }

    /**
     * Current value of a key: its anchor if one exists, else the entry with the highest scene number.
     */
    public Optional<Constraint> current(String key) {
        Optional<Constraint> anchored = anchor(key);
        if (anchored.isPresent()) {
            return anchored;
        }
        Constraint best = null;
        for (Constraint c : state.getKeyConstraints()) {
            if (c.key().equals(key) && (best == null || c.sceneNumber() >= best.sceneNumber())) {
                best = c;
            }
        }
        return Optional.ofNullable(best);
    }

    /**
     * Resolved view: anchored constraints first, then the current value of every other key,
     * each group in first-assertion order.
     */
    public List<Constraint> resolved() {
        Map<String, Constraint> anchors = new LinkedHashMap<>();
        Map<String, Constraint> latest = new LinkedHashMap<>();
        for (Constraint c : state.getKeyConstraints()) {
            if (c.anchored()) {
                anchors.putIfAbsent(c.key(), c);
            }
        }
        for (Constraint c : state.getKeyConstraints()) {
            if (anchors.containsKey(c.key())) {
                continue;
            }
            Constraint prev = latest.get(c.key());
            if (prev == null || c.sceneNumber() >= prev.sceneNumber()) {
                latest.put(c.key(), c);
            }
        }
        List<Constraint> result = new ArrayList<>(anchors.values());
        result.addAll(latest.values());
        return result;
    }

    /**
     * Renders the full resolved view as a prompt block.
     */
    public String renderBlock() {
        return render(resolved());
    }

    /**
     * Renders constraints in prompt form, one per line.
     */
    public static String render(List<Constraint> constraints) {
        if (constraints.isEmpty()) {
            return EMPTY_BLOCK;
        }
        StringBuilder sb = new StringBuilder();
        List<Constraint> anchored = constraints.stream().filter(Constraint::anchored).toList();
        List<Constraint> evolving = constraints.stream().filter(c -> !c.anchored()).toList();
        if (!anchored.isEmpty()) {
            sb.append("ESTABLISHED FACTS (never contradict):\n");
            for (Constraint c : anchored) {
                sb.append("- ").append(c.key()).append(": ").append(c.value()).append('\n');
            }
        }
        if (!evolving.isEmpty()) {
            if (!sb.isEmpty()) {
                sb.append('\n');
            }
            sb.append("CURRENT STATE:\n");
            for (Constraint c : evolving) {
                sb.append("- ").append(c.key()).append(": ").append(c.value())
                        .append(" (Scene ").append(c.sceneNumber()).append(")\n");
            }
        }
        return sb.toString().stripTrailing();
    }

    private Optional<Constraint> anchor(String key) {
        return state.getKeyConstraints().stream()
                .filter(c -> c.anchored() && c.key().equals(key))
                .findFirst();
    }
}
