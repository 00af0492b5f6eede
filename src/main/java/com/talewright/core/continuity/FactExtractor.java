package com.talewright.core.continuity;

import com.talewright.core.model.AgentRole;
import com.talewright.core.model.RawFact;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Pulls continuity fact candidates out of scene prose.
 * <p>
 * Only sentences about names on the run's allow-list are considered, so an entity the model
 * invents in passing never becomes a fact. When the same key is asserted several times in one
 * scene the last assertion wins.
 */
@Component
public class FactExtractor {

    private static final String STATUS_WORDS =
            "wounded|injured|killed|married|born|dead|captured|freed|healed|exiled|imprisoned|missing|betrayed|blinded";

    private static final String ATTRIBUTES = "health|status|location|relationship|allegiance";

    public List<RawFact> extract(String text, int sceneNumber, AgentRole source, EntityNames names, Instant now) {
        if (text == null || text.isBlank() || names.isEmpty()) {
            return List.of();
        }
        String nameGroup = names.aliases().stream()
                .sorted((a, b) -> Integer.compare(b.length(), a.length()))
                .map(Pattern::quote)
                .collect(Collectors.joining("|"));

        Map<String, RawFact> byKey = new LinkedHashMap<>();
        List<Match> matches = new ArrayList<>();

        Pattern status = Pattern.compile(
                "\\b(" + nameGroup + ")\\s+(?:was|is|became|had been|has been)\\s+(" + STATUS_WORDS + ")\\b");
        collect(status.matcher(text), m -> new Match(m.start(), m.group(1), "status", m.group(2), m.group()), matches);

        Pattern died = Pattern.compile("\\b(" + nameGroup + ")\\s+(died|vanished|fled|escaped)\\b");
        collect(died.matcher(text), m -> new Match(m.start(), m.group(1), "status", normalizeVerb(m.group(2)), m.group()),
                matches);

        Pattern attribute = Pattern.compile(
                "\\b(" + nameGroup + ")'s\\s+(" + ATTRIBUTES + ")\\s+(?:changed to|is now|was now|is|was)\\s+([^.;!?\\n]{1,60})");
        collect(attribute.matcher(text), m -> new Match(m.start(), m.group(1), m.group(2), m.group(3).trim(), m.group()),
                matches);

        Pattern location = Pattern.compile(
                "\\b(" + nameGroup + ")\\s+(?:arrived at|arrived in|reached|returned to|moved to)\\s+(?:the\\s+)?"
                        + "([A-Z][\\w'-]*(?:\\s+[A-Z][\\w'-]*){0,3})");
        collect(location.matcher(text), m -> new Match(m.start(), m.group(1), "location", m.group(2), m.group()), matches);

        matches.sort((a, b) -> Integer.compare(a.position, b.position));
        for (Match match : matches) {
            String canonical = names.canonical(match.alias);
            String key = "char_" + EntityNames.slug(canonical) + "_" + match.attribute;
            byKey.remove(key);
            byKey.put(key, new RawFact(key, match.value, match.sentence, source, sceneNumber, now));
        }
        return List.copyOf(byKey.values());
    }

    private static String normalizeVerb(String verb) {
        return switch (verb) {
            case "died" -> "dead";
            case "vanished" -> "missing";
            default -> verb;
        };
    }

    private static void collect(Matcher matcher, Function<Matcher, Match> toMatch, List<Match> out) {
        while (matcher.find()) {
            out.add(toMatch.apply(matcher));
        }
    }

    private record Match(int position, String alias, String attribute, String value, String sentence) {}
}
