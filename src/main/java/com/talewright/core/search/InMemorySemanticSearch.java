package com.talewright.core.search;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-local {@link SemanticSearch} scoring documents by cosine similarity of term frequencies.
 */
@Service
public class InMemorySemanticSearch implements SemanticSearch {

    private static final Logger log = LoggerFactory.getLogger(InMemorySemanticSearch.class);

    private final CopyOnWriteArrayList<Document> documents = new CopyOnWriteArrayList<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public String store(String text, Map<String, String> metadata) {
        String id = "doc-" + sequence.incrementAndGet();
        documents.add(new Document(id, text, Map.copyOf(metadata), termFrequencies(text)));
        log.debug("Indexed {} ({} chars, {})", id, text.length(), metadata);
        return id;
    }

    @Override
    public List<SearchHit> search(String query, int topK, Map<String, String> filter) {
        Map<String, Integer> queryTerms = termFrequencies(query);
        if (queryTerms.isEmpty() || topK <= 0) {
            return List.of();
        }
        return documents.stream()
                .filter(d -> matches(d.metadata, filter))
                .map(d -> new SearchHit(d.id, cosine(queryTerms, d.terms), d.metadata, d.text))
                .filter(hit -> hit.score() > 0)
                .sorted(Comparator.comparingDouble(SearchHit::score).reversed())
                .limit(topK)
                .toList();
    }

    @Override
    public int delete(Map<String, String> filter) {
        List<Document> dropped = documents.stream().filter(d -> matches(d.metadata, filter)).toList();
        documents.removeAll(dropped);
        if (!dropped.isEmpty()) {
            log.debug("Dropped {} document(s) matching {}", dropped.size(), filter);
        }
        return dropped.size();
    }

    public int size() {
        return documents.size();
    }

    private static boolean matches(Map<String, String> metadata, Map<String, String> filter) {
        for (var entry : filter.entrySet()) {
            if (!entry.getValue().equals(metadata.get(entry.getKey()))) {
                return false;
            }
        }
        return true;
    }

    static Map<String, Integer> termFrequencies(String text) {
        Map<String, Integer> terms = new HashMap<>();
        if (text == null) {
            return terms;
        }
        for (String token : text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}']+")) {
            if (token.length() > 2) {
                terms.merge(token, 1, Integer::sum);
            }
        }
        return terms;
    }

    static double cosine(Map<String, Integer> a, Map<String, Integer> b) {
        double dot = 0;
        for (var entry : a.entrySet()) {
            Integer other = b.get(entry.getKey());
            if (other != null) {
                dot += entry.getValue() * (double) other;
            }
        }
        if (dot == 0) {
            return 0;
        }
        return dot / (norm(a) * norm(b));
    }

    private static double norm(Map<String, Integer> v) {
        double sum = 0;
        for (int x : v.values()) {
            sum += (double) x * x;
        }
        return Math.sqrt(sum);
    }

    private record Document(String id, String text, Map<String, String> metadata, Map<String, Integer> terms) {}
}
