package me.golemcore.reasoning.adapter.outbound.knowledge;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.reasoning.domain.model.KnowledgeItem;
import me.golemcore.reasoning.port.outbound.KnowledgeStorePort;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Process-local fact store. Ranks facts by the share of query words that
 * appear in the fact; words shorter than three characters are ignored.
 */
@Slf4j
public class InMemoryKnowledgeStoreAdapter implements KnowledgeStorePort {

    private static final int MIN_WORD_LENGTH = 3;

    private final Map<String, Fact> facts = new ConcurrentHashMap<>();
    private final AtomicLong ids = new AtomicLong();

    @Override
    public List<KnowledgeItem> query(String text, int k) {
        Set<String> queryWords = words(text);
        if (queryWords.isEmpty() || k <= 0) {
            return List.of();
        }
        return facts.values().stream()
                .map(fact -> fact.toItem(overlap(queryWords, fact.words())))
                .filter(item -> item.score() > 0)
                .sorted(Comparator.comparingDouble(KnowledgeItem::score).reversed()
                        .thenComparing(KnowledgeItem::id))
                .limit(k)
                .toList();
    }

    @Override
    public String store(String subject, String predicate, String object, double confidence) {
        String id = "fact-" + ids.incrementAndGet();
        Fact fact = new Fact(id, subject, predicate, object, confidence,
                words(subject + " " + predicate + " " + object));
        facts.put(id, fact);
        log.debug("[Knowledge] Stored {}: {} {} {}", id, subject, predicate, object);
        return id;
    }

    public int size() {
        return facts.size();
    }

    private static double overlap(Set<String> queryWords, Set<String> factWords) {
        long shared = queryWords.stream().filter(factWords::contains).count();
        return (double) shared / queryWords.size();
    }

    static Set<String> words(String text) {
        if (text == null || text.isBlank()) {
            return Set.of();
        }
        return Arrays.stream(text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+"))
                .filter(word -> word.length() >= MIN_WORD_LENGTH)
                .collect(Collectors.toUnmodifiableSet());
    }

    private record Fact(String id, String subject, String predicate, String object, double confidence,
            Set<String> words) {

        KnowledgeItem toItem(double score) {
            return new KnowledgeItem(id, subject, predicate, object, confidence, score);
        }
    }
}
