package me.golemcore.reasoning.port.outbound;

import me.golemcore.reasoning.domain.model.KnowledgeItem;

import java.util.List;

/**
 * Query interface of the external context/memory manager.
 */
public interface KnowledgeStorePort {

    /**
     * Returns up to {@code k} items ranked by relevance to {@code text}.
     */
    List<KnowledgeItem> query(String text, int k);

    /**
     * Stores a fact and returns its id.
     */
    String store(String subject, String predicate, String object, double confidence);
}
