package com.tessera.core.knowledge;

import com.tessera.core.model.KnowledgeSnippet;

import java.util.List;

/**
 * Source of reference snippets (architecture notes, prior specs, conventions)
 * relevant to a command.
 */
public interface KnowledgeService {

    /**
     * @return snippets in relevance order as decided by the service
     * @throws KnowledgeUnavailableException when the service cannot answer
     */
    List<KnowledgeSnippet> query(List<String> terms, KnowledgeScope scope);

    boolean isAvailable();
}
