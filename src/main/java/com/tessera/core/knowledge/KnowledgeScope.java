package com.tessera.core.knowledge;

import java.util.List;

/**
 * What a knowledge query is about: the workspace and the files in play.
 */
public record KnowledgeScope(String workspaceRoot, List<String> paths) {

    public KnowledgeScope {
        paths = List.copyOf(paths);
    }
}
