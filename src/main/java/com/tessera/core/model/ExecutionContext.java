package com.tessera.core.model;

import com.tessera.core.command.ParsedCommand;

import java.nio.file.Path;
import java.util.List;

/**
 * Everything the reasoning backend needs for one command. Built once per execution
 * and immutable afterwards.
 *
 * @param workspaceRoot     absolute, normalized workspace root
 * @param selectedFiles     workspace-relative paths of all included files, sorted
 * @param fileContents      contents of mentioned files in mention order, then pinned files
 * @param knowledgeSnippets snippets in the knowledge service's order
 * @param priorDecisions    decisions taken earlier in the session, oldest first
 * @param activeCommand     the command being executed
 * @param warnings          non-fatal problems met while building
 */
public record ExecutionContext(
        Path workspaceRoot,
        List<String> selectedFiles,
        List<FileContent> fileContents,
        List<KnowledgeSnippet> knowledgeSnippets,
        List<PriorDecision> priorDecisions,
        ParsedCommand activeCommand,
        List<String> warnings
) {
    public ExecutionContext {
        selectedFiles = List.copyOf(selectedFiles);
        fileContents = List.copyOf(fileContents);
        knowledgeSnippets = List.copyOf(knowledgeSnippets);
        priorDecisions = List.copyOf(priorDecisions);
        warnings = List.copyOf(warnings);
    }
}
