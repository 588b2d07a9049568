package com.tessera.core.backend;

import com.tessera.core.command.FlagValue;
import com.tessera.core.model.ExecutionContext;
import com.tessera.core.model.FileContent;
import com.tessera.core.model.KnowledgeSnippet;
import com.tessera.core.model.PriorDecision;
import com.tessera.core.workspace.Languages;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Builds the system prompt for a verb and renders an {@link ExecutionContext} into
 * the user prompt.
 */
@Component
public class PromptRenderer {

    static final String OUTPUT_RULES = """
            ## Output format
            Explain your reasoning in plain prose. For every file you want to change, emit one
            fenced block whose info string is the language followed by the workspace-relative path,
            containing the COMPLETE new file content:

            ```java src/main/java/com/example/Foo.java
            ...full file...
            ```

            For small edits to large files you may instead emit a unified diff:

            ```diff src/main/java/com/example/Foo.java
            @@ -10,3 +10,4 @@
            ...
            ```

            Never emit a fenced block with a path unless you intend the change. Use paths exactly as
            they appear in the provided files; never reference paths outside the workspace.
            """;

    private static final Map<String, String> ROLES = Map.of(
            "implement", "You are a senior engineer implementing a requested change in an existing codebase. "
                    + "Keep to the conventions of the surrounding code and change only what the request needs.",
            "debug", "You are a debugging expert. Identify the root cause from the provided files and "
                    + "propose the smallest fix that resolves it. State the cause before the fix.",
            "review", "You are a meticulous code reviewer. List concrete problems ordered by severity and "
                    + "propose fixes as file changes where the fix is clear.",
            "spec", "You write concise, testable specifications. Produce a markdown specification file "
                    + "for the requested feature.",
            "plan", "You are a technical lead. Produce an ordered implementation plan with the files each "
                    + "step touches. Do not change source files.",
            "tasks", "You break work down into small, independently verifiable tasks. Produce a task list; "
                    + "do not change source files.",
            "ask", "You answer questions about the codebase precisely, citing file paths. Do not propose "
                    + "file changes unless explicitly asked."
    );

    public String systemPrompt(String verb) {
        String role = ROLES.getOrDefault(verb, ROLES.get("ask"));
        return role + "\n\n" + OUTPUT_RULES;
    }

    public String render(ExecutionContext context, String userRequest) {
        var sb = new StringBuilder();
        sb.append("## Request\n");
        sb.append('/').append(context.activeCommand().verb()).append(' ').append(userRequest).append("\n\n");

        Map<String, FlagValue> flags = context.activeCommand().flags();
        if (!flags.isEmpty()) {
            sb.append("## Options\n");
            flags.forEach((name, value) -> {
                sb.append("- ").append(name);
                if (value instanceof FlagValue.Text text) {
                    sb.append(": ").append(text.value());
                }
                sb.append('\n');
            });
            sb.append('\n');
        }

        if (!context.fileContents().isEmpty()) {
            sb.append("## Files\n");
            for (FileContent file : context.fileContents()) {
                String language = Languages.detect(file.path());
                sb.append("```").append(language).append(' ').append(file.path()).append('\n');
                sb.append(file.content());
                if (!file.content().endsWith("\n")) {
                    sb.append('\n');
                }
                sb.append("```\n\n");
            }
        }

        if (!context.knowledgeSnippets().isEmpty()) {
            sb.append("## Reference knowledge\n");
            for (KnowledgeSnippet snippet : context.knowledgeSnippets()) {
                sb.append("- [").append(snippet.provenance()).append("] ").append(snippet.text()).append('\n');
            }
            sb.append('\n');
        }

        if (!context.priorDecisions().isEmpty()) {
            sb.append("## Earlier decisions in this session\n");
            for (PriorDecision decision : context.priorDecisions()) {
                sb.append("- ").append(decision.filePath()).append(": ").append(decision.outcome()).append('\n');
            }
            sb.append('\n');
        }
        return sb.toString();
    }
}
