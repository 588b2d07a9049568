package com.tessera.core.context;

import com.tessera.core.command.ParsedCommand;
import com.tessera.core.knowledge.KnowledgeProperties;
import com.tessera.core.knowledge.KnowledgeScope;
import com.tessera.core.knowledge.KnowledgeService;
import com.tessera.core.model.ExecutionContext;
import com.tessera.core.model.FileContent;
import com.tessera.core.model.KnowledgeSnippet;
import com.tessera.core.model.PriorDecision;
import com.tessera.core.model.Selection;
import com.tessera.core.workspace.WorkspaceFiles;
import com.tessera.core.workspace.WorkspacePathException;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Assembles the {@link ExecutionContext} for a parsed command.
 * <p>
 * File problems are fatal and surface as {@link ContextBuildException}. Knowledge
 * problems are not: an unreachable, failing or slow knowledge service yields an empty
 * snippet list and a warning. The same inputs against the same workspace and
 * knowledge snapshot always give an equal context.
 */
@Service
public class ExecutionContextBuilder {

    private static final Logger log = LoggerFactory.getLogger(ExecutionContextBuilder.class);

    private static final int MAX_TERMS = 12;

    private final KnowledgeService knowledgeService;
    private final KnowledgeProperties knowledgeProperties;
    private final ExecutorService executor;

    public ExecutionContextBuilder(KnowledgeService knowledgeService, KnowledgeProperties knowledgeProperties) {
        this.knowledgeService = knowledgeService;
        this.knowledgeProperties = knowledgeProperties;
        var counter = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "tessera-context-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Builds the context asynchronously. The future fails with a
     * {@link ContextBuildException} for file problems.
     */
    public CompletableFuture<ExecutionContext> build(ParsedCommand command, Selection selection,
                                                     WorkspaceFiles workspace, List<PriorDecision> priorDecisions) {
        return CompletableFuture.supplyAsync(() -> assemble(command, selection, workspace, priorDecisions), executor);
    }

    ExecutionContext assemble(ParsedCommand command, Selection selection,
                              WorkspaceFiles workspace, List<PriorDecision> priorDecisions) {
        var warnings = new ArrayList<String>();

        var paths = new LinkedHashSet<String>();
        for (String mention : command.mentionedFiles()) {
            paths.add(normalize(workspace, mention));
        }
        for (String pinned : selection.pinnedFiles()) {
            paths.add(normalize(workspace, pinned));
        }

        var contents = new ArrayList<FileContent>(paths.size());
        for (String path : paths) {
            contents.add(readFile(workspace, path));
        }

        List<KnowledgeSnippet> snippets = queryKnowledge(command, workspace, paths, warnings);

        List<String> selected = paths.stream().sorted().toList();
        log.debug("Context for /{}: {} file(s), {} snippet(s), {} warning(s)",
                command.verb(), contents.size(), snippets.size(), warnings.size());
        return new ExecutionContext(workspace.root(), selected, contents, snippets,
                priorDecisions, command, warnings);
    }

    private static String normalize(WorkspaceFiles workspace, String path) {
        try {
            return workspace.normalize(path);
        } catch (WorkspacePathException e) {
            throw new ContextBuildException(ContextBuildException.Kind.NOT_FOUND, path, e.getMessage(), e);
        }
    }

    private static FileContent readFile(WorkspaceFiles workspace, String path) {
        Path file = workspace.resolve(path);
        if (!Files.exists(file)) {
            throw new ContextBuildException(ContextBuildException.Kind.NOT_FOUND, path, "File not found: " + path);
        }
        if (Files.isDirectory(file)) {
            throw new ContextBuildException(ContextBuildException.Kind.NOT_FOUND, path, "Not a file: " + path);
        }
        if (!Files.isReadable(file)) {
            throw new ContextBuildException(ContextBuildException.Kind.PERMISSION_DENIED, path, "Cannot read " + path);
        }
        try {
            long size = Files.size(file);
            long max = workspace.properties().getMaxFileBytes();
            if (size > max) {
                throw new ContextBuildException(ContextBuildException.Kind.TOO_LARGE, path,
                        path + " is " + size + " bytes, limit is " + max);
            }
            byte[] bytes = Files.readAllBytes(file);
            return new FileContent(path, new String(bytes, StandardCharsets.UTF_8), bytes.length);
        } catch (IOException e) {
            throw readFailure(path, e);
        }
    }

    /** Maps a read error to its kind; only a refused access counts as PERMISSION_DENIED. */
    static ContextBuildException readFailure(String path, IOException e) {
        if (e instanceof NoSuchFileException) {
            return new ContextBuildException(ContextBuildException.Kind.NOT_FOUND, path, "File not found: " + path, e);
        }
        if (e instanceof AccessDeniedException) {
            return new ContextBuildException(ContextBuildException.Kind.PERMISSION_DENIED, path, "Cannot read " + path, e);
        }
        return new ContextBuildException(ContextBuildException.Kind.READ_FAILED, path,
                "Failed to read " + path + ": " + e.getMessage(), e);
    }

    private List<KnowledgeSnippet> queryKnowledge(ParsedCommand command, WorkspaceFiles workspace,
                                                  LinkedHashSet<String> paths, List<String> warnings) {
        if (!knowledgeService.isAvailable()) {
            log.debug("Knowledge service not configured, skipping");
            return List.of();
        }
        List<String> terms = termsFor(command);
        var scope = new KnowledgeScope(workspace.root().toString(), new ArrayList<>(paths));
        Future<List<KnowledgeSnippet>> future = executor.submit(() -> knowledgeService.query(terms, scope));
        try {
            List<KnowledgeSnippet> snippets = future.get(knowledgeProperties.getQueryTimeoutSeconds(), TimeUnit.SECONDS);
            int max = knowledgeProperties.getMaxSnippets();
            return snippets.size() > max ? List.copyOf(snippets.subList(0, max)) : List.copyOf(snippets);
        } catch (TimeoutException e) {
            future.cancel(true);
            warnings.add("Knowledge service timed out after " + knowledgeProperties.getQueryTimeoutSeconds()
                    + "s (" + ContextBuildException.Kind.BACKEND_UNREACHABLE + ")");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Knowledge query failed, continuing without snippets: {}", cause.getMessage());
            warnings.add("Knowledge service unavailable (" + ContextBuildException.Kind.BACKEND_UNREACHABLE
                    + "): " + cause.getMessage());
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while querying knowledge");
        }
        return List.of();
    }

    /** Distinct lower-case words of the argument (three letters or more), then mentioned file names. */
    static List<String> termsFor(ParsedCommand command) {
        var terms = new LinkedHashSet<String>();
        for (String word : command.argument().toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}_]+")) {
            if (word.length() >= 3) {
                terms.add(word);
            }
        }
        for (String mention : command.mentionedFiles()) {
            int slash = mention.lastIndexOf('/');
            terms.add(slash >= 0 ? mention.substring(slash + 1) : mention);
        }
        return terms.stream().limit(MAX_TERMS).toList();
    }

    @PreDestroy
    void shutdown() {
        executor.shutdownNow();
    }
}
