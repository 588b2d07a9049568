package com.tessera.core.context;

import com.tessera.core.command.CommandParser;
import com.tessera.core.command.CommandRegistry;
import com.tessera.core.command.ParsedCommand;
import com.tessera.core.knowledge.KnowledgeProperties;
import com.tessera.core.knowledge.KnowledgeScope;
import com.tessera.core.knowledge.KnowledgeService;
import com.tessera.core.knowledge.KnowledgeUnavailableException;
import com.tessera.core.model.ErrorKind;
import com.tessera.core.model.ExecutionContext;
import com.tessera.core.model.KnowledgeSnippet;
import com.tessera.core.model.Selection;
import com.tessera.core.workspace.WorkspaceFiles;
import com.tessera.core.workspace.WorkspaceProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

class ExecutionContextBuilderTest {

    @TempDir
    Path root;

    private final CommandParser parser = new CommandParser(new CommandRegistry());
    private KnowledgeService knowledge;
    private KnowledgeProperties knowledgeProperties;
    private WorkspaceFiles files;
    private ExecutionContextBuilder builder;

    @BeforeEach
    void setUp() throws IOException {
        Files.createDirectories(root.resolve("src"));
        Files.writeString(root.resolve("src/Login.java"), "class Login {}\n");
        Files.writeString(root.resolve("src/Session.java"), "class Session {}\n");
        knowledge = mock(KnowledgeService.class);
        knowledgeProperties = new KnowledgeProperties();
        knowledgeProperties.setQueryTimeoutSeconds(1);
        knowledgeProperties.setMaxSnippets(2);
        files = new WorkspaceFiles(root, new WorkspaceProperties());
        builder = new ExecutionContextBuilder(knowledge, knowledgeProperties);
    }

    @AfterEach
    void tearDown() {
        builder.shutdown();
    }

    private ExecutionContext build(String input, Selection selection) throws Exception {
        ParsedCommand command = parser.parse(input);
        return builder.build(command, selection, files, List.of()).get(5, TimeUnit.SECONDS);
    }

    @Nested
    @DisplayName("files")
    class FileTests {

        @Test
        @DisplayName("reads mentions then pinned files, without duplicates")
        void readsFiles() throws Exception {
            ExecutionContext context = build("/debug NPE @src/Session.java",
                    Selection.of("src/Login.java", "src/Session.java"));

            assertEquals(List.of("src/Session.java", "src/Login.java"),
                    context.fileContents().stream().map(f -> f.path()).toList());
            assertEquals(List.of("src/Login.java", "src/Session.java"), context.selectedFiles());
            assertEquals("class Session {}\n", context.fileContents().get(0).content());
            assertEquals("debug", context.activeCommand().verb());
        }

        @Test
        @DisplayName("a missing mention fails with NOT_FOUND")
        void missing() {
            var e = assertThrows(ExecutionException.class, () -> build("/review @src/Nope.java", Selection.none()));
            var cause = assertInstanceOf(ContextBuildException.class, e.getCause());
            assertEquals(ContextBuildException.Kind.NOT_FOUND, cause.getKind());
            assertEquals("src/Nope.java", cause.getPath());
        }

        @Test
        @DisplayName("a mention outside the workspace fails with NOT_FOUND")
        void outside() {
            var e = assertThrows(ExecutionException.class, () -> build("/review @../etc/passwd", Selection.none()));
            assertEquals(ContextBuildException.Kind.NOT_FOUND,
                    ((ContextBuildException) e.getCause()).getKind());
        }

        @Test
        @DisplayName("files over the size limit fail with TOO_LARGE")
        void tooLarge() throws Exception {
            var props = new WorkspaceProperties();
            props.setMaxFileBytes(4);
            files = new WorkspaceFiles(root, props);

            var e = assertThrows(ExecutionException.class, () -> build("/review @src/Login.java", Selection.none()));
            assertEquals(ContextBuildException.Kind.TOO_LARGE, ((ContextBuildException) e.getCause()).getKind());
        }

        @Test
        @DisplayName("directories are not files")
        void directory() {
            var e = assertThrows(ExecutionException.class, () -> build("/review @src", Selection.none()));
            assertEquals(ContextBuildException.Kind.NOT_FOUND, ((ContextBuildException) e.getCause()).getKind());
        }

        @Test
        @DisplayName("only a refused access is reported as PERMISSION_DENIED")
        void readFailureKinds() {
            assertEquals(ContextBuildException.Kind.PERMISSION_DENIED, ExecutionContextBuilder
                    .readFailure("a.txt", new AccessDeniedException("a.txt")).getKind());
            assertEquals(ContextBuildException.Kind.NOT_FOUND, ExecutionContextBuilder
                    .readFailure("a.txt", new NoSuchFileException("a.txt")).getKind());

            ContextBuildException generic = ExecutionContextBuilder
                    .readFailure("a.txt", new IOException("Input/output error"));
            assertEquals(ContextBuildException.Kind.READ_FAILED, generic.getKind());
            assertEquals(ErrorKind.READ_FAILED, generic.getKind().toErrorKind());
            assertTrue(generic.getMessage().contains("Input/output error"));
        }
    }

    @Nested
    @DisplayName("knowledge")
    class KnowledgeTests {

        @Test
        @DisplayName("skips the service when it is not available")
        void unavailable() throws Exception {
            when(knowledge.isAvailable()).thenReturn(false);

            ExecutionContext context = build("/ask how does login work", Selection.none());

            assertTrue(context.knowledgeSnippets().isEmpty());
            assertTrue(context.warnings().isEmpty());
            verify(knowledge, never()).query(anyList(), any());
        }

        @Test
        @DisplayName("keeps the service's order and caps the count")
        void capsSnippets() throws Exception {
            when(knowledge.isAvailable()).thenReturn(true);
            when(knowledge.query(anyList(), any(KnowledgeScope.class))).thenReturn(List.of(
                    new KnowledgeSnippet("a", "adr/1.md", 0.9),
                    new KnowledgeSnippet("b", "adr/2.md", 0.8),
                    new KnowledgeSnippet("c", "adr/3.md", 0.7)));

            ExecutionContext context = build("/ask how does login work", Selection.none());

            assertEquals(List.of("a", "b"), context.knowledgeSnippets().stream().map(KnowledgeSnippet::text).toList());
        }

        @Test
        @DisplayName("a failing service becomes a warning, not an error")
        void failureIsWarning() throws Exception {
            when(knowledge.isAvailable()).thenReturn(true);
            when(knowledge.query(anyList(), any())).thenThrow(new KnowledgeUnavailableException("connection refused"));

            ExecutionContext context = build("/ask how does login work", Selection.none());

            assertTrue(context.knowledgeSnippets().isEmpty());
            assertEquals(1, context.warnings().size());
            assertTrue(context.warnings().get(0).contains("BACKEND_UNREACHABLE"));
        }

        @Test
        @DisplayName("a slow service times out into a warning")
        void timeout() throws Exception {
            when(knowledge.isAvailable()).thenReturn(true);
            when(knowledge.query(anyList(), any())).thenAnswer(inv -> {
                Thread.sleep(3000);
                return List.of();
            });

            ExecutionContext context = build("/ask how does login work", Selection.none());

            assertTrue(context.warnings().get(0).contains("timed out"));
        }
    }

    @Test
    @DisplayName("terms are distinct words of three letters or more, then mentioned file names")
    void terms() {
        List<String> terms = ExecutionContextBuilder.termsFor(
                parser.parse("/debug the NPE in the Login flow @src/auth/Login.java"));

        assertEquals(List.of("the", "npe", "login", "flow", "Login.java"), terms);
    }
}
