package com.tessera.core.vcs;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class GitVersionControlServiceTest {

    private static final Path ROOT = Path.of("/work/repo");

    private RecordingGit git;

    @BeforeEach
    void setUp() {
        var properties = new VcsProperties();
        properties.setAuthorName("Ada");
        properties.setAuthorEmail("ada@example.com");
        git = new RecordingGit(properties);
    }

    @Test
    @DisplayName("isRepository is true only when git reports a work tree")
    void isRepository() {
        git.reply(0, "true\n");
        assertTrue(git.isRepository(ROOT));

        git.reply(128, "fatal: not a git repository");
        assertFalse(git.isRepository(ROOT));

        git.fail(new VcsException("Cannot run git: not installed", new IOException("no git")));
        assertFalse(git.isRepository(ROOT));
    }

    @Test
    @DisplayName("stage passes paths after --")
    void stage() {
        git.reply(0, "");
        git.stage(ROOT, List.of("src/A.java", "docs/b.md"));

        assertEquals(List.of("add", "-A", "--", "src/A.java", "docs/b.md"), git.calls.get(0));
    }

    @Test
    @DisplayName("stage with no paths runs nothing")
    void stageNothing() {
        git.stage(ROOT, List.of());
        assertTrue(git.calls.isEmpty());
    }

    @Test
    @DisplayName("commit uses the configured author and returns HEAD")
    void commit() {
        git.reply(0, "[main abc1234] msg");
        git.reply(0, "abc1234def\n");

        assertEquals("abc1234def", git.commit(ROOT, "tessera: fix login"));
        assertEquals(List.of("-c", "user.name=Ada", "-c", "user.email=ada@example.com",
                "commit", "-m", "tessera: fix login"), git.calls.get(0));
        assertEquals(List.of("rev-parse", "HEAD"), git.calls.get(1));
    }

    @Test
    @DisplayName("a failing git command raises VcsException with its exit code")
    void commitFailure() {
        git.reply(1, "nothing to commit, working tree clean");

        VcsException e = assertThrows(VcsException.class, () -> git.commit(ROOT, "msg"));
        assertEquals(1, e.getExitCode());
        assertTrue(e.getMessage().contains("nothing to commit"));
    }

    @Test
    @DisplayName("diff can be limited to one path")
    void diff() {
        git.reply(0, "diff --git a/x b/x");
        assertEquals("diff --git a/x b/x", git.diff(ROOT, Optional.of("x")));
        assertEquals(List.of("diff", "--no-color", "--", "x"), git.calls.get(0));
    }

    /** Replays canned git results instead of starting processes. */
    private static final class RecordingGit extends GitVersionControlService {
        final List<List<String>> calls = new ArrayList<>();
        private final Deque<Object> replies = new ArrayDeque<>();

        RecordingGit(VcsProperties properties) {
            super(properties);
        }

        void reply(int exitCode, String output) {
            replies.add(new GitResult(exitCode, output));
        }

        void fail(VcsException e) {
            replies.add(e);
        }

        @Override
        protected GitResult runGit(Path workDir, String... args) {
            calls.add(List.of(args));
            Object next = replies.poll();
            if (next instanceof VcsException e) {
                throw e;
            }
            return (GitResult) next;
        }
    }
}
