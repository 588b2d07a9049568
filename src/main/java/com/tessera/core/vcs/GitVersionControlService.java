package com.tessera.core.vcs;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * {@link VersionControlService} backed by the {@code git} CLI.
 *
 * <p>This class shells out to {@code git} via {@link ProcessBuilder} rather than
 * using a Java git library, so it behaves exactly like the user's own git.
 */
@Service
public class GitVersionControlService implements VersionControlService {

    private static final Logger log = LoggerFactory.getLogger(GitVersionControlService.class);

    private final VcsProperties properties;

    public GitVersionControlService(VcsProperties properties) {
        this.properties = properties;
    }

    @Override
    public boolean isRepository(Path workspaceRoot) {
        try {
            GitResult result = runGit(workspaceRoot, "rev-parse", "--is-inside-work-tree");
            return result.exitCode() == 0 && result.output().strip().equals("true");
        } catch (VcsException e) {
            return false;
        }
    }

    @Override
    public void stage(Path workspaceRoot, List<String> paths) {
        if (paths.isEmpty()) {
            return;
        }
        var args = new ArrayList<String>(List.of("add", "-A", "--"));
        args.addAll(paths);
        require(runGit(workspaceRoot, args.toArray(String[]::new)), "git add");
    }

    @Override
    public String commit(Path workspaceRoot, String message) {
        require(runGit(workspaceRoot,
                "-c", "user.name=" + properties.getAuthorName(),
                "-c", "user.email=" + properties.getAuthorEmail(),
                "commit", "-m", message), "git commit");
        String commitId = require(runGit(workspaceRoot, "rev-parse", "HEAD"), "git rev-parse").output().strip();
        log.info("Committed {} in {}", commitId, workspaceRoot);
        return commitId;
    }

    @Override
    public String diff(Path workspaceRoot, Optional<String> path) {
        var args = new ArrayList<String>(List.of("diff", "--no-color"));
        path.ifPresent(p -> {
            args.add("--");
            args.add(p);
        });
        return require(runGit(workspaceRoot, args.toArray(String[]::new)), "git diff").output();
    }

    /**
     * Runs a git command and captures its combined output.
     *
     * @param workDir working directory for the git command
     * @param args    git arguments (e.g. "add", "-A", "--", "src/Foo.java")
     */
    protected GitResult runGit(Path workDir, String... args) {
        var command = new ArrayList<String>(args.length + 1);
        command.add("git");
        command.addAll(List.of(args));
        log.debug("Running: {}", String.join(" ", command));

        try {
            var process = new ProcessBuilder(command)
                    .directory(workDir.toFile())
                    .redirectErrorStream(true)
                    .start();

            String output;
            try (var reader = new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                output = reader.lines().collect(Collectors.joining("\n"));
            }
            return new GitResult(process.waitFor(), output);
        } catch (IOException e) {
            throw new VcsException("Cannot run git: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new VcsException("Interrupted while running git", e);
        }
    }

    private static GitResult require(GitResult result, String what) {
        if (result.exitCode() != 0) {
            log.warn("{} exited with code {}: {}", what, result.exitCode(), result.output());
            throw new VcsException(what + " failed: " + result.output().strip(), result.exitCode());
        }
        return result;
    }

    public record GitResult(int exitCode, String output) {}
}
