package com.tessera.dispatch.api;

import com.tessera.core.engine.ExecutionEngine;
import com.tessera.core.workspace.FileInfo;
import com.tessera.core.workspace.FileNode;
import com.tessera.core.workspace.SearchMatch;
import com.tessera.core.workspace.WorkspaceFiles;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.NoSuchFileException;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * REST controller for read-only queries against a session's workspace.
 */
@RestController
@RequestMapping("/api/v1/sessions/{sid}/workspace")
public class WorkspaceController {

    private final ExecutionEngine engine;

    public WorkspaceController(ExecutionEngine engine) {
        this.engine = engine;
    }

    @GetMapping("/tree")
    public FileNode tree(@PathVariable String sid) {
        WorkspaceFiles files = files(sid);
        try {
            return files.getFileTree();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list workspace " + files.root(), e);
        }
    }

    @GetMapping("/search")
    public List<SearchMatch> search(@PathVariable String sid, @RequestParam String q,
                                    @RequestParam(required = false) Integer limit) {
        WorkspaceFiles files = files(sid);
        try {
            return limit != null ? files.searchFiles(q, limit) : files.searchFiles(q);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot search workspace " + files.root(), e);
        }
    }

    @GetMapping("/info")
    public FileInfo info(@PathVariable String sid, @RequestParam String path) {
        WorkspaceFiles files = files(sid);
        try {
            return files.getFileInfo(path);
        } catch (NoSuchFileException e) {
            throw new NoSuchElementException("No such file: " + path);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + path, e);
        }
    }

    private WorkspaceFiles files(String sid) {
        return engine.session(sid).getWorkspace().files();
    }
}
