package com.tessera.core.workspace;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "tessera.workspace")
public class WorkspaceProperties {

    /** Largest file, in bytes, that may be pulled into an execution context. */
    private long maxFileBytes = 1_048_576;

    /** Directory and file names skipped by the file tree and search. */
    private List<String> ignoredNames = new ArrayList<>(List.of(
            "node_modules", "target", "build", "dist", "out", "__pycache__",
            ".git", ".idea", ".vscode", ".gradle", ".mvn", ".next", ".DS_Store", "Thumbs.db"));

    /** Glob patterns, relative to the workspace root, that proposals may never write. */
    private List<String> writeDenied = new ArrayList<>(List.of(".git/**", ".git"));

    private int searchLimit = 50;

    public long getMaxFileBytes() { return maxFileBytes; }
    public void setMaxFileBytes(long maxFileBytes) { this.maxFileBytes = maxFileBytes; }
    public List<String> getIgnoredNames() { return ignoredNames; }
    public void setIgnoredNames(List<String> ignoredNames) { this.ignoredNames = ignoredNames; }
    public List<String> getWriteDenied() { return writeDenied; }
    public void setWriteDenied(List<String> writeDenied) { this.writeDenied = writeDenied; }
    public int getSearchLimit() { return searchLimit; }
    public void setSearchLimit(int searchLimit) { this.searchLimit = searchLimit; }
}
