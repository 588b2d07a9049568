package com.tessera.core.model;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * A single proposed modification to one workspace file.
 * <p>
 * The proposal itself is immutable; only the decision state and the user's edited
 * content change over time. Each change belongs to exactly one execution.
 */
public class Change {

    private final String id;
    private final String executionId;
    private final String filePath;
    private final String original;
    private final byte[] originalBytes;
    private final boolean originalExisted;
    private final String modified;
    private final int startLine;
    private final int endLine;
    private final String description;
    private final ChangeKind kind;

    private ChangeStatus status = ChangeStatus.PENDING;
    private String userContent;

    public Change(String id, String executionId, String filePath, String original, boolean originalExisted,
                  String modified, int startLine, int endLine, String description, ChangeKind kind) {
        this(id, executionId, filePath, original,
                original == null ? new byte[0] : original.getBytes(StandardCharsets.UTF_8),
                originalExisted, modified, startLine, endLine, description, kind);
    }

    /**
     * @param originalBytes the file content exactly as read when the change was proposed;
     *                      staleness is judged against these bytes, not the decoded text
     */
    public Change(String id, String executionId, String filePath, String original, byte[] originalBytes,
                  boolean originalExisted, String modified, int startLine, int endLine, String description,
                  ChangeKind kind) {
        this.id = Objects.requireNonNull(id, "id");
        this.executionId = Objects.requireNonNull(executionId, "executionId");
        this.filePath = Objects.requireNonNull(filePath, "filePath");
        this.original = original == null ? "" : original;
        this.originalBytes = Objects.requireNonNull(originalBytes, "originalBytes").clone();
        this.originalExisted = originalExisted;
        this.modified = Objects.requireNonNull(modified, "modified");
        this.startLine = startLine;
        this.endLine = endLine;
        this.description = description == null ? "" : description;
        this.kind = kind;
    }

    public String getId() { return id; }
    public String getExecutionId() { return executionId; }
    public String getFilePath() { return filePath; }
    public String getOriginal() { return original; }
    public boolean isOriginalExisted() { return originalExisted; }
    public String getModified() { return modified; }
    public int getStartLine() { return startLine; }
    public int getEndLine() { return endLine; }
    public String getDescription() { return description; }
    public ChangeKind getKind() { return kind; }

    public synchronized ChangeStatus getStatus() {
        return status;
    }

    public synchronized String getUserContent() {
        return userContent;
    }

    /** True if {@code current} is byte for byte the content this change was proposed against. */
    public boolean matchesOriginal(byte[] current) {
        return Arrays.equals(originalBytes, current);
    }

    public boolean isNewFile() {
        return !originalExisted;
    }

    /** Content that will be written on apply: the user's edit if any, else the proposal. */
    public synchronized String effectiveContent() {
        return userContent != null ? userContent : modified;
    }

    public synchronized void accept() {
        transitionTo(ChangeStatus.ACCEPTED);
        userContent = null;
    }

    public synchronized void reject() {
        transitionTo(ChangeStatus.REJECTED);
    }

    public synchronized void edit(String newContent) {
        transitionTo(ChangeStatus.MODIFIED);
        userContent = newContent;
    }

    public synchronized void markApplied() {
        transitionTo(ChangeStatus.APPLIED);
    }

    public synchronized void markReverted() {
        transitionTo(ChangeStatus.REVERTED);
    }

    private void transitionTo(ChangeStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException(
                    "Change " + executionId + "/" + id + " cannot move from " + status + " to " + next);
        }
        status = next;
    }

    public synchronized ChangeView view() {
        return new ChangeView(id, executionId, filePath, description, kind, status,
                startLine, endLine, original, modified, userContent, originalExisted);
    }

    @Override
    public String toString() {
        return "Change[" + executionId + "/" + id + " " + filePath + " " + getStatus() + "]";
    }
}
