package com.tessera.core.workspace;

import java.util.List;

/**
 * One entry of the workspace file tree. Children are empty for files.
 */
public record FileNode(String name, String path, boolean directory, long size, List<FileNode> children) {

    public FileNode {
        children = List.copyOf(children);
    }
}
