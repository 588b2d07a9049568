package com.tessera.core.model;

/** Content of a workspace file read while building context. Path is workspace-relative. */
public record FileContent(String path, String content, long sizeBytes) {}
