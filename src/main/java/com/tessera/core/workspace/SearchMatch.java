package com.tessera.core.workspace;

/**
 * @param path      workspace-relative path
 * @param proximity segments between the matched segment and the file name; 0 means the file name matched
 */
public record SearchMatch(String path, int proximity) {}
