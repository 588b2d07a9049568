package com.tessera.core.model;

/** How a proposal arrived from the reasoning backend. */
public enum ChangeKind {
    FULL_CONTENT,
    DIFF
}
