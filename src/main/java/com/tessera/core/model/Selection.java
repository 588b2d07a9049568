package com.tessera.core.model;

import java.util.List;

/**
 * Files the user pinned to the context in addition to the ones mentioned in the command.
 */
public record Selection(List<String> pinnedFiles) {

    public Selection {
        pinnedFiles = pinnedFiles == null ? List.of() : List.copyOf(pinnedFiles);
    }

    public static Selection none() {
        return new Selection(List.of());
    }

    public static Selection of(String... paths) {
        return new Selection(List.of(paths));
    }
}
