package com.tessera.core.workspace;

import java.util.List;

/**
 * @param restoredPaths paths put back to their pre-apply content
 * @param deletedPaths  paths removed because the apply had created them
 */
public record RevertResult(List<String> restoredPaths, List<String> deletedPaths) {

    public RevertResult {
        restoredPaths = List.copyOf(restoredPaths);
        deletedPaths = List.copyOf(deletedPaths);
    }
}
