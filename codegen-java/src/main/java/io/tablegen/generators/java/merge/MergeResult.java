package io.tablegen.generators.java.merge;

import java.util.List;

/**
 * Outcome of one merge.
 *
 * @param content merged text
 * @param preservedIds block ids whose on-disk body was carried over, in template order
 * @param orphanedIds block ids found on disk that the new template no longer defines;
 *                    their bodies are not in {@code content}
 */
public record MergeResult(String content, List<String> preservedIds, List<String> orphanedIds) {
    public MergeResult {
        preservedIds = List.copyOf(preservedIds);
        orphanedIds = List.copyOf(orphanedIds);
    }

    public boolean hasOrphans() {
        return !orphanedIds.isEmpty();
    }
}
