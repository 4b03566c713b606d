package io.tablegen.generators.java;

import io.tablegen.core.model.TableMetadata;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * What a generation request produced. On a dry run {@code written} lists the files that
 * would have been written.
 *
 * @param orphanedBlocks per relative file path, preserved block ids dropped because the
 *                       template no longer defines them
 */
public record GenerationResult(
    String key,
    String checksum,
    TableMetadata metadata,
    List<GeneratedFile> files,
    List<Path> written,
    List<Path> skipped,
    Map<String, List<String>> orphanedBlocks,
    boolean dryRun
) {
    public GenerationResult {
        files = List.copyOf(files);
        written = List.copyOf(written);
        skipped = List.copyOf(skipped);
        orphanedBlocks = Map.copyOf(orphanedBlocks);
    }
}
