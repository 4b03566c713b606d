package io.tablegen.generators.java;

/**
 * One candidate output file: a path relative to the output root (forward slashes)
 * and its freshly generated content, before merging with what is on disk.
 */
public record GeneratedFile(String relativePath, String content) {
}
