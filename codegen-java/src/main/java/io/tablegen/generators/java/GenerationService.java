package io.tablegen.generators.java;

import io.tablegen.core.MetadataValidator;
import io.tablegen.core.model.TableMetadata;
import io.tablegen.generators.java.merge.MergeResult;
import io.tablegen.generators.java.merge.PreservationMerger;
import io.tablegen.generators.java.store.ChecksumCalculator;
import io.tablegen.generators.java.store.MetadataStore;
import io.tablegen.generators.java.store.MetadataStoreRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs one generation request end to end: resolve metadata, check it against the
 * checksum store, render the files, merge preserved blocks from the files on disk,
 * write what changed and record the accepted checksum.
 *
 * <p>Drift is checked before anything is written, so a rejected run leaves the output
 * tree and the store untouched.
 */
public class GenerationService {

    private static final Logger log = LoggerFactory.getLogger(GenerationService.class);

    private final JavaGenerator generator;
    private final MetadataStore store;

    public GenerationService() {
        this(new JavaGenerator(), new MetadataStore());
    }

    public GenerationService(JavaGenerator generator, MetadataStore store) {
        this.generator = generator;
        this.store = store;
    }

    /**
     * @throws SchemaDriftDetectedException if the stored checksum differs and {@code force} is off
     * @throws IOException if metadata, the store or an output file cannot be read or written
     */
    public GenerationResult generate(GenerateOptions options) throws IOException {
        TableMetadata metadata = resolveMetadata(options);
        MetadataValidator.validate(metadata);

        String key = metadata.key();
        String checksum = ChecksumCalculator.compute(metadata);
        Path storePath = options.resolvedStorePath();
        Map<String, MetadataStoreRecord> records = store.load(storePath);

        checkDrift(key, records.get(key), checksum, options.force());

        List<GeneratedFile> files = generator.generate(metadata, options.basePackage(), options.dialect());
        List<Path> written = new ArrayList<>();
        List<Path> skipped = new ArrayList<>();
        Map<String, List<String>> orphans = new LinkedHashMap<>();

        for (GeneratedFile file : files) {
            Path target = options.outputRoot().resolve(file.relativePath());
            String existing = Files.exists(target) ? Files.readString(target) : null;

            if (existing != null) {
                for (String problem : PreservationMerger.validateMarkers(existing)) {
                    log.warn("{}: {}", target, problem);
                }
            }

            MergeResult merged = PreservationMerger.mergeDetailed(
                PreservationMerger.normalize(file.content()), existing);
            if (merged.hasOrphans()) {
                log.warn("{}: discarding preserved block(s) no longer in the template: {}",
                    target, merged.orphanedIds());
                orphans.put(file.relativePath(), merged.orphanedIds());
            }

            String content = PreservationMerger.normalize(merged.content());
            if (existing != null && content.equals(PreservationMerger.normalize(existing))) {
                log.debug("Unchanged {}", target);
                skipped.add(target);
                continue;
            }

            if (!options.dryRun()) {
                Path parent = target.getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                Files.writeString(target, content);
                log.info("Wrote {}", target);
            } else {
                log.info("Would write {}", target);
            }
            written.add(target);
        }

        if (!options.dryRun()) {
            store.updateRecord(records, metadata, checksum);
            store.save(storePath, records);
        }

        return new GenerationResult(key, checksum, metadata, files, written, skipped, orphans, options.dryRun());
    }

    private TableMetadata resolveMetadata(GenerateOptions options) throws IOException {
        if (options.metadata() != null) {
            return options.metadata();
        }
        try (SchemaIntrospector introspector = options.introspector()) {
            TableMetadata metadata = introspector.getTableMetadata(options.schema(), options.table());
            if (metadata == null) {
                throw new IOException("Table not found: " + options.schema() + "." + options.table());
            }
            return metadata;
        }
    }

    private static void checkDrift(String key, MetadataStoreRecord stored, String checksum, boolean force) {
        if (stored == null || stored.checksum() == null || stored.checksum().equals(checksum)) {
            return;
        }
        if (!force) {
            throw new SchemaDriftDetectedException(key, stored.checksum(), checksum);
        }
        log.warn("Schema drift for {} accepted with force ({} -> {})", key, stored.checksum(), checksum);
    }
}
