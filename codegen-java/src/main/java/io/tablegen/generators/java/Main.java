package io.tablegen.generators.java;

import io.tablegen.core.MetadataLoader;
import io.tablegen.core.model.TableMetadata;
import io.tablegen.core.query.SqlDialects;
import io.tablegen.generators.java.config.GeneratorConfig;
import io.tablegen.generators.java.config.GeneratorConfigLoader;

import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * CLI entry point for the table code generator.
 *
 * Usage:
 *   java -jar codegen-java.jar --metadata-file <path> --package <pkg> --output <dir>
 *       [--schema <name>] [--table <name>] [--store <path>] [--dialect postgres|mysql]
 *       [--config <path>] [--force] [--dry-run]
 *
 * Values missing from the command line are taken from {@code tablegen.json} (or {@code --config}).
 */
public class Main {

    private static final String USAGE = "Usage: java -jar codegen-java.jar --metadata-file <path> --package <pkg>"
        + " --output <dir> [--schema <name>] [--table <name>] [--store <path>] [--dialect postgres|mysql]"
        + " [--config <path>] [--force] [--dry-run]";

    public static void main(String[] args) {
        int code = run(args, System.out, System.err);
        if (code != 0) {
            System.exit(code);
        }
    }

    /**
     * @return process exit code, 0 on success and 1 on any error
     */
    public static int run(String[] args, PrintStream out, PrintStream err) {
        try {
            String metadataFile = null;
            String schema = null;
            String table = null;
            String packageName = null;
            String outputDir = null;
            String storeFile = null;
            String dialect = null;
            String configFile = null;
            boolean force = false;
            boolean dryRun = false;

            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case "--metadata-file":
                        metadataFile = value(args, ++i);
                        break;
                    case "--schema":
                        schema = value(args, ++i);
                        break;
                    case "--table":
                        table = value(args, ++i);
                        break;
                    case "--package":
                        packageName = value(args, ++i);
                        break;
                    case "--output":
                        outputDir = value(args, ++i);
                        break;
                    case "--store":
                        storeFile = value(args, ++i);
                        break;
                    case "--dialect":
                        dialect = value(args, ++i);
                        break;
                    case "--config":
                        configFile = value(args, ++i);
                        break;
                    case "--force":
                        force = true;
                        break;
                    case "--dry-run":
                        dryRun = true;
                        break;
                    default:
                        throw new IllegalArgumentException("Unknown argument: " + args[i]);
                }
            }

            // only the default config file is optional
            if (configFile != null && !Files.exists(Paths.get(configFile))) {
                throw new IllegalArgumentException("config file not found: " + configFile);
            }
            GeneratorConfig config = GeneratorConfigLoader.load(
                Paths.get(configFile != null ? configFile : GeneratorConfig.DEFAULT_FILE));
            metadataFile = firstNonNull(metadataFile, config.metadataFile());
            packageName = firstNonNull(packageName, config.basePackage());
            outputDir = firstNonNull(outputDir, config.outputPath());
            dialect = firstNonNull(dialect, config.dialect());
            storeFile = firstNonNull(storeFile, config.storePath());

            if (metadataFile == null || packageName == null || outputDir == null) {
                err.println(USAGE);
                return 1;
            }

            TableMetadata metadata = MetadataLoader.load(Paths.get(metadataFile));
            if (schema != null && !schema.equals(metadata.schema())
                || table != null && !table.equals(metadata.table())) {
                throw new IllegalArgumentException("Metadata file describes " + metadata.key()
                    + ", not " + firstNonNull(schema, metadata.schema()) + "." + firstNonNull(table, metadata.table()));
            }

            GenerateOptions options = GenerateOptions.builder()
                .metadata(metadata)
                .basePackage(packageName)
                .outputRoot(Paths.get(outputDir))
                .storePath(storeFile != null ? Paths.get(storeFile) : null)
                .dialect(SqlDialects.of(dialect))
                .force(force)
                .dryRun(dryRun)
                .build();

            GenerationResult result = new GenerationService().generate(options);

            out.println((dryRun ? "Dry run for " : "Generated Java code for ") + result.key()
                + " (checksum " + result.checksum() + ")");
            for (Path p : result.written()) {
                out.println((dryRun ? "  would write " : "  wrote ") + p);
            }
            for (Path p : result.skipped()) {
                out.println("  unchanged " + p);
            }
            result.orphanedBlocks().forEach((file, ids) ->
                out.println("  discarded preserved blocks in " + file + ": " + ids));
            return 0;

        } catch (Exception e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    private static String value(String[] args, int i) {
        if (i >= args.length) {
            throw new IllegalArgumentException("Missing value for " + args[i - 1]);
        }
        return args[i];
    }

    private static String firstNonNull(String a, String b) {
        return a != null ? a : b;
    }
}
