package io.tablegen.generators.java;

import io.tablegen.core.model.TableMetadata;
import io.tablegen.core.query.SqlDialect;
import io.tablegen.core.query.SqlDialects;
import io.tablegen.generators.java.store.MetadataStore;

import java.nio.file.Path;

/**
 * Inputs of one generation request. Metadata comes either literally ({@code metadata})
 * or from an {@code introspector} queried with {@code schema} and {@code table}.
 */
public record GenerateOptions(
    String schema,
    String table,
    String basePackage,
    Path outputRoot,
    Path storePath,
    SqlDialect dialect,
    TableMetadata metadata,
    SchemaIntrospector introspector,
    boolean force,
    boolean dryRun
) {

    /** Configured store path, or {@code <outputRoot>/.tablegen/metadata.json}. */
    public Path resolvedStorePath() {
        return storePath != null ? storePath : outputRoot.resolve(MetadataStore.DEFAULT_RELATIVE_PATH);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String schema;
        private String table;
        private String basePackage;
        private Path outputRoot;
        private Path storePath;
        private SqlDialect dialect = SqlDialects.POSTGRES;
        private TableMetadata metadata;
        private SchemaIntrospector introspector;
        private boolean force;
        private boolean dryRun;

        public Builder schema(String schema) {
            this.schema = schema;
            return this;
        }

        public Builder table(String table) {
            this.table = table;
            return this;
        }

        public Builder basePackage(String basePackage) {
            this.basePackage = basePackage;
            return this;
        }

        public Builder outputRoot(Path outputRoot) {
            this.outputRoot = outputRoot;
            return this;
        }

        public Builder storePath(Path storePath) {
            this.storePath = storePath;
            return this;
        }

        public Builder dialect(SqlDialect dialect) {
            this.dialect = dialect;
            return this;
        }

        public Builder metadata(TableMetadata metadata) {
            this.metadata = metadata;
            return this;
        }

        public Builder introspector(SchemaIntrospector introspector) {
            this.introspector = introspector;
            return this;
        }

        public Builder force(boolean force) {
            this.force = force;
            return this;
        }

        public Builder dryRun(boolean dryRun) {
            this.dryRun = dryRun;
            return this;
        }

        /**
         * @throws IllegalArgumentException if a required input is missing
         */
        public GenerateOptions build() {
            if (basePackage == null || basePackage.isBlank()) {
                throw new IllegalArgumentException("basePackage required");
            }
            if (outputRoot == null) {
                throw new IllegalArgumentException("outputRoot required");
            }
            if (dialect == null) {
                throw new IllegalArgumentException("dialect required");
            }
            if (metadata == null) {
                if (introspector == null) {
                    throw new IllegalArgumentException("either metadata or an introspector is required");
                }
                if (schema == null || table == null) {
                    throw new IllegalArgumentException("schema and table required when introspecting");
                }
            }
            return new GenerateOptions(schema, table, basePackage, outputRoot, storePath, dialect,
                metadata, introspector, force, dryRun);
        }
    }
}
