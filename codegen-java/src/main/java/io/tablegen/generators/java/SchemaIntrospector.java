package io.tablegen.generators.java;

import io.tablegen.core.model.TableMetadata;

import java.io.IOException;

/**
 * Source of live table metadata, typically backed by a database connection.
 * The generation service closes it once the metadata has been read.
 */
public interface SchemaIntrospector extends AutoCloseable {

    TableMetadata getTableMetadata(String schema, String table) throws IOException;

    @Override
    default void close() throws IOException {
    }
}
