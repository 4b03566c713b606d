package io.tablegen.generators.java;

/**
 * Table metadata changed since the last accepted generation and the caller did not force
 * regeneration. Raised before any file is written.
 */
public class SchemaDriftDetectedException extends IllegalStateException {

    private final String key;
    private final String storedChecksum;
    private final String currentChecksum;

    public SchemaDriftDetectedException(String key, String storedChecksum, String currentChecksum) {
        super("Schema drift detected for " + key + ": stored checksum " + storedChecksum
            + " does not match current checksum " + currentChecksum
            + ". Review the metadata change and regenerate with force to accept it.");
        this.key = key;
        this.storedChecksum = storedChecksum;
        this.currentChecksum = currentChecksum;
    }

    public String getKey() {
        return key;
    }

    public String getStoredChecksum() {
        return storedChecksum;
    }

    public String getCurrentChecksum() {
        return currentChecksum;
    }
}
