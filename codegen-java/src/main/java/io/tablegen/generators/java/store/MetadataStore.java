package io.tablegen.generators.java.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.tablegen.core.model.TableMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON file mapping {@code "schema.table"} to its {@link MetadataStoreRecord}.
 *
 * <pre>
 * {
 *   "public.orders" : {
 *     "checksum" : "9f2c...",
 *     "metadata" : { ... },
 *     "generatedAt" : "2025-01-01T10:00:00Z",
 *     "updatedAt" : "2025-02-01T08:30:00Z"
 *   }
 * }
 * </pre>
 *
 * No locking: concurrent generation of the same table must be serialized by the caller.
 */
public class MetadataStore {

    private static final Logger log = LoggerFactory.getLogger(MetadataStore.class);

    /** Store location relative to the output root when none is configured. */
    public static final String DEFAULT_RELATIVE_PATH = ".tablegen/metadata.json";

    private static final TypeReference<LinkedHashMap<String, MetadataStoreRecord>> STORE_TYPE =
        new TypeReference<>() {};

    private final ObjectMapper mapper;
    private final Clock clock;

    public MetadataStore() {
        this(Clock.systemUTC());
    }

    public MetadataStore(Clock clock) {
        this.clock = clock;
        this.mapper = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .build();
    }

    /**
     * @return mutable map; empty when the file does not exist or is empty
     * @throws IOException if the file cannot be read or is not a valid store
     */
    public Map<String, MetadataStoreRecord> load(Path path) throws IOException {
        if (!Files.exists(path) || Files.size(path) == 0) {
            log.debug("No metadata store at {}", path);
            return new LinkedHashMap<>();
        }
        try {
            Map<String, MetadataStoreRecord> records = mapper.readValue(path.toFile(), STORE_TYPE);
            return records == null ? new LinkedHashMap<>() : records;
        } catch (JsonProcessingException e) {
            throw new IOException("Invalid metadata store " + path + ": " + e.getOriginalMessage(), e);
        }
    }

    public void save(Path path, Map<String, MetadataStoreRecord> records) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(path, mapper.writeValueAsString(records) + "\n");
        log.debug("Saved {} record(s) to {}", records.size(), path);
    }

    /**
     * Put the record for {@code metadata.key()} into {@code records}, keeping the first
     * {@code generatedAt} and stamping {@code updatedAt} with the current time.
     */
    public MetadataStoreRecord updateRecord(Map<String, MetadataStoreRecord> records,
            TableMetadata metadata, String checksum) {
        Instant now = clock.instant();
        MetadataStoreRecord previous = records.get(metadata.key());
        Instant generatedAt = previous != null && previous.generatedAt() != null ? previous.generatedAt() : now;
        MetadataStoreRecord record = new MetadataStoreRecord(checksum, metadata, generatedAt, now);
        records.put(metadata.key(), record);
        return record;
    }
}
