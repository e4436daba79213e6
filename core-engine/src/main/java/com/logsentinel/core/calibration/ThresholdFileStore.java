package com.logsentinel.core.calibration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Keeps the operating threshold in a small JSON file so it survives restarts.
 *
 * <pre>
 * {"threshold": 0.42, "updated_at": "2024-05-01T10:15:30Z"}
 * </pre>
 *
 * <p>
 * Persistence is best effort. A missing, unreadable or out-of-range file is
 * logged and ignored, and a failed write never propagates.
 * </p>
 *
 * @since 1.0.0
 */
public class ThresholdFileStore {

    private static final Logger LOG = LoggerFactory.getLogger(ThresholdFileStore.class);

    private final Path path;
    private final ObjectMapper mapper;

    public ThresholdFileStore(Path path) {
        this.path = Objects.requireNonNull(path, "path must not be null");
        this.mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
    }

    /**
     * @return the stored threshold, or empty when nothing usable is stored
     */
    public OptionalDouble load() {
        if (!Files.exists(path)) {
            LOG.info("No stored threshold at {}", path);
            return OptionalDouble.empty();
        }
        try {
            JsonNode node = mapper.readTree(path.toFile()).path("threshold");
            if (!node.isNumber() || !ThresholdCalibrator.inUnitRange(node.asDouble())) {
                LOG.warn("Ignoring stored threshold {} in {}", node, path);
                return OptionalDouble.empty();
            }
            LOG.info("Loaded stored threshold {} from {}", node.asDouble(), path);
            return OptionalDouble.of(node.asDouble());
        } catch (IOException e) {
            LOG.warn("Failed to read stored threshold from {}: {}", path, e.getMessage());
            return OptionalDouble.empty();
        }
    }

    /**
     * @param threshold threshold to store
     * @param at        time of the change
     */
    public void save(double threshold, Instant at) {
        ObjectNode node = mapper.createObjectNode();
        node.put("threshold", threshold);
        node.put("updated_at", at.toString());
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            mapper.writeValue(path.toFile(), node);
        } catch (IOException e) {
            LOG.warn("Failed to store threshold {} to {}: {}", threshold, path, e.getMessage());
        }
    }

    public Path getPath() {
        return path;
    }
}
