package tore.relay.service.checkpoint;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.math.BigInteger;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import tore.relay.config.RelayProperties;

/**
 * Persists the height of the last block whose events are known to be enqueued.
 * The record is a small JSON document {@code { "lastBlock": N }}.
 */
@Service
@Slf4j
public class CheckpointStore {

    private static final String LAST_BLOCK_FIELD = "lastBlock";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Path path;

    @Autowired
    public CheckpointStore(RelayProperties properties) {
        this(properties.getCheckpoint().getPath());
    }

    public CheckpointStore(String path) {
        this.path = Path.of(path);
    }

    /**
     * Returns the stored height, or 0 when the record is missing or unreadable.
     */
    public synchronized long read() {
        try {
            JsonNode root = objectMapper.readTree(Files.readAllBytes(path));
            JsonNode lastBlock = root == null ? null : root.get(LAST_BLOCK_FIELD);
            if (lastBlock == null || lastBlock.isNull()) {
                return 0;
            }
            if (lastBlock.isIntegralNumber() && lastBlock.canConvertToLong()) {
                return Math.max(0, lastBlock.asLong());
            }
            double value = lastBlock.isTextual() ? Double.parseDouble(lastBlock.asText().trim()) : lastBlock.asDouble(Double.NaN);
            if (!Double.isFinite(value) || value < 0) {
                return 0;
            }
            return (long) Math.floor(value);
        } catch (NoSuchFileException e) {
            return 0;
        } catch (IOException | RuntimeException e) {
            log.error("Failed to read checkpoint from {}: {}", path, e.getMessage());
            return 0;
        }
    }

    /**
     * Stores {@code height} when it is a finite, non-negative number; anything else is ignored.
     * Fractional heights are floored.
     */
    public synchronized void write(Number height) {
        if (height == null) {
            return;
        }
        long block;
        if (height instanceof Long || height instanceof Integer || height instanceof Short || height instanceof Byte) {
            block = height.longValue();
        } else if (height instanceof BigInteger bigInteger) {
            if (bigInteger.signum() < 0 || bigInteger.bitLength() > 63) {
                return;
            }
            block = bigInteger.longValue();
        } else {
            double value = height.doubleValue();
            if (!Double.isFinite(value)) {
                return;
            }
            block = (long) Math.floor(value);
        }
        if (block < 0) {
            return;
        }
        try {
            if (path.getParent() != null) {
                Files.createDirectories(path.getParent());
            }
            ObjectNode record = objectMapper.createObjectNode();
            record.put(LAST_BLOCK_FIELD, block);
            Path temp = path.resolveSibling(path.getFileName() + ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), record);
            try {
                Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("Checkpoint advanced to block {}", block);
        } catch (IOException e) {
            log.warn("Failed to persist checkpoint {} to {}: {}", block, path, e.getMessage());
        }
    }

    /**
     * Writes {@code height} only when it is ahead of the stored checkpoint, so concurrent
     * subscriptions cannot move it backwards.
     *
     * @return true when the checkpoint moved
     */
    public synchronized boolean advance(long height) {
        if (height <= read()) {
            return false;
        }
        write(height);
        return true;
    }

    public Path getPath() {
        return path;
    }
}
