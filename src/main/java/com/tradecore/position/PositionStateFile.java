package com.tradecore.position;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * JSON file holding the full symbol to position map. Writes go to a temp file in the same
 * directory which is then moved over the target, so a crash mid-write leaves the previous
 * content intact.
 */
public class PositionStateFile {

	private static final Logger LOGGER = LoggerFactory.getLogger(PositionStateFile.class);
	private static final TypeReference<LinkedHashMap<String, Position>> MAP_TYPE = new TypeReference<>() {
	};

	private final Path path;
	private final ObjectMapper objectMapper;

	public PositionStateFile(Path path, ObjectMapper objectMapper) {
		this.path = path.toAbsolutePath();
		this.objectMapper = objectMapper;
	}

	public Path path() {
		return path;
	}

	/**
	 * Loads the persisted map. A missing or unreadable file yields an empty map; entries with a
	 * zero quantity are dropped.
	 */
	public Map<String, Position> load() {
		if (!Files.exists(path)) {
			LOGGER.info("EVENT=STATE_FILE_ABSENT path={}", path);
			return new LinkedHashMap<>();
		}
		try {
			Map<String, Position> raw = objectMapper.readValue(path.toFile(), MAP_TYPE);
			Map<String, Position> loaded = new LinkedHashMap<>();
			if (raw == null) {
				return loaded;
			}
			raw.forEach((symbol, position) -> {
				if (position == null || position.quantity() == null || position.quantity().signum() == 0) {
					LOGGER.info("EVENT=STATE_ENTRY_SKIPPED symbol={} reason=zero_quantity", symbol);
					return;
				}
				loaded.put(symbol, position);
			});
			LOGGER.info("EVENT=STATE_FILE_LOADED path={} positions={}", path, loaded.size());
			return loaded;
		} catch (IOException ex) {
			LOGGER.error("EVENT=STATE_FILE_CORRUPT path={} reason={}", path, ex.getMessage());
			return new LinkedHashMap<>();
		}
	}

	public void write(Map<String, Position> positions) {
		Path directory = path.getParent();
		Path temp = null;
		try {
			Files.createDirectories(directory);
			temp = Files.createTempFile(directory, path.getFileName().toString(), ".tmp");
			objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), positions);
			try {
				Files.move(temp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
			} catch (AtomicMoveNotSupportedException ex) {
				Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
			}
		} catch (IOException ex) {
			deleteQuietly(temp);
			throw new PositionPersistenceException("Failed to write position state to " + path, ex);
		}
	}

	private static void deleteQuietly(Path temp) {
		if (temp == null) {
			return;
		}
		try {
			Files.deleteIfExists(temp);
		} catch (IOException ex) {
			LOGGER.warn("EVENT=STATE_TEMP_CLEANUP_FAIL path={} reason={}", temp, ex.getMessage());
		}
	}
}
