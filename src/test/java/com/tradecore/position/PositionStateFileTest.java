package com.tradecore.position;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.tradecore.TestFixtures;

class PositionStateFileTest {

	@TempDir
	Path tempDir;

	@Test
	void missingFileLoadsEmpty() {
		PositionStateFile file = new PositionStateFile(tempDir.resolve("absent.json"), TestFixtures.objectMapper());

		assertThat(file.load()).isEmpty();
	}

	@Test
	void corruptFileLoadsEmpty() throws IOException {
		Path path = tempDir.resolve("positions.json");
		Files.writeString(path, "{\"BTCUSDT\": {\"symbol\": ");

		assertThat(new PositionStateFile(path, TestFixtures.objectMapper()).load()).isEmpty();
	}

	@Test
	void zeroQuantityEntriesAreSkippedOnLoad() throws IOException {
		Path path = tempDir.resolve("positions.json");
		Files.writeString(path, """
				{
				  "BTCUSDT": {"symbol": "BTCUSDT", "side": "LONG", "quantity": 0, "entryPrice": 100,
				              "stopLossOrderId": 1, "takeProfitOrderId": 2, "openedAt": 1},
				  "ETHUSDT": {"symbol": "ETHUSDT", "side": "SHORT", "quantity": 2, "entryPrice": 2000,
				              "stopLoss": 2100, "takeProfit": 1900, "initialStopLoss": 2100,
				              "stopLossOrderId": 3, "takeProfitOrderId": 4, "strategyId": "s1", "openedAt": 1}
				}
				""");

		Map<String, Position> loaded = new PositionStateFile(path, TestFixtures.objectMapper()).load();

		assertThat(loaded).containsOnlyKeys("ETHUSDT");
		assertThat(loaded.get("ETHUSDT").side()).isEqualTo(PositionSide.SHORT);
		assertThat(loaded.get("ETHUSDT").takeProfit()).isEqualByComparingTo("1900");
	}

	@Test
	void writeReplacesFileAndLeavesNoTempFiles() throws IOException {
		Path path = tempDir.resolve("nested").resolve("positions.json");
		PositionStateFile file = new PositionStateFile(path, TestFixtures.objectMapper());
		Position position = new Position("BTCUSDT", PositionSide.LONG, new BigDecimal("1"), new BigDecimal("100"),
				new BigDecimal("95"), new BigDecimal("110"), new BigDecimal("95"), 1L, 2L, "s1", 1L);

		file.write(Map.of("BTCUSDT", position));
		file.write(Map.of());

		assertThat(file.load()).isEmpty();
		try (Stream<Path> files = Files.list(path.getParent())) {
			assertThat(files).containsExactly(path);
		}
	}

	@Test
	void writeFailureIsReportedAsPersistenceException() throws IOException {
		Path blocker = tempDir.resolve("blocker");
		Files.writeString(blocker, "not a directory");
		PositionStateFile file = new PositionStateFile(blocker.resolve("positions.json"), TestFixtures.objectMapper());

		assertThatThrownBy(() -> file.write(Map.of()))
				.isInstanceOf(PositionPersistenceException.class);
	}
}
