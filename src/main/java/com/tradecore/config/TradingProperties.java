package com.tradecore.config;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import com.tradecore.exchange.dto.MarginType;
import com.tradecore.exchange.dto.OrderType;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

@Validated
@ConfigurationProperties(prefix = "trading")
public record TradingProperties(
		@Positive int leverage,
		@NotNull MarginType marginType,
		@Positive int maxActiveTrades,
		@NotNull @Positive BigDecimal marginPerTradePct,
		@NotBlank String balanceAsset,
		@Positive int snapshotDepth,
		@Positive int viewDepth,
		@Positive int depthBufferCapacity,
		boolean sequenceGapCheck,
		@NotNull Path stateFile,
		@Positive long reconcileIntervalMs,
		@Positive long rulesRefreshIntervalMs,
		long pendingEntryTtlMs,
		@Valid List<StrategySlot> strategies) {

	public List<StrategySlot> resolvedStrategies() {
		return strategies == null ? List.of() : strategies;
	}

	public List<String> tradedSymbols() {
		return resolvedStrategies().stream()
				.map(StrategySlot::normalizedSymbol)
				.distinct()
				.toList();
	}

	public record StrategySlot(
			@NotBlank String id,
			@NotBlank String type,
			@NotBlank String symbol,
			OrderType entryOrderType,
			int entryOffsetTicks,
			Map<String, String> parameters) {

		public String normalizedSymbol() {
			return symbol.toUpperCase(Locale.ROOT);
		}

		public OrderType resolvedEntryOrderType() {
			return entryOrderType == null ? OrderType.LIMIT : entryOrderType;
		}

		public Map<String, String> resolvedParameters() {
			return parameters == null ? Map.of() : parameters;
		}
	}
}
