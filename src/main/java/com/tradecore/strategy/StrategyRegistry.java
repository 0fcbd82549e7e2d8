package com.tradecore.strategy;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.tradecore.config.TradingProperties;
import com.tradecore.config.TradingProperties.StrategySlot;

/**
 * One {@link Strategy} per configured slot, built by the factory registered for the slot's
 * type. Unknown types and duplicate ids fail startup.
 */
@Component
public class StrategyRegistry {

	private static final Logger LOGGER = LoggerFactory.getLogger(StrategyRegistry.class);

	private final Map<String, Strategy> strategies = new LinkedHashMap<>();

	public StrategyRegistry(List<StrategyFactory> factories, TradingProperties tradingProperties) {
		Map<String, StrategyFactory> byType = factories.stream()
				.collect(Collectors.toMap(StrategyFactory::type, Function.identity(), (left, right) -> {
					throw new IllegalStateException("Duplicate strategy factory registered for " + left.type());
				}));
		for (StrategySlot slot : tradingProperties.resolvedStrategies()) {
			StrategyFactory factory = byType.get(slot.type());
			if (factory == null) {
				throw new IllegalStateException("No strategy factory registered for type " + slot.type()
						+ " (slot " + slot.id() + ")");
			}
			if (strategies.containsKey(slot.id())) {
				throw new IllegalStateException("Duplicate strategy slot id " + slot.id());
			}
			Strategy strategy = factory.create(slot);
			strategies.put(slot.id(), strategy);
			LOGGER.info("EVENT=STRATEGY_REGISTERED id={} type={} symbol={} entryOrderType={} offsetTicks={}",
					slot.id(), slot.type(), strategy.symbol(), strategy.entryOrderType(), strategy.entryOffsetTicks());
		}
	}

	public List<Strategy> all() {
		return List.copyOf(strategies.values());
	}

	public Optional<Strategy> find(String id) {
		return Optional.ofNullable(id == null ? null : strategies.get(id));
	}
}
