package com.tradecore.market;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

import org.springframework.stereotype.Component;

import com.tradecore.config.TradingProperties;

/**
 * One {@link OrderBookSynchronizer} and one {@link BookUpdateSignal} per traded symbol.
 */
@Component
public class OrderBookRegistry {

	private final Map<String, OrderBookSynchronizer> synchronizers = new LinkedHashMap<>();
	private final Map<String, BookUpdateSignal> signals = new LinkedHashMap<>();

	public OrderBookRegistry(TradingProperties tradingProperties) {
		for (String symbol : tradingProperties.tradedSymbols()) {
			synchronizers.put(symbol, new OrderBookSynchronizer(symbol,
					tradingProperties.depthBufferCapacity(),
					tradingProperties.sequenceGapCheck()));
			signals.put(symbol, new BookUpdateSignal());
		}
	}

	public Collection<String> symbols() {
		return synchronizers.keySet();
	}

	public OrderBookSynchronizer synchronizer(String symbol) {
		OrderBookSynchronizer synchronizer = synchronizers.get(normalize(symbol));
		if (synchronizer == null) {
			throw new IllegalArgumentException("Symbol not traded: " + symbol);
		}
		return synchronizer;
	}

	public BookUpdateSignal signal(String symbol) {
		BookUpdateSignal signal = signals.get(normalize(symbol));
		if (signal == null) {
			throw new IllegalArgumentException("Symbol not traded: " + symbol);
		}
		return signal;
	}

	public boolean isTraded(String symbol) {
		return symbol != null && synchronizers.containsKey(normalize(symbol));
	}

	private static String normalize(String symbol) {
		return symbol.toUpperCase(Locale.ROOT);
	}
}
