package com.tradecore.market;

import java.math.BigDecimal;
import java.util.Comparator;
import java.util.List;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;

import com.tradecore.market.dto.DepthUpdateEvent;
import com.tradecore.market.dto.OrderBookDepthResponse;

/**
 * Price-level book for one symbol. Not thread-safe on its own; {@link OrderBookSynchronizer}
 * serializes access.
 */
public class LocalOrderBook {

	private final NavigableMap<BigDecimal, BigDecimal> bids = new TreeMap<>(Comparator.reverseOrder());
	private final NavigableMap<BigDecimal, BigDecimal> asks = new TreeMap<>();
	private long lastUpdateId = -1;

	public void reset() {
		bids.clear();
		asks.clear();
		lastUpdateId = -1;
	}

	public void applySnapshot(OrderBookDepthResponse snapshot) {
		bids.clear();
		asks.clear();
		lastUpdateId = snapshot.lastUpdateId();
		applyLevels(bids, snapshot.bids());
		applyLevels(asks, snapshot.asks());
	}

	public void applyDepthUpdate(DepthUpdateEvent update) {
		applyLevels(bids, update.bids());
		applyLevels(asks, update.asks());
		lastUpdateId = update.finalUpdateId();
	}

	public long lastUpdateId() {
		return lastUpdateId;
	}

	public Optional<BigDecimal> bestBid() {
		return bids.isEmpty() ? Optional.empty() : Optional.of(bids.firstKey());
	}

	public Optional<BigDecimal> bestAsk() {
		return asks.isEmpty() ? Optional.empty() : Optional.of(asks.firstKey());
	}

	public Optional<BigDecimal> bidQuantity(BigDecimal price) {
		return Optional.ofNullable(bids.get(price));
	}

	public Optional<BigDecimal> askQuantity(BigDecimal price) {
		return Optional.ofNullable(asks.get(price));
	}

	/**
	 * True when both sides are present and the best bid is not strictly below the best ask.
	 */
	public boolean isCrossed() {
		if (bids.isEmpty() || asks.isEmpty()) {
			return false;
		}
		return bids.firstKey().compareTo(asks.firstKey()) >= 0;
	}

	public OrderBookView view(String symbol, int depthLevels) {
		List<PriceLevel> bidLevels = bids.entrySet().stream()
				.limit(depthLevels)
				.map(entry -> new PriceLevel(entry.getKey(), entry.getValue()))
				.toList();
		List<PriceLevel> askLevels = asks.entrySet().stream()
				.limit(depthLevels)
				.map(entry -> new PriceLevel(entry.getKey(), entry.getValue()))
				.toList();
		BigDecimal bestBid = bids.isEmpty() ? null : bids.firstKey();
		BigDecimal bestAsk = asks.isEmpty() ? null : asks.firstKey();
		return new OrderBookView(symbol, bestBid, bestAsk, bidLevels, askLevels, lastUpdateId);
	}

	private void applyLevels(NavigableMap<BigDecimal, BigDecimal> book, List<List<String>> levels) {
		if (levels == null) {
			return;
		}
		for (List<String> level : levels) {
			if (level.size() < 2) {
				continue;
			}
			BigDecimal price = new BigDecimal(level.get(0));
			BigDecimal qty = new BigDecimal(level.get(1));
			if (qty.signum() == 0) {
				book.remove(price);
			} else {
				book.put(price, qty);
			}
		}
	}
}
