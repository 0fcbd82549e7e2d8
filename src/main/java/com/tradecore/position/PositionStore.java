package com.tradecore.position;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tradecore.exchange.dto.ExchangePosition;

/**
 * Symbol to open-position map, at most one position per symbol. All access goes through one
 * lock and every mutation rewrites the state file. A failed write is logged and the in-memory
 * state stays authoritative until the next reconciliation.
 */
public class PositionStore {

	private static final Logger LOGGER = LoggerFactory.getLogger(PositionStore.class);

	private final Object lock = new Object();
	private final Map<String, Position> positions = new LinkedHashMap<>();
	private final PositionStateFile stateFile;

	public PositionStore(PositionStateFile stateFile) {
		this.stateFile = stateFile;
		positions.putAll(stateFile.load());
	}

	public Optional<Position> get(String symbol) {
		synchronized (lock) {
			return Optional.ofNullable(positions.get(normalize(symbol)));
		}
	}

	public boolean contains(String symbol) {
		return get(symbol).isPresent();
	}

	public int count() {
		synchronized (lock) {
			return positions.size();
		}
	}

	public List<Position> all() {
		synchronized (lock) {
			return List.copyOf(positions.values());
		}
	}

	/**
	 * Stores a position. Only fully protected positions are accepted.
	 */
	public void set(Position position) {
		if (!position.isProtected()) {
			throw new IllegalArgumentException("Position without both bracket orders: " + position.symbol());
		}
		synchronized (lock) {
			positions.put(normalize(position.symbol()), position);
			persist();
		}
		LOGGER.info("EVENT=POSITION_SET symbol={} side={} qty={} entry={} sl={} tp={} slOrderId={} tpOrderId={}",
				position.symbol(), position.side(), position.quantity(), position.entryPrice(),
				position.stopLoss(), position.takeProfit(), position.stopLossOrderId(), position.takeProfitOrderId());
	}

	public Optional<Position> close(String symbol) {
		Position removed;
		synchronized (lock) {
			removed = positions.remove(normalize(symbol));
			if (removed == null) {
				return Optional.empty();
			}
			persist();
		}
		LOGGER.info("EVENT=POSITION_CLOSED symbol={} side={} qty={}", removed.symbol(), removed.side(),
				removed.quantity());
		return Optional.of(removed);
	}

	/**
	 * Replaces the bracket order ids; a {@code null} id keeps the current one.
	 */
	public Optional<Position> updateBracketOrders(String symbol, Long stopLossOrderId, Long takeProfitOrderId) {
		synchronized (lock) {
			Position current = positions.get(normalize(symbol));
			if (current == null) {
				return Optional.empty();
			}
			Position updated = current.withBracketOrders(
					stopLossOrderId == null ? current.stopLossOrderId() : stopLossOrderId,
					takeProfitOrderId == null ? current.takeProfitOrderId() : takeProfitOrderId);
			positions.put(normalize(symbol), updated);
			persist();
			return Optional.of(updated);
		}
	}

	public Optional<Position> updateBrackets(String symbol, BigDecimal stopLoss, BigDecimal takeProfit,
			long stopLossOrderId, long takeProfitOrderId) {
		synchronized (lock) {
			Position current = positions.get(normalize(symbol));
			if (current == null) {
				return Optional.empty();
			}
			Position updated = current.withBrackets(stopLoss, takeProfit, stopLossOrderId, takeProfitOrderId);
			positions.put(normalize(symbol), updated);
			persist();
			return Optional.of(updated);
		}
	}

	public List<Position> clear() {
		List<Position> removed;
		synchronized (lock) {
			removed = new ArrayList<>(positions.values());
			if (removed.isEmpty()) {
				return removed;
			}
			positions.clear();
			persist();
		}
		LOGGER.warn("EVENT=POSITIONS_CLEARED count={}", removed.size());
		return removed;
	}

	public ReconciliationReport reconcile(List<ExchangePosition> exchangePositions) {
		return reconcile(exchangePositions, Long.MAX_VALUE);
	}

	/**
	 * Corrects the local map against the exchange's position list. Local positions opened after
	 * {@code observedAt} are left alone, since the exchange list may predate them.
	 */
	public ReconciliationReport reconcile(List<ExchangePosition> exchangePositions, long observedAt) {
		Map<String, ExchangePosition> remote = new LinkedHashMap<>();
		for (ExchangePosition exchangePosition : exchangePositions) {
			if (exchangePosition.positionAmt() != null && exchangePosition.positionAmt().signum() != 0) {
				remote.put(normalize(exchangePosition.symbol()), exchangePosition);
			}
		}

		List<String> stale = new ArrayList<>();
		List<String> sideMismatch = new ArrayList<>();
		List<String> corrected = new ArrayList<>();
		List<String> untracked = new ArrayList<>();

		synchronized (lock) {
			Set<String> trackedBefore = new HashSet<>(positions.keySet());
			for (Position local : new ArrayList<>(positions.values())) {
				String symbol = normalize(local.symbol());
				if (local.openedAt() > observedAt) {
					continue;
				}
				ExchangePosition exchangePosition = remote.get(symbol);
				if (exchangePosition == null) {
					positions.remove(symbol);
					stale.add(symbol);
					LOGGER.warn("EVENT=RECONCILE_STALE_DROPPED symbol={} side={} qty={}", symbol, local.side(),
							local.quantity());
					continue;
				}
				PositionSide remoteSide = exchangePosition.isLong() ? PositionSide.LONG : PositionSide.SHORT;
				if (remoteSide != local.side()) {
					positions.remove(symbol);
					sideMismatch.add(symbol);
					LOGGER.error("EVENT=RECONCILE_SIDE_MISMATCH symbol={} localSide={} exchangeSide={}", symbol,
							local.side(), remoteSide);
					continue;
				}
				BigDecimal remoteQuantity = exchangePosition.absoluteQuantity();
				if (remoteQuantity.compareTo(local.quantity()) != 0) {
					positions.put(symbol, local.withQuantity(remoteQuantity));
					corrected.add(symbol);
					LOGGER.warn("EVENT=RECONCILE_QTY_CORRECTED symbol={} localQty={} exchangeQty={}", symbol,
							local.quantity(), remoteQuantity);
				}
			}
			for (String symbol : remote.keySet()) {
				if (!trackedBefore.contains(symbol)) {
					untracked.add(symbol);
				}
			}
			if (!stale.isEmpty() || !sideMismatch.isEmpty() || !corrected.isEmpty()) {
				persist();
			}
		}
		untracked.forEach(symbol -> LOGGER.info("EVENT=RECONCILE_UNTRACKED_EXCHANGE_POSITION symbol={} qty={}",
				symbol, remote.get(symbol).positionAmt()));
		return new ReconciliationReport(List.copyOf(stale), List.copyOf(sideMismatch), List.copyOf(corrected),
				List.copyOf(untracked));
	}

	// Caller holds the lock.
	private void persist() {
		try {
			stateFile.write(new LinkedHashMap<>(positions));
		} catch (PositionPersistenceException ex) {
			LOGGER.error("EVENT=STATE_PERSIST_FAIL path={} reason={}", stateFile.path(), ex.getMessage());
		}
	}

	private static String normalize(String symbol) {
		return symbol.toUpperCase(Locale.ROOT);
	}
}
