package com.tradecore.execution;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import org.springframework.stereotype.Component;

/**
 * Outstanding entry orders, keyed by client order id, at most one per symbol.
 */
@Component
public class PendingEntryBook {

	private final Object lock = new Object();
	private final Map<String, PendingEntry> byClientOrderId = new HashMap<>();
	private final Map<String, String> clientOrderIdBySymbol = new HashMap<>();

	/**
	 * @throws IllegalStateException when the symbol already has a pending entry
	 */
	public void add(PendingEntry entry) {
		String symbol = normalize(entry.symbol());
		synchronized (lock) {
			String existing = clientOrderIdBySymbol.get(symbol);
			if (existing != null) {
				throw new IllegalStateException("Pending entry already exists for " + symbol + ": " + existing);
			}
			byClientOrderId.put(entry.clientOrderId(), entry);
			clientOrderIdBySymbol.put(symbol, entry.clientOrderId());
		}
	}

	public Optional<PendingEntry> findByClientOrderId(String clientOrderId) {
		if (clientOrderId == null) {
			return Optional.empty();
		}
		synchronized (lock) {
			return Optional.ofNullable(byClientOrderId.get(clientOrderId));
		}
	}

	public Optional<PendingEntry> findBySymbol(String symbol) {
		synchronized (lock) {
			String clientOrderId = clientOrderIdBySymbol.get(normalize(symbol));
			return Optional.ofNullable(clientOrderId == null ? null : byClientOrderId.get(clientOrderId));
		}
	}

	public void attachOrderId(String clientOrderId, Long orderId) {
		synchronized (lock) {
			byClientOrderId.computeIfPresent(clientOrderId, (key, entry) -> entry.withOrderId(orderId));
		}
	}

	/**
	 * Flags the entry as being cancelled; returns false if it already was or is gone.
	 */
	public boolean markCancelRequested(String clientOrderId) {
		synchronized (lock) {
			PendingEntry entry = byClientOrderId.get(clientOrderId);
			if (entry == null || entry.cancelRequested()) {
				return false;
			}
			byClientOrderId.put(clientOrderId, entry.withCancelRequested(true));
			return true;
		}
	}

	/**
	 * Undoes {@link #markCancelRequested} so the next expiry sweep tries again.
	 */
	public void clearCancelRequested(String clientOrderId) {
		synchronized (lock) {
			byClientOrderId.computeIfPresent(clientOrderId, (key, entry) -> entry.withCancelRequested(false));
		}
	}

	/**
	 * Removes the entry; only the first caller for a given id gets it back.
	 */
	public Optional<PendingEntry> remove(String clientOrderId) {
		synchronized (lock) {
			PendingEntry removed = byClientOrderId.remove(clientOrderId);
			if (removed != null) {
				clientOrderIdBySymbol.remove(normalize(removed.symbol()), clientOrderId);
			}
			return Optional.ofNullable(removed);
		}
	}

	public List<PendingEntry> olderThan(long cutoff) {
		synchronized (lock) {
			return byClientOrderId.values().stream()
					.filter(entry -> entry.createdAt() < cutoff)
					.toList();
		}
	}

	public int size() {
		synchronized (lock) {
			return byClientOrderId.size();
		}
	}

	private static String normalize(String symbol) {
		return symbol.toUpperCase(Locale.ROOT);
	}
}
