package com.tradecore.execution;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.function.IntSupplier;

import org.springframework.stereotype.Component;

/**
 * Symbols with an order operation in flight (entry, adjustment or close). Acquiring is an atomic
 * test-and-set, so two callers can never both own a symbol.
 * <p>
 * Entry claims also count toward the active-trade cap; the cap check and the claim happen under
 * the same lock.
 */
@Component
public class PendingSymbolTable {

	public enum EntryClaim {
		CLAIMED,
		SYMBOL_BUSY,
		AT_CAPACITY
	}

	private final Object lock = new Object();
	private final Set<String> pending = new HashSet<>();
	private final Set<String> entries = new HashSet<>();

	public boolean tryAcquire(String symbol) {
		synchronized (lock) {
			return pending.add(normalize(symbol));
		}
	}

	/**
	 * Claims the symbol for a new entry if it is free and {@code openPositions + entry claims}
	 * is below {@code maxActive}.
	 */
	public EntryClaim tryAcquireEntry(String symbol, IntSupplier openPositions, int maxActive) {
		String key = normalize(symbol);
		synchronized (lock) {
			if (pending.contains(key)) {
				return EntryClaim.SYMBOL_BUSY;
			}
			if (openPositions.getAsInt() + entries.size() >= maxActive) {
				return EntryClaim.AT_CAPACITY;
			}
			pending.add(key);
			entries.add(key);
			return EntryClaim.CLAIMED;
		}
	}

	public void release(String symbol) {
		String key = normalize(symbol);
		synchronized (lock) {
			pending.remove(key);
			entries.remove(key);
		}
	}

	public boolean isPending(String symbol) {
		synchronized (lock) {
			return pending.contains(normalize(symbol));
		}
	}

	private static String normalize(String symbol) {
		return symbol.toUpperCase(Locale.ROOT);
	}
}
