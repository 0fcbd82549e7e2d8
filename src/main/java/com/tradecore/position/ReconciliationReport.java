package com.tradecore.position;

import java.util.ArrayList;
import java.util.List;

/**
 * What a reconciliation pass changed in the local store.
 *
 * @param staleDropped local positions the exchange no longer reports
 * @param sideMismatchDropped local positions whose side disagreed with the exchange
 * @param quantityCorrected local positions whose quantity was overwritten with the exchange's
 * @param untrackedOnExchange exchange positions this bot did not open; logged, never adopted
 */
public record ReconciliationReport(
		List<String> staleDropped,
		List<String> sideMismatchDropped,
		List<String> quantityCorrected,
		List<String> untrackedOnExchange) {

	public static ReconciliationReport empty() {
		return new ReconciliationReport(List.of(), List.of(), List.of(), List.of());
	}

	public List<String> droppedSymbols() {
		List<String> dropped = new ArrayList<>(staleDropped);
		dropped.addAll(sideMismatchDropped);
		return dropped;
	}

	public boolean hasChanges() {
		return !staleDropped.isEmpty() || !sideMismatchDropped.isEmpty() || !quantityCorrected.isEmpty();
	}
}
