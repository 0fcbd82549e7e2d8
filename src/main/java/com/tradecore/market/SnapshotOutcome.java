package com.tradecore.market;

public enum SnapshotOutcome {
	SYNCED,
	/** Snapshot predates the buffered diffs; a newer one is needed. */
	STALE_SNAPSHOT,
	/** Buffered diffs have a hole after the snapshot; a newer one is needed. */
	GAP_IN_BUFFER
}
