package com.tradecore.market;

public enum DiffOutcome {
	APPLIED,
	BUFFERED,
	IGNORED_STALE,
	/** First diff seen while uninitialized; a snapshot must be fetched. */
	SNAPSHOT_REQUIRED,
	/** Sequence gap, crossed book or buffer overflow; the book was dropped and needs a fresh snapshot. */
	RESYNC_REQUIRED;

	public boolean requiresSnapshot() {
		return this == SNAPSHOT_REQUIRED || this == RESYNC_REQUIRED;
	}
}
