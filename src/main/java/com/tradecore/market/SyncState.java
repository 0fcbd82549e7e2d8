package com.tradecore.market;

public enum SyncState {
	/** No usable book; the next diff asks for a snapshot. */
	UNINITIALIZED,
	/** Snapshot requested; diffs are held in the pre-sync buffer. */
	BUFFERING,
	SYNCED
}
