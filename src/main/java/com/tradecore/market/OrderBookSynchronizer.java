package com.tradecore.market;

import java.math.BigDecimal;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tradecore.market.dto.DepthUpdateEvent;
import com.tradecore.market.dto.OrderBookDepthResponse;

/**
 * Keeps a {@link LocalOrderBook} consistent with the exchange from a REST snapshot plus the
 * sequenced diff stream.
 * <p>
 * Diffs that arrive before the book is synced are held in a bounded buffer. When a snapshot
 * lands, buffered diffs already covered by it are discarded and the rest are replayed. Once
 * synced, every diff must continue the sequence: with a {@code pu} field it must equal the last
 * applied id, without one its first id must not skip past {@code lastApplied + 1}. A gap, a
 * crossed book or a buffer overflow drops the book back to uninitialized and asks for a new
 * snapshot.
 * <p>
 * The synchronizer never performs I/O; callers react to the returned outcome. All methods are
 * synchronized so the stream thread and the snapshot callback can share one instance.
 */
public class OrderBookSynchronizer {

	private static final Logger LOGGER = LoggerFactory.getLogger(OrderBookSynchronizer.class);

	private final String symbol;
	private final int bufferCapacity;
	private final boolean sequenceGapCheck;
	private final LocalOrderBook orderBook = new LocalOrderBook();
	private final Deque<DepthUpdateEvent> buffer = new ArrayDeque<>();

	private SyncState state = SyncState.UNINITIALIZED;
	private boolean awaitingFirstDiffAfterSnapshot;
	private int resyncCount;

	public OrderBookSynchronizer(String symbol, int bufferCapacity, boolean sequenceGapCheck) {
		if (bufferCapacity <= 0) {
			throw new IllegalArgumentException("bufferCapacity must be positive");
		}
		this.symbol = symbol;
		this.bufferCapacity = bufferCapacity;
		this.sequenceGapCheck = sequenceGapCheck;
	}

	public String symbol() {
		return symbol;
	}

	public synchronized DiffOutcome applyDiff(DepthUpdateEvent event) {
		if (state != SyncState.SYNCED) {
			return bufferDiff(event);
		}
		long lastApplied = orderBook.lastUpdateId();
		if (event.finalUpdateId() <= lastApplied) {
			return DiffOutcome.IGNORED_STALE;
		}
		if (sequenceGapCheck && isGap(event, lastApplied, awaitingFirstDiffAfterSnapshot)) {
			resync("SEQUENCE_GAP lastApplied=" + lastApplied + " U=" + event.firstUpdateId()
					+ " pu=" + event.previousFinalUpdateId());
			buffer.addLast(event);
			return DiffOutcome.RESYNC_REQUIRED;
		}
		orderBook.applyDepthUpdate(event);
		awaitingFirstDiffAfterSnapshot = false;
		if (orderBook.isCrossed()) {
			resync("CROSSED_BOOK bestBid=" + orderBook.bestBid().orElse(null)
					+ " bestAsk=" + orderBook.bestAsk().orElse(null));
			return DiffOutcome.RESYNC_REQUIRED;
		}
		return DiffOutcome.APPLIED;
	}

	public synchronized SnapshotOutcome applySnapshot(OrderBookDepthResponse snapshot) {
		long snapshotId = snapshot.lastUpdateId();
		DepthUpdateEvent firstBuffered = buffer.peekFirst();
		if (sequenceGapCheck && firstBuffered != null && firstBuffered.firstUpdateId() > snapshotId + 1) {
			LOGGER.info("EVENT=DEPTH_SNAPSHOT_STALE symbol={} snapshotId={} firstBufferedU={}",
					symbol, snapshotId, firstBuffered.firstUpdateId());
			state = SyncState.BUFFERING;
			return SnapshotOutcome.STALE_SNAPSHOT;
		}

		orderBook.applySnapshot(snapshot);
		awaitingFirstDiffAfterSnapshot = true;
		int replayed = 0;
		while (!buffer.isEmpty()) {
			DepthUpdateEvent event = buffer.peekFirst();
			long lastApplied = orderBook.lastUpdateId();
			if (event.finalUpdateId() <= lastApplied) {
				buffer.pollFirst();
				continue;
			}
			if (sequenceGapCheck && isGap(event, lastApplied, awaitingFirstDiffAfterSnapshot)) {
				LOGGER.warn("EVENT=DEPTH_REPLAY_GAP symbol={} lastApplied={} U={} pu={}",
						symbol, lastApplied, event.firstUpdateId(), event.previousFinalUpdateId());
				orderBook.reset();
				state = SyncState.BUFFERING;
				return SnapshotOutcome.GAP_IN_BUFFER;
			}
			orderBook.applyDepthUpdate(buffer.pollFirst());
			awaitingFirstDiffAfterSnapshot = false;
			replayed++;
		}

		if (orderBook.isCrossed()) {
			resync("CROSSED_BOOK_AFTER_SNAPSHOT snapshotId=" + snapshotId);
			return SnapshotOutcome.GAP_IN_BUFFER;
		}
		state = SyncState.SYNCED;
		LOGGER.info("EVENT=DEPTH_SYNCED symbol={} snapshotId={} replayed={} lastUpdateId={} resyncCount={}",
				symbol, snapshotId, replayed, orderBook.lastUpdateId(), resyncCount);
		return SnapshotOutcome.SYNCED;
	}

	public synchronized SyncState state() {
		return state;
	}

	public synchronized boolean isSynced() {
		return state == SyncState.SYNCED;
	}

	public synchronized int bufferedCount() {
		return buffer.size();
	}

	public synchronized int resyncCount() {
		return resyncCount;
	}

	public synchronized long lastUpdateId() {
		return orderBook.lastUpdateId();
	}

	/**
	 * Best bid of the synced book; empty while the book is not synced or the side is empty.
	 */
	public synchronized Optional<BigDecimal> getBestBid() {
		return state == SyncState.SYNCED ? orderBook.bestBid() : Optional.empty();
	}

	public synchronized Optional<BigDecimal> getBestAsk() {
		return state == SyncState.SYNCED ? orderBook.bestAsk() : Optional.empty();
	}

	public synchronized Optional<BigDecimal> getBidQuantity(BigDecimal price) {
		return state == SyncState.SYNCED ? orderBook.bidQuantity(price) : Optional.empty();
	}

	public synchronized Optional<BigDecimal> getAskQuantity(BigDecimal price) {
		return state == SyncState.SYNCED ? orderBook.askQuantity(price) : Optional.empty();
	}

	/**
	 * Copy of the top {@code levels} of each side, or empty while not synced.
	 */
	public synchronized Optional<OrderBookView> getDepth(int levels) {
		if (state != SyncState.SYNCED) {
			return Optional.empty();
		}
		return Optional.of(orderBook.view(symbol, levels));
	}

	/**
	 * Drops the book and the buffer; the next diff starts a fresh sync.
	 */
	public synchronized void reset() {
		orderBook.reset();
		buffer.clear();
		state = SyncState.UNINITIALIZED;
		awaitingFirstDiffAfterSnapshot = false;
	}

	private DiffOutcome bufferDiff(DepthUpdateEvent event) {
		if (buffer.size() >= bufferCapacity) {
			LOGGER.warn("EVENT=DEPTH_BUFFER_OVERFLOW symbol={} capacity={}", symbol, bufferCapacity);
			buffer.clear();
			buffer.addLast(event);
			state = SyncState.UNINITIALIZED;
			resyncCount++;
			return DiffOutcome.RESYNC_REQUIRED;
		}
		buffer.addLast(event);
		if (state == SyncState.UNINITIALIZED) {
			state = SyncState.BUFFERING;
			return DiffOutcome.SNAPSHOT_REQUIRED;
		}
		return DiffOutcome.BUFFERED;
	}

	private void resync(String reason) {
		resyncCount++;
		LOGGER.warn("EVENT=DEPTH_RESYNC symbol={} reason={} resyncCount={}", symbol, reason, resyncCount);
		orderBook.reset();
		buffer.clear();
		state = SyncState.UNINITIALIZED;
		awaitingFirstDiffAfterSnapshot = false;
	}

	// The first diff after a snapshot may straddle the snapshot id, so only its start is checked.
	static boolean isGap(DepthUpdateEvent event, long lastApplied, boolean firstAfterSnapshot) {
		if (!firstAfterSnapshot && event.hasPreviousFinalUpdateId()) {
			return event.previousFinalUpdateId() != lastApplied;
		}
		return event.firstUpdateId() > lastApplied + 1;
	}
}
