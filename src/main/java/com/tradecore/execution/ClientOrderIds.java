package com.tradecore.execution;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Client order ids of the form {@code tc_<tag>_<millis36>_<seq36>}, unique per process and
 * well under the exchange's 36 character limit.
 */
public final class ClientOrderIds {

	public static final String PREFIX = "tc_";
	private static final AtomicLong SEQUENCE = new AtomicLong();

	private ClientOrderIds() {
	}

	public static String next(String tag) {
		return PREFIX + tag + "_" + Long.toString(System.currentTimeMillis(), 36)
				+ "_" + Long.toString(SEQUENCE.incrementAndGet(), 36);
	}
}
