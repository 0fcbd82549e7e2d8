package com.tradecore.market;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

/**
 * Per-symbol "the book changed" notification. Emits the last applied update id. Consumers are
 * expected to keep only the latest value; missed ticks are not replayed.
 */
public class BookUpdateSignal {

	private final Sinks.Many<Long> sink = Sinks.many().multicast().directBestEffort();

	public synchronized void publish(long updateId) {
		sink.tryEmitNext(updateId);
	}

	public Flux<Long> updates() {
		return sink.asFlux();
	}
}
