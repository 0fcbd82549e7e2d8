package com.tradecore.strategy;

import com.tradecore.config.TradingProperties.StrategySlot;
import com.tradecore.exchange.dto.OrderType;

/**
 * Base class taking identity, symbol and entry settings from a configured slot.
 */
public abstract class SlotBoundStrategy implements Strategy {

	private final StrategySlot slot;

	protected SlotBoundStrategy(StrategySlot slot) {
		this.slot = slot;
	}

	@Override
	public String id() {
		return slot.id();
	}

	@Override
	public String symbol() {
		return slot.normalizedSymbol();
	}

	@Override
	public OrderType entryOrderType() {
		return slot.resolvedEntryOrderType();
	}

	@Override
	public int entryOffsetTicks() {
		return slot.entryOffsetTicks();
	}

	protected String parameter(String name, String defaultValue) {
		return slot.resolvedParameters().getOrDefault(name, defaultValue);
	}
}
