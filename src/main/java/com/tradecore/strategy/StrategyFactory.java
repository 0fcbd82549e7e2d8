package com.tradecore.strategy;

import com.tradecore.config.TradingProperties.StrategySlot;

/**
 * Builds strategies of one type from configured slots. Contribute implementations as Spring
 * beans; {@link #type()} is the value of {@code trading.strategies[].type}.
 */
public interface StrategyFactory {

	String type();

	Strategy create(StrategySlot slot);
}
