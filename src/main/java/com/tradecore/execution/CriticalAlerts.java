package com.tradecore.execution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Operator-facing alerts for states that leave real exposure at risk. Routed to a separate
 * appender in {@code logback-spring.xml}.
 */
final class CriticalAlerts {

	static final String LOGGER_NAME = "com.tradecore.alerts";
	private static final Logger ALERTS = LoggerFactory.getLogger(LOGGER_NAME);

	private CriticalAlerts() {
	}

	static void raise(String event, String symbol, String detail, Throwable cause) {
		ALERTS.error("EVENT={} severity=CRITICAL symbol={} detail={} reason={}", event, symbol, detail,
				cause == null ? "NA" : cause.getMessage());
	}
}
