package com.tradecore.market.dto;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Diff-depth stream event. {@code previousFinalUpdateId} ({@code pu}) is only sent by the
 * futures stream; it is {@code 0} when absent.
 */
public record DepthUpdateEvent(
		@JsonProperty("E") long eventTime,
		@JsonProperty("s") String symbol,
		@JsonProperty("U") long firstUpdateId,
		@JsonProperty("u") long finalUpdateId,
		@JsonProperty("pu") long previousFinalUpdateId,
		@JsonProperty("b") List<List<String>> bids,
		@JsonProperty("a") List<List<String>> asks) {

	public boolean hasPreviousFinalUpdateId() {
		return previousFinalUpdateId > 0;
	}
}
