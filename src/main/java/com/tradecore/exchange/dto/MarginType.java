package com.tradecore.exchange.dto;

public enum MarginType {
	ISOLATED,
	CROSSED
}
