package com.tradecore.position;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradecore.config.TradingProperties;

@Configuration
public class PositionStoreConfig {

	@Bean
	public PositionStateFile positionStateFile(TradingProperties tradingProperties, ObjectMapper objectMapper) {
		return new PositionStateFile(tradingProperties.stateFile(), objectMapper);
	}

	@Bean
	public PositionStore positionStore(PositionStateFile positionStateFile) {
		return new PositionStore(positionStateFile);
	}
}
