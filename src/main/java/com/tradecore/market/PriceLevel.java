package com.tradecore.market;

import java.math.BigDecimal;

public record PriceLevel(BigDecimal price, BigDecimal quantity) {
}
