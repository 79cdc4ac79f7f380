package my.portfoliorebalancer.app.dto;

import java.math.BigDecimal;

public record PriceQuoteDto(String ticker, BigDecimal price) {
}
