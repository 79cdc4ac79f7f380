package my.portfoliorebalancer.app.dto;

import java.math.BigDecimal;

public record HoldingValuationDto(String ticker, BigDecimal shares, BigDecimal price, BigDecimal currentValue) {
}
