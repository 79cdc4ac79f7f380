package my.portfoliorebalancer.app.dto;

import java.math.BigDecimal;
import java.util.List;

public record ValuationResponseDto(BigDecimal totalValue, List<HoldingValuationDto> holdings) {
}
