package my.portfoliorebalancer.app.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;

public record HoldingDto(
		@NotBlank String ticker,
		@NotNull @DecimalMin("0") BigDecimal shares,
		@DecimalMin("0") BigDecimal price
) {
}
