package my.portfoliorebalancer.app.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;

public record AllocationTargetDto(
		@NotBlank String ticker,
		@NotNull @DecimalMin("0") @DecimalMax("1") BigDecimal targetPercentage
) {
}
