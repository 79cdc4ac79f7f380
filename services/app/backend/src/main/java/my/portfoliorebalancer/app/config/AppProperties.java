package my.portfoliorebalancer.app.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;

@Validated
@ConfigurationProperties(prefix = "app")
public record AppProperties(
		@Valid Security security,
		@Valid Rebalancer rebalancer
) {
	public record Security(
			@NotBlank String adminUser,
			@NotBlank String adminPass
	) {
	}

	public record Rebalancer(
			@DecimalMin("0") BigDecimal tolerance,
			@DecimalMin("0") BigDecimal allocationSumEpsilon,
			@Min(0) Integer shareScale
	) {
	}
}
