package my.portfoliorebalancer.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.List;

public record RebalanceRunResponseDto(
		@JsonProperty("totalValue") BigDecimal totalValue,
		@JsonProperty("holdings") List<HoldingValuationDto> holdings,
		@JsonProperty("actions") List<RebalanceActionDto> actions,
		@JsonProperty("warnings") List<String> warnings,
		@JsonProperty("balanced") boolean balanced
) {
}
