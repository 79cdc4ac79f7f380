package my.portfoliorebalancer.app.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

import java.util.List;

public record RebalanceRunRequestDto(
		@NotNull List<@Valid HoldingDto> holdings,
		@NotNull List<@Valid AllocationTargetDto> allocations
) {
}
