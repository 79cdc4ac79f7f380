package my.portfoliorebalancer.app.api;

import jakarta.validation.Valid;
import my.portfoliorebalancer.app.dto.RebalanceRunRequestDto;
import my.portfoliorebalancer.app.dto.RebalanceRunResponseDto;
import my.portfoliorebalancer.app.dto.ValuationRequestDto;
import my.portfoliorebalancer.app.dto.ValuationResponseDto;
import my.portfoliorebalancer.app.service.RebalanceRunService;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/rebalancer")
public class RebalancerController {
	private final RebalanceRunService rebalanceRunService;

	public RebalancerController(RebalanceRunService rebalanceRunService) {
		this.rebalanceRunService = rebalanceRunService;
	}

	@PostMapping("/run")
	public RebalanceRunResponseDto run(@Valid @RequestBody RebalanceRunRequestDto request) {
		return rebalanceRunService.run(request);
	}

	@PostMapping("/valuation")
	public ValuationResponseDto valuation(@Valid @RequestBody ValuationRequestDto request) {
		return rebalanceRunService.valuation(request.holdings());
	}
}
