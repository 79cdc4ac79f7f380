package my.portfoliorebalancer.app.service;

import my.portfoliorebalancer.app.config.AppProperties;
import my.portfoliorebalancer.app.domain.AllocationPolicy;
import my.portfoliorebalancer.app.domain.AllocationTarget;
import my.portfoliorebalancer.app.domain.PricedAsset;
import my.portfoliorebalancer.app.domain.QuotedPricedAsset;
import my.portfoliorebalancer.app.domain.RebalanceAction;
import my.portfoliorebalancer.app.domain.StaticPricedAsset;
import my.portfoliorebalancer.app.dto.AllocationTargetDto;
import my.portfoliorebalancer.app.dto.HoldingDto;
import my.portfoliorebalancer.app.dto.HoldingValuationDto;
import my.portfoliorebalancer.app.dto.RebalanceActionDto;
import my.portfoliorebalancer.app.dto.RebalanceRunRequestDto;
import my.portfoliorebalancer.app.dto.RebalanceRunResponseDto;
import my.portfoliorebalancer.app.dto.ValuationResponseDto;
import my.portfoliorebalancer.app.pricing.PriceSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

@Service
public class RebalanceRunService {
	private static final Logger logger = LoggerFactory.getLogger(RebalanceRunService.class);

	private final PortfolioRebalancer rebalancer;
	private final PriceSource priceSource;
	private final BigDecimal allocationSumEpsilon;

	public RebalanceRunService(PortfolioRebalancer rebalancer, PriceSource priceSource, AppProperties properties) {
		this.rebalancer = rebalancer;
		this.priceSource = priceSource;
		this.allocationSumEpsilon = resolveEpsilon(properties);
	}

	public RebalanceRunResponseDto run(RebalanceRunRequestDto request) {
		if (request == null) {
			throw new IllegalArgumentException("Rebalance request is required");
		}
		List<StaticPricedAsset> holdings = toHoldings(request.holdings());
		AllocationPolicy policy = toPolicy(request.allocations());
		List<RebalanceAction> actions = rebalancer.rebalance(holdings, policy);

		List<String> warnings = new ArrayList<>();
		policy.sumWarning().ifPresent(warnings::add);
		List<RebalanceActionDto> actionDtos = actions.stream()
				.map(action -> new RebalanceActionDto(action.ticker(), action.action(), action.amount()))
				.toList();
		return new RebalanceRunResponseDto(
				rebalancer.totalValue(holdings),
				toValuations(holdings),
				actionDtos,
				List.copyOf(warnings),
				actionDtos.isEmpty()
		);
	}

	public ValuationResponseDto valuation(List<HoldingDto> holdingDtos) {
		List<StaticPricedAsset> holdings = toHoldings(holdingDtos);
		return new ValuationResponseDto(rebalancer.totalValue(holdings), toValuations(holdings));
	}

	AllocationPolicy toPolicy(List<AllocationTargetDto> allocations) {
		if (allocations == null) {
			throw new IllegalArgumentException("Allocations are required");
		}
		List<AllocationTarget> targets = new ArrayList<>(allocations.size());
		for (AllocationTargetDto dto : allocations) {
			if (dto == null) {
				throw new IllegalArgumentException("Allocation entries must not be null");
			}
			targets.add(new AllocationTarget(dto.ticker(), dto.targetPercentage()));
		}
		return new AllocationPolicy(targets, allocationSumEpsilon);
	}

	List<StaticPricedAsset> toHoldings(List<HoldingDto> holdings) {
		if (holdings == null) {
			throw new IllegalArgumentException("Holdings are required");
		}
		List<StaticPricedAsset> result = new ArrayList<>(holdings.size());
		for (HoldingDto dto : holdings) {
			if (dto == null) {
				throw new IllegalArgumentException("Holding entries must not be null");
			}
			result.add(toAsset(dto).snapshot());
		}
		return result;
	}

	private PricedAsset toAsset(HoldingDto dto) {
		if (dto.price() != null) {
			return new StaticPricedAsset(dto.ticker(), dto.shares(), dto.price());
		}
		logger.debug("No price supplied for {}, using quote store", dto.ticker());
		return new QuotedPricedAsset(dto.ticker(), dto.shares(), priceSource);
	}

	private List<HoldingValuationDto> toValuations(List<StaticPricedAsset> holdings) {
		return holdings.stream()
				.map(asset -> new HoldingValuationDto(asset.ticker(), asset.shares(), asset.price(), asset.currentValue()))
				.toList();
	}

	private static BigDecimal resolveEpsilon(AppProperties properties) {
		if (properties == null || properties.rebalancer() == null
				|| properties.rebalancer().allocationSumEpsilon() == null) {
			return AllocationPolicy.DEFAULT_SUM_EPSILON;
		}
		return properties.rebalancer().allocationSumEpsilon();
	}
}
