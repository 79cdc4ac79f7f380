package my.portfoliorebalancer.app.service;

import my.portfoliorebalancer.app.config.AppProperties;
import my.portfoliorebalancer.app.domain.AllocationPolicy;
import my.portfoliorebalancer.app.domain.AllocationTarget;
import my.portfoliorebalancer.app.domain.PricedAsset;
import my.portfoliorebalancer.app.domain.RebalanceAction;
import my.portfoliorebalancer.app.domain.RebalanceActionType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

@Service
public class PortfolioRebalancer {
	private static final Logger logger = LoggerFactory.getLogger(PortfolioRebalancer.class);
	public static final BigDecimal DEFAULT_TOLERANCE = new BigDecimal("0.01");
	public static final int DEFAULT_SHARE_SCALE = 8;

	private final BigDecimal tolerance;
	private final int shareScale;

	@Autowired
	public PortfolioRebalancer(AppProperties properties) {
		this(resolveTolerance(properties), resolveShareScale(properties));
	}

	public PortfolioRebalancer(BigDecimal tolerance, int shareScale) {
		if (tolerance == null || tolerance.signum() < 0) {
			throw new IllegalArgumentException("tolerance must be a non-negative amount");
		}
		if (shareScale < 0) {
			throw new IllegalArgumentException("shareScale must not be negative");
		}
		this.tolerance = tolerance;
		this.shareScale = shareScale;
	}

	public PortfolioRebalancer() {
		this(DEFAULT_TOLERANCE, DEFAULT_SHARE_SCALE);
	}

	public List<RebalanceAction> rebalance(List<? extends PricedAsset> holdings, AllocationPolicy policy) {
		List<? extends PricedAsset> safeHoldings = holdings == null ? List.of() : holdings;
		if (policy == null || policy.size() == 0) {
			return List.of();
		}
		BigDecimal totalValue = totalValue(safeHoldings);
		List<RebalanceAction> actions = new ArrayList<>();
		// off-policy holdings count toward the total but never get an action
		for (AllocationTarget target : policy) {
			BigDecimal targetValue = totalValue.multiply(target.targetPercentage());
			PricedAsset holding = findHolding(safeHoldings, target.ticker());
			BigDecimal currentValue = holding == null ? BigDecimal.ZERO : holding.currentValue();
			BigDecimal difference = targetValue.subtract(currentValue);
			if (holding == null || difference.abs().compareTo(tolerance) <= 0) {
				logger.debug("No action for {} (held={}, difference={})",
						target.ticker(), holding != null, difference.toPlainString());
				continue;
			}
			BigDecimal price = holding.currentPrice();
			if (price.signum() == 0) {
				logger.warn("Skipping {}: price is zero, share amount for difference {} is undefined",
						target.ticker(), difference.toPlainString());
				continue;
			}
			RebalanceActionType type = difference.signum() > 0 ? RebalanceActionType.BUY : RebalanceActionType.SELL;
			BigDecimal shares = difference.abs().divide(price, shareScale, RoundingMode.HALF_UP);
			if (shares.signum() == 0) {
				logger.debug("No action for {}: difference {} rounds to zero shares at scale {}",
						target.ticker(), difference.toPlainString(), shareScale);
				continue;
			}
			actions.add(new RebalanceAction(target.ticker(), type, shares));
		}
		logger.info("Rebalanced {} holdings against {} targets: total value {}, {} actions",
				safeHoldings.size(), policy.size(), totalValue.toPlainString(), actions.size());
		return List.copyOf(actions);
	}

	public BigDecimal totalValue(List<? extends PricedAsset> holdings) {
		if (holdings == null || holdings.isEmpty()) {
			return BigDecimal.ZERO;
		}
		BigDecimal total = BigDecimal.ZERO;
		for (PricedAsset holding : holdings) {
			total = total.add(holding.shares().multiply(holding.currentPrice()));
		}
		return total;
	}

	public BigDecimal tolerance() {
		return tolerance;
	}

	private PricedAsset findHolding(List<? extends PricedAsset> holdings, String ticker) {
		for (PricedAsset holding : holdings) {
			if (holding.ticker().equals(ticker)) {
				return holding;
			}
		}
		return null;
	}

	private static BigDecimal resolveTolerance(AppProperties properties) {
		if (properties == null || properties.rebalancer() == null || properties.rebalancer().tolerance() == null) {
			return DEFAULT_TOLERANCE;
		}
		return properties.rebalancer().tolerance();
	}

	private static int resolveShareScale(AppProperties properties) {
		if (properties == null || properties.rebalancer() == null || properties.rebalancer().shareScale() == null) {
			return DEFAULT_SHARE_SCALE;
		}
		return properties.rebalancer().shareScale();
	}
}
