package my.portfoliorebalancer.app.domain;

import java.math.BigDecimal;

public record AllocationTarget(String ticker, BigDecimal targetPercentage) {
	public AllocationTarget {
		ticker = Assets.requireTicker(ticker);
		if (targetPercentage == null) {
			throw new IllegalArgumentException("targetPercentage must not be null");
		}
		if (targetPercentage.signum() < 0 || targetPercentage.compareTo(BigDecimal.ONE) > 0) {
			throw new IllegalArgumentException("targetPercentage must be within [0, 1]: " + targetPercentage.toPlainString());
		}
	}
}
