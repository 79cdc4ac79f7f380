package my.portfoliorebalancer.app.domain;

import java.math.BigDecimal;

public interface PricedAsset {
	String ticker();

	BigDecimal shares();

	BigDecimal currentPrice();

	default BigDecimal currentValue() {
		return shares().multiply(currentPrice());
	}

	default StaticPricedAsset snapshot() {
		return new StaticPricedAsset(ticker(), shares(), currentPrice());
	}
}
