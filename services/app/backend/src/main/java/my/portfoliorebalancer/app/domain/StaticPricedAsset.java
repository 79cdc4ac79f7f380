package my.portfoliorebalancer.app.domain;

import java.math.BigDecimal;

public record StaticPricedAsset(String ticker, BigDecimal shares, BigDecimal price) implements PricedAsset {
	public StaticPricedAsset {
		ticker = Assets.requireTicker(ticker);
		shares = Assets.requireNonNegative(shares, "shares");
		price = Assets.requireNonNegative(price, "price");
	}

	@Override
	public BigDecimal currentPrice() {
		return price;
	}
}
