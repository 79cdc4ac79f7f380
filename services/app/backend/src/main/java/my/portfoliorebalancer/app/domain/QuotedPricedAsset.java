package my.portfoliorebalancer.app.domain;

import my.portfoliorebalancer.app.pricing.PriceSource;
import my.portfoliorebalancer.app.pricing.PriceUnavailableException;

import java.math.BigDecimal;
import java.util.Objects;

public final class QuotedPricedAsset implements PricedAsset {
	private final String ticker;
	private final BigDecimal shares;
	private final PriceSource priceSource;

	public QuotedPricedAsset(String ticker, BigDecimal shares, PriceSource priceSource) {
		this.ticker = Assets.requireTicker(ticker);
		this.shares = Assets.requireNonNegative(shares, "shares");
		this.priceSource = Objects.requireNonNull(priceSource, "priceSource");
	}

	@Override
	public String ticker() {
		return ticker;
	}

	@Override
	public BigDecimal shares() {
		return shares;
	}

	@Override
	public BigDecimal currentPrice() {
		BigDecimal price = priceSource.latestPrice(ticker)
				.orElseThrow(() -> new PriceUnavailableException(ticker));
		if (price.signum() < 0) {
			throw new PriceUnavailableException(ticker, "negative quote " + price.toPlainString());
		}
		return price;
	}

	@Override
	public String toString() {
		return "QuotedPricedAsset[ticker=" + ticker + ", shares=" + shares.toPlainString() + "]";
	}
}
