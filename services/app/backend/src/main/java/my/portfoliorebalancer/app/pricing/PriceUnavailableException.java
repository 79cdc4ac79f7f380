package my.portfoliorebalancer.app.pricing;

public class PriceUnavailableException extends RuntimeException {
	private final String ticker;

	public PriceUnavailableException(String ticker) {
		super("No price available for " + ticker);
		this.ticker = ticker;
	}

	public PriceUnavailableException(String ticker, String reason) {
		super("No price available for " + ticker + ": " + reason);
		this.ticker = ticker;
	}

	public String getTicker() {
		return ticker;
	}
}
