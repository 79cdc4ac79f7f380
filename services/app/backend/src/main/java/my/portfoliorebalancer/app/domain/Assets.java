package my.portfoliorebalancer.app.domain;

import java.math.BigDecimal;

final class Assets {
	private Assets() {
	}

	static String requireTicker(String ticker) {
		if (ticker == null || ticker.isBlank()) {
			throw new IllegalArgumentException("Ticker must not be blank");
		}
		return ticker.trim();
	}

	static BigDecimal requireNonNegative(BigDecimal value, String field) {
		if (value == null) {
			throw new IllegalArgumentException(field + " must not be null");
		}
		if (value.signum() < 0) {
			throw new IllegalArgumentException(field + " must not be negative: " + value.toPlainString());
		}
		return value;
	}
}
