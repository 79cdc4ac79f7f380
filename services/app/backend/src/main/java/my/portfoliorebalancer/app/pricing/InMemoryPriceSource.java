package my.portfoliorebalancer.app.pricing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class InMemoryPriceSource implements PriceSource {
	private static final Logger logger = LoggerFactory.getLogger(InMemoryPriceSource.class);

	private final Map<String, BigDecimal> prices = new ConcurrentHashMap<>();

	@Override
	public Optional<BigDecimal> latestPrice(String ticker) {
		String key = normalize(ticker);
		if (key == null) {
			return Optional.empty();
		}
		return Optional.ofNullable(prices.get(key));
	}

	public void updatePrice(String ticker, BigDecimal price) {
		String key = normalize(ticker);
		if (key == null) {
			throw new IllegalArgumentException("Ticker must not be blank");
		}
		if (price == null || price.signum() < 0) {
			throw new IllegalArgumentException("Price must be a non-negative number");
		}
		BigDecimal previous = prices.put(key, price);
		logger.debug("Price for {} updated from {} to {}", key, previous, price.toPlainString());
	}

	public boolean removePrice(String ticker) {
		String key = normalize(ticker);
		return key != null && prices.remove(key) != null;
	}

	public Map<String, BigDecimal> snapshot() {
		return new TreeMap<>(prices);
	}

	private String normalize(String ticker) {
		if (ticker == null || ticker.isBlank()) {
			return null;
		}
		return ticker.trim().toUpperCase(Locale.ROOT);
	}
}
