package my.portfoliorebalancer.app.pricing;

import java.math.BigDecimal;
import java.util.Optional;

public interface PriceSource {
	Optional<BigDecimal> latestPrice(String ticker);
}
