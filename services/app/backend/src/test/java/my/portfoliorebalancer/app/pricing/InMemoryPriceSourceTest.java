package my.portfoliorebalancer.app.pricing;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryPriceSourceTest {
	private final InMemoryPriceSource priceSource = new InMemoryPriceSource();

	@Test
	void returnsLatestPriceIgnoringCase() {
		priceSource.updatePrice("meta", new BigDecimal("300"));
		priceSource.updatePrice("META", new BigDecimal("310"));

		assertThat(priceSource.latestPrice(" Meta ")).contains(new BigDecimal("310"));
		assertThat(priceSource.snapshot()).containsOnlyKeys("META");
	}

	@Test
	void missingTickerIsEmpty() {
		assertThat(priceSource.latestPrice("NVDA")).isEmpty();
		assertThat(priceSource.latestPrice(null)).isEmpty();
	}

	@Test
	void removePriceReportsWhetherQuoteExisted() {
		priceSource.updatePrice("APPL", new BigDecimal("200"));

		assertThat(priceSource.removePrice("appl")).isTrue();
		assertThat(priceSource.removePrice("appl")).isFalse();
		assertThat(priceSource.latestPrice("APPL")).isEmpty();
	}

	@Test
	void rejectsNegativePrice() {
		assertThatThrownBy(() -> priceSource.updatePrice("APPL", new BigDecimal("-1")))
				.isInstanceOf(IllegalArgumentException.class);
	}
}
