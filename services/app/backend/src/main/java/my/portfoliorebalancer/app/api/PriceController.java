package my.portfoliorebalancer.app.api;

import jakarta.validation.Valid;
import my.portfoliorebalancer.app.dto.PriceQuoteDto;
import my.portfoliorebalancer.app.dto.PriceUpdateRequest;
import my.portfoliorebalancer.app.pricing.InMemoryPriceSource;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Locale;

@RestController
@RequestMapping("/api/prices")
public class PriceController {
	private final InMemoryPriceSource priceSource;

	public PriceController(InMemoryPriceSource priceSource) {
		this.priceSource = priceSource;
	}

	@GetMapping
	public List<PriceQuoteDto> list() {
		return priceSource.snapshot().entrySet().stream()
				.map(entry -> new PriceQuoteDto(entry.getKey(), entry.getValue()))
				.toList();
	}

	@GetMapping("/{ticker}")
	public PriceQuoteDto get(@PathVariable("ticker") String ticker) {
		return priceSource.latestPrice(ticker)
				.map(price -> new PriceQuoteDto(normalize(ticker), price))
				.orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Price not found"));
	}

	@PutMapping("/{ticker}")
	public PriceQuoteDto update(@PathVariable("ticker") String ticker, @Valid @RequestBody PriceUpdateRequest request) {
		priceSource.updatePrice(ticker, request.price());
		return new PriceQuoteDto(normalize(ticker), request.price());
	}

	@DeleteMapping("/{ticker}")
	public ResponseEntity<Void> delete(@PathVariable("ticker") String ticker) {
		if (!priceSource.removePrice(ticker)) {
			throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Price not found");
		}
		return ResponseEntity.noContent().build();
	}

	private String normalize(String ticker) {
		return ticker.trim().toUpperCase(Locale.ROOT);
	}
}
