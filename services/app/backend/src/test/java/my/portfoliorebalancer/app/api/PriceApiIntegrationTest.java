package my.portfoliorebalancer.app.api;

import my.portfoliorebalancer.app.pricing.InMemoryPriceSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.context.WebApplicationContext;

import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.httpBasic;
import static org.springframework.security.test.web.servlet.setup.SecurityMockMvcConfigurers.springSecurity;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(classes = my.portfoliorebalancer.app.AppApplication.class)
@ActiveProfiles("test")
class PriceApiIntegrationTest {
	private MockMvc mockMvc;

	@Autowired
	private WebApplicationContext context;

	@Autowired
	private InMemoryPriceSource priceSource;

	@BeforeEach
	void setUp() {
		mockMvc = MockMvcBuilders.webAppContextSetup(context)
				.apply(springSecurity())
				.build();
	}

	@AfterEach
	void tearDown() {
		priceSource.snapshot().keySet().forEach(priceSource::removePrice);
	}

	@Test
	void updateThenReadQuote() throws Exception {
		mockMvc.perform(put("/api/prices/meta")
						.with(httpBasic("admin", "admin"))
						.contentType(MediaType.APPLICATION_JSON)
						.content("{\"price\":301.25}"))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.ticker").value("META"))
				.andExpect(jsonPath("$.price").value(301.25));

		mockMvc.perform(get("/api/prices/META")
						.with(httpBasic("admin", "admin")))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.price").value(301.25));

		mockMvc.perform(get("/api/prices")
						.with(httpBasic("admin", "admin")))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$[0].ticker").value("META"));
	}

	@Test
	void unknownQuoteIsNotFound() throws Exception {
		mockMvc.perform(get("/api/prices/NVDA")
						.with(httpBasic("admin", "admin")))
				.andExpect(status().isNotFound());

		mockMvc.perform(delete("/api/prices/NVDA")
						.with(httpBasic("admin", "admin")))
				.andExpect(status().isNotFound());
	}

	@Test
	void deleteRemovesQuote() throws Exception {
		mockMvc.perform(put("/api/prices/APPL")
						.with(httpBasic("admin", "admin"))
						.contentType(MediaType.APPLICATION_JSON)
						.content("{\"price\":200}"))
				.andExpect(status().isOk());

		mockMvc.perform(delete("/api/prices/APPL")
						.with(httpBasic("admin", "admin")))
				.andExpect(status().isNoContent());

		mockMvc.perform(get("/api/prices/APPL")
						.with(httpBasic("admin", "admin")))
				.andExpect(status().isNotFound());
	}

	@Test
	void negativePriceIsRejected() throws Exception {
		mockMvc.perform(put("/api/prices/APPL")
						.with(httpBasic("admin", "admin"))
						.contentType(MediaType.APPLICATION_JSON)
						.content("{\"price\":-5}"))
				.andExpect(status().isBadRequest());
	}

	@Test
	void wrongCredentialsAreRejected() throws Exception {
		mockMvc.perform(get("/api/prices")
						.with(httpBasic("admin", "wrong")))
				.andExpect(status().isUnauthorized());
	}
}
