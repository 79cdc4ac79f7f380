package my.portfoliorebalancer.app.domain;

import java.math.BigDecimal;

/**
 * Suggested trade for one ticker. {@code amount} is the number of shares to transact.
 */
public record RebalanceAction(String ticker, RebalanceActionType action, BigDecimal amount) {
}
