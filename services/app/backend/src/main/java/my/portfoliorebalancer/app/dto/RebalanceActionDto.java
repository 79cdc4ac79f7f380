package my.portfoliorebalancer.app.dto;

import my.portfoliorebalancer.app.domain.RebalanceActionType;

import java.math.BigDecimal;

public record RebalanceActionDto(String ticker, RebalanceActionType action, BigDecimal amount) {
}
