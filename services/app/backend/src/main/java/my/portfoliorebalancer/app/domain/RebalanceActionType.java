package my.portfoliorebalancer.app.domain;

public enum RebalanceActionType {
	BUY,
	SELL
}
