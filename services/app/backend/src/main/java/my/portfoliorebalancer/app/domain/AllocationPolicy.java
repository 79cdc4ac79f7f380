package my.portfoliorebalancer.app.domain;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

public final class AllocationPolicy implements Iterable<AllocationTarget> {
	private static final Logger logger = LoggerFactory.getLogger(AllocationPolicy.class);
	public static final BigDecimal DEFAULT_SUM_EPSILON = new BigDecimal("0.001");

	private final List<AllocationTarget> targets;
	private final BigDecimal totalPercentage;
	private final String sumWarning;

	public AllocationPolicy(List<AllocationTarget> targets) {
		this(targets, DEFAULT_SUM_EPSILON);
	}

	public AllocationPolicy(List<AllocationTarget> targets, BigDecimal sumEpsilon) {
		if (targets == null) {
			throw new IllegalArgumentException("targets must not be null");
		}
		List<AllocationTarget> copy = new ArrayList<>(targets.size());
		BigDecimal total = BigDecimal.ZERO;
		for (AllocationTarget target : targets) {
			if (target == null) {
				throw new IllegalArgumentException("targets must not contain null entries");
			}
			copy.add(target);
			total = total.add(target.targetPercentage());
		}
		this.targets = List.copyOf(copy);
		this.totalPercentage = total;
		BigDecimal epsilon = sumEpsilon == null ? DEFAULT_SUM_EPSILON : sumEpsilon;
		logger.debug("Allocation policy with {} targets, total allocation {}", copy.size(), total.toPlainString());
		if (total.subtract(BigDecimal.ONE).abs().compareTo(epsilon) > 0) {
			this.sumWarning = "Total allocation is " + total.movePointRight(2).stripTrailingZeros().toPlainString()
					+ "%, not 100%";
			logger.warn("{} ({} targets)", sumWarning, copy.size());
		} else {
			this.sumWarning = null;
		}
	}

	public static AllocationPolicy of(AllocationTarget... targets) {
		return new AllocationPolicy(List.of(targets));
	}

	public List<AllocationTarget> targets() {
		return targets;
	}

	public BigDecimal totalPercentage() {
		return totalPercentage;
	}

	public Optional<String> sumWarning() {
		return Optional.ofNullable(sumWarning);
	}

	public int size() {
		return targets.size();
	}

	@Override
	public Iterator<AllocationTarget> iterator() {
		return targets.iterator();
	}

	@Override
	public String toString() {
		return "AllocationPolicy[targets=" + targets + ", totalPercentage=" + totalPercentage.toPlainString() + "]";
	}
}
