package com.stewel.mining;

import org.immutables.value.Value;

import java.util.OptionalLong;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * The thresholds of one mining run.
 * <p>
 * The minimum support is absolute, a number of transactions. {@link #withRelativeSupport}
 * derives it from a fraction of the database size.
 */
@Value.Immutable
public abstract class MiningParameters {

    public abstract long getMinimumSupport();

    /**
     * The minimum confidence of a rule. A value above 1 is accepted and yields no rules.
     */
    @Value.Default
    public double getMinimumConfidence() {
        return 0.0;
    }

    @Value.Default
    public double getMinimumLift() {
        return 0.0;
    }

    /**
     * The number of transactions mined; when present, rules carry their lift.
     */
    public abstract OptionalLong getDatabaseSize();

    @Value.Check
    protected void check() {
        checkArgument(getMinimumSupport() >= 1,
                "minimumSupport must be at least 1, got: %s", getMinimumSupport());
        checkArgument(!Double.isNaN(getMinimumConfidence()) && getMinimumConfidence() >= 0.0,
                "minimumConfidence must be a non-negative number, got: %s", getMinimumConfidence());
        checkArgument(!Double.isNaN(getMinimumLift()) && getMinimumLift() >= 0.0,
                "minimumLift must be a non-negative number, got: %s", getMinimumLift());
        checkArgument(!getDatabaseSize().isPresent() || getDatabaseSize().getAsLong() > 0,
                "databaseSize must be positive, got: %s", getDatabaseSize());
        checkArgument(getMinimumLift() == 0.0 || getDatabaseSize().isPresent(),
                "minimumLift requires the databaseSize");
    }

    public static ImmutableMiningParameters.Builder builder() {
        return ImmutableMiningParameters.builder();
    }

    public static MiningParameters withAbsoluteSupport(final long minimumSupport) {
        return builder().minimumSupport(minimumSupport).build();
    }

    /**
     * Creates parameters whose minimum support is the given fraction of the database,
     * rounded up and at least one transaction.
     *
     * @param databaseSize            the number of transactions
     * @param minimumRelativeSupport  the fraction, in (0, 1]
     * @return the parameters, the database size included
     */
    public static MiningParameters withRelativeSupport(final long databaseSize, final double minimumRelativeSupport) {
        checkArgument(databaseSize > 0, "databaseSize must be positive, got: %s", databaseSize);
        checkArgument(minimumRelativeSupport > 0.0 && minimumRelativeSupport <= 1.0,
                "minimumRelativeSupport must be in (0, 1], got: %s", minimumRelativeSupport);
        final long minimumSupport = Math.max(1L, (long) Math.ceil(databaseSize * minimumRelativeSupport));
        return builder()
                .minimumSupport(minimumSupport)
                .databaseSize(databaseSize)
                .build();
    }
}
