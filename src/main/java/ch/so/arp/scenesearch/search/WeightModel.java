package ch.so.arp.scenesearch.search;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Operations on {@link WeightVector}s that keep the channel weights summing up
 * to one.
 * <p>
 * All operations are side effect free: the given vector is never modified and
 * a new vector is returned. Every mutator returns a normalized vector as long
 * as at least one unlocked channel exists, even though intermediate values may
 * transiently violate the invariant. Instances hold no state and can be shared
 * between concurrent requests.
 */
public class WeightModel {

    /** Tolerance used when comparing the sum of the weights with one. */
    public static final double EPSILON = 1e-6d;

    /**
     * Builds a vector from configured channel values and rejects configurations
     * that would silently zero out search quality.
     *
     * @param values channel name to weight, iterated in the desired channel order
     * @return the unlocked, not yet normalized vector
     * @throws InvalidWeightsException if there are no channels, a value is out
     *                                 of range or no value is positive
     */
    public static WeightVector validated(Map<String, Double> values) {
        if (values == null || values.isEmpty()) {
            throw new InvalidWeightsException("at least one channel weight must be configured");
        }
        WeightVector vector;
        try {
            vector = WeightVector.fromValues(values);
        } catch (IllegalArgumentException | NullPointerException ex) {
            throw new InvalidWeightsException("invalid channel weights " + values + ": " + ex.getMessage());
        }
        boolean anyPositive = vector.channels().stream().anyMatch(weight -> weight.value() > 0.0d);
        if (!anyPositive) {
            throw new InvalidWeightsException("at least one channel weight must be > 0, got " + values);
        }
        return vector;
    }

    public boolean isNormalized(WeightVector vector) {
        return Math.abs(getWeightsSum(vector) - 1.0d) <= EPSILON;
    }

    public double getWeightsSum(WeightVector vector) {
        double sum = 0.0d;
        for (ChannelWeight weight : vector.channels()) {
            sum += weight.value();
        }
        return sum;
    }

    /**
     * Scales the unlocked channels so that all weights sum up to one. Locked
     * channels keep their values unless their mass alone exceeds one, in which
     * case they are scaled down to exactly one and all unlocked channels drop
     * to zero.
     */
    public WeightVector normalizeWeights(WeightVector vector) {
        if (vector.isEmpty() || isNormalized(vector)) {
            return vector;
        }
        double lockedSum = 0.0d;
        double unlockedSum = 0.0d;
        int unlockedCount = 0;
        for (ChannelWeight weight : vector.channels()) {
            if (weight.locked()) {
                lockedSum += weight.value();
            } else {
                unlockedSum += weight.value();
                unlockedCount++;
            }
        }

        if (lockedSum > 1.0d + EPSILON) {
            double lockedScale = 1.0d / lockedSum;
            return vector.map(weight -> weight.locked()
                    ? weight.withValue(clamp(weight.value() * lockedScale))
                    : weight.withValue(0.0d));
        }
        if (unlockedCount == 0) {
            return vector;
        }

        double target = 1.0d - lockedSum;
        if (target <= EPSILON) {
            return vector.map(weight -> weight.locked() ? weight : weight.withValue(0.0d));
        }
        if (unlockedSum < EPSILON) {
            double share = target / unlockedCount;
            return vector.map(weight -> weight.locked() ? weight : weight.withValue(clamp(share)));
        }
        double scale = target / unlockedSum;
        return vector.map(weight -> weight.locked() ? weight : weight.withValue(clamp(weight.value() * scale)));
    }

    /**
     * Sets the weight of one channel and gives the difference back to (or takes
     * it from) the other unlocked channels in proportion to their current
     * weights.
     *
     * @return the updated and normalized vector, or the unchanged vector if the
     *         channel is unknown or locked
     */
    public WeightVector updateWeight(WeightVector vector, String name, double newValue) {
        double target = clamp(newValue);
        ChannelWeight current = vector.get(name).orElse(null);
        if (current == null || current.locked()) {
            return vector;
        }
        double delta = target - current.value();
        if (Math.abs(delta) < EPSILON) {
            return normalizeWeights(vector);
        }

        double othersSum = 0.0d;
        int othersCount = 0;
        for (ChannelWeight weight : vector.channels()) {
            if (!weight.locked() && !weight.name().equals(name)) {
                othersSum += weight.value();
                othersCount++;
            }
        }
        if (othersCount == 0) {
            return normalizeWeights(vector.withValue(name, target));
        }

        double sumOfOthers = othersSum;
        int countOfOthers = othersCount;
        WeightVector updated = vector.map(weight -> {
            if (weight.name().equals(name)) {
                return weight.withValue(target);
            }
            if (weight.locked()) {
                return weight;
            }
            if (sumOfOthers > EPSILON) {
                double adjustment = -delta * (weight.value() / sumOfOthers);
                return weight.withValue(clamp(weight.value() + adjustment));
            }
            return weight.withValue(clamp(weight.value() - delta / countOfOthers));
        });
        // clamping may have truncated part of the delta
        return normalizeWeights(updated);
    }

    /**
     * Applies preset values to the unlocked channels. Channels missing from the
     * preset keep their current value; the preset does not need to sum up to
     * one since the result is normalized.
     */
    public WeightVector applyPreset(WeightVector vector, Map<String, Double> preset) {
        WeightVector updated = vector.map(weight -> {
            Double presetValue = preset.get(weight.name());
            if (weight.locked() || presetValue == null || presetValue.isNaN()) {
                return weight;
            }
            return weight.withValue(clamp(presetValue));
        });
        return normalizeWeights(updated);
    }

    /**
     * Forces the given channels to zero and redistributes their mass over the
     * remaining unlocked channels. Disabled channels are zeroed even when locked
     * because they cannot produce a score at all.
     */
    public WeightVector disableChannels(WeightVector vector, Collection<String> names) {
        Set<String> disabled = new HashSet<>(names);
        disabled.retainAll(vector.names());
        if (disabled.isEmpty()) {
            return vector;
        }
        Set<String> previouslyLocked = new HashSet<>();
        WeightVector zeroed = vector.map(weight -> {
            if (!disabled.contains(weight.name())) {
                return weight;
            }
            if (weight.locked()) {
                previouslyLocked.add(weight.name());
            }
            return new ChannelWeight(weight.name(), 0.0d, true);
        });
        WeightVector normalized = normalizeWeights(zeroed);
        return normalized.map(weight -> disabled.contains(weight.name())
                ? weight.withLocked(previouslyLocked.contains(weight.name()))
                : weight);
    }

    /**
     * Rounds the value to the nearest multiple of {@code step} using decimal
     * arithmetic, so exact multiples such as {@code 0.10} for a step of
     * {@code 0.05} are returned unchanged.
     */
    public double roundToStep(double value, double step) {
        if (!(step > 0.0d) || Double.isInfinite(step)) {
            throw new IllegalArgumentException("step must be a positive finite number, got " + step);
        }
        if (!Double.isFinite(value)) {
            return value;
        }
        BigDecimal decimalStep = BigDecimal.valueOf(step);
        BigDecimal steps = BigDecimal.valueOf(value).divide(decimalStep, 0, RoundingMode.HALF_UP);
        return steps.multiply(decimalStep).doubleValue();
    }

    public String weightToPercentage(double value, int decimals) {
        if (decimals < 0) {
            throw new IllegalArgumentException("decimals must not be negative, got " + decimals);
        }
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("weight must be finite, got " + value);
        }
        return BigDecimal.valueOf(value).movePointRight(2).setScale(decimals, RoundingMode.HALF_UP).toPlainString()
                + "%";
    }

    /**
     * Parses a percentage such as {@code "35"}, {@code "35%"} or
     * {@code "12.5 %"} into a weight. Values outside of 0..100 are clamped.
     *
     * @throws IllegalArgumentException if the text is not a number
     */
    public double percentageToWeight(String percentage) {
        if (percentage == null) {
            throw new IllegalArgumentException("percentage must not be null");
        }
        String text = percentage.strip();
        if (text.endsWith("%")) {
            text = text.substring(0, text.length() - 1).strip();
        }
        double parsed;
        try {
            parsed = Double.parseDouble(text);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("not a percentage: '" + percentage + "'", ex);
        }
        if (Double.isNaN(parsed)) {
            throw new IllegalArgumentException("not a percentage: '" + percentage + "'");
        }
        return clamp(parsed / 100.0d);
    }

    static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0d;
        }
        return Math.max(0.0d, Math.min(1.0d, value));
    }
}
