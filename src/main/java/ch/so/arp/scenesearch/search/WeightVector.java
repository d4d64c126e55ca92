package ch.so.arp.scenesearch.search;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Immutable, ordered set of channel weights. Order is the insertion order of
 * the channels and is kept by every transformation.
 */
public final class WeightVector {

    private static final WeightVector EMPTY = new WeightVector(new LinkedHashMap<>());

    private final Map<String, ChannelWeight> weights;

    private WeightVector(LinkedHashMap<String, ChannelWeight> weights) {
        this.weights = Collections.unmodifiableMap(weights);
    }

    public static WeightVector empty() {
        return EMPTY;
    }

    public static WeightVector of(Collection<ChannelWeight> weights) {
        LinkedHashMap<String, ChannelWeight> copy = new LinkedHashMap<>();
        for (ChannelWeight weight : weights) {
            if (copy.putIfAbsent(weight.name(), weight) != null) {
                throw new IllegalArgumentException("duplicate channel '" + weight.name() + "'");
            }
        }
        return new WeightVector(copy);
    }

    public static WeightVector of(ChannelWeight... weights) {
        return of(List.of(weights));
    }

    /**
     * Builds an unlocked vector from a name to value map, keeping the map's
     * iteration order.
     */
    public static WeightVector fromValues(Map<String, Double> values) {
        List<ChannelWeight> list = new ArrayList<>(values.size());
        values.forEach((name, value) -> list.add(ChannelWeight.unlocked(name, value)));
        return of(list);
    }

    public boolean isEmpty() {
        return weights.isEmpty();
    }

    public int size() {
        return weights.size();
    }

    public boolean contains(String name) {
        return weights.containsKey(name);
    }

    public Optional<ChannelWeight> get(String name) {
        return Optional.ofNullable(weights.get(name));
    }

    /**
     * @return the weight value of the channel or {@code 0} when the channel is
     *         not part of the vector
     */
    public double valueOf(String name) {
        ChannelWeight weight = weights.get(name);
        return weight == null ? 0.0d : weight.value();
    }

    public boolean isLocked(String name) {
        ChannelWeight weight = weights.get(name);
        return weight != null && weight.locked();
    }

    public Collection<ChannelWeight> channels() {
        return weights.values();
    }

    public List<String> names() {
        return List.copyOf(weights.keySet());
    }

    public Map<String, Double> asValueMap() {
        Map<String, Double> values = new LinkedHashMap<>();
        weights.forEach((name, weight) -> values.put(name, weight.value()));
        return Collections.unmodifiableMap(values);
    }

    /**
     * Returns a copy in which every channel was passed through the given
     * function. The function must not change the channel name.
     */
    public WeightVector map(UnaryOperator<ChannelWeight> mapper) {
        LinkedHashMap<String, ChannelWeight> copy = new LinkedHashMap<>();
        weights.forEach((name, weight) -> {
            ChannelWeight mapped = mapper.apply(weight);
            if (!mapped.name().equals(name)) {
                throw new IllegalStateException("mapper renamed channel '" + name + "'");
            }
            copy.put(name, mapped);
        });
        return new WeightVector(copy);
    }

    public WeightVector withValue(String name, double value) {
        return map(weight -> weight.name().equals(name) ? weight.withValue(value) : weight);
    }

    public WeightVector withLocked(String name, boolean locked) {
        return map(weight -> weight.name().equals(name) ? weight.withLocked(locked) : weight);
    }

    public WeightVector without(String name) {
        LinkedHashMap<String, ChannelWeight> copy = new LinkedHashMap<>(weights);
        copy.remove(name);
        return new WeightVector(copy);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof WeightVector that)) {
            return false;
        }
        return List.copyOf(weights.values()).equals(List.copyOf(that.weights.values()));
    }

    @Override
    public int hashCode() {
        return Objects.hash(List.copyOf(weights.values()));
    }

    @Override
    public String toString() {
        return weights.values().toString();
    }
}
