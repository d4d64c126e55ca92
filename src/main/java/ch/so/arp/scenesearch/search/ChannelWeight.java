package ch.so.arp.scenesearch.search;

/**
 * Weight of a single similarity channel. A locked weight is pinned by the
 * caller and never touched by automatic redistribution.
 */
public record ChannelWeight(String name, double value, boolean locked) {

    public ChannelWeight {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("channel name must not be blank");
        }
        if (Double.isNaN(value) || value < 0.0d || value > 1.0d) {
            throw new IllegalArgumentException("weight of channel '" + name + "' must be in [0, 1], got " + value);
        }
    }

    public static ChannelWeight unlocked(String name, double value) {
        return new ChannelWeight(name, value, false);
    }

    public ChannelWeight withValue(double newValue) {
        return new ChannelWeight(name, newValue, locked);
    }

    public ChannelWeight withLocked(boolean newLocked) {
        return new ChannelWeight(name, value, newLocked);
    }
}
