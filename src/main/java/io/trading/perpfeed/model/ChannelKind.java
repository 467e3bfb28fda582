package io.trading.perpfeed.model;

/**
 * Canonical classification of an inbound stream message.
 */
public enum ChannelKind {
    TRADE("trade"),
    DIFF("diff"),
    FUNDING("funding"),
    UNROUTED("unrouted");

    private final String displayName;

    ChannelKind(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
