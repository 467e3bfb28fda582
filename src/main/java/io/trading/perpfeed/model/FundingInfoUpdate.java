package io.trading.perpfeed.model;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Sparse funding-info delta. An empty field means "unchanged", never zero.
 *
 * @param tradingPair             Canonical trading pair
 * @param indexPrice              New index price, if reported
 * @param markPrice               New mark price, if reported
 * @param nextFundingUtcTimestamp New next funding time in epoch seconds, if reported
 * @param rate                    New funding rate, if reported
 */
public record FundingInfoUpdate(
    String tradingPair,
    Optional<BigDecimal> indexPrice,
    Optional<BigDecimal> markPrice,
    OptionalLong nextFundingUtcTimestamp,
    Optional<BigDecimal> rate
) {
    public FundingInfoUpdate {
        if (tradingPair == null || tradingPair.isEmpty()) {
            throw new IllegalArgumentException("tradingPair cannot be null or empty");
        }
        if (indexPrice == null || markPrice == null || nextFundingUtcTimestamp == null || rate == null) {
            throw new IllegalArgumentException("optional fields cannot be null, use empty()");
        }
    }

    public boolean isEmpty() {
        return indexPrice.isEmpty() && markPrice.isEmpty()
            && nextFundingUtcTimestamp.isEmpty() && rate.isEmpty();
    }

    public static Builder builder(String tradingPair) {
        return new Builder(tradingPair);
    }

    /**
     * Builder for FundingInfoUpdate; unset fields stay empty.
     */
    public static class Builder {
        private final String tradingPair;
        private Optional<BigDecimal> indexPrice = Optional.empty();
        private Optional<BigDecimal> markPrice = Optional.empty();
        private OptionalLong nextFundingUtcTimestamp = OptionalLong.empty();
        private Optional<BigDecimal> rate = Optional.empty();

        private Builder(String tradingPair) {
            this.tradingPair = tradingPair;
        }

        public Builder indexPrice(BigDecimal indexPrice) {
            this.indexPrice = Optional.of(indexPrice);
            return this;
        }

        public Builder markPrice(BigDecimal markPrice) {
            this.markPrice = Optional.of(markPrice);
            return this;
        }

        public Builder nextFundingUtcTimestamp(long nextFundingUtcTimestamp) {
            this.nextFundingUtcTimestamp = OptionalLong.of(nextFundingUtcTimestamp);
            return this;
        }

        public Builder rate(BigDecimal rate) {
            this.rate = Optional.of(rate);
            return this;
        }

        public FundingInfoUpdate build() {
            return new FundingInfoUpdate(tradingPair, indexPrice, markPrice, nextFundingUtcTimestamp, rate);
        }
    }
}
