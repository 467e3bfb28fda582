package io.trading.perpfeed.model;

import java.math.BigDecimal;

/**
 * Complete funding information for one perpetual instrument.
 *
 * @param tradingPair             Canonical trading pair
 * @param indexPrice              Index price
 * @param markPrice               Mark price
 * @param nextFundingUtcTimestamp Next funding time, epoch based as reported by the exchange
 * @param rate                    Funding rate as a decimal fraction
 */
public record FundingInfo(
    String tradingPair,
    BigDecimal indexPrice,
    BigDecimal markPrice,
    long nextFundingUtcTimestamp,
    BigDecimal rate
) {
    public FundingInfo {
        if (tradingPair == null || tradingPair.isEmpty()) {
            throw new IllegalArgumentException("tradingPair cannot be null or empty");
        }
        if (indexPrice == null || markPrice == null || rate == null) {
            throw new IllegalArgumentException("indexPrice, markPrice and rate cannot be null");
        }
    }

    /**
     * Returns a copy with every field present in the update replaced. Empty fields keep
     * the current value.
     */
    public FundingInfo apply(FundingInfoUpdate update) {
        if (!tradingPair.equals(update.tradingPair())) {
            throw new IllegalArgumentException(
                "update for " + update.tradingPair() + " cannot be applied to " + tradingPair);
        }
        return new FundingInfo(
            tradingPair,
            update.indexPrice().orElse(indexPrice),
            update.markPrice().orElse(markPrice),
            update.nextFundingUtcTimestamp().orElse(nextFundingUtcTimestamp),
            update.rate().orElse(rate)
        );
    }
}
