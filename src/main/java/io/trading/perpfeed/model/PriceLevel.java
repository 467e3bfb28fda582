package io.trading.perpfeed.model;

/**
 * Single price level in an order book snapshot or diff.
 *
 * @param price Price of the level
 * @param size  Quantity at this price; zero in a diff removes the level
 */
public record PriceLevel(
    double price,
    double size
) {
    public PriceLevel {
        if (Double.isNaN(price) || Double.isNaN(size)) {
            throw new IllegalArgumentException("price and size must be numbers");
        }
    }
}
