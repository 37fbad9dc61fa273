package com.flagship.custodial_exchange.market;

import lombok.Value;

/**
 * Distribution of a sale price between treasury, reward pool and seller.
 *
 * All math truncates toward zero in basis points. {@code sellerAmount} absorbs
 * {@code price - tax} and {@code rewardPoolAmount} absorbs
 * {@code tax - treasuryAmount}, so the three parts always add up to the price.
 */
@Value
public class FeeSplit {

    public static final long BASIS_POINTS = 10_000L;

    long price;
    long tax;
    long treasuryAmount;
    long rewardPoolAmount;
    long sellerAmount;

    public static FeeSplit of(long price, int feeRate, int treasuryFeeRate) {
        if (price < 0) {
            throw new IllegalArgumentException("Price must not be negative: " + price);
        }
        requireRate("Fee rate", feeRate);
        requireRate("Treasury fee rate", treasuryFeeRate);

        long tax = basisPointsOf(price, feeRate);
        long treasuryAmount = basisPointsOf(tax, treasuryFeeRate);
        return new FeeSplit(price, tax, treasuryAmount, tax - treasuryAmount, price - tax);
    }

    public long total() {
        return treasuryAmount + rewardPoolAmount + sellerAmount;
    }

    /**
     * {@code floor(amount * rate / 10000)} without forming the full product,
     * so any non-negative long price can be split.
     */
    static long basisPointsOf(long amount, int rate) {
        return amount / BASIS_POINTS * rate + amount % BASIS_POINTS * rate / BASIS_POINTS;
    }

    private static void requireRate(String name, int rate) {
        if (rate < 0 || rate > BASIS_POINTS) {
            throw new IllegalArgumentException(name + " must be within 0..10000 basis points: " + rate);
        }
    }
}
