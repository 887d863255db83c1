package com.pairarb.domain;

import java.math.BigDecimal;
import java.math.MathContext;

/**
 * Spread arithmetic.
 *
 * <p>A spread is the relative gap between the price paid on the bought leg and the price
 * received on the sold leg, in percent of the sell price: {@code (1 - buy / sell) * 100}.
 * Its magnitude equals {@code |buy / sell - 1| * 100}; the sign is positive when the sold
 * leg is priced above the bought leg, which is the profitable side of the trade.
 * Buying at 100 and selling at 102 is a spread of about 1.96%.
 */
public final class Spreads {

    public static final MathContext MC = MathContext.DECIMAL64;

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private Spreads() {}

    public static BigDecimal spreadPct(BigDecimal buyPrice, BigDecimal sellPrice) {
        return BigDecimal.ONE.subtract(buyPrice.divide(sellPrice, MC)).multiply(HUNDRED, MC);
    }

    /** True when {@code spreadPct} is at least {@code minSpreadPct}. A null minimum accepts any spread. */
    public static boolean meetsThreshold(BigDecimal spreadPct, BigDecimal minSpreadPct) {
        return minSpreadPct == null || spreadPct.compareTo(minSpreadPct) >= 0;
    }
}
