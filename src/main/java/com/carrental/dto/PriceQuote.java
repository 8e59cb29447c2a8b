package com.carrental.dto;

import java.math.BigDecimal;

public class PriceQuote {
    private final long days;
    private final BigDecimal dailyRate;
    private final BigDecimal basePrice;
    private final BigDecimal subscriptionDiscount;
    private final BigDecimal promotionDiscount;
    private final BigDecimal totalPrice;

    public PriceQuote(long days,
                      BigDecimal dailyRate,
                      BigDecimal basePrice,
                      BigDecimal subscriptionDiscount,
                      BigDecimal promotionDiscount,
                      BigDecimal totalPrice) {
        this.days = days;
        this.dailyRate = dailyRate;
        this.basePrice = basePrice;
        this.subscriptionDiscount = subscriptionDiscount;
        this.promotionDiscount = promotionDiscount;
        this.totalPrice = totalPrice;
    }

    public static PriceQuote zero() {
        return new PriceQuote(0, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO);
    }

    public long getDays() { return days; }
    public BigDecimal getDailyRate() { return dailyRate; }
    public BigDecimal getBasePrice() { return basePrice; }
    public BigDecimal getSubscriptionDiscount() { return subscriptionDiscount; }
    public BigDecimal getPromotionDiscount() { return promotionDiscount; }
    public BigDecimal getTotalPrice() { return totalPrice; }

    public BigDecimal getTotalDiscount() {
        return subscriptionDiscount.add(promotionDiscount);
    }

    /** Stored discount: null when nothing was taken off. */
    public BigDecimal getDiscountAmountOrNull() {
        BigDecimal d = getTotalDiscount();
        return d.signum() == 0 ? null : d;
    }
}
