package com.carrental.service;

import com.carrental.dto.PriceQuote;
import com.carrental.model.Car;
import com.carrental.model.Promotion;
import com.carrental.model.Subscription;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.LocalDateTime;

@Service
public class PricingService {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final PromotionService promotionService;

    public PricingService(PromotionService promotionService) {
        this.promotionService = promotionService;
    }

    private static BigDecimal money(BigDecimal v) {
        return v.setScale(2, RoundingMode.HALF_UP);
    }

    /**
     * Billable days: every started 24 hours counts as a day, never fewer than one.
     */
    public long rentalDays(LocalDateTime start, LocalDateTime end) {
        if (start == null || end == null || !end.isAfter(start)) return 1;
        Duration d = Duration.between(start, end);
        long days = d.toDays();
        if (d.minusDays(days).isZero()) {
            return Math.max(1, days);
        }
        return days + 1;
    }

    public BigDecimal basePrice(Car car, LocalDateTime start, LocalDateTime end) {
        return money(car.getDailyRate().multiply(BigDecimal.valueOf(rentalDays(start, end))));
    }

    /** Membership discount; zero unless the subscription is active. */
    public BigDecimal subscriptionDiscount(BigDecimal basePrice, Subscription subscription) {
        if (subscription == null || !subscription.isActive()) return BigDecimal.ZERO;
        return money(basePrice.multiply(subscription.getDiscountPercentage()).divide(HUNDRED, 2, RoundingMode.HALF_UP));
    }

    /** Promotion discount, capped at the promotion's max amount. Zero when the promotion is not usable for this car. */
    public BigDecimal promotionDiscount(BigDecimal basePrice, Promotion promotion, Car car) {
        if (promotion == null || !promotionService.isUsableFor(promotion, car.isElectric())) return BigDecimal.ZERO;
        return cappedDiscount(basePrice, promotion);
    }

    /**
     * Discount of a promotion already redeemed by a booking. Its window and usage cap were checked when the
     * booking was made; only the EV-only restriction and the cap still apply.
     */
    public BigDecimal bookedPromotionDiscount(BigDecimal basePrice, Promotion promotion, Car car) {
        if (promotion == null || (promotion.isEvOnly() && !car.isElectric())) return BigDecimal.ZERO;
        return cappedDiscount(basePrice, promotion);
    }

    private static BigDecimal cappedDiscount(BigDecimal basePrice, Promotion promotion) {
        BigDecimal discount = basePrice.multiply(promotion.getDiscountPercentage()).divide(HUNDRED, 2, RoundingMode.HALF_UP);
        if (promotion.getMaxDiscountAmount() != null && discount.compareTo(promotion.getMaxDiscountAmount()) > 0) {
            discount = promotion.getMaxDiscountAmount();
        }
        return money(discount);
    }

    public PriceQuote quote(Car car,
                            LocalDateTime start,
                            LocalDateTime end,
                            Promotion promotion,
                            Subscription subscription) {
        return quote(car, start, end, promotion, subscription, false);
    }

    /** Re-prices an existing booking, keeping the discount of the promotion it was booked with. */
    public PriceQuote requote(Car car,
                              LocalDateTime start,
                              LocalDateTime end,
                              Promotion bookedPromotion,
                              Subscription subscription) {
        return quote(car, start, end, bookedPromotion, subscription, true);
    }

    private PriceQuote quote(Car car,
                             LocalDateTime start,
                             LocalDateTime end,
                             Promotion promotion,
                             Subscription subscription,
                             boolean promotionRedeemed) {
        if (car == null) return PriceQuote.zero();

        long days = rentalDays(start, end);
        BigDecimal base = basePrice(car, start, end);
        BigDecimal subDiscount = subscriptionDiscount(base, subscription);
        BigDecimal promoDiscount = promotionRedeemed
                ? bookedPromotionDiscount(base, promotion, car)
                : promotionDiscount(base, promotion, car);

        BigDecimal total = base.subtract(subDiscount).subtract(promoDiscount);
        if (total.signum() < 0) total = BigDecimal.ZERO;

        return new PriceQuote(days, money(car.getDailyRate()), base, subDiscount, promoDiscount, money(total));
    }
}
