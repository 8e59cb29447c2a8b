package com.carrental.service;

import com.carrental.exception.BusinessException;
import com.carrental.exception.NotFoundException;
import com.carrental.model.Promotion;
import com.carrental.repository.PromotionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

@Service
public class PromotionService {

    private static final Logger logger = LoggerFactory.getLogger(PromotionService.class);

    private final PromotionRepository promotionRepository;
    private final Clock clock;

    public PromotionService(PromotionRepository promotionRepository, Clock clock) {
        this.promotionRepository = promotionRepository;
        this.clock = clock;
    }

    /**
     * Outcome of checking a code typed into the booking form.
     */
    public static class Validation {
        private final boolean valid;
        private final Promotion promotion;
        private final String message;

        private Validation(boolean valid, Promotion promotion, String message) {
            this.valid = valid;
            this.promotion = promotion;
            this.message = message;
        }

        static Validation ok(Promotion p) {
            return new Validation(true, p, "Promotion code applied: " + p.getDiscountPercentage().stripTrailingZeros().toPlainString() + "% off");
        }

        static Validation rejected(String message) {
            return new Validation(false, null, message);
        }

        public boolean isValid() { return valid; }
        public Promotion getPromotion() { return promotion; }
        public String getMessage() { return message; }
    }

    public Optional<Promotion> findById(Long id) {
        return id == null ? Optional.empty() : promotionRepository.findById(id);
    }

    public Promotion getById(Long id) {
        return promotionRepository.findById(id).orElseThrow(() -> NotFoundException.of("Promotion", id));
    }

    public Optional<Promotion> findByCode(String code) {
        if (code == null || code.isBlank()) return Optional.empty();
        return promotionRepository.findByCodeIgnoreCase(code.trim());
    }

    public List<Promotion> listAll() {
        return promotionRepository.findAllByOrderByCreatedAtDesc();
    }

    /** Promotions a customer could use right now, best discount first. */
    public List<Promotion> listActive() {
        return promotionRepository.findByActiveTrueOrderByDiscountPercentageDesc().stream()
                .filter(p -> isCurrentlyValid(p))
                .toList();
    }

    /** Active, inside its window and under its usage cap. Ignores the EV-only restriction. */
    public boolean isCurrentlyValid(Promotion p) {
        if (p == null || !p.isActive()) return false;
        LocalDateTime now = LocalDateTime.now(clock);
        if (now.isBefore(p.getStartDate()) || now.isAfter(p.getEndDate())) return false;
        return p.getMaxUses() == null || p.getCurrentUses() < p.getMaxUses();
    }

    /** {@link #isCurrentlyValid} plus the EV-only restriction for the given vehicle. */
    public boolean isUsableFor(Promotion p, boolean electricVehicle) {
        return isCurrentlyValid(p) && (!p.isEvOnly() || electricVehicle);
    }

    public Validation validateCode(String code, boolean electricVehicle) {
        if (code == null || code.isBlank()) {
            return Validation.rejected("Please enter a promotion code.");
        }
        Optional<Promotion> found = findByCode(code);
        if (found.isEmpty()) {
            return Validation.rejected("Invalid promotion code.");
        }
        Promotion p = found.get();
        LocalDateTime now = LocalDateTime.now(clock);
        if (!p.isActive()) {
            return Validation.rejected("This promotion is no longer active.");
        }
        if (now.isBefore(p.getStartDate())) {
            return Validation.rejected("This promotion has not started yet.");
        }
        if (now.isAfter(p.getEndDate())) {
            return Validation.rejected("This promotion has expired.");
        }
        if (p.isEvOnly() && !electricVehicle) {
            return Validation.rejected("This promotion is only valid for electric vehicles.");
        }
        if (p.getMaxUses() != null && p.getCurrentUses() >= p.getMaxUses()) {
            return Validation.rejected("This promotion has reached its usage limit.");
        }
        return Validation.ok(p);
    }

    @Transactional
    public void redeem(Promotion promotion) {
        promotion.setCurrentUses(promotion.getCurrentUses() + 1);
        promotion.setUpdatedAt(LocalDateTime.now(clock));
        promotionRepository.save(promotion);
    }

    @Transactional
    public Promotion create(Promotion promotion) {
        normalizeAndCheck(promotion);
        if (promotionRepository.existsByCodeIgnoreCase(promotion.getCode())) {
            throw new BusinessException("Promotion code '" + promotion.getCode() + "' already exists.");
        }
        promotion.setCurrentUses(0);
        promotion.setCreatedAt(LocalDateTime.now(clock));
        Promotion saved = promotionRepository.save(promotion);
        logger.info("Created promotion {} ({})", saved.getCode(), saved.getId());
        return saved;
    }

    @Transactional
    public Promotion update(Long id, Promotion changes) {
        Promotion existing = getById(id);
        normalizeAndCheck(changes);
        if (promotionRepository.existsByCodeIgnoreCaseAndIdNot(changes.getCode(), id)) {
            throw new BusinessException("Promotion code '" + changes.getCode() + "' already exists.");
        }
        existing.setName(changes.getName());
        existing.setDescription(changes.getDescription());
        existing.setCode(changes.getCode());
        existing.setDiscountPercentage(changes.getDiscountPercentage());
        existing.setMaxDiscountAmount(changes.getMaxDiscountAmount());
        existing.setStartDate(changes.getStartDate());
        existing.setEndDate(changes.getEndDate());
        existing.setActive(changes.isActive());
        existing.setEvOnly(changes.isEvOnly());
        existing.setMaxUses(changes.getMaxUses());
        existing.setUpdatedAt(LocalDateTime.now(clock));
        return promotionRepository.save(existing);
    }

    @Transactional
    public void delete(Long id) {
        Promotion p = getById(id);
        promotionRepository.delete(p);
        logger.info("Deleted promotion {}", p.getCode());
    }

    @Transactional
    public Promotion toggleActive(Long id) {
        Promotion p = getById(id);
        p.setActive(!p.isActive());
        p.setUpdatedAt(LocalDateTime.now(clock));
        return promotionRepository.save(p);
    }

    private void normalizeAndCheck(Promotion p) {
        if (p.getCode() == null || p.getCode().isBlank()) {
            throw new BusinessException("Promotion code is required.");
        }
        p.setCode(p.getCode().trim().toUpperCase(Locale.ROOT));
        BigDecimal pct = p.getDiscountPercentage();
        if (pct == null || pct.signum() < 0 || pct.compareTo(BigDecimal.valueOf(100)) > 0) {
            throw new BusinessException("Discount percentage must be between 0 and 100.");
        }
        if (p.getStartDate() == null || p.getEndDate() == null || p.getEndDate().isBefore(p.getStartDate())) {
            throw new BusinessException("Promotion end date must be after its start date.");
        }
        if (p.getMaxUses() != null && p.getMaxUses() < 1) {
            throw new BusinessException("Max uses must be at least 1.");
        }
    }
}
