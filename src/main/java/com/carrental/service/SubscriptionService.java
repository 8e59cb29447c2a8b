package com.carrental.service;

import com.carrental.exception.BusinessException;
import com.carrental.exception.NotFoundException;
import com.carrental.model.Subscription;
import com.carrental.repository.SubscriptionRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Service
@RequiredArgsConstructor
public class SubscriptionService {

    private final SubscriptionRepository subscriptionRepository;
    private final Clock clock;

    public Optional<Subscription> findById(Long id) {
        return id == null ? Optional.empty() : subscriptionRepository.findById(id);
    }

    public Subscription getById(Long id) {
        return subscriptionRepository.findById(id).orElseThrow(() -> NotFoundException.of("Subscription", id));
    }

    public List<Subscription> listAll() {
        return subscriptionRepository.findAllByOrderByMonthlyPriceAsc();
    }

    public List<Subscription> listActive() {
        return subscriptionRepository.findByActiveTrueOrderByMonthlyPriceAsc();
    }

    @Transactional
    public Subscription create(Subscription s) {
        check(s);
        s.setCreatedAt(LocalDateTime.now(clock));
        return subscriptionRepository.save(s);
    }

    @Transactional
    public Subscription update(Long id, Subscription changes) {
        check(changes);
        Subscription existing = getById(id);
        existing.setName(changes.getName());
        existing.setDescription(changes.getDescription());
        existing.setMonthlyPrice(changes.getMonthlyPrice());
        existing.setDiscountPercentage(changes.getDiscountPercentage());
        existing.setMaxRentalsPerMonth(changes.getMaxRentalsPerMonth());
        existing.setMaxDaysPerRental(changes.getMaxDaysPerRental());
        existing.setEvPriority(changes.isEvPriority());
        existing.setActive(changes.isActive());
        existing.setUpdatedAt(LocalDateTime.now(clock));
        return subscriptionRepository.save(existing);
    }

    @Transactional
    public void delete(Long id) {
        subscriptionRepository.delete(getById(id));
    }

    @Transactional
    public Subscription toggleActive(Long id) {
        Subscription s = getById(id);
        s.setActive(!s.isActive());
        s.setUpdatedAt(LocalDateTime.now(clock));
        return subscriptionRepository.save(s);
    }

    private void check(Subscription s) {
        if (s.getName() == null || s.getName().isBlank()) {
            throw new BusinessException("Subscription name is required.");
        }
        BigDecimal pct = s.getDiscountPercentage();
        if (pct == null || pct.signum() < 0 || pct.compareTo(BigDecimal.valueOf(100)) > 0) {
            throw new BusinessException("Discount percentage must be between 0 and 100.");
        }
        if (s.getMonthlyPrice() == null || s.getMonthlyPrice().signum() < 0) {
            throw new BusinessException("Monthly price must not be negative.");
        }
    }
}
