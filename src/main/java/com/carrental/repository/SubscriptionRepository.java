package com.carrental.repository;

import com.carrental.model.Subscription;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface SubscriptionRepository extends JpaRepository<Subscription, Long> {
    List<Subscription> findAllByOrderByMonthlyPriceAsc();
    List<Subscription> findByActiveTrueOrderByMonthlyPriceAsc();
}
