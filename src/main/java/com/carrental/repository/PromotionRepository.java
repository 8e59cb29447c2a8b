package com.carrental.repository;

import com.carrental.model.Promotion;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface PromotionRepository extends JpaRepository<Promotion, Long> {
    Optional<Promotion> findByCodeIgnoreCase(String code);
    boolean existsByCodeIgnoreCase(String code);
    boolean existsByCodeIgnoreCaseAndIdNot(String code, Long id);
    List<Promotion> findAllByOrderByCreatedAtDesc();
    List<Promotion> findByActiveTrueOrderByDiscountPercentageDesc();
}
