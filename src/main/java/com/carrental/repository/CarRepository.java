package com.carrental.repository;

import com.carrental.model.Car;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;

public interface CarRepository extends JpaRepository<Car, Long> {
    List<Car> findByAvailableTrue();
    List<Car> findAllByOrderByCreatedAtDesc();
    List<Car> findByElectricTrueAndAvailableTrueOrderByDailyRateAsc();
    List<Car> findByIdInAndElectricTrue(Collection<Long> ids);

    boolean existsByLicensePlateIgnoreCase(String licensePlate);
    boolean existsByLicensePlateIgnoreCaseAndIdNot(String licensePlate, Long id);

    long countByAvailableTrue();
    long countByElectricTrue();
}
