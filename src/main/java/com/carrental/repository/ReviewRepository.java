package com.carrental.repository;

import com.carrental.model.Review;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface ReviewRepository extends JpaRepository<Review, Long> {
    List<Review> findByApprovedTrueOrderByCreatedAtDesc();
    List<Review> findByCarIdAndApprovedTrueOrderByCreatedAtDesc(Long carId);
    List<Review> findByApprovedOrderByCreatedAtDesc(boolean approved);
    List<Review> findAllByOrderByCreatedAtDesc();
    List<Review> findByUserId(Long userId);

    Optional<Review> findByCarIdAndUserId(Long carId, Long userId);

    long countByCarIdAndApprovedTrue(Long carId);
    long countByApprovedFalse();

    @Query("select avg(r.rating) from Review r where r.car.id = :carId and r.approved = true")
    Double averageApprovedRating(@Param("carId") Long carId);

    // rows of [carId, average]
    @Query("select r.car.id, avg(r.rating) from Review r where r.approved = true group by r.car.id")
    List<Object[]> averageApprovedRatingsByCar();
}
