package com.carrental.repository;

import com.carrental.model.Favorite;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface FavoriteRepository extends JpaRepository<Favorite, Long> {
    List<Favorite> findByUserIdOrderByCreatedAtDesc(Long userId);
    Optional<Favorite> findByUserIdAndCarId(Long userId, Long carId);
    boolean existsByUserIdAndCarId(Long userId, Long carId);

    @Query("select f.car.id from Favorite f where f.user.id = :userId")
    List<Long> findCarIdsByUserId(@Param("userId") Long userId);
}
