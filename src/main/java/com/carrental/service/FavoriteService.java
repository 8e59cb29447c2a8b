package com.carrental.service;

import com.carrental.exception.NotFoundException;
import com.carrental.model.Car;
import com.carrental.model.Favorite;
import com.carrental.model.User;
import com.carrental.repository.CarRepository;
import com.carrental.repository.FavoriteRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

@Service
@RequiredArgsConstructor
public class FavoriteService {

    private final FavoriteRepository favoriteRepository;
    private final CarRepository carRepository;
    private final Clock clock;

    public List<Favorite> listFor(User user) {
        return favoriteRepository.findByUserIdOrderByCreatedAtDesc(user.getId());
    }

    /** @return false when the car was already a favorite */
    @Transactional
    public boolean add(User user, Long carId) {
        Car car = carRepository.findById(carId).orElseThrow(() -> NotFoundException.of("Car", carId));
        if (favoriteRepository.existsByUserIdAndCarId(user.getId(), carId)) {
            return false;
        }
        Favorite f = new Favorite();
        f.setUser(user);
        f.setCar(car);
        f.setCreatedAt(LocalDateTime.now(clock));
        favoriteRepository.save(f);
        return true;
    }

    /** @return false when there was nothing to remove */
    @Transactional
    public boolean remove(User user, Long carId) {
        return favoriteRepository.findByUserIdAndCarId(user.getId(), carId)
                .map(f -> {
                    favoriteRepository.delete(f);
                    return true;
                })
                .orElse(false);
    }

    public boolean isFavorited(User user, Long carId) {
        return user != null && favoriteRepository.existsByUserIdAndCarId(user.getId(), carId);
    }

    public Set<Long> favoriteCarIds(User user) {
        if (user == null) return Set.of();
        return new HashSet<>(favoriteRepository.findCarIdsByUserId(user.getId()));
    }
}
