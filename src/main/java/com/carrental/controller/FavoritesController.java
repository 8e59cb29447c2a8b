package com.carrental.controller;

import com.carrental.model.Car;
import com.carrental.model.Favorite;
import com.carrental.model.User;
import com.carrental.repository.UserRepository;
import com.carrental.service.FavoriteService;
import org.springframework.security.core.Authentication;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@Controller
@RequestMapping("/favorites")
public class FavoritesController {

    private final FavoriteService favoriteService;
    private final UserRepository userRepository;

    public FavoritesController(FavoriteService favoriteService, UserRepository userRepository) {
        this.favoriteService = favoriteService;
        this.userRepository = userRepository;
    }

    private User currentUser(Authentication authentication) {
        return userRepository.findByUsername(authentication.getName()).orElseThrow();
    }

    @GetMapping
    @ResponseBody
    public List<Car> list(Authentication authentication) {
        return favoriteService.listFor(currentUser(authentication)).stream()
                .map(Favorite::getCar)
                .toList();
    }

    @PostMapping("/add")
    @ResponseBody
    public Map<String, Object> add(Authentication authentication, @RequestParam Long carId) {
        boolean added = favoriteService.add(currentUser(authentication), carId);
        return added
                ? Map.of("success", true, "message", "Added to favorites")
                : Map.of("success", false, "message", "Already in favorites");
    }

    @PostMapping("/remove")
    @ResponseBody
    public Map<String, Object> remove(Authentication authentication, @RequestParam Long carId) {
        boolean removed = favoriteService.remove(currentUser(authentication), carId);
        return removed
                ? Map.of("success", true, "message", "Removed from favorites")
                : Map.of("success", false, "message", "Favorite not found");
    }

    @GetMapping("/check")
    @ResponseBody
    public Map<String, Object> check(Authentication authentication, @RequestParam Long carId) {
        return Map.of("isFavorited", favoriteService.isFavorited(currentUser(authentication), carId));
    }
}
