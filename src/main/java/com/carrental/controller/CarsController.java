package com.carrental.controller;

import com.carrental.dto.CarDetails;
import com.carrental.dto.CarSearchCriteria;
import com.carrental.model.Car;
import com.carrental.model.User;
import com.carrental.repository.UserRepository;
import com.carrental.service.CarCatalogService;
import com.carrental.service.FavoriteService;
import com.carrental.service.ReviewService;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.ModelAttribute;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;

import java.math.BigDecimal;
import java.util.List;

@Controller
@RequestMapping("/cars")
public class CarsController {

    private final CarCatalogService carCatalogService;
    private final FavoriteService favoriteService;
    private final ReviewService reviewService;
    private final UserRepository userRepository;

    public CarsController(CarCatalogService carCatalogService,
                          FavoriteService favoriteService,
                          ReviewService reviewService,
                          UserRepository userRepository) {
        this.carCatalogService = carCatalogService;
        this.favoriteService = favoriteService;
        this.reviewService = reviewService;
        this.userRepository = userRepository;
    }

    private User currentUserOrNull(Authentication auth) {
        if (auth == null || auth instanceof AnonymousAuthenticationToken) return null;
        return userRepository.findByUsername(auth.getName()).orElse(null);
    }

    @GetMapping
    public String index(@ModelAttribute("criteria") CarSearchCriteria criteria,
                        Authentication authentication,
                        Model model) {
        List<Car> cars = carCatalogService.search(criteria);
        BigDecimal[] range = carCatalogService.priceRange();

        model.addAttribute("cars", cars);
        model.addAttribute("ratings", carCatalogService.averageRatings(cars));
        model.addAttribute("states", carCatalogService.states());
        model.addAttribute("categories", carCatalogService.activeCategories());
        model.addAttribute("minPrice", range[0]);
        model.addAttribute("maxPrice", range[1]);
        model.addAttribute("favoriteIds", favoriteService.favoriteCarIds(currentUserOrNull(authentication)));
        model.addAttribute("activePage", "cars");
        return "cars";
    }

    @GetMapping("/{id}")
    public String details(@PathVariable Long id, Authentication authentication, Model model) {
        CarDetails details = carCatalogService.details(id);
        User user = currentUserOrNull(authentication);

        model.addAttribute("details", details);
        model.addAttribute("car", details.getCar());
        model.addAttribute("isFavorited", favoriteService.isFavorited(user, id));
        model.addAttribute("canReview", user != null && reviewService.hasCompletedRental(user, id)
                && reviewService.findOwn(user, id).isEmpty());
        model.addAttribute("ownReview", user == null ? null : reviewService.findOwn(user, id).orElse(null));
        model.addAttribute("activePage", "cars");
        return "car-details";
    }
}
