package com.carrental.controller;

import com.carrental.dto.CarSearchCriteria;
import com.carrental.service.CarCatalogService;
import com.carrental.service.PromotionService;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.web.bind.annotation.GetMapping;

@Controller
public class HomeController {

    private static final int FEATURED_CARS = 6;

    private final CarCatalogService carCatalogService;
    private final PromotionService promotionService;

    public HomeController(CarCatalogService carCatalogService, PromotionService promotionService) {
        this.carCatalogService = carCatalogService;
        this.promotionService = promotionService;
    }

    @GetMapping("/")
    public String home(Authentication auth, Model model) {
        // Staff land on their dashboard instead of the public landing page
        if (auth != null && auth.isAuthenticated() && !(auth instanceof AnonymousAuthenticationToken)) {
            var roles = auth.getAuthorities().toString();
            if (roles.contains("ROLE_STAFF") || roles.contains("ROLE_MANAGER")) {
                return "redirect:/staff/dashboard";
            }
        }
        model.addAttribute("featuredCars", carCatalogService.search(new CarSearchCriteria()).stream().limit(FEATURED_CARS).toList());
        model.addAttribute("promotions", promotionService.listActive());
        model.addAttribute("activePage", "home");
        return "landing";
    }

    @GetMapping("/login")
    public String login(Model model) {
        model.addAttribute("activePage", "login");
        return "login";
    }
}
