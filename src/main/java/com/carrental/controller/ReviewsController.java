package com.carrental.controller;

import com.carrental.dto.ReviewRowDto;
import com.carrental.exception.BusinessException;
import com.carrental.model.Review;
import com.carrental.model.User;
import com.carrental.repository.UserRepository;
import com.carrental.service.ReviewService;
import org.springframework.security.core.Authentication;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.support.RedirectAttributes;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Controller
@RequestMapping("/reviews")
public class ReviewsController {

    private final ReviewService reviewService;
    private final UserRepository userRepository;

    public ReviewsController(ReviewService reviewService, UserRepository userRepository) {
        this.reviewService = reviewService;
        this.userRepository = userRepository;
    }

    private User currentUser(Authentication authentication) {
        return userRepository.findByUsername(authentication.getName()).orElseThrow();
    }

    @GetMapping
    @ResponseBody
    public Map<String, Object> approved(@RequestParam(required = false) Long carId) {
        List<ReviewRowDto> reviews = reviewService.listApproved(carId).stream().map(ReviewRowDto::new).toList();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("reviews", reviews);
        if (carId != null) {
            body.put("averageRating", reviewService.averageRating(carId));
            body.put("reviewCount", reviewService.reviewCount(carId));
        }
        return body;
    }

    @PostMapping
    public String create(Authentication authentication,
                         @RequestParam Long carId,
                         @RequestParam int rating,
                         @RequestParam(required = false) String comment,
                         RedirectAttributes redirectAttributes) {
        User user = currentUser(authentication);
        Optional<Review> existing = reviewService.findOwn(user, carId);
        if (existing.isPresent()) {
            redirectAttributes.addFlashAttribute("infoMessage", "You have already reviewed this vehicle. You can edit your review below.");
            return "redirect:/cars/" + carId + "#review-" + existing.get().getId();
        }
        try {
            reviewService.create(user, carId, rating, comment);
            redirectAttributes.addFlashAttribute("successMessage",
                    "Thank you for your review! It will be visible after approval.");
        } catch (BusinessException e) {
            redirectAttributes.addFlashAttribute("errorMessage", e.getMessage());
        }
        return "redirect:/cars/" + carId;
    }

    @PostMapping("/{id}/edit")
    public String edit(@PathVariable Long id,
                       Authentication authentication,
                       @RequestParam int rating,
                       @RequestParam(required = false) String comment,
                       RedirectAttributes redirectAttributes) {
        Review r = reviewService.edit(id, currentUser(authentication), rating, comment);
        redirectAttributes.addFlashAttribute("successMessage", "Your review was updated and is awaiting approval.");
        return "redirect:/cars/" + r.getCar().getId();
    }

    @PostMapping("/{id}/approve")
    @ResponseBody
    public Map<String, Object> approve(@PathVariable Long id) {
        reviewService.setApproved(id, true);
        return Map.of("success", true, "message", "Review approved.");
    }

    @PostMapping("/{id}/reject")
    @ResponseBody
    public Map<String, Object> reject(@PathVariable Long id) {
        reviewService.setApproved(id, false);
        return Map.of("success", true, "message", "Review rejected.");
    }

    @PostMapping("/{id}/delete")
    @ResponseBody
    public Map<String, Object> delete(@PathVariable Long id, Authentication authentication) {
        reviewService.delete(id, currentUser(authentication));
        return Map.of("success", true, "message", "Review deleted.");
    }
}
