package com.carrental.controller;

import com.carrental.model.Promotion;
import com.carrental.service.PromotionService;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@Controller
@RequestMapping("/promotions")
public class PromotionsController {

    private final PromotionService promotionService;

    public PromotionsController(PromotionService promotionService) {
        this.promotionService = promotionService;
    }

    // Public: promotions usable right now
    @GetMapping
    @ResponseBody
    public List<Promotion> active() {
        return promotionService.listActive();
    }

    // ---------------- Staff management ----------------

    @GetMapping("/manage")
    @ResponseBody
    public List<Promotion> all() {
        return promotionService.listAll();
    }

    @GetMapping("/manage/{id}")
    @ResponseBody
    public Promotion get(@PathVariable Long id) {
        return promotionService.getById(id);
    }

    @PostMapping
    @ResponseBody
    public Promotion create(@RequestBody Promotion promotion) {
        promotion.setId(null);
        return promotionService.create(promotion);
    }

    @PostMapping("/{id}")
    @ResponseBody
    public Promotion update(@PathVariable Long id, @RequestBody Promotion promotion) {
        return promotionService.update(id, promotion);
    }

    @PostMapping("/{id}/toggle")
    @ResponseBody
    public Map<String, Object> toggle(@PathVariable Long id) {
        Promotion p = promotionService.toggleActive(id);
        return Map.of("success", true, "active", p.isActive());
    }

    @PostMapping("/{id}/delete")
    @ResponseBody
    public Map<String, Object> delete(@PathVariable Long id) {
        promotionService.delete(id);
        return Map.of("success", true);
    }
}
