package com.carrental.controller;

import com.carrental.model.Subscription;
import com.carrental.service.SubscriptionService;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@Controller
@RequestMapping("/subscriptions")
public class SubscriptionsController {

    private final SubscriptionService subscriptionService;

    public SubscriptionsController(SubscriptionService subscriptionService) {
        this.subscriptionService = subscriptionService;
    }

    @GetMapping
    @ResponseBody
    public List<Subscription> active() {
        return subscriptionService.listActive();
    }

    @GetMapping("/{id}/details")
    @ResponseBody
    public Subscription details(@PathVariable Long id) {
        return subscriptionService.getById(id);
    }

    // ---------------- Staff management ----------------

    @GetMapping("/manage")
    @ResponseBody
    public List<Subscription> all() {
        return subscriptionService.listAll();
    }

    @PostMapping
    @ResponseBody
    public Subscription create(@RequestBody Subscription subscription) {
        subscription.setId(null);
        return subscriptionService.create(subscription);
    }

    @PostMapping("/{id}")
    @ResponseBody
    public Subscription update(@PathVariable Long id, @RequestBody Subscription subscription) {
        return subscriptionService.update(id, subscription);
    }

    @PostMapping("/{id}/toggle")
    @ResponseBody
    public Map<String, Object> toggle(@PathVariable Long id) {
        Subscription s = subscriptionService.toggleActive(id);
        return Map.of("success", true, "active", s.isActive());
    }

    @PostMapping("/{id}/delete")
    @ResponseBody
    public Map<String, Object> delete(@PathVariable Long id) {
        subscriptionService.delete(id);
        return Map.of("success", true);
    }
}
