package com.carrental.controller;

import com.carrental.model.Car;
import com.carrental.service.CarCatalogService;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Controller
@RequestMapping("/ev-hub")
public class EvHubController {

    private final CarCatalogService carCatalogService;

    public EvHubController(CarCatalogService carCatalogService) {
        this.carCatalogService = carCatalogService;
    }

    @GetMapping
    @ResponseBody
    public List<Car> electricVehicles() {
        return carCatalogService.electricVehicles();
    }

    // e.g. /ev-hub/compare?ids=4,5,6
    @GetMapping("/compare")
    @ResponseBody
    public List<Car> compare(@RequestParam(name = "ids", required = false) List<Long> ids) {
        return carCatalogService.compare(ids);
    }
}
