package com.carrental.controller;

import com.carrental.dto.AppointmentRowDto;
import com.carrental.dto.PaymentRowDto;
import com.carrental.dto.ReviewRowDto;
import com.carrental.dto.UserRowDto;
import com.carrental.model.Appointment;
import com.carrental.model.AppointmentStatus;
import com.carrental.model.Car;
import com.carrental.model.User;
import com.carrental.repository.UserRepository;
import com.carrental.service.*;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.security.core.Authentication;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

@Controller
@RequestMapping("/staff")
public class StaffController {

    private final AppointmentService appointmentService;
    private final AnalyticsService analyticsService;
    private final AccountService accountService;
    private final CarCatalogService carCatalogService;
    private final ReviewService reviewService;
    private final PaymentService paymentService;
    private final FileUploadService fileUploadService;
    private final UserRepository userRepository;

    public StaffController(AppointmentService appointmentService,
                           AnalyticsService analyticsService,
                           AccountService accountService,
                           CarCatalogService carCatalogService,
                           ReviewService reviewService,
                           PaymentService paymentService,
                           FileUploadService fileUploadService,
                           UserRepository userRepository) {
        this.appointmentService = appointmentService;
        this.analyticsService = analyticsService;
        this.accountService = accountService;
        this.carCatalogService = carCatalogService;
        this.reviewService = reviewService;
        this.paymentService = paymentService;
        this.fileUploadService = fileUploadService;
        this.userRepository = userRepository;
    }

    private User currentUser(Authentication authentication) {
        return userRepository.findByUsername(authentication.getName()).orElseThrow();
    }

    // ---------------- Dashboard ----------------

    @GetMapping("/dashboard")
    public String dashboard(Model model) {
        model.addAttribute("stats", analyticsService.dashboardStats());
        model.addAttribute("activePage", "staff-dashboard");
        return "staff/dashboard";
    }

    @GetMapping("/dashboard/stats")
    @ResponseBody
    public Map<String, Object> dashboardStats() {
        return analyticsService.dashboardStats();
    }

    @GetMapping("/reports/revenue")
    @ResponseBody
    public Map<String, Object> revenueReport(
            @RequestParam("from") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam("to") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        if (to.isBefore(from)) {
            throw new IllegalArgumentException("The end date must not be before the start date.");
        }
        return analyticsService.revenueReport(from, to);
    }

    // ---------------- Orders (JSON consumed by the staff orders page) ----------------

    @GetMapping("/orders")
    @ResponseBody
    public List<AppointmentRowDto> orders(@RequestParam(value = "status", required = false) String status,
                                          @RequestParam(value = "search", required = false) String search) {
        return appointmentService.listForStaff(status, search);
    }

    @PostMapping("/orders/{id}/status")
    @ResponseBody
    public Map<String, Object> updateOrderStatus(@PathVariable Long id, @RequestParam String status) {
        Appointment a = appointmentService.updateStatus(id, AppointmentStatus.parse(status));
        return Map.of("success", true, "status", a.getStatus().name());
    }

    @PostMapping("/orders/batch-status")
    @ResponseBody
    public Map<String, Object> batchUpdateStatus(@RequestParam("ids") List<Long> ids, @RequestParam String status) {
        int updated = appointmentService.batchUpdateStatus(ids, AppointmentStatus.parse(status));
        return Map.of("success", true, "updated", updated);
    }

    @PostMapping("/orders/{id}/reschedule")
    @ResponseBody
    public AppointmentRowDto reschedule(
            @PathVariable Long id,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime startDate,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime endDate) {
        Appointment a = appointmentService.reschedule(id, startDate, endDate);
        return new AppointmentRowDto(a, appointmentService.latestPayment(id).orElse(null));
    }

    @PostMapping("/orders/{id}/delete")
    @ResponseBody
    public Map<String, Object> deleteOrder(@PathVariable Long id) {
        appointmentService.delete(id);
        return Map.of("success", true);
    }

    @GetMapping("/calendar")
    @ResponseBody
    public List<Map<String, Object>> calendar(
            @RequestParam("from") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam("to") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        return appointmentService.calendarEvents(from.atStartOfDay(), to.plusDays(1).atStartOfDay());
    }

    @GetMapping("/payments")
    @ResponseBody
    public List<PaymentRowDto> payments() {
        return paymentService.listAll().stream().map(PaymentRowDto::new).toList();
    }

    // ---------------- Customers ----------------

    @GetMapping("/customers")
    @ResponseBody
    public List<UserRowDto> customers(@RequestParam(value = "search", required = false) String search) {
        return accountService.listCustomers(search);
    }

    @GetMapping("/customers/{id}")
    @ResponseBody
    public Map<String, Object> customerDetails(@PathVariable Long id) {
        return accountService.customerDetails(id);
    }

    @PostMapping("/customers/{id}/toggle")
    @ResponseBody
    public Map<String, Object> toggleCustomer(@PathVariable Long id, Authentication authentication) {
        User u = accountService.toggleCustomerEnabled(id, currentUser(authentication));
        return Map.of("success", true, "enabled", u.isEnabled());
    }

    // ---------------- Vehicles ----------------

    @GetMapping("/vehicles")
    @ResponseBody
    public List<Car> vehicles(@RequestParam(value = "search", required = false) String search,
                              @RequestParam(value = "availability", required = false) String availability,
                              @RequestParam(value = "state", required = false) String state) {
        return carCatalogService.listForStaff(search, availability, state);
    }

    @PostMapping("/vehicles")
    @ResponseBody
    public Car createVehicle(@RequestBody Car car, @RequestParam(value = "categoryId", required = false) Long categoryId) {
        car.setId(null);
        return carCatalogService.create(car, categoryId);
    }

    @PostMapping("/vehicles/{id}")
    @ResponseBody
    public Car updateVehicle(@PathVariable Long id,
                             @RequestBody Car car,
                             @RequestParam(value = "categoryId", required = false) Long categoryId) {
        return carCatalogService.update(id, car, categoryId);
    }

    @PostMapping("/vehicles/{id}/toggle")
    @ResponseBody
    public Map<String, Object> toggleVehicle(@PathVariable Long id) {
        Car car = carCatalogService.toggleAvailability(id);
        return Map.of("success", true, "available", car.isAvailable());
    }

    @PostMapping("/vehicles/{id}/image")
    @ResponseBody
    public Map<String, Object> uploadVehicleImage(@PathVariable Long id,
                                                  @RequestParam("file") MultipartFile file) throws IOException {
        Car car = carCatalogService.getById(id);
        String previous = car.getImageUrl();
        String url = fileUploadService.uploadVehicleImage(file, id);
        carCatalogService.setImage(id, url);
        if (previous != null) {
            fileUploadService.deleteFile(previous);
        }
        return Map.of("success", true, "url", url);
    }

    // ---------------- Reviews moderation ----------------

    @GetMapping("/reviews")
    @ResponseBody
    public List<ReviewRowDto> reviews(@RequestParam(value = "status", defaultValue = "All") String status) {
        return reviewService.listForModeration(status).stream().map(ReviewRowDto::new).toList();
    }
}
