package com.carrental.controller;

import com.carrental.dto.BookingRequest;
import com.carrental.dto.PriceQuote;
import com.carrental.dto.TimeSlot;
import com.carrental.exception.BookingException;
import com.carrental.model.Appointment;
import com.carrental.model.AppointmentStatus;
import com.carrental.model.Car;
import com.carrental.model.Promotion;
import com.carrental.model.User;
import com.carrental.repository.UserRepository;
import com.carrental.service.*;
import jakarta.validation.Valid;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.Authentication;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.validation.BindingResult;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.support.RedirectAttributes;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.springframework.format.annotation.DateTimeFormat.ISO;

@Controller
@RequestMapping("/appointments")
public class AppointmentsController {

    private final AppointmentService appointmentService;
    private final CarCatalogService carCatalogService;
    private final PromotionService promotionService;
    private final SubscriptionService subscriptionService;
    private final CancelPolicyService cancelPolicyService;
    private final UserRepository userRepository;
    private final Clock clock;

    public AppointmentsController(AppointmentService appointmentService,
                                  CarCatalogService carCatalogService,
                                  PromotionService promotionService,
                                  SubscriptionService subscriptionService,
                                  CancelPolicyService cancelPolicyService,
                                  UserRepository userRepository,
                                  Clock clock) {
        this.appointmentService = appointmentService;
        this.carCatalogService = carCatalogService;
        this.promotionService = promotionService;
        this.subscriptionService = subscriptionService;
        this.cancelPolicyService = cancelPolicyService;
        this.userRepository = userRepository;
        this.clock = clock;
    }

    private User currentUser(Authentication authentication) {
        return userRepository.findByUsername(authentication.getName()).orElseThrow();
    }

    // ---------------- Pages ----------------

    @GetMapping
    public String index(Authentication authentication,
                        @RequestParam(value = "view", defaultValue = "Active") String view,
                        Model model) {
        User customer = currentUser(authentication);
        model.addAttribute("appointments", appointmentService.listForCustomer(customer, view));
        model.addAttribute("view", view);
        model.addAttribute("activePage", "appointments");
        return "appointments";
    }

    @GetMapping("/create")
    public String createForm(@RequestParam(value = "carId", required = false) Long carId, Model model) {
        BookingRequest form = model.containsAttribute("form")
                ? (BookingRequest) model.getAttribute("form")
                : new BookingRequest();
        if (form.getCarId() == null) {
            form.setCarId(carId);
        }
        if (form.getCarId() != null) {
            Car car = carCatalogService.getById(form.getCarId());
            model.addAttribute("car", car);
            model.addAttribute("slots", appointmentService.availableTimeSlots(car.getId(), null, null));
        }
        model.addAttribute("form", form);
        model.addAttribute("subscriptions", subscriptionService.listActive());
        model.addAttribute("promotions", promotionService.listActive());
        model.addAttribute("activePage", "appointments");
        return "appointment-form";
    }

    @PostMapping("/create")
    public String create(Authentication authentication,
                         @Valid @ModelAttribute("form") BookingRequest form,
                         BindingResult bindingResult,
                         RedirectAttributes redirectAttributes) {
        String back = "redirect:/appointments/create" + (form.getCarId() != null ? "?carId=" + form.getCarId() : "");
        if (bindingResult.hasErrors()) {
            redirectAttributes.addFlashAttribute("form", form);
            redirectAttributes.addFlashAttribute("errors", bindingResult.getAllErrors().stream()
                    .map(e -> e.getDefaultMessage()).toList());
            return back;
        }

        User customer = currentUser(authentication);
        try {
            Appointment created = appointmentService.create(form, customer);
            redirectAttributes.addFlashAttribute("successMessage",
                    "Booking created successfully! Please complete payment to confirm your booking.");
            return "redirect:/appointments/" + created.getId();
        } catch (BookingException e) {
            redirectAttributes.addFlashAttribute("form", form);
            redirectAttributes.addFlashAttribute("errors", e.getErrors());
            return back;
        }
    }

    @GetMapping("/{id}")
    public String details(@PathVariable Long id, Authentication authentication, Model model) {
        User customer = currentUser(authentication);
        Appointment appointment = appointmentService.getById(id);
        if (!appointment.isOwnedBy(customer)) {
            throw new AccessDeniedException("You can only view your own bookings.");
        }
        boolean cancellable = appointment.getStatus() != AppointmentStatus.CANCELLED
                && appointment.getStatus() != AppointmentStatus.COMPLETED;

        model.addAttribute("appointment", appointment);
        model.addAttribute("payment", appointmentService.latestPayment(id).orElse(null));
        model.addAttribute("cancellable", cancellable);
        model.addAttribute("freeCancellation", cancelPolicyService.isFreeCancellation(appointment, clock));
        model.addAttribute("activePage", "appointments");
        return "appointment-details";
    }

    @PostMapping("/{id}/cancel")
    public String cancel(@PathVariable Long id,
                         Authentication authentication,
                         RedirectAttributes redirectAttributes) {
        User customer = currentUser(authentication);
        try {
            boolean free = appointmentService.cancel(id, customer);
            redirectAttributes.addFlashAttribute("successMessage", free
                    ? "Booking cancelled successfully. Full refund will be processed."
                    : "Booking cancelled. Cancellation fee may apply as it's less than 48 hours before pickup.");
        } catch (BookingException e) {
            redirectAttributes.addFlashAttribute("errorMessage", e.getMessage());
        }
        return "redirect:/appointments";
    }

    @GetMapping("/{id}/rebook")
    public String rebook(@PathVariable Long id, Authentication authentication) {
        Car car = appointmentService.rebook(id, currentUser(authentication));
        return "redirect:/appointments/create?carId=" + car.getId();
    }

    // ---------------- JSON used by the booking form ----------------

    @GetMapping("/quote")
    @ResponseBody
    public Map<String, Object> quote(@RequestParam Long carId,
                                     @RequestParam @DateTimeFormat(iso = ISO.DATE_TIME) LocalDateTime startDate,
                                     @RequestParam @DateTimeFormat(iso = ISO.DATE_TIME) LocalDateTime endDate,
                                     @RequestParam(required = false) String promotionCode,
                                     @RequestParam(required = false) Long subscriptionId) {
        Long promotionId = promotionService.findByCode(promotionCode).map(Promotion::getId).orElse(null);
        PriceQuote q = appointmentService.quote(carId, startDate, endDate, promotionId, subscriptionId);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("days", q.getDays());
        body.put("dailyRate", q.getDailyRate());
        body.put("basePrice", q.getBasePrice());
        body.put("subscriptionDiscount", q.getSubscriptionDiscount());
        body.put("promotionDiscount", q.getPromotionDiscount());
        body.put("totalPrice", q.getTotalPrice());
        body.put("currency", "RM");
        body.put("available", appointmentService.isCarAvailable(carId, startDate, endDate, null));
        return body;
    }

    @GetMapping("/slots")
    @ResponseBody
    public List<TimeSlot> slots(@RequestParam Long carId,
                                @RequestParam(required = false) @DateTimeFormat(iso = ISO.DATE_TIME) LocalDateTime from,
                                @RequestParam(required = false) @DateTimeFormat(iso = ISO.DATE_TIME) LocalDateTime to) {
        return appointmentService.availableTimeSlots(carId, from, to);
    }

    @GetMapping("/validate-promotion")
    @ResponseBody
    public Map<String, Object> validatePromotion(@RequestParam String code, @RequestParam Long carId) {
        Car car = carCatalogService.getById(carId);
        PromotionService.Validation v = promotionService.validateCode(code, car.isElectric());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("valid", v.isValid());
        body.put("discount", v.isValid() ? v.getPromotion().getDiscountPercentage() : 0);
        body.put("promotionId", v.isValid() ? v.getPromotion().getId() : null);
        body.put("message", v.getMessage());
        return body;
    }
}
