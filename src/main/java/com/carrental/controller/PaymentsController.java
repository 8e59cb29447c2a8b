package com.carrental.controller;

import com.carrental.dto.PaymentRowDto;
import com.carrental.exception.BusinessException;
import com.carrental.model.Payment;
import com.carrental.model.PaymentStatus;
import com.carrental.model.User;
import com.carrental.repository.UserRepository;
import com.carrental.service.PaymentService;
import org.springframework.security.core.Authentication;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.support.RedirectAttributes;

import java.util.List;
import java.util.Locale;

@Controller
@RequestMapping("/payments")
public class PaymentsController {

    private final PaymentService paymentService;
    private final UserRepository userRepository;

    public PaymentsController(PaymentService paymentService, UserRepository userRepository) {
        this.paymentService = paymentService;
        this.userRepository = userRepository;
    }

    private User currentUser(Authentication authentication) {
        return userRepository.findByUsername(authentication.getName()).orElseThrow();
    }

    @GetMapping
    @ResponseBody
    public List<PaymentRowDto> myPayments(Authentication authentication) {
        return paymentService.listForCustomer(currentUser(authentication)).stream()
                .map(PaymentRowDto::new)
                .toList();
    }

    @PostMapping
    public String pay(Authentication authentication,
                      @RequestParam Long appointmentId,
                      @RequestParam String paymentMethod,
                      @RequestParam(required = false) String transactionId,
                      RedirectAttributes redirectAttributes) {
        try {
            Payment p = paymentService.create(appointmentId, paymentMethod, transactionId, currentUser(authentication));
            redirectAttributes.addFlashAttribute("successMessage",
                    p.getStatus() == PaymentStatus.COMPLETED
                            ? "Payment successful! Your booking is confirmed."
                            : "Payment recorded and awaiting processing.");
        } catch (BusinessException e) {
            redirectAttributes.addFlashAttribute("errorMessage", e.getMessage());
        }
        return "redirect:/appointments/" + appointmentId;
    }

    @GetMapping("/{id}")
    @ResponseBody
    public PaymentRowDto details(@PathVariable Long id, Authentication authentication) {
        return new PaymentRowDto(paymentService.getForViewer(id, currentUser(authentication)));
    }

    @PostMapping("/{id}/status")
    @ResponseBody
    public PaymentRowDto updateStatus(@PathVariable Long id, @RequestParam String status) {
        PaymentStatus newStatus = PaymentStatus.valueOf(status.trim().toUpperCase(Locale.ROOT));
        return new PaymentRowDto(paymentService.updateStatus(id, newStatus));
    }
}
