package com.carrental.controller;

import com.carrental.dto.RegistrationForm;
import com.carrental.exception.BusinessException;
import com.carrental.model.User;
import com.carrental.repository.UserRepository;
import com.carrental.service.AccountService;
import com.carrental.service.CaptchaService;
import com.carrental.service.FileUploadService;
import jakarta.servlet.http.HttpSession;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.core.Authentication;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.validation.BindingResult;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.servlet.mvc.support.RedirectAttributes;

import java.io.IOException;
import java.util.Map;

@Controller
public class AccountController {

    private static final Logger logger = LoggerFactory.getLogger(AccountController.class);

    private final AccountService accountService;
    private final CaptchaService captchaService;
    private final FileUploadService fileUploadService;
    private final UserRepository userRepository;

    public AccountController(AccountService accountService,
                             CaptchaService captchaService,
                             FileUploadService fileUploadService,
                             UserRepository userRepository) {
        this.accountService = accountService;
        this.captchaService = captchaService;
        this.fileUploadService = fileUploadService;
        this.userRepository = userRepository;
    }

    @GetMapping("/register")
    public String registerForm(Model model) {
        if (!model.containsAttribute("form")) {
            model.addAttribute("form", new RegistrationForm());
        }
        model.addAttribute("activePage", "register");
        return "register";
    }

    @PostMapping("/register")
    public String register(@Valid @ModelAttribute("form") RegistrationForm form,
                           BindingResult bindingResult,
                           HttpSession session,
                           Model model,
                           RedirectAttributes redirectAttributes) {
        String expected = (String) session.getAttribute(CaptchaService.SESSION_KEY);
        // one attempt per image
        session.removeAttribute(CaptchaService.SESSION_KEY);

        if (!captchaService.validate(form.getCaptcha(), expected)) {
            bindingResult.reject("captcha", "The security code is incorrect. Please try again.");
        }
        if (bindingResult.hasErrors()) {
            model.addAttribute("activePage", "register");
            return "register";
        }
        try {
            accountService.registerCustomer(form);
        } catch (BusinessException e) {
            model.addAttribute("errorMessage", e.getMessage());
            model.addAttribute("activePage", "register");
            return "register";
        }
        redirectAttributes.addFlashAttribute("successMessage", "Registration successful. Please sign in.");
        return "redirect:/login";
    }

    @PostMapping("/account/profile-picture")
    @ResponseBody
    public Map<String, Object> uploadProfilePicture(Authentication authentication,
                                                    @RequestParam("file") MultipartFile file) throws IOException {
        User user = userRepository.findByUsername(authentication.getName()).orElseThrow();
        String previous = user.getProfilePictureUrl();
        String url = fileUploadService.uploadProfilePicture(file, user.getId());
        accountService.updateProfilePicture(user, url);
        if (previous != null && !fileUploadService.deleteFile(previous)) {
            logger.warn("Previous profile picture {} was already gone", previous);
        }
        return Map.of("success", true, "url", url);
    }
}
