package com.carrental.controller;

import com.carrental.dto.RegistrationForm;
import com.carrental.dto.UserRowDto;
import com.carrental.model.User;
import com.carrental.repository.UserRepository;
import com.carrental.service.AccountService;
import jakarta.validation.Valid;
import org.springframework.security.core.Authentication;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@Controller
@RequestMapping("/manager")
public class ManagerController {

    private final AccountService accountService;
    private final UserRepository userRepository;

    public ManagerController(AccountService accountService, UserRepository userRepository) {
        this.accountService = accountService;
        this.userRepository = userRepository;
    }

    private User currentUser(Authentication authentication) {
        return userRepository.findByUsername(authentication.getName()).orElseThrow();
    }

    // ---------------- Staff ----------------

    @GetMapping("/staff")
    @ResponseBody
    public List<UserRowDto> staff() {
        return accountService.listStaff();
    }

    @PostMapping("/staff")
    @ResponseBody
    public UserRowDto createStaff(@Valid @RequestBody RegistrationForm form) {
        return new UserRowDto(accountService.createStaff(form), 0);
    }

    @PostMapping("/staff/{id}/toggle")
    @ResponseBody
    public Map<String, Object> toggleStaff(@PathVariable Long id, Authentication authentication) {
        User u = accountService.toggleStaffEnabled(id, currentUser(authentication));
        return Map.of("success", true, "enabled", u.isEnabled());
    }

    @PostMapping("/staff/{id}/delete")
    @ResponseBody
    public Map<String, Object> deleteStaff(@PathVariable Long id, Authentication authentication) {
        accountService.deleteStaff(id, currentUser(authentication));
        return Map.of("success", true);
    }

    // ---------------- All users ----------------

    @GetMapping("/users")
    @ResponseBody
    public List<UserRowDto> users(@RequestParam(value = "search", required = false) String search,
                                  @RequestParam(value = "role", required = false) String role,
                                  @RequestParam(value = "status", required = false) String status) {
        return accountService.listUsers(search, role, status);
    }

    @PostMapping("/users/{id}/toggle")
    @ResponseBody
    public Map<String, Object> toggleUser(@PathVariable Long id, Authentication authentication) {
        User u = accountService.toggleEnabled(id, currentUser(authentication));
        return Map.of("success", true, "enabled", u.isEnabled());
    }

    @PostMapping("/users/{id}/delete")
    @ResponseBody
    public Map<String, Object> deleteUser(@PathVariable Long id, Authentication authentication) {
        accountService.deleteUser(id, currentUser(authentication));
        return Map.of("success", true);
    }
}
