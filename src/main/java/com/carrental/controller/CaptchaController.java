package com.carrental.controller;

import com.carrental.service.CaptchaService;
import jakarta.servlet.http.HttpSession;
import org.springframework.http.CacheControl;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.GetMapping;

import java.io.IOException;

@Controller
public class CaptchaController {

    private final CaptchaService captchaService;

    public CaptchaController(CaptchaService captchaService) {
        this.captchaService = captchaService;
    }

    // New code on every request; the registration form checks against the latest one
    @GetMapping("/captcha")
    public ResponseEntity<byte[]> captcha(HttpSession session) throws IOException {
        String code = captchaService.generateCode();
        session.setAttribute(CaptchaService.SESSION_KEY, code);
        return ResponseEntity.ok()
                .cacheControl(CacheControl.noStore())
                .contentType(MediaType.IMAGE_PNG)
                .body(captchaService.renderPng(code));
    }
}
