package com.carrental.service;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.core.Authentication;
import org.springframework.security.web.authentication.AuthenticationSuccessHandler;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Sends staff and managers to the staff dashboard, customers to the catalog.
 */
@Component
public class CustomAuthenticationSuccessHandler implements AuthenticationSuccessHandler {

    private static final Logger logger = LoggerFactory.getLogger(CustomAuthenticationSuccessHandler.class);

    @Override
    public void onAuthenticationSuccess(HttpServletRequest request,
                                        HttpServletResponse response,
                                        Authentication authentication) throws IOException {
        String target = landingPageFor(authentication);
        logger.info("Login {} -> {}", authentication.getName(), target);
        response.sendRedirect(request.getContextPath() + target);
    }

    static String landingPageFor(Authentication authentication) {
        var roles = authentication.getAuthorities().toString();
        if (roles.contains("ROLE_STAFF") || roles.contains("ROLE_MANAGER")) {
            return "/staff/dashboard";
        }
        return "/cars";
    }
}
