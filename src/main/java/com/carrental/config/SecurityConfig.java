package com.carrental.config;

import com.carrental.service.CustomAuthenticationSuccessHandler;
import com.carrental.service.CustomUserDetailsService;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.authentication.AuthenticationManager;
import org.springframework.security.authentication.dao.DaoAuthenticationProvider;
import org.springframework.security.config.annotation.authentication.configuration.AuthenticationConfiguration;
import org.springframework.security.config.annotation.method.configuration.EnableMethodSecurity;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.web.SecurityFilterChain;

@Configuration
@EnableMethodSecurity // enables @PreAuthorize in controllers/services
public class SecurityConfig {

    private final CustomUserDetailsService userDetailsService;
    private final CustomAuthenticationSuccessHandler customAuthenticationSuccessHandler;

    public SecurityConfig(CustomUserDetailsService userDetailsService,
                          CustomAuthenticationSuccessHandler customAuthenticationSuccessHandler) {
        this.userDetailsService = userDetailsService;
        this.customAuthenticationSuccessHandler = customAuthenticationSuccessHandler;
    }

    @Bean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder();
    }

    @Bean
    public DaoAuthenticationProvider authenticationProvider() {
        DaoAuthenticationProvider provider = new DaoAuthenticationProvider();
        provider.setUserDetailsService(userDetailsService);
        provider.setPasswordEncoder(passwordEncoder());
        return provider;
    }

    @Bean
    public AuthenticationManager authenticationManager(AuthenticationConfiguration config) throws Exception {
        return config.getAuthenticationManager();
    }

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        http
                .authorizeHttpRequests(auth -> auth
                        // Public pages, catalog & static assets
                        .requestMatchers("/", "/login", "/register", "/about", "/captcha",
                                "/cars", "/cars/**", "/ev-hub", "/ev-hub/**",
                                "/uploads/**", "/css/**", "/js/**", "/images/**", "/error").permitAll()

                        // Booking form helpers are callable before sign-in
                        .requestMatchers(HttpMethod.GET, "/appointments/slots", "/appointments/quote",
                                "/appointments/validate-promotion").permitAll()
                        .requestMatchers(HttpMethod.GET, "/promotions", "/subscriptions", "/subscriptions/*/details",
                                "/reviews").permitAll()

                        // Management areas
                        .requestMatchers("/manager/**").hasRole("MANAGER")
                        .requestMatchers("/staff/**").hasAnyRole("STAFF", "MANAGER")
                        .requestMatchers("/promotions/**", "/subscriptions/**").hasAnyRole("STAFF", "MANAGER")
                        .requestMatchers(HttpMethod.POST, "/payments/*/status",
                                "/reviews/*/approve", "/reviews/*/reject").hasAnyRole("STAFF", "MANAGER")

                        // Customer area
                        .requestMatchers("/appointments/**", "/appointments").hasRole("CUSTOMER")

                        // Favorites, payments, notifications, reviews, account
                        .anyRequest().authenticated()
                )

                .formLogin(form -> form
                        .loginPage("/login")
                        .failureUrl("/login?error=true")
                        .successHandler(customAuthenticationSuccessHandler)
                        .permitAll()
                )

                .logout(logout -> logout
                        .logoutSuccessUrl("/?logout")
                        .permitAll()
                );

        return http.build();
    }
}
