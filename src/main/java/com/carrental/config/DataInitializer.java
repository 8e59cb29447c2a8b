package com.carrental.config;

import com.carrental.model.*;
import com.carrental.repository.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Seeds reference data once the application is up. Each table is only filled while it is empty.
 */
@Component
@ConditionalOnProperty(name = "app.seed.enabled", havingValue = "true")
public class DataInitializer {

    private static final Logger logger = LoggerFactory.getLogger(DataInitializer.class);

    private final CategoryRepository categoryRepository;
    private final CarRepository carRepository;
    private final PromotionRepository promotionRepository;
    private final SubscriptionRepository subscriptionRepository;
    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final Clock clock;

    @Value("${app.seed.default-password:Password1}")
    private String defaultPassword;

    public DataInitializer(CategoryRepository categoryRepository,
                           CarRepository carRepository,
                           PromotionRepository promotionRepository,
                           SubscriptionRepository subscriptionRepository,
                           UserRepository userRepository,
                           PasswordEncoder passwordEncoder,
                           Clock clock) {
        this.categoryRepository = categoryRepository;
        this.carRepository = carRepository;
        this.promotionRepository = promotionRepository;
        this.subscriptionRepository = subscriptionRepository;
        this.userRepository = userRepository;
        this.passwordEncoder = passwordEncoder;
        this.clock = clock;
    }

    @EventListener(ApplicationReadyEvent.class)
    @Transactional
    public void seed() {
        try {
            Map<String, Category> categories = seedCategories();
            seedCars(categories);
            seedPromotions();
            seedSubscriptions();
            seedUsers();
        } catch (RuntimeException e) {
            logger.error("Seeding reference data failed", e);
            throw e;
        }
    }

    private Map<String, Category> seedCategories() {
        Map<String, Category> byName = new HashMap<>();
        if (categoryRepository.count() == 0) {
            category("Sedan", "Comfortable everyday cars");
            category("SUV", "Space for family and luggage");
            category("Compact", "Easy to park, easy on fuel");
            category("Electric", "Zero-emission driving");
            category("Luxury", "Premium comfort and performance");
            logger.info("Seeded categories");
        }
        categoryRepository.findAll().forEach(c -> byName.put(c.getName(), c));
        return byName;
    }

    private void category(String name, String description) {
        Category c = new Category();
        c.setName(name);
        c.setDescription(description);
        c.setActive(true);
        categoryRepository.save(c);
    }

    private void seedCars(Map<String, Category> categories) {
        if (carRepository.count() > 0) return;
        car("Perodua", "Myvi", 2023, "WXY1234", "Red", "120.00", Car.FUEL_GAS, "Kuala Lumpur", "Kuala Lumpur", categories.get("Compact"), null, null, null);
        car("Proton", "X50", 2024, "VBN5678", "White", "220.00", Car.FUEL_GAS, "Selangor", "Petaling Jaya", categories.get("SUV"), null, null, null);
        car("Honda", "City", 2022, "WQA4321", "Silver", "160.00", Car.FUEL_GAS, "Kuala Lumpur", "Kuala Lumpur", categories.get("Sedan"), null, null, null);
        car("Toyota", "Camry Hybrid", 2023, "PKL8899", "Black", "280.00", Car.FUEL_HYBRID, "Penang", "George Town", categories.get("Sedan"), null, null, null);
        car("BYD", "Atto 3", 2024, "EV1001", "Blue", "250.00", Car.FUEL_ELECTRIC, "Kuala Lumpur", "Kuala Lumpur", categories.get("Electric"), 60, 420, 45);
        car("Tesla", "Model 3", 2024, "EV2002", "White", "380.00", Car.FUEL_ELECTRIC, "Selangor", "Shah Alam", categories.get("Electric"), 75, 510, 30);
        car("Hyundai", "Ioniq 5", 2023, "EV3003", "Grey", "330.00", Car.FUEL_ELECTRIC, "Johor", "Johor Bahru", categories.get("Electric"), 72, 480, 18);
        car("BMW", "5 Series", 2023, "WLX5555", "Black", "550.00", Car.FUEL_GAS, "Kuala Lumpur", "Kuala Lumpur", categories.get("Luxury"), null, null, null);
        logger.info("Seeded {} vehicles", carRepository.count());
    }

    private void car(String make, String model, int year, String plate, String color, String rate, String fuel,
                     String state, String city, Category category, Integer batteryKwh, Integer rangeKm, Integer chargeMinutes) {
        Car c = new Car();
        c.setMake(make);
        c.setModel(model);
        c.setYear(year);
        c.setLicensePlate(plate);
        c.setColor(color);
        c.setDailyRate(new BigDecimal(rate));
        c.setFuelType(fuel);
        c.setElectric(Car.FUEL_ELECTRIC.equals(fuel));
        c.setAvailable(true);
        c.setState(state);
        c.setCity(city);
        c.setCategory(category);
        c.setBatteryCapacity(batteryKwh);
        c.setRange(rangeKm);
        c.setChargingTime(chargeMinutes);
        c.setDescription(year + " " + make + " " + model + " in " + color.toLowerCase());
        c.setCreatedAt(LocalDateTime.now(clock));
        carRepository.save(c);
    }

    private void seedPromotions() {
        if (promotionRepository.count() > 0) return;
        LocalDateTime now = LocalDateTime.now(clock);
        promotion("Welcome Discount", "WELCOME10", "10", "50.00", false, null, now);
        promotion("Go Electric", "EVGREEN20", "20", "150.00", true, null, now);
        promotion("Weekend Flash", "FLASH15", "15", null, false, 100, now);
        logger.info("Seeded promotions");
    }

    private void promotion(String name, String code, String pct, String cap, boolean evOnly, Integer maxUses, LocalDateTime now) {
        Promotion p = new Promotion();
        p.setName(name);
        p.setDescription(name + " - " + pct + "% off");
        p.setCode(code);
        p.setDiscountPercentage(new BigDecimal(pct));
        p.setMaxDiscountAmount(cap == null ? null : new BigDecimal(cap));
        p.setStartDate(now.minusDays(1));
        p.setEndDate(now.plusMonths(6));
        p.setActive(true);
        p.setEvOnly(evOnly);
        p.setMaxUses(maxUses);
        p.setCreatedAt(now);
        promotionRepository.save(p);
    }

    private void seedSubscriptions() {
        if (subscriptionRepository.count() > 0) return;
        subscription("Basic", "29.90", "5", 2, 3, false);
        subscription("Premium", "79.90", "10", 5, 7, false);
        subscription("EV Elite", "129.90", "15", null, 14, true);
        logger.info("Seeded subscriptions");
    }

    private void subscription(String name, String price, String pct, Integer rentals, Integer days, boolean evPriority) {
        Subscription s = new Subscription();
        s.setName(name);
        s.setDescription(name + " membership");
        s.setMonthlyPrice(new BigDecimal(price));
        s.setDiscountPercentage(new BigDecimal(pct));
        s.setMaxRentalsPerMonth(rentals);
        s.setMaxDaysPerRental(days);
        s.setEvPriority(evPriority);
        s.setActive(true);
        s.setCreatedAt(LocalDateTime.now(clock));
        subscriptionRepository.save(s);
    }

    private void seedUsers() {
        if (userRepository.count() > 0) return;
        for (String role : List.of(User.ROLE_MANAGER, User.ROLE_STAFF, User.ROLE_CUSTOMER)) {
            User u = new User();
            u.setUsername(role.toLowerCase() + "@carrental.local");
            u.setPassword(passwordEncoder.encode(defaultPassword));
            u.setRole(role);
            u.setEnabled(true);
            u.setFirstName(role.charAt(0) + role.substring(1).toLowerCase());
            u.setLastName("User");
            u.setCreatedAt(LocalDateTime.now(clock));
            userRepository.save(u);
        }
        logger.info("Seeded default accounts (manager, staff, customer)");
    }
}
