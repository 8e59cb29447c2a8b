package com.carrental.it;

import com.carrental.model.*;
import com.carrental.repository.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.security.test.context.support.WithMockUser;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.*;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.closeTo;
import static org.mockito.Mockito.when;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.csrf;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
@Transactional
@ActiveProfiles("test")
@WithMockUser(username = StaffOperationsIntegrationTest.STAFF, roles = "STAFF")
class StaffOperationsIntegrationTest {

    static final String STAFF = "staff@example.com";

    @Autowired MockMvc mvc;

    @Autowired AppointmentRepository appointmentRepo;
    @Autowired PaymentRepository paymentRepo;
    @Autowired NotificationRepository notificationRepo;
    @Autowired CarRepository carRepo;
    @Autowired UserRepository userRepo;
    @Autowired PromotionRepository promotionRepo;

    @MockBean Clock clock;

    private final ZoneId zone = ZoneId.of("Asia/Kuala_Lumpur");
    private final LocalDateTime now = LocalDateTime.of(2025, 3, 3, 9, 0);

    private User customer;
    private Car car;
    private Appointment booking;

    @BeforeEach
    void setUp() {
        when(clock.getZone()).thenReturn(zone);
        when(clock.instant()).thenReturn(now.atZone(zone).toInstant());

        userRepo.save(Fixtures.user(STAFF, User.ROLE_STAFF));
        customer = userRepo.save(Fixtures.user("gina@example.com", User.ROLE_CUSTOMER));
        car = carRepo.save(Fixtures.car("Mazda", "CX-5", "JQK5555", "250.00"));

        Appointment a = Fixtures.appointment(car, customer, now.plusDays(3), now.plusDays(5), AppointmentStatus.CONFIRMED, "500.00");
        a.setCreatedAt(now.minusDays(1));
        booking = appointmentRepo.save(a);
    }

    @Test
    void orders_filterByStatusAndSearch() throws Exception {
        Appointment pending = Fixtures.appointment(car, customer, now.plusDays(10), now.plusDays(11), AppointmentStatus.PENDING, "250.00");
        appointmentRepo.save(pending);

        mvc.perform(get("/staff/orders").param("status", "Confirmed"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].id").value(booking.getId()));

        mvc.perform(get("/staff/orders").param("search", "cx-5"))
                .andExpect(jsonPath("$.length()").value(2));
    }

    @Test
    void cancellingPaidBooking_refundsAndNotifies() throws Exception {
        Payment p = paymentRepo.save(Fixtures.payment(booking, Payment.METHOD_CREDIT_CARD, PaymentStatus.COMPLETED, now.minusDays(1)));

        mvc.perform(post("/staff/orders/{id}/status", booking.getId()).param("status", "Cancelled").with(csrf()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("CANCELLED"));

        assertThat(paymentRepo.findById(p.getId()).orElseThrow().getStatus()).isEqualTo(PaymentStatus.REFUNDED);
        assertThat(notificationRepo.findByUserIdOrderByCreatedAtDesc(customer.getId()))
                .extracting(Notification::getTitle)
                .contains("Refund Processed", "Booking Cancelled");
    }

    @Test
    void batchStatus_skipsUnknownIds() throws Exception {
        mvc.perform(post("/staff/orders/batch-status")
                        .param("ids", booking.getId().toString(), "999999")
                        .param("status", "COMPLETED")
                        .with(csrf()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.updated").value(1));

        assertThat(appointmentRepo.findById(booking.getId()).orElseThrow().getStatus())
                .isEqualTo(AppointmentStatus.COMPLETED);
    }

    @Test
    void reschedule_intoAnotherBooking_isRejectedWithErrors() throws Exception {
        appointmentRepo.save(Fixtures.appointment(car, customer, now.plusDays(8), now.plusDays(9), AppointmentStatus.PENDING, "250.00"));

        mvc.perform(post("/staff/orders/{id}/reschedule", booking.getId())
                        .param("startDate", now.plusDays(7).toString())
                        .param("endDate", now.plusDays(9).toString())
                        .with(csrf()))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors", hasItem("2024 Mazda CX-5 - JQK5555 is not available for the selected dates.")));

        mvc.perform(post("/staff/orders/{id}/reschedule", booking.getId())
                        .param("startDate", now.plusDays(4).toString())
                        .param("endDate", now.plusDays(7).toString())
                        .with(csrf()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalPrice").value(750.0));
    }

    @Test
    void reschedule_keepsDiscountOfSingleUsePromotion() throws Exception {
        Promotion once = Fixtures.promotion("ONCE10", "10", now.minusDays(10), now.plusDays(10));
        once.setMaxUses(1);
        once.setCurrentUses(1);
        once = promotionRepo.save(once);
        booking.setPromotion(once);
        booking.setTotalPrice(new BigDecimal("450.00"));
        booking.setDiscountAmount(new BigDecimal("50.00"));
        appointmentRepo.save(booking);

        mvc.perform(post("/staff/orders/{id}/reschedule", booking.getId())
                        .param("startDate", now.plusDays(4).toString())
                        .param("endDate", now.plusDays(6).toString())
                        .with(csrf()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalPrice").value(450.0));

        Appointment moved = appointmentRepo.findById(booking.getId()).orElseThrow();
        assertThat(moved.getTotalPrice()).isEqualByComparingTo("450.00");
        assertThat(moved.getDiscountAmount()).isEqualByComparingTo("50.00");
        assertThat(moved.getStartDate()).isEqualTo(now.plusDays(4));
    }

    @Test
    void deletingPaidBooking_removesItsPayments() throws Exception {
        Payment p = paymentRepo.save(Fixtures.payment(booking, Payment.METHOD_CREDIT_CARD, PaymentStatus.COMPLETED, now.minusDays(1)));
        paymentRepo.save(Fixtures.payment(booking, Payment.METHOD_PAYPAL, PaymentStatus.FAILED, now.minusDays(2)));
        notificationRepo.save(notification(customer, "Booking Confirmed"));

        mvc.perform(post("/staff/orders/{id}/delete", booking.getId()).with(csrf()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true));

        appointmentRepo.flush();
        assertThat(appointmentRepo.findById(booking.getId())).isEmpty();
        assertThat(paymentRepo.findById(p.getId())).isEmpty();
        assertThat(paymentRepo.findByAppointmentId(booking.getId())).isEmpty();
        assertThat(notificationRepo.findByUserIdOrderByCreatedAtDesc(customer.getId())).hasSize(1);
    }

    private Notification notification(User user, String title) {
        Notification n = new Notification();
        n.setUser(user);
        n.setTitle(title);
        n.setMessage(title);
        n.setType(NotificationType.SUCCESS);
        n.setCreatedAt(now);
        return n;
    }

    @Test
    void calendar_colorsByStatus() throws Exception {
        mvc.perform(get("/staff/calendar").param("from", "2025-03-01").param("to", "2025-03-31"))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$[0].color").value("#28a745"))
                .andExpect(jsonPath("$[0].title").value("Mazda CX-5 - " + customer.getFullName()));
    }

    @Test
    void revenueReport_zeroFillsDays() throws Exception {
        mvc.perform(get("/staff/reports/revenue").param("from", "2025-03-01").param("to", "2025-03-03"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.bookings").value(1))
                .andExpect(jsonPath("$.revenue").value(closeTo(500.0, 0.001)))
                .andExpect(jsonPath("$.byDay['2025-03-01']").value(0))
                .andExpect(jsonPath("$.byDay['2025-03-02']").value(closeTo(500.0, 0.001)))
                .andExpect(jsonPath("$.byDay['2025-03-03']").value(0));

        mvc.perform(get("/staff/reports/revenue").param("from", "2025-03-05").param("to", "2025-03-01"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void dashboardStats_countBookingsAndRevenue() throws Exception {
        mvc.perform(get("/staff/dashboard/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalBookings").value(1))
                .andExpect(jsonPath("$.confirmedBookings").value(1))
                .andExpect(jsonPath("$.monthlyRevenue").value(closeTo(500.0, 0.001)))
                .andExpect(jsonPath("$.totalCustomers").value(1))
                .andExpect(jsonPath("$.recentBookings[0].carName").value(car.getDisplayName()));
    }

    @Test
    void vehicles_createToggleAndList() throws Exception {
        mvc.perform(post("/staff/vehicles")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"make":"Kia","model":"EV6","year":2024,"licensePlate":"EV6006",
                                 "dailyRate":300.00,"fuelType":"Electric","electric":true,"state":"Penang"}
                                """)
                        .with(csrf()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").exists())
                .andExpect(jsonPath("$.available").value(true));

        mvc.perform(post("/staff/vehicles/{id}/toggle", car.getId()).with(csrf()))
                .andExpect(jsonPath("$.available").value(false));

        mvc.perform(get("/staff/vehicles").param("availability", "unavailable"))
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].licensePlate").value("JQK5555"));

        mvc.perform(post("/staff/vehicles")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"make":"Kia","model":"EV6","year":2024,"licensePlate":"ev6006","dailyRate":300.00}
                                """)
                        .with(csrf()))
                .andExpect(status().isBadRequest());
    }

    @Test
    void customers_listAndToggle() throws Exception {
        mvc.perform(get("/staff/customers").param("search", "gina"))
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].bookingCount").value(1));

        mvc.perform(post("/staff/customers/{id}/toggle", customer.getId()).with(csrf()))
                .andExpect(jsonPath("$.enabled").value(false));

        User staff = userRepo.findByUsername(STAFF).orElseThrow();
        mvc.perform(post("/staff/customers/{id}/toggle", staff.getId()).with(csrf()))
                .andExpect(status().isBadRequest());
    }
}
