package com.carrental.it;

import com.carrental.dto.BookingRequest;
import com.carrental.exception.BookingException;
import com.carrental.model.*;
import com.carrental.repository.*;
import com.carrental.service.AppointmentService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.security.test.context.support.WithMockUser;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.transaction.annotation.Transactional;

import java.time.*;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.allOf;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.startsWith;
import static org.mockito.Mockito.when;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.csrf;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
@Transactional
@ActiveProfiles("test")
@WithMockUser(username = AppointmentFlowIntegrationTest.EMAIL, roles = "CUSTOMER")
class AppointmentFlowIntegrationTest {

    static final String EMAIL = "alice@example.com";

    @Autowired MockMvc mvc;

    @Autowired AppointmentService appointmentService;
    @Autowired AppointmentRepository appointmentRepo;
    @Autowired PaymentRepository paymentRepo;
    @Autowired PromotionRepository promotionRepo;
    @Autowired NotificationRepository notificationRepo;
    @Autowired CarRepository carRepo;
    @Autowired UserRepository userRepo;

    // Mon 2025-03-03 09:00 in Kuala Lumpur
    @MockBean Clock clock;

    private final ZoneId zone = ZoneId.of("Asia/Kuala_Lumpur");
    private final LocalDateTime now = LocalDateTime.of(2025, 3, 3, 9, 0);

    private User customer;
    private Car car;

    @BeforeEach
    void setUp() {
        when(clock.getZone()).thenReturn(zone);
        when(clock.instant()).thenReturn(now.atZone(zone).toInstant());

        customer = userRepo.save(Fixtures.user(EMAIL, User.ROLE_CUSTOMER));
        car = carRepo.save(Fixtures.car("Perodua", "Myvi", "WAB1234", "150.00"));
    }

    private BookingRequest request(LocalDateTime start, LocalDateTime end, String promoCode) {
        BookingRequest r = new BookingRequest();
        r.setCarId(car.getId());
        r.setStartDate(start);
        r.setEndDate(end);
        r.setPromotionCode(promoCode);
        return r;
    }

    @Test
    void bookingThroughTheForm_isPricedAndPending() throws Exception {
        mvc.perform(post("/appointments/create")
                        .param("carId", car.getId().toString())
                        .param("startDate", "2025-03-10T10:00:00")
                        .param("endDate", "2025-03-12T10:00:00")
                        .param("specialRequests", "Child seat please")
                        .with(csrf()))
                .andExpect(status().is3xxRedirection())
                .andExpect(redirectedUrlPattern("/appointments/*"));

        List<Appointment> mine = appointmentRepo.findByCustomerOrderByCreatedAtDesc(customer);
        assertThat(mine).hasSize(1);
        Appointment a = mine.get(0);
        assertThat(a.getStatus()).isEqualTo(AppointmentStatus.PENDING);
        assertThat(a.getTotalPrice()).isEqualByComparingTo("300.00");
        assertThat(a.getDiscountAmount()).isNull();
        assertThat(a.getCustomerEmail()).isEqualTo(EMAIL);
        assertThat(a.getSpecialRequests()).isEqualTo("Child seat please");

        assertThat(notificationRepo.findByUserIdOrderByCreatedAtDesc(customer.getId()))
                .extracting(Notification::getTitle)
                .contains("Booking Created");
    }

    @Test
    void overlappingBooking_isRejected_backToBackIsAllowed() throws Exception {
        appointmentService.create(request(LocalDateTime.of(2025, 3, 10, 10, 0), LocalDateTime.of(2025, 3, 12, 10, 0), null), customer);

        mvc.perform(post("/appointments/create")
                        .param("carId", car.getId().toString())
                        .param("startDate", "2025-03-11T10:00:00")
                        .param("endDate", "2025-03-13T10:00:00")
                        .with(csrf()))
                .andExpect(status().is3xxRedirection())
                .andExpect(redirectedUrl("/appointments/create?carId=" + car.getId()))
                .andExpect(flash().attribute("errors", hasItem(allOf(
                        startsWith("2024 Perodua Myvi - WAB1234 is not available"),
                        containsString("already booked from Mar 10, 2025 10:00")))));

        // pickup exactly at the previous return
        Appointment next = appointmentService.create(
                request(LocalDateTime.of(2025, 3, 12, 10, 0), LocalDateTime.of(2025, 3, 13, 10, 0), null), customer);
        assertThat(next.getId()).isNotNull();
    }

    @Test
    void cancelledBookings_doNotBlockTheCar() {
        Appointment first = appointmentService.create(
                request(LocalDateTime.of(2025, 3, 10, 10, 0), LocalDateTime.of(2025, 3, 12, 10, 0), null), customer);
        appointmentService.cancel(first.getId(), customer);

        assertThat(appointmentService.isCarAvailable(car.getId(),
                LocalDateTime.of(2025, 3, 10, 10, 0), LocalDateTime.of(2025, 3, 12, 10, 0), null)).isTrue();
    }

    @Test
    void pastAndTooShortRentals_collectAllErrors() {
        assertThatThrownBy(() -> appointmentService.create(
                request(now.minusDays(1), now.minusDays(1).plusMinutes(30), null), customer))
                .isInstanceOf(BookingException.class)
                .satisfies(e -> assertThat(((BookingException) e).getErrors()).contains(
                        "Pickup date cannot be in the past.",
                        "Return date cannot be in the past.",
                        "Minimum rental duration is 1 hour."));
    }

    @Test
    void lastAllowedPromotionUse_stillGetsItsDiscount() {
        Promotion once = Fixtures.promotion("ONCE10", "10", now.minusDays(1), now.plusDays(30));
        once.setMaxUses(1);
        promotionRepo.save(once);

        Appointment a = appointmentService.create(
                request(LocalDateTime.of(2025, 3, 10, 10, 0), LocalDateTime.of(2025, 3, 12, 10, 0), "once10"), customer);

        assertThat(a.getTotalPrice()).isEqualByComparingTo("270.00");
        assertThat(a.getDiscountAmount()).isEqualByComparingTo("30.00");
        assertThat(promotionRepo.findByCodeIgnoreCase("ONCE10").orElseThrow().getCurrentUses()).isEqualTo(1);

        assertThatThrownBy(() -> appointmentService.create(
                request(LocalDateTime.of(2025, 3, 20, 10, 0), LocalDateTime.of(2025, 3, 21, 10, 0), "ONCE10"), customer))
                .isInstanceOf(BookingException.class)
                .hasMessageContaining("usage limit");
    }

    @Test
    void cancelWellAhead_refundsInFull() throws Exception {
        Appointment a = appointmentService.create(
                request(LocalDateTime.of(2025, 3, 10, 10, 0), LocalDateTime.of(2025, 3, 12, 10, 0), null), customer);
        Payment paid = paymentRepo.save(Fixtures.payment(a, Payment.METHOD_CREDIT_CARD, PaymentStatus.COMPLETED, now));

        mvc.perform(post("/appointments/{id}/cancel", a.getId()).with(csrf()))
                .andExpect(status().is3xxRedirection())
                .andExpect(redirectedUrl("/appointments"))
                .andExpect(flash().attribute("successMessage", containsString("Full refund")));

        assertThat(appointmentRepo.findById(a.getId()).orElseThrow().getStatus()).isEqualTo(AppointmentStatus.CANCELLED);
        assertThat(paymentRepo.findById(paid.getId()).orElseThrow().getStatus()).isEqualTo(PaymentStatus.REFUNDED);
    }

    @Test
    void cancelInsideTwoDays_isPartiallyRefunded() throws Exception {
        Appointment a = appointmentService.create(
                request(now.plusHours(20), now.plusHours(44), null), customer);
        Payment paid = paymentRepo.save(Fixtures.payment(a, Payment.METHOD_CREDIT_CARD, PaymentStatus.COMPLETED, now));

        mvc.perform(post("/appointments/{id}/cancel", a.getId()).with(csrf()))
                .andExpect(status().is3xxRedirection())
                .andExpect(flash().attribute("successMessage", containsString("Cancellation fee may apply")));

        assertThat(paymentRepo.findById(paid.getId()).orElseThrow().getStatus()).isEqualTo(PaymentStatus.PARTIALLY_REFUNDED);
    }

    @Test
    void cancellingTwice_showsError() throws Exception {
        Appointment a = appointmentService.create(
                request(LocalDateTime.of(2025, 3, 10, 10, 0), LocalDateTime.of(2025, 3, 12, 10, 0), null), customer);
        appointmentService.cancel(a.getId(), customer);

        mvc.perform(post("/appointments/{id}/cancel", a.getId()).with(csrf()))
                .andExpect(status().is3xxRedirection())
                .andExpect(flash().attribute("errorMessage", "This booking is already cancelled."));
    }

    @Test
    void slots_skipBookedPeriod() throws Exception {
        appointmentService.create(
                request(LocalDateTime.of(2025, 3, 10, 10, 0), LocalDateTime.of(2025, 3, 12, 10, 0), null), customer);

        mvc.perform(get("/appointments/slots")
                        .param("carId", car.getId().toString())
                        .param("from", "2025-03-09T00:00:00")
                        .param("to", "2025-03-14T00:00:00"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[0].end").value("2025-03-10T10:00:00"))
                .andExpect(jsonPath("$[1].start").value("2025-03-12T10:00:00"));
    }

    @Test
    void detailsAndHistoryTabs_render() throws Exception {
        Appointment a = appointmentService.create(
                request(LocalDateTime.of(2025, 3, 10, 10, 0), LocalDateTime.of(2025, 3, 12, 10, 0), null), customer);

        mvc.perform(get("/appointments/{id}", a.getId()))
                .andExpect(status().isOk())
                .andExpect(view().name("appointment-details"))
                .andExpect(model().attribute("freeCancellation", true))
                .andExpect(content().string(containsString("Pay Now")));

        appointmentService.cancel(a.getId(), customer);

        mvc.perform(get("/appointments").param("view", "History"))
                .andExpect(status().isOk())
                .andExpect(content().string(containsString("CANCELLED")));
        mvc.perform(get("/appointments"))
                .andExpect(status().isOk())
                .andExpect(content().string(containsString("You have no bookings here yet.")));
    }
}
