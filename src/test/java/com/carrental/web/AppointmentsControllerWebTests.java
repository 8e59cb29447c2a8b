package com.carrental.web;

import com.carrental.config.SecurityConfig;
import com.carrental.controller.AppointmentsController;
import com.carrental.dto.BookingRequest;
import com.carrental.dto.PriceQuote;
import com.carrental.exception.BookingException;
import com.carrental.model.Appointment;
import com.carrental.model.Car;
import com.carrental.model.User;
import com.carrental.repository.UserRepository;
import com.carrental.service.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.time.*;
import java.util.List;
import java.util.Optional;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasItem;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.csrf;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.user;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(controllers = AppointmentsController.class)
@AutoConfigureMockMvc(addFilters = true)
@Import({SecurityConfig.class, CustomAuthenticationSuccessHandler.class})
class AppointmentsControllerWebTests {

    @Autowired MockMvc mvc;

    @MockBean AppointmentService appointmentService;
    @MockBean CarCatalogService carCatalogService;
    @MockBean PromotionService promotionService;
    @MockBean SubscriptionService subscriptionService;
    @MockBean CancelPolicyService cancelPolicyService;
    @MockBean UserRepository userRepository;

    // SecurityConfig wires its DaoAuthenticationProvider with this
    @MockBean CustomUserDetailsService userDetailsService;

    @MockBean Clock clock;

    private final ZoneId zone = ZoneId.of("Asia/Kuala_Lumpur");
    private final Instant fixedInstant = ZonedDateTime.of(2025, 3, 3, 9, 0, 0, 0, zone).toInstant();

    private User customer;
    private Car car;

    @BeforeEach
    void setup() {
        when(clock.getZone()).thenReturn(zone);
        when(clock.instant()).thenReturn(fixedInstant);

        customer = new User();
        customer.setId(123L);
        customer.setUsername("customer@test.local");
        customer.setRole(User.ROLE_CUSTOMER);
        when(userRepository.findByUsername("customer@test.local")).thenReturn(Optional.of(customer));

        car = new Car();
        car.setId(5L);
        car.setMake("Proton");
        car.setModel("X50");
        car.setYear(2024);
        car.setLicensePlate("VBC5050");
        car.setDailyRate(new BigDecimal("180.00"));
        when(carCatalogService.getById(5L)).thenReturn(car);

        when(appointmentService.listForCustomer(any(User.class), anyString())).thenReturn(List.of());
        when(appointmentService.availableTimeSlots(eq(5L), any(), any())).thenReturn(List.of());
        when(subscriptionService.listActive()).thenReturn(List.of());
        when(promotionService.listActive()).thenReturn(List.of());
    }

    @Test
    void myBookings_rendersForCustomer() throws Exception {
        mvc.perform(get("/appointments")
                        .with(user("customer@test.local").roles("CUSTOMER")))
                .andExpect(status().isOk())
                .andExpect(view().name("appointments"))
                .andExpect(model().attribute("view", "Active"))
                .andExpect(content().string(containsString("My Bookings")));
    }

    @Test
    void myBookings_requiresSignIn_andCustomerRole() throws Exception {
        mvc.perform(get("/appointments"))
                .andExpect(status().is3xxRedirection())
                .andExpect(redirectedUrlPattern("**/login"));

        mvc.perform(get("/appointments")
                        .with(user("staff@test.local").roles("STAFF")))
                .andExpect(status().isForbidden());
    }

    @Test
    void bookingForm_showsChosenCar() throws Exception {
        mvc.perform(get("/appointments/create").param("carId", "5")
                        .with(user("customer@test.local").roles("CUSTOMER")))
                .andExpect(status().isOk())
                .andExpect(view().name("appointment-form"))
                .andExpect(model().attribute("car", car))
                .andExpect(content().string(containsString("Book a Car")))
                .andExpect(content().string(containsString("Proton")));
    }

    @Test
    void quote_isPublic_andReportsBreakdown() throws Exception {
        when(promotionService.findByCode(null)).thenReturn(Optional.empty());
        when(appointmentService.quote(eq(5L), any(), any(), isNull(), isNull()))
                .thenReturn(new PriceQuote(2, new BigDecimal("180.00"), new BigDecimal("360.00"),
                        BigDecimal.ZERO, BigDecimal.ZERO, new BigDecimal("360.00")));
        when(appointmentService.isCarAvailable(eq(5L), any(), any(), isNull())).thenReturn(true);

        mvc.perform(get("/appointments/quote")
                        .param("carId", "5")
                        .param("startDate", "2025-03-10T10:00:00")
                        .param("endDate", "2025-03-12T10:00:00"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.days").value(2))
                .andExpect(jsonPath("$.totalPrice").value(360.0))
                .andExpect(jsonPath("$.currency").value("RM"))
                .andExpect(jsonPath("$.available").value(true));
    }

    @Test
    void createBooking_success_redirectsToDetails() throws Exception {
        Appointment created = new Appointment();
        created.setId(42L);
        when(appointmentService.create(any(BookingRequest.class), eq(customer))).thenReturn(created);

        mvc.perform(post("/appointments/create")
                        .param("carId", "5")
                        .param("startDate", "2025-03-10T10:00:00")
                        .param("endDate", "2025-03-12T10:00:00")
                        .with(user("customer@test.local").roles("CUSTOMER"))
                        .with(csrf()))
                .andExpect(status().is3xxRedirection())
                .andExpect(redirectedUrl("/appointments/42"))
                .andExpect(flash().attribute("successMessage", containsString("Please complete payment")));
    }

    @Test
    void createBooking_conflict_returnsToFormWithErrors() throws Exception {
        when(appointmentService.create(any(BookingRequest.class), eq(customer)))
                .thenThrow(new BookingException("Proton X50 is not available for the selected dates."));

        mvc.perform(post("/appointments/create")
                        .param("carId", "5")
                        .param("startDate", "2025-03-10T10:00:00")
                        .param("endDate", "2025-03-12T10:00:00")
                        .with(user("customer@test.local").roles("CUSTOMER"))
                        .with(csrf()))
                .andExpect(status().is3xxRedirection())
                .andExpect(redirectedUrl("/appointments/create?carId=5"))
                .andExpect(flash().attribute("errors", hasItem(containsString("not available"))));
    }

    @Test
    void createBooking_withoutCsrf_isRejected() throws Exception {
        mvc.perform(post("/appointments/create")
                        .param("carId", "5")
                        .with(user("customer@test.local").roles("CUSTOMER")))
                .andExpect(status().isForbidden());
        verify(appointmentService, never()).create(any(), any());
    }

    @Test
    void details_ofSomeoneElsesBooking_isForbidden() throws Exception {
        User other = new User();
        other.setId(999L);
        Appointment a = new Appointment();
        a.setId(7L);
        a.setCar(car);
        a.setCustomer(other);
        when(appointmentService.getById(7L)).thenReturn(a);

        mvc.perform(get("/appointments/7")
                        .with(user("customer@test.local").roles("CUSTOMER")))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.success").value(false));
    }

    @Test
    void validatePromotion_reportsRejectionMessage() throws Exception {
        PromotionService.Validation rejected = mock(PromotionService.Validation.class);
        when(rejected.isValid()).thenReturn(false);
        when(rejected.getMessage()).thenReturn("This promotion is only valid for electric vehicles.");
        when(promotionService.validateCode("EVGREEN20", false)).thenReturn(rejected);

        mvc.perform(get("/appointments/validate-promotion")
                        .param("code", "EVGREEN20")
                        .param("carId", "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.valid").value(false))
                .andExpect(jsonPath("$.message").value("This promotion is only valid for electric vehicles."));
    }
}
