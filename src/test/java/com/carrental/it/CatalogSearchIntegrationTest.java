package com.carrental.it;

import com.carrental.dto.CarSearchCriteria;
import com.carrental.model.*;
import com.carrental.repository.*;
import com.carrental.service.CarCatalogService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.*;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
@Transactional
@ActiveProfiles("test")
class CatalogSearchIntegrationTest {

    @Autowired MockMvc mvc;

    @Autowired CarCatalogService catalog;
    @Autowired CarRepository carRepo;
    @Autowired CategoryRepository categoryRepo;
    @Autowired AppointmentRepository appointmentRepo;
    @Autowired UserRepository userRepo;

    @MockBean Clock clock;

    private final ZoneId zone = ZoneId.of("Asia/Kuala_Lumpur");
    private final LocalDateTime now = LocalDateTime.of(2025, 3, 3, 9, 0);

    private Car tesla;
    private Car byd;
    private Car myvi;
    private Car vios;

    @BeforeEach
    void setUp() {
        when(clock.getZone()).thenReturn(zone);
        when(clock.instant()).thenReturn(now.atZone(zone).toInstant());

        Category sedan = new Category();
        sedan.setName("Sedan");
        sedan = categoryRepo.save(sedan);

        tesla = Fixtures.ev("Tesla", "Model 3", "EV2002", "350.00");
        tesla.setState("Selangor");
        tesla.setCategory(sedan);
        tesla = carRepo.save(tesla);

        byd = carRepo.save(Fixtures.ev("BYD", "Atto 3", "EV1001", "220.00"));

        myvi = Fixtures.car("Perodua", "Myvi", "WAB1234", "90.00");
        myvi.setYear(2021);
        myvi = carRepo.save(myvi);

        vios = Fixtures.car("Toyota", "Vios", "WCC7777", "140.00");
        vios.setAvailable(false);
        vios = carRepo.save(vios);
    }

    private CarSearchCriteria criteria() {
        return new CarSearchCriteria();
    }

    @Test
    void defaultSearch_listsAvailableCarsCheapestFirst() {
        assertThat(catalog.search(criteria())).containsExactly(myvi, byd, tesla);
    }

    @Test
    void filters_combine() {
        CarSearchCriteria c = criteria();
        c.setFuelType("Electric");
        c.setMaxPrice(new BigDecimal("300"));
        assertThat(catalog.search(c)).containsExactly(byd);

        CarSearchCriteria gas = criteria();
        gas.setFuelType("Gas");
        assertThat(catalog.search(gas)).containsExactly(myvi);

        CarSearchCriteria inSelangor = criteria();
        inSelangor.setState("selangor");
        assertThat(catalog.search(inSelangor)).containsExactly(tesla);

        CarSearchCriteria text = criteria();
        text.setQuery("sedan");
        assertThat(catalog.search(text)).containsExactly(tesla);
    }

    @Test
    void sorting_byPriceNameAndYear() {
        CarSearchCriteria c = criteria();
        c.setSortBy("price_desc");
        assertThat(catalog.search(c)).containsExactly(tesla, byd, myvi);

        c.setSortBy("name_asc");
        assertThat(catalog.search(c)).containsExactly(byd, myvi, tesla);

        c.setSortBy("year_desc");
        assertThat(catalog.search(c).get(2)).isEqualTo(myvi);
    }

    @Test
    void availabilityWindow_excludesBookedCars() {
        User u = userRepo.save(Fixtures.user("frank@example.com", User.ROLE_CUSTOMER));
        appointmentRepo.save(Fixtures.appointment(byd, u,
                now.plusDays(2), now.plusDays(4), AppointmentStatus.CONFIRMED, "440.00"));

        CarSearchCriteria c = criteria();
        c.setStartDate(now.plusDays(3));
        c.setEndDate(now.plusDays(5));
        assertThat(catalog.search(c)).containsExactly(myvi, tesla);

        // window ending exactly at pickup does not collide
        c.setStartDate(now);
        c.setEndDate(now.plusDays(2));
        assertThat(catalog.search(c)).contains(byd);
    }

    @Test
    void priceRangeAndStates_comeFromAvailableCars() {
        BigDecimal[] range = catalog.priceRange();
        assertThat(range[0]).isEqualByComparingTo("90.00");
        assertThat(range[1]).isEqualByComparingTo("350.00");
        assertThat(catalog.states()).containsExactly("Kuala Lumpur", "Selangor");
    }

    @Test
    void catalogPages_arePublic() throws Exception {
        mvc.perform(get("/cars").param("fuelType", "Electric"))
                .andExpect(status().isOk())
                .andExpect(view().name("cars"))
                .andExpect(model().attribute("cars", List.of(byd, tesla)))
                .andExpect(content().string(containsString("Browse Cars")))
                .andExpect(content().string(containsString("Atto 3")));

        mvc.perform(get("/cars/{id}", tesla.getId()))
                .andExpect(status().isOk())
                .andExpect(view().name("car-details"))
                .andExpect(content().string(containsString("Model 3")))
                .andExpect(content().string(containsString("No reviews yet.")));

        mvc.perform(get("/"))
                .andExpect(status().isOk())
                .andExpect(view().name("landing"))
                .andExpect(content().string(containsString("Featured Cars")));
    }

    @Test
    void unknownCar_is404() throws Exception {
        mvc.perform(get("/cars/{id}", 987654L))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Car not found with id: 987654"));
    }

    @Test
    void evHub_comparesOnlyElectricCars_inRequestedOrder() throws Exception {
        mvc.perform(get("/ev-hub"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[0].model").value("Atto 3"));

        mvc.perform(get("/ev-hub/compare")
                        .param("ids", tesla.getId().toString(), myvi.getId().toString(), byd.getId().toString()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[0].licensePlate").value("EV2002"))
                .andExpect(jsonPath("$[1].licensePlate").value("EV1001"));
    }
}
