package com.carrental.service;

import com.carrental.dto.CarDetails;
import com.carrental.dto.CarSearchCriteria;
import com.carrental.dto.ReviewRowDto;
import com.carrental.exception.BusinessException;
import com.carrental.exception.NotFoundException;
import com.carrental.model.Car;
import com.carrental.model.Category;
import com.carrental.repository.AppointmentRepository;
import com.carrental.repository.CarRepository;
import com.carrental.repository.CategoryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.*;
import java.util.stream.Stream;

/**
 * Vehicle catalog: customer search and details, the EV hub, and staff vehicle management.
 */
@Service
public class CarCatalogService {

    private static final Logger logger = LoggerFactory.getLogger(CarCatalogService.class);

    static final int MAX_COMPARE = 3;
    private static final BigDecimal DEFAULT_MIN_PRICE = BigDecimal.ZERO;
    private static final BigDecimal DEFAULT_MAX_PRICE = BigDecimal.valueOf(1000);

    private final CarRepository carRepository;
    private final CategoryRepository categoryRepository;
    private final AppointmentRepository appointmentRepository;
    private final AppointmentService appointmentService;
    private final ReviewService reviewService;
    private final Clock clock;

    public CarCatalogService(CarRepository carRepository,
                             CategoryRepository categoryRepository,
                             AppointmentRepository appointmentRepository,
                             AppointmentService appointmentService,
                             ReviewService reviewService,
                             Clock clock) {
        this.carRepository = carRepository;
        this.categoryRepository = categoryRepository;
        this.appointmentRepository = appointmentRepository;
        this.appointmentService = appointmentService;
        this.reviewService = reviewService;
        this.clock = clock;
    }

    public Car getById(Long id) {
        return carRepository.findById(id).orElseThrow(() -> NotFoundException.of("Car", id));
    }

    // ---------------- Customer catalog ----------------

    public List<Car> search(CarSearchCriteria c) {
        Stream<Car> stream = carRepository.findByAvailableTrue().stream();

        if (notBlank(c.getQuery())) {
            String q = c.getQuery().trim().toLowerCase(Locale.ROOT);
            stream = stream.filter(car -> matchesText(car, q));
        }
        if (notBlank(c.getFuelType()) && !"All".equalsIgnoreCase(c.getFuelType())) {
            boolean wantElectric = Car.FUEL_ELECTRIC.equalsIgnoreCase(c.getFuelType());
            stream = stream.filter(car -> car.isElectric() == wantElectric);
        }
        if (notBlank(c.getState())) {
            stream = stream.filter(car -> c.getState().trim().equalsIgnoreCase(car.getState()));
        }
        if (c.getCategoryId() != null) {
            stream = stream.filter(car -> car.getCategory() != null && c.getCategoryId().equals(car.getCategory().getId()));
        }
        if (c.getMinPrice() != null) {
            stream = stream.filter(car -> car.getDailyRate().compareTo(c.getMinPrice()) >= 0);
        }
        if (c.getMaxPrice() != null) {
            stream = stream.filter(car -> car.getDailyRate().compareTo(c.getMaxPrice()) <= 0);
        }
        if (c.hasAvailabilityWindow()) {
            stream = stream.filter(car -> appointmentRepository
                    .findOverlapping(car.getId(), c.getStartDate(), c.getEndDate(), null).isEmpty());
        }

        List<Car> cars = new ArrayList<>(stream.toList());
        cars.sort(comparatorFor(c.getSortBy()));
        return cars;
    }

    private static boolean matchesText(Car car, String q) {
        return containsIgnoreCase(car.getMake(), q)
                || containsIgnoreCase(car.getModel(), q)
                || containsIgnoreCase(car.getDescription(), q)
                || containsIgnoreCase(car.getDisplayName(), q)
                || containsIgnoreCase(car.getCity(), q)
                || containsIgnoreCase(car.getState(), q)
                || containsIgnoreCase(car.getFuelType(), q)
                || (car.getCategory() != null && containsIgnoreCase(car.getCategory().getName(), q))
                || String.valueOf(car.getYear()).contains(q);
    }

    private Comparator<Car> comparatorFor(String sortBy) {
        String key = sortBy == null ? "price_asc" : sortBy;
        Comparator<Car> byName = Comparator.comparing(Car::getMake, String.CASE_INSENSITIVE_ORDER)
                .thenComparing(Car::getModel, String.CASE_INSENSITIVE_ORDER);
        return switch (key) {
            case "price_desc" -> Comparator.comparing(Car::getDailyRate).reversed();
            case "name_asc" -> byName;
            case "name_desc" -> byName.reversed();
            case "year_desc" -> Comparator.comparingInt(Car::getYear).reversed();
            case "rating_desc" -> {
                Map<Long, Double> ratings = reviewService.averageRatingsByCar();
                yield Comparator.<Car>comparingDouble(car -> ratings.getOrDefault(car.getId(), 0.0)).reversed();
            }
            default -> Comparator.comparing(Car::getDailyRate);
        };
    }

    /** carId -> average approved rating for the given cars; cars without reviews map to 0. */
    public Map<Long, Double> averageRatings(Collection<Car> cars) {
        Map<Long, Double> all = reviewService.averageRatingsByCar();
        Map<Long, Double> result = new LinkedHashMap<>();
        for (Car car : cars) {
            result.put(car.getId(), all.getOrDefault(car.getId(), 0.0));
        }
        return result;
    }

    public List<String> states() {
        return carRepository.findByAvailableTrue().stream()
                .map(Car::getState)
                .filter(CarCatalogService::notBlank)
                .distinct()
                .sorted()
                .toList();
    }

    /** [min, max] daily rate of available cars; 0 and 1000 when there are none. */
    public BigDecimal[] priceRange() {
        List<Car> cars = carRepository.findByAvailableTrue();
        if (cars.isEmpty()) {
            return new BigDecimal[]{DEFAULT_MIN_PRICE, DEFAULT_MAX_PRICE};
        }
        BigDecimal min = cars.stream().map(Car::getDailyRate).min(Comparator.naturalOrder()).orElse(DEFAULT_MIN_PRICE);
        BigDecimal max = cars.stream().map(Car::getDailyRate).max(Comparator.naturalOrder()).orElse(DEFAULT_MAX_PRICE);
        return new BigDecimal[]{min, max};
    }

    public List<Category> activeCategories() {
        return categoryRepository.findByActiveTrueOrderByNameAsc();
    }

    public CarDetails details(Long id) {
        Car car = getById(id);
        List<ReviewRowDto> reviews = reviewService.listApproved(id).stream().map(ReviewRowDto::new).toList();
        return new CarDetails(car, reviews,
                reviewService.averageRating(id),
                reviewService.reviewCount(id),
                appointmentService.availableTimeSlots(id, null, null));
    }

    // ---------------- EV hub ----------------

    public List<Car> electricVehicles() {
        return carRepository.findByElectricTrueAndAvailableTrueOrderByDailyRateAsc();
    }

    /** Electric cars among the first three ids, in the order given. Non-electric and unknown ids are ignored. */
    public List<Car> compare(List<Long> ids) {
        if (ids == null || ids.isEmpty()) return List.of();
        List<Long> wanted = ids.stream().filter(Objects::nonNull).distinct().limit(MAX_COMPARE).toList();
        Map<Long, Car> found = new HashMap<>();
        carRepository.findByIdInAndElectricTrue(wanted).forEach(car -> found.put(car.getId(), car));
        return wanted.stream().map(found::get).filter(Objects::nonNull).toList();
    }

    // ---------------- Staff vehicle management ----------------

    public List<Car> listForStaff(String search, String availability, String state) {
        Stream<Car> stream = carRepository.findAllByOrderByCreatedAtDesc().stream();
        if (notBlank(search)) {
            String q = search.trim().toLowerCase(Locale.ROOT);
            stream = stream.filter(car -> containsIgnoreCase(car.getMake(), q)
                    || containsIgnoreCase(car.getModel(), q)
                    || containsIgnoreCase(car.getLicensePlate(), q));
        }
        if ("available".equalsIgnoreCase(availability)) {
            stream = stream.filter(Car::isAvailable);
        } else if ("unavailable".equalsIgnoreCase(availability)) {
            stream = stream.filter(car -> !car.isAvailable());
        }
        if (notBlank(state)) {
            stream = stream.filter(car -> state.trim().equalsIgnoreCase(car.getState()));
        }
        return stream.toList();
    }

    @Transactional
    public Car create(Car car, Long categoryId) {
        check(car);
        if (carRepository.existsByLicensePlateIgnoreCase(car.getLicensePlate())) {
            throw new BusinessException("A vehicle with license plate " + car.getLicensePlate() + " already exists.");
        }
        car.setCategory(resolveCategory(categoryId));
        car.setElectric(Car.FUEL_ELECTRIC.equalsIgnoreCase(car.getFuelType()) || car.isElectric());
        car.setCreatedAt(LocalDateTime.now(clock));
        Car saved = carRepository.save(car);
        logger.info("Vehicle {} added ({})", saved.getId(), saved.getDisplayName());
        return saved;
    }

    @Transactional
    public Car update(Long id, Car changes, Long categoryId) {
        Car car = getById(id);
        check(changes);
        if (carRepository.existsByLicensePlateIgnoreCaseAndIdNot(changes.getLicensePlate(), id)) {
            throw new BusinessException("A vehicle with license plate " + changes.getLicensePlate() + " already exists.");
        }
        car.setMake(changes.getMake());
        car.setModel(changes.getModel());
        car.setYear(changes.getYear());
        car.setLicensePlate(changes.getLicensePlate());
        car.setColor(changes.getColor());
        car.setDailyRate(changes.getDailyRate());
        car.setFuelType(changes.getFuelType());
        car.setDescription(changes.getDescription());
        car.setElectric(Car.FUEL_ELECTRIC.equalsIgnoreCase(changes.getFuelType()) || changes.isElectric());
        car.setAvailable(changes.isAvailable());
        car.setState(changes.getState());
        car.setCity(changes.getCity());
        car.setLocationAddress(changes.getLocationAddress());
        car.setBatteryCapacity(changes.getBatteryCapacity());
        car.setRange(changes.getRange());
        car.setChargingTime(changes.getChargingTime());
        car.setCategory(resolveCategory(categoryId));
        car.setUpdatedAt(LocalDateTime.now(clock));
        return carRepository.save(car);
    }

    @Transactional
    public Car toggleAvailability(Long id) {
        Car car = getById(id);
        car.setAvailable(!car.isAvailable());
        car.setUpdatedAt(LocalDateTime.now(clock));
        logger.info("Vehicle {} availability -> {}", id, car.isAvailable());
        return carRepository.save(car);
    }

    @Transactional
    public Car setImage(Long id, String imageUrl) {
        Car car = getById(id);
        car.setImageUrl(imageUrl);
        car.setUpdatedAt(LocalDateTime.now(clock));
        return carRepository.save(car);
    }

    private Category resolveCategory(Long categoryId) {
        if (categoryId == null) return null;
        return categoryRepository.findById(categoryId).orElseThrow(() -> NotFoundException.of("Category", categoryId));
    }

    private static void check(Car car) {
        if (!notBlank(car.getMake()) || !notBlank(car.getModel()) || !notBlank(car.getLicensePlate())) {
            throw new BusinessException("Make, model and license plate are required.");
        }
        if (car.getYear() < 1900 || car.getYear() > 2100) {
            throw new BusinessException("Year must be between 1900 and 2100.");
        }
        if (car.getDailyRate() == null || car.getDailyRate().signum() <= 0) {
            throw new BusinessException("Daily rate must be greater than zero.");
        }
    }

    private static boolean notBlank(String s) {
        return s != null && !s.isBlank();
    }

    private static boolean containsIgnoreCase(String value, String lowerTerm) {
        return value != null && value.toLowerCase(Locale.ROOT).contains(lowerTerm);
    }
}
