package com.carrental.service;

import com.carrental.model.Appointment;
import com.carrental.model.AppointmentStatus;
import com.carrental.model.Car;
import com.carrental.model.User;
import com.carrental.repository.AppointmentRepository;
import com.carrental.repository.CarRepository;
import com.carrental.repository.ReviewRepository;
import com.carrental.repository.UserRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Staff dashboard figures and revenue analytics. Revenue counts confirmed and completed bookings,
 * bucketed by the day the booking was made.
 */
@Service
@Transactional(readOnly = true)
public class AnalyticsService {

    static final List<AppointmentStatus> EARNING = List.of(AppointmentStatus.CONFIRMED, AppointmentStatus.COMPLETED);

    private final AppointmentRepository appointmentRepository;
    private final CarRepository carRepository;
    private final UserRepository userRepository;
    private final ReviewRepository reviewRepository;
    private final AppointmentService appointmentService;
    private final Clock clock;

    public AnalyticsService(AppointmentRepository appointmentRepository,
                            CarRepository carRepository,
                            UserRepository userRepository,
                            ReviewRepository reviewRepository,
                            AppointmentService appointmentService,
                            Clock clock) {
        this.appointmentRepository = appointmentRepository;
        this.carRepository = carRepository;
        this.userRepository = userRepository;
        this.reviewRepository = reviewRepository;
        this.appointmentService = appointmentService;
        this.clock = clock;
    }

    public Map<String, Object> dashboardStats() {
        LocalDate today = LocalDate.now(clock);
        YearMonth month = YearMonth.from(today);

        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("totalBookings", appointmentRepository.count());
        stats.put("pendingBookings", appointmentRepository.countByStatus(AppointmentStatus.PENDING));
        stats.put("confirmedBookings", appointmentRepository.countByStatus(AppointmentStatus.CONFIRMED));
        stats.put("completedBookings", appointmentRepository.countByStatus(AppointmentStatus.COMPLETED));
        stats.put("cancelledBookings", appointmentRepository.countByStatus(AppointmentStatus.CANCELLED));
        stats.put("todayBookings", appointmentRepository.countByCreatedAtBetween(
                today.atStartOfDay(), today.plusDays(1).atStartOfDay()));
        stats.put("totalRevenue", sum(appointmentRepository.findByStatusIn(EARNING)));
        stats.put("monthlyRevenue", revenueBetween(month.atDay(1).atStartOfDay(), month.plusMonths(1).atDay(1).atStartOfDay()));
        stats.put("totalVehicles", carRepository.count());
        stats.put("availableVehicles", carRepository.countByAvailableTrue());
        stats.put("electricVehicles", carRepository.countByElectricTrue());
        stats.put("totalCustomers", userRepository.countByRole(User.ROLE_CUSTOMER));
        stats.put("pendingReviews", reviewRepository.countByApprovedFalse());
        stats.put("recentBookings", appointmentService.toRows(appointmentRepository.findTop5ByOrderByCreatedAtDesc()));
        return stats;
    }

    /** Revenue and booking count for bookings made between two dates, both inclusive. */
    public Map<String, Object> revenueReport(LocalDate from, LocalDate to) {
        LocalDateTime start = from.atStartOfDay();
        LocalDateTime end = to.plusDays(1).atStartOfDay();
        List<Appointment> earning = appointmentRepository.findByStatusInAndCreatedBetween(EARNING, start, end);

        Map<String, Object> report = new LinkedHashMap<>();
        report.put("from", from);
        report.put("to", to);
        report.put("bookings", earning.size());
        report.put("revenue", sum(earning));
        report.put("byDay", revenueByDay(from, to));
        return report;
    }

    public Map<String, Object> analytics() {
        LocalDate today = LocalDate.now(clock);
        YearMonth thisMonth = YearMonth.from(today);
        YearMonth lastMonth = thisMonth.minusMonths(1);

        LocalDateTime monthStart = thisMonth.atDay(1).atStartOfDay();
        LocalDateTime nextMonthStart = thisMonth.plusMonths(1).atDay(1).atStartOfDay();
        LocalDateTime lastMonthStart = lastMonth.atDay(1).atStartOfDay();

        Map<String, Object> a = new LinkedHashMap<>();
        a.put("revenueToday", revenueBetween(today.atStartOfDay(), today.plusDays(1).atStartOfDay()));
        a.put("revenueThisMonth", revenueBetween(monthStart, nextMonthStart));
        a.put("revenueLastMonth", revenueBetween(lastMonthStart, monthStart));
        a.put("bookingsToday", appointmentRepository.countByCreatedAtBetween(today.atStartOfDay(), today.plusDays(1).atStartOfDay()));
        a.put("bookingsThisMonth", appointmentRepository.countByCreatedAtBetween(monthStart, nextMonthStart));
        a.put("bookingsLastMonth", appointmentRepository.countByCreatedAtBetween(lastMonthStart, monthStart));
        a.put("topVehicles", topVehicles(monthStart, nextMonthStart, 5));
        a.put("revenueByDay", revenueByDay(thisMonth.atDay(1), today));
        return a;
    }

    /** Every day in [from, to] with its revenue, zero-filled. */
    public Map<LocalDate, BigDecimal> revenueByDay(LocalDate from, LocalDate to) {
        Map<LocalDate, BigDecimal> byDay = new TreeMap<>();
        for (LocalDate d = from; !d.isAfter(to); d = d.plusDays(1)) {
            byDay.put(d, BigDecimal.ZERO);
        }
        appointmentRepository.findByStatusInAndCreatedBetween(EARNING, from.atStartOfDay(), to.plusDays(1).atStartOfDay())
                .forEach(a -> byDay.merge(a.getCreatedAt().toLocalDate(), price(a), BigDecimal::add));
        return byDay;
    }

    List<Map<String, Object>> topVehicles(LocalDateTime from, LocalDateTime to, int limit) {
        Map<Car, List<Appointment>> byCar = appointmentRepository.findByStatusInAndCreatedBetween(EARNING, from, to).stream()
                .collect(Collectors.groupingBy(Appointment::getCar));
        return byCar.entrySet().stream()
                .sorted(Comparator.comparing((Map.Entry<Car, List<Appointment>> e) -> e.getValue().size()).reversed()
                        .thenComparing(e -> e.getKey().getId()))
                .limit(limit)
                .map(e -> {
                    Map<String, Object> row = new LinkedHashMap<>();
                    row.put("carId", e.getKey().getId());
                    row.put("carName", e.getKey().getDisplayName());
                    row.put("bookings", e.getValue().size());
                    row.put("revenue", sum(e.getValue()));
                    return row;
                })
                .toList();
    }

    private BigDecimal revenueBetween(LocalDateTime from, LocalDateTime to) {
        return sum(appointmentRepository.findByStatusInAndCreatedBetween(EARNING, from, to));
    }

    private static BigDecimal sum(Collection<Appointment> appointments) {
        return appointments.stream().map(AnalyticsService::price).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private static BigDecimal price(Appointment a) {
        return a.getTotalPrice() != null ? a.getTotalPrice() : BigDecimal.ZERO;
    }
}
