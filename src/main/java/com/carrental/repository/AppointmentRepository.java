package com.carrental.repository;

import com.carrental.model.Appointment;
import com.carrental.model.AppointmentStatus;
import com.carrental.model.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

public interface AppointmentRepository extends JpaRepository<Appointment, Long> {

    List<Appointment> findAllByOrderByCreatedAtDesc();
    List<Appointment> findByCustomerOrderByCreatedAtDesc(User customer);
    List<Appointment> findByStatusOrderByCreatedAtDesc(AppointmentStatus status);
    List<Appointment> findTop5ByOrderByCreatedAtDesc();
    List<Appointment> findByCustomerId(Long customerId);

    long countByStatus(AppointmentStatus status);
    long countByCustomerId(Long customerId);
    long countByCreatedAtBetween(LocalDateTime startInclusive, LocalDateTime endExclusive);

    boolean existsByCarIdAndCustomerIdAndStatus(Long carId, Long customerId, AppointmentStatus status);

    // Half-open overlap: existing.start < end AND existing.end > start
    @Query("""
            select a from Appointment a
            where a.car.id = :carId
              and a.status <> com.carrental.model.AppointmentStatus.CANCELLED
              and a.startDate < :end
              and a.endDate > :start
              and (:excludeId is null or a.id <> :excludeId)
            order by a.startDate asc
            """)
    List<Appointment> findOverlapping(@Param("carId") Long carId,
                                      @Param("start") LocalDateTime start,
                                      @Param("end") LocalDateTime end,
                                      @Param("excludeId") Long excludeId);

    // Inclusive intersection with [from, to], used for calendars and date-range listings
    @Query("""
            select a from Appointment a
            where a.status <> com.carrental.model.AppointmentStatus.CANCELLED
              and a.startDate <= :to
              and a.endDate >= :from
            order by a.startDate asc
            """)
    List<Appointment> findActiveInRange(@Param("from") LocalDateTime from,
                                        @Param("to") LocalDateTime to);

    @Query("""
            select a from Appointment a
            where a.status in :statuses
              and a.createdAt >= :from
              and a.createdAt < :to
            """)
    List<Appointment> findByStatusInAndCreatedBetween(@Param("statuses") Collection<AppointmentStatus> statuses,
                                                      @Param("from") LocalDateTime from,
                                                      @Param("to") LocalDateTime to);

    List<Appointment> findByStatusIn(Collection<AppointmentStatus> statuses);
}
