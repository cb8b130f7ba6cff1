package junie.email.intel.repository;

import junie.email.intel.entity.AiBudget;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Every mutation is a single conditional UPDATE so concurrent callers never read-modify-write.
 * A return value of 0 means the guard did not hold.
 */
@Repository
public interface AiBudgetRepository extends JpaRepository<AiBudget, String> {

    @Modifying(clearAutomatically = true)
    @Query("UPDATE AiBudget b SET b.dailyReservedCents = b.dailyReservedCents + :cents, " +
           "b.monthlyReservedCents = b.monthlyReservedCents + :cents, b.updatedAt = :now " +
           "WHERE b.userId = :userId " +
           "AND b.dailyUsageCents + b.dailyReservedCents < b.dailyLimitCents " +
           "AND b.monthlyUsageCents + b.monthlyReservedCents < b.monthlyLimitCents")
    int reserve(@Param("userId") String userId, @Param("cents") long cents, @Param("now") Instant now);

    @Modifying(clearAutomatically = true)
    @Query("UPDATE AiBudget b SET b.dailyReservedCents = b.dailyReservedCents + :cents, " +
           "b.monthlyReservedCents = b.monthlyReservedCents + :cents, b.updatedAt = :now " +
           "WHERE b.userId = :userId")
    int reserveUnconditionally(@Param("userId") String userId, @Param("cents") long cents, @Param("now") Instant now);

    @Modifying(clearAutomatically = true)
    @Query("UPDATE AiBudget b SET " +
           "b.dailyReservedCents = CASE WHEN b.dailyReservedCents >= :reserved THEN b.dailyReservedCents - :reserved ELSE 0 END, " +
           "b.monthlyReservedCents = CASE WHEN b.monthlyReservedCents >= :reserved THEN b.monthlyReservedCents - :reserved ELSE 0 END, " +
           "b.dailyUsageCents = b.dailyUsageCents + :actual, " +
           "b.monthlyUsageCents = b.monthlyUsageCents + :actual, b.updatedAt = :now " +
           "WHERE b.userId = :userId")
    int settle(@Param("userId") String userId, @Param("reserved") long reserved,
               @Param("actual") long actual, @Param("now") Instant now);

    @Modifying(clearAutomatically = true)
    @Query("UPDATE AiBudget b SET b.dailyUsageCents = 0, b.dailyWindowStart = :today, b.updatedAt = :now " +
           "WHERE b.userId = :userId AND (b.dailyWindowStart IS NULL OR b.dailyWindowStart < :today)")
    int resetDailyWindow(@Param("userId") String userId, @Param("today") LocalDate today, @Param("now") Instant now);

    @Modifying(clearAutomatically = true)
    @Query("UPDATE AiBudget b SET b.monthlyUsageCents = 0, b.monthlyWindowStart = :monthStart, b.updatedAt = :now " +
           "WHERE b.userId = :userId AND (b.monthlyWindowStart IS NULL OR b.monthlyWindowStart < :monthStart)")
    int resetMonthlyWindow(@Param("userId") String userId, @Param("monthStart") LocalDate monthStart, @Param("now") Instant now);

    @Modifying(clearAutomatically = true)
    @Query("UPDATE AiBudget b SET b.dailyUsageCents = 0, b.dailyWindowStart = :today, b.updatedAt = :now " +
           "WHERE b.dailyWindowStart IS NULL OR b.dailyWindowStart < :today")
    int resetAllDailyWindows(@Param("today") LocalDate today, @Param("now") Instant now);

    @Modifying(clearAutomatically = true)
    @Query("UPDATE AiBudget b SET b.monthlyUsageCents = 0, b.monthlyWindowStart = :monthStart, b.updatedAt = :now " +
           "WHERE b.monthlyWindowStart IS NULL OR b.monthlyWindowStart < :monthStart")
    int resetAllMonthlyWindows(@Param("monthStart") LocalDate monthStart, @Param("now") Instant now);

    @Modifying(clearAutomatically = true)
    @Query("UPDATE AiBudget b SET b.dailyLimitCents = :daily, b.monthlyLimitCents = :monthly, b.updatedAt = :now " +
           "WHERE b.userId = :userId")
    int updateLimits(@Param("userId") String userId, @Param("daily") long daily,
                     @Param("monthly") long monthly, @Param("now") Instant now);
}
