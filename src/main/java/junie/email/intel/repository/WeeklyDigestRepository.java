package junie.email.intel.repository;

import junie.email.intel.entity.WeeklyDigest;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Optional;

@Repository
public interface WeeklyDigestRepository extends JpaRepository<WeeklyDigest, String> {
    Optional<WeeklyDigest> findByUserIdAndWeekStart(String userId, LocalDate weekStart);

    Optional<WeeklyDigest> findByIdAndUserId(String id, String userId);
}
