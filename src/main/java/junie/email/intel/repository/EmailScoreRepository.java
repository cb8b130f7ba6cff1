package junie.email.intel.repository;

import junie.email.intel.entity.AiStatus;
import junie.email.intel.entity.EmailScore;
import junie.email.intel.entity.ProcessingTier;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface EmailScoreRepository extends JpaRepository<EmailScore, String> {

    // Fetch the record too, callers read sender and subject outside the session
    @Query("SELECT s FROM EmailScore s JOIN FETCH s.emailRecord r WHERE r.id = :emailRecordId AND s.userId = :userId")
    Optional<EmailScore> findByEmailRecordIdAndUserId(@Param("emailRecordId") String emailRecordId,
                                                      @Param("userId") String userId);

    @Query("SELECT s FROM EmailScore s JOIN FETCH s.emailRecord r " +
           "WHERE s.userId = :userId AND s.processingTier = :tier " +
           "AND r.receivedAt >= :from AND r.receivedAt < :to " +
           "ORDER BY r.receivedAt")
    List<EmailScore> findByTierReceivedBetween(@Param("userId") String userId,
                                               @Param("tier") ProcessingTier tier,
                                               @Param("from") Instant from,
                                               @Param("to") Instant to);

    @Query("SELECT s FROM EmailScore s JOIN FETCH s.emailRecord r WHERE s.aiStatus = :status ORDER BY s.scoredAt")
    List<EmailScore> findByAiStatus(@Param("status") AiStatus status, Pageable pageable);

    List<EmailScore> findByAiStatusAndUpdatedAtBefore(AiStatus status, Instant updatedBefore, Pageable pageable);

    @Query("SELECT s FROM EmailScore s JOIN FETCH s.emailRecord r " +
           "WHERE s.userId = :userId AND LOWER(r.senderEmail) = :senderEmail")
    List<EmailScore> findBySender(@Param("userId") String userId, @Param("senderEmail") String senderEmail);
}
