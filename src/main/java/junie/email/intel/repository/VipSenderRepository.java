package junie.email.intel.repository;

import junie.email.intel.entity.VipSender;
import junie.email.intel.entity.VipStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface VipSenderRepository extends JpaRepository<VipSender, String> {
    List<VipSender> findByUserIdOrderBySenderEmail(String userId);

    List<VipSender> findByUserIdAndStatus(String userId, VipStatus status);

    Optional<VipSender> findByUserIdAndSenderEmail(String userId, String senderEmail);

    long countByUserIdAndStatus(String userId, VipStatus status);

    @Modifying
    @Query("UPDATE VipSender v SET v.usageCount = v.usageCount + 1, v.lastUsedAt = :now " +
           "WHERE v.userId = :userId AND v.senderEmail = :senderEmail")
    int incrementUsage(@Param("userId") String userId,
                       @Param("senderEmail") String senderEmail,
                       @Param("now") Instant now);
}
