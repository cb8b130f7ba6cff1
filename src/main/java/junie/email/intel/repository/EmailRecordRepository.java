package junie.email.intel.repository;

import junie.email.intel.entity.EmailRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface EmailRecordRepository extends JpaRepository<EmailRecord, String> {
    Optional<EmailRecord> findByUserIdAndProviderMessageId(String userId, String providerMessageId);

    Optional<EmailRecord> findByIdAndUserId(String id, String userId);
}
