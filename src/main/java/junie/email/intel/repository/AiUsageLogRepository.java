package junie.email.intel.repository;

import junie.email.intel.entity.AiUsageLog;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface AiUsageLogRepository extends JpaRepository<AiUsageLog, String> {
    List<AiUsageLog> findByEmailRecordIdOrderByCreatedAt(String emailRecordId);
}
