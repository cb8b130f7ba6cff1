package junie.email.intel.repository;

import junie.email.intel.entity.SenderReputation;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface SenderReputationRepository extends JpaRepository<SenderReputation, String> {
    List<SenderReputation> findByUserId(String userId);

    Optional<SenderReputation> findByUserIdAndSenderEmail(String userId, String senderEmail);
}
