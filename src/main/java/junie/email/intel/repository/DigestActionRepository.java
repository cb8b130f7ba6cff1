package junie.email.intel.repository;

import junie.email.intel.entity.DigestAction;
import junie.email.intel.entity.DigestActionType;
import junie.email.intel.entity.DigestTargetType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Set;

@Repository
public interface DigestActionRepository extends JpaRepository<DigestAction, String> {
    List<DigestAction> findByDigestId(String digestId);

    @Query("SELECT DISTINCT a.targetValue FROM DigestAction a WHERE a.userId = :userId " +
           "AND a.actionType = :actionType AND a.targetType = :targetType AND a.applied = true")
    Set<String> findAppliedTargets(@Param("userId") String userId,
                                   @Param("actionType") DigestActionType actionType,
                                   @Param("targetType") DigestTargetType targetType);
}
