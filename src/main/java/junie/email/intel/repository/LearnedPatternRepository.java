package junie.email.intel.repository;

import junie.email.intel.entity.LearnedPattern;
import junie.email.intel.entity.PatternType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface LearnedPatternRepository extends JpaRepository<LearnedPattern, String> {
    Optional<LearnedPattern> findByUserIdAndPatternTypeAndPatternValue(String userId, PatternType patternType, String patternValue);

    long countByUserId(String userId);

    @Query("SELECT p FROM LearnedPattern p WHERE p.userId = :userId " +
           "AND p.confidenceScore > :minConfidence AND p.sampleCount >= :minSamples " +
           "ORDER BY p.patternType, p.patternValue")
    List<LearnedPattern> findConfident(@Param("userId") String userId,
                                       @Param("minConfidence") double minConfidence,
                                       @Param("minSamples") int minSamples);
}
