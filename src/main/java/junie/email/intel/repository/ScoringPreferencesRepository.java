package junie.email.intel.repository;

import junie.email.intel.entity.ScoringPreferences;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ScoringPreferencesRepository extends JpaRepository<ScoringPreferences, String> {
}
