package junie.email.intel.repository;

import junie.email.intel.entity.UserAction;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface UserActionRepository extends JpaRepository<UserAction, String> {
    long countByUserId(String userId);

    // Rows of [action, count]
    @Query("SELECT a.action, COUNT(a) FROM UserAction a WHERE a.userId = :userId GROUP BY a.action")
    List<Object[]> countByAction(@Param("userId") String userId);

    // Rows of [feedback, count]
    @Query("SELECT a.feedback, COUNT(a) FROM UserAction a WHERE a.userId = :userId GROUP BY a.feedback")
    List<Object[]> countByFeedback(@Param("userId") String userId);
}
