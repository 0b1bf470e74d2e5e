package career.pulse.app.repository;

import career.pulse.app.entity.JobApplication;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface JobApplicationRepository extends JpaRepository<JobApplication, String> {
    List<JobApplication> findByUserId(String userId);
    List<JobApplication> findByUserIdOrderByDateAppliedDesc(String userId);
    Optional<JobApplication> findByIdAndUserId(String id, String userId);
    long countByUserId(String userId);
}
