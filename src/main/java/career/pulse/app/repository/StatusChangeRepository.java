package career.pulse.app.repository;

import career.pulse.app.entity.StatusChange;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface StatusChangeRepository extends JpaRepository<StatusChange, String> {
    List<StatusChange> findByApplicationIdOrderByChangedAtDesc(String applicationId);
    void deleteByApplicationId(String applicationId);
}
