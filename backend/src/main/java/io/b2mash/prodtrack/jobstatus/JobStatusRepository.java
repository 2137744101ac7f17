package io.b2mash.prodtrack.jobstatus;

import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface JobStatusRepository extends JpaRepository<JobStatus, Long> {

  @Query("SELECT s FROM JobStatus s ORDER BY s.orderIndex ASC")
  List<JobStatus> findAllOrdered();

  @Query("SELECT s FROM JobStatus s WHERE s.name = :name")
  Optional<JobStatus> findByName(@Param("name") String name);

  @Query("SELECT s FROM JobStatus s WHERE s.isDefault = true")
  List<JobStatus> findDefaults();
}
