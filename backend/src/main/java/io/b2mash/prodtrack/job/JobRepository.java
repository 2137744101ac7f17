package io.b2mash.prodtrack.job;

import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface JobRepository extends JpaRepository<Job, Long> {

  @Query("SELECT j FROM Job j WHERE j.projectId = :projectId ORDER BY j.createdAt DESC")
  List<Job> findByProjectId(@Param("projectId") Long projectId);

  @Query("SELECT j FROM Job j ORDER BY j.createdAt DESC")
  List<Job> findAllNewestFirst();

  boolean existsByStatusId(Long statusId);
}
