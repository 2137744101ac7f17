package io.b2mash.prodtrack.leadtime;

import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface LeadTimeRepository extends JpaRepository<LeadTime, Long> {

  @Query("SELECT l FROM LeadTime l ORDER BY l.fromStatusId ASC, l.toStatusId ASC")
  List<LeadTime> findAllOrdered();

  /** Rules in insertion order, as consumed by the scheduler. */
  @Query("SELECT l FROM LeadTime l ORDER BY l.id ASC")
  List<LeadTime> findAllInInsertionOrder();

  @Query("SELECT l FROM LeadTime l WHERE l.fromStatusId = :statusId ORDER BY l.toStatusId ASC")
  List<LeadTime> findByFromStatusId(@Param("statusId") Long statusId);

  @Query(
      "SELECT l FROM LeadTime l WHERE l.fromStatusId = :fromStatusId"
          + " AND l.toStatusId = :toStatusId ORDER BY l.id ASC")
  List<LeadTime> findByPair(
      @Param("fromStatusId") Long fromStatusId, @Param("toStatusId") Long toStatusId);

  default Optional<LeadTime> findFirstByPair(Long fromStatusId, Long toStatusId) {
    return findByPair(fromStatusId, toStatusId).stream().findFirst();
  }
}
