package io.b2mash.prodtrack.calendar;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface HolidayRepository extends JpaRepository<Holiday, Long> {

  @Query("SELECT h FROM Holiday h ORDER BY h.date ASC")
  List<Holiday> findAllOrderByDate();

  @Query("SELECT h FROM Holiday h WHERE h.date BETWEEN :from AND :to ORDER BY h.date ASC")
  List<Holiday> findBetween(@Param("from") LocalDate from, @Param("to") LocalDate to);

  @Query("SELECT h FROM Holiday h WHERE h.date = :date")
  Optional<Holiday> findByDate(@Param("date") LocalDate date);
}
