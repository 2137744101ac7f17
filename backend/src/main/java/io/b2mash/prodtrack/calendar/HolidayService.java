package io.b2mash.prodtrack.calendar;

import io.b2mash.prodtrack.calendar.dto.HolidayRequest;
import io.b2mash.prodtrack.calendar.dto.HolidayResponse;
import io.b2mash.prodtrack.exception.InvalidStateException;
import io.b2mash.prodtrack.exception.ResourceConflictException;
import io.b2mash.prodtrack.exception.ResourceNotFoundException;
import java.time.LocalDate;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class HolidayService {

  private static final Logger log = LoggerFactory.getLogger(HolidayService.class);

  private final HolidayRepository holidayRepository;

  public HolidayService(HolidayRepository holidayRepository) {
    this.holidayRepository = holidayRepository;
  }

  @Transactional(readOnly = true)
  public List<HolidayResponse> listAll() {
    return holidayRepository.findAllOrderByDate().stream().map(HolidayResponse::from).toList();
  }

  @Transactional(readOnly = true)
  public List<HolidayResponse> listForYear(int year) {
    if (year < 1900 || year > 9999) {
      throw new InvalidStateException("Invalid year", "Year must be between 1900 and 9999");
    }
    return holidayRepository
        .findBetween(LocalDate.of(year, 1, 1), LocalDate.of(year, 12, 31))
        .stream()
        .map(HolidayResponse::from)
        .toList();
  }

  @Transactional
  public HolidayResponse create(HolidayRequest request) {
    requireDateAvailable(request.date(), null);

    var holiday =
        new Holiday(
            request.name(),
            request.date(),
            request.isPublic() == null || request.isPublic(),
            request.isCustom() == null || request.isCustom(),
            request.description());
    holiday = holidayRepository.save(holiday);

    log.info(
        "Created holiday: id={}, name={}, date={}",
        holiday.getId(),
        holiday.getName(),
        holiday.getDate());
    return HolidayResponse.from(holiday);
  }

  @Transactional
  public HolidayResponse update(Long id, HolidayRequest request) {
    var holiday =
        holidayRepository
            .findById(id)
            .orElseThrow(() -> new ResourceNotFoundException("Holiday", id));
    requireDateAvailable(request.date(), id);

    holiday.update(
        request.name(),
        request.date(),
        request.isPublic() == null ? holiday.isPublic() : request.isPublic(),
        request.isCustom() == null ? holiday.isCustom() : request.isCustom(),
        request.description());
    holiday = holidayRepository.save(holiday);

    log.info("Updated holiday: id={}, date={}", holiday.getId(), holiday.getDate());
    return HolidayResponse.from(holiday);
  }

  @Transactional
  public void delete(Long id) {
    var holiday =
        holidayRepository
            .findById(id)
            .orElseThrow(() -> new ResourceNotFoundException("Holiday", id));
    holidayRepository.delete(holiday);
    log.info("Deleted holiday: id={}, date={}", holiday.getId(), holiday.getDate());
  }

  private void requireDateAvailable(LocalDate date, Long ownId) {
    holidayRepository
        .findByDate(date)
        .filter(existing -> !existing.getId().equals(ownId))
        .ifPresent(
            existing -> {
              throw ResourceConflictException.duplicate("holiday", "date", date);
            });
  }
}
