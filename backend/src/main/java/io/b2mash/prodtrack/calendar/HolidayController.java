package io.b2mash.prodtrack.calendar;

import io.b2mash.prodtrack.calendar.dto.HolidayRequest;
import io.b2mash.prodtrack.calendar.dto.HolidayResponse;
import jakarta.validation.Valid;
import java.net.URI;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/holidays")
public class HolidayController {

  private final HolidayService holidayService;

  public HolidayController(HolidayService holidayService) {
    this.holidayService = holidayService;
  }

  @GetMapping
  public ResponseEntity<List<HolidayResponse>> list() {
    return ResponseEntity.ok(holidayService.listAll());
  }

  @GetMapping("/year/{year}")
  public ResponseEntity<List<HolidayResponse>> listForYear(@PathVariable int year) {
    return ResponseEntity.ok(holidayService.listForYear(year));
  }

  @PostMapping
  @PreAuthorize("hasAnyRole('ADMIN', 'MANAGER')")
  public ResponseEntity<HolidayResponse> create(@Valid @RequestBody HolidayRequest request) {
    var response = holidayService.create(request);
    return ResponseEntity.created(URI.create("/api/holidays/" + response.id())).body(response);
  }

  @PutMapping("/{id}")
  @PreAuthorize("hasAnyRole('ADMIN', 'MANAGER')")
  public ResponseEntity<HolidayResponse> update(
      @PathVariable Long id, @Valid @RequestBody HolidayRequest request) {
    return ResponseEntity.ok(holidayService.update(id, request));
  }

  @DeleteMapping("/{id}")
  @PreAuthorize("hasAnyRole('ADMIN', 'MANAGER')")
  public ResponseEntity<Void> delete(@PathVariable Long id) {
    holidayService.delete(id);
    return ResponseEntity.noContent().build();
  }
}
