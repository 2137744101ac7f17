package io.b2mash.prodtrack.leadtime;

import io.b2mash.prodtrack.leadtime.dto.InitializeLeadTimesResponse;
import io.b2mash.prodtrack.leadtime.dto.LeadTimeResponse;
import io.b2mash.prodtrack.leadtime.dto.UpdateLeadTimeRequest;
import io.b2mash.prodtrack.leadtime.dto.UpsertLeadTimeRequest;
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
@RequestMapping("/api/lead-times")
public class LeadTimeController {

  private final LeadTimeService leadTimeService;

  public LeadTimeController(LeadTimeService leadTimeService) {
    this.leadTimeService = leadTimeService;
  }

  @GetMapping
  public ResponseEntity<List<LeadTimeResponse>> list() {
    return ResponseEntity.ok(leadTimeService.listAll());
  }

  @GetMapping("/status/{statusId}")
  public ResponseEntity<List<LeadTimeResponse>> listFromStatus(@PathVariable Long statusId) {
    return ResponseEntity.ok(leadTimeService.listFromStatus(statusId));
  }

  @PostMapping
  @PreAuthorize("hasAnyRole('ADMIN', 'MANAGER')")
  public ResponseEntity<LeadTimeResponse> upsert(
      @Valid @RequestBody UpsertLeadTimeRequest request) {
    var outcome = leadTimeService.upsert(request);
    if (outcome.created()) {
      return ResponseEntity.created(URI.create("/api/lead-times/" + outcome.leadTime().id()))
          .body(outcome.leadTime());
    }
    return ResponseEntity.ok(outcome.leadTime());
  }

  @PutMapping("/{id}")
  @PreAuthorize("hasAnyRole('ADMIN', 'MANAGER')")
  public ResponseEntity<LeadTimeResponse> update(
      @PathVariable Long id, @Valid @RequestBody UpdateLeadTimeRequest request) {
    return ResponseEntity.ok(leadTimeService.update(id, request));
  }

  @DeleteMapping("/{id}")
  @PreAuthorize("hasAnyRole('ADMIN', 'MANAGER')")
  public ResponseEntity<Void> delete(@PathVariable Long id) {
    leadTimeService.delete(id);
    return ResponseEntity.noContent().build();
  }

  @PostMapping("/initialize")
  @PreAuthorize("hasAnyRole('ADMIN', 'MANAGER')")
  public ResponseEntity<InitializeLeadTimesResponse> initialize() {
    return ResponseEntity.ok(leadTimeService.initializeDefaults());
  }
}
