package io.b2mash.prodtrack.jobstatus;

import io.b2mash.prodtrack.jobstatus.dto.CreateJobStatusRequest;
import io.b2mash.prodtrack.jobstatus.dto.JobStatusResponse;
import io.b2mash.prodtrack.jobstatus.dto.ReorderJobStatusesRequest;
import io.b2mash.prodtrack.jobstatus.dto.UpdateJobStatusRequest;
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
@RequestMapping("/api/job-statuses")
public class JobStatusController {

  private final JobStatusService jobStatusService;

  public JobStatusController(JobStatusService jobStatusService) {
    this.jobStatusService = jobStatusService;
  }

  @GetMapping
  public ResponseEntity<List<JobStatusResponse>> list() {
    return ResponseEntity.ok(jobStatusService.listAll());
  }

  @PostMapping
  @PreAuthorize("hasAnyRole('ADMIN', 'MANAGER')")
  public ResponseEntity<JobStatusResponse> create(
      @Valid @RequestBody CreateJobStatusRequest request) {
    var response = jobStatusService.create(request);
    return ResponseEntity.created(URI.create("/api/job-statuses/" + response.id())).body(response);
  }

  @PutMapping("/reorder")
  @PreAuthorize("hasAnyRole('ADMIN', 'MANAGER')")
  public ResponseEntity<List<JobStatusResponse>> reorder(
      @Valid @RequestBody ReorderJobStatusesRequest request) {
    return ResponseEntity.ok(jobStatusService.reorder(request));
  }

  @PutMapping("/{id}")
  @PreAuthorize("hasAnyRole('ADMIN', 'MANAGER')")
  public ResponseEntity<JobStatusResponse> update(
      @PathVariable Long id, @Valid @RequestBody UpdateJobStatusRequest request) {
    return ResponseEntity.ok(jobStatusService.update(id, request));
  }

  @DeleteMapping("/{id}")
  @PreAuthorize("hasAnyRole('ADMIN', 'MANAGER')")
  public ResponseEntity<Void> delete(@PathVariable Long id) {
    jobStatusService.delete(id);
    return ResponseEntity.noContent().build();
  }
}
