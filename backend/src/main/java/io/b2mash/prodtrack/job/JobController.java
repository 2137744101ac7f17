package io.b2mash.prodtrack.job;

import io.b2mash.prodtrack.job.dto.CreateJobRequest;
import io.b2mash.prodtrack.job.dto.JobResponse;
import io.b2mash.prodtrack.job.dto.RescheduleJobRequest;
import jakarta.validation.Valid;
import java.net.URI;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/jobs")
public class JobController {

  private final JobService jobService;

  public JobController(JobService jobService) {
    this.jobService = jobService;
  }

  @GetMapping
  public ResponseEntity<List<JobResponse>> list(@RequestParam(required = false) Long projectId) {
    return ResponseEntity.ok(jobService.list(projectId));
  }

  @GetMapping("/{id}")
  public ResponseEntity<JobResponse> get(@PathVariable Long id) {
    return ResponseEntity.ok(jobService.get(id));
  }

  @PostMapping
  public ResponseEntity<JobResponse> create(@Valid @RequestBody CreateJobRequest request) {
    var response = jobService.create(request);
    return ResponseEntity.created(URI.create("/api/jobs/" + response.id())).body(response);
  }

  @PostMapping("/{id}/advance-status")
  public ResponseEntity<JobResponse> advanceStatus(@PathVariable Long id) {
    return ResponseEntity.ok(jobService.advanceStatus(id));
  }

  @PutMapping("/{id}/schedule")
  public ResponseEntity<JobResponse> reschedule(
      @PathVariable Long id, @Valid @RequestBody RescheduleJobRequest request) {
    return ResponseEntity.ok(jobService.reschedule(id, request));
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<Void> delete(@PathVariable Long id) {
    jobService.delete(id);
    return ResponseEntity.noContent().build();
  }
}
