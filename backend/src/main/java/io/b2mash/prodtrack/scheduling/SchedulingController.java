package io.b2mash.prodtrack.scheduling;

import io.b2mash.prodtrack.scheduling.dto.AdvanceStatusRequest;
import io.b2mash.prodtrack.scheduling.dto.AdvanceStatusResponse;
import io.b2mash.prodtrack.scheduling.dto.CalculateDatesRequest;
import io.b2mash.prodtrack.scheduling.dto.CalculatedDatesResponse;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/scheduling")
public class SchedulingController {

  private final SchedulingService schedulingService;

  public SchedulingController(SchedulingService schedulingService) {
    this.schedulingService = schedulingService;
  }

  @PostMapping("/calculate")
  public ResponseEntity<CalculatedDatesResponse> calculate(
      @Valid @RequestBody CalculateDatesRequest request) {
    return ResponseEntity.ok(schedulingService.calculate(request));
  }

  @PostMapping("/advance")
  public ResponseEntity<AdvanceStatusResponse> advance(
      @Valid @RequestBody AdvanceStatusRequest request) {
    return ResponseEntity.ok(schedulingService.advance(request));
  }
}
