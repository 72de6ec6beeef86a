package com.scholary.tts.handler.api;

import com.scholary.tts.handler.service.HealthService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/** Health check for load balancers. Always answers 200. */
@RestController
@Tag(name = "Health", description = "Liveness and queue statistics")
public class HealthController {

  private final HealthService healthService;

  public HealthController(HealthService healthService) {
    this.healthService = healthService;
  }

  @GetMapping("/health")
  @Operation(summary = "Health check", description = "Liveness plus queue and artifact counters")
  public HealthResponse health() {
    return healthService.report();
  }
}
