package com.ospicorp.waterquality.web;

import io.swagger.v3.oas.annotations.Hidden;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Hidden
public class RootController {

  private static final List<String> ENDPOINTS = List.of(
      "POST /api/readings",
      "GET /api/readings/latest",
      "GET /api/predictions",
      "GET /api/predictions/latest",
      "GET /api/predictions/{date}",
      "POST /api/predictions/trigger",
      "GET /api/dashboard",
      "GET /admin/job");

  @GetMapping("/")
  public Map<String, Object> root() {
    Map<String, Object> banner = new LinkedHashMap<>();
    banner.put("service", "water-quality-service");
    banner.put("status", "ok");
    banner.put("endpoints", ENDPOINTS);
    return banner;
  }

  @GetMapping("/v1/ping")
  public ResponseEntity<Map<String, Object>> ping() {
    return ResponseEntity.ok(Map.of("pong", true));
  }
}
