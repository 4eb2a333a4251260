package rasterlab.web;

import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import rasterlab.raster.Algorithm;

@RestController
public class RootController {

  @GetMapping("/")
  public Map<String, Object> root() {
    return Map.of(
        "service", "raster-service",
        "status", "ok",
        "draw", "POST /v1/draw",
        "algorithms", Algorithm.canonicalNames(),
        "docs", "/swagger-ui.html");
  }

  @GetMapping("/v1/ping")
  public ResponseEntity<Map<String, Object>> ping() {
    return ResponseEntity.ok(Map.of("pong", true, "algorithms", Algorithm.values().length));
  }
}
