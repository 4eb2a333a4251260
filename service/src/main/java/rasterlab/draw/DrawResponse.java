package rasterlab.draw;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import rasterlab.raster.PixelSample;

public record DrawResponse(
    String algorithm,
    @JsonProperty("point_count") int pointCount,
    List<PixelSample> points,
    long elapsed
) {

  static DrawResponse from(RasterResult result) {
    return new DrawResponse(result.algorithm().canonicalName(), result.points().size(),
        result.points(), result.elapsedNanos());
  }
}
