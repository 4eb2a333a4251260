package rasterlab.draw;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import rasterlab.raster.RasterRequest;

// Absent coordinates deserialize to 0; each algorithm reads only the fields it needs.
@Schema(description = "Draw request. Circles use (x1, y1) as centre and r as radius.")
public record DrawRequest(
    @NotBlank @Schema(example = "bresenham-line") String algorithm,
    int x1,
    int y1,
    int x2,
    int y2,
    int x3,
    int y3,
    int x4,
    int y4,
    int r
) {

  public RasterRequest toRasterRequest() {
    return new RasterRequest(x1, y1, x2, y2, x3, y3, x4, y4, r);
  }
}
