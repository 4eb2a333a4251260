package rasterlab.raster;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * One emitted pixel. {@code alpha} is the coverage of the pixel by the ideal line, 1.0 for
 * every algorithm except Wu's.
 */
@JsonPropertyOrder({"x", "y", "alpha"})
public record PixelSample(int x, int y, double alpha) {

  public PixelSample {
    if (!(alpha >= 0d && alpha <= 1d)) {
      throw new IllegalArgumentException("alpha must lie in [0,1], got " + alpha);
    }
  }

  public static PixelSample opaque(int x, int y) {
    return new PixelSample(x, y, 1d);
  }
}
