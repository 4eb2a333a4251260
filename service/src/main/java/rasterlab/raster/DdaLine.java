package rasterlab.raster;

import java.util.ArrayList;
import java.util.List;

/**
 * Digital differential analyzer: real-valued increments along both axes, rounded at emission.
 *
 * <p>Each sample is computed from its step index ({@code x1 + i * xInc}) rather than by
 * accumulating the increment, so the last sample lands exactly on the end point.
 */
public final class DdaLine {
  private DdaLine() {
  }

  public static List<PixelSample> rasterize(LineRequest line) {
    return rasterize(line.x1(), line.y1(), line.x2(), line.y2());
  }

  public static List<PixelSample> rasterize(int x1, int y1, int x2, int y2) {
    long dx = (long) x2 - x1;
    long dy = (long) y2 - y1;
    long steps = Math.max(Math.abs(dx), Math.abs(dy));

    List<PixelSample> out = new ArrayList<>(Geometry.capacity(steps + 1));
    if (steps == 0) {
      out.add(PixelSample.opaque(x1, y1));
      return out;
    }

    double xInc = (double) dx / steps;
    double yInc = (double) dy / steps;
    for (long i = 0; i <= steps; i++) {
      double x = x1 + i * xInc;
      double y = y1 + i * yInc;
      out.add(PixelSample.opaque(Geometry.round(x), Geometry.round(y)));
    }
    return out;
  }
}
