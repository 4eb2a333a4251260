package rasterlab.raster;

import java.util.ArrayList;
import java.util.List;

/**
 * Line drawing straight from the explicit equation {@code y = kx + b}, stepping along the
 * dominant axis.
 */
public final class StepwiseLine {
  private StepwiseLine() {
  }

  public static List<PixelSample> rasterize(LineRequest line) {
    return rasterize(line.x1(), line.y1(), line.x2(), line.y2());
  }

  public static List<PixelSample> rasterize(int x1, int y1, int x2, int y2) {
    long dx = (long) x2 - x1;
    long dy = (long) y2 - y1;

    // Slope is undefined; walk the column bottom-up regardless of endpoint order.
    if (dx == 0) {
      int from = Math.min(y1, y2);
      long count = Math.abs(dy) + 1;
      List<PixelSample> out = new ArrayList<>(Geometry.capacity(count));
      for (long i = 0; i < count; i++) {
        out.add(PixelSample.opaque(x1, (int) (from + i)));
      }
      return out;
    }

    double k = (double) dy / dx;
    double b = y1 - k * x1;

    if (Math.abs(dx) >= Math.abs(dy)) {
      int step = dx > 0 ? 1 : -1;
      long count = Math.abs(dx) + 1;
      List<PixelSample> out = new ArrayList<>(Geometry.capacity(count));
      for (long i = 0; i < count; i++) {
        int x = (int) (x1 + i * step);
        out.add(PixelSample.opaque(x, Geometry.round(k * x + b)));
      }
      return out;
    }

    // |dy| > |dx| >= 1 here, so k is never zero.
    int step = dy > 0 ? 1 : -1;
    long count = Math.abs(dy) + 1;
    List<PixelSample> out = new ArrayList<>(Geometry.capacity(count));
    for (long i = 0; i < count; i++) {
      int y = (int) (y1 + i * step);
      out.add(PixelSample.opaque(Geometry.round((y - b) / k), y));
    }
    return out;
  }
}
