package rasterlab.raster;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Integer-only Bresenham line with the symmetric error term {@code err = dx - dy}.
 *
 * <p>The walk always starts from the endpoint with the smaller x (smaller y on a tie) so that
 * A-B and B-A cover the same pixels; ties in the error term would otherwise resolve
 * differently per direction. The result is reversed when needed, so it still runs from
 * {@code (x1, y1)} to {@code (x2, y2)}. A reversed request can therefore pick different tie
 * pixels than a literal walk started at {@code (x1, y1)} would.
 *
 * <p>Deltas and the error term are held in long so that endpoints anywhere in the int range
 * are walked without overflow.
 */
public final class BresenhamLine {
  private BresenhamLine() {
  }

  public static List<PixelSample> rasterize(LineRequest line) {
    return rasterize(line.x1(), line.y1(), line.x2(), line.y2());
  }

  public static List<PixelSample> rasterize(int x1, int y1, int x2, int y2) {
    if (x1 > x2 || (x1 == x2 && y1 > y2)) {
      List<PixelSample> out = walk(x2, y2, x1, y1);
      Collections.reverse(out);
      return out;
    }
    return walk(x1, y1, x2, y2);
  }

  private static List<PixelSample> walk(int x1, int y1, int x2, int y2) {
    long dx = Math.abs((long) x2 - x1);
    long dy = Math.abs((long) y2 - y1);
    int sx = x1 < x2 ? 1 : -1;
    int sy = y1 < y2 ? 1 : -1;
    long err = dx - dy;

    List<PixelSample> out = new ArrayList<>(Geometry.capacity(Math.max(dx, dy) + 1));
    int x = x1;
    int y = y1;
    while (true) {
      out.add(PixelSample.opaque(x, y));
      if (x == x2 && y == y2) {
        return out;
      }
      long e2 = 2 * err;
      // Both branches may fire in one iteration: a diagonal step.
      if (e2 > -dy) {
        err -= dy;
        x += sx;
      }
      if (e2 < dx) {
        err += dx;
        y += sy;
      }
    }
  }
}
