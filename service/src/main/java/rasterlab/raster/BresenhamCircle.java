package rasterlab.raster;

import java.util.ArrayList;
import java.util.List;

/**
 * Midpoint circle: walks one octant with an integer decision variable and mirrors every
 * point into the other seven.
 *
 * <p>Points come out in batches of eight (one per octant) in the order the octant is walked,
 * not sorted by angle. Batches near the octant boundary repeat pixels; nothing is
 * deduplicated.
 *
 * <p>The whole circle must lie inside the int coordinate range; the decision variable is
 * kept in long.
 */
public final class BresenhamCircle {
  private BresenhamCircle() {
  }

  public static List<PixelSample> rasterize(CircleRequest circle) {
    return rasterize(circle.xc(), circle.yc(), circle.r());
  }

  public static List<PixelSample> rasterize(int xc, int yc, int r) {
    if (r < 0) {
      throw new IllegalArgumentException("radius must be non-negative, got " + r);
    }
    new CircleRequest(xc, yc, r).bounds().requireInt();
    int x = 0;
    int y = r;
    long d = 3 - 2L * r;

    List<PixelSample> out = new ArrayList<>(Geometry.capacity(8L * (r + 2)));
    mirror(out, xc, yc, x, y);
    // A zero radius would step the decision variable off the centre.
    if (r == 0) {
      return out;
    }

    while (y >= x) {
      x++;
      if (d > 0) {
        y--;
        d += 4L * (x - y) + 10;
      } else {
        d += 4L * x + 6;
      }
      mirror(out, xc, yc, x, y);
    }
    return out;
  }

  private static void mirror(List<PixelSample> out, int xc, int yc, int x, int y) {
    out.add(PixelSample.opaque(xc + x, yc + y));
    out.add(PixelSample.opaque(xc - x, yc + y));
    out.add(PixelSample.opaque(xc + x, yc - y));
    out.add(PixelSample.opaque(xc - x, yc - y));
    out.add(PixelSample.opaque(xc + y, yc + x));
    out.add(PixelSample.opaque(xc - y, yc + x));
    out.add(PixelSample.opaque(xc + y, yc - x));
    out.add(PixelSample.opaque(xc - y, yc - x));
  }
}
