package rasterlab.raster;

import static rasterlab.raster.Geometry.fpart;
import static rasterlab.raster.Geometry.ipart;
import static rasterlab.raster.Geometry.rfpart;

import java.util.ArrayList;
import java.util.List;

/**
 * Xiaolin Wu's antialiased line. Every column (row, for steep lines) gets two vertically
 * adjacent pixels whose alphas split the coverage of the ideal line between them.
 *
 * <p>Emission order: the two start-point pixels, the two end-point pixels, then one pair per
 * intermediate column from left to right. Steep lines are walked with the axes swapped and
 * transposed back on emission.
 */
public final class WuLine {
  private WuLine() {
  }

  public static List<PixelSample> rasterize(LineRequest line) {
    return rasterize(line.x1(), line.y1(), line.x2(), line.y2());
  }

  /**
   * Pixel box the line can touch: the endpoints plus one extra row (column, for steep lines)
   * for the lower partner of each pair.
   */
  public static PixelBounds bounds(LineRequest line) {
    PixelBounds box = line.bounds();
    boolean steep = isSteep(line.x1(), line.y1(), line.x2(), line.y2());
    return steep ? box.growMaxX(1) : box.growMaxY(1);
  }

  public static List<PixelSample> rasterize(int x1, int y1, int x2, int y2) {
    bounds(new LineRequest(x1, y1, x2, y2)).requireInt();
    boolean steep = isSteep(x1, y1, x2, y2);
    if (steep) {
      int t = x1;
      x1 = y1;
      y1 = t;
      t = x2;
      x2 = y2;
      y2 = t;
    }
    if (x1 > x2) {
      int t = x1;
      x1 = x2;
      x2 = t;
      t = y1;
      y1 = y2;
      y2 = t;
    }

    double dx = (double) x2 - x1;
    double dy = (double) y2 - y1;
    double gradient = dx == 0d ? 1d : dy / dx;

    List<PixelSample> out = new ArrayList<>(Geometry.capacity(2 * ((long) x2 - x1 + 1)));

    int xPixel1 = Geometry.roundHalfUp(x1);
    double yEnd1 = y1 + gradient * (xPixel1 - x1);
    double xGap1 = rfpart(x1 + 0.5d);
    plot(out, steep, xPixel1, ipart(yEnd1), rfpart(yEnd1) * xGap1);
    plot(out, steep, xPixel1, ipart(yEnd1) + 1, fpart(yEnd1) * xGap1);
    double intery = yEnd1 + gradient;

    int xPixel2 = Geometry.roundHalfUp(x2);
    double yEnd2 = y2 + gradient * (xPixel2 - x2);
    double xGap2 = fpart(x2 + 0.5d);
    plot(out, steep, xPixel2, ipart(yEnd2), rfpart(yEnd2) * xGap2);
    plot(out, steep, xPixel2, ipart(yEnd2) + 1, fpart(yEnd2) * xGap2);

    for (long x = (long) xPixel1 + 1; x < xPixel2; x++) {
      plot(out, steep, (int) x, ipart(intery), rfpart(intery));
      plot(out, steep, (int) x, ipart(intery) + 1, fpart(intery));
      intery += gradient;
    }
    return out;
  }

  private static boolean isSteep(int x1, int y1, int x2, int y2) {
    return Math.abs((long) y2 - y1) > Math.abs((long) x2 - x1);
  }

  // (x, y) are in the walked space; transpose back for steep lines.
  private static void plot(List<PixelSample> out, boolean steep, int x, int y, double coverage) {
    double alpha = Geometry.clamp(coverage, 0d, 1d);
    if (steep) {
      out.add(new PixelSample(y, x, alpha));
    } else {
      out.add(new PixelSample(x, y, alpha));
    }
  }
}
