package rasterlab.raster;

import java.util.ArrayList;
import java.util.List;

/**
 * Cubic Bézier sampled with de Casteljau's construction at a fixed parameter step.
 *
 * <p>The parameter is sampled uniformly, not by arc length, so pixel density varies along
 * the curve.
 */
public final class CasteljauCurve {
  /** Number of parameter intervals; {@code t} advances by 0.005 and 201 samples are emitted. */
  public static final int STEPS = 200;

  private CasteljauCurve() {
  }

  public static List<PixelSample> rasterize(CurveRequest curve) {
    List<PixelSample> out = new ArrayList<>(STEPS + 1);
    for (int i = 0; i <= STEPS; i++) {
      double t = (double) i / STEPS;
      out.add(evaluate(curve, t));
    }
    return out;
  }

  static PixelSample evaluate(CurveRequest c, double t) {
    double q0x = lerp(c.x1(), c.x2(), t);
    double q0y = lerp(c.y1(), c.y2(), t);
    double q1x = lerp(c.x2(), c.x3(), t);
    double q1y = lerp(c.y2(), c.y3(), t);
    double q2x = lerp(c.x3(), c.x4(), t);
    double q2y = lerp(c.y3(), c.y4(), t);

    double r0x = lerp(q0x, q1x, t);
    double r0y = lerp(q0y, q1y, t);
    double r1x = lerp(q1x, q2x, t);
    double r1y = lerp(q1y, q2y, t);

    double bx = lerp(r0x, r1x, t);
    double by = lerp(r0y, r1y, t);
    return PixelSample.opaque(Geometry.round(bx), Geometry.round(by));
  }

  private static double lerp(double a, double b, double t) {
    return a + (b - a) * t;
  }
}
