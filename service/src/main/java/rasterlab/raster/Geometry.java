package rasterlab.raster;

/**
 * Rounding and fractional-part helpers shared by the rasterizers.
 */
public final class Geometry {
  private static final int MAX_INITIAL_CAPACITY = 1 << 16;

  private Geometry() {
  }

  /** Initial list capacity for an expected sample count; large outputs grow on demand. */
  static int capacity(long samples) {
    return (int) Math.max(0L, Math.min(samples, MAX_INITIAL_CAPACITY));
  }

  /** Rounds half away from zero: 2.5 -> 3, -2.5 -> -3. */
  public static int round(double value) {
    double magnitude = Math.abs(value);
    double whole = Math.floor(magnitude);
    if (magnitude - whole >= 0.5d) {
      whole += 1d;
    }
    return (int) Math.copySign(whole, value);
  }

  /** Rounds half up: 2.5 -> 3, -2.5 -> -2. */
  public static int roundHalfUp(double value) {
    return (int) Math.floor(value + 0.5d);
  }

  /** Integer part, floor based so that ipart(-0.25) == -1. */
  public static int ipart(double value) {
    return (int) Math.floor(value);
  }

  /** Fractional part in [0,1), floor based. */
  public static double fpart(double value) {
    return value - Math.floor(value);
  }

  public static double rfpart(double value) {
    return 1d - fpart(value);
  }

  public static double clamp(double value, double low, double high) {
    if (value < low) return low;
    if (value > high) return high;
    return value;
  }
}
