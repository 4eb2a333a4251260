package rasterlab.raster;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Rasterization algorithms addressable by name. Besides the canonical name each algorithm
 * accepts the short names used by the legacy browser client.
 */
public enum Algorithm {
  STEPWISE("stepwise", Shape.LINE, false, "step"),
  DDA("dda", Shape.LINE, false),
  BRESENHAM_LINE("bresenham-line", Shape.LINE, false, "bresenham_line"),
  BRESENHAM_CIRCLE("bresenham-circle", Shape.CIRCLE, false, "bresenham_circle"),
  BEZIER_CUBIC("bezier-cubic", Shape.CURVE, false, "casteljau"),
  WU_ANTIALIASED("wu-antialiased", Shape.LINE, true, "wu");

  private final String canonicalName;
  private final Shape shape;
  private final boolean antialiased;
  private final List<String> aliases;

  Algorithm(String canonicalName, Shape shape, boolean antialiased, String... aliases) {
    this.canonicalName = canonicalName;
    this.shape = shape;
    this.antialiased = antialiased;
    this.aliases = List.of(aliases);
  }

  public String canonicalName() {
    return canonicalName;
  }

  public Shape shape() {
    return shape;
  }

  public boolean antialiased() {
    return antialiased;
  }

  public List<String> aliases() {
    return aliases;
  }

  public static Algorithm fromName(String name) {
    if (name == null || name.isBlank()) {
      throw new UnsupportedAlgorithmException(name);
    }
    String key = name.trim().toLowerCase(Locale.ROOT);
    for (Algorithm algorithm : values()) {
      if (algorithm.canonicalName.equals(key) || algorithm.aliases.contains(key)) {
        return algorithm;
      }
    }
    throw new UnsupportedAlgorithmException(name);
  }

  public static List<String> canonicalNames() {
    return Arrays.stream(values()).map(Algorithm::canonicalName).toList();
  }
}
