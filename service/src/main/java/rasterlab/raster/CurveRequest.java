package rasterlab.raster;

/**
 * Four control points of a cubic Bézier. Coincident points are allowed and simply produce a
 * degenerate curve.
 */
public record CurveRequest(int x1, int y1, int x2, int y2, int x3, int y3, int x4, int y4) {

  // The curve never leaves the convex hull of its control points.
  public PixelBounds bounds() {
    return PixelBounds.of(x1, y1, x2, y2).union(PixelBounds.of(x3, y3, x4, y4));
  }
}
