package rasterlab.raster;

/**
 * Every scalar a rasterizer may read. Each algorithm takes the subset its shape needs and
 * ignores the rest.
 */
public record RasterRequest(int x1, int y1, int x2, int y2, int x3, int y3, int x4, int y4,
    int r) {

  public static RasterRequest line(int x1, int y1, int x2, int y2) {
    return new RasterRequest(x1, y1, x2, y2, 0, 0, 0, 0, 0);
  }

  public static RasterRequest circle(int xc, int yc, int r) {
    return new RasterRequest(xc, yc, 0, 0, 0, 0, 0, 0, r);
  }

  public static RasterRequest curve(int x1, int y1, int x2, int y2, int x3, int y3, int x4,
      int y4) {
    return new RasterRequest(x1, y1, x2, y2, x3, y3, x4, y4, 0);
  }

  public LineRequest toLine() {
    return new LineRequest(x1, y1, x2, y2);
  }

  // The centre travels in the first point.
  public CircleRequest toCircle() {
    return new CircleRequest(x1, y1, r);
  }

  public CurveRequest toCurve() {
    return new CurveRequest(x1, y1, x2, y2, x3, y3, x4, y4);
  }
}
