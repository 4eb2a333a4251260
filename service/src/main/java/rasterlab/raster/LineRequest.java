package rasterlab.raster;

// Endpoints in either order; dx = 0, dy = 0 and both are valid.
public record LineRequest(int x1, int y1, int x2, int y2) {

  /** Length along the dominant axis, computed in long space to survive extreme endpoints. */
  public long span() {
    return Math.max(Math.abs((long) x2 - x1), Math.abs((long) y2 - y1));
  }

  public PixelBounds bounds() {
    return PixelBounds.of(x1, y1, x2, y2);
  }
}
