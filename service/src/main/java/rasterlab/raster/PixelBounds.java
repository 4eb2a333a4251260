package rasterlab.raster;

/**
 * Inclusive box of every pixel coordinate a rasterizer can emit for a request, held in long
 * space so that boxes reaching past the int range can still be described.
 */
public record PixelBounds(long minX, long minY, long maxX, long maxY) {

  public static PixelBounds of(long ax, long ay, long bx, long by) {
    return new PixelBounds(Math.min(ax, bx), Math.min(ay, by), Math.max(ax, bx),
        Math.max(ay, by));
  }

  public PixelBounds union(PixelBounds other) {
    return new PixelBounds(Math.min(minX, other.minX), Math.min(minY, other.minY),
        Math.max(maxX, other.maxX), Math.max(maxY, other.maxY));
  }

  public PixelBounds growMaxX(long by) {
    return new PixelBounds(minX, minY, maxX + by, maxY);
  }

  public PixelBounds growMaxY(long by) {
    return new PixelBounds(minX, minY, maxX, maxY + by);
  }

  public boolean fitsInt() {
    return minX >= Integer.MIN_VALUE && minY >= Integer.MIN_VALUE
        && maxX <= Integer.MAX_VALUE && maxY <= Integer.MAX_VALUE;
  }

  void requireInt() {
    if (!fitsInt()) {
      throw new IllegalArgumentException("pixel coordinates " + this + " exceed the int range");
    }
  }
}
