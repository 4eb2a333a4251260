package rasterlab.raster;

public record CircleRequest(int xc, int yc, int r) {

  public CircleRequest {
    if (r < 0) {
      throw new IllegalArgumentException("radius must be non-negative, got " + r);
    }
  }

  public PixelBounds bounds() {
    return new PixelBounds((long) xc - r, (long) yc - r, (long) xc + r, (long) yc + r);
  }
}
