package rasterlab.raster;

import java.util.List;

/**
 * Routes a request to the rasterizer an {@link Algorithm} names, handing it only the fields
 * of its shape. The produced samples are returned as generated.
 */
public final class Dispatcher {
  private Dispatcher() {
  }

  public static List<PixelSample> rasterize(String algorithmName, RasterRequest request) {
    return rasterize(Algorithm.fromName(algorithmName), request);
  }

  public static List<PixelSample> rasterize(Algorithm algorithm, RasterRequest request) {
    return switch (algorithm) {
      case STEPWISE -> StepwiseLine.rasterize(request.toLine());
      case DDA -> DdaLine.rasterize(request.toLine());
      case BRESENHAM_LINE -> BresenhamLine.rasterize(request.toLine());
      case BRESENHAM_CIRCLE -> BresenhamCircle.rasterize(request.toCircle());
      case BEZIER_CUBIC -> CasteljauCurve.rasterize(request.toCurve());
      case WU_ANTIALIASED -> WuLine.rasterize(request.toLine());
    };
  }

  /** Every pixel coordinate the algorithm can emit for this request lies inside the box. */
  public static PixelBounds bounds(Algorithm algorithm, RasterRequest request) {
    return switch (algorithm) {
      case STEPWISE, DDA, BRESENHAM_LINE -> request.toLine().bounds();
      case BRESENHAM_CIRCLE -> request.toCircle().bounds();
      case BEZIER_CUBIC -> request.toCurve().bounds();
      case WU_ANTIALIASED -> WuLine.bounds(request.toLine());
    };
  }
}
