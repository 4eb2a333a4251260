package rasterlab.draw;

import static rasterlab.draw.InvalidParameterException.COORDINATE_OUT_OF_RANGE;
import static rasterlab.draw.InvalidParameterException.NEGATIVE_RADIUS;
import static rasterlab.draw.InvalidParameterException.SPAN_TOO_LARGE;

import java.util.Arrays;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import rasterlab.raster.Algorithm;
import rasterlab.raster.Dispatcher;
import rasterlab.raster.PixelBounds;
import rasterlab.raster.PixelSample;
import rasterlab.raster.RasterRequest;

@Service
public class DrawService {
  private static final Logger log = LoggerFactory.getLogger(DrawService.class);

  private final long maxSpan;
  private final String errorDocsBase;

  public DrawService(@Value("${raster.limits.max-span:100000}") long maxSpan,
      @Value("${raster.errors.docs-base:https://docs.raster-api.dev/errors/}") String errorDocsBase) {
    if (maxSpan < 1) {
      throw new IllegalStateException("raster.limits.max-span must be positive, got " + maxSpan);
    }
    this.maxSpan = maxSpan;
    this.errorDocsBase = errorDocsBase.endsWith("/") ? errorDocsBase : errorDocsBase + '/';
  }

  public RasterResult draw(DrawRequest request) {
    Algorithm algorithm = Algorithm.fromName(request.algorithm());
    RasterRequest geometry = request.toRasterRequest();
    checkLimits(algorithm, geometry);

    long start = System.nanoTime();
    List<PixelSample> points = Dispatcher.rasterize(algorithm, geometry);
    long elapsed = System.nanoTime() - start;

    log.debug("Rasterized {} into {} samples in {} ns", algorithm.canonicalName(),
        points.size(), elapsed);
    return new RasterResult(algorithm, points, elapsed);
  }

  public List<AlgorithmInfo> algorithms() {
    return Arrays.stream(Algorithm.values()).map(AlgorithmInfo::of).toList();
  }

  public InvalidParameterException invalidParameter(String message, int errorCode) {
    return new InvalidParameterException(message, errorCode, errorDocsBase);
  }

  private void checkLimits(Algorithm algorithm, RasterRequest geometry) {
    checkCost(algorithm, geometry);
    PixelBounds bounds = Dispatcher.bounds(algorithm, geometry);
    if (!bounds.fitsInt()) {
      throw invalidParameter("Shape covers pixels outside the 32-bit coordinate range: x in ["
          + bounds.minX() + ", " + bounds.maxX() + "], y in [" + bounds.minY() + ", "
          + bounds.maxY() + "].", COORDINATE_OUT_OF_RANGE);
    }
  }

  private void checkCost(Algorithm algorithm, RasterRequest geometry) {
    switch (algorithm.shape()) {
      case LINE -> {
        long span = geometry.toLine().span();
        if (span > maxSpan) {
          throw invalidParameter("Line span " + span + " exceeds the limit of " + maxSpan + ".",
              SPAN_TOO_LARGE);
        }
      }
      case CIRCLE -> {
        if (geometry.r() < 0) {
          throw invalidParameter("Invalid radius " + geometry.r() + ". Must be non-negative.",
              NEGATIVE_RADIUS);
        }
        if (geometry.r() > maxSpan) {
          throw invalidParameter("Radius " + geometry.r() + " exceeds the limit of " + maxSpan
              + ".", SPAN_TOO_LARGE);
        }
      }
      // Curves always take a fixed number of samples.
      case CURVE -> {
      }
    }
  }
}
