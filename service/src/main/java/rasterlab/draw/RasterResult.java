package rasterlab.draw;

import java.util.List;
import rasterlab.raster.Algorithm;
import rasterlab.raster.PixelSample;

// Samples in generation order plus the time the dispatcher took, measured by DrawService.
public record RasterResult(
    Algorithm algorithm,
    List<PixelSample> points,
    long elapsedNanos
) {}
