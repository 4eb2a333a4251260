package rasterlab.raster;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class PixelSampleTest {

  @Test
  void opaqueSamplesCarryFullAlpha() {
    assertEquals(new PixelSample(4, -2, 1d), PixelSample.opaque(4, -2));
  }

  @Test
  void alphaOutsideUnitIntervalIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> new PixelSample(0, 0, 1.5));
    assertThrows(IllegalArgumentException.class, () -> new PixelSample(0, 0, -0.01));
    assertThrows(IllegalArgumentException.class, () -> new PixelSample(0, 0, Double.NaN));
  }
}
