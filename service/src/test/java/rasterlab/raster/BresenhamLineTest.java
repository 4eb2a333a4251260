package rasterlab.raster;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import org.junit.jupiter.api.Test;

class BresenhamLineTest {

  @Test
  void horizontalLine() {
    assertEquals(List.of(
        PixelSample.opaque(0, 0),
        PixelSample.opaque(1, 0),
        PixelSample.opaque(2, 0),
        PixelSample.opaque(3, 0)), BresenhamLine.rasterize(0, 0, 3, 0));
  }

  @Test
  void diagonalMovesBothAxesInOneStep() {
    assertEquals(List.of(
        PixelSample.opaque(0, 0),
        PixelSample.opaque(1, 1),
        PixelSample.opaque(2, 2),
        PixelSample.opaque(3, 3)), BresenhamLine.rasterize(0, 0, 3, 3));
  }

  @Test
  void shallowLine() {
    assertEquals(List.of(
        PixelSample.opaque(0, 0),
        PixelSample.opaque(1, 0),
        PixelSample.opaque(2, 1),
        PixelSample.opaque(3, 1),
        PixelSample.opaque(4, 2),
        PixelSample.opaque(5, 2),
        PixelSample.opaque(6, 3),
        PixelSample.opaque(7, 3)), BresenhamLine.rasterize(0, 0, 7, 3));
  }

  @Test
  void singlePointTerminates() {
    assertEquals(List.of(PixelSample.opaque(-4, 9)), BresenhamLine.rasterize(-4, 9, -4, 9));
  }

  @Test
  void endpointsAreExactInBothDirections() {
    var forward = BresenhamLine.rasterize(-3, 8, 11, -5);
    var backward = BresenhamLine.rasterize(11, -5, -3, 8);

    assertEquals(PixelSample.opaque(-3, 8), forward.get(0));
    assertEquals(PixelSample.opaque(11, -5), forward.get(forward.size() - 1));
    assertEquals(PixelSample.opaque(11, -5), backward.get(0));
    assertEquals(PixelSample.opaque(-3, 8), backward.get(backward.size() - 1));
  }

  @Test
  void reversedLineCoversSamePixels() {
    for (int x = -8; x <= 8; x++) {
      for (int y = -8; y <= 8; y++) {
        var forward = new HashSet<>(BresenhamLine.rasterize(0, 0, x, y));
        var backward = new HashSet<>(BresenhamLine.rasterize(x, y, 0, 0));
        assertEquals(forward, backward, "line to (" + x + "," + y + ")");
      }
    }
  }

  @Test
  void tieCaseIsSymmetric() {
    var forward = BresenhamLine.rasterize(0, 0, 6, 3);
    var backward = BresenhamLine.rasterize(6, 3, 0, 0);

    assertEquals(7, forward.size());
    assertEquals(new HashSet<>(forward), new HashSet<>(backward));
  }

  @Test
  void walksUpToIntMaxWithoutWrapping() {
    var out = assertTimeoutPreemptively(Duration.ofSeconds(5),
        () -> BresenhamLine.rasterize(Integer.MAX_VALUE, 0, Integer.MAX_VALUE - 2, 2));

    assertEquals(List.of(
        PixelSample.opaque(Integer.MAX_VALUE, 0),
        PixelSample.opaque(Integer.MAX_VALUE - 1, 1),
        PixelSample.opaque(Integer.MAX_VALUE - 2, 2)), out);
  }
}
