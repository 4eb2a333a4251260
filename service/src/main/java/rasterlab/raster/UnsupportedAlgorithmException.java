package rasterlab.raster;

import java.util.List;

public class UnsupportedAlgorithmException extends RuntimeException {
  private final String requested;

  public UnsupportedAlgorithmException(String requested) {
    super("Unsupported algorithm '" + requested + "'. Supported values: "
        + String.join(",", Algorithm.canonicalNames()) + ".");
    this.requested = requested;
  }

  public String requested() {
    return requested;
  }

  public List<String> supported() {
    return Algorithm.canonicalNames();
  }
}
