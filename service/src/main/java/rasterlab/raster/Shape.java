package rasterlab.raster;

import java.util.List;

public enum Shape {
  LINE(List.of("x1", "y1", "x2", "y2")),
  CIRCLE(List.of("x1", "y1", "r")),
  CURVE(List.of("x1", "y1", "x2", "y2", "x3", "y3", "x4", "y4"));

  private final List<String> requiredFields;

  Shape(List<String> requiredFields) {
    this.requiredFields = requiredFields;
  }

  public List<String> requiredFields() {
    return requiredFields;
  }
}
