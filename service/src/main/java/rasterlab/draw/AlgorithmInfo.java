package rasterlab.draw;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Locale;
import rasterlab.raster.Algorithm;

public record AlgorithmInfo(
    String name,
    List<String> aliases,
    String shape,
    @JsonProperty("required_fields") List<String> requiredFields,
    boolean antialiased
) {

  static AlgorithmInfo of(Algorithm algorithm) {
    return new AlgorithmInfo(
        algorithm.canonicalName(),
        algorithm.aliases(),
        algorithm.shape().name().toLowerCase(Locale.ROOT),
        algorithm.shape().requiredFields(),
        algorithm.antialiased());
  }
}
