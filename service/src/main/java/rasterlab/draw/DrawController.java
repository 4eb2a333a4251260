package rasterlab.draw;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.headers.Header;
import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.Comparator;
import java.util.List;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.MimeTypeUtils;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1")
@Validated
@Tag(name = "Rasterization")
public class DrawController {
  static final String ELAPSED_HEADER = "X-Elapsed-Nanos";

  private final DrawService drawService;

  public DrawController(DrawService drawService) {
    this.drawService = drawService;
  }

  @PostMapping(value = "/draw", consumes = MediaType.APPLICATION_JSON_VALUE)
  @Operation(summary = "Rasterize a primitive",
      description = "Convert a line, circle or cubic Bézier into pixel samples with the named algorithm.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Pixel samples in generation order",
          headers = @Header(name = ELAPSED_HEADER, description = "Rasterization time in nanoseconds",
              schema = @Schema(type = "integer")),
          content = {
              @Content(mediaType = "application/json",
                  schema = @Schema(implementation = DrawResponse.class)),
              @Content(mediaType = "text/csv")
          }),
      @ApiResponse(responseCode = "400", description = "Unknown algorithm or invalid parameter",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = org.springframework.http.ProblemDetail.class)))
  })
  public ResponseEntity<?> draw(@Valid @RequestBody DrawRequest request,
      @RequestParam(name = "format", required = false)
          @Parameter(description = "Response format, overrides Accept", example = "json") String format,
      @RequestHeader(value = HttpHeaders.ACCEPT, required = false) String accept) {

    MediaType contentType = selectMediaType(format, accept);
    RasterResult result = drawService.draw(request);

    ResponseEntity.BodyBuilder builder = ResponseEntity.ok()
        .header(ELAPSED_HEADER, Long.toString(result.elapsedNanos()))
        .contentType(contentType);

    if (contentType.isCompatibleWith(PixelCsvHttpMessageConverter.TEXT_CSV)) {
      return builder.body(result.points());
    }
    return builder.body(DrawResponse.from(result));
  }

  @GetMapping(value = "/algorithms", produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(summary = "List algorithms",
      description = "Supported algorithm names, their aliases and the request fields each one reads.")
  @ApiResponse(responseCode = "200", description = "Supported algorithms",
      content = @Content(mediaType = "application/json",
          array = @ArraySchema(schema = @Schema(implementation = AlgorithmInfo.class))))
  public List<AlgorithmInfo> algorithms() {
    return drawService.algorithms();
  }

  private MediaType selectMediaType(String format, String accept) {
    if (StringUtils.hasText(format)) {
      if ("csv".equalsIgnoreCase(format)) {
        return PixelCsvHttpMessageConverter.TEXT_CSV;
      }
      if ("json".equalsIgnoreCase(format)) {
        return MediaType.APPLICATION_JSON;
      }
      throw drawService.invalidParameter("Invalid format value. Supported values: json,csv.",
          InvalidParameterException.INVALID_FORMAT);
    }
    if (!StringUtils.hasText(accept)) {
      return MediaType.APPLICATION_JSON;
    }
    List<MediaType> mediaTypes = MediaType.parseMediaTypes(accept);
    mediaTypes.sort(Comparator.comparingDouble(MediaType::getQualityValue).reversed());
    MimeTypeUtils.sortBySpecificity(mediaTypes);
    for (MediaType mediaType : mediaTypes) {
      if (mediaType.isCompatibleWith(MediaType.APPLICATION_JSON)) {
        return MediaType.APPLICATION_JSON;
      }
      if (mediaType.isCompatibleWith(PixelCsvHttpMessageConverter.TEXT_CSV)) {
        return PixelCsvHttpMessageConverter.TEXT_CSV;
      }
    }
    return MediaType.APPLICATION_JSON;
  }
}
