package rasterlab.draw;

/**
 * A draw request that names a known algorithm but carries unusable values. Rendered as a 400
 * with the numeric {@link #errorCode()} and a link to its documentation page.
 */
public class InvalidParameterException extends RuntimeException {
  /** Line span or circle radius above {@code raster.limits.max-span}. */
  public static final int SPAN_TOO_LARGE = 2002;
  public static final int NEGATIVE_RADIUS = 2003;
  /** {@code format} query parameter other than json or csv. */
  public static final int INVALID_FORMAT = 2004;
  /** Some pixel the shape would cover lies outside the 32-bit coordinate range. */
  public static final int COORDINATE_OUT_OF_RANGE = 2005;

  private final int errorCode;
  private final String moreInfo;

  public InvalidParameterException(String message, int errorCode, String docsBase) {
    super(message);
    this.errorCode = errorCode;
    this.moreInfo = docsBase + errorCode;
  }

  public int errorCode() {
    return errorCode;
  }

  public String moreInfo() {
    return moreInfo;
  }
}
