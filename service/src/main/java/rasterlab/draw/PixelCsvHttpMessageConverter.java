package rasterlab.draw;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import java.io.IOException;
import java.util.Collection;
import org.springframework.http.HttpInputMessage;
import org.springframework.http.HttpOutputMessage;
import org.springframework.http.MediaType;
import org.springframework.http.converter.AbstractHttpMessageConverter;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.http.converter.HttpMessageNotWritableException;
import org.springframework.lang.NonNull;
import rasterlab.raster.PixelSample;

/**
 * Writes a collection of {@link PixelSample} as {@code text/csv} with an {@code x,y,alpha}
 * header row. Write only.
 */
public class PixelCsvHttpMessageConverter extends AbstractHttpMessageConverter<Collection<?>> {
  public static final MediaType TEXT_CSV = MediaType.valueOf("text/csv");

  private final CsvMapper mapper = new CsvMapper();
  private final CsvSchema schema = mapper.schemaFor(PixelSample.class).withHeader();

  public PixelCsvHttpMessageConverter() {
    super(TEXT_CSV);
  }

  @Override
  protected boolean supports(@NonNull Class<?> clazz) {
    return Collection.class.isAssignableFrom(clazz);
  }

  @Override
  protected boolean canRead(MediaType mediaType) {
    return false;
  }

  @Override
  @NonNull
  protected Collection<?> readInternal(@NonNull Class<? extends Collection<?>> clazz,
      @NonNull HttpInputMessage inputMessage) throws IOException, HttpMessageNotReadableException {
    throw new HttpMessageNotReadableException("CSV reading not supported", inputMessage);
  }

  @Override
  protected void writeInternal(@NonNull Collection<?> samples, @NonNull HttpOutputMessage outputMessage)
      throws IOException, HttpMessageNotWritableException {
    SequenceWriter writer = mapper.writer(schema).writeValues(outputMessage.getBody());
    for (Object sample : samples) {
      if (!(sample instanceof PixelSample)) {
        throw new HttpMessageNotWritableException(
            "Only pixel samples can be written as CSV, got " + sample);
      }
      writer.write(sample);
    }
    writer.flush();
  }
}
