package com.ospicorp.waterquality.web;

import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import java.io.IOException;
import java.io.OutputStream;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.Objects;
import java.util.StringJoiner;
import org.springframework.core.ResolvableType;
import org.springframework.http.HttpInputMessage;
import org.springframework.http.HttpOutputMessage;
import org.springframework.http.MediaType;
import org.springframework.http.converter.AbstractGenericHttpMessageConverter;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.http.converter.HttpMessageNotWritableException;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

/**
 * Writes collections of records as {@code text/csv} with a header row taken from the element
 * type's JSON property names, so CSV columns match the JSON fields.
 *
 * <p>The element type comes from the declared return type when Spring supplies it, otherwise from
 * the first element. An empty collection with a known element type yields only the header row; an
 * empty collection of unknown type yields an empty body.
 */
public class CsvHttpMessageConverter extends AbstractGenericHttpMessageConverter<Collection<?>> {
  public static final MediaType TEXT_CSV = MediaType.valueOf("text/csv");

  private final CsvMapper mapper = new CsvMapper();

  public CsvHttpMessageConverter() {
    super(TEXT_CSV);
    mapper.findAndRegisterModules();
    mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
  }

  @Override
  protected boolean supports(@NonNull Class<?> clazz) {
    return Collection.class.isAssignableFrom(clazz);
  }

  @Override
  @NonNull
  public Collection<?> read(@NonNull Type type, @Nullable Class<?> contextClass,
      @NonNull HttpInputMessage inputMessage) throws IOException, HttpMessageNotReadableException {
    throw new HttpMessageNotReadableException("CSV reading not supported", inputMessage);
  }

  @Override
  @NonNull
  protected Collection<?> readInternal(@NonNull Class<? extends Collection<?>> clazz,
      @NonNull HttpInputMessage inputMessage) throws IOException, HttpMessageNotReadableException {
    throw new HttpMessageNotReadableException("CSV reading not supported", inputMessage);
  }

  @Override
  protected void writeInternal(@NonNull Collection<?> rows, @Nullable Type type,
      @NonNull HttpOutputMessage outputMessage) throws IOException, HttpMessageNotWritableException {
    Class<?> rowType = rowType(rows, type);
    if (rowType == null) {
      return;
    }
    CsvSchema schema = mapper.schemaFor(rowType).withHeader();
    OutputStream body = outputMessage.getBody();
    if (rows.stream().noneMatch(Objects::nonNull)) {
      // the generator only emits the header ahead of the first row
      body.write(headerLine(schema).getBytes(StandardCharsets.UTF_8));
      body.flush();
      return;
    }
    SequenceWriter writer = mapper.writer(schema).writeValues(body);
    for (Object row : rows) {
      if (row != null) {
        writer.write(row);
      }
    }
    writer.flush();
  }

  @Nullable
  private static Class<?> rowType(Collection<?> rows, @Nullable Type type) {
    if (type != null) {
      Class<?> declared = ResolvableType.forType(type).asCollection().resolveGeneric(0);
      if (declared != null && declared != Object.class) {
        return declared;
      }
    }
    return rows.stream().filter(Objects::nonNull).findFirst().map(Object::getClass).orElse(null);
  }

  private static String headerLine(CsvSchema schema) {
    StringJoiner header = new StringJoiner(String.valueOf(schema.getColumnSeparator()));
    for (CsvSchema.Column column : schema) {
      header.add(column.getName());
    }
    return header + new String(schema.getLineSeparator());
  }
}
