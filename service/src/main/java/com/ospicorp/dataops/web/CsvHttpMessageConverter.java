package com.ospicorp.dataops.web;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.ospicorp.dataops.table.Table;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpInputMessage;
import org.springframework.http.HttpOutputMessage;
import org.springframework.http.MediaType;
import org.springframework.http.converter.AbstractHttpMessageConverter;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.http.converter.HttpMessageNotWritableException;
import org.springframework.lang.NonNull;

/** Writes a {@link Table} as {@code text/csv} with a header row in column order. */
public class CsvHttpMessageConverter extends AbstractHttpMessageConverter<Table> {
  public static final MediaType TEXT_CSV = MediaType.valueOf("text/csv");

  private final CsvMapper mapper = new CsvMapper();

  public CsvHttpMessageConverter() {
    super(TEXT_CSV);
    mapper.findAndRegisterModules();
    mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
  }

  @Override
  protected boolean supports(@NonNull Class<?> clazz) {
    return Table.class.isAssignableFrom(clazz);
  }

  @Override
  @NonNull
  protected Table readInternal(@NonNull Class<? extends Table> clazz,
      @NonNull HttpInputMessage inputMessage) throws IOException, HttpMessageNotReadableException {
    throw new HttpMessageNotReadableException("CSV reading not supported", inputMessage);
  }

  @Override
  protected void writeInternal(@NonNull Table table, @NonNull HttpOutputMessage outputMessage)
      throws IOException, HttpMessageNotWritableException {
    CsvSchema.Builder builder = CsvSchema.builder();
    table.columns().forEach(builder::addColumn);
    CsvSchema schema = builder.setUseHeader(true).build();

    if (table.rowCount() == 0) {
      SequenceWriter header = mapper.writer(schema.withoutHeader())
          .writeValues(outputMessage.getBody());
      header.write(table.columns());
      header.flush();
      return;
    }
    SequenceWriter writer = mapper.writer(schema).writeValues(outputMessage.getBody());
    for (Map<String, Object> row : table.rows()) {
      List<Object> cells = new ArrayList<>(table.columns().size());
      for (String column : table.columns()) {
        cells.add(row.get(column));
      }
      writer.write(cells);
    }
    writer.flush();
  }
}
