package com.flamingo.ai.reportextract.service.output;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import java.io.Closeable;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes output rows as RFC 4180 CSV with Jackson's CSV generator. Fields holding commas, quotes
 * or line breaks are quoted and embedded quotes are doubled.
 *
 * <p>Not thread-safe; the batch driver writes from one thread.
 */
public class CsvRecordWriter implements Closeable {

  private static final CsvMapper CSV_MAPPER = new CsvMapper();

  private final SequenceWriter rows;
  private long rowCount;

  public CsvRecordWriter(Writer out) throws IOException {
    this.rows =
        CSV_MAPPER.writerFor(String[].class).with(CsvSchema.emptySchema()).writeValues(out);
  }

  /**
   * Opens {@code file} for writing, creating parent directories and truncating existing content.
   *
   * @param file output file
   * @return a writer owning the file
   * @throws IOException if the file cannot be created
   */
  public static CsvRecordWriter open(Path file) throws IOException {
    Path parent = file.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    return new CsvRecordWriter(Files.newBufferedWriter(file, StandardCharsets.UTF_8));
  }

  public void writeRow(List<String> row) throws IOException {
    rows.write(row.toArray(new String[0]));
    rowCount++;
  }

  public void flush() throws IOException {
    rows.flush();
  }

  /** Rows written so far, header row included. */
  public long getRowCount() {
    return rowCount;
  }

  @Override
  public void close() throws IOException {
    rows.close();
  }
}
