package dev.pooleval.table;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** Shared CSV plumbing: raw row reading and header-first writing with Jackson CSV. */
final class CsvTables {

  private static final char BYTE_ORDER_MARK = '\uFEFF';

  private static final CsvMapper MAPPER =
      CsvMapper.builder().enable(CsvParser.Feature.WRAP_AS_ARRAY).build();

  private CsvTables() {}

  /** Reads every row of {@code file}, header included. A UTF-8 byte order mark is skipped. */
  static List<String[]> readRows(Path file) throws IOException {
    List<String[]> rows = new ArrayList<>();
    try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      reader.mark(1);
      if (reader.read() != BYTE_ORDER_MARK) {
        reader.reset();
      }
      try (MappingIterator<String[]> it = MAPPER.readerFor(String[].class).readValues(reader)) {
        while (it.hasNextValue()) {
          rows.add(it.nextValue());
        }
      }
    }
    return rows;
  }

  static void writeRows(Path file, List<String> header, List<List<String>> rows)
      throws IOException {
    Path parent = file.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    CsvSchema schema = CsvSchema.builder().addColumns(header, CsvSchema.ColumnType.STRING).build();
    try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
        SequenceWriter rowWriter = MAPPER.writer(schema).writeValues(writer)) {
      rowWriter.write(header);
      for (List<String> row : rows) {
        rowWriter.write(row);
      }
    }
  }

  /** Cell {@code index} of {@code row}, or null when the row is short or the cell blank. */
  static @Nullable String cell(String[] row, int index) {
    if (index < 0 || index >= row.length) {
      return null;
    }
    String value = row[index];
    return value == null || value.isBlank() ? null : value.strip();
  }

  /** Raw cell value without trimming, or null when the row is short or the cell empty. */
  static @Nullable String rawCell(String[] row, int index) {
    if (index < 0 || index >= row.length) {
      return null;
    }
    String value = row[index];
    return value == null || value.isEmpty() ? null : value;
  }

  /** Parses an integer cell, accepting integral decimals such as {@code 3.0}. */
  static @Nullable Integer parseInteger(@Nullable String value) {
    if (value == null) {
      return null;
    }
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException e) {
      try {
        double d = Double.parseDouble(value);
        return d == Math.rint(d) && !Double.isInfinite(d) ? (int) d : null;
      } catch (NumberFormatException notNumeric) {
        return null;
      }
    }
  }

  static int indexOf(String[] header, String column) {
    for (int i = 0; i < header.length; i++) {
      if (column.equals(header[i])) {
        return i;
      }
    }
    return -1;
  }
}
