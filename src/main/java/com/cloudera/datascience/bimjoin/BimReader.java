package com.cloudera.datascience.bimjoin;

import com.google.common.base.CharMatcher;
import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import htsjdk.samtools.SAMException;
import htsjdk.samtools.util.IOUtil;
import htsjdk.samtools.util.RuntimeIOException;
import java.io.BufferedReader;
import java.io.Closeable;
import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.apache.commons.lang.StringUtils;

/**
 * Reads variant records from a .bim file, one per line. Each line has six
 * whitespace-separated fields: chromosome, name, genetic distance, position, allele 1
 * and allele 2. The genetic distance is ignored.
 * <p>
 * The first empty line, or the end of the underlying reader, ends the input.
 */
public class BimReader implements Closeable {

  static final int FIELD_COUNT = 6;

  private static final Splitter FIELD_SPLITTER =
      Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();

  private static final CharMatcher DECIMAL_DIGIT = CharMatcher.inRange('0', '9');

  private final String source;
  private final BufferedReader reader;
  private long lineNumber;
  private boolean ended;

  public BimReader(String source, BufferedReader reader) {
    this.source = Preconditions.checkNotNull(source);
    this.reader = Preconditions.checkNotNull(reader);
  }

  /**
   * Opens a UTF-8 .bim file for reading. Files ending in .gz are decompressed.
   * @throws BimJoinException.CouldNotReadInputFile if the file is missing or unreadable
   */
  public static BimReader open(File file) {
    if (!file.isFile() || !file.canRead()) {
      throw new BimJoinException.CouldNotReadInputFile(file,
          file.exists() ? "file is not readable" : "file does not exist");
    }
    try {
      return new BimReader(file.getPath(), new BufferedReader(
          new InputStreamReader(IOUtil.openFileForReading(file), StandardCharsets.UTF_8)));
    } catch (SAMException e) {
      throw new BimJoinException.CouldNotReadInputFile(file, e);
    }
  }

  public String getSource() {
    return source;
  }

  /**
   * @return the number of the last line read, starting from 1
   */
  public long getLineNumber() {
    return lineNumber;
  }

  /**
   * Reads the next line. Once the end has been reached every further call returns
   * {@link ParseResult#end()} without touching the underlying reader.
   */
  public ParseResult next() {
    if (ended) {
      return ParseResult.end();
    }
    String line;
    try {
      line = reader.readLine();
    } catch (IOException e) {
      throw new RuntimeIOException("Error reading " + source, e);
    }
    if (StringUtils.isEmpty(line)) {
      ended = true;
      return ParseResult.end();
    }
    lineNumber++;
    return parseLine(line, lineNumber);
  }

  /**
   * Parses a single line, checking that it has exactly six fields and that the
   * chromosome and position are unsigned 32-bit integers.
   */
  public static ParseResult parseLine(String line, long lineNumber) {
    List<String> fields = FIELD_SPLITTER.splitToList(line);
    if (fields.size() != FIELD_COUNT) {
      return ParseResult.malformed(
          "expected " + FIELD_COUNT + " fields but found " + fields.size(), lineNumber, line);
    }
    long chromosome = parseUnsigned(fields.get(0));
    if (chromosome < 0) {
      return ParseResult.malformed("invalid chromosome '" + fields.get(0) + "'", lineNumber,
          line);
    }
    long position = parseUnsigned(fields.get(3));
    if (position < 0) {
      return ParseResult.malformed("invalid position '" + fields.get(3) + "'", lineNumber,
          line);
    }
    VariantRecord record = new VariantRecord(chromosome, fields.get(1), position,
        fields.get(4), fields.get(5));
    return ParseResult.record(record, lineNumber);
  }

  /**
   * Parses a line without validating it: fields are read left to right, a number
   * that cannot be read becomes 0, missing fields are left empty and extra fields are
   * ignored. Never fails.
   */
  public static VariantRecord parseLineLeniently(String line) {
    List<String> fields = FIELD_SPLITTER.splitToList(line);
    long chromosome = Math.max(0, parseUnsigned(field(fields, 0)));
    long position = Math.max(0, parseUnsigned(field(fields, 3)));
    return new VariantRecord(chromosome, field(fields, 1), position, field(fields, 4),
        field(fields, 5));
  }

  private static String field(List<String> fields, int index) {
    return index < fields.size() ? fields.get(index) : "";
  }

  /**
   * @return the value, or -1 if it is not an unsigned 32-bit decimal integer
   */
  private static long parseUnsigned(String value) {
    if (value.isEmpty() || !DECIMAL_DIGIT.matchesAllOf(value)) {
      return -1;
    }
    try {
      long parsed = Long.parseLong(value);
      return parsed <= VariantRecord.MAX_UNSIGNED_INT ? parsed : -1;
    } catch (NumberFormatException e) {
      return -1; // too many digits for a long
    }
  }

  @Override
  public void close() throws IOException {
    reader.close();
  }
}
