package com.cloudera.datascience.bimjoin;

import com.google.common.base.Preconditions;

/**
 * The outcome of reading one line from a .bim file: a record, a line that could not be
 * parsed, or the end of the input.
 */
public final class ParseResult {

  public enum Status {
    RECORD,
    MALFORMED,
    END
  }

  private static final ParseResult END = new ParseResult(Status.END, null, null, 0, null);

  private final Status status;
  private final VariantRecord record;
  private final String reason;
  private final long lineNumber;
  private final String line;

  private ParseResult(Status status, VariantRecord record, String reason, long lineNumber,
      String line) {
    this.status = status;
    this.record = record;
    this.reason = reason;
    this.lineNumber = lineNumber;
    this.line = line;
  }

  public static ParseResult record(VariantRecord record, long lineNumber) {
    return new ParseResult(Status.RECORD, Preconditions.checkNotNull(record), null,
        lineNumber, null);
  }

  public static ParseResult malformed(String reason, long lineNumber, String line) {
    return new ParseResult(Status.MALFORMED, null, Preconditions.checkNotNull(reason),
        lineNumber, line);
  }

  public static ParseResult end() {
    return END;
  }

  public Status getStatus() {
    return status;
  }

  public boolean isRecord() {
    return status == Status.RECORD;
  }

  public boolean isMalformed() {
    return status == Status.MALFORMED;
  }

  public boolean isEnd() {
    return status == Status.END;
  }

  public VariantRecord getRecord() {
    Preconditions.checkState(isRecord(), "no record for a %s result", status);
    return record;
  }

  public String getReason() {
    Preconditions.checkState(isMalformed(), "no reason for a %s result", status);
    return reason;
  }

  public long getLineNumber() {
    return lineNumber;
  }

  public String getLine() {
    return line;
  }

  @Override
  public String toString() {
    switch (status) {
      case RECORD:
        return "ParseResult{record=" + record + ", line=" + lineNumber + '}';
      case MALFORMED:
        return "ParseResult{malformed='" + reason + "', line=" + lineNumber + '}';
      default:
        return "ParseResult{end}";
    }
  }
}
