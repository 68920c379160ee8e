package com.cloudera.datascience.bimjoin;

import java.io.File;

/**
 * Errors caused by the user's input: files that cannot be opened or written, lines that
 * are not valid .bim records, and inputs that cannot be joined.
 */
public class BimJoinException extends RuntimeException {
  private static final long serialVersionUID = 0L;

  public BimJoinException(String message) {
    super(message);
  }

  public BimJoinException(String message, Throwable cause) {
    super(message, cause);
  }

  protected static String getMessage(Throwable t) {
    String message = t.getMessage();
    return message != null ? message : t.getClass().getName();
  }

  public static class CouldNotReadInputFile extends BimJoinException {
    private static final long serialVersionUID = 0L;

    public CouldNotReadInputFile(File file, String message) {
      super(String.format("Couldn't read file %s. Error was: %s", file, message));
    }

    public CouldNotReadInputFile(File file, Throwable cause) {
      super(String.format("Couldn't read file %s. Error was: %s", file, getMessage(cause)),
          cause);
    }
  }

  public static class CouldNotCreateOutputFile extends BimJoinException {
    private static final long serialVersionUID = 0L;

    public CouldNotCreateOutputFile(File file, String message) {
      super(String.format("Couldn't write file %s. Error was: %s", file, message));
    }

    public CouldNotCreateOutputFile(File file, Throwable cause) {
      super(String.format("Couldn't write file %s. Error was: %s", file, getMessage(cause)),
          cause);
    }
  }

  /**
   * Thrown for a line that does not hold six fields, or whose chromosome or position is
   * not an unsigned integer, when malformed records are not tolerated.
   */
  public static class MalformedRecord extends BimJoinException {
    private static final long serialVersionUID = 0L;

    private final String source;
    private final long lineNumber;

    public MalformedRecord(String source, long lineNumber, String reason, String line) {
      super(String.format("Malformed record in %s at line %d: %s (line was \"%s\")", source,
          lineNumber, reason, line));
      this.source = source;
      this.lineNumber = lineNumber;
    }

    public String getSource() {
      return source;
    }

    public long getLineNumber() {
      return lineNumber;
    }
  }

  /**
   * Thrown when every input is at the same locus but the alleles disagree, and the join
   * was asked to stop rather than skip past the locus.
   */
  public static class InconsistentAlleles extends BimJoinException {
    private static final long serialVersionUID = 0L;

    public InconsistentAlleles(Iterable<VariantRecord> frontier) {
      super("Inputs disagree on alleles at a shared locus: " + frontier);
    }
  }
}
