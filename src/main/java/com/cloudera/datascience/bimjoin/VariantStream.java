package com.cloudera.datascience.bimjoin;

import com.google.common.base.Preconditions;
import java.io.Closeable;
import java.io.IOException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * A cursor over one input: the record the input is currently positioned at, and whether
 * the input has run out. Lines that do not parse are handled according to a
 * {@link MalformedRecordPolicy}.
 */
public class VariantStream implements Closeable {

  private static final Logger logger = LogManager.getLogger(VariantStream.class);

  private final BimReader reader;
  private final MalformedRecordPolicy malformedRecordPolicy;
  private VariantRecord current;
  private boolean exhausted;
  private long recordsRead;
  private long recordsSkipped;

  public VariantStream(BimReader reader, MalformedRecordPolicy malformedRecordPolicy) {
    this.reader = Preconditions.checkNotNull(reader);
    this.malformedRecordPolicy = Preconditions.checkNotNull(malformedRecordPolicy);
  }

  public String getName() {
    return reader.getSource();
  }

  /**
   * Moves to the next record. Does nothing if the input is already exhausted.
   * @return true if the stream is positioned at a record afterwards
   * @throws BimJoinException.MalformedRecord if a line does not parse and the policy is
   * {@link MalformedRecordPolicy#STRICT}
   */
  public boolean advance() {
    while (!exhausted) {
      ParseResult result = reader.next();
      switch (result.getStatus()) {
        case END:
          exhausted = true;
          current = null;
          return false;
        case RECORD:
          current = result.getRecord();
          recordsRead++;
          return true;
        case MALFORMED:
          if (handleMalformed(result)) {
            return true;
          }
          break;
        default:
          throw new IllegalStateException("Unknown parse status " + result.getStatus());
      }
    }
    return false;
  }

  /**
   * @return true if the stream took a record from the malformed line
   */
  private boolean handleMalformed(ParseResult result) {
    switch (malformedRecordPolicy) {
      case SKIP:
        recordsSkipped++;
        logger.warn("Skipping malformed record in {} at line {}: {}", getName(),
            result.getLineNumber(), result.getReason());
        return false;
      case LEGACY:
        current = BimReader.parseLineLeniently(result.getLine());
        recordsRead++;
        logger.warn("Reading malformed record in {} at line {} as {}: {}", getName(),
            result.getLineNumber(), current, result.getReason());
        return true;
      default:
        throw new BimJoinException.MalformedRecord(getName(), result.getLineNumber(),
            result.getReason(), result.getLine());
    }
  }

  /**
   * @return the current record, or null before the first {@link #advance()} and once
   * exhausted
   */
  public VariantRecord current() {
    return current;
  }

  public boolean isExhausted() {
    return exhausted;
  }

  public long getRecordsRead() {
    return recordsRead;
  }

  public long getRecordsSkipped() {
    return recordsSkipped;
  }

  @Override
  public void close() throws IOException {
    reader.close();
  }

  @Override
  public String toString() {
    return "VariantStream{" +
        "name='" + getName() + '\'' +
        ", current=" + current +
        ", exhausted=" + exhausted +
        '}';
  }
}
