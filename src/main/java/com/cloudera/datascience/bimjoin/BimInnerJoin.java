package com.cloudera.datascience.bimjoin;

import com.google.common.io.Closer;
import htsjdk.samtools.util.RuntimeIOException;
import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.barclay.argparser.Argument;
import org.broadinstitute.barclay.argparser.CommandLineArgumentParser;
import org.broadinstitute.barclay.argparser.CommandLineException;
import org.broadinstitute.barclay.argparser.CommandLineParser;
import org.broadinstitute.barclay.argparser.CommandLineProgramProperties;
import org.broadinstitute.barclay.argparser.PositionalArguments;

/**
 * Finds the variants present in every one of a set of .bim files.
 *
 * <h3>Usage example</h3>
 * <pre>
 * bim-inner-join cohort1.bim cohort2.bim cohort3.bim
 * </pre>
 *
 * Each input must be sorted by chromosome, then position. For every locus found in all
 * inputs with compatible alleles, the name of each input's record is appended to
 * <code>bij_names_N.txt</code> and one record is written to <code>bij_matches.bim</code>.
 * Loci present everywhere but with conflicting alleles go to
 * <code>bij_mismatches.bim</code>. The join stops when the shortest input runs out.
 */
@CommandLineProgramProperties(
    summary = "Usage: bim-inner-join file1.bim file2.bim [file3.bim ...]\n" +
        "Joins .bim files sorted by chromosome and position, writing the variants found " +
        "in every file with compatible alleles.",
    oneLineSummary = "Finds the variants shared by a set of sorted .bim files",
    programGroup = BimJoinProgramGroup.class
)
public class BimInnerJoin {

  private static final Logger logger = LogManager.getLogger(BimInnerJoin.class);

  public static final String OUTPUT_DIR_LONG_NAME = "output-dir";
  public static final String OUTPUT_PREFIX_LONG_NAME = "output-prefix";
  public static final String MALFORMED_RECORDS_LONG_NAME = "malformed-records";
  public static final String EQUAL_LOCUS_MISMATCH_LONG_NAME = "equal-locus-mismatch";
  public static final String WRITE_MISMATCHES_LONG_NAME = "write-mismatches";

  @PositionalArguments(minElements = 2, doc = "The .bim files to join, at least two.")
  public List<File> inputs = new ArrayList<>();

  @Argument(
      doc = "Directory to write the output files to.",
      fullName = OUTPUT_DIR_LONG_NAME,
      shortName = "O",
      optional = true
  )
  public File outputDir = new File(".");

  @Argument(
      doc = "Prefix for the output file names.",
      fullName = OUTPUT_PREFIX_LONG_NAME,
      optional = true
  )
  public String outputPrefix = BimJoinOutput.DEFAULT_PREFIX;

  @Argument(
      doc = "How to handle lines that are not valid .bim records.",
      fullName = MALFORMED_RECORDS_LONG_NAME,
      optional = true
  )
  public MalformedRecordPolicy malformedRecords = MalformedRecordPolicy.STRICT;

  @Argument(
      doc = "What to do when all inputs are at the same locus but their alleles conflict.",
      fullName = EQUAL_LOCUS_MISMATCH_LONG_NAME,
      optional = true
  )
  public EqualLocusMismatchPolicy equalLocusMismatch = EqualLocusMismatchPolicy.ADVANCE_ALL;

  @Argument(
      doc = "Write mismatched loci to the mismatches file. The file is created either way.",
      fullName = WRITE_MISMATCHES_LONG_NAME,
      optional = true
  )
  public boolean writeMismatches = true;

  public static void main(String[] args) {
    System.exit(new BimInnerJoin().instanceMain(args));
  }

  /**
   * Parses the arguments and runs the join.
   * @return the exit status: 0 on success, 1 on a usage error or a failed run
   */
  public int instanceMain(String[] argv) {
    CommandLineParser parser = new CommandLineArgumentParser(this);
    try {
      parser.parseArguments(System.err, argv);
    } catch (CommandLineException e) {
      System.err.println(parser.usage(false, false));
      logger.error(e.getMessage());
      return 1;
    }

    try {
      JoinSummary summary = doWork();
      logSummary(summary);
      return 0;
    } catch (BimJoinException | RuntimeIOException e) {
      logger.error(e.getMessage());
      return 1;
    } catch (IOException e) {
      logger.error("Error closing files: " + e.getMessage());
      return 1;
    }
  }

  /**
   * Opens every input, then the outputs, so that a missing input leaves earlier output
   * files untouched. Everything opened is closed again on the way out.
   */
  JoinSummary doWork() throws IOException {
    Closer closer = Closer.create();
    try {
      List<VariantStream> streams = new ArrayList<>(inputs.size());
      for (File input : inputs) {
        logger.info("Opening: {}", input);
        streams.add(closer.register(new VariantStream(BimReader.open(input),
            malformedRecords)));
      }
      BimJoinOutput output = closer.register(new BimJoinOutput(outputDir, outputPrefix,
          inputs.size(), writeMismatches));
      return new InnerJoin(streams, equalLocusMismatch).run(output);
    } catch (Throwable e) {
      throw closer.rethrow(e);
    } finally {
      closer.close();
    }
  }

  private static void logSummary(JoinSummary summary) {
    logger.info("Compared {} frontiers: {} matched, {} mismatched", summary.getSteps(),
        summary.getMatchedGroups(), summary.getMismatchedGroups());
    List<String> names = summary.getInputNames();
    for (int i = 0; i < names.size(); i++) {
      if (summary.getRecordsSkipped(i) > 0) {
        logger.info("{}: read {} records, skipped {} malformed lines", names.get(i),
            summary.getRecordsRead(i), summary.getRecordsSkipped(i));
      } else {
        logger.info("{}: read {} records", names.get(i), summary.getRecordsRead(i));
      }
    }
  }
}
