package com.cloudera.datascience.bimjoin;

import com.google.common.base.Preconditions;
import com.google.common.io.Closer;
import htsjdk.samtools.SAMException;
import htsjdk.samtools.util.IOUtil;
import htsjdk.samtools.util.RuntimeIOException;
import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.File;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes the groups found by a join to files in an output directory:
 * <ul>
 *   <li><code>PREFIXnames_N.txt</code>, for each input N (starting from 1), the names of
 *   that input's records in every matched group</li>
 *   <li><code>PREFIXmatches.bim</code>, one representative record per matched group</li>
 *   <li><code>PREFIXmismatches.bim</code>, the first input's record for each mismatched
 *   group</li>
 * </ul>
 * Files are written as UTF-8, and existing files are overwritten.
 */
public class BimJoinOutput implements VariantGroupSink, Closeable {

  public static final String DEFAULT_PREFIX = "bij_";

  private final Closer closer = Closer.create();
  private final List<File> namesFiles = new ArrayList<>();
  private final List<Writer> namesWriters = new ArrayList<>();
  private final File matchesFile;
  private final Writer matchesWriter;
  private final File mismatchesFile;
  private final Writer mismatchesWriter;
  private final boolean writeMismatches;

  /**
   * Creates (or truncates) all the output files. If any of them cannot be created, those
   * already opened are closed again.
   * @throws BimJoinException.CouldNotCreateOutputFile if a file cannot be created
   */
  public BimJoinOutput(File outputDir, String prefix, int inputCount,
      boolean writeMismatches) {
    Preconditions.checkArgument(inputCount >= 1, "no inputs");
    Preconditions.checkNotNull(prefix);
    this.writeMismatches = writeMismatches;
    if (!outputDir.isDirectory() && !outputDir.mkdirs()) {
      throw new BimJoinException.CouldNotCreateOutputFile(outputDir,
          "could not create output directory");
    }
    try {
      for (int i = 1; i <= inputCount; i++) {
        File file = new File(outputDir, prefix + "names_" + i + ".txt");
        namesFiles.add(file);
        namesWriters.add(openForWriting(file));
      }
      matchesFile = new File(outputDir, prefix + "matches.bim");
      matchesWriter = openForWriting(matchesFile);
      mismatchesFile = new File(outputDir, prefix + "mismatches.bim");
      mismatchesWriter = openForWriting(mismatchesFile);
    } catch (RuntimeException e) {
      try {
        closer.close();
      } catch (IOException closeFailure) {
        e.addSuppressed(closeFailure);
      }
      throw e;
    }
  }

  private Writer openForWriting(File file) {
    try {
      BufferedWriter writer = new BufferedWriter(
          new OutputStreamWriter(IOUtil.openFileForWriting(file), StandardCharsets.UTF_8));
      return closer.register(writer);
    } catch (SAMException e) {
      throw new BimJoinException.CouldNotCreateOutputFile(file, e);
    }
  }

  public List<File> getNamesFiles() {
    return namesFiles;
  }

  public File getMatchesFile() {
    return matchesFile;
  }

  public File getMismatchesFile() {
    return mismatchesFile;
  }

  @Override
  public void add(VariantGroup group) {
    Preconditions.checkArgument(group.size() == namesWriters.size(),
        "group has %s records but there are %s inputs", group.size(), namesWriters.size());
    if (group.isMatched()) {
      for (int i = 0; i < group.size(); i++) {
        writeLine(namesWriters.get(i), namesFiles.get(i), group.getRecord(i).getName());
      }
      writeLine(matchesWriter, matchesFile, group.getRepresentative().toBimLine());
    } else if (writeMismatches) {
      writeLine(mismatchesWriter, mismatchesFile, group.getReference().toBimLine());
    }
  }

  private static void writeLine(Writer writer, File file, String line) {
    try {
      writer.write(line);
      writer.write('\n');
    } catch (IOException e) {
      throw new RuntimeIOException("Error writing " + file, e);
    }
  }

  @Override
  public void finish() {
    try {
      for (Writer writer : namesWriters) {
        writer.flush();
      }
      matchesWriter.flush();
      mismatchesWriter.flush();
    } catch (IOException e) {
      throw new RuntimeIOException("Error flushing output", e);
    }
  }

  @Override
  public void close() throws IOException {
    closer.close();
  }
}
