package com.cloudera.datascience.bimjoin;

import com.google.common.collect.ImmutableList;
import com.google.common.io.Files;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class TestBimJoinOutput {

  @Rule
  public TemporaryFolder folder = new TemporaryFolder();

  private static String read(File file) throws IOException {
    return Files.asCharSource(file, StandardCharsets.UTF_8).read();
  }

  private static VariantGroup group(boolean matched, VariantRecord... records) {
    return new VariantGroup(ImmutableList.copyOf(records), matched);
  }

  @Test
  public void testWritesGroups() throws IOException {
    File dir = folder.newFolder();
    try (BimJoinOutput output = new BimJoinOutput(dir, "bij_", 2, true)) {
      output.add(group(true,
          new VariantRecord(1, "rs1", 100, "A", "0"),
          new VariantRecord(1, "rs1b", 100, "A", "G")));
      output.add(group(false,
          new VariantRecord(1, "rs2", 200, "A", "G"),
          new VariantRecord(1, "rs2b", 200, "C", "T")));
      output.add(group(true,
          new VariantRecord(2, "rs3", 300, "0", "C"),
          new VariantRecord(2, "rs3b", 300, "C", "0")));
      output.finish();
    }

    assertEquals("rs1\nrs3\n", read(new File(dir, "bij_names_1.txt")));
    assertEquals("rs1b\nrs3b\n", read(new File(dir, "bij_names_2.txt")));
    assertEquals("1\trs1b\t0\t100\tA\tG\n2\trs3\t0\t300\t0\tC\n",
        read(new File(dir, "bij_matches.bim")));
    assertEquals("1\trs2\t0\t200\tA\tG\n", read(new File(dir, "bij_mismatches.bim")));
  }

  @Test
  public void testMismatchesCanBeLeftOut() throws IOException {
    File dir = folder.newFolder();
    try (BimJoinOutput output = new BimJoinOutput(dir, "out.", 2, false)) {
      output.add(group(false,
          new VariantRecord(1, "rs2", 200, "A", "G"),
          new VariantRecord(1, "rs2b", 200, "C", "T")));
      output.finish();
      assertEquals(new File(dir, "out.mismatches.bim"), output.getMismatchesFile());
    }
    File mismatches = new File(dir, "out.mismatches.bim");
    assertTrue(mismatches.exists());
    assertEquals("", read(mismatches));
    assertEquals("", read(new File(dir, "out.names_1.txt")));
  }

  @Test
  public void testOverwritesPreviousOutput() throws IOException {
    File dir = folder.newFolder();
    File matches = new File(dir, "bij_matches.bim");
    Files.asCharSink(matches, StandardCharsets.UTF_8).write("stale\n");
    try (BimJoinOutput output = new BimJoinOutput(dir, "bij_", 2, true)) {
      output.finish();
    }
    assertEquals("", read(matches));
  }

  @Test
  public void testCreatesOutputDirectory() throws IOException {
    File dir = new File(folder.getRoot(), "nested/out");
    try (BimJoinOutput output = new BimJoinOutput(dir, "bij_", 3, true)) {
      assertEquals(3, output.getNamesFiles().size());
      assertEquals(new File(dir, "bij_names_3.txt"), output.getNamesFiles().get(2));
    }
    assertTrue(new File(dir, "bij_names_3.txt").exists());
  }

  @Test(expected = BimJoinException.CouldNotCreateOutputFile.class)
  public void testOutputDirectoryIsAFile() throws IOException {
    File file = folder.newFile();
    new BimJoinOutput(file, "bij_", 2, true);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testGroupSizeMustMatchInputs() throws IOException {
    try (BimJoinOutput output = new BimJoinOutput(folder.newFolder(), "bij_", 3, true)) {
      output.add(group(true,
          new VariantRecord(1, "rs1", 100, "A", "G"),
          new VariantRecord(1, "rs1b", 100, "A", "G")));
    }
  }
}
