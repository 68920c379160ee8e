package com.cloudera.datascience.bimjoin;

import java.io.BufferedReader;
import java.io.StringReader;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class TestVariantStream {

  private static final String INPUT =
      "1 m1 0 100 A G\n" +
      "1 m2 0 200\n" +
      "1 m3 0 300 C T\n";

  private static VariantStream stream(String contents, MalformedRecordPolicy policy) {
    return new VariantStream(
        new BimReader("test.bim", new BufferedReader(new StringReader(contents))), policy);
  }

  @Test
  public void testAdvanceUntilExhausted() {
    VariantStream stream = stream("1 rs1 0 100 A G\n1 rs2 0 200 A G\n",
        MalformedRecordPolicy.STRICT);
    assertNull(stream.current());
    assertTrue(stream.advance());
    assertEquals("rs1", stream.current().getName());
    assertTrue(stream.advance());
    assertEquals("rs2", stream.current().getName());
    assertFalse(stream.advance());
    assertTrue(stream.isExhausted());
    assertNull(stream.current());
    assertFalse(stream.advance()); // no-op once exhausted
    assertEquals(2, stream.getRecordsRead());
  }

  @Test
  public void testStrictPolicy() {
    VariantStream stream = stream(INPUT, MalformedRecordPolicy.STRICT);
    assertTrue(stream.advance());
    try {
      stream.advance();
      fail("expected a malformed record");
    } catch (BimJoinException.MalformedRecord e) {
      assertEquals("test.bim", e.getSource());
      assertEquals(2, e.getLineNumber());
    }
  }

  @Test
  public void testSkipPolicy() {
    VariantStream stream = stream(INPUT, MalformedRecordPolicy.SKIP);
    assertTrue(stream.advance());
    assertTrue(stream.advance());
    assertEquals("m3", stream.current().getName());
    assertFalse(stream.advance());
    assertEquals(2, stream.getRecordsRead());
    assertEquals(1, stream.getRecordsSkipped());
  }

  @Test
  public void testSkipPolicyWhenOnlyMalformedLinesRemain() {
    VariantStream stream = stream("1 m1 0 100 A G\nbad\nworse\n", MalformedRecordPolicy.SKIP);
    assertTrue(stream.advance());
    assertFalse(stream.advance());
    assertTrue(stream.isExhausted());
    assertEquals(2, stream.getRecordsSkipped());
  }

  @Test
  public void testLegacyPolicy() {
    VariantStream stream = stream(INPUT, MalformedRecordPolicy.LEGACY);
    assertTrue(stream.advance());
    assertTrue(stream.advance());
    assertEquals(new VariantRecord(1, "m2", 200, "", ""), stream.current());
    assertTrue(stream.advance());
    assertEquals("m3", stream.current().getName());
    assertEquals(3, stream.getRecordsRead());
    assertEquals(0, stream.getRecordsSkipped());
  }
}
