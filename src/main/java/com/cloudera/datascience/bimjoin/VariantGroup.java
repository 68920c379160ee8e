package com.cloudera.datascience.bimjoin;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * The records, one per input and in input order, that the join found at one locus,
 * together with whether their alleles matched.
 */
public class VariantGroup {
  private final ImmutableList<VariantRecord> records;
  private final boolean matched;

  public VariantGroup(List<VariantRecord> records, boolean matched) {
    Preconditions.checkArgument(!records.isEmpty(), "empty group");
    this.records = ImmutableList.copyOf(records);
    this.matched = matched;
  }

  public List<VariantRecord> getRecords() {
    return records;
  }

  public VariantRecord getRecord(int inputIndex) {
    return records.get(inputIndex);
  }

  public int size() {
    return records.size();
  }

  public boolean isMatched() {
    return matched;
  }

  /**
   * The record that stands in for the whole group in the matches output.
   */
  public VariantRecord getRepresentative() {
    return AlleleMatcher.representative(records);
  }

  /**
   * The first input's record, against which the others were compared.
   */
  public VariantRecord getReference() {
    return records.get(0);
  }

  @Override
  public String toString() {
    return "VariantGroup{" +
        "matched=" + matched +
        ", records=" + records +
        '}';
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;

    VariantGroup that = (VariantGroup) o;

    if (matched != that.matched) return false;
    return records.equals(that.records);
  }

  @Override
  public int hashCode() {
    return 31 * records.hashCode() + (matched ? 1 : 0);
  }
}
