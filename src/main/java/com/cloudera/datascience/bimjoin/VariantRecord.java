package com.cloudera.datascience.bimjoin;

import com.google.common.base.Preconditions;
import com.google.common.collect.ComparisonChain;
import java.util.Comparator;
import java.util.HashSet;
import java.util.Set;

/**
 * A single line of a .bim file: a locus (chromosome and position) plus the two alleles
 * observed there. The genetic distance column is not kept.
 */
public class VariantRecord {

  /**
   * The allele value used for a monomorphic site, where the allele was not determined.
   * It is never compared against other alleles.
   */
  public static final String MISSING_ALLELE = "0";

  static final long MAX_UNSIGNED_INT = 0xFFFFFFFFL;

  /**
   * Orders records by chromosome, then position. Alleles and names are ignored, so
   * records at the same locus compare as equal.
   */
  public static final Comparator<VariantRecord> LOCUS_ORDER = VariantRecord::compare;

  private final long chromosome;
  private final String name;
  private final long position;
  private final String allele1;
  private final String allele2;

  public VariantRecord(long chromosome, String name, long position, String allele1,
      String allele2) {
    Preconditions.checkArgument(chromosome >= 0 && chromosome <= MAX_UNSIGNED_INT,
        "chromosome out of range: %s", chromosome);
    Preconditions.checkArgument(position >= 0 && position <= MAX_UNSIGNED_INT,
        "position out of range: %s", position);
    this.chromosome = chromosome;
    this.name = Preconditions.checkNotNull(name);
    this.position = position;
    this.allele1 = Preconditions.checkNotNull(allele1);
    this.allele2 = Preconditions.checkNotNull(allele2);
  }

  public long getChromosome() {
    return chromosome;
  }

  public String getName() {
    return name;
  }

  public long getPosition() {
    return position;
  }

  public String getAllele1() {
    return allele1;
  }

  public String getAllele2() {
    return allele2;
  }

  public static int compare(VariantRecord a, VariantRecord b) {
    return ComparisonChain.start()
        .compare(a.chromosome, b.chromosome)
        .compare(a.position, b.position)
        .result();
  }

  public static boolean locusEquals(VariantRecord a, VariantRecord b) {
    return a.chromosome == b.chromosome && a.position == b.position;
  }

  /**
   * Two records have compatible alleles if they are at the same locus and, once missing
   * alleles are dropped, there are no more than two distinct alleles between them. So
   * A/0 matches G/A, but A/0 does not match T/G.
   */
  public static boolean allelesEqual(VariantRecord a, VariantRecord b) {
    if (!locusEquals(a, b)) {
      return false;
    }
    Set<String> alleles = new HashSet<>(4);
    a.addKnownAlleles(alleles);
    b.addKnownAlleles(alleles);
    return alleles.size() <= 2;
  }

  private void addKnownAlleles(Set<String> alleles) {
    if (!MISSING_ALLELE.equals(allele1)) {
      alleles.add(allele1);
    }
    if (!MISSING_ALLELE.equals(allele2)) {
      alleles.add(allele2);
    }
  }

  public boolean isLocusBefore(VariantRecord other) {
    return compare(this, other) < 0;
  }

  public boolean hasMissingAllele() {
    return MISSING_ALLELE.equals(allele1) || MISSING_ALLELE.equals(allele2);
  }

  /**
   * Formats this record as a .bim line (without a line terminator). The genetic distance
   * column is always written as 0.
   */
  public String toBimLine() {
    return chromosome + "\t" + name + "\t0\t" + position + "\t" + allele1 + "\t" + allele2;
  }

  @Override
  public String toString() {
    return "<Variant " + name +
        " chr" + chromosome + ":" + position +
        ", [" + allele1 + ", " + allele2 + "]>";
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;

    VariantRecord that = (VariantRecord) o;

    if (chromosome != that.chromosome) return false;
    if (position != that.position) return false;
    if (!name.equals(that.name)) return false;
    if (!allele1.equals(that.allele1)) return false;
    return allele2.equals(that.allele2);
  }

  @Override
  public int hashCode() {
    int result = Long.hashCode(chromosome);
    result = 31 * result + name.hashCode();
    result = 31 * result + Long.hashCode(position);
    result = 31 * result + allele1.hashCode();
    result = 31 * result + allele2.hashCode();
    return result;
  }
}
