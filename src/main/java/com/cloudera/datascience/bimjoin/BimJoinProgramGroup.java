package com.cloudera.datascience.bimjoin;

import org.broadinstitute.barclay.argparser.CommandLineProgramGroup;

public class BimJoinProgramGroup implements CommandLineProgramGroup {
  @Override
  public String getName() {
    return "Variant Comparison";
  }

  @Override
  public String getDescription() {
    return "Tools that compare variant records across files";
  }
}
