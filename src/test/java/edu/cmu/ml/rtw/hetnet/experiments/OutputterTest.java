package edu.cmu.ml.rtw.hetnet.experiments;

import java.io.IOException;
import java.util.List;

import junit.framework.TestCase;

import com.google.common.collect.Lists;

import edu.cmu.ml.rtw.hetnet.features.FeatureTable;
import edu.cmu.ml.rtw.hetnet.graphs.Edge;
import edu.cmu.ml.rtw.hetnet.permutation.PermutationStats;
import edu.cmu.ml.rtw.hetnet.util.FakeFileUtil;

public class OutputterTest extends TestCase {
  private FakeFileUtil fileUtil;
  private Outputter outputter;

  @Override
  public void setUp() {
    fileUtil = new FakeFileUtil();
    outputter = new Outputter(fileUtil);
  }

  public void testOutputFeatureTable() throws IOException {
    FeatureTable table = new FeatureTable("a_id",
                                          "c_id",
                                          Lists.newArrayList("a1", "a2"),
                                          Lists.newArrayList("c1"),
                                          Lists.newArrayList("AxBy>C", "AxBxAxBy>C"),
                                          new double[][] {{0.5, 0.0}, {0.25, 1.0}},
                                          false);
    String expected =
        "a_id\tc_id\tAxBy>C\tAxBxAxBy>C\n" +
        "a1\tc1\t0.5\t0.25\n" +
        "a2\tc1\t0.0\t1.0\n";
    fileUtil.onlyAllowExpectedFiles();
    fileUtil.addExpectedFileWritten("out/dwpc.tsv", expected);
    outputter.outputFeatureTable("out/dwpc.tsv", table);
    fileUtil.expectFilesWritten();
  }

  public void testIntegralTablesHaveNoDecimalPoint() throws IOException {
    FeatureTable table = new FeatureTable("a_id",
                                          "c_id",
                                          Lists.newArrayList("a1"),
                                          Lists.newArrayList("c1"),
                                          Lists.newArrayList("AxB"),
                                          new double[][] {{2.0}},
                                          true);
    fileUtil.addExpectedFileWritten("degrees.tsv", "a_id\tc_id\tAxB\na1\tc1\t2\n");
    outputter.outputFeatureTable("degrees.tsv", table);
    fileUtil.expectFilesWritten();
  }

  public void testOutputEdgesAndStats() throws IOException {
    List<Edge> edges = Lists.newArrayList(new Edge("b1", "c2", "y_By>C"));
    fileUtil.addExpectedFileWritten("edges.tsv", "start_id\tend_id\ttype\nb1\tc2\ty_By>C\n");
    outputter.outputEdges("edges.tsv", edges);

    List<PermutationStats> stats = Lists.newArrayList(
        new PermutationStats(1, 2, 0.5, 0.75, 0.5, 0.0, 0.0, 0.0, "y_By>C"));
    fileUtil.addExpectedFileWritten("stats.tsv",
        Outputter.STATS_HEADER + "\tetype\n" + "1\t2\t0.5\t0.75\t0.5\t0.0\t0.0\t0.0\ty_By>C\n");
    outputter.outputStats("stats.tsv", stats, true);
    fileUtil.expectFilesWritten();
  }
}
