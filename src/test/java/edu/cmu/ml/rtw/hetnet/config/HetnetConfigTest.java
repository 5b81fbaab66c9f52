package edu.cmu.ml.rtw.hetnet.config;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;

import junit.framework.TestCase;

import edu.cmu.ml.rtw.hetnet.util.TestUtil;
import edu.cmu.ml.rtw.hetnet.util.TestUtil.Function;

public class HetnetConfigTest extends TestCase {

  private HetnetConfig.Builder minimal() {
    return new HetnetConfig.Builder().setNodeFile("nodes.tsv").setEdgeFile("edges.tsv");
  }

  public void testDefaults() {
    HetnetConfig config = minimal().build();
    assertEquals(4, config.maxLength);
    assertEquals(0.4, config.dampening);
    assertEquals(1, config.numWorkers);
    assertEquals(10.0, config.multiplier);
    assertEquals(0L, config.seed);
    assertFalse(config.failFast);
    assertNull(config.metaPathFile);
  }

  public void testSetFromParamFile() throws IOException {
    String params =
        "# feature run\n" +
        "node_file\tnodes.tsv\n" +
        "edge_file\tedges.tsv.bz2\n" +
        "start_type\tCompound\n" +
        "end_type\tDisease\n" +
        "\n" +
        "max_length\t3\n" +
        "damping\t0.5\n" +
        "n_jobs\t4\n" +
        "fail_fast\ttrue\n" +
        "start_nodes\tids:DB00001\n" +
        "seed\t12\n" +
        "unknown_key\tignored\n";
    HetnetConfig config = new HetnetConfig.Builder()
        .setFromParamFile(new BufferedReader(new StringReader(params)))
        .build();
    assertEquals("edges.tsv.bz2", config.edgeFile);
    assertEquals("Compound", config.startType);
    assertEquals(3, config.maxLength);
    assertEquals(0.5, config.dampening);
    assertEquals(4, config.numWorkers);
    assertTrue(config.failFast);
    assertEquals("ids:DB00001", config.startSelector);
    assertNull(config.endSelector);
    assertEquals(12L, config.seed);
  }

  public void testCopyBuilder() {
    HetnetConfig config = minimal().setSeed(5).setOutputBase("out").build();
    HetnetConfig copy = new HetnetConfig.Builder(config).setSeed(6).build();
    assertEquals(6L, copy.seed);
    assertEquals("out", copy.outputBase);
    assertEquals("nodes.tsv", copy.nodeFile);
  }

  public void testInconsistentConfigFails() {
    TestUtil.expectError(IllegalStateException.class, "node file", new Function() {
      @Override
      public void call() {
        new HetnetConfig.Builder().setEdgeFile("edges.tsv").build();
      }
    });
    TestUtil.expectError(IllegalStateException.class, "dampening", new Function() {
      @Override
      public void call() {
        minimal().setDampening(1.5).build();
      }
    });
    TestUtil.expectError(IllegalStateException.class, "worker", new Function() {
      @Override
      public void call() {
        minimal().setNumWorkers(0).build();
      }
    });
    TestUtil.expectError(IllegalStateException.class, "together", new Function() {
      @Override
      public void call() {
        minimal().setStartType("Compound").build();
      }
    });
    TestUtil.expectError(IllegalArgumentException.class, "max_length", new Function() {
      @Override
      public void call() {
        minimal().setParam("max_length", "four");
      }
    });
    assertNull(new HetnetConfig.Builder().noChecks().build().nodeFile);
  }
}
