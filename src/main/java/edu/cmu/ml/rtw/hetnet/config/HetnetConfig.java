package edu.cmu.ml.rtw.hetnet.config;

import java.io.BufferedReader;
import java.io.IOException;
import java.util.Map;

import org.apache.log4j.Logger;

import edu.cmu.ml.rtw.hetnet.util.FileUtil;

/**
 * Everything a feature or permutation run needs to know, fixed once the run starts.  Fields are
 * filled either from the command line (see FeatureDriver and PermutationDriver) or from a
 * parameter file of key-tab-value lines, or both.
 */
public class HetnetConfig {
  ////////////////////////////////////////////////////////////////////////////////////////////////
  // Input files
  ////////////////////////////////////////////////////////////////////////////////////////////////

  // Node table: one row per node, with id and type (label) columns.
  public final String nodeFile;

  // Edge table: one row per edge, with start id, end id and edge type columns.
  public final String edgeFile;

  // If not null, a metapaths.json catalog to use instead of enumerating metapaths.
  public final String metaPathFile;

  // If not null, a two-column file of (start id, end id) pairs the permuter may not create.
  public final String excludedEdgeFile;

  ////////////////////////////////////////////////////////////////////////////////////////////////
  // Feature extraction
  ////////////////////////////////////////////////////////////////////////////////////////////////

  public final String startType;
  public final String endType;

  // Longest metapath to enumerate, counted in edges.
  public final int maxLength;

  // Degree dampening exponent, in [0, 1].
  public final double dampening;

  // Which start and end nodes to report, in NodeSelector syntax.  Null means every node of the
  // start (end) type.
  public final String startSelector;
  public final String endSelector;

  ////////////////////////////////////////////////////////////////////////////////////////////////
  // Permutation
  ////////////////////////////////////////////////////////////////////////////////////////////////

  // Swap attempts per edge.
  public final double multiplier;
  public final long seed;

  ////////////////////////////////////////////////////////////////////////////////////////////////
  // Execution and output
  ////////////////////////////////////////////////////////////////////////////////////////////////

  // 1 means run everything on the calling thread.
  public final int numWorkers;

  // If true, the first failing metapath (or edge type) cancels the rest of the run.
  public final boolean failFast;

  public final String outputBase;

  ////////////////////////////////////////////////////////////////////////////////////////////////
  // The Builder code.
  ////////////////////////////////////////////////////////////////////////////////////////////////

  private HetnetConfig(Builder builder) {
    nodeFile = builder.nodeFile;
    edgeFile = builder.edgeFile;
    metaPathFile = builder.metaPathFile;
    excludedEdgeFile = builder.excludedEdgeFile;
    startType = builder.startType;
    endType = builder.endType;
    maxLength = builder.maxLength;
    dampening = builder.dampening;
    startSelector = builder.startSelector;
    endSelector = builder.endSelector;
    multiplier = builder.multiplier;
    seed = builder.seed;
    numWorkers = builder.numWorkers;
    failFast = builder.failFast;
    outputBase = builder.outputBase;
  }

  public static class Builder {
    private static final Logger log = Logger.getLogger(Builder.class);

    private String nodeFile;
    private String edgeFile;
    private String metaPathFile;
    private String excludedEdgeFile;
    private String startType;
    private String endType;
    private int maxLength = 4;
    private double dampening = 0.4;
    private String startSelector;
    private String endSelector;
    private double multiplier = 10;
    private long seed = 0;
    private int numWorkers = 1;
    private boolean failFast = false;
    private String outputBase;

    private boolean noChecks = false;

    public Builder() {}
    public Builder setNodeFile(String nodeFile) {this.nodeFile = nodeFile;return this;}
    public Builder setEdgeFile(String edgeFile) {this.edgeFile = edgeFile;return this;}
    public Builder setMetaPathFile(String m) {this.metaPathFile = m;return this;}
    public Builder setExcludedEdgeFile(String e) {this.excludedEdgeFile = e;return this;}
    public Builder setStartType(String startType) {this.startType = startType;return this;}
    public Builder setEndType(String endType) {this.endType = endType;return this;}
    public Builder setMaxLength(int maxLength) {this.maxLength = maxLength;return this;}
    public Builder setDampening(double dampening) {this.dampening = dampening;return this;}
    public Builder setStartSelector(String s) {this.startSelector = s;return this;}
    public Builder setEndSelector(String s) {this.endSelector = s;return this;}
    public Builder setMultiplier(double multiplier) {this.multiplier = multiplier;return this;}
    public Builder setSeed(long seed) {this.seed = seed;return this;}
    public Builder setNumWorkers(int numWorkers) {this.numWorkers = numWorkers;return this;}
    public Builder setFailFast(boolean failFast) {this.failFast = failFast;return this;}
    public Builder setOutputBase(String outputBase) {this.outputBase = outputBase;return this;}

    /**
     * Reads parameters from key-tab-value lines.  Blank lines and lines starting with # are
     * skipped.  Unknown keys are logged and ignored; a malformed number is an
     * IllegalArgumentException.
     */
    public Builder setFromParamFile(BufferedReader reader) throws IOException {
      Map<String, String> params = new FileUtil().readMapFromTsvReader(reader);
      for (Map.Entry<String, String> entry : params.entrySet()) {
        setParam(entry.getKey(), entry.getValue());
      }
      return this;
    }

    public Builder setParam(String key, String value) {
      try {
        if (key.equals("node_file")) {
          setNodeFile(value);
        } else if (key.equals("edge_file")) {
          setEdgeFile(value);
        } else if (key.equals("metapath_file")) {
          setMetaPathFile(value);
        } else if (key.equals("excluded_edge_file")) {
          setExcludedEdgeFile(value);
        } else if (key.equals("start_type")) {
          setStartType(value);
        } else if (key.equals("end_type")) {
          setEndType(value);
        } else if (key.equals("max_length")) {
          setMaxLength(Integer.parseInt(value));
        } else if (key.equals("damping") || key.equals("w")) {
          setDampening(Double.parseDouble(value));
        } else if (key.equals("start_nodes")) {
          setStartSelector(value);
        } else if (key.equals("end_nodes")) {
          setEndSelector(value);
        } else if (key.equals("multiplier")) {
          setMultiplier(Double.parseDouble(value));
        } else if (key.equals("seed")) {
          setSeed(Long.parseLong(value));
        } else if (key.equals("n_jobs") || key.equals("num_workers")) {
          setNumWorkers(Integer.parseInt(value));
        } else if (key.equals("fail_fast")) {
          setFailFast(Boolean.parseBoolean(value));
        } else if (key.equals("output_dir")) {
          setOutputBase(value);
        } else {
          log.warn("Ignoring unrecognized parameter: " + key);
        }
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("Bad value for parameter " + key + ": " + value, e);
      }
      return this;
    }

    public HetnetConfig build() {
      if (noChecks) return new HetnetConfig(this);

      if (nodeFile == null) throw new IllegalStateException("node file must be set");
      if (edgeFile == null) throw new IllegalStateException("edge file must be set");
      if (maxLength < 1) throw new IllegalStateException("max length must be at least 1");
      if (dampening < 0 || dampening > 1) throw new IllegalStateException(
          "dampening must be between 0 and 1, was " + dampening);
      if (numWorkers < 1) throw new IllegalStateException("need at least one worker");
      if (multiplier < 0) throw new IllegalStateException("multiplier cannot be negative");
      if (metaPathFile == null && (startType == null) != (endType == null)) {
        throw new IllegalStateException("start type and end type must be given together");
      }
      return new HetnetConfig(this);
    }

    public Builder(HetnetConfig config) {
      setNodeFile(config.nodeFile);
      setEdgeFile(config.edgeFile);
      setMetaPathFile(config.metaPathFile);
      setExcludedEdgeFile(config.excludedEdgeFile);
      setStartType(config.startType);
      setEndType(config.endType);
      setMaxLength(config.maxLength);
      setDampening(config.dampening);
      setStartSelector(config.startSelector);
      setEndSelector(config.endSelector);
      setMultiplier(config.multiplier);
      setSeed(config.seed);
      setNumWorkers(config.numWorkers);
      setFailFast(config.failFast);
      setOutputBase(config.outputBase);
    }

    /**
     * Disables consistency checks, for tests that only need part of a config.
     */
    public Builder noChecks() {
      this.noChecks = true;
      return this;
    }
  }
}
