package edu.cmu.ml.rtw.hetnet.experiments;

import java.io.IOException;
import java.util.List;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.commons.cli.PosixParser;
import org.apache.log4j.Logger;

import com.google.common.annotations.VisibleForTesting;

import edu.cmu.ml.rtw.hetnet.config.HetnetConfig;
import edu.cmu.ml.rtw.hetnet.features.FeatureExtractor;
import edu.cmu.ml.rtw.hetnet.features.FeatureTable;
import edu.cmu.ml.rtw.hetnet.features.MetaPath;
import edu.cmu.ml.rtw.hetnet.features.MetaPathCatalog;
import edu.cmu.ml.rtw.hetnet.features.PathCountSemantics;
import edu.cmu.ml.rtw.hetnet.graphs.GraphLoader;
import edu.cmu.ml.rtw.hetnet.graphs.HetGraph;
import edu.cmu.ml.rtw.hetnet.graphs.NodeSelector;
import edu.cmu.ml.rtw.hetnet.parallel.ExecutorParallelMapper;
import edu.cmu.ml.rtw.hetnet.util.FileUtil;

/**
 * Loads a network, computes DWPC features (and optionally DWWC and degree features) between the
 * start and end nodes, and writes them under the output directory:
 *
 * <pre>
 *   metapaths.json   the metapaths that were counted
 *   dwpc.tsv         one row per (start, end) pair, one column per metapath
 *   dwwc.tsv         with --walks
 *   degrees.tsv      with --degrees
 * </pre>
 */
public class FeatureDriver {
  private static final Logger log = Logger.getLogger(FeatureDriver.class);

  private final FileUtil fileUtil;
  private final GraphLoader loader;
  private final Outputter outputter;

  public FeatureDriver() {
    this(new FileUtil(), new GraphLoader(), new Outputter());
  }

  @VisibleForTesting
  protected FeatureDriver(FileUtil fileUtil, GraphLoader loader, Outputter outputter) {
    this.fileUtil = fileUtil;
    this.loader = loader;
    this.outputter = outputter;
  }

  public void run(HetnetConfig config, boolean walks, boolean degrees) throws IOException {
    HetGraph graph = loader.loadGraph(config.nodeFile, config.edgeFile);
    ExecutorParallelMapper mapper = new ExecutorParallelMapper(config.numWorkers, config.failFast);

    FeatureExtractor extractor;
    if (config.metaPathFile != null) {
      MetaPathCatalog catalog = MetaPathCatalog.fromReader(
          fileUtil.getBufferedReader(config.metaPathFile));
      extractor = FeatureExtractor.fromCatalog(graph, catalog, config.dampening, mapper);
    } else {
      extractor = FeatureExtractor.fromGraph(graph, config.startType, config.endType,
                                             config.maxLength, config.dampening, mapper);
    }
    List<MetaPath> metaPaths = extractor.getMetaPaths();
    if (metaPaths.isEmpty()) {
      log.warn("No metapaths to count; not writing any features");
      return;
    }

    NodeSelector start = getSelector(config.startSelector, config.startType, metaPaths.get(0)
                                     .getStartType());
    NodeSelector end = getSelector(config.endSelector, config.endType, metaPaths.get(0)
                                   .getEndType());

    String outputBase = fileUtil.addDirectorySeparatorIfNecessary(config.outputBase);
    fileUtil.mkdirs(outputBase);
    outputter.outputMetaPaths(outputBase + "metapaths.json",
                              MetaPathCatalog.fromMetaPaths(metaPaths));

    FeatureTable dwpc = extractor.extract(PathCountSemantics.PATHS, null, start, end);
    outputter.outputFeatureTable(outputBase + "dwpc.tsv", dwpc);
    if (walks) {
      FeatureTable dwwc = extractor.extract(PathCountSemantics.WALKS, null, start, end);
      outputter.outputFeatureTable(outputBase + "dwwc.tsv", dwwc);
    }
    if (degrees) {
      outputter.outputFeatureTable(outputBase + "degrees.tsv",
                                   extractor.extractDegrees(start, end));
    }
  }

  private NodeSelector getSelector(String selector, String type, String metaPathType) {
    if (selector != null) return NodeSelector.parse(selector);
    if (type != null) return NodeSelector.ofType(type);
    return NodeSelector.ofType(metaPathType);
  }

  @VisibleForTesting
  protected static FeatureDriver driver = new FeatureDriver();

  public static void main(String[] args) throws IOException {
    Options cmdLineOptions = createOptionParser();
    CommandLine cmdLine = null;
    try {
      CommandLineParser parser = new PosixParser();
      cmdLine = parser.parse(cmdLineOptions, args);
    } catch (ParseException e) {
      printHelp("ParseException while processing arguments");
      return;
    }
    runFeatures(cmdLine);
  }

  public static Options createOptionParser() {
    Options cmdLineOptions = new Options();

    // Node table with id and label columns, and edge table with start_id, end_id and type
    // columns.  See GraphLoader for the accepted layouts.
    cmdLineOptions.addOption("n", "nodes", true, "node table");
    cmdLineOptions.addOption("e", "edges", true, "edge table");

    // Either a metapaths.json catalog, or a start and end type to enumerate metapaths between.
    cmdLineOptions.addOption("m", "metapaths", true, "metapath catalog (metapaths.json)");
    cmdLineOptions.addOption("s", "start-type", true, "start node type");
    cmdLineOptions.addOption("t", "end-type", true, "end node type");
    cmdLineOptions.addOption("l", "max-length", true, "longest metapath to enumerate");

    // Selectors: a node type, "ids:a,b,c" or "indices:0,1,2".
    cmdLineOptions.addOption(null, "start-nodes", true, "which start nodes to report");
    cmdLineOptions.addOption(null, "end-nodes", true, "which end nodes to report");

    cmdLineOptions.addOption("w", "damping", true, "degree dampening exponent");
    cmdLineOptions.addOption("j", "workers", true, "number of worker threads");
    cmdLineOptions.addOption(null, "fail-fast", false, "stop at the first failing metapath");
    cmdLineOptions.addOption(null, "walks", false, "also compute DWWC features");
    cmdLineOptions.addOption(null, "degrees", false, "also compute degree features");

    // Parameters file: key-tab-value lines, see HetnetConfig.Builder.setParam.  Command line
    // options override the file.
    cmdLineOptions.addOption("p", "param-file", true, "parameter file");
    cmdLineOptions.addOption("o", "outdir", true, "base directory for output");
    return cmdLineOptions;
  }

  private static void printHelp(String message) {
    if (message != null) System.out.println(message);
    HelpFormatter formatter = new HelpFormatter();
    formatter.printHelp("FeatureDriver", createOptionParser());
  }

  public static void runFeatures(CommandLine cmdLine) throws IOException {
    HetnetConfig.Builder builder = new HetnetConfig.Builder();
    String parameterFile = cmdLine.getOptionValue("param-file");
    if (parameterFile != null) {
      builder.setFromParamFile(driver.fileUtil.getBufferedReader(parameterFile));
    }
    setFromCommandLine(builder, cmdLine, "nodes", "node_file");
    setFromCommandLine(builder, cmdLine, "edges", "edge_file");
    setFromCommandLine(builder, cmdLine, "metapaths", "metapath_file");
    setFromCommandLine(builder, cmdLine, "start-type", "start_type");
    setFromCommandLine(builder, cmdLine, "end-type", "end_type");
    setFromCommandLine(builder, cmdLine, "max-length", "max_length");
    setFromCommandLine(builder, cmdLine, "start-nodes", "start_nodes");
    setFromCommandLine(builder, cmdLine, "end-nodes", "end_nodes");
    setFromCommandLine(builder, cmdLine, "damping", "damping");
    setFromCommandLine(builder, cmdLine, "workers", "num_workers");
    setFromCommandLine(builder, cmdLine, "outdir", "output_dir");
    if (cmdLine.hasOption("fail-fast")) builder.setFailFast(true);

    HetnetConfig config;
    try {
      config = builder.build();
    } catch (IllegalStateException e) {
      printHelp(e.getMessage());
      return;
    }
    if (config.outputBase == null) {
      printHelp("An output directory is required");
      return;
    }
    if (config.metaPathFile == null && config.startType == null) {
      printHelp("Give either a metapath catalog or a start and end type");
      return;
    }
    driver.run(config, cmdLine.hasOption("walks"), cmdLine.hasOption("degrees"));
  }

  static void setFromCommandLine(HetnetConfig.Builder builder,
                                 CommandLine cmdLine,
                                 String option,
                                 String param) {
    String value = cmdLine.getOptionValue(option);
    if (value != null) builder.setParam(param, value);
  }
}
