package edu.cmu.ml.rtw.hetnet.experiments;

import java.io.IOException;
import java.util.List;
import java.util.Set;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.commons.cli.PosixParser;
import org.apache.log4j.Logger;

import com.google.common.annotations.VisibleForTesting;

import edu.cmu.ml.rtw.hetnet.config.HetnetConfig;
import edu.cmu.ml.rtw.hetnet.graphs.GraphLoader;
import edu.cmu.ml.rtw.hetnet.graphs.HetGraph;
import edu.cmu.ml.rtw.hetnet.parallel.ExecutorParallelMapper;
import edu.cmu.ml.rtw.hetnet.permutation.GraphPermuter;
import edu.cmu.ml.rtw.hetnet.permutation.PermutationResult;
import edu.cmu.ml.rtw.hetnet.util.FileUtil;
import edu.cmu.ml.rtw.hetnet.util.Pair;

/**
 * Builds a degree-preserving null network: every edge type of the input is permuted on its own
 * and the permuted edges are written to edges.tsv under the output directory, under the start,
 * end and type headers of the input edge table.  stats.tsv gets one line of statistics per
 * checkpoint per edge type.
 */
public class PermutationDriver {
  private static final Logger log = Logger.getLogger(PermutationDriver.class);

  private final FileUtil fileUtil;
  private final GraphLoader loader;
  private final Outputter outputter;

  public PermutationDriver() {
    this(new FileUtil(), new GraphLoader(), new Outputter());
  }

  @VisibleForTesting
  protected PermutationDriver(FileUtil fileUtil, GraphLoader loader, Outputter outputter) {
    this.fileUtil = fileUtil;
    this.loader = loader;
    this.outputter = outputter;
  }

  public PermutationResult run(HetnetConfig config) throws IOException {
    HetGraph graph = loader.loadGraph(config.nodeFile, config.edgeFile);
    List<String> edgeColumns = loader.readEdgeColumnNames(config.edgeFile);
    Set<Pair<String, String>> excluded = null;
    if (config.excludedEdgeFile != null) {
      excluded = loader.readEdgePairs(config.excludedEdgeFile);
      log.info("Excluding " + excluded.size() + " edges from permutation");
    }
    GraphPermuter permuter =
        new GraphPermuter(new ExecutorParallelMapper(config.numWorkers, config.failFast));
    PermutationResult result =
        permuter.permute(graph.getEdgesByType(), config.multiplier, excluded, config.seed);

    String outputBase = fileUtil.addDirectorySeparatorIfNecessary(config.outputBase);
    fileUtil.mkdirs(outputBase);
    outputter.outputEdges(outputBase + "edges.tsv", result.getEdges(), edgeColumns);
    outputter.outputStats(outputBase + "stats.tsv", result.getStats(), true);
    return result;
  }

  @VisibleForTesting
  protected static PermutationDriver driver = new PermutationDriver();

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
    runPermutation(cmdLine);
  }

  public static Options createOptionParser() {
    Options cmdLineOptions = new Options();
    cmdLineOptions.addOption("n", "nodes", true, "node table");
    cmdLineOptions.addOption("e", "edges", true, "edge table");
    cmdLineOptions.addOption("x", "excluded", true, "edges the permutation may not create");
    cmdLineOptions.addOption("m", "multiplier", true, "swap attempts per edge");
    cmdLineOptions.addOption("r", "seed", true, "random seed");
    cmdLineOptions.addOption("j", "workers", true, "number of edge types to permute at once");
    cmdLineOptions.addOption(null, "fail-fast", false, "stop at the first failing edge type");
    cmdLineOptions.addOption("p", "param-file", true, "parameter file");
    cmdLineOptions.addOption("o", "outdir", true, "base directory for output");
    return cmdLineOptions;
  }

  private static void printHelp(String message) {
    if (message != null) System.out.println(message);
    HelpFormatter formatter = new HelpFormatter();
    formatter.printHelp("PermutationDriver", createOptionParser());
  }

  public static void runPermutation(CommandLine cmdLine) throws IOException {
    HetnetConfig.Builder builder = new HetnetConfig.Builder();
    String parameterFile = cmdLine.getOptionValue("param-file");
    if (parameterFile != null) {
      builder.setFromParamFile(driver.fileUtil.getBufferedReader(parameterFile));
    }
    FeatureDriver.setFromCommandLine(builder, cmdLine, "nodes", "node_file");
    FeatureDriver.setFromCommandLine(builder, cmdLine, "edges", "edge_file");
    FeatureDriver.setFromCommandLine(builder, cmdLine, "excluded", "excluded_edge_file");
    FeatureDriver.setFromCommandLine(builder, cmdLine, "multiplier", "multiplier");
    FeatureDriver.setFromCommandLine(builder, cmdLine, "seed", "seed");
    FeatureDriver.setFromCommandLine(builder, cmdLine, "workers", "num_workers");
    FeatureDriver.setFromCommandLine(builder, cmdLine, "outdir", "output_dir");
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
    driver.run(config);
  }
}
