package edu.cmu.ml.rtw.hetnet.features;

import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import edu.cmu.ml.rtw.hetnet.errors.UnknownMetaPathException;
import edu.cmu.ml.rtw.hetnet.graphs.HetGraph;
import edu.cmu.ml.rtw.hetnet.graphs.NodeSelector;
import edu.cmu.ml.rtw.hetnet.graphs.SelectedNodes;
import edu.cmu.ml.rtw.hetnet.matrix.MatrixCache;
import edu.cmu.ml.rtw.hetnet.matrix.SparseMatrix;
import edu.cmu.ml.rtw.hetnet.parallel.ParallelMapper;
import edu.cmu.ml.rtw.hetnet.schema.MetaGraph;

/**
 * Computes DWPC, DWWC and degree features over a heterogeneous network.  Construction builds the
 * schema, the metapath set and every adjacency and weighted matrix up front; after that the
 * extractor is read-only and each extraction fans its metapaths out over the ParallelMapper.
 */
public class FeatureExtractor {
  private static final Logger log = Logger.getLogger(FeatureExtractor.class);

  private final HetGraph graph;
  private final MetaGraph metaGraph;
  private final MatrixCache cache;
  private final Map<String, MetaPath> metaPaths;
  private final ParallelMapper mapper;
  private final PathCounter counter;
  private final ResultAssembler assembler;

  public FeatureExtractor(HetGraph graph,
                          MetaGraph metaGraph,
                          List<MetaPath> metaPaths,
                          MatrixCache cache,
                          ParallelMapper mapper) {
    this.graph = graph;
    this.metaGraph = metaGraph;
    this.cache = cache;
    this.mapper = mapper;
    Map<String, MetaPath> byAbbreviation = Maps.newLinkedHashMap();
    for (MetaPath metaPath : metaPaths) {
      byAbbreviation.put(metaPath.getAbbreviation(), metaPath);
    }
    this.metaPaths = byAbbreviation;
    this.counter = new PathCounter(cache);
    this.assembler = new ResultAssembler();
  }

  /**
   * Sets up extraction for every metapath from startType to endType of length at most
   * maxLength.
   */
  public static FeatureExtractor fromGraph(HetGraph graph,
                                           String startType,
                                           String endType,
                                           int maxLength,
                                           double w,
                                           ParallelMapper mapper) {
    MetaGraph metaGraph = MetaGraph.fromGraph(graph);
    List<MetaPath> metaPaths =
        new MetaPathEnumerator(metaGraph).enumerate(startType, endType, maxLength);
    return new FeatureExtractor(graph, metaGraph, metaPaths,
                                MatrixCache.build(graph, metaGraph, w), mapper);
  }

  /**
   * Sets up extraction for exactly the metapaths in a catalog.
   */
  public static FeatureExtractor fromCatalog(HetGraph graph,
                                             MetaPathCatalog catalog,
                                             double w,
                                             ParallelMapper mapper) {
    MetaGraph metaGraph = MetaGraph.fromGraph(graph);
    List<MetaPath> metaPaths = catalog.resolve(metaGraph);
    log.info("Using " + metaPaths.size() + " metapaths from the catalog");
    return new FeatureExtractor(graph, metaGraph, metaPaths,
                                MatrixCache.build(graph, metaGraph, w), mapper);
  }

  public HetGraph getGraph() {
    return graph;
  }

  public MetaGraph getMetaGraph() {
    return metaGraph;
  }

  public List<MetaPath> getMetaPaths() {
    return ImmutableList.copyOf(metaPaths.values());
  }

  public MetaPath getMetaPath(String abbreviation) {
    MetaPath metaPath = metaPaths.get(abbreviation);
    if (metaPath == null) {
      throw new UnknownMetaPathException("Metapath " + abbreviation + " is not one of the "
                                         + metaPaths.size() + " known metapaths");
    }
    return metaPath;
  }

  public FeatureTable extractDwpc(List<String> requested, NodeSelector start, NodeSelector end) {
    return extract(PathCountSemantics.PATHS, requested, start, end);
  }

  public FeatureTable extractDwwc(List<String> requested, NodeSelector start, NodeSelector end) {
    return extract(PathCountSemantics.WALKS, requested, start, end);
  }

  /**
   * Counts the requested metapaths (all known metapaths if requested is null or empty) and
   * returns the counts between the selected start and end nodes.  Selectors and metapath names
   * are checked before any counting starts.
   */
  public FeatureTable extract(PathCountSemantics semantics,
                              List<String> requested,
                              NodeSelector start,
                              NodeSelector end) {
    List<MetaPath> toCount = Lists.newArrayList();
    if (requested == null || requested.isEmpty()) {
      toCount.addAll(metaPaths.values());
    } else {
      for (String abbreviation : requested) {
        toCount.add(getMetaPath(abbreviation));
      }
    }
    SelectedNodes startNodes = start.resolve(graph);
    SelectedNodes endNodes = end.resolve(graph);

    log.info("Calculating " + semantics.getFeatureName() + "s for " + toCount.size()
             + " metapaths...");
    List<PathCountTask> tasks = Lists.newArrayList();
    List<String> names = Lists.newArrayList();
    for (MetaPath metaPath : toCount) {
      tasks.add(new PathCountTask(counter, metaPath, semantics));
      names.add(metaPath.getAbbreviation());
    }
    List<SparseMatrix> products = mapper.map(tasks);

    log.info("Reformatting results...");
    return assembler.assemble(products, names, startNodes, endNodes);
  }

  public FeatureTable extractDegrees(NodeSelector start, NodeSelector end) {
    return new DegreeFeatureExtractor(metaGraph, cache).extract(start.resolve(graph),
                                                                end.resolve(graph));
  }
}
