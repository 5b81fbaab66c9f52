package edu.cmu.ml.rtw.hetnet.matrix;

import java.util.List;
import java.util.Map;

import junit.framework.TestCase;

import com.google.common.collect.Lists;

import edu.cmu.ml.rtw.hetnet.errors.UnknownNodeReferenceException;
import edu.cmu.ml.rtw.hetnet.graphs.Edge;
import edu.cmu.ml.rtw.hetnet.graphs.HetGraph;
import edu.cmu.ml.rtw.hetnet.graphs.Node;
import edu.cmu.ml.rtw.hetnet.graphs.ToyGraphs;
import edu.cmu.ml.rtw.hetnet.schema.MetaGraph;
import edu.cmu.ml.rtw.hetnet.util.TestUtil;
import edu.cmu.ml.rtw.hetnet.util.TestUtil.Function;

public class AdjacencyMatrixBuilderTest extends TestCase {

  public void testBuildAllRegistersBothOrientations() {
    HetGraph graph = ToyGraphs.abc();
    MetaGraph metaGraph = MetaGraph.fromGraph(graph);
    Map<String, SparseMatrix> matrices = new AdjacencyMatrixBuilder(graph).buildAll(metaGraph);
    assertEquals(4, matrices.size());

    // Undirected: symmetric, and the inverse shares the instance.
    SparseMatrix axb = matrices.get("AxB");
    assertEquals(7, axb.getNumRows());
    assertEquals(1.0, axb.get(0, 2));
    assertEquals(1.0, axb.get(2, 0));
    assertEquals(0.0, axb.get(1, 2));
    assertSame(axb, matrices.get("BxA"));

    // Directed: only the declared direction, and the inverse is the transpose.
    SparseMatrix byc = matrices.get("By>C");
    assertEquals(1.0, byc.get(2, 5));
    assertEquals(0.0, byc.get(5, 2));
    assertEquals(byc.transpose(), matrices.get("C<yB"));
  }

  public void testUnknownEndpointFails() {
    List<Node> nodes = Lists.newArrayList(new Node("a1", "A"), new Node("b1", "B"));
    List<Edge> edges = Lists.newArrayList(new Edge("a1", "b1", "x_AxB"),
                                          new Edge("a1", "b9", "x_AxB"));
    final HetGraph graph = new HetGraph(nodes, edges);
    final MetaGraph metaGraph = MetaGraph.fromGraph(graph);
    TestUtil.expectError(UnknownNodeReferenceException.class, "b9", new Function() {
      @Override
      public void call() {
        new AdjacencyMatrixBuilder(graph).build(metaGraph.getMetaEdge("AxB"));
      }
    });
  }

  public void testMatrixCacheSharesWeightedMatrices() {
    HetGraph graph = ToyGraphs.abc();
    MatrixCache cache = MatrixCache.build(graph, MetaGraph.fromGraph(graph), 0.4);
    assertEquals(0.4, cache.getDampening());
    assertEquals(4, cache.getAbbreviations().size());
    assertSame(cache.getWeighted("AxB"), cache.getWeighted("AxB"));
    assertEquals(cache.getWeighted("By>C").transpose(), cache.getWeighted("C<yB"));
  }
}
