package edu.cmu.ml.rtw.hetnet.graphs;

import java.util.List;

import junit.framework.TestCase;

import com.google.common.collect.Lists;

import edu.cmu.ml.rtw.hetnet.errors.UnknownNodeReferenceException;
import edu.cmu.ml.rtw.hetnet.util.TestUtil;
import edu.cmu.ml.rtw.hetnet.util.TestUtil.Function;

public class HetGraphTest extends TestCase {

  private HetGraph graph = ToyGraphs.abc();

  public void testIndicesFollowNodeTableOrder() {
    assertEquals(7, graph.getNumNodes());
    assertEquals(0, graph.getIndex("a1"));
    assertEquals(4, graph.getIndex("b3"));
    assertEquals("c2", graph.getId(6));
    assertEquals("B", graph.getType(3));
    assertEquals("C", graph.getNodeType("c1"));
  }

  public void testIndicesOfType() {
    int[] bs = graph.getIndicesOfType("B");
    assertEquals(3, bs.length);
    assertEquals(2, bs[0]);
    assertEquals(4, bs[2]);
    bs[0] = 100;
    assertEquals(2, graph.getIndicesOfType("B")[0]);
    assertEquals(0, graph.getIndicesOfType("D").length);
    assertEquals(Lists.newArrayList("A", "B", "C"), graph.getNodeTypes());
  }

  public void testEdgesByTypeKeepFirstSeenOrder() {
    assertEquals(Lists.newArrayList("x_AxB", "y_By>C"),
                 Lists.newArrayList(graph.getEdgesByType().keySet()));
    assertEquals(3, graph.getEdgesOfType("y_By>C").size());
    assertTrue(graph.getEdgesOfType("z_AzC").isEmpty());
    assertEquals(7, graph.getEdges().size());
  }

  public void testUnknownIdFails() {
    assertFalse(graph.hasNode("d1"));
    TestUtil.expectError(UnknownNodeReferenceException.class, "d1", new Function() {
      @Override
      public void call() {
        graph.getIndex("d1");
      }
    });
  }

  public void testDuplicateNodeIdFails() {
    final List<Node> nodes = Lists.newArrayList(new Node("a", "A"), new Node("a", "B"));
    TestUtil.expectError(IllegalArgumentException.class, new Function() {
      @Override
      public void call() {
        new HetGraph(nodes, Lists.<Edge>newArrayList());
      }
    });
  }
}
