package edu.cmu.ml.rtw.hetnet.schema;

import java.util.List;

import junit.framework.TestCase;

import com.google.common.collect.Lists;

import edu.cmu.ml.rtw.hetnet.errors.SchemaParseException;
import edu.cmu.ml.rtw.hetnet.graphs.Edge;
import edu.cmu.ml.rtw.hetnet.graphs.HetGraph;
import edu.cmu.ml.rtw.hetnet.graphs.Node;
import edu.cmu.ml.rtw.hetnet.util.TestUtil;
import edu.cmu.ml.rtw.hetnet.util.TestUtil.Function;

public class MetaGraphTest extends TestCase {

  private MetaGraph metaGraph;

  @Override
  public void setUp() {
    metaGraph = new MetaGraph.Builder()
        .addEdgeType("binds_CbG", "Compound", "Gene")
        .addEdgeType("regulates_Gr>G", "Gene", "Gene")
        .addEdgeType("interacts_GiG", "Gene", "Gene")
        .addEdgeType("treats_CtD", "Compound", "Disease")
        .build();
  }

  public void testNodeTypeCodesAreLearnedFromAbbreviations() {
    assertEquals("C", metaGraph.getNodeTypeCode("Compound"));
    assertEquals("G", metaGraph.getNodeTypeCode("Gene"));
    assertEquals("D", metaGraph.getNodeTypeCode("Disease"));
    assertTrue(metaGraph.hasNodeType("Gene"));
    assertFalse(metaGraph.hasNodeType("Anatomy"));
  }

  public void testInverseMetaEdges() {
    MetaEdge binds = metaGraph.getMetaEdge("CbG");
    MetaEdge inverse = metaGraph.getMetaEdge("GbC");
    assertSame(inverse, binds.getInverse());
    assertSame(binds, inverse.getInverse());
    assertFalse(binds.isInverted());
    assertTrue(inverse.isInverted());
    assertEquals("Gene", inverse.getSourceType());
    assertEquals("Compound", inverse.getTargetType());
    assertEquals("CbG", inverse.getStandardAbbrev());

    MetaEdge regulates = metaGraph.getMetaEdge("Gr>G");
    MetaEdge regulatedBy = metaGraph.getMetaEdge("G<rG");
    assertSame(regulatedBy, regulates.getInverse());
    assertEquals(EdgeDirection.BACKWARD, regulatedBy.getDirection());
    assertEquals("Gr>G", regulatedBy.getStandardAbbrev());
  }

  public void testMarkerBeforeThePredicateIsRewrittenToTheUsualForm() {
    MetaGraph upregulates = new MetaGraph.Builder()
        .addEdgeType("upregulates_A>uB", "Anatomy", "Gene")
        .build();
    MetaEdge forward = upregulates.getMetaEdge("Au>B");
    assertEquals("upregulates_A>uB", forward.getEdgeType());
    assertEquals(EdgeDirection.FORWARD, forward.getDirection());
    assertEquals("B<uA", forward.getInverse().getAbbrev());
  }

  public void testUndirectedSelfEdgeIsItsOwnInverse() {
    MetaEdge interacts = metaGraph.getMetaEdge("GiG");
    assertSame(interacts, interacts.getInverse());
  }

  public void testOutgoingIsSortedAndIncludesInverses() {
    List<String> abbreviations = Lists.newArrayList();
    for (MetaEdge metaEdge : metaGraph.getOutgoing("Gene")) {
      abbreviations.add(metaEdge.getAbbrev());
    }
    assertEquals(Lists.newArrayList("G<rG", "GbC", "GiG", "Gr>G"), abbreviations);
    assertTrue(metaGraph.getOutgoing("Anatomy").isEmpty());
  }

  public void testDisplayNames() {
    assertEquals("Compound - binds - Gene", metaGraph.getMetaEdge("CbG").toString());
    assertEquals("Gene > regulates > Gene", metaGraph.getMetaEdge("Gr>G").toString());
    assertEquals("Gene < regulates < Gene", metaGraph.getMetaEdge("G<rG").toString());
  }

  public void testConflictingCodesFail() {
    TestUtil.expectError(SchemaParseException.class, new Function() {
      @Override
      public void call() {
        new MetaGraph.Builder()
            .addEdgeType("binds_CbG", "Compound", "Gene")
            .addEdgeType("treats_XtD", "Compound", "Disease");
      }
    });
    TestUtil.expectError(SchemaParseException.class, new Function() {
      @Override
      public void call() {
        new MetaGraph.Builder()
            .addEdgeType("binds_CbG", "Compound", "Gene")
            .addEdgeType("treats_CtD", "Cell", "Disease");
      }
    });
  }

  public void testDuplicateAbbreviationFails() {
    TestUtil.expectError(SchemaParseException.class, new Function() {
      @Override
      public void call() {
        new MetaGraph.Builder()
            .addEdgeType("binds_CbG", "Compound", "Gene")
            .addEdgeType("bound_GbC", "Gene", "Compound")
            .build();
      }
    });
  }

  public void testFromGraphUsesEndpointTypes() {
    List<Node> nodes = Lists.newArrayList(new Node("a1", "A"), new Node("b1", "B"));
    List<Edge> edges = Lists.newArrayList(new Edge("a1", "b1", "x_AxB"));
    MetaGraph fromGraph = MetaGraph.fromGraph(new HetGraph(nodes, edges));
    assertEquals(1, fromGraph.getMetaEdges().size());
    assertEquals("A", fromGraph.getMetaEdges().get(0).getSourceType());
    assertEquals("B", fromGraph.getMetaEdges().get(0).getTargetType());
    assertEquals("x", fromGraph.getMetaEdges().get(0).getName());
  }
}
