package edu.cmu.ml.rtw.hetnet.features;

import java.util.List;

import junit.framework.TestCase;

import com.google.common.collect.Lists;

import edu.cmu.ml.rtw.hetnet.graphs.ToyGraphs;
import edu.cmu.ml.rtw.hetnet.schema.MetaGraph;

public class MetaPathEnumeratorTest extends TestCase {

  private MetaGraph hetio = new MetaGraph.Builder()
      .addEdgeType("binds_CbG", "Compound", "Gene")
      .addEdgeType("regulates_Gr>G", "Gene", "Gene")
      .addEdgeType("associates_DaG", "Disease", "Gene")
      .addEdgeType("treats_CtD", "Compound", "Disease")
      .build();

  private List<String> abbreviations(List<MetaPath> metaPaths) {
    List<String> result = Lists.newArrayList();
    for (MetaPath metaPath : metaPaths) {
      result.add(metaPath.getAbbreviation());
    }
    return result;
  }

  public void testToyNetworkHasExactlyOneMetaPath() {
    MetaGraph metaGraph = MetaGraph.fromGraph(ToyGraphs.abc());
    List<MetaPath> metaPaths = new MetaPathEnumerator(metaGraph).enumerate("A", "C", 3);
    assertEquals(1, metaPaths.size());
    MetaPath metaPath = metaPaths.get(0);
    assertEquals("AxBy>C", metaPath.getAbbreviation());
    assertEquals(2, metaPath.getLength());
    assertEquals(Lists.newArrayList("AxB", "By>C"), metaPath.getEdgeAbbreviations());
    assertEquals(Lists.newArrayList("A - x - B", "B > y > C"), metaPath.getEdgeNames());
    assertEquals(Lists.newArrayList("A", "B", "C"), metaPath.getNodeTypes());
  }

  public void testLengthOneStartToEndPathsAreDropped() {
    List<MetaPath> metaPaths = new MetaPathEnumerator(hetio).enumerate("Compound", "Disease", 2);
    assertEquals(Lists.newArrayList("CbGaD"), abbreviations(metaPaths));
  }

  public void testDirectedEdgesAreWalkedBothWays() {
    List<MetaPath> metaPaths = new MetaPathEnumerator(hetio).enumerate("Compound", "Disease", 3);
    List<String> found = abbreviations(metaPaths);
    assertTrue(found.contains("CbGr>GaD"));
    assertTrue(found.contains("CbG<rGaD"));
    assertTrue(found.contains("CtDaGaD"));
    assertTrue(found.contains("CbGbCtD"));
    for (MetaPath metaPath : metaPaths) {
      assertTrue(metaPath.getLength() > 1 && metaPath.getLength() <= 3);
      assertEquals("Disease", metaPath.getEndType());
    }
    // Shorter metapaths come first.
    assertEquals("CbGaD", found.get(0));
  }

  public void testEnumerationIsDeterministic() {
    MetaGraph shuffled = new MetaGraph.Builder()
        .addEdgeType("treats_CtD", "Compound", "Disease")
        .addEdgeType("associates_DaG", "Disease", "Gene")
        .addEdgeType("regulates_Gr>G", "Gene", "Gene")
        .addEdgeType("binds_CbG", "Compound", "Gene")
        .build();
    List<String> first =
        abbreviations(new MetaPathEnumerator(hetio).enumerate("Compound", "Disease", 4));
    List<String> second =
        abbreviations(new MetaPathEnumerator(shuffled).enumerate("Compound", "Disease", 4));
    assertEquals(first, second);
    assertEquals(first,
                 abbreviations(new MetaPathEnumerator(hetio).enumerate("Compound", "Disease", 4)));
  }

  public void testUnknownTypesGiveNoMetaPaths() {
    assertTrue(new MetaPathEnumerator(hetio).enumerate("Compound", "Anatomy", 3).isEmpty());
  }

  public void testReverse() {
    MetaPath metaPath = new MetaPathEnumerator(hetio).enumerate("Compound", "Disease", 3).get(0);
    MetaPath reversed = metaPath.reverse();
    assertEquals("DaGbC", reversed.getAbbreviation());
    assertEquals(metaPath, reversed.reverse());
    assertEquals(Lists.newArrayList("DaG", "GbC"), reversed.getEdgeAbbreviations());
    assertEquals(Lists.newArrayList("DaG", "CbG"), reversed.getStandardEdgeAbbreviations());
  }
}
