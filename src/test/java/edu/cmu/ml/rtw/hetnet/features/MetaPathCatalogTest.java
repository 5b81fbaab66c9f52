package edu.cmu.ml.rtw.hetnet.features;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.List;

import junit.framework.TestCase;

import com.google.common.collect.Lists;

import edu.cmu.ml.rtw.hetnet.errors.UnknownMetaPathException;
import edu.cmu.ml.rtw.hetnet.graphs.ToyGraphs;
import edu.cmu.ml.rtw.hetnet.schema.MetaGraph;
import edu.cmu.ml.rtw.hetnet.util.TestUtil;
import edu.cmu.ml.rtw.hetnet.util.TestUtil.Function;

public class MetaPathCatalogTest extends TestCase {

  private MetaGraph metaGraph = MetaGraph.fromGraph(ToyGraphs.abc());

  private String catalogJson =
      "[\n" +
      "  {\n" +
      "    \"abbreviation\": \"AxBy>C\",\n" +
      "    \"length\": 2,\n" +
      "    \"edges\": [\"A - x - B\", \"B > y > C\"],\n" +
      "    \"edge_abbreviations\": [\"AxB\", \"By>C\"],\n" +
      "    \"standard_edge_abbreviations\": [\"AxB\", \"By>C\"],\n" +
      "    \"dwpc_raw_mean\": 0.5\n" +
      "  },\n" +
      "  {\n" +
      "    \"abbreviation\": \"my_custom_name\",\n" +
      "    \"length\": 2,\n" +
      "    \"edges\": [\"A - x - B\", \"B - x - A\"],\n" +
      "    \"edge_abbreviations\": [\"AxB\", \"BxA\"],\n" +
      "    \"standard_edge_abbreviations\": [\"AxB\", \"AxB\"]\n" +
      "  }\n" +
      "]\n";

  public void testReadAndResolveKeepsRecordsVerbatim() throws IOException {
    MetaPathCatalog catalog = MetaPathCatalog.fromReader(new StringReader(catalogJson));
    assertEquals(2, catalog.getRecords().size());
    List<MetaPath> metaPaths = catalog.resolve(metaGraph);
    assertEquals("AxBy>C", metaPaths.get(0).getAbbreviation());
    assertEquals("my_custom_name", metaPaths.get(1).getAbbreviation());
    assertEquals(Lists.newArrayList("AxB", "AxB"),
                 metaPaths.get(1).getStandardEdgeAbbreviations());
    assertEquals("A", metaPaths.get(1).getEndType());
    assertSame(metaGraph.getMetaEdge("BxA"), metaPaths.get(1).getEdges().get(1));
  }

  public void testWriteThenReadGivesSameMetaPaths() throws IOException {
    List<MetaPath> enumerated = new MetaPathEnumerator(metaGraph).enumerate("A", "A", 4);
    StringWriter writer = new StringWriter();
    MetaPathCatalog.fromMetaPaths(enumerated).write(writer);
    String json = writer.toString();
    assertTrue(json.contains("\"edge_abbreviations\""));
    assertTrue(json.contains("\"standard_edge_abbreviations\""));
    List<MetaPath> reread =
        MetaPathCatalog.fromReader(new StringReader(json)).resolve(metaGraph);
    assertEquals(enumerated, reread);
    assertEquals(enumerated.get(0).getEdgeNames(), reread.get(0).getEdgeNames());
  }

  public void testUnknownMetaEdgeFails() throws IOException {
    final MetaPathCatalog catalog = MetaPathCatalog.fromReader(new StringReader(
        "[{\"abbreviation\": \"AzC\", \"length\": 1, \"edges\": [\"A - z - C\"], "
        + "\"edge_abbreviations\": [\"AzC\"], \"standard_edge_abbreviations\": [\"AzC\"]}]"));
    TestUtil.expectError(UnknownMetaPathException.class, "AzC", new Function() {
      @Override
      public void call() {
        catalog.resolve(metaGraph);
      }
    });
  }

  public void testNullFieldsFailWithTheRecordName() throws IOException {
    final MetaPathCatalog nullEdges = MetaPathCatalog.fromReader(new StringReader(
        "[{\"abbreviation\": \"AxBy>C\", \"length\": 2, \"edges\": null, "
        + "\"edge_abbreviations\": [\"AxB\", \"By>C\"], "
        + "\"standard_edge_abbreviations\": [\"AxB\", \"By>C\"]}]"));
    TestUtil.expectError(UnknownMetaPathException.class, "AxBy>C has no edges", new Function() {
      @Override
      public void call() {
        nullEdges.resolve(metaGraph);
      }
    });
    final MetaPathCatalog nullStandard = MetaPathCatalog.fromReader(new StringReader(
        "[{\"abbreviation\": \"AxBy>C\", \"length\": 2, "
        + "\"edges\": [\"A - x - B\", \"B > y > C\"], "
        + "\"edge_abbreviations\": [\"AxB\", \"By>C\"], "
        + "\"standard_edge_abbreviations\": null}]"));
    TestUtil.expectError(UnknownMetaPathException.class, "AxBy>C has no standard",
                         new Function() {
      @Override
      public void call() {
        nullStandard.resolve(metaGraph);
      }
    });
  }
}
