package edu.cmu.ml.rtw.hetnet.features;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import edu.cmu.ml.rtw.hetnet.errors.UnknownMetaPathException;
import edu.cmu.ml.rtw.hetnet.schema.MetaEdge;
import edu.cmu.ml.rtw.hetnet.schema.MetaGraph;

/**
 * A fixed, previously published set of metapaths, stored as a JSON array of records.  When a
 * catalog is given it replaces enumeration entirely, and its records are used as they are: the
 * abbreviation, length and edge names are never re-derived.  Only the per-edge abbreviations are
 * looked up in the schema, to find each step's matrix and node types.
 */
public class MetaPathCatalog {
  private static final ObjectMapper MAPPER =
      new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

  private final List<Record> records;

  public MetaPathCatalog(List<Record> records) {
    this.records = ImmutableList.copyOf(records);
  }

  public static MetaPathCatalog fromReader(Reader reader) throws IOException {
    try {
      List<Record> records = MAPPER.readValue(reader, new TypeReference<List<Record>>() {});
      return new MetaPathCatalog(records);
    } finally {
      reader.close();
    }
  }

  /**
   * A catalog describing already enumerated metapaths, so that a later run can reuse exactly the
   * same feature set.
   */
  public static MetaPathCatalog fromMetaPaths(List<MetaPath> metaPaths) {
    List<Record> records = Lists.newArrayList();
    for (MetaPath metaPath : metaPaths) {
      records.add(new Record(metaPath.getAbbreviation(),
                             metaPath.getLength(),
                             metaPath.getEdgeNames(),
                             metaPath.getEdgeAbbreviations(),
                             metaPath.getStandardEdgeAbbreviations()));
    }
    return new MetaPathCatalog(records);
  }

  public void write(Writer writer) throws IOException {
    MAPPER.writeValue(writer, records);
  }

  public List<Record> getRecords() {
    return records;
  }

  /**
   * Turns the records into metapaths over the given schema, in file order.  Throws
   * UnknownMetaPathException if a record is missing a field or uses a metaedge abbreviation the
   * schema doesn't have.
   */
  public List<MetaPath> resolve(MetaGraph metaGraph) {
    List<MetaPath> metaPaths = Lists.newArrayList();
    for (Record record : records) {
      if (record.abbreviation == null) {
        throw new UnknownMetaPathException("Catalog record has no abbreviation");
      }
      if (record.edgeAbbreviations == null || record.edgeAbbreviations.isEmpty()) {
        throw new UnknownMetaPathException("Catalog metapath " + record.abbreviation
                                           + " has no edge abbreviations");
      }
      if (record.edges == null) {
        throw new UnknownMetaPathException("Catalog metapath " + record.abbreviation
                                           + " has no edges");
      }
      if (record.standardEdgeAbbreviations == null) {
        throw new UnknownMetaPathException("Catalog metapath " + record.abbreviation
                                           + " has no standard edge abbreviations");
      }
      List<MetaEdge> edges = Lists.newArrayList();
      for (String abbreviation : record.edgeAbbreviations) {
        MetaEdge edge = metaGraph.getMetaEdge(abbreviation);
        if (edge == null) {
          throw new UnknownMetaPathException("Catalog metapath " + record.abbreviation
                                             + " uses unknown metaedge " + abbreviation);
        }
        edges.add(edge);
      }
      metaPaths.add(new MetaPath(record.abbreviation,
                                 record.length,
                                 edges,
                                 record.edges,
                                 record.edgeAbbreviations,
                                 record.standardEdgeAbbreviations));
    }
    return metaPaths;
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  @JsonPropertyOrder({"abbreviation", "length", "edges", "edge_abbreviations",
      "standard_edge_abbreviations"})
  public static class Record {
    @JsonProperty("abbreviation")
    public String abbreviation;
    @JsonProperty("length")
    public int length;
    @JsonProperty("edges")
    public List<String> edges = Lists.newArrayList();
    @JsonProperty("edge_abbreviations")
    public List<String> edgeAbbreviations = Lists.newArrayList();
    @JsonProperty("standard_edge_abbreviations")
    public List<String> standardEdgeAbbreviations = Lists.newArrayList();

    public Record() {}

    public Record(String abbreviation,
                  int length,
                  List<String> edges,
                  List<String> edgeAbbreviations,
                  List<String> standardEdgeAbbreviations) {
      this.abbreviation = abbreviation;
      this.length = length;
      this.edges = Lists.newArrayList(edges);
      this.edgeAbbreviations = Lists.newArrayList(edgeAbbreviations);
      this.standardEdgeAbbreviations = Lists.newArrayList(standardEdgeAbbreviations);
    }
  }
}
