package edu.cmu.ml.rtw.hetnet.graphs;

import java.io.BufferedReader;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.log4j.Logger;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;

import edu.cmu.ml.rtw.hetnet.util.FileUtil;
import edu.cmu.ml.rtw.hetnet.util.Pair;

/**
 * Reads node and edge tables in the neo4j bulk import layout.  The node table needs an id column
 * and a label column; the edge table needs start id, end id and type columns.  Column headers are
 * matched after stripping the neo4j decoration, so ":ID", "id" and "compound_id:ID" all name the
 * id column, and any other columns are ignored.  Files ending in .tsv are tab separated, everything
 * else is comma separated with double-quote quoting.
 */
public class GraphLoader {
  private static final Logger log = Logger.getLogger(GraphLoader.class);

  private static final ImmutableSet<String> RESERVED_COLUMNS =
      ImmutableSet.of("id", "label", "start_id", "end_id", "type");
  private static final ImmutableList<String> EDGE_COLUMNS =
      ImmutableList.of("start_id", "end_id", "type");

  private final FileUtil fileUtil;

  public GraphLoader() {
    this(new FileUtil());
  }

  @VisibleForTesting
  protected GraphLoader(FileUtil fileUtil) {
    this.fileUtil = fileUtil;
  }

  public HetGraph loadGraph(String nodeFile, String edgeFile) throws IOException {
    log.info("Reading file information...");
    List<Node> nodes = readNodes(nodeFile);
    List<Edge> edges = readEdges(edgeFile);
    log.info("Read " + nodes.size() + " nodes and " + edges.size() + " edges");
    return new HetGraph(nodes, edges);
  }

  public List<Node> readNodes(String filename) throws IOException {
    BufferedReader reader = fileUtil.getBufferedReader(filename);
    char delimiter = getDelimiter(filename);
    try {
      Map<String, Integer> columns = readHeader(reader, delimiter, filename);
      int idColumn = requireColumn(columns, "id", filename);
      int labelColumn = requireColumn(columns, "label", filename);
      List<Node> nodes = Lists.newArrayList();
      String line;
      while ((line = reader.readLine()) != null) {
        if (line.isEmpty()) continue;
        List<String> fields = splitLine(line, delimiter);
        String id = getField(fields, idColumn);
        String label = getField(fields, labelColumn);
        if (id == null || label == null) {
          log.warn("Skipping node row with missing values: " + line);
          continue;
        }
        nodes.add(new Node(id, label));
      }
      return nodes;
    } finally {
      reader.close();
    }
  }

  /**
   * Reads an edge table.  Rows missing a start id, end id or type are dropped.
   */
  public List<Edge> readEdges(String filename) throws IOException {
    BufferedReader reader = fileUtil.getBufferedReader(filename);
    char delimiter = getDelimiter(filename);
    try {
      Map<String, Integer> columns = readHeader(reader, delimiter, filename);
      int startColumn = requireColumn(columns, EDGE_COLUMNS.get(0), filename);
      int endColumn = requireColumn(columns, EDGE_COLUMNS.get(1), filename);
      int typeColumn = requireColumn(columns, EDGE_COLUMNS.get(2), filename);
      List<Edge> edges = Lists.newArrayList();
      int dropped = 0;
      String line;
      while ((line = reader.readLine()) != null) {
        if (line.isEmpty()) continue;
        List<String> fields = splitLine(line, delimiter);
        String start = getField(fields, startColumn);
        String end = getField(fields, endColumn);
        String type = getField(fields, typeColumn);
        if (start == null || end == null || type == null) {
          dropped++;
          continue;
        }
        edges.add(new Edge(start, end, type));
      }
      if (dropped > 0) {
        log.warn("Dropped " + dropped + " edge rows with missing values from " + filename);
      }
      return edges;
    } finally {
      reader.close();
    }
  }

  /**
   * Reads (start id, end id) pairs from a table with start_id and end_id columns, such as the
   * edges the permuter must not create.  Any type column is ignored.
   */
  public Set<Pair<String, String>> readEdgePairs(String filename) throws IOException {
    BufferedReader reader = fileUtil.getBufferedReader(filename);
    char delimiter = getDelimiter(filename);
    try {
      Map<String, Integer> columns = readHeader(reader, delimiter, filename);
      int startColumn = requireColumn(columns, "start_id", filename);
      int endColumn = requireColumn(columns, "end_id", filename);
      Set<Pair<String, String>> pairs = Sets.newHashSet();
      String line;
      while ((line = reader.readLine()) != null) {
        if (line.isEmpty()) continue;
        List<String> fields = splitLine(line, delimiter);
        String start = getField(fields, startColumn);
        String end = getField(fields, endColumn);
        if (start == null || end == null) continue;
        pairs.add(Pair.makePair(start, end));
      }
      return pairs;
    } finally {
      reader.close();
    }
  }

  /**
   * The edge table's own header names for its start id, end id and type columns, in that order,
   * so that rewritten edges can carry the headers they were read with.
   */
  public List<String> readEdgeColumnNames(String filename) throws IOException {
    BufferedReader reader = fileUtil.getBufferedReader(filename);
    try {
      List<String> names = readHeaderNames(reader, getDelimiter(filename), filename);
      Map<String, Integer> columns = indexColumns(names);
      List<String> edgeColumns = Lists.newArrayList();
      for (String column : EDGE_COLUMNS) {
        edgeColumns.add(names.get(requireColumn(columns, column, filename)).trim());
      }
      return edgeColumns;
    } finally {
      reader.close();
    }
  }

  private Map<String, Integer> readHeader(BufferedReader reader, char delimiter, String filename)
      throws IOException {
    return indexColumns(readHeaderNames(reader, delimiter, filename));
  }

  private List<String> readHeaderNames(BufferedReader reader, char delimiter, String filename)
      throws IOException {
    String header = reader.readLine();
    if (header == null) {
      throw new IOException("Table has no header line: " + filename);
    }
    return splitLine(header, delimiter);
  }

  private Map<String, Integer> indexColumns(List<String> names) {
    Map<String, Integer> columns = Maps.newHashMap();
    for (int i = 0; i < names.size(); i++) {
      String name = normalizeColumnName(names.get(i));
      if (!columns.containsKey(name)) {
        columns.put(name, i);
      }
    }
    return columns;
  }

  private int requireColumn(Map<String, Integer> columns, String name, String filename)
      throws IOException {
    Integer column = columns.get(name);
    if (column == null) {
      throw new IOException("Table " + filename + " has no '" + name + "' column");
    }
    return column;
  }

  private String getField(List<String> fields, int column) {
    if (column >= fields.size()) return null;
    String value = fields.get(column);
    if (value.isEmpty()) return null;
    return value;
  }

  /**
   * Strips neo4j import decoration from a column name: ":START_ID" becomes "start_id",
   * "compound_id:ID" becomes "id", and "name:STRING" becomes "name".
   */
  @VisibleForTesting
  protected static String normalizeColumnName(String column) {
    String lower = column.trim().toLowerCase();
    int colon = lower.indexOf(':');
    if (colon < 0) {
      return lower;
    }
    String before = lower.substring(0, colon);
    String after = lower.substring(colon + 1);
    if (RESERVED_COLUMNS.contains(after)) {
      return after;
    }
    return before;
  }

  private char getDelimiter(String filename) {
    if (filename.endsWith(".tsv") || filename.endsWith(".tsv.bz2")) {
      return '\t';
    }
    return ',';
  }

  @VisibleForTesting
  protected static List<String> splitLine(String line, char delimiter) {
    List<String> fields = Lists.newArrayList();
    StringBuilder current = new StringBuilder();
    boolean quoted = false;
    for (int i = 0; i < line.length(); i++) {
      char c = line.charAt(i);
      if (quoted) {
        if (c == '"') {
          if (i + 1 < line.length() && line.charAt(i + 1) == '"') {
            current.append('"');
            i++;
          } else {
            quoted = false;
          }
        } else {
          current.append(c);
        }
      } else if (c == '"') {
        quoted = true;
      } else if (c == delimiter) {
        fields.add(current.toString());
        current = new StringBuilder();
      } else {
        current.append(c);
      }
    }
    fields.add(current.toString());
    return fields;
  }
}
