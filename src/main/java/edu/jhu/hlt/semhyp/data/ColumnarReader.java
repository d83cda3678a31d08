package edu.jhu.hlt.semhyp.data;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import org.apache.log4j.Logger;

import edu.jhu.hlt.semhyp.datatypes.CorefCluster;
import edu.jhu.hlt.semhyp.datatypes.DependencyParse;
import edu.jhu.hlt.semhyp.datatypes.Document;
import edu.jhu.hlt.semhyp.datatypes.LabeledSpan;
import edu.jhu.hlt.semhyp.hyper.Hyperedges;
import edu.jhu.hlt.semhyp.hyper.Node;

/**
 * Reads annotated documents from whitespace separated columns, one token per
 * line:
 * <pre>
 * sent_i tok_i word space lemma pos tag dep head [extra columns...]
 * </pre>
 * space is "+" if the word is followed by whitespace. tok_i 0 starts a new
 * sentence; head is a sentence-relative token index, the root being its own
 * head. Extra columns are recognized by their content: named entities (BIO),
 * PropBank rolesets, SRL (BIO, one column per predicate), coreference (BIO
 * with MAIN&lt;n&gt;/REF&lt;n&gt; labels) and WordNet synsets. Lines which do
 * not start with a digit are ignored, except for "# hyperedge = ..." lines
 * which hold reference hyperedges (see {@link #readHyperedges(List)}).
 */
public class ColumnarReader {
  public static final Logger LOG = Logger.getLogger(ColumnarReader.class);

  public static final String HYPEREDGE_PREFIX = "# hyperedge = ";
  public static final int NUM_FIXED_COLUMNS = 9;

  public static enum ColumnType { NER, ROLESET, SRL, COREF, SYNSET }

  // in the order they are tried
  private static final Map<ColumnType, Pattern> COLUMN_PATTERNS = new LinkedHashMap<>();
  static {
    COLUMN_PATTERNS.put(ColumnType.NER, Pattern.compile("[BI]-(CARDINAL|DATE|EVENT|FAC|GPE|LANGUAGE|LAW"
        + "|LOC|MONEY|NORP|ORDINAL|ORG|PERCENT|PERSON|PRODUCT|QUANTITY|TIME|WORK_OF_ART)"));
    COLUMN_PATTERNS.put(ColumnType.ROLESET, Pattern.compile("\\w+\\.\\d\\d"));
    COLUMN_PATTERNS.put(ColumnType.SRL, Pattern.compile("[BI](-[RC])?-(ARG0|ARG1|ARG2|ARG3|ARG4|ARG5|ARG6"
        + "|ARGM-ADJ|ARGM-ADV|ARGM-CAU|ARGM-COM|ARGM-DIR|ARGM-DIS|ARGM-DSP|ARGM-EXT|ARGM-GOL|ARGM-LOC"
        + "|ARGM-MNR|ARGM-MOD|ARGM-PNC|ARGM-PRD|ARGM-PRP|ARGM-REC|ARGM-TMP|V)"));
    COLUMN_PATTERNS.put(ColumnType.COREF, Pattern.compile("[BI]-(MAIN|REF)\\d+"));
    COLUMN_PATTERNS.put(ColumnType.SYNSET, Pattern.compile("\\w+\\.\\w\\.\\d\\d"));
  }

  /** Token rows of one sentence. */
  private static class SentenceRows {
    final int start;            // document index of the first token
    final int firstLine;
    final List<String[]> extra = new ArrayList<>();
    SentenceRows(int start, int firstLine) {
      this.start = start;
      this.firstLine = firstLine;
    }
  }

  public static Document read(File f) throws IOException {
    LOG.info("[read] " + f.getPath());
    List<String> lines = Files.readAllLines(f.toPath(), StandardCharsets.UTF_8);
    return read(f.getName(), lines);
  }

  public static Document read(String id, List<String> lines) throws ColumnarFormatException {
    List<String> words = new ArrayList<>();
    List<Boolean> spaces = new ArrayList<>();
    List<String> lemmas = new ArrayList<>();
    List<String> pos = new ArrayList<>();
    List<String> tags = new ArrayList<>();
    List<String> deps = new ArrayList<>();
    List<Integer> heads = new ArrayList<>();
    List<Integer> headLines = new ArrayList<>();
    List<SentenceRows> sentences = new ArrayList<>();

    SentenceRows cur = null;
    for (int ln = 1; ln <= lines.size(); ln++) {
      String line = lines.get(ln - 1);
      if (line.isEmpty() || !Character.isDigit(line.charAt(0)))
        continue;
      String[] items = line.trim().split("\\s+");
      if (items.length < NUM_FIXED_COLUMNS)
        throw new ColumnarFormatException("expected at least " + NUM_FIXED_COLUMNS + " columns", ln);
      if ("0".equals(items[1])) {
        cur = new SentenceRows(words.size(), ln);
        sentences.add(cur);
      } else if (cur == null) {
        throw new ColumnarFormatException("the first token must have tok_i 0", ln);
      }

      words.add(items[2]);
      spaces.add("+".equals(items[3]));
      lemmas.add(items[4]);
      pos.add(items[5]);
      tags.add(items[6]);
      deps.add(items[7]);
      try {
        heads.add(cur.start + Integer.parseInt(items[8]));
      } catch (NumberFormatException e) {
        throw new ColumnarFormatException("head is not a number: " + items[8], ln);
      }
      headLines.add(ln);
      cur.extra.add(Arrays.copyOfRange(items, NUM_FIXED_COLUMNS, items.length));
    }

    int n = words.size();
    int[] h = new int[n];
    boolean[] sp = new boolean[n];
    for (int i = 0; i < n; i++) {
      int head = heads.get(i);
      if (head < 0 || head >= n)
        throw new ColumnarFormatException("head " + head + " is outside of the document", headLines.get(i));
      h[i] = head == i ? DependencyParse.ROOT : head;
      sp[i] = spaces.get(i);
    }
    int[] starts = new int[sentences.size()];
    for (int i = 0; i < starts.length; i++)
      starts[i] = sentences.get(i).start;

    Document doc = new Document(id,
        words.toArray(new String[n]), sp,
        lemmas.toArray(new String[n]),
        pos.toArray(new String[n]),
        tags.toArray(new String[n]),
        new DependencyParse(h, deps.toArray(new String[n])),
        starts);

    Map<Integer, LabeledSpan> mains = new LinkedHashMap<>();
    Map<Integer, List<LabeledSpan>> refs = new LinkedHashMap<>();
    for (SentenceRows s : sentences)
      readExtraColumns(doc, s, mains, refs);
    for (Map.Entry<Integer, LabeledSpan> m : mains.entrySet()) {
      List<LabeledSpan> r = refs.get(m.getKey());
      doc.addCorefCluster(new CorefCluster(m.getKey(), m.getValue(),
          r == null ? new ArrayList<LabeledSpan>() : r));
    }
    LOG.info("[read] " + doc);
    return doc;
  }

  private static void readExtraColumns(Document doc, SentenceRows s,
      Map<Integer, LabeledSpan> mains, Map<Integer, List<LabeledSpan>> refs) throws ColumnarFormatException {
    if (s.extra.isEmpty())
      return;
    int numColumns = s.extra.get(0).length;
    for (int r = 0; r < s.extra.size(); r++) {
      if (s.extra.get(r).length != numColumns) {
        throw new ColumnarFormatException("sentence has rows with " + numColumns + " and "
            + s.extra.get(r).length + " extra columns", s.firstLine + r);
      }
    }

    for (int col = 0; col < numColumns; col++) {
      List<String> column = new ArrayList<>(s.extra.size());
      for (String[] row : s.extra)
        column.add(row[col]);
      ColumnType t = columnType(column);
      if (t == null)
        continue;
      switch (t) {
      case NER:
        for (LabeledSpan e : toSpans(s.start, column))
          doc.addEntity(e);
        break;
      case SRL:
        addSrlFrame(doc, toSpans(s.start, column), s.firstLine);
        break;
      case COREF:
        for (LabeledSpan m : toSpans(s.start, column)) {
          String label = m.getLabel();
          if (label.startsWith("MAIN")) {
            mains.put(Integer.parseInt(label.substring(4)), m);
          } else if (label.startsWith("REF")) {
            int id = Integer.parseInt(label.substring(3));
            List<LabeledSpan> l = refs.get(id);
            if (l == null) {
              l = new ArrayList<>();
              refs.put(id, l);
            }
            l.add(m);
          }
        }
        break;
      case ROLESET:
        for (int i = 0; i < column.size(); i++)
          if (!"-".equals(column.get(i)))
            doc.setRoleset(s.start + i, column.get(i));
        break;
      case SYNSET:
        for (int i = 0; i < column.size(); i++)
          if (!"-".equals(column.get(i)))
            doc.setSynset(s.start + i, column.get(i));
        break;
      default:
        throw new RuntimeException("unknown column type: " + t);
      }
    }
  }

  private static void addSrlFrame(Document doc, List<LabeledSpan> args, int line) {
    int predicate = -1;
    for (LabeledSpan a : args)
      if ("V".equals(a.getLabel()))
        predicate = a.getStart();
    if (predicate < 0) {
      LOG.warn("[read] SRL column starting near line " + line + " has no predicate, skipping it");
      return;
    }
    doc.addSrl(predicate, args);
  }

  /**
   * The type of a column is decided by the last cell which looks like one of
   * the known types, null if no cell does.
   */
  static ColumnType columnType(List<String> column) {
    ColumnType type = null;
    for (String cell : column) {
      for (Map.Entry<ColumnType, Pattern> p : COLUMN_PATTERNS.entrySet()) {
        if (p.getValue().matcher(cell).matches()) {
          type = p.getKey();
          break;
        }
      }
    }
    return type;
  }

  /**
   * Spans of a BIO column: B- opens a span (closing any open one), O closes
   * it. Cells which are neither B- nor I- count as O.
   */
  static List<LabeledSpan> toSpans(int offset, List<String> column) {
    List<LabeledSpan> spans = new ArrayList<>();
    int start = -1;
    String label = null;
    for (int i = 0; i <= column.size(); i++) {
      String cell = i < column.size() ? column.get(i) : "O";
      boolean begin = cell.startsWith("B-");
      boolean inside = cell.startsWith("I-");
      if (inside)
        continue;
      if (start >= 0)
        spans.add(new LabeledSpan(offset + start, offset + i, label));
      if (begin) {
        start = i;
        label = cell.substring(2);
      } else {
        start = -1;
        label = null;
      }
    }
    return spans;
  }

  /** Parses every "# hyperedge = ..." line. */
  public static List<Node> readHyperedges(List<String> lines) {
    List<Node> edges = new ArrayList<>();
    for (String line : lines)
      if (line.startsWith(HYPEREDGE_PREFIX))
        edges.add(Hyperedges.parse(line.substring(HYPEREDGE_PREFIX.length()).trim()));
    return edges;
  }
}
