package edu.jhu.hlt.semhyp.inference;

import static org.junit.Assert.*;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import edu.jhu.hlt.semhyp.data.ColumnarReader;
import edu.jhu.hlt.semhyp.data.ColumnarReaderTest;
import edu.jhu.hlt.semhyp.datatypes.Document;
import edu.jhu.hlt.semhyp.hyper.Atom;
import edu.jhu.hlt.semhyp.hyper.Node;
import edu.jhu.hlt.semhyp.util.Diagnostic;

public class HyperedgeParserTest {

  @Rule
  public TemporaryFolder tmp = new TemporaryFolder();

  @Before
  public void setup() {
    TestingUtil.silenceLogs();
    Logger.getLogger(ColumnarReader.class).setLevel(Level.ERROR);
  }

  @Test
  public void readAndParse() throws Exception {
    Document d = ColumnarReader.read(ColumnarReaderTest.fixture());
    DocumentParse p = new HyperedgeParser().parse(d);
    List<String> lines = Files.readAllLines(ColumnarReaderTest.fixture().toPath(), StandardCharsets.UTF_8);
    List<Node> expected = ColumnarReader.readHyperedges(lines);
    assertEquals(expected.size(), p.getEdges().size());
    for (int i = 0; i < expected.size(); i++)
      assertEquals(expected.get(i).toString(), p.getEdge(i).toString());
    assertTrue(p.getDiagnostics().isEmpty());
  }

  @Test
  public void synsetLabels() throws Exception {
    Document d = ColumnarReader.read(ColumnarReaderTest.fixture());
    HyperedgeParser parser = new HyperedgeParser(new ParserOptions(true, true));
    Node e = parser.parse(d).getEdge(0);
    boolean sawSynset = false;
    for (Atom a : e.atoms()) {
      assertNotEquals("won", a.getLabel());
      sawSynset |= "win.v.01".equals(a.getLabel());
    }
    assertTrue(sawSynset);
    // lemmas where there is no synset
    assertTrue(e.toString().startsWith("(say/Pd"));
  }

  @Test
  public void optionsFromConfig() {
    Map<String, String> config = new HashMap<>();
    assertFalse(ParserOptions.fromConfig(config).withLemma());
    config.put(ParserOptions.WITH_LEMMA, "true");
    ParserOptions opts = ParserOptions.fromConfig(config);
    assertTrue(opts.withLemma());
    assertFalse(opts.withSynset());
  }

  @Test
  public void configFileUnderCommandLine() throws Exception {
    File f = tmp.newFile("semhyp.config");
    Files.write(f.toPath(), Arrays.asList(
        "withLemma\ttrue",
        "withSynset\ttrue"), StandardCharsets.UTF_8);
    Map<String, String> config = new HashMap<>();
    String file = HyperedgeParser.readArguments(new String[] {
        "doc.conll", HyperedgeParser.CONFIG_FILE, f.getPath(), ParserOptions.WITH_SYNSET, "false"}, config);
    assertEquals("doc.conll", file);
    assertFalse(config.containsKey(HyperedgeParser.CONFIG_FILE));
    ParserOptions opts = ParserOptions.fromConfig(config);
    assertTrue(opts.withLemma());
    assertFalse(opts.withSynset());
  }

  @Test
  public void failedSentenceDoesNotStopTheOthers() {
    Document d = new TestingUtil.DocBuilder("oneBad")
        .tok("!", "PUNCT", ".", "punct", -1)
        .newSentence()
        .tok("John", "PROPN", "NNP", "nsubj", 2)
        .tok("runs", "run", "VERB", "VBZ", "ROOT", -1)
        .build();
    DocumentParse p = new HyperedgeParser().parse(d);
    assertNull(p.getEdge(0));
    assertTrue(p.getSentenceParses().get(0).failed());
    assertEquals("(runs/P.s.|f--3s john/Cp..s)", p.getEdge(1).toString());
    List<Diagnostic> diags = p.getDiagnostics();
    assertEquals(1, diags.size());
    assertEquals(Diagnostic.Kind.SENTENCE_FAILED, diags.get(0).getKind());
    assertEquals(0, diags.get(0).getToken());
  }

  @Test
  public void sentenceMode() {
    SentenceParse p = new HyperedgeParser().parse(TestingUtil.johnRuns().getSentence(0));
    assertFalse(p.failed());
    assertEquals("(runs/P.s.|f--3s john/Cp..s)", p.getEdge().toString());
    assertEquals(2, p.getAtoms().size());
  }

  @Test
  public void longDocument() {
    int n = 3400;
    TestingUtil.DocBuilder b = new TestingUtil.DocBuilder("long");
    for (int i = 0; i < n; i++) {
      if (i > 0)
        b.newSentence();
      int start = 3 * i;
      b.tok("John", "PROPN", "NNP", "nsubj", start + 1)
          .tok("arrived", "arrive", "VERB", "VBD", "ROOT", -1)
          .tok(".", "PUNCT", ".", "punct", start + 1);
    }
    Document d = b.build();
    assertEquals(3 * n, d.size());
    DocumentParse p = new HyperedgeParser().parse(d);
    assertEquals(n, p.getEdges().size());
    assertEquals("(arrived/Pd.s.<f john/Cp..s)", p.getEdge(0).toString());
    assertEquals("(arrived/Pd.s.<f john/Cp..s)", p.getEdge(n - 1).toString());
    assertTrue(p.getDiagnostics().isEmpty());
  }
}
