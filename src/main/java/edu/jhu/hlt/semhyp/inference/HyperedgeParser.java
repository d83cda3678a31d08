package edu.jhu.hlt.semhyp.inference;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;

import edu.jhu.hlt.semhyp.data.ColumnarReader;
import edu.jhu.hlt.semhyp.datatypes.Document;
import edu.jhu.hlt.semhyp.datatypes.Sentence;
import edu.jhu.hlt.semhyp.hyper.EdgeLinearizer;
import edu.jhu.hlt.semhyp.hyper.Node;
import edu.jhu.hlt.semhyp.util.Config;
import edu.jhu.hlt.semhyp.util.Diagnostic;

/**
 * Turns dependency parsed (and optionally SRL, NER and coreference annotated)
 * documents into one hyperedge per sentence.
 */
public class HyperedgeParser {
  public static final Logger LOG = Logger.getLogger(HyperedgeParser.class);
  public static final String CONFIG_FILE = "config";

  private final HyperedgeTransducer transducer;

  public HyperedgeParser(ParserOptions options) {
    this.transducer = new HyperedgeTransducer(options);
  }

  public HyperedgeParser() {
    this(ParserOptions.defaults());
  }

  public ParserOptions getOptions() {
    return transducer.getOptions();
  }

  /**
   * Parses every sentence, then substitutes coreferent mentions across the
   * whole document. A sentence which cannot be parsed does not stop the
   * others.
   */
  public DocumentParse parse(Document doc) {
    List<SentenceParse> parses = new ArrayList<>();
    for (Sentence s : doc.getSentences())
      parses.add(parseIsolated(s));
    List<Diagnostic> corefDiagnostics = new ArrayList<>();
    List<Node> edges = CorefSubstitution.apply(parses, doc.getCorefClusters(), corefDiagnostics);
    return new DocumentParse(doc, parses, edges, corefDiagnostics);
  }

  /**
   * Parses one sentence on its own. Only coreference clusters lying entirely
   * inside the sentence are used.
   */
  public SentenceParse parse(Sentence s) {
    SentenceParse p = parseIsolated(s);
    if (p.failed())
      return p;
    List<Diagnostic> corefDiagnostics = new ArrayList<>();
    List<Node> edges = CorefSubstitution.apply(
        Collections.singletonList(p), s.getCorefClusters(), corefDiagnostics);
    return p.withEdge(edges.get(0), corefDiagnostics);
  }

  private SentenceParse parseIsolated(Sentence s) {
    try {
      return transducer.transduce(s);
    } catch (RuntimeException e) {
      LOG.warn("[parse] failed on " + s, e);
      return SentenceParse.failed(s, new Diagnostic(
          Diagnostic.Kind.SENTENCE_FAILED, s.start(), e.toString()));
    }
  }

  /**
   * Reads command line arguments of the form columnarFile (key value)*. If a
   * "config" key names a tab separated config file, its entries are added
   * under the command line ones.
   * @return the columnar file name
   */
  public static String readArguments(String[] args, Map<String, String> config) {
    String file = Config.parseIntoMap(args, config, true);
    String configFile = config.remove(CONFIG_FILE);
    if (configFile != null) {
      for (Map.Entry<String, String> kv : Config.readConfig(new File(configFile), false).entrySet()) {
        if (!config.containsKey(kv.getKey()))
          config.put(kv.getKey(), kv.getValue());
      }
    }
    return file;
  }

  /**
   * Usage: HyperedgeParser columnarFile [withLemma true|false] [withSynset true|false] [config file]
   * Options can also be given as -DsemhypProperties="withLemma=true".
   */
  public static void main(String[] args) throws IOException {
    if (args.length == 0) {
      System.err.println("usage: " + HyperedgeParser.class.getName()
          + " columnarFile [" + ParserOptions.WITH_LEMMA + " true|false]"
          + " [" + ParserOptions.WITH_SYNSET + " true|false]"
          + " [" + CONFIG_FILE + " file]");
      System.exit(1);
    }
    Map<String, String> config = new HashMap<>();
    String file = readArguments(args, config);
    ParserOptions opts = ParserOptions.fromConfig(config);
    LOG.info("[main] reading " + file + " with " + opts);

    Document doc = ColumnarReader.read(new File(file));
    DocumentParse parse = new HyperedgeParser(opts).parse(doc);
    for (int i = 0; i < parse.getEdges().size(); i++) {
      Sentence s = doc.getSentence(i);
      Node e = parse.getEdge(i);
      System.out.println("# text = " + s.getText());
      if (e == null) {
        System.out.println("# failed");
      } else {
        System.out.println(e);
        System.out.println("# linearized = " + EdgeLinearizer.linearize(e).getText());
      }
      System.out.println();
    }
    LOG.info("[main] done, " + parse.getDiagnostics().size() + " diagnostics");
  }
}
