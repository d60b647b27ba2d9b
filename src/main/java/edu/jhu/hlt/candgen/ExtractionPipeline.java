package edu.jhu.hlt.candgen;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.log4j.Logger;

import edu.jhu.hlt.candgen.datatypes.Document;
import edu.jhu.hlt.candgen.datatypes.MentionType;
import edu.jhu.hlt.candgen.datatypes.RelationSchema;
import edu.jhu.hlt.candgen.datatypes.Sentence;
import edu.jhu.hlt.candgen.inference.RelationFilterPolicy;
import edu.jhu.hlt.candgen.inference.RunReport;
import edu.jhu.hlt.candgen.matchers.DictionaryMatcher;
import edu.jhu.hlt.candgen.matchers.Matcher;
import edu.jhu.hlt.candgen.matchers.RegexMatcher;
import edu.jhu.hlt.candgen.spans.NgramSpanExtractor;
import edu.jhu.hlt.candgen.spans.SpanExtractor;
import edu.jhu.hlt.candgen.store.ExtractionStore;
import edu.jhu.hlt.candgen.store.StoreConfig;
import edu.jhu.hlt.candgen.throttle.Throttler;
import edu.jhu.hlt.candgen.throttle.Throttlers;
import edu.jhu.hlt.candgen.util.ExperimentProperties;

/**
 * Runs ingestion, mention extraction and candidate extraction from the command
 * line, e.g.
 *
 * <pre>
 *   java edu.jhu.hlt.candgen.ExtractionPipeline \
 *     corpus docs.txt \
 *     mention.types part,temp \
 *     mention.part.regex '[A-Z]{2}\d+.*' \
 *     mention.temp.dictionary '150,200,-65' \
 *     relations PartTemp \
 *     relation.PartTemp part,temp \
 *     parallelism 4
 * </pre>
 *
 * The corpus file holds documents separated by blank lines. The first line of
 * a block is the document name and every following line is a sentence.
 */
public class ExtractionPipeline {
  public static final Logger LOG = Logger.getLogger(ExtractionPipeline.class);

  private final ExperimentProperties config;
  private final StoreConfig storeConfig;

  public ExtractionPipeline(ExperimentProperties config) {
    this.config = config;
    this.storeConfig = StoreConfig.fromConfig(config);
  }

  public StoreConfig getStoreConfig() {
    return storeConfig;
  }

  /** Stores documents that aren't in the store yet, returns all of them. */
  public List<Document> ingest(List<Document> docs, Map<Document, List<String>> sentences) {
    try (ExtractionStore store = storeConfig.open()) {
      store.createBaseTables();
      Set<Document> present = new HashSet<>(store.documents());
      int added = 0;
      for (Document d : docs) {
        if (present.contains(d))
          continue;
        List<Sentence> ss = new ArrayList<>();
        int offset = 0;
        List<String> lines = sentences.get(d);
        for (int i = 0; i < lines.size(); i++) {
          ss.add(Sentence.whitespaceTokenized(d.getId(), i, lines.get(i), offset));
          offset += lines.get(i).length() + 1;
        }
        store.insertDocument(d, ss);
        added++;
      }
      store.commit();
      LOG.info("[ingest] added " + added + " of " + docs.size() + " documents");
    }
    return docs;
  }

  public MentionExtractor buildMentionExtractor(Map<String, MentionType> types) {
    List<MentionType> ts = new ArrayList<>();
    List<SpanExtractor> spans = new ArrayList<>();
    List<Matcher> matchers = new ArrayList<>();
    for (MentionType t : types.values()) {
      String prefix = "mention." + t.getName() + ".";
      boolean ignoreCase = config.getBoolean(prefix + "ignoreCase", true);
      String regex = config.getProperty(prefix + "regex");
      String dict = config.getProperty(prefix + "dictionary");
      Matcher m;
      if (regex != null && dict == null) {
        m = new RegexMatcher(regex, ignoreCase, true);
      } else if (dict != null && regex == null) {
        m = new DictionaryMatcher(config.getList(prefix + "dictionary"), ignoreCase);
      } else {
        throw new ConfigurationException("mention type " + t
            + " needs exactly one of " + prefix + "regex and " + prefix + "dictionary");
      }
      ts.add(t);
      spans.add(new NgramSpanExtractor(config.getInt(prefix + "nmax", NgramSpanExtractor.DEFAULT_N_MAX)));
      matchers.add(m);
    }
    return new MentionExtractor(storeConfig, ts, spans, matchers);
  }

  public CandidateExtractor buildCandidateExtractor(Map<String, MentionType> types) {
    List<RelationSchema> schemas = new ArrayList<>();
    List<List<MentionType>> argTypes = new ArrayList<>();
    List<Throttler> throttlers = new ArrayList<>();
    for (String r : config.getList("relations")) {
      List<MentionType> args = new ArrayList<>();
      for (String t : config.getList("relation." + r)) {
        MentionType mt = types.get(t);
        if (mt == null)
          throw new ConfigurationException("relation " + r + " uses unknown mention type " + t);
        args.add(mt);
      }
      schemas.add(RelationSchema.forMentionTypes(r, args));
      argTypes.add(args);
      throttlers.add(config.getBoolean("relation." + r + ".sameSentence", false)
          ? Throttlers.sameSentence() : null);
    }
    return new CandidateExtractor(storeConfig, schemas, argTypes, throttlers,
        RelationFilterPolicy.fromConfig(config));
  }

  public Map<String, MentionType> mentionTypes() {
    Map<String, MentionType> types = new LinkedHashMap<>();
    for (String t : config.getList("mention.types"))
      types.put(t, new MentionType(t));
    return types;
  }

  /**
   * Builds both extractors first, so a bad configuration fails before anything
   * is written, then ingests and extracts.
   */
  public RunReport run(List<Document> docs, Map<Document, List<String>> sentences) {
    int parallelism = config.getInt("parallelism", 1);
    int split = config.getInt("split", 0);
    boolean clear = config.getBoolean("clear", false);
    Map<String, MentionType> types = mentionTypes();
    MentionExtractor me = buildMentionExtractor(types);
    CandidateExtractor ce = buildCandidateExtractor(types);

    ingest(docs, sentences);
    RunReport mentions = me.applyWithReport(docs, clear, parallelism);
    LOG.info("[run] " + mentions);
    RunReport candidates = ce.applyWithReport(docs, split, clear, parallelism);
    LOG.info("[run] " + candidates);

    String report = config.getProperty("report.file");
    if (report != null) {
      writeReport(new File(report), mentions, candidates);
    }
    return candidates;
  }

  private static void writeReport(File f, RunReport... reports) {
    try (Writer w = Files.newBufferedWriter(f.toPath(), StandardCharsets.UTF_8)) {
      RunReport.writeFailuresCsv(w, Arrays.asList(reports));
      LOG.info("[run] wrote failures to " + f.getPath());
    } catch (IOException e) {
      throw new UncheckedIOException("could not write " + f.getPath(), e);
    }
  }

  /**
   * Reads the blank-line separated corpus format. Documents are numbered from
   * 1 in file order.
   */
  public static List<Document> readCorpus(File f, Map<Document, List<String>> sentences) {
    List<Document> docs = new ArrayList<>();
    try (BufferedReader r = Files.newBufferedReader(f.toPath(), StandardCharsets.UTF_8)) {
      Document cur = null;
      for (String line = r.readLine(); line != null; line = r.readLine()) {
        if (line.trim().isEmpty()) {
          cur = null;
        } else if (cur == null) {
          cur = new Document(docs.size() + 1, line.trim());
          docs.add(cur);
          sentences.put(cur, new ArrayList<>());
        } else {
          sentences.get(cur).add(line);
        }
      }
    } catch (IOException e) {
      throw new ConfigurationException("could not read corpus " + f.getPath(), e);
    }
    return docs;
  }

  public static void main(String[] args) {
    ExperimentProperties config = ExperimentProperties.init(args);
    Map<Document, List<String>> sentences = new HashMap<>();
    List<Document> docs = readCorpus(config.getFile("corpus"), sentences);
    ExtractionPipeline p = new ExtractionPipeline(config);
    RunReport r = p.run(docs, sentences);
    LOG.info("[main] config " + config);
    if (!r.isComplete())
      System.exit(1);
  }
}
