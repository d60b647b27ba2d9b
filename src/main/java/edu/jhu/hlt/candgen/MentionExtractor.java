package edu.jhu.hlt.candgen;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

import org.apache.log4j.Logger;

import edu.jhu.hlt.candgen.datatypes.Document;
import edu.jhu.hlt.candgen.datatypes.Mention;
import edu.jhu.hlt.candgen.datatypes.MentionType;
import edu.jhu.hlt.candgen.inference.DocumentUdf;
import edu.jhu.hlt.candgen.inference.ExtractionStageException;
import edu.jhu.hlt.candgen.inference.MentionGenerator;
import edu.jhu.hlt.candgen.inference.ParallelRunner;
import edu.jhu.hlt.candgen.inference.RunReport;
import edu.jhu.hlt.candgen.matchers.Matcher;
import edu.jhu.hlt.candgen.spans.SpanExtractor;
import edu.jhu.hlt.candgen.store.ExtractionStore;
import edu.jhu.hlt.candgen.store.StoreConfig;

/**
 * Extracts mentions of one or more types from documents: the i-th type uses
 * the i-th span extractor and the i-th matcher.
 */
public class MentionExtractor {
  public static final Logger LOG = Logger.getLogger(MentionExtractor.class);

  private final StoreConfig storeConfig;
  private final List<MentionGenerator> generators;

  public MentionExtractor(StoreConfig storeConfig, List<MentionType> types,
      List<? extends SpanExtractor> spaces, List<? extends Matcher> matchers) {
    if (types == null || types.isEmpty())
      throw new ConfigurationException("no mention types to extract");
    if (spaces == null || spaces.size() != types.size()) {
      throw new ConfigurationException(types.size() + " mention types but "
          + (spaces == null ? 0 : spaces.size()) + " span extractors");
    }
    if (matchers == null || matchers.size() != types.size()) {
      throw new ConfigurationException(types.size() + " mention types but "
          + (matchers == null ? 0 : matchers.size()) + " matchers");
    }
    Set<MentionType> seen = new HashSet<>();
    List<MentionGenerator> gens = new ArrayList<>();
    for (int i = 0; i < types.size(); i++) {
      if (!seen.add(types.get(i)))
        throw new ConfigurationException("mention type " + types.get(i) + " given twice");
      if (spaces.get(i) == null || matchers.get(i) == null)
        throw new ConfigurationException("mention type " + types.get(i) + " needs a span extractor and a matcher");
      gens.add(new MentionGenerator(types.get(i), spaces.get(i), matchers.get(i)));
    }
    this.storeConfig = storeConfig;
    this.generators = Collections.unmodifiableList(gens);

    try (ExtractionStore store = storeConfig.open()) {
      store.createBaseTables();
      store.commit();
    }
  }

  public List<MentionType> getTypes() {
    List<MentionType> types = new ArrayList<>();
    for (MentionGenerator g : generators)
      types.add(g.getType());
    return types;
  }

  /**
   * @param clear if true, each document's existing mentions of these types are
   * deleted (along with candidates built on them) before re-extracting, in the
   * same transaction.
   * @return the number of mentions added.
   */
  public int apply(List<Document> docs, boolean clear, int parallelism) {
    return applyWithReport(docs, clear, parallelism).getRowsWritten();
  }

  public RunReport applyWithReport(List<Document> docs, boolean clear, int parallelism) {
    return new ParallelRunner(storeConfig).run(docs, new MentionUdf(generators, clear), parallelism);
  }

  /** Deletes all mentions of these types, and the candidates that use them. */
  public void clear() {
    try (ExtractionStore store = storeConfig.open()) {
      for (MentionGenerator g : generators) {
        int n = store.deleteMentions(g.getType(), null);
        LOG.info("[clear] deleted " + n + " " + g.getType() + " mentions");
      }
      store.commit();
    }
  }

  static class MentionUdf implements DocumentUdf {
    private final List<MentionGenerator> generators;
    private final boolean clear;

    MentionUdf(List<MentionGenerator> generators, boolean clear) {
      this.generators = generators;
      this.clear = clear;
    }

    @Override
    public String getName() {
      return "mentions" + (clear ? " clear" : "");
    }

    @Override
    public int apply(Document doc, ExtractionStore store) {
      int added = 0;
      for (MentionGenerator g : generators) {
        try {
          if (clear)
            store.deleteMentions(g.getType(), doc.getId());
          Iterator<Mention> itr = g.generate(doc, clear, store);
          while (itr.hasNext()) {
            if (store.insertMention(itr.next()) >= 0)
              added++;
          }
        } catch (RuntimeException e) {
          throw new ExtractionStageException(g.getType().getName(), e);
        }
      }
      return added;
    }
  }
}
