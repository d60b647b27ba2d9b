package edu.jhu.hlt.candgen;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

import org.apache.log4j.Logger;

import edu.jhu.hlt.candgen.datatypes.Candidate;
import edu.jhu.hlt.candgen.datatypes.Document;
import edu.jhu.hlt.candgen.datatypes.MentionType;
import edu.jhu.hlt.candgen.datatypes.RelationSchema;
import edu.jhu.hlt.candgen.inference.CandidateGenerator;
import edu.jhu.hlt.candgen.inference.DocumentUdf;
import edu.jhu.hlt.candgen.inference.ExtractionStageException;
import edu.jhu.hlt.candgen.inference.ParallelRunner;
import edu.jhu.hlt.candgen.inference.RelationFilterPolicy;
import edu.jhu.hlt.candgen.inference.RunReport;
import edu.jhu.hlt.candgen.store.ExtractionStore;
import edu.jhu.hlt.candgen.store.StoreConfig;
import edu.jhu.hlt.candgen.throttle.Throttler;

/**
 * Extracts candidates of one or more relations from documents whose mentions
 * have already been extracted.
 *
 * <pre>
 *   CandidateExtractor ce = new CandidateExtractor(store,
 *       Arrays.asList(partTemp, partVolt),
 *       Arrays.asList(Arrays.asList(part, temp), Arrays.asList(part, volt)),
 *       Arrays.asList(tempThrottler, null),
 *       RelationFilterPolicy.defaults());
 *   int n = ce.apply(docs, 0, false, 4);
 * </pre>
 *
 * All configuration is checked in the constructor, which also makes sure the
 * store has a table for every relation.
 */
public class CandidateExtractor {
  public static final Logger LOG = Logger.getLogger(CandidateExtractor.class);

  private final StoreConfig storeConfig;
  private final List<CandidateGenerator> generators;
  private final RelationFilterPolicy policy;

  /**
   * @param schemas the relations to extract.
   * @param argTypes for each relation, the mention type of each of its roles.
   * @param throttlers null or empty for no throttling, otherwise one
   * (possibly null) throttler per relation.
   */
  public CandidateExtractor(StoreConfig storeConfig, List<RelationSchema> schemas,
      List<List<MentionType>> argTypes, List<Throttler> throttlers, RelationFilterPolicy policy) {
    if (schemas == null || schemas.isEmpty())
      throw new ConfigurationException("no relations to extract");
    if (argTypes == null || argTypes.size() != schemas.size()) {
      throw new ConfigurationException(schemas.size() + " relations but "
          + (argTypes == null ? 0 : argTypes.size()) + " lists of argument types");
    }
    boolean throttled = throttlers != null && !throttlers.isEmpty();
    if (throttled && throttlers.size() != schemas.size()) {
      throw new ConfigurationException(schemas.size() + " relations but "
          + throttlers.size() + " throttlers");
    }
    if (policy == null)
      throw new ConfigurationException("no relation filter policy");

    Set<String> names = new HashSet<>();
    List<CandidateGenerator> gens = new ArrayList<>();
    for (int i = 0; i < schemas.size(); i++) {
      RelationSchema schema = schemas.get(i);
      if (!names.add(schema.getName().toLowerCase()))
        throw new ConfigurationException("relation " + schema.getName() + " given twice");
      Throttler t = throttled ? throttlers.get(i) : null;
      gens.add(new CandidateGenerator(schema, argTypes.get(i), t, policy));
    }
    this.storeConfig = storeConfig;
    this.generators = Collections.unmodifiableList(gens);
    this.policy = policy;

    try (ExtractionStore store = storeConfig.open()) {
      store.createBaseTables();
      for (RelationSchema schema : schemas)
        store.registerRelation(schema);
      store.commit();
    }
    if (LOG.isDebugEnabled()) {
      for (CandidateGenerator g : generators)
        LOG.debug("[init] " + g);
    }
  }

  public List<RelationSchema> getSchemas() {
    List<RelationSchema> schemas = new ArrayList<>();
    for (CandidateGenerator g : generators)
      schemas.add(g.getSchema());
    return schemas;
  }

  public RelationFilterPolicy getPolicy() {
    return policy;
  }

  /**
   * Extracts candidates from docs into split.
   *
   * @param clear if true, each document's existing candidates (of these
   * relations, in this split) are deleted in the same transaction that
   * re-creates them; otherwise existing candidates are kept and only missing
   * ones are added.
   * @return the number of candidates added.
   */
  public int apply(List<Document> docs, int split, boolean clear, int parallelism) {
    return applyWithReport(docs, split, clear, parallelism).getRowsWritten();
  }

  public RunReport applyWithReport(List<Document> docs, int split, boolean clear, int parallelism) {
    ParallelRunner runner = new ParallelRunner(storeConfig);
    return runner.run(docs, new CandidateUdf(generators, split, clear), parallelism);
  }

  /** Deletes all candidates of these relations in split. */
  public void clear(int split) {
    try (ExtractionStore store = storeConfig.open()) {
      for (CandidateGenerator g : generators) {
        int n = store.deleteCandidates(g.getSchema(), split, null);
        LOG.info("[clear] deleted " + n + " " + g.getSchema().getName() + " candidates (split " + split + ")");
      }
      store.commit();
    }
  }

  /** Deletes the candidates of every relation known to the store in split. */
  public void clearAll(int split) {
    LOG.info("[clearAll] clearing ALL candidates (split " + split + ")");
    try (ExtractionStore store = storeConfig.open()) {
      for (RelationSchema schema : store.registeredRelations())
        store.deleteCandidates(schema, split, null);
      store.commit();
    }
  }

  static class CandidateUdf implements DocumentUdf {
    private final List<CandidateGenerator> generators;
    private final int split;
    private final boolean clear;

    CandidateUdf(List<CandidateGenerator> generators, int split, boolean clear) {
      this.generators = generators;
      this.split = split;
      this.clear = clear;
    }

    @Override
    public String getName() {
      return "candidates split=" + split + (clear ? " clear" : "");
    }

    @Override
    public int apply(Document doc, ExtractionStore store) {
      int added = 0;
      for (CandidateGenerator g : generators) {
        RelationSchema schema = g.getSchema();
        try {
          if (clear)
            store.deleteCandidates(schema, split, doc.getId());
          Iterator<Candidate> itr = g.generate(doc, split, clear, store);
          while (itr.hasNext()) {
            if (store.insertCandidate(schema, itr.next()) >= 0)
              added++;
          }
        } catch (RuntimeException e) {
          throw new ExtractionStageException(schema.getName(), e);
        }
      }
      return added;
    }
  }
}
