package edu.jhu.hlt.candgen;

import static edu.jhu.hlt.candgen.CorpusFixtures.*;
import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.Before;
import org.junit.Test;

import edu.jhu.hlt.candgen.datatypes.Candidate;
import edu.jhu.hlt.candgen.datatypes.Document;
import edu.jhu.hlt.candgen.datatypes.Mention;
import edu.jhu.hlt.candgen.datatypes.MentionType;
import edu.jhu.hlt.candgen.datatypes.RelationSchema;
import edu.jhu.hlt.candgen.inference.DocumentFailure;
import edu.jhu.hlt.candgen.inference.RelationFilterPolicy;
import edu.jhu.hlt.candgen.inference.RunReport;
import edu.jhu.hlt.candgen.matchers.DictionaryMatcher;
import edu.jhu.hlt.candgen.matchers.RegexMatcher;
import edu.jhu.hlt.candgen.spans.NgramSpanExtractor;
import edu.jhu.hlt.candgen.store.ExtractionStore;
import edu.jhu.hlt.candgen.store.StoreConfig;
import edu.jhu.hlt.candgen.throttle.Throttler;
import edu.jhu.hlt.candgen.throttle.Throttlers;

/**
 * Three documents: doc1 has 2 parts and 2 temperatures in two sentences, doc2
 * one of each, doc3 none.
 */
public class CandidateExtractorTest {

  static final MentionType PART = new MentionType("Part");
  static final MentionType TEMP = new MentionType("Temp");
  static final MentionType VOLT = new MentionType("Volt");
  static final RelationSchema PART_TEMP = RelationSchema.forMentionTypes("PartTemp", Arrays.asList(PART, TEMP));
  static final RelationSchema PART_VOLT = RelationSchema.forMentionTypes("PartVolt", Arrays.asList(PART, VOLT));

  private StoreConfig storeConfig;
  private List<Document> docs;

  static List<Document> loadCorpus(StoreConfig sc) {
    List<Document> docs = documents(3);
    try (ExtractionStore store = sc.open()) {
      addDocument(store, docs.get(0), "BC548 max 150 C at 12 V", "BC337 max 200 C");
      addDocument(store, docs.get(1), "BC547 rated 150 C");
      addDocument(store, docs.get(2), "nothing here");
      store.commit();
    }
    MentionExtractor me = new MentionExtractor(sc,
        Arrays.asList(PART, TEMP, VOLT),
        Arrays.asList(new NgramSpanExtractor(), new NgramSpanExtractor(), new NgramSpanExtractor(2)),
        Arrays.asList(new RegexMatcher("bc\\d+"),
            new DictionaryMatcher(Arrays.asList("150", "200"), true),
            new RegexMatcher("\\d+ V", false, true)));
    assertEquals(7, me.apply(docs, false, 2));
    return docs;
  }

  @Before
  public void setup() {
    storeConfig = freshStore();
    docs = loadCorpus(storeConfig);
  }

  private CandidateExtractor partTemp(Throttler t) {
    return new CandidateExtractor(storeConfig, Arrays.asList(PART_TEMP),
        Arrays.asList(Arrays.asList(PART, TEMP)),
        t == null ? null : Arrays.asList(t), RelationFilterPolicy.defaults());
  }

  private int count(RelationSchema schema, int split) {
    try (ExtractionStore store = storeConfig.open()) {
      return store.countCandidates(schema, split);
    }
  }

  /** Candidates by content: doc/part span/temp span. */
  static Set<String> describe(StoreConfig sc, RelationSchema schema, int split) {
    Set<String> out = new HashSet<>();
    try (ExtractionStore store = sc.open()) {
      Map<Long, Mention> byId = new HashMap<>();
      for (MentionType t : Arrays.asList(PART, TEMP, VOLT))
        for (Mention m : store.mentions(t))
          byId.put(m.getId(), m);
      for (Candidate c : store.candidates(schema, split)) {
        StringBuilder sb = new StringBuilder().append(c.getDocumentId());
        for (long a : c.getArgIds())
          sb.append('/').append(byId.get(a).getText()).append('@').append(byId.get(a).getSpan().shortString());
        out.add(sb.toString());
      }
    }
    return out;
  }

  @Test
  public void fullProductPerDocument() {
    assertEquals(5, partTemp(null).apply(docs, 0, false, 2));
    assertEquals(5, count(PART_TEMP, 0));
    assertTrue(describe(storeConfig, PART_TEMP, 0).contains("1/BC548@0-5/150@10-13"));
    assertTrue(describe(storeConfig, PART_TEMP, 0).contains("2/BC547@0-5/150@12-15"));
  }

  @Test
  public void throttled() {
    assertEquals(3, partTemp(Throttlers.sameSentence()).apply(docs, 0, false, 1));
    assertFalse(describe(storeConfig, PART_TEMP, 0).contains("1/BC548@0-5/200@34-37"));
  }

  @Test
  public void idempotent() {
    CandidateExtractor ce = partTemp(null);
    assertEquals(5, ce.apply(docs, 0, false, 3));
    assertEquals(0, ce.apply(docs, 0, false, 3));
    assertEquals(5, count(PART_TEMP, 0));
  }

  @Test
  public void incremental() {
    CandidateExtractor ce = partTemp(null);
    assertEquals(4, ce.apply(docs.subList(0, 1), 0, false, 1));
    assertEquals(1, ce.apply(docs, 0, false, 2));
    assertEquals(5, count(PART_TEMP, 0));
  }

  @Test
  public void clearReplacesOnlyThoseDocuments() {
    CandidateExtractor ce = partTemp(null);
    ce.apply(docs, 0, false, 1);
    ce.apply(docs, 1, false, 1);
    Set<String> before = describe(storeConfig, PART_TEMP, 0);
    assertEquals(4, ce.apply(docs.subList(0, 1), 0, true, 1));
    assertEquals(before, describe(storeConfig, PART_TEMP, 0));
    // other split untouched
    assertEquals(5, count(PART_TEMP, 1));

    ce.clear(0);
    assertEquals(0, count(PART_TEMP, 0));
    assertEquals(5, count(PART_TEMP, 1));
    try (ExtractionStore store = storeConfig.open()) {
      assertEquals(3, store.countMentions(PART));
    }
  }

  @Test
  public void clearThenApplyReproducesContent() {
    CandidateExtractor ce = partTemp(null);
    ce.apply(docs, 0, false, 2);
    Set<String> once = describe(storeConfig, PART_TEMP, 0);
    ce.clear(0);
    assertEquals(5, ce.apply(docs, 0, false, 2));
    assertEquals(once, describe(storeConfig, PART_TEMP, 0));
  }

  @Test
  public void clearAllTouchesEveryRelation() {
    CandidateExtractor pt = partTemp(null);
    CandidateExtractor pv = new CandidateExtractor(storeConfig, Arrays.asList(PART_VOLT),
        Arrays.asList(Arrays.asList(PART, VOLT)), null, RelationFilterPolicy.defaults());
    pt.apply(docs, 0, false, 1);
    assertEquals(2, pv.apply(docs, 0, false, 1));
    pt.clearAll(0);
    assertEquals(0, count(PART_TEMP, 0));
    assertEquals(0, count(PART_VOLT, 0));
  }

  @Test
  public void severalRelationsAtOnce() {
    CandidateExtractor ce = new CandidateExtractor(storeConfig, Arrays.asList(PART_TEMP, PART_VOLT),
        Arrays.asList(Arrays.asList(PART, TEMP), Arrays.asList(PART, VOLT)),
        Arrays.asList(Throttlers.sameSentence(), null), RelationFilterPolicy.defaults());
    assertEquals(3 + 2, ce.apply(docs, 0, false, 2));
    assertEquals(Arrays.asList(PART_TEMP, PART_VOLT), ce.getSchemas());
  }

  @Test
  public void parallelismInvariance() {
    partTemp(null).apply(docs, 0, false, 1);
    StoreConfig other = freshStore();
    loadCorpus(other);
    new CandidateExtractor(other, Arrays.asList(PART_TEMP), Arrays.asList(Arrays.asList(PART, TEMP)),
        null, RelationFilterPolicy.defaults()).apply(docs, 0, false, 3);
    assertEquals(describe(storeConfig, PART_TEMP, 0), describe(other, PART_TEMP, 0));
  }

  @Test
  public void mentionDeletionRemovesCandidates() {
    partTemp(null).apply(docs, 0, false, 1);
    MentionExtractor temps = new MentionExtractor(storeConfig, Arrays.asList(TEMP),
        Arrays.asList(new NgramSpanExtractor()),
        Arrays.asList(new DictionaryMatcher(Arrays.asList("150", "200"), true)));
    temps.clear();
    assertEquals(0, count(PART_TEMP, 0));
  }

  @Test
  public void failingDocumentIsReported() {
    Throttler fussy = args -> {
      if (args.get(0).getDocumentId() == 2)
        throw new IllegalStateException("malformed mention");
      return true;
    };
    RunReport r = partTemp(fussy).applyWithReport(docs, 0, false, 2);
    assertEquals(4, r.getRowsWritten());
    assertEquals(1, r.getFailures().size());
    DocumentFailure f = r.getFailures().get(0);
    assertEquals(2, f.getDocument().getId());
    assertEquals("PartTemp", f.getStage());
    assertEquals(4, count(PART_TEMP, 0));
  }

  @Test(expected = ConfigurationException.class)
  public void arityMismatch() {
    new CandidateExtractor(storeConfig, Arrays.asList(PART_TEMP),
        Arrays.asList(Arrays.asList(PART)), null, RelationFilterPolicy.defaults());
  }

  @Test(expected = ConfigurationException.class)
  public void argumentListsMismatch() {
    new CandidateExtractor(storeConfig, Arrays.asList(PART_TEMP, PART_VOLT),
        Arrays.asList(Arrays.asList(PART, TEMP)), null, RelationFilterPolicy.defaults());
  }

  @Test(expected = ConfigurationException.class)
  public void throttlerCountMismatch() {
    new CandidateExtractor(storeConfig, Arrays.asList(PART_TEMP),
        Arrays.asList(Arrays.asList(PART, TEMP)),
        Arrays.asList(Throttlers.ALWAYS, Throttlers.ALWAYS), RelationFilterPolicy.defaults());
  }

  @Test(expected = ConfigurationException.class)
  public void noRelations() {
    new CandidateExtractor(storeConfig, Collections.<RelationSchema>emptyList(),
        Collections.<List<MentionType>>emptyList(), null, RelationFilterPolicy.defaults());
  }

  @Test(expected = ConfigurationException.class)
  public void badParallelism() {
    partTemp(null).apply(docs, 0, false, 0);
  }
}
