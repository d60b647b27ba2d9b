package edu.jhu.hlt.candgen;

import static edu.jhu.hlt.candgen.CorpusFixtures.*;
import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.List;

import org.junit.Before;
import org.junit.Test;

import edu.jhu.hlt.candgen.datatypes.Document;
import edu.jhu.hlt.candgen.datatypes.Mention;
import edu.jhu.hlt.candgen.datatypes.MentionType;
import edu.jhu.hlt.candgen.matchers.Matcher;
import edu.jhu.hlt.candgen.matchers.RegexMatcher;
import edu.jhu.hlt.candgen.spans.NgramSpanExtractor;
import edu.jhu.hlt.candgen.store.ExtractionStore;
import edu.jhu.hlt.candgen.store.StoreConfig;

public class MentionExtractorTest {

  private static final MentionType PART = new MentionType("Part");
  private static final MentionType NUM = new MentionType("Num");

  private StoreConfig storeConfig;
  private List<Document> docs;
  private MentionExtractor extractor;

  @Before
  public void setup() {
    storeConfig = freshStore();
    docs = documents(4);
    try (ExtractionStore store = storeConfig.open()) {
      for (Document d : docs)
        addDocument(store, d, "BC54" + d.getId() + " at 150 C", "and 200 C");
      store.commit();
    }
    extractor = new MentionExtractor(storeConfig, Arrays.asList(PART, NUM),
        Arrays.asList(new NgramSpanExtractor(), new NgramSpanExtractor(1)),
        Arrays.asList(new RegexMatcher("bc\\d+"), new RegexMatcher("\\d+")));
  }

  private int count(MentionType t) {
    try (ExtractionStore store = storeConfig.open()) {
      return store.countMentions(t);
    }
  }

  @Test
  public void extractsAndDeduplicates() {
    assertEquals(4 * 3, extractor.apply(docs, false, 2));
    assertEquals(4, count(PART));
    assertEquals(8, count(NUM));
    assertEquals(0, extractor.apply(docs, false, 4));
    assertEquals(Arrays.asList(PART, NUM), extractor.getTypes());
    try (ExtractionStore store = storeConfig.open()) {
      Mention m = store.mentions(1, PART).get(0);
      assertEquals("BC541", m.getText());
      assertTrue(m.isPersisted());
    }
  }

  @Test
  public void clearPerDocumentAndGlobally() {
    extractor.apply(docs, false, 1);
    assertEquals(3, extractor.apply(docs.subList(1, 2), true, 1));
    assertEquals(4, count(PART));
    extractor.clear();
    assertEquals(0, count(PART));
    assertEquals(0, count(NUM));
  }

  @Test(expected = ConfigurationException.class)
  public void lengthMismatch() {
    new MentionExtractor(storeConfig, Arrays.asList(PART, NUM),
        Arrays.asList(new NgramSpanExtractor()),
        Arrays.<Matcher>asList(new RegexMatcher("x"), new RegexMatcher("y")));
  }

  @Test(expected = ConfigurationException.class)
  public void duplicateType() {
    new MentionExtractor(storeConfig, Arrays.asList(PART, new MentionType("Part")),
        Arrays.asList(new NgramSpanExtractor(), new NgramSpanExtractor()),
        Arrays.<Matcher>asList(new RegexMatcher("x"), new RegexMatcher("y")));
  }
}
