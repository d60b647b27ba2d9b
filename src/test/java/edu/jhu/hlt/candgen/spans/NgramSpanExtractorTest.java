package edu.jhu.hlt.candgen.spans;

import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;

import edu.jhu.hlt.candgen.datatypes.Sentence;
import edu.jhu.hlt.candgen.datatypes.Span;

public class NgramSpanExtractorTest {

  private static List<String> texts(SpanExtractor e, String sentence) {
    List<String> t = new ArrayList<>();
    for (TemporarySpan ts : e.computeSpans(Sentence.whitespaceTokenized(1, 0, sentence, 0)))
      t.add(ts.getText());
    return t;
  }

  @Test
  public void splitsOnHyphen() {
    NgramSpanExtractor e = new NgramSpanExtractor();
    assertEquals(Arrays.asList("New-Text", "New", "Text"), texts(e, "New-Text"));
    assertEquals(Arrays.asList("New-", "New"), texts(e, "New-"));
    assertEquals(Arrays.asList("-Text", "Text"), texts(e, "-Text"));
    assertEquals(Arrays.asList("-"), texts(e, "-"));
  }

  @Test
  public void splitsOnFirstTokenOnly() {
    NgramSpanExtractor e = new NgramSpanExtractor();
    assertEquals(Arrays.asList("New/Text-Word", "New", "Text-Word"), texts(e, "New/Text-Word"));
  }

  @Test
  public void noSplitTokens() {
    NgramSpanExtractor e = new NgramSpanExtractor(3, Collections.<String>emptyList());
    assertEquals(Arrays.asList("New-Text"), texts(e, "New-Text"));
  }

  @Test
  public void longestFirst() {
    NgramSpanExtractor e = new NgramSpanExtractor(2);
    assertEquals(Arrays.asList("BC548BG at", "at 150", "150 C", "BC548BG", "at", "150", "C"),
        texts(e, "BC548BG at 150 C"));
  }

  @Test
  public void nMaxLongerThanSentence() {
    NgramSpanExtractor e = new NgramSpanExtractor(5);
    assertEquals(Arrays.asList("a b", "a", "b"), texts(e, "a b"));
    assertTrue(texts(e, "").isEmpty());
  }

  @Test
  public void absoluteOffsets() {
    // second sentence of a document, starting at character 20
    Sentence s = Sentence.whitespaceTokenized(1, 1, "BC548 at 150", 20);
    List<TemporarySpan> spans = new NgramSpanExtractor(1).computeSpans(s);
    assertEquals(3, spans.size());
    assertEquals(Span.getSpan(20, 25), spans.get(0).getCharSpan());
    assertEquals(Span.getSpan(26, 28), spans.get(1).getCharSpan());
    assertEquals(Span.getSpan(29, 32), spans.get(2).getCharSpan());
    assertEquals("150", spans.get(2).getText());
  }

  @Test(expected = IllegalArgumentException.class)
  public void badNMax() {
    new NgramSpanExtractor(0);
  }
}
