package edu.jhu.hlt.candgen.spans;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.google.common.base.Joiner;
import com.google.common.collect.Lists;

import edu.jhu.hlt.candgen.datatypes.Sentence;
import edu.jhu.hlt.candgen.datatypes.Span;

/**
 * All n-grams of a sentence with 1 <= n <= nMax, longest first, left to right.
 *
 * A single word containing one of the split tokens (by default "-" and "/")
 * also yields the pieces on either side of the first split token, right
 * after the word itself: "New-Text" gives "New-Text", "New", "Text". Empty
 * pieces are skipped.
 */
public class NgramSpanExtractor extends SpanExtractor {

  public static final int DEFAULT_N_MAX = 5;
  public static final List<String> DEFAULT_SPLIT_TOKENS = Arrays.asList("-", "/");

  private final int nMax;
  private final Pattern split;   // null means never split

  public NgramSpanExtractor() {
    this(DEFAULT_N_MAX, DEFAULT_SPLIT_TOKENS);
  }

  public NgramSpanExtractor(int nMax) {
    this(nMax, DEFAULT_SPLIT_TOKENS);
  }

  public NgramSpanExtractor(int nMax, List<String> splitTokens) {
    if (nMax < 1)
      throw new IllegalArgumentException("nMax must be positive: " + nMax);
    this.nMax = nMax;
    if (splitTokens == null || splitTokens.isEmpty()) {
      this.split = null;
    } else {
      List<String> quoted = Lists.transform(splitTokens, Pattern::quote);
      this.split = Pattern.compile(Joiner.on('|').join(quoted));
    }
  }

  public int getNMax() {
    return nMax;
  }

  @Override
  public String getName() {
    return "Ngrams(" + nMax + ")";
  }

  @Override
  public void computeSpans(Sentence s, List<TemporarySpan> addTo) {
    Set<Span> seen = new HashSet<>();
    int n = s.size();
    for (int width = Math.min(nMax, n); width >= 1; width--) {
      for (int i = 0; i + width <= n; i++) {
        Span sp = s.getCharSpan(i, i + width - 1);
        if (seen.add(sp))
          addTo.add(new TemporarySpan(s, sp));
        if (width == 1 && split != null)
          addSplits(s, sp, seen, addTo);
      }
    }
  }

  private void addSplits(Sentence s, Span word, Set<Span> seen, List<TemporarySpan> addTo) {
    String text = s.getText(word);
    Matcher m = split.matcher(text);
    if (!m.find())
      return;
    if (m.start() > 0) {
      Span left = Span.getSpan(word.start, word.start + m.start());
      if (seen.add(left))
        addTo.add(new TemporarySpan(s, left));
    }
    if (m.end() < text.length()) {
      Span right = Span.getSpan(word.start + m.end(), word.end);
      if (seen.add(right))
        addTo.add(new TemporarySpan(s, right));
    }
  }
}
