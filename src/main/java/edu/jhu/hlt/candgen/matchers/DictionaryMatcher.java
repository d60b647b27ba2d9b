package edu.jhu.hlt.candgen.matchers;

import java.util.Collection;
import java.util.Locale;

import com.google.common.collect.ImmutableSet;

import edu.jhu.hlt.candgen.spans.TemporarySpan;

/** Matches spans whose text is one of a fixed set of strings. */
public class DictionaryMatcher extends Matcher {

  private final ImmutableSet<String> dictionary;
  private final boolean ignoreCase;

  public DictionaryMatcher(Collection<String> entries, boolean ignoreCase) {
    ImmutableSet.Builder<String> b = ImmutableSet.builder();
    for (String e : entries)
      b.add(ignoreCase ? e.toLowerCase(Locale.ROOT) : e);
    this.dictionary = b.build();
    this.ignoreCase = ignoreCase;
  }

  @Override
  public boolean matches(TemporarySpan span) {
    String text = span.getText();
    return dictionary.contains(ignoreCase ? text.toLowerCase(Locale.ROOT) : text);
  }

  public int size() {
    return dictionary.size();
  }

  @Override
  public String toString() {
    return "(DictionaryMatcher size=" + dictionary.size() + ")";
  }
}
