package edu.jhu.hlt.candgen.matchers;

import java.util.regex.Pattern;

import edu.jhu.hlt.candgen.spans.TemporarySpan;

/**
 * Matches spans whose text matches a regular expression. By default the whole
 * text has to match; with fullMatch=false a match anywhere in the text will do.
 */
public class RegexMatcher extends Matcher {

  private final Pattern pattern;
  private final boolean fullMatch;

  public RegexMatcher(String regex) {
    this(regex, true, true);
  }

  public RegexMatcher(String regex, boolean ignoreCase, boolean fullMatch) {
    this.pattern = ignoreCase
        ? Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE)
        : Pattern.compile(regex);
    this.fullMatch = fullMatch;
  }

  @Override
  public boolean matches(TemporarySpan span) {
    java.util.regex.Matcher m = pattern.matcher(span.getText());
    return fullMatch ? m.matches() : m.find();
  }

  @Override
  public String toString() {
    return "(RegexMatcher " + pattern.pattern() + (fullMatch ? "" : " partial") + ")";
  }
}
