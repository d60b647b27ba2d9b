package edu.jhu.hlt.candgen.inference;

import java.util.Iterator;
import java.util.List;

import org.apache.log4j.Logger;

import com.google.common.collect.AbstractIterator;
import com.google.common.collect.Iterators;

import edu.jhu.hlt.candgen.datatypes.Document;
import edu.jhu.hlt.candgen.datatypes.Mention;
import edu.jhu.hlt.candgen.datatypes.MentionType;
import edu.jhu.hlt.candgen.datatypes.Sentence;
import edu.jhu.hlt.candgen.matchers.Matcher;
import edu.jhu.hlt.candgen.spans.SpanExtractor;
import edu.jhu.hlt.candgen.spans.TemporarySpan;
import edu.jhu.hlt.candgen.store.ExtractionStore;

/**
 * The arity-1 counterpart of {@link CandidateGenerator}: proposes the mentions
 * of one type for one document. Spans come from a {@link SpanExtractor} run
 * over each sentence (in document order), are filtered by a {@link Matcher},
 * and (unless clearing) by an existence check against the store.
 */
public class MentionGenerator {
  public static final Logger LOG = Logger.getLogger(MentionGenerator.class);

  private final MentionType type;
  private final SpanExtractor spans;
  private final Matcher matcher;

  public MentionGenerator(MentionType type, SpanExtractor spans, Matcher matcher) {
    if (type == null || spans == null || matcher == null)
      throw new IllegalArgumentException("type, spans and matcher are all required");
    this.type = type;
    this.spans = spans;
    this.matcher = matcher;
  }

  public MentionType getType() {
    return type;
  }

  public Iterator<Mention> generate(final Document doc, final boolean clear, final ExtractionStore store) {
    List<Sentence> sentences = store.sentences(doc.getId());
    if (LOG.isDebugEnabled())
      LOG.debug("[generate] " + type + " " + doc + " sentences=" + sentences.size());
    // One matcher pass per sentence: longest-match-only state never spans sentences.
    final Iterator<TemporarySpan> matched = Iterators.concat(
        Iterators.transform(sentences.iterator(),
            s -> matcher.apply(spans.computeSpans(s).iterator())));

    return new AbstractIterator<Mention>() {
      @Override
      protected Mention computeNext() {
        while (matched.hasNext()) {
          TemporarySpan ts = matched.next();
          if (!clear && store.mentionExists(type, doc.getId(), ts.getCharSpan()))
            continue;
          return ts.toMention(type);
        }
        return endOfData();
      }
    };
  }

  @Override
  public String toString() {
    return "(MentionGenerator " + type + " " + spans.getName() + " " + matcher + ")";
  }
}
