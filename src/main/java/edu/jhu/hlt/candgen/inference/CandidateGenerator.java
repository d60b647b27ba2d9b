package edu.jhu.hlt.candgen.inference;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

import org.apache.log4j.Logger;

import com.google.common.collect.AbstractIterator;
import com.google.common.collect.Lists;

import edu.jhu.hlt.candgen.ConfigurationException;
import edu.jhu.hlt.candgen.datatypes.Candidate;
import edu.jhu.hlt.candgen.datatypes.Document;
import edu.jhu.hlt.candgen.datatypes.Mention;
import edu.jhu.hlt.candgen.datatypes.MentionType;
import edu.jhu.hlt.candgen.datatypes.RelationSchema;
import edu.jhu.hlt.candgen.inference.RelationFilterPolicy.Verdict;
import edu.jhu.hlt.candgen.store.ExtractionStore;
import edu.jhu.hlt.candgen.throttle.Throttler;

/**
 * Proposes the candidates of one relation for one document.
 *
 * For every role the document's mentions of that role's type are read in id
 * order, and the Cartesian product of those lists is walked lazily. Each tuple
 * goes through the throttler (if any), then, for binary relations only, the
 * {@link RelationFilterPolicy}, and then (unless clearing) an existence check
 * against the store. Whatever survives comes out of the iterator as a new,
 * unsaved {@link Candidate}.
 *
 * Reads only; persisting is up to the caller. Relations with arity other than
 * two are only throttled: self/nested/symmetric pruning isn't defined for
 * them.
 */
public class CandidateGenerator {
  public static final Logger LOG = Logger.getLogger(CandidateGenerator.class);

  private final RelationSchema schema;
  private final List<MentionType> argTypes;
  private final Throttler throttler;   // may be null
  private final RelationFilterPolicy policy;

  public CandidateGenerator(RelationSchema schema, List<MentionType> argTypes,
      Throttler throttler, RelationFilterPolicy policy) {
    if (argTypes == null || argTypes.size() != schema.getArity()) {
      throw new ConfigurationException(schema.getName() + " has arity " + schema.getArity()
          + " but " + (argTypes == null ? 0 : argTypes.size()) + " mention types were given");
    }
    this.schema = schema;
    this.argTypes = Collections.unmodifiableList(new ArrayList<>(argTypes));
    this.throttler = throttler;
    this.policy = policy;
  }

  public RelationSchema getSchema() {
    return schema;
  }

  public List<MentionType> getArgTypes() {
    return argTypes;
  }

  /** A mention and its position in the id-ordered list of its role. */
  static final class Arg {
    final int index;
    final Mention mention;

    Arg(int index, Mention mention) {
      this.index = index;
      this.mention = mention;
    }

    Mention getMention() {
      return mention;
    }
  }

  /**
   * Lazily yields the candidates of doc in split. Calling this again starts
   * over (re-reading mentions from the store).
   *
   * @param clear if true, skip the existence check (the caller has deleted
   * this document's candidates already).
   */
  public Iterator<Candidate> generate(final Document doc, final int split,
      final boolean clear, final ExtractionStore store) {
    List<List<Arg>> perRole = new ArrayList<>(argTypes.size());
    for (MentionType t : argTypes) {
      List<Mention> mentions = store.mentions(doc.getId(), t);
      List<Arg> args = new ArrayList<>(mentions.size());
      for (int i = 0; i < mentions.size(); i++)
        args.add(new Arg(i, mentions.get(i)));
      perRole.add(args);
    }
    if (LOG.isDebugEnabled()) {
      StringBuilder sb = new StringBuilder();
      for (int i = 0; i < perRole.size(); i++)
        sb.append(' ').append(schema.getRole(i)).append('=').append(perRole.get(i).size());
      LOG.debug("[generate] " + schema.getName() + " " + doc + sb);
    }
    final Iterator<List<Arg>> tuples = Lists.cartesianProduct(perRole).iterator();
    final boolean binary = schema.getArity() == 2;

    return new AbstractIterator<Candidate>() {
      @Override
      protected Candidate computeNext() {
        while (tuples.hasNext()) {
          List<Arg> tuple = tuples.next();

          if (throttler != null && !throttler.test(Lists.transform(tuple, Arg::getMention)))
            continue;

          if (binary) {
            Arg a = tuple.get(0);
            Arg b = tuple.get(1);
            Verdict v = policy.check(a.index, a.mention, b.index, b.mention);
            if (v != Verdict.KEEP) {
              if (LOG.isDebugEnabled())
                LOG.debug("[generate] skipping " + v + " candidate " + a.mention + ", " + b.mention);
              continue;
            }
          }

          long[] argIds = new long[tuple.size()];
          for (int j = 0; j < argIds.length; j++)
            argIds[j] = tuple.get(j).mention.getId();

          if (!clear && store.candidateExists(schema, split, argIds))
            continue;

          return new Candidate(-1, schema.getName(), split, doc.getId(), argIds);
        }
        return endOfData();
      }
    };
  }

  @Override
  public String toString() {
    return "(CandidateGenerator " + schema.getDefinitionString() + " types=" + argTypes
        + " throttled=" + (throttler != null) + " " + policy + ")";
  }
}
