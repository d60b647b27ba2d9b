package edu.jhu.hlt.candgen.inference;

import edu.jhu.hlt.candgen.datatypes.Document;
import edu.jhu.hlt.candgen.store.ExtractionStore;

/**
 * The per-document unit of work handed to a {@link ParallelRunner}. One
 * instance is shared by all workers, so implementations must not keep
 * per-document state in fields; everything a call needs arrives through its
 * arguments, including the worker's own store connection.
 */
public interface DocumentUdf {

  /** Used in logs and reports, e.g. "candidates split=0". */
  String getName();

  /**
   * Processes one document inside the current transaction of store. Must not
   * commit or roll back: the runner does that.
   *
   * @return the number of rows written.
   * @throws ExtractionStageException to tell the runner which part of the
   * work failed. Any other runtime exception is reported against the whole
   * udf.
   */
  int apply(Document doc, ExtractionStore store);
}
