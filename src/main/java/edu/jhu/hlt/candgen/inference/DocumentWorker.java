package edu.jhu.hlt.candgen.inference;

import java.util.List;
import java.util.concurrent.Callable;

import org.apache.log4j.Logger;

import edu.jhu.hlt.candgen.datatypes.Document;
import edu.jhu.hlt.candgen.store.ExtractionStore;
import edu.jhu.hlt.candgen.store.StoreConfig;
import edu.jhu.hlt.candgen.store.StoreException;

/**
 * Runs a {@link DocumentUdf} over a fixed list of documents with a connection
 * of its own. Each document is one transaction: committed if the udf returns,
 * rolled back and reported if it throws. A failing document never stops the
 * others; if even the rollback fails the connection is replaced.
 *
 * Between documents the worker stops if its thread was interrupted or the run
 * was marked interrupted.
 */
class DocumentWorker implements Callable<Integer> {
  public static final Logger LOG = Logger.getLogger(DocumentWorker.class);

  private final int workerId;
  private final List<Document> docs;
  private final DocumentUdf udf;
  private final StoreConfig storeConfig;
  private final RunReport report;

  DocumentWorker(int workerId, List<Document> docs, DocumentUdf udf,
      StoreConfig storeConfig, RunReport report) {
    this.workerId = workerId;
    this.docs = docs;
    this.udf = udf;
    this.storeConfig = storeConfig;
    this.report = report;
  }

  /** @return how many of its documents this worker committed. */
  @Override
  public Integer call() {
    int done = 0;
    ExtractionStore store = storeConfig.open();
    try {
      for (Document doc : docs) {
        if (Thread.currentThread().isInterrupted() || report.wasInterrupted()) {
          LOG.info("[worker" + workerId + "] interrupted, stopping after " + done
              + " of " + docs.size() + " documents");
          report.markInterrupted();
          break;
        }
        int rows;
        try {
          rows = udf.apply(doc, store);
          store.commit();
        } catch (RuntimeException e) {
          DocumentFailure f = DocumentFailure.of(doc, udf, e);
          LOG.warn("[worker" + workerId + "] " + udf.getName() + " failed on " + doc
              + " (" + f.getStage() + "), rolling back", e);
          report.documentFailed(f);
          try {
            store.rollback();
          } catch (StoreException re) {
            LOG.error("[worker" + workerId + "] rollback failed after " + doc
                + ", opening a new connection", re);
            close(store);
            store = storeConfig.open();
          }
          continue;
        }
        done++;
        report.documentCommitted(rows);
        if (LOG.isDebugEnabled())
          LOG.debug("[worker" + workerId + "] committed " + doc + " rows=" + rows);
      }
    } finally {
      close(store);
    }
    return done;
  }

  private void close(ExtractionStore store) {
    try {
      store.close();
    } catch (StoreException e) {
      LOG.warn("[worker" + workerId + "] could not close connection", e);
    }
  }
}
