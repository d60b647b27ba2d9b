package edu.jhu.hlt.candgen.inference;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.apache.log4j.Logger;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.common.util.concurrent.Uninterruptibles;

import edu.jhu.hlt.candgen.ConfigurationException;
import edu.jhu.hlt.candgen.datatypes.Document;
import edu.jhu.hlt.candgen.store.StoreConfig;

/**
 * Fans a {@link DocumentUdf} out over documents. The documents are dealt
 * round-robin to p workers up front, so every document is handled by exactly
 * one worker; each worker has its own store connection and commits one
 * document at a time. With p == 1 everything runs on the calling thread.
 *
 * There is no ordering across documents. If the calling thread is
 * interrupted the workers stop after their current document and the report
 * is marked interrupted; committed documents stay committed. In every case
 * {@link #run} returns (or throws) only after all workers have stopped, so
 * nothing is written to the store or the report afterwards.
 */
public class ParallelRunner {
  public static final Logger LOG = Logger.getLogger(ParallelRunner.class);

  private final StoreConfig storeConfig;

  public ParallelRunner(StoreConfig storeConfig) {
    this.storeConfig = storeConfig;
  }

  public RunReport run(List<Document> docs, DocumentUdf udf, int parallelism) {
    if (parallelism < 1)
      throw new ConfigurationException("parallelism must be positive: " + parallelism);
    RunReport report = new RunReport(udf.getName(), docs.size());
    int p = Math.max(1, Math.min(parallelism, docs.size()));
    LOG.info("[run] " + udf.getName() + " on " + docs.size() + " documents with " + p + " workers");

    if (p == 1) {
      new DocumentWorker(0, docs, udf, storeConfig, report).call();
    } else {
      List<List<Document>> parts = partition(docs, p);
      ExecutorService es = Executors.newFixedThreadPool(p,
          new ThreadFactoryBuilder().setNameFormat("candgen-worker-%d").build());
      List<Future<Integer>> futures = new ArrayList<>();
      for (int i = 0; i < p; i++)
        futures.add(es.submit(new DocumentWorker(i, parts.get(i), udf, storeConfig, report)));
      es.shutdown();
      RuntimeException workerFailure = null;
      try {
        for (Future<Integer> f : futures) {
          try {
            f.get();
          } catch (ExecutionException e) {
            // Per-document errors never get here; this is a worker that could not
            // run at all (e.g. no connection). Stop the others after their
            // current document and rethrow once they are done.
            workerFailure = unwrap(e);
            LOG.warn("[run] a worker died, stopping the others after their current document", workerFailure);
            stopWorkers(es, report);
            break;
          }
        }
      } catch (InterruptedException e) {
        LOG.warn("[run] interrupted, stopping workers after their current document");
        stopWorkers(es, report);
        Thread.currentThread().interrupt();
      }
      if (workerFailure != null)
        throw workerFailure;
    }

    LOG.info("[run] done " + report + " in " + report.getSeconds() + " seconds");
    for (DocumentFailure f : report.getFailures())
      LOG.warn("[run] failed: " + f);
    return report;
  }

  /**
   * Asks the workers to stop and blocks until they have. Workers check for
   * this between documents, so the ones mid-document finish (and commit)
   * first.
   */
  private static void stopWorkers(ExecutorService es, RunReport report) {
    report.markInterrupted();
    es.shutdownNow();
    Uninterruptibles.awaitTerminationUninterruptibly(es);
  }

  private static RuntimeException unwrap(ExecutionException e) {
    Throwable cause = e.getCause();
    if (cause instanceof RuntimeException)
      return (RuntimeException) cause;
    return new RuntimeException(cause);
  }

  /** Deals docs round-robin into p lists, preserving their relative order. */
  static List<List<Document>> partition(List<Document> docs, int p) {
    List<List<Document>> parts = new ArrayList<>(p);
    for (int i = 0; i < p; i++)
      parts.add(new ArrayList<>());
    for (int i = 0; i < docs.size(); i++)
      parts.get(i % p).add(docs.get(i));
    return parts;
  }
}
