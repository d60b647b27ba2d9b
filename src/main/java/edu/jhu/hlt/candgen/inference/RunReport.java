package edu.jhu.hlt.candgen.inference;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.apache.log4j.Logger;

/**
 * What a run did: documents committed, rows written and documents that
 * failed. Workers update it concurrently; read it once the run is over.
 */
public class RunReport {
  public static final Logger LOG = Logger.getLogger(RunReport.class);

  /** Seconds between progress lines. */
  public static double PROGRESS_INTERVAL = 15;

  private final String name;
  private final int numDocuments;
  private final AtomicInteger committed = new AtomicInteger();
  private final AtomicInteger rows = new AtomicInteger();
  private final List<DocumentFailure> failures = Collections.synchronizedList(new ArrayList<>());
  private volatile boolean interrupted = false;

  private final long start = System.currentTimeMillis();
  private long lastMark = start;

  public RunReport(String name, int numDocuments) {
    this.name = name;
    this.numDocuments = numDocuments;
  }

  void documentCommitted(int rowsWritten) {
    committed.incrementAndGet();
    rows.addAndGet(rowsWritten);
    maybeLogProgress();
  }

  void documentFailed(DocumentFailure f) {
    failures.add(f);
    maybeLogProgress();
  }

  void markInterrupted() {
    interrupted = true;
  }

  private synchronized void maybeLogProgress() {
    long now = System.currentTimeMillis();
    if ((now - lastMark) / 1000d >= PROGRESS_INTERVAL) {
      lastMark = now;
      LOG.info("[" + name + "] " + getDocumentsProcessed() + "/" + numDocuments
          + " documents, " + rows.get() + " rows, " + failures.size() + " failures in "
          + getSeconds() + " seconds");
    }
  }

  public String getName() { return name; }
  public int getNumDocuments() { return numDocuments; }
  public int getDocumentsCommitted() { return committed.get(); }
  public int getDocumentsProcessed() { return committed.get() + failures.size(); }
  public int getRowsWritten() { return rows.get(); }
  public boolean wasInterrupted() { return interrupted; }

  /** True if every document was committed. */
  public boolean isComplete() {
    return !interrupted && committed.get() == numDocuments;
  }

  public List<DocumentFailure> getFailures() {
    synchronized (failures) {
      return new ArrayList<>(failures);
    }
  }

  public double getSeconds() {
    return (System.currentTimeMillis() - start) / 1000d;
  }

  /** One row per failed document: doc_id, doc_name, stage, error. */
  public void writeFailuresCsv(Appendable out) throws IOException {
    writeFailuresCsv(out, Collections.singletonList(this));
  }

  /** Failures of several runs under one header. */
  public static void writeFailuresCsv(Appendable out, List<RunReport> reports) throws IOException {
    CSVFormat format = CSVFormat.DEFAULT.builder()
        .setHeader("doc_id", "doc_name", "stage", "error")
        .build();
    try (CSVPrinter p = new CSVPrinter(out, format)) {
      for (RunReport r : reports) {
        for (DocumentFailure f : r.getFailures())
          p.printRecord(f.getDocument().getId(), f.getDocument().getName(), f.getStage(), f.getMessage());
      }
    }
  }

  @Override
  public String toString() {
    return "(RunReport " + name + " documents=" + getDocumentsCommitted() + "/" + numDocuments
        + " rows=" + rows.get() + " failures=" + failures.size()
        + (interrupted ? " interrupted" : "") + ")";
  }
}
