package edu.jhu.hlt.candgen.inference;

import edu.jhu.hlt.candgen.datatypes.Document;

/**
 * A document whose work was rolled back, with enough context to retry just
 * that document.
 */
public final class DocumentFailure {

  private final Document document;
  private final String stage;
  private final Throwable cause;

  public DocumentFailure(Document document, String stage, Throwable cause) {
    this.document = document;
    this.stage = stage;
    this.cause = cause;
  }

  static DocumentFailure of(Document doc, DocumentUdf udf, RuntimeException e) {
    if (e instanceof ExtractionStageException) {
      ExtractionStageException se = (ExtractionStageException) e;
      return new DocumentFailure(doc, se.getStage(), se.getCause());
    }
    return new DocumentFailure(doc, udf.getName(), e);
  }

  public Document getDocument() {
    return document;
  }

  /** Relation or mention type being processed when the failure happened. */
  public String getStage() {
    return stage;
  }

  public Throwable getCause() {
    return cause;
  }

  public String getMessage() {
    String m = cause.getMessage();
    return cause.getClass().getSimpleName() + (m == null ? "" : ": " + m);
  }

  @Override
  public String toString() {
    return "(DocumentFailure doc=" + document.getId() + " " + document.getName()
        + " stage=" + stage + " " + getMessage() + ")";
  }
}
