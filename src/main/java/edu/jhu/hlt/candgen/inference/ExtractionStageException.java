package edu.jhu.hlt.candgen.inference;

/**
 * Wraps a failure while processing one document with the name of the relation
 * or mention type being worked on.
 */
public class ExtractionStageException extends RuntimeException {
  private static final long serialVersionUID = 6751309243382571046L;

  private final String stage;

  public ExtractionStageException(String stage, Throwable cause) {
    super(stage + ": " + cause.getMessage(), cause);
    this.stage = stage;
  }

  public String getStage() {
    return stage;
  }
}
