package io.github.themoah.logspike.ingest;

/**
 * Why a line did not become an event.
 */
public enum FailureReason {
  /** The line matched no known structural format. */
  UNRECOGNIZED_FORMAT("unrecognized_format"),
  /** The format was recognized but the parser rejected the line. */
  UNPARSEABLE_LINE("unparseable_line"),
  /** Something unexpected failed while processing the line. */
  INTERNAL_ERROR("internal_error");

  private final String value;

  FailureReason(String value) {
    this.value = value;
  }

  public String getValue() {
    return value;
  }
}
