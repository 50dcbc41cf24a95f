package io.github.themoah.logspike.ingest;

/**
 * Structural shape of a raw log line. Describes structure, not meaning.
 */
public enum LogFormat {
  JSON,
  TIMESTAMP_TEXT,
  KEY_VALUE,
  UNKNOWN
}
