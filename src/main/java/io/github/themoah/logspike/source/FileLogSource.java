package io.github.themoah.logspike.source;

import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.file.AsyncFile;
import io.vertx.core.file.OpenOptions;
import io.vertx.core.parsetools.RecordParser;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Replays a UTF-8 log file, one line per record.
 */
public class FileLogSource implements LogSource {

  private static final Logger log = LoggerFactory.getLogger(FileLogSource.class);

  private final Vertx vertx;
  private final String path;
  private final IngestPipeline pipeline;
  private final AtomicLong linesRead = new AtomicLong();

  private volatile boolean healthy = true;
  private volatile boolean finished;
  private AsyncFile file;

  public FileLogSource(Vertx vertx, String path, IngestPipeline pipeline) {
    this.vertx = Objects.requireNonNull(vertx, "vertx cannot be null");
    this.path = Objects.requireNonNull(path, "path cannot be null");
    this.pipeline = Objects.requireNonNull(pipeline, "pipeline cannot be null");
  }

  @Override
  public String name() {
    return "file:" + path;
  }

  @Override
  public Future<Void> start() {
    log.info("Reading log lines from {}", path);
    return vertx.fileSystem().open(path, new OpenOptions().setRead(true).setWrite(false).setCreate(false))
      .onFailure(err -> {
        healthy = false;
        log.error("Failed to open log file {}", path, err);
      })
      .map(asyncFile -> {
        file = asyncFile;
        RecordParser parser = RecordParser.newDelimited("\n", asyncFile);
        parser.handler(this::handleLine);
        parser.exceptionHandler(err -> {
          healthy = false;
          log.error("Error while reading {}", path, err);
        });
        parser.endHandler(v -> {
          finished = true;
          log.info("Finished reading {}: {} lines", path, linesRead.get());
          asyncFile.close()
            .onFailure(err -> log.warn("Failed to close {}: {}", path, err.getMessage()));
        });
        return null;
      });
  }

  private void handleLine(Buffer buffer) {
    String line = buffer.toString(StandardCharsets.UTF_8);
    if (line.endsWith("\r")) {
      line = line.substring(0, line.length() - 1);
    }
    if (line.isBlank()) {
      return;
    }
    linesRead.incrementAndGet();
    pipeline.accept(line);
  }

  @Override
  public Future<Void> stop() {
    if (file == null || finished) {
      return Future.succeededFuture();
    }
    return file.close()
      .onFailure(err -> log.warn("Failed to close {}: {}", path, err.getMessage()));
  }

  @Override
  public boolean isHealthy() {
    return healthy;
  }

  @Override
  public long linesRead() {
    return linesRead.get();
  }

  /**
   * Returns true once the whole file has been read.
   */
  public boolean isFinished() {
    return finished;
  }
}
