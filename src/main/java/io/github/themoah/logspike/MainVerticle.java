package io.github.themoah.logspike;

import io.github.themoah.logspike.api.AnomalyHandler;
import io.github.themoah.logspike.api.IngestHandler;
import io.github.themoah.logspike.api.PatternHandler;
import io.github.themoah.logspike.config.AppConfig;
import io.github.themoah.logspike.context.ContextBuilder;
import io.github.themoah.logspike.context.DeployRegistry;
import io.github.themoah.logspike.detect.AnomalyDetector;
import io.github.themoah.logspike.detect.DetectionScheduler;
import io.github.themoah.logspike.detect.DetectorConfig;
import io.github.themoah.logspike.detect.SeverityThresholds;
import io.github.themoah.logspike.explain.AnomalyExplainer;
import io.github.themoah.logspike.explain.ExplainerConfig;
import io.github.themoah.logspike.explain.OpenRouterCompletionClient;
import io.github.themoah.logspike.explain.TextCompletionClient;
import io.github.themoah.logspike.health.HealthCheckHandler;
import io.github.themoah.logspike.ingest.Ingestor;
import io.github.themoah.logspike.metrics.MetricsConfig;
import io.github.themoah.logspike.metrics.MetricsReporter;
import io.github.themoah.logspike.metrics.MicrometerConfig;
import io.github.themoah.logspike.metrics.MicrometerReporter;
import io.github.themoah.logspike.metrics.PrometheusHandler;
import io.github.themoah.logspike.normalize.Normalizer;
import io.github.themoah.logspike.source.FileLogSource;
import io.github.themoah.logspike.source.IngestPipeline;
import io.github.themoah.logspike.source.KafkaLogSource;
import io.github.themoah.logspike.source.KafkaSourceConfig;
import io.github.themoah.logspike.source.LogSource;
import io.github.themoah.logspike.source.SourceConfig;
import io.github.themoah.logspike.store.PatternStore;
import io.github.themoah.logspike.store.StoreConfig;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.http.HttpServer;
import io.vertx.ext.web.Router;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main verticle for logspike.
 * Wires input sources, the pattern store, periodic detection and the HTTP surface.
 */
public class MainVerticle extends AbstractVerticle {

  private static final Logger log = LoggerFactory.getLogger(MainVerticle.class);

  private final AppConfig appConfig;
  private final MetricsConfig metricsConfig;
  private final SourceConfig sourceConfig;
  private final ExplainerConfig explainerConfig;

  private final List<LogSource> sources = new ArrayList<>();
  private DetectionScheduler scheduler;
  private TextCompletionClient completionClient;
  private HttpServer httpServer;

  public MainVerticle() {
    this(AppConfig.fromEnvironment(), MetricsConfig.fromEnvironment(),
      SourceConfig.fromEnvironment(), ExplainerConfig.fromEnvironment());
  }

  public MainVerticle(
    AppConfig appConfig,
    MetricsConfig metricsConfig,
    SourceConfig sourceConfig,
    ExplainerConfig explainerConfig
  ) {
    this.appConfig = appConfig;
    this.metricsConfig = metricsConfig;
    this.sourceConfig = sourceConfig;
    this.explainerConfig = explainerConfig;
  }

  @Override
  public void start(Promise<Void> startPromise) {
    log.info("Starting logspike MainVerticle");

    PatternStore store = new PatternStore(StoreConfig.fromEnvironment());
    Ingestor ingestor = new Ingestor(Normalizer.fromEnvironment());
    IngestPipeline pipeline = new IngestPipeline(ingestor, store);
    AnomalyDetector detector = new AnomalyDetector(store, DetectorConfig.fromEnvironment());
    SeverityThresholds thresholds = SeverityThresholds.fromEnvironment();

    Router router = Router.router(vertx);
    MetricsReporter reporter = createMetricsReporter(router);

    scheduler = new DetectionScheduler(vertx, detector, store, ingestor, reporter, thresholds,
      appConfig.detectionClock(), Clock.systemUTC(), appConfig.detectionIntervalMs());

    createSources(pipeline);

    new HealthCheckHandler(sources).registerRoutes(router);
    new IngestHandler(pipeline).registerRoutes(router);
    new PatternHandler(store).registerRoutes(router);
    new AnomalyHandler(
      scheduler,
      new ContextBuilder(store, appConfig.contextWindow()),
      new DeployRegistry(),
      createExplainer()
    ).registerRoutes(router);

    router.route().handler(ctx -> {
      ctx.response()
        .setStatusCode(404)
        .putHeader("content-type", "application/json")
        .end("{\"error\": \"Not Found\"}");
    });

    startSources()
      .compose(v -> scheduler.start())
      .compose(v -> startHttpServer(router, appConfig.httpPort()))
      .onSuccess(server -> {
        httpServer = server;
        log.info("logspike started successfully on port {}", server.actualPort());
        startPromise.complete();
      })
      .onFailure(err -> {
        log.error("Failed to start logspike", err);
        startPromise.fail(err);
      });
  }

  @Override
  public void stop(Promise<Void> stopPromise) {
    log.info("Stopping logspike MainVerticle");

    Future<Void> stopScheduler = (scheduler != null)
      ? scheduler.stop()
      : Future.succeededFuture();

    Future<Void> stopHttpServer = (httpServer != null)
      ? httpServer.close()
      : Future.succeededFuture();

    if (completionClient != null) {
      completionClient.close();
    }

    stopScheduler
      .compose(v -> stopHttpServer)
      .compose(v -> stopSources())
      .onSuccess(v -> {
        log.info("logspike stopped successfully");
        stopPromise.complete();
      })
      .onFailure(err -> {
        log.error("Error during logspike shutdown", err);
        stopPromise.fail(err);
      });
  }

  /**
   * Returns the port the HTTP server is bound to, or -1 before it has started.
   */
  public int actualPort() {
    return httpServer != null ? httpServer.actualPort() : -1;
  }

  private Future<HttpServer> startHttpServer(Router router, int port) {
    return vertx.createHttpServer()
      .requestHandler(router)
      .listen(port)
      .onSuccess(server -> log.info("HTTP server started on port {}", server.actualPort()))
      .onFailure(err -> log.error("Failed to start HTTP server", err));
  }

  private void createSources(IngestPipeline pipeline) {
    if (sourceConfig.fileEnabled()) {
      sources.add(new FileLogSource(vertx, sourceConfig.logFile(), pipeline));
    }
    if (sourceConfig.kafkaEnabled()) {
      sources.add(new KafkaLogSource(vertx, KafkaSourceConfig.load(), sourceConfig.kafkaTopic(), pipeline));
    }
    if (sources.isEmpty()) {
      log.info("No input sources configured; lines can be sent to POST /ingest");
    }
  }

  /**
   * Starts every source. A source that fails to start is reported through readiness
   * instead of failing the deployment.
   */
  private Future<Void> startSources() {
    List<Future<Void>> started = sources.stream()
      .map(source -> source.start()
        .recover(err -> {
          log.warn("Source {} failed to start: {}", source.name(), err.getMessage());
          return Future.succeededFuture();
        }))
      .collect(Collectors.toList());
    return Future.all(started).mapEmpty();
  }

  private Future<Void> stopSources() {
    List<Future<Void>> stopped = sources.stream()
      .map(LogSource::stop)
      .collect(Collectors.toList());
    return Future.join(stopped).mapEmpty();
  }

  private MetricsReporter createMetricsReporter(Router router) {
    if (!metricsConfig.isEnabled()) {
      log.info("Metrics reporting is disabled");
      return null;
    }

    MeterRegistry registry = MicrometerConfig.createRegistry(metricsConfig.reporterType());
    if (registry == null) {
      log.warn("Failed to create meter registry for type: {}", metricsConfig.reporterType());
      return null;
    }

    if (metricsConfig.jvmMetricsEnabled()) {
      MicrometerConfig.bindJvmMetrics(registry);
      log.info("JVM metrics enabled");
    }

    if (registry instanceof PrometheusMeterRegistry prometheusRegistry) {
      new PrometheusHandler(prometheusRegistry).registerRoutes(router);
    }

    return new MicrometerReporter(registry);
  }

  private AnomalyExplainer createExplainer() {
    if (!explainerConfig.isEnabled()) {
      return null;
    }
    completionClient = new OpenRouterCompletionClient(vertx, explainerConfig);
    return new AnomalyExplainer(completionClient);
  }
}
