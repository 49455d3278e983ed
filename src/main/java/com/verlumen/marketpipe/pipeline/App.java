package com.verlumen.marketpipe.pipeline;

import static com.google.common.base.Strings.isNullOrEmpty;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.flogger.FluentLogger;
import com.google.inject.Guice;
import com.google.inject.Inject;
import com.verlumen.marketpipe.execution.RunMode;
import com.verlumen.marketpipe.features.FeatureSetRegistry;
import com.verlumen.marketpipe.ingestion.IngestionConfig;
import com.verlumen.marketpipe.ingestion.PairOutcome;
import com.verlumen.marketpipe.ingestion.RetryPolicy;
import com.verlumen.marketpipe.instruments.AssetClass;
import com.verlumen.marketpipe.instruments.Instrument;
import com.verlumen.marketpipe.kafka.KafkaDefaults;
import com.verlumen.marketpipe.marketdata.MarketDataConfig;
import com.verlumen.marketpipe.signals.SignalPublisher;
import com.verlumen.marketpipe.signals.SignalsConfig;
import com.verlumen.marketpipe.time.TimeFrame;
import com.verlumen.marketpipe.time.Timestamps;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import java.util.logging.LogManager;
import net.sourceforge.argparse4j.ArgumentParsers;
import net.sourceforge.argparse4j.inf.ArgumentParser;
import net.sourceforge.argparse4j.inf.ArgumentParserException;
import net.sourceforge.argparse4j.inf.Namespace;

/** Runs one ingestion, feature and signal cycle and exits. Meant to be triggered by a scheduler. */
final class App {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();
  private static final String ALPHA_VANTAGE_API_KEY_ENV_VAR = "ALPHAVANTAGE_API_KEY";
  private static final String DATA_DIR_ENV_VAR = "MARKETPIPE_DATA_DIR";

  private final CycleRunner cycleRunner;
  private final ImmutableList<Instrument> instruments;
  private final SignalPublisher signalPublisher;
  private final RunMode runMode;

  @Inject
  App(
      CycleRunner cycleRunner,
      ImmutableList<Instrument> instruments,
      SignalPublisher signalPublisher,
      RunMode runMode) {
    this.cycleRunner = cycleRunner;
    this.instruments = instruments;
    this.signalPublisher = signalPublisher;
    this.runMode = runMode;
  }

  CycleReport run(Instant asOf) {
    logger.atInfo().log("Running %s cycle for %s as of %s", runMode, instruments, asOf);
    try {
      CycleReport report = cycleRunner.runCycle(instruments, asOf);
      for (PairOutcome outcome : report.pairOutcomes()) {
        if (!outcome.succeeded()) {
          logger.atWarning().log(
              "%s: %s (%s) %s",
              outcome.pair(),
              outcome.status(),
              outcome.failureKind().orElse(null),
              outcome.message().orElse(""));
        }
      }
      for (InstrumentReport instrumentReport : report.instrumentReports()) {
        logger.atInfo().log(
            "%s: %d feature records written, %d failed timestamps, signal=%s",
            instrumentReport.instrument(),
            instrumentReport.featuresWritten(),
            instrumentReport.failedTimestamps().size(),
            instrumentReport.signal().map(s -> s.decision().name()).orElse("none"));
      }
      return report;
    } finally {
      signalPublisher.close();
    }
  }

  public static void main(String[] args) throws ArgumentParserException {
    configureLogging();
    logger.atInfo().log("marketpipe starting with %d arguments", args.length);
    Namespace namespace = createParser().parseArgs(args);

    RunMode runMode = RunMode.fromString(namespace.getString("runMode"));
    Instant asOf =
        isNullOrEmpty(namespace.getString("asOf"))
            ? Instant.now().truncatedTo(ChronoUnit.MINUTES)
            : Timestamps.parseInstantOrDate(namespace.getString("asOf"));
    TimeFrame timeFrame = TimeFrame.fromLabel(namespace.getString("timeFrame"));
    Duration recomputeHorizon = Duration.parse(namespace.getString("recomputeHorizon"));

    List<String> sources = splitList(namespace.getString("sources"));
    Instant backfillStart = Timestamps.parseInstantOrDate(namespace.getString("backfillStart"));
    if (runMode == RunMode.DRY) {
      // Synthetic data only needs to cover the features' history.
      sources = ImmutableList.of("dryrun");
      backfillStart = asOf.minus(recomputeHorizon.multipliedBy(2));
    }

    String dataDir = namespace.getString("dataDir");
    IngestionConfig ingestionConfig =
        IngestionConfig.defaults()
            .withRetryPolicy(
                RetryPolicy.create(
                    namespace.getInt("maxAttempts"),
                    Duration.ofMillis(namespace.getLong("baseDelayMillis")),
                    Duration.ofSeconds(30),
                    0.2))
            .withCycleTimeout(Duration.ofSeconds(namespace.getLong("cycleTimeoutSeconds")));
    String modelEndpoint = namespace.getString("modelEndpoint");

    PipelineModule module =
        PipelineModule.create(
            runMode,
            ImmutableList.copyOf(splitList(namespace.getString("instruments"))),
            isNullOrEmpty(dataDir) ? Optional.empty() : Optional.of(Path.of(dataDir)),
            namespace.getString("kafka.bootstrap.servers"),
            MarketDataConfig.create(
                backfillStart, timeFrame, namespace.getString("alphavantage.apiKey")),
            ingestionConfig,
            new SignalsConfig(
                namespace.getDouble("buyThreshold"),
                namespace.getDouble("sellThreshold"),
                namespace.getString("signalTopic"),
                isNullOrEmpty(modelEndpoint) ? Optional.empty() : Optional.of(modelEndpoint),
                namespace.getString("modelVersion")),
            new PipelineConfig(
                ImmutableList.copyOf(sources),
                ImmutableMap.of(
                    AssetClass.CRYPTO, namespace.getString("cryptoFeatureSetVersion"),
                    AssetClass.EQUITY, namespace.getString("equityFeatureSetVersion")),
                recomputeHorizon));

    App app = Guice.createInjector(module).getInstance(App.class);
    CycleReport report = app.run(asOf);
    logger.atInfo().log(
        "Cycle complete in %s with %d failed pairs", report.duration(), report.failedPairs());
  }

  /** Applies the bundled logging.properties unless a config file was given on the command line. */
  private static void configureLogging() {
    if (System.getProperty("java.util.logging.config.file") != null) {
      return;
    }
    try (InputStream config = App.class.getResourceAsStream("/logging.properties")) {
      if (config != null) {
        LogManager.getLogManager().readConfiguration(config);
      }
    } catch (IOException e) {
      logger.atWarning().withCause(e).log("Could not read bundled logging configuration");
    }
  }

  private static List<String> splitList(String value) {
    return Splitter.on(',').trimResults().omitEmptyStrings().splitToList(value);
  }

  private static ArgumentParser createParser() {
    ArgumentParser parser = ArgumentParsers.newFor("MarketPipe")
      .build()
      .defaultHelp(true)
      .description("Runs one market data ingestion, feature and signal cycle");

    parser.addArgument("--runMode")
      .choices("wet", "dry")
      .setDefault("wet")
      .help("Run mode: wet or dry");

    parser.addArgument("--instruments")
      .setDefault("")
      .help("Comma-separated instruments, e.g. crypto:BTC/USDT@binance,equity:AAPL@nasdaq");

    parser.addArgument("--sources")
      .setDefault("binance,alphavantage")
      .help("Comma-separated source adapters to pull from");

    parser.addArgument("--asOf")
      .setDefault("")
      .help("ISO instant or date the cycle runs as of (default: now)");

    parser.addArgument("--timeFrame")
      .setDefault(TimeFrame.ONE_MIN.getLabel())
      .help("Bar interval requested from sources");

    parser.addArgument("--cryptoFeatureSetVersion")
      .setDefault(FeatureSetRegistry.CORE_MINUTE)
      .help("Feature set materialized for crypto instruments; must match --timeFrame");

    parser.addArgument("--equityFeatureSetVersion")
      .setDefault(FeatureSetRegistry.CORE_DAILY)
      .help("Feature set materialized for equities, which are served as daily bars");

    parser.addArgument("--recomputeHorizon")
      .setDefault("PT12H")
      .help("ISO-8601 duration before asOf over which features are recomputed");

    parser.addArgument("--backfillStart")
      .setDefault("2017-08-01")
      .help("First bar requested for pairs never ingested before");

    parser.addArgument("--dataDir")
      .setDefault(System.getenv().getOrDefault(DATA_DIR_ENV_VAR, ""))
      .help("Root of the local blob store (default: value of " + DATA_DIR_ENV_VAR
          + " environment variable, in memory when empty)");

    parser.addArgument("--alphavantage.apiKey")
      .setDefault(System.getenv().getOrDefault(ALPHA_VANTAGE_API_KEY_ENV_VAR, ""))
      .help("Alpha Vantage API key (default: value of " + ALPHA_VANTAGE_API_KEY_ENV_VAR
          + " environment variable)");

    parser.addArgument("--maxAttempts")
      .type(Integer.class)
      .setDefault(5)
      .help("Attempts per source call before a pair is reported failed");

    parser.addArgument("--baseDelayMillis")
      .type(Long.class)
      .setDefault(500L)
      .help("First retry delay; doubles on every further attempt");

    parser.addArgument("--cycleTimeoutSeconds")
      .type(Long.class)
      .setDefault(120L)
      .help("Deadline for one pair's ingestion cycle");

    // Kafka configuration
    parser.addArgument("--kafka.bootstrap.servers")
      .setDefault(KafkaDefaults.BOOTSTRAP_SERVERS)
      .help("Kafka bootstrap servers");

    parser.addArgument("--signalTopic")
      .setDefault(KafkaDefaults.SIGNAL_TOPIC)
      .help("Kafka topic for publishing signals");

    // Model configuration
    parser.addArgument("--modelEndpoint")
      .setDefault("")
      .help("HTTP endpoint of the prediction model (default: built-in heuristic)");

    parser.addArgument("--modelVersion")
      .setDefault("remote-v1")
      .help("Version recorded for the remote model");

    parser.addArgument("--buyThreshold")
      .type(Double.class)
      .setDefault(0.01)
      .help("Expected return at or above which to BUY");

    parser.addArgument("--sellThreshold")
      .type(Double.class)
      .setDefault(0.01)
      .help("Expected loss at or beyond which to SELL");

    return parser;
  }
}
