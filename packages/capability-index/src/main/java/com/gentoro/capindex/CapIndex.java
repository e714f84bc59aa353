package com.gentoro.capindex;

import com.gentoro.capindex.budget.BudgetPlanner;
import com.gentoro.capindex.budget.ComparisonPlanner;
import com.gentoro.capindex.cache.ScoreCache;
import com.gentoro.capindex.element.ElementSource;
import com.gentoro.capindex.element.YamlElementSource;
import com.gentoro.capindex.exception.StateException;
import com.gentoro.capindex.index.BuildPipeline;
import com.gentoro.capindex.index.CapabilityIndex;
import com.gentoro.capindex.index.CapabilityIndexService;
import com.gentoro.capindex.index.IndexBuilder;
import com.gentoro.capindex.index.IndexCodec;
import com.gentoro.capindex.lease.IndexLeaseManager;
import com.gentoro.capindex.profile.LexicalProfiler;
import com.gentoro.capindex.relationship.ActionTriggerExtractor;
import com.gentoro.capindex.relationship.RelationshipDiscoverer;
import com.gentoro.capindex.relationship.RelationshipRules;
import com.gentoro.capindex.relationship.TraversalOptions;
import com.gentoro.capindex.relationship.VerbTaxonomy;
import com.gentoro.capindex.scoring.SimilarityScorer;
import com.gentoro.capindex.utility.JacksonUtility;
import java.io.PrintStream;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.commons.configuration2.Configuration;

/**
 * Application context: owns the configuration and the wired index components. Nothing here is a
 * singleton; tests and embedders create as many contexts as they need.
 */
public class CapIndex {
  private static final org.slf4j.Logger log =
      com.gentoro.capindex.logging.LoggingService.getLogger(CapIndex.class);

  private final StartupParameters startupParameters;
  private ConfigurationProvider configurationProvider;
  private IndexConfig indexConfig;
  private IndexCodec codec;
  private IndexLeaseManager leaseManager;
  private BuildPipeline pipeline;

  public CapIndex(String[] applicationArgs) {
    this.startupParameters = new StartupParameters(applicationArgs);
  }

  public void initialize() {
    this.configurationProvider = new ConfigurationProvider(startupParameters.configFile());
    com.gentoro.capindex.logging.LoggingService.applyConfiguration(configuration());

    startupParameters
        .getOptional("index-path")
        .ifPresent(
            p -> {
              configuration().setProperty(IndexConfig.PREFIX + "index.path", p);
              log.info("Index path overridden via --index-path: {}", p);
            });

    this.indexConfig = IndexConfig.fromConfiguration(configuration());
    this.codec = new IndexCodec();
    this.leaseManager =
        new IndexLeaseManager(
            Clock.systemUTC(), indexConfig.leaseTimeoutMs(), indexConfig.leasePollMs());
    this.pipeline = pipelineFor(indexConfig);
  }

  /** Wire the build stages from configuration; the returned pipeline owns a fresh cache. */
  public static BuildPipeline pipelineFor(IndexConfig config) {
    ScoreCache cache = new ScoreCache(config.cacheCapacity());
    VerbTaxonomy taxonomy = new VerbTaxonomy(config.customVerbs());
    return new BuildPipeline(
        new LexicalProfiler(config.minTokenLength()),
        new BudgetPlanner(config.budget()),
        ComparisonPlanner.withDefaults(config.budget()),
        cache,
        new SimilarityScorer(config.scoring(), cache),
        new ActionTriggerExtractor(config.triggers(), taxonomy),
        new RelationshipDiscoverer(
            config.relationships(),
            RelationshipRules.forSettings(config.relationships()),
            taxonomy));
  }

  /** A service over the given element source, sharing this context's pipeline and lease manager. */
  public CapabilityIndexService newService(ElementSource source) {
    IndexBuilder builder =
        new IndexBuilder(
            source, pipeline(), leaseManager, codec, indexConfig.buildSettings(), Clock.systemUTC());
    return new CapabilityIndexService(builder, codec);
  }

  /** Execute the mode selected on the command line. Returns a process exit code. */
  public int run(PrintStream out) {
    return switch (startupParameters.mode()) {
      case "build" -> runBuild(out);
      case "query" -> runQuery(out);
      default -> {
        printUsage(out);
        yield 0;
      }
    };
  }

  private int runBuild(PrintStream out) {
    String elements = startupParameters.getOptional("elements").orElseThrow();
    CapabilityIndexService service = newService(new YamlElementSource(Paths.get(elements)));
    CapabilityIndex index = service.rebuild();
    out.print(JacksonUtility.toYaml(index.buildStats()));
    return 0;
  }

  private int runQuery(PrintStream out) {
    CapabilityIndexService service = newService(java.util.List::of);
    if (service.current().isEmpty()) {
      out.println("No index found at " + indexConfig.indexPath());
      return 1;
    }
    Map<String, Object> result = new LinkedHashMap<>();
    startupParameters
        .getOptional("verb")
        .ifPresent(v -> result.put("elements", service.getByActionTrigger(v)));
    startupParameters
        .getOptional("element")
        .ifPresent(
            id -> {
              result.put("relationships", service.getRelationships(id));
              service.getSemanticProfile(id).ifPresent(p -> result.put("profile", p));
              result.put(
                  "connected",
                  service.getConnectedElements(id, TraversalOptions.forNeighbourhood()).keySet());
            });
    if (result.isEmpty()) {
      service.getRelationshipStats().ifPresent(s -> result.put("stats", s));
    }
    out.print(JacksonUtility.toYaml(result));
    return 0;
  }

  private static void printUsage(PrintStream out) {
    out.println("Usage:");
    out.println("  --mode build --elements <elements.yaml> [--index-path <file>]");
    out.println("  --mode query [--element <id>] [--verb <verb>] [--index-path <file>]");
    out.println("  --mode help");
    out.println("Common: --config-file <classpath:name.yaml | file path>");
  }

  public StartupParameters startupParameters() {
    return startupParameters;
  }

  public Configuration configuration() {
    if (configurationProvider == null) {
      throw new StateException("CapIndex not initialized. Call initialize() first.");
    }
    return configurationProvider.config();
  }

  public IndexConfig indexConfig() {
    requireInitialized();
    return indexConfig;
  }

  public BuildPipeline pipeline() {
    requireInitialized();
    return pipeline;
  }

  private void requireInitialized() {
    if (indexConfig == null) {
      throw new StateException("CapIndex not initialized. Call initialize() first.");
    }
  }
}
