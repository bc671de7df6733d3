package io.intellixity.optimade.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.intellixity.optimade.filter.FilterSyntaxException;
import io.intellixity.optimade.filter.InvalidFilterException;
import io.intellixity.optimade.filter.UnknownGrammarVersionException;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * {@code optimade-get}: runs one filter against several providers and prints the merged results
 * as JSON, shaped {@code {endpoint: {filter: {baseUrl: results}}}}.
 * <p>
 * Exit codes: 0 on success, 1 when any provider failed, 2 for an invalid filter or bad usage.
 */
@Command(name = "optimade-get",
    mixinStandardHelpOptions = true,
    exitCodeOnInvalidInput = OptimadeClientCli.EXIT_USAGE,
    version = "optimade-get 0.1.0",
    description = "Query one or more OPTIMADE APIs with the same filter.")
public final class OptimadeClientCli implements Callable<Integer> {
  static final int EXIT_OK = 0;
  static final int EXIT_PROVIDER_FAILED = 1;
  static final int EXIT_USAGE = 2;

  @Spec
  private CommandSpec spec;

  @Option(names = "--filter", defaultValue = "", description = "OPTIMADE filter; empty selects everything.")
  private String filter;

  @Option(names = "--base-url", required = true, description = "Provider base URL; repeat for several providers.")
  private List<String> baseUrls;

  @Option(names = "--endpoint", defaultValue = "structures", description = "Entry endpoint (default: ${DEFAULT-VALUE}).")
  private String endpoint;

  @Option(names = "--response-fields", split = ",", description = "Comma-separated response fields.")
  private List<String> responseFields;

  @Option(names = "--sort", description = "Sort parameter passed through to the providers.")
  private String sort;

  @Option(names = "--max-results-per-provider", defaultValue = "1000",
      description = "Stop paginating a provider after this many results; 0 for no cap (default: ${DEFAULT-VALUE}).")
  private int maxResultsPerProvider;

  @Option(names = "--max-attempts", defaultValue = "5", description = "Attempts per page on HTTP 429 (default: ${DEFAULT-VALUE}).")
  private int maxAttempts;

  @Option(names = "--retry-delay-ms", defaultValue = "1000", description = "Wait between 429 retries (default: ${DEFAULT-VALUE}).")
  private long retryDelayMs;

  @Option(names = "--sync", description = "Query providers one after the other.")
  private boolean sync;

  @Option(names = "--count", description = "Only count the results per provider.")
  private boolean count;

  @Option(names = "--pretty-print", description = "Indent the JSON output.")
  private boolean pretty;

  public static void main(String[] args) {
    System.exit(commandLine().execute(args));
  }

  static CommandLine commandLine() {
    return new CommandLine(new OptimadeClientCli());
  }

  @Override
  public Integer call() throws JsonProcessingException {
    ClientSettings settings;
    try {
      settings = ClientSettings.defaults()
          .withMaxResultsPerProvider(maxResultsPerProvider)
          .withRetries(maxAttempts, Duration.ofMillis(retryDelayMs))
          .withAsync(!sync);
    } catch (IllegalArgumentException e) {
      spec.commandLine().getErr().println("Invalid option: " + e.getMessage());
      return EXIT_USAGE;
    }

    try (OptimadeClient client = new OptimadeClient(baseUrls, settings)) {
      ObjectMapper mapper = client.mapper();
      ObjectNode perProvider = mapper.createObjectNode();
      boolean failed = false;

      if (count) {
        for (Map.Entry<String, CountResult> e : client.count(filter, endpoint).entrySet()) {
          CountResult r = e.getValue();
          if (r.ok()) {
            perProvider.put(e.getKey(), r.count());
          } else {
            perProvider.putNull(e.getKey());
            failed = true;
            r.errors().forEach(msg -> spec.commandLine().getErr().println(e.getKey() + ": " + msg));
          }
        }
      } else {
        for (Map.Entry<String, QueryResults> e : client.get(filter, endpoint, responseFields, sort).entrySet()) {
          perProvider.set(e.getKey(), e.getValue().toJson(mapper));
          failed |= e.getValue().failed();
        }
      }

      ObjectNode root = mapper.createObjectNode();
      root.putObject(endpoint).set(filter, perProvider);
      String json = pretty ? mapper.writerWithDefaultPrettyPrinter().writeValueAsString(root) : mapper.writeValueAsString(root);
      spec.commandLine().getOut().println(json);
      spec.commandLine().getOut().flush();
      return failed ? EXIT_PROVIDER_FAILED : EXIT_OK;
    } catch (FilterSyntaxException | InvalidFilterException | UnknownGrammarVersionException e) {
      spec.commandLine().getErr().println("Filter " + quoted(filter) + " is not a valid OPTIMADE filter: " + e.getMessage());
      return EXIT_USAGE;
    } catch (IllegalArgumentException e) {
      spec.commandLine().getErr().println("Invalid option: " + e.getMessage());
      return EXIT_USAGE;
    }
  }

  private static String quoted(String s) {
    return "'" + s + "'";
  }
}
