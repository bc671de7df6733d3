package io.intellixity.optimade.examples.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.optimade.entry.CollectionSettings;
import io.intellixity.optimade.entry.EntryCollection;
import io.intellixity.optimade.filter.compile.FilterCompiler;
import io.intellixity.optimade.filter.parse.FilterParser;
import io.intellixity.optimade.filter.parse.GrammarRegistry;
import io.intellixity.optimade.filter.parse.GrammarVersion;
import io.intellixity.optimade.filter.transform.FieldAliases;
import io.intellixity.optimade.memory.InMemoryEntryCollection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Configuration
@EnableConfigurationProperties(OptimadeProperties.class)
public class OptimadeExampleConfig {
  private static final Logger log = LoggerFactory.getLogger(OptimadeExampleConfig.class);

  public static final String STRUCTURES = "structures";

  @Bean
  public GrammarRegistry grammarRegistry() {
    return GrammarRegistry.discover();
  }

  @Bean
  public FilterCompiler filterCompiler(GrammarRegistry registry, OptimadeProperties props) {
    String tag = props.getGrammarVersion();
    FilterParser parser = (tag == null || tag.isBlank())
        ? new FilterParser(registry)
        : new FilterParser(registry, GrammarVersion.parse(tag));
    log.info("optimade.examples grammar={}", parser.version());
    return new FilterCompiler(parser);
  }

  @Bean
  public FieldAliases structureAliases(OptimadeProperties props) {
    OptimadeProperties.Structures s = props.getStructures();
    return new FieldAliases(s.getAliases(), s.getLengthAliases());
  }

  @Bean
  public CollectionSettings structureSettings(OptimadeProperties props) {
    OptimadeProperties.Structures s = props.getStructures();
    return new CollectionSettings(s.getPageLimit(), s.getPageLimitMax(), s.getStrictness(),
        s.getProviderPrefix(), Set.copyOf(s.getKnownFields()), s.getCountTimeout());
  }

  @Bean
  public EntryCollection structuresCollection(ObjectMapper json,
                                              FilterCompiler compiler,
                                              FieldAliases structureAliases,
                                              CollectionSettings structureSettings,
                                              OptimadeProperties props) throws IOException {
    List<Map<String, Object>> documents = loadFixture(json, props.getStructures().getFixture());
    return new InMemoryEntryCollection(STRUCTURES, documents, compiler, structureAliases, structureSettings);
  }

  private static List<Map<String, Object>> loadFixture(ObjectMapper json, String location) throws IOException {
    ClassPathResource resource = new ClassPathResource(location);
    if (!resource.exists()) throw new IllegalStateException("Fixture not found on classpath: " + location);
    try (InputStream in = resource.getInputStream()) {
      return json.readValue(in, new TypeReference<List<Map<String, Object>>>() {});
    }
  }
}
