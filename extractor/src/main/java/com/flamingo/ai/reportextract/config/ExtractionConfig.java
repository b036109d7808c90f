package com.flamingo.ai.reportextract.config;

import com.flamingo.ai.reportextract.service.extraction.model.ExtractionProfile;
import com.flamingo.ai.reportextract.service.extraction.model.Term;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for document extraction. */
@Configuration
@ConfigurationProperties(prefix = "extraction")
@Getter
@Setter
public class ExtractionConfig {

  /** Name of the profile used when the command line does not pick one. */
  private String profile = "moderation";

  private Input input = new Input();
  private Output output = new Output();
  private Scan scan = new Scan();
  private Batch batch = new Batch();
  private Runner runner = new Runner();
  private Map<String, Profile> profiles = new LinkedHashMap<>();

  /** Resolves the configured default profile. */
  public ExtractionProfile activeProfile() {
    return resolveProfile(profile);
  }

  /**
   * Resolves a declared profile into its term lists.
   *
   * @param name profile name under {@code extraction.profiles}
   * @return the profile with its header and section terms in declaration order
   * @throws IllegalArgumentException if no profile with that name is declared
   */
  public ExtractionProfile resolveProfile(String name) {
    Profile declared = profiles.get(name);
    if (declared == null) {
      throw new IllegalArgumentException(
          "Unknown extraction profile '" + name + "', declared: " + profiles.keySet());
    }
    return new ExtractionProfile(
        name, toTerms(declared.getHeaders()), toTerms(declared.getSections()));
  }

  private static List<Term> toTerms(List<TermDefinition> definitions) {
    List<Term> terms = new ArrayList<>(definitions.size());
    for (TermDefinition definition : definitions) {
      terms.add(definition.toTerm());
    }
    return terms;
  }

  @Getter
  @Setter
  public static class Input {
    private String dataDir = "../../data";

    /** Treat the positional input argument as a file listing one document path per line. */
    private boolean listFile = false;

    private List<String> extensions = new ArrayList<>(List.of("docx"));
  }

  @Getter
  @Setter
  public static class Output {
    private String file = "/tmp/out.csv";
  }

  @Getter
  @Setter
  public static class Scan {
    /** A positional scan may take at most this many steps per element it covers. */
    private int boundFactor = 4;

    public void setBoundFactor(int boundFactor) {
      if (boundFactor < 0) {
        throw new IllegalArgumentException(
            "extraction.scan.bound-factor must not be negative: " + boundFactor);
      }
      this.boundFactor = boundFactor;
    }
  }

  @Getter
  @Setter
  public static class Batch {
    private int workers = 1;
    private int queueCapacity = 500;
  }

  @Getter
  @Setter
  public static class Runner {
    private boolean enabled = true;
  }

  @Getter
  @Setter
  public static class Profile {
    private List<TermDefinition> headers = new ArrayList<>();

    /** Section terms in the order they appear in documents. */
    private List<TermDefinition> sections = new ArrayList<>();
  }

  @Getter
  @Setter
  public static class TermDefinition {
    private String main;
    private List<String> aliases = new ArrayList<>();
    private String column;
    private boolean required = false;

    public Term toTerm() {
      return new Term(main, new LinkedHashSet<>(aliases), column, required);
    }
  }
}
