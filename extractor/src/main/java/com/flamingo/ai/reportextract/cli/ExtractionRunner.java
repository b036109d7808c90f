package com.flamingo.ai.reportextract.cli;

import com.flamingo.ai.reportextract.config.ExtractionConfig;
import com.flamingo.ai.reportextract.service.batch.BatchExtractionService;
import com.flamingo.ai.reportextract.service.batch.BatchSummary;
import com.flamingo.ai.reportextract.service.document.DocumentSource;
import com.flamingo.ai.reportextract.service.extraction.model.ExtractionProfile;
import com.flamingo.ai.reportextract.service.output.CsvRecordWriter;
import java.nio.file.Path;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Command-line entry: {@code report-extractor [dataDir] [outputFile] [--list] [--profile=name]}.
 *
 * <p>{@code dataDir} is a directory to search for documents or, with {@code --list}, a file
 * listing one document path per line. Missing arguments fall back to {@code extraction.input.*},
 * {@code extraction.output.file} and {@code extraction.profile}.
 */
@Component
@ConditionalOnProperty(
    name = "extraction.runner.enabled",
    havingValue = "true",
    matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class ExtractionRunner implements ApplicationRunner {

  static final String LIST_OPTION = "list";
  static final String PROFILE_OPTION = "profile";

  private final ExtractionConfig extractionConfig;
  private final DocumentSource documentSource;
  private final BatchExtractionService batchExtractionService;

  @Override
  public void run(ApplicationArguments args) throws Exception {
    List<String> positional = args.getNonOptionArgs();
    Path input =
        Path.of(
            positional.size() > 0 ? positional.get(0) : extractionConfig.getInput().getDataDir());
    Path output =
        Path.of(
            positional.size() > 1 ? positional.get(1) : extractionConfig.getOutput().getFile());
    boolean listFile =
        args.containsOption(LIST_OPTION) || extractionConfig.getInput().isListFile();
    ExtractionProfile profile = extractionConfig.resolveProfile(profileName(args));

    List<Path> documents =
        listFile ? documentSource.readList(input) : documentSource.collect(input);

    BatchSummary summary;
    try (CsvRecordWriter writer = CsvRecordWriter.open(output)) {
      summary = batchExtractionService.run(documents, profile, writer);
    }
    log.info(
        "Wrote {} rows to {} ({} documents skipped)",
        summary.succeeded(),
        output,
        summary.failures().size());
    summary.failures().forEach(f -> log.warn("Skipped {}: {}", f.path(), f.reason()));
  }

  private String profileName(ApplicationArguments args) {
    List<String> values = args.getOptionValues(PROFILE_OPTION);
    if (values == null || values.isEmpty() || values.get(0).isBlank()) {
      return extractionConfig.getProfile();
    }
    return values.get(0);
  }
}
