package com.flamingo.ai.reportextract.service.batch;

import com.flamingo.ai.reportextract.exception.DocumentExtractionException;
import com.flamingo.ai.reportextract.service.extraction.RecordAssembler;
import com.flamingo.ai.reportextract.service.extraction.model.ExtractedRecord;
import com.flamingo.ai.reportextract.service.extraction.model.ExtractionProfile;
import com.flamingo.ai.reportextract.service.output.CsvRecordWriter;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Runs extraction over a list of documents and writes the results.
 *
 * <p>Documents are extracted on the {@code documentExtractionExecutor} pool. A document that
 * fails is logged with its path, counted, and skipped; the run carries on. Rows are written from
 * the calling thread in input order whatever order the workers finish in.
 */
@Service
@Slf4j
public class BatchExtractionService {

  private final DocumentExtractionService extractionService;
  private final RecordAssembler recordAssembler;
  private final Executor executor;
  private final MeterRegistry meterRegistry;

  public BatchExtractionService(
      DocumentExtractionService extractionService,
      RecordAssembler recordAssembler,
      @Qualifier("documentExtractionExecutor") Executor executor,
      MeterRegistry meterRegistry) {
    this.extractionService = extractionService;
    this.recordAssembler = recordAssembler;
    this.executor = executor;
    this.meterRegistry = meterRegistry;
  }

  /**
   * Extracts every document and writes a header row followed by one row per success.
   *
   * @param documents document paths, in output order
   * @param profile terms to extract
   * @param writer destination; left open
   * @return counts and per-document failures
   * @throws IOException if writing the output fails
   */
  public BatchSummary run(List<Path> documents, ExtractionProfile profile, CsvRecordWriter writer)
      throws IOException {
    log.info("Extracting {} documents with profile '{}'", documents.size(), profile.name());
    writer.writeRow(recordAssembler.headerRow(profile));

    List<CompletableFuture<Outcome>> pending = new ArrayList<>(documents.size());
    for (Path path : documents) {
      pending.add(CompletableFuture.supplyAsync(() -> extractOne(path, profile), executor));
    }

    int succeeded = 0;
    List<BatchSummary.Failure> failures = new ArrayList<>();
    for (CompletableFuture<Outcome> future : pending) {
      Outcome outcome = future.join();
      if (outcome.record() != null) {
        writer.writeRow(recordAssembler.toRow(outcome.record()));
        succeeded++;
      } else {
        failures.add(outcome.failure());
      }
    }
    writer.flush();

    log.info(
        "Extraction finished: {} of {} documents written, {} skipped",
        succeeded,
        documents.size(),
        failures.size());
    return new BatchSummary(documents.size(), succeeded, failures);
  }

  private Outcome extractOne(Path path, ExtractionProfile profile) {
    log.info("Processing file: {}", path);
    try {
      ExtractedRecord record = extractionService.extract(path, profile);
      meterRegistry.counter("document.extraction.success").increment();
      return new Outcome(record, null);
    } catch (DocumentExtractionException e) {
      log.error("{} in file: {}", e.getMessage(), path);
      return failed(path, e.getReason(), e.getMessage());
    } catch (RuntimeException e) {
      log.error("Unexpected failure in file: {}", path, e);
      return failed(path, "unexpected", e.getMessage());
    }
  }

  private Outcome failed(Path path, String reason, String message) {
    meterRegistry.counter("document.extraction.failure", "reason", reason).increment();
    return new Outcome(null, new BatchSummary.Failure(path, reason, message));
  }

  private record Outcome(ExtractedRecord record, BatchSummary.Failure failure) {}
}
