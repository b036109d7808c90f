package com.flamingo.ai.reportextract.service.document;

import com.flamingo.ai.reportextract.config.ExtractionConfig;
import com.flamingo.ai.reportextract.exception.NoDocumentsFoundException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Collects the document paths for one run. */
@Component
@RequiredArgsConstructor
@Slf4j
public class DocumentSource {

  private final ExtractionConfig extractionConfig;

  /**
   * Recursively collects regular files under {@code dataDir} whose extension is one of {@code
   * extraction.input.extensions}, sorted by path. Office lock files ({@code ~$…}) are skipped.
   *
   * @param dataDir root directory
   * @return document paths
   * @throws NoDocumentsFoundException if {@code dataDir} is not a directory or no document matches
   * @throws UncheckedIOException if the directory cannot be walked
   */
  public List<Path> collect(Path dataDir) {
    if (!Files.isDirectory(dataDir)) {
      throw new NoDocumentsFoundException(dataDir.toAbsolutePath().toString());
    }
    List<String> extensions =
        extractionConfig.getInput().getExtensions().stream()
            .map(ext -> "." + ext.toLowerCase(Locale.ROOT))
            .toList();
    List<Path> documents;
    try (Stream<Path> walk = Files.walk(dataDir)) {
      documents =
          walk.filter(Files::isRegularFile)
              .filter(p -> !p.getFileName().toString().startsWith("~$"))
              .filter(
                  p -> {
                    String name = p.getFileName().toString().toLowerCase(Locale.ROOT);
                    return extensions.stream().anyMatch(name::endsWith);
                  })
              .sorted()
              .toList();
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot walk " + dataDir, e);
    }
    if (documents.isEmpty()) {
      throw new NoDocumentsFoundException(dataDir.toAbsolutePath().toString());
    }
    log.info("Found {} documents under {}", documents.size(), dataDir);
    return documents;
  }

  /**
   * Reads a list file holding one document path per line. Blank lines are ignored; paths are
   * taken as written.
   *
   * @param listFile the list file
   * @return document paths in file order
   * @throws NoDocumentsFoundException if the file lists no paths
   * @throws UncheckedIOException if the file cannot be read
   */
  public List<Path> readList(Path listFile) {
    List<Path> documents;
    try (Stream<String> lines = Files.lines(listFile)) {
      documents = lines.map(String::trim).filter(line -> !line.isEmpty()).map(Path::of).toList();
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot read list file " + listFile, e);
    }
    if (documents.isEmpty()) {
      throw new NoDocumentsFoundException(listFile.toAbsolutePath().toString());
    }
    log.info("Read {} document paths from {}", documents.size(), listFile);
    return documents;
  }
}
