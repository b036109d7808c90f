package com.flamingo.ai.reportextract.service.document;

import com.flamingo.ai.reportextract.exception.DocumentReadException;
import com.flamingo.ai.reportextract.service.parsing.DocumentParserRouter;
import com.flamingo.ai.reportextract.service.parsing.model.ContentNode;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.tika.Tika;

/**
 * One document moving through {@code UNLOADED → LOADED → PARSED}.
 *
 * <ul>
 *   <li>{@link #load()} reads the file and detects its MIME type.
 *   <li>{@link #parse(DocumentParserRouter)} turns the bytes into a content tree.
 *   <li>{@link #release()} (or {@link #close()}) drops everything and returns to {@code UNLOADED}
 *       from any state.
 * </ul>
 *
 * <p>Calling an operation from the wrong state throws {@link IllegalStateException}. Meant for
 * try-with-resources so buffers are released on every exit path. Not thread-safe.
 */
@Slf4j
public class DocumentHandle implements AutoCloseable {

  /** Lifecycle state of a handle. */
  public enum State {
    UNLOADED,
    LOADED,
    PARSED
  }

  private static final Tika TIKA = new Tika();

  private final Path path;
  private State state = State.UNLOADED;
  private byte[] bytes;
  private String mimeType;
  private List<ContentNode> contentTree;

  public DocumentHandle(Path path) {
    this.path = path;
  }

  /**
   * Reads the document into memory and detects its MIME type.
   *
   * @return this handle, now {@code LOADED}
   * @throws DocumentReadException if the file cannot be read
   */
  public DocumentHandle load() {
    requireState(State.UNLOADED, "load");
    try {
      bytes = Files.readAllBytes(path);
    } catch (IOException e) {
      throw new DocumentReadException("Cannot read " + path + ": " + e.getMessage(), e);
    }
    mimeType = TIKA.detect(bytes, path.getFileName().toString());
    state = State.LOADED;
    log.debug("Loaded {} ({} bytes, {})", path, bytes.length, mimeType);
    return this;
  }

  /**
   * Parses the loaded bytes with the parser routed for the detected MIME type.
   *
   * @param router parser router
   * @return the content tree; the handle is now {@code PARSED}
   * @throws DocumentReadException if no parser supports the document or parsing fails
   */
  public List<ContentNode> parse(DocumentParserRouter router) {
    requireState(State.LOADED, "parse");
    contentTree = router.route(mimeType).parse(new ByteArrayInputStream(bytes), mimeType);
    bytes = null;
    state = State.PARSED;
    return contentTree;
  }

  public List<ContentNode> getContentTree() {
    requireState(State.PARSED, "getContentTree");
    return contentTree;
  }

  public String getMimeType() {
    if (state == State.UNLOADED) {
      throw new IllegalStateException("Document " + path + " is not loaded");
    }
    return mimeType;
  }

  /** Drops all buffers and returns the handle to {@code UNLOADED}. Safe to call repeatedly. */
  public void release() {
    bytes = null;
    mimeType = null;
    contentTree = null;
    state = State.UNLOADED;
  }

  @Override
  public void close() {
    release();
  }

  public Path getPath() {
    return path;
  }

  public State getState() {
    return state;
  }

  private void requireState(State expected, String operation) {
    if (state != expected) {
      throw new IllegalStateException(
          "Cannot " + operation + " document " + path + " in state " + state
              + ", expected " + expected);
    }
  }
}
