package com.flamingo.ai.reportextract.service.extraction.model;

import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * A label descriptor with one canonical spelling and any number of recognised aliases.
 *
 * <p>Document authors retype labels with different capitalisation, add or drop trailing colons,
 * and insert or collapse whitespace, but they do not reorder words. Matching therefore runs in
 * three tiers, always in this order:
 *
 * <ol>
 *   <li>{@link #matchesExact}: the trimmed text equals an alias
 *   <li>{@link #matchesNormalized}: both sides equal after {@link #normalize}
 *   <li>{@link #startsWith}: the label, a colon and its value share one paragraph or cell
 * </ol>
 *
 * <p>Exact matching must come first: some labels are legitimate substrings of unrelated narrative
 * sentences.
 *
 * @param main canonical label, also used as the positional key inside a header table
 * @param aliases every recognised spelling; always contains {@code main}
 * @param column column name written to the output file
 * @param required whether the document is considered incomplete without a value for this term
 */
public record Term(String main, Set<String> aliases, String column, boolean required) {

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  public Term {
    if (main == null || main.isBlank()) {
      throw new IllegalArgumentException("Term main label must not be blank");
    }
    LinkedHashSet<String> all = new LinkedHashSet<>();
    all.add(main);
    if (aliases != null) {
      aliases.stream().filter(a -> a != null && !a.isEmpty()).forEach(all::add);
    }
    aliases = Set.copyOf(all);
    column = column == null || column.isBlank() ? main : column;
  }

  /** Creates an optional term whose column name is its canonical label. */
  public static Term of(String main, String... aliases) {
    return new Term(main, new LinkedHashSet<>(Arrays.asList(aliases)), main, false);
  }

  /** Returns a copy of this term written under a different output column. */
  public Term withColumn(String newColumn) {
    return new Term(main, aliases, newColumn, required);
  }

  /** Returns a copy of this term flagged as required. */
  public Term asRequired() {
    return new Term(main, aliases, column, true);
  }

  public boolean matchesExact(String text) {
    return text != null && aliases.contains(text.trim());
  }

  public boolean matchesNormalized(String text) {
    if (text == null) {
      return false;
    }
    String normalized = normalize(text);
    if (normalized.isEmpty()) {
      return false;
    }
    return aliases.stream().anyMatch(alias -> normalize(alias).equals(normalized));
  }

  /** Exact match first, then normalized match. */
  public boolean matches(String text) {
    return matchesExact(text) || matchesNormalized(text);
  }

  /**
   * Whether {@code text} has the "label: value" form for this term: it starts with an alias and a
   * colon follows, possibly after whitespace. "Subject Advisor" and "CONCLUSIONS drawn" do not.
   */
  public boolean startsWith(String text) {
    return longestPrefixAlias(text).isPresent();
  }

  /**
   * Recovers the value portion of a "label: value" text.
   *
   * <p>Removes the longest alias the trimmed text starts with in "label: value" form (or, failing
   * that, the first alias occurrence anywhere), then one leading colon and the surrounding
   * whitespace.
   *
   * @param text text holding both the label and its value
   * @return the value portion, possibly empty
   */
  public String strip(String text) {
    if (text == null) {
      return "";
    }
    String trimmed = text.trim();
    String remainder =
        longestPrefixAlias(trimmed)
            .map(alias -> trimmed.substring(alias.length()))
            .orElseGet(() -> removeFirstOccurrence(trimmed));
    remainder = remainder.trim();
    if (remainder.startsWith(":")) {
      remainder = remainder.substring(1).trim();
    }
    return remainder;
  }

  private Optional<String> longestPrefixAlias(String text) {
    if (text == null) {
      return Optional.empty();
    }
    String trimmed = text.trim();
    return aliases.stream()
        .filter(alias -> trimmed.startsWith(alias) && followedByColon(alias, trimmed))
        .max(Comparator.comparingInt(String::length));
  }

  /** The label part of "label: value" ends in a colon, either inside the alias or right after. */
  private static boolean followedByColon(String alias, String text) {
    return alias.endsWith(":") || text.substring(alias.length()).stripLeading().startsWith(":");
  }

  private String removeFirstOccurrence(String text) {
    return aliases.stream()
        .sorted(Comparator.comparingInt(String::length).reversed())
        .filter(text::contains)
        .findFirst()
        .map(alias -> text.replaceFirst(Pattern.quote(alias), ""))
        .orElse(text);
  }

  /**
   * Deep-match form of a label: non-breaking spaces treated as spaces, lower-cased, colons and
   * all whitespace removed.
   */
  public static String normalize(String text) {
    if (text == null) {
      return "";
    }
    String lower = text.replace('\u00A0', ' ').toLowerCase(Locale.ROOT).replace(":", "");
    return WHITESPACE.matcher(lower).replaceAll("");
  }

  @Override
  public String toString() {
    return main;
  }
}
