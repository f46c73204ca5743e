package dev.regula.retrieval.fulltext;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Builds PostgreSQL {@code to_tsquery} expressions from keyword lists.
 *
 * <p>Keywords are reduced to letters and digits so that no user input reaches the tsquery parser
 * as an operator. Slash-separated alternatives become an OR group ({@code gst/hst} becomes {@code
 * (gst | hst)}) and hyphenated or multi-word terms become phrases ({@code self <-> employed}).
 */
public final class TsQueryBuilder {

  private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}]+");

  private TsQueryBuilder() {
    // static utility
  }

  /** Every keyword must match: {@code a & (b | c) & d}. Empty if no keyword survives. */
  public static String allOf(List<String> keywords) {
    return join(keywords, " & ");
  }

  /** Any keyword may match: {@code a | (b | c) | d}. Empty if no keyword survives. */
  public static String anyOf(List<String> keywords) {
    return join(keywords, " | ");
  }

  private static String join(List<String> keywords, String operator) {
    List<String> groups = new ArrayList<>();
    for (String keyword : keywords) {
      String group = toGroup(keyword);
      if (!group.isEmpty() && !groups.contains(group)) {
        groups.add(group);
      }
    }
    return String.join(operator, groups);
  }

  static String toGroup(String keyword) {
    List<String> alternatives = new ArrayList<>();
    for (String alternative : keyword.toLowerCase(Locale.ROOT).split("/")) {
      String phrase = toPhrase(alternative);
      if (!phrase.isEmpty()) {
        alternatives.add(phrase);
      }
    }
    if (alternatives.size() > 1) {
      return "(" + String.join(" | ", alternatives) + ")";
    }
    return alternatives.isEmpty() ? "" : alternatives.get(0);
  }

  private static String toPhrase(String text) {
    List<String> words = new ArrayList<>();
    for (String word : NON_WORD.split(text)) {
      if (word.length() >= 2) {
        words.add(word);
      }
    }
    if (words.size() > 1) {
      return "(" + String.join(" <-> ", words) + ")";
    }
    return words.isEmpty() ? "" : words.get(0);
  }
}
