package dev.shortlist.search;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/** Lower-cases text and splits it on whitespace and punctuation. */
final class Tokenizer {

  private static final Pattern SEPARATORS = Pattern.compile("[\\s\\p{Punct}]+");

  private Tokenizer() {}

  static List<String> tokenize(String text) {
    if (text == null || text.isBlank()) {
      return List.of();
    }
    String[] parts = SEPARATORS.split(text.toLowerCase(Locale.ROOT));
    List<String> tokens = new ArrayList<>(parts.length);
    for (String part : parts) {
      if (!part.isEmpty()) {
        tokens.add(part);
      }
    }
    return tokens;
  }
}
