package io.lacuna.weft;

import io.lacuna.bifurcan.*;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads training sequences, one per line. Line terminators are dropped and no stop symbol is appended.
 */
public class Corpus {

  private Corpus() {
  }

  /**
   * @return one sequence per line, each character of the line a symbol
   */
  public static IList<IList<String>> read(Reader reader) throws IOException {
    IList<IList<String>> sequences = new LinearList<>();
    for (String line : lines(reader)) {
      IList<String> symbols = new LinearList<>();
      line.codePoints().forEach(c -> symbols.addLast(new String(Character.toChars(c))));
      sequences.addLast(symbols);
    }
    return sequences;
  }

  public static IList<IList<String>> read(Path path) throws IOException {
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return read(reader);
    }
  }

  /**
   * @return one sequence per line, each whitespace-separated token of the line a symbol
   */
  public static IList<IList<String>> words(Reader reader) throws IOException {
    IList<IList<String>> sequences = new LinearList<>();
    for (String line : lines(reader)) {
      IList<String> symbols = new LinearList<>();
      for (String token : line.trim().split("\\s+")) {
        if (!token.isEmpty()) {
          symbols.addLast(token);
        }
      }
      sequences.addLast(symbols);
    }
    return sequences;
  }

  static IList<String> lines(Reader reader) throws IOException {
    BufferedReader in = reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);
    IList<String> lines = new LinearList<>();
    String line;
    while ((line = in.readLine()) != null) {
      lines.addLast(line);
    }
    return lines;
  }
}
