package io.lacuna.weft;

import io.lacuna.bifurcan.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;

/**
 * Edit distance between sequences, and the error rate of hypotheses against references. Independent of the
 * automaton classes.
 */
public class ErrorRate {

  private static final Logger LOG = LoggerFactory.getLogger(ErrorRate.class);

  private ErrorRate() {
  }

  /**
   * @return the Levenshtein distance between {@code ref} and {@code hyp}, counting insertions, deletions, and
   * substitutions as one edit each
   */
  public static <V> int distance(IList<V> ref, IList<V> hyp) {
    int m = (int) ref.size();
    int n = (int) hyp.size();

    // d[i][j] is the distance between the first i symbols of ref and the first j symbols of hyp
    int[][] d = new int[m + 1][n + 1];
    for (int i = 0; i <= m; i++) {
      d[i][0] = i;
    }
    for (int j = 0; j <= n; j++) {
      d[0][j] = j;
    }

    for (int i = 1; i <= m; i++) {
      for (int j = 1; j <= n; j++) {
        int substitution = d[i - 1][j - 1] + (ref.nth(i - 1).equals(hyp.nth(j - 1)) ? 0 : 1);
        int deletion = d[i - 1][j] + 1;
        int insertion = d[i][j - 1] + 1;
        d[i][j] = Math.min(substitution, Math.min(deletion, insertion));
      }
    }
    return d[m][n];
  }

  public static int distance(String ref, String hyp) {
    return distance(codePoints(ref), codePoints(hyp));
  }

  /**
   * @param refs the reference strings
   * @param hyps the hypothesis strings, aligned with {@code refs}
   * @return the total edit distance over all pairs, divided by the total length of the references
   */
  public static double rate(IList<String> refs, IList<String> hyps) {
    if (refs.size() != hyps.size()) {
      throw new IllegalArgumentException("expected the same number of references and hypotheses, got "
              + refs.size() + " and " + hyps.size());
    }

    long edits = 0;
    long length = 0;
    for (long i = 0; i < refs.size(); i++) {
      IList<Integer> ref = codePoints(refs.nth(i));
      edits += distance(ref, codePoints(hyps.nth(i)));
      length += ref.size();
    }
    if (length == 0) {
      throw new IllegalArgumentException("references are empty");
    }
    return (double) edits / length;
  }

  private static IList<Integer> codePoints(String s) {
    IList<Integer> result = new LinearList<>();
    s.codePoints().forEach(result::addLast);
    return result;
  }

  /**
   * Prints the error rate of a file of hypotheses against a file of references, one per line.
   */
  public static void main(String[] args) throws IOException {
    if (args.length != 2) {
      System.err.println("usage: ErrorRate <reference> <hypothesis>");
      System.exit(1);
    }

    IList<String> refs = lines(args[0]);
    IList<String> hyps = lines(args[1]);
    if (refs.size() != hyps.size()) {
      LOG.error("{} has {} lines but {} has {}", args[0], refs.size(), args[1], hyps.size());
      System.exit(1);
    }

    System.out.println(rate(refs, hyps));
  }

  private static IList<String> lines(String path) throws IOException {
    try (Reader reader = Files.newBufferedReader(Paths.get(path), StandardCharsets.UTF_8)) {
      return Corpus.lines(reader);
    }
  }
}
