package com.gentoro.ragmcp.ingestion;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Splits text on an ordered list of separators, trying the coarsest separator first and recursing
 * into pieces that are still too long with the remaining ones. Adjacent pieces are merged back
 * into chunks of at most {@code chunkSize} characters, and consecutive chunks share up to {@code
 * chunkOverlap} characters of trailing pieces.
 *
 * <p>A piece longer than {@code chunkSize} that none of the separators can break is emitted as is.
 * Add {@code ""} as the last separator to force a character-level split.
 */
public class RecursiveTextSplitter {

  private final int chunkSize;
  private final int chunkOverlap;
  private final List<String> separators;

  public RecursiveTextSplitter(int chunkSize, int chunkOverlap, List<String> separators) {
    if (chunkSize <= 0) {
      throw new IllegalArgumentException("chunkSize must be > 0 (was " + chunkSize + ")");
    }
    if (chunkOverlap < 0 || chunkOverlap >= chunkSize) {
      throw new IllegalArgumentException(
          "chunkOverlap must be in [0, chunkSize) (was " + chunkOverlap + ")");
    }
    if (separators == null || separators.isEmpty()) {
      throw new IllegalArgumentException("At least one separator is required");
    }
    this.chunkSize = chunkSize;
    this.chunkOverlap = chunkOverlap;
    this.separators = List.copyOf(separators);
  }

  /** Chunks of one document, numbered from 0 in document order. */
  public List<Chunk> chunk(SourceDocument document) {
    List<String> pieces = split(document.text());
    List<Chunk> chunks = new ArrayList<>(pieces.size());
    for (int i = 0; i < pieces.size(); i++) {
      String text = pieces.get(i);
      chunks.add(
          new Chunk(
              document.resourceName(),
              document.sourcePath(),
              i,
              text,
              embeddingText(document.sourcePath(), text)));
    }
    return chunks;
  }

  // The source path is part of the embedded text so file names contribute to similarity.
  static String embeddingText(String sourcePath, String text) {
    return sourcePath + "\n\n" + text;
  }

  public List<String> split(String text) {
    if (text == null || text.isBlank()) return List.of();
    return split(text, separators);
  }

  private List<String> split(String text, List<String> seps) {
    String separator = seps.get(seps.size() - 1);
    List<String> remaining = List.of();
    for (int i = 0; i < seps.size(); i++) {
      String s = seps.get(i);
      if (s.isEmpty()) {
        separator = s;
        break;
      }
      if (text.contains(s)) {
        separator = s;
        remaining = seps.subList(i + 1, seps.size());
        break;
      }
    }

    List<String> chunks = new ArrayList<>();
    List<String> fitting = new ArrayList<>();
    for (String piece : splitOn(text, separator)) {
      if (piece.length() < chunkSize) {
        fitting.add(piece);
        continue;
      }
      if (!fitting.isEmpty()) {
        chunks.addAll(merge(fitting, separator));
        fitting.clear();
      }
      if (remaining.isEmpty()) {
        String trimmed = piece.strip();
        if (!trimmed.isEmpty()) chunks.add(trimmed);
      } else {
        chunks.addAll(split(piece, remaining));
      }
    }
    if (!fitting.isEmpty()) {
      chunks.addAll(merge(fitting, separator));
    }
    return chunks;
  }

  private static List<String> splitOn(String text, String separator) {
    List<String> out = new ArrayList<>();
    if (separator.isEmpty()) {
      for (int i = 0; i < text.length(); i++) {
        out.add(String.valueOf(text.charAt(i)));
      }
      return out;
    }
    int from = 0;
    int idx;
    while ((idx = text.indexOf(separator, from)) >= 0) {
      if (idx > from) out.add(text.substring(from, idx));
      from = idx + separator.length();
    }
    if (from < text.length()) out.add(text.substring(from));
    return out;
  }

  private List<String> merge(List<String> pieces, String separator) {
    int sepLen = separator.length();
    List<String> chunks = new ArrayList<>();
    Deque<String> window = new ArrayDeque<>();
    int total = 0;
    for (String piece : pieces) {
      int len = piece.length();
      if (total + len + (window.isEmpty() ? 0 : sepLen) > chunkSize && !window.isEmpty()) {
        addJoined(chunks, window, separator);
        // drop leading pieces until only the overlap remains and the next piece fits
        while (total > chunkOverlap
            || (total > 0 && total + len + (window.isEmpty() ? 0 : sepLen) > chunkSize)) {
          String head = window.pollFirst();
          if (head == null) break;
          total -= head.length() + (window.isEmpty() ? 0 : sepLen);
        }
      }
      window.addLast(piece);
      total += len + (window.size() > 1 ? sepLen : 0);
    }
    addJoined(chunks, window, separator);
    return chunks;
  }

  private static void addJoined(List<String> out, Deque<String> window, String separator) {
    String joined = String.join(separator, window).strip();
    if (!joined.isEmpty()) out.add(joined);
  }
}
