package com.flamingo.ai.climatechat.service.rag.search;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/** Flattens markdown tables and literal escape sequences in indexed passages into plain text. */
public final class DocumentContentCleaner {

  private static final Pattern TABLE_SEPARATOR = Pattern.compile("\\|[- |]+\\|");
  private static final Pattern NEWLINES = Pattern.compile("\\n+");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private DocumentContentCleaner() {}

  public static String clean(String content) {
    if (content == null || content.isEmpty()) {
      return "";
    }

    String withoutSeparators = TABLE_SEPARATOR.matcher(content).replaceAll("");

    List<String> lines = new ArrayList<>();
    for (String line : withoutSeparators.split("\n", -1)) {
      lines.add(line.strip().startsWith("|") ? joinTableCells(line) : line);
    }

    String text = String.join("\n", lines);
    text = NEWLINES.matcher(text).replaceAll(" ");
    text = WHITESPACE.matcher(text).replaceAll(" ");

    return text.replace("\\n", " ")
        .replace("\\\"", "\"")
        .replace("\\'", "'")
        .replace("\\_{", "_")
        .replace("\\", "")
        .strip();
  }

  private static String joinTableCells(String row) {
    List<String> cells = new ArrayList<>();
    for (String cell : row.split("\\|")) {
      if (!cell.isBlank()) {
        cells.add(cell.strip());
      }
    }
    return String.join(" ", cells);
  }
}
