package com.example.pnl.service;

import com.example.pnl.domain.SelectableItem;

/**
 * A parsed picker value. Accepted forms are {@code tag_<tag>}, {@code <id> - <label>} and a plain
 * {@code <id>}.
 *
 * @param id node id, null for a tag
 * @param label label given after the id, may be null
 * @param tag the tag for tag selections, null otherwise
 */
public record ReportSelector(String id, String label, String tag) {

  private static final String ID_SEPARATOR = " - ";

  public static ReportSelector parse(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("Selector is required");
    }
    String value = raw.trim();
    if (value.startsWith(SelectableItem.TAG_PREFIX)) {
      String tag = value.substring(SelectableItem.TAG_PREFIX.length());
      if (tag.isBlank()) {
        throw new IllegalArgumentException("Tag selector has no tag: " + raw);
      }
      return new ReportSelector(null, null, tag);
    }
    int separator = value.indexOf(ID_SEPARATOR);
    if (separator > 0) {
      return new ReportSelector(
          value.substring(0, separator).trim(),
          value.substring(separator + ID_SEPARATOR.length()).trim(),
          null);
    }
    return new ReportSelector(value, null, null);
  }

  public boolean isTag() {
    return tag != null;
  }
}
