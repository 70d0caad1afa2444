package com.example.pnl.domain;

import java.util.List;

/**
 * A district node of the customer configuration.
 *
 * <p>{@code reportingExcluded} only suppresses the district's own standalone report. Its
 * customers still take part in tag-based groups.
 */
public record District(
    String id, String label, List<String> tags, boolean reportingExcluded, boolean displayExcluded) {

  public District {
    tags = tags == null ? List.of() : List.copyOf(tags);
  }

  public boolean hasTag(String tag) {
    return tags.contains(tag);
  }
}
