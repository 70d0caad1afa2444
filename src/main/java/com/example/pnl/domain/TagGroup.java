package com.example.pnl.domain;

import java.util.List;

/**
 * Reporting unit formed by every customer whose parent district carries the same sorted tag set.
 *
 * @param key sorted tags joined with ","
 * @param label display label derived from the tags
 * @param tags the sorted tags
 * @param members member customers, in input order
 */
public record TagGroup(String key, String label, List<String> tags, List<Facility> members) {

  public TagGroup {
    tags = List.copyOf(tags);
    members = List.copyOf(members);
  }
}
