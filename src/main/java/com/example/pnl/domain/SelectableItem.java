package com.example.pnl.domain;

/** An entry of a hierarchy picker: a concrete node or a tag (id prefixed with "tag_"). */
public record SelectableItem(String id, String label, String type) {

  public static final String TAG_TYPE = "tag";
  public static final String TAG_PREFIX = "tag_";

  public static SelectableItem tag(String tag) {
    return new SelectableItem(TAG_PREFIX + tag, tag, TAG_TYPE);
  }
}
