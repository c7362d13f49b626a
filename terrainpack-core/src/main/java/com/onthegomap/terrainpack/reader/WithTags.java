package com.onthegomap.terrainpack.reader;

import java.util.Map;

/** An input element with a set of string key/value pairs. */
public interface WithTags {

  static WithTags from(Map<String, String> tags) {
    return new OfMap(Map.copyOf(tags));
  }

  /** The key/value pairs on this element. */
  Map<String, String> tags();

  default String getString(String key) {
    return tags().get(key);
  }

  default String getString(String key, String defaultValue) {
    String value = tags().get(key);
    return value == null ? defaultValue : value;
  }

  default boolean hasTag(String key) {
    return tags().containsKey(key);
  }

  default boolean hasTag(String key, String value) {
    return value.equals(tags().get(key));
  }

  /** Returns true if the value for {@code key} is equal to any one of the values. */
  default boolean hasTag(String key, String value1, String... others) {
    String actual = tags().get(key);
    if (actual == null) {
      return false;
    } else if (actual.equals(value1)) {
      return true;
    }
    for (String other : others) {
      if (actual.equals(other)) {
        return true;
      }
    }
    return false;
  }

  record OfMap(@Override Map<String, String> tags) implements WithTags {}
}
