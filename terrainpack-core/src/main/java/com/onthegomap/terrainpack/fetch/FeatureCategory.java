package com.onthegomap.terrainpack.fetch;

import com.onthegomap.terrainpack.config.ValidationException;
import java.util.Arrays;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * A kind of map feature that an export can request, with the Overpass QL statements that select it and an estimate of
 * how many nodes it contributes per square kilometer in a typical urban area.
 */
public enum FeatureCategory {
  ROADS("roads", 500, "way[\"highway\"]"),
  BUILDINGS("buildings", 2000, "way[\"building\"]", "relation[\"building\"]"),
  RAILWAYS("railways", 100, "way[\"railway\"]"),
  POWER_LINES("power_lines", 300,
    "way[\"power\"=\"line\"]", "node[\"power\"=\"tower\"]", "node[\"power\"=\"pole\"]"),
  WATER("water", 200, "way[\"natural\"=\"water\"]", "way[\"waterway\"]", "relation[\"natural\"=\"water\"]"),
  POI("poi", 500, "node[\"amenity\"]", "way[\"amenity\"]"),
  STREET_FURNITURE("street_furniture", 1000,
    "node[\"highway\"=\"street_lamp\"]", "node[\"amenity\"=\"bench\"]", "node[\"amenity\"=\"waste_basket\"]",
    "node[\"highway\"=\"traffic_signals\"]"),
  LANDUSE("landuse", 300, "way[\"landuse\"]", "relation[\"landuse\"]"),
  NATURAL("natural", 200, "way[\"natural\"]", "relation[\"natural\"]"),
  BARRIERS("barriers", 400, "way[\"barrier\"]", "node[\"barrier\"]");

  private final String id;
  private final double defaultDensity;
  private final List<String> selectors;

  FeatureCategory(String id, double defaultDensity, String... selectors) {
    this.id = id;
    this.defaultDensity = defaultDensity;
    this.selectors = List.of(selectors);
  }

  /** Name used in arguments and filter lists, like {@code "power_lines"}. */
  public String id() {
    return id;
  }

  /** Estimated nodes per square kilometer. */
  public double defaultDensity() {
    return defaultDensity;
  }

  /** Overpass QL statements, without the bounding box filter, that select features of this category. */
  public List<String> selectors() {
    return selectors;
  }

  /**
   * Returns the category with {@code id}, ignoring case and treating {@code -} like {@code _}.
   *
   * @throws ValidationException if there is no such category
   */
  public static FeatureCategory fromId(String id) {
    String normalized = id.strip().toLowerCase(Locale.ROOT).replace('-', '_');
    for (var category : values()) {
      if (category.id.equals(normalized)) {
        return category;
      }
    }
    throw new ValidationException(
      "Unknown feature category '" + id + "', expected one of " + Arrays.stream(values()).map(c -> c.id).toList());
  }

  /**
   * Returns the filter set for {@code ids}.
   *
   * @throws ValidationException if any id is unknown or no category is selected
   */
  public static Set<FeatureCategory> parseFilterSet(Collection<String> ids) {
    Set<FeatureCategory> result = EnumSet.noneOf(FeatureCategory.class);
    for (String id : ids) {
      result.add(fromId(id));
    }
    return requireNonEmpty(result);
  }

  /**
   * Returns {@code filters} unchanged.
   *
   * @throws ValidationException if it is null or empty
   */
  public static Set<FeatureCategory> requireNonEmpty(Set<FeatureCategory> filters) {
    if (filters == null || filters.isEmpty()) {
      throw new ValidationException("At least one feature category must be selected");
    }
    return filters;
  }
}
