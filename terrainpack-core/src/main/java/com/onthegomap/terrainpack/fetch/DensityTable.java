package com.onthegomap.terrainpack.fetch;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;

/**
 * Estimated feature-node density per {@link FeatureCategory}, used to decide how many requests a bounding box needs.
 *
 * @param nodesPerKm2  nodes per square kilometer for each category, categories left out count as 0
 * @param safetyMargin factor the raw estimate is multiplied by to stay under the service's cap
 */
public record DensityTable(Map<FeatureCategory, Double> nodesPerKm2, double safetyMargin) {

  public static final double DEFAULT_SAFETY_MARGIN = 1.3;

  public DensityTable {
    nodesPerKm2 = nodesPerKm2.isEmpty() ? Map.of() : Map.copyOf(new EnumMap<>(nodesPerKm2));
    if (!(safetyMargin > 0)) {
      throw new IllegalArgumentException("safety margin must be positive: " + safetyMargin);
    }
  }

  /** Returns the built-in densities with the default safety margin. */
  public static DensityTable defaults() {
    Map<FeatureCategory, Double> densities = new EnumMap<>(FeatureCategory.class);
    for (var category : FeatureCategory.values()) {
      densities.put(category, category.defaultDensity());
    }
    return new DensityTable(densities, DEFAULT_SAFETY_MARGIN);
  }

  public double density(FeatureCategory category) {
    return nodesPerKm2.getOrDefault(category, 0d);
  }

  /** Returns the sum of densities for {@code categories} in nodes per square kilometer. */
  public double totalDensity(Collection<FeatureCategory> categories) {
    double total = 0;
    for (var category : categories) {
      total += density(category);
    }
    return total;
  }
}
