package com.onthegomap.terrainpack.geometry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Serializes converted features to the JSON document stored in a package's vector feature geometry block.
 * <p>
 * The document has a {@code counts} object followed by one array per {@link ConvertedFeature.Kind}:
 * {@code buildings}, {@code paths}, {@code cables} and {@code points}.
 */
public class FeatureGeometryEncoder {

  private final ObjectMapper objectMapper;

  public FeatureGeometryEncoder(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public FeatureGeometryEncoder() {
    this(new ObjectMapper());
  }

  /** Returns the features grouped by kind, in input order within each group. */
  public static Map<String, Object> document(List<ConvertedFeature> features) {
    Map<String, List<ConvertedFeature>> groups = new LinkedHashMap<>();
    for (var kind : ConvertedFeature.Kind.values()) {
      groups.put(kind.group(), new ArrayList<>());
    }
    for (var feature : features) {
      groups.get(feature.kind().group()).add(feature);
    }
    Map<String, Integer> counts = new LinkedHashMap<>();
    groups.forEach((group, list) -> counts.put(group, list.size()));
    Map<String, Object> document = new LinkedHashMap<>();
    document.put("counts", counts);
    document.putAll(groups);
    return document;
  }

  /** Returns the UTF-8 JSON document for {@code features}. */
  public byte[] encode(List<ConvertedFeature> features) {
    try {
      return objectMapper.writeValueAsBytes(document(features));
    } catch (JsonProcessingException e) {
      throw new UncheckedIOException(e);
    }
  }
}
