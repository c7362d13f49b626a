package com.onthegomap.terrainpack.reader.osm;

import com.carrotsearch.hppc.LongArrayList;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.onthegomap.terrainpack.reader.FileFormatException;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses an Overpass API {@code [out:json]} response into a {@link FeatureCollection}.
 *
 * @see <a href="https://wiki.openstreetmap.org/wiki/Overpass_API/Output_Formats#JSON">Overpass JSON output</a>
 */
public class OverpassResponseParser {

  private static final Logger LOGGER = LoggerFactory.getLogger(OverpassResponseParser.class);
  private final ObjectMapper objectMapper;

  public OverpassResponseParser(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public OverpassResponseParser() {
    this(new ObjectMapper());
  }

  /**
   * Reads every node, way and relation in the {@code elements} array of a response.
   *
   * @throws FileFormatException if the response is not JSON or has no {@code elements} array
   * @throws IOException         if the stream cannot be read
   */
  public FeatureCollection parse(InputStream inputStream) throws IOException {
    JsonNode root;
    try {
      root = objectMapper.readTree(inputStream);
    } catch (JsonProcessingException e) {
      throw new FileFormatException("Invalid JSON in query response: " + e.getOriginalMessage(), e);
    }
    if (root == null || !root.path("elements").isArray()) {
      String remark = root == null ? null : root.path("remark").asText(null);
      throw new FileFormatException("Query response has no elements array" + (remark == null ? "" : ": " + remark));
    }
    var builder = FeatureCollection.builder();
    int unknown = 0;
    for (JsonNode element : root.get("elements")) {
      OsmElement parsed = parseElement(element);
      if (parsed == null) {
        unknown++;
      } else {
        builder.add(parsed);
      }
    }
    if (unknown > 0) {
      LOGGER.debug("Ignored {} unrecognized elements in query response", unknown);
    }
    return builder.build();
  }

  private static OsmElement parseElement(JsonNode element) {
    var type = OsmElement.Type.fromName(element.path("type").asText(""));
    if (type == null || !element.hasNonNull("id")) {
      return null;
    }
    long id = element.get("id").asLong();
    Map<String, String> tags = parseTags(element.path("tags"));
    return switch (type) {
      case NODE -> new OsmElement.Node(id, tags, element.path("lat").asDouble(), element.path("lon").asDouble());
      case WAY -> {
        LongArrayList nodes = new LongArrayList();
        for (JsonNode ref : element.path("nodes")) {
          nodes.add(ref.asLong());
        }
        List<OsmElement.LatLon> geometry = new ArrayList<>();
        for (JsonNode point : element.path("geometry")) {
          if (point.isObject() && point.hasNonNull("lat") && point.hasNonNull("lon")) {
            geometry.add(new OsmElement.LatLon(point.get("lat").asDouble(), point.get("lon").asDouble()));
          }
        }
        yield new OsmElement.Way(id, tags, nodes, geometry, false);
      }
      case RELATION -> {
        List<OsmElement.Relation.Member> members = new ArrayList<>();
        for (JsonNode member : element.path("members")) {
          var memberType = OsmElement.Type.fromName(member.path("type").asText(""));
          if (memberType != null) {
            members.add(new OsmElement.Relation.Member(memberType, member.path("ref").asLong(),
              member.path("role").asText("")));
          }
        }
        yield new OsmElement.Relation(id, tags, members);
      }
    };
  }

  private static Map<String, String> parseTags(JsonNode tagsNode) {
    Map<String, String> tags = new HashMap<>();
    var fields = tagsNode.fields();
    while (fields.hasNext()) {
      var entry = fields.next();
      if (!entry.getValue().isNull()) {
        tags.put(entry.getKey(), entry.getValue().asText());
      }
    }
    return tags;
  }
}
