package com.onthegomap.terrainpack.reader.osm;

import com.carrotsearch.hppc.LongHashSet;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;
import java.util.stream.Stream;
import javax.annotation.concurrent.Immutable;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * An immutable set of nodes, ways, and relations where each id appears at most once per element type, in the order
 * they were first seen.
 */
@Immutable
public final class FeatureCollection {

  private static final FeatureCollection EMPTY = new FeatureCollection(List.of(), List.of(), List.of());

  private final List<OsmElement.Node> nodes;
  private final List<OsmElement.Way> ways;
  private final List<OsmElement.Relation> relations;

  private FeatureCollection(List<OsmElement.Node> nodes, List<OsmElement.Way> ways,
    List<OsmElement.Relation> relations) {
    this.nodes = Collections.unmodifiableList(nodes);
    this.ways = Collections.unmodifiableList(ways);
    this.relations = Collections.unmodifiableList(relations);
  }

  public static FeatureCollection empty() {
    return EMPTY;
  }

  /** Returns a collection of {@code elements}, dropping any element whose type and id was already seen. */
  public static FeatureCollection of(List<? extends OsmElement> elements) {
    Builder builder = builder();
    elements.forEach(builder::add);
    return builder.build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public List<OsmElement.Node> nodes() {
    return nodes;
  }

  public List<OsmElement.Way> ways() {
    return ways;
  }

  public List<OsmElement.Relation> relations() {
    return relations;
  }

  /** Returns nodes, then ways, then relations. */
  public Stream<OsmElement> stream() {
    return Stream.of(nodes.stream(), ways.stream(), relations.stream()).flatMap(s -> s);
  }

  public int size() {
    return nodes.size() + ways.size() + relations.size();
  }

  public boolean isEmpty() {
    return size() == 0;
  }

  /** Returns a copy of this collection with {@code mapper} applied to every way. */
  public FeatureCollection mapWays(UnaryOperator<OsmElement.Way> mapper) {
    return new FeatureCollection(nodes, ways.stream().map(mapper).toList(), relations);
  }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof FeatureCollection that &&
      nodes.equals(that.nodes) && ways.equals(that.ways) && relations.equals(that.relations));
  }

  @Override
  public int hashCode() {
    return Objects.hash(nodes, ways, relations);
  }

  @Override
  public String toString() {
    return "FeatureCollection[nodes=" + nodes.size() + ", ways=" + ways.size() + ", relations=" + relations.size() +
      "]";
  }

  /**
   * Accumulates elements from one or more chunk responses, keeping the first occurrence of each id.
   */
  @NotThreadSafe
  public static final class Builder {

    private final LongHashSet seenNodes = new LongHashSet();
    private final LongHashSet seenWays = new LongHashSet();
    private final LongHashSet seenRelations = new LongHashSet();
    private final List<OsmElement.Node> nodes = new ArrayList<>();
    private final List<OsmElement.Way> ways = new ArrayList<>();
    private final List<OsmElement.Relation> relations = new ArrayList<>();
    private long duplicates = 0;

    private Builder() {}

    /** Adds {@code element} and returns true, or returns false if one with the same type and id was already added. */
    public boolean add(OsmElement element) {
      boolean added;
      if (element instanceof OsmElement.Node node) {
        added = seenNodes.add(node.id());
        if (added) {
          nodes.add(node);
        }
      } else if (element instanceof OsmElement.Way way) {
        added = seenWays.add(way.id());
        if (added) {
          ways.add(way);
        }
      } else if (element instanceof OsmElement.Relation relation) {
        added = seenRelations.add(relation.id());
        if (added) {
          relations.add(relation);
        }
      } else {
        throw new IllegalArgumentException("Unrecognized element: " + element);
      }
      if (!added) {
        duplicates++;
      }
      return added;
    }

    /** Adds every element of {@code other} and returns the number that were new. */
    public int addAll(FeatureCollection other) {
      int added = 0;
      for (var element : (Iterable<OsmElement>) other.stream()::iterator) {
        if (add(element)) {
          added++;
        }
      }
      return added;
    }

    /** Number of elements dropped because their id was already present. */
    public long duplicates() {
      return duplicates;
    }

    public FeatureCollection build() {
      return new FeatureCollection(List.copyOf(nodes), List.copyOf(ways), List.copyOf(relations));
    }
  }
}
