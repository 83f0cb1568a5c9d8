package org.chucc.shaclengine.model;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;
import org.apache.jena.graph.Node;

/**
 * Immutable property shape: constraints on the values reachable from a focus
 * node through a single predicate path.
 *
 * <p>Every constraint field is optional. An absent field means the constraint
 * kind is not checked, never that it is checked against zero. Patterns are
 * compiled once when the shape is built.</p>
 */
public final class PropertyShape {

  private final Node id;
  private final Node path;
  private final Integer minCount;
  private final Integer maxCount;
  private final Node datatype;
  private final Node shClass;
  private final Pattern pattern;
  private final Integer minLength;
  private final List<Node> inList;
  private final Node hasValue;
  private final BigDecimal maxInclusive;
  private final Node qualifiedClass;
  private final Integer qualifiedMinCount;
  private final String message;

  private PropertyShape(Builder builder) {
    this.id = builder.id;
    this.path = builder.path;
    this.minCount = builder.minCount;
    this.maxCount = builder.maxCount;
    this.datatype = builder.datatype;
    this.shClass = builder.shClass;
    this.pattern = builder.pattern;
    this.minLength = builder.minLength;
    this.inList = List.copyOf(builder.inList);
    this.hasValue = builder.hasValue;
    this.maxInclusive = builder.maxInclusive;
    this.qualifiedClass = builder.qualifiedClass;
    this.qualifiedMinCount = builder.qualifiedMinCount;
    this.message = builder.message;
  }

  /**
   * Starts building a property shape.
   *
   * @param id the shape identifier (IRI or blank node)
   * @param path the predicate path
   * @return a new builder
   */
  public static Builder builder(Node id, Node path) {
    return new Builder(id, path);
  }

  public Node id() {
    return id;
  }

  public Node path() {
    return path;
  }

  public Optional<Integer> minCount() {
    return Optional.ofNullable(minCount);
  }

  public Optional<Integer> maxCount() {
    return Optional.ofNullable(maxCount);
  }

  public Optional<Node> datatype() {
    return Optional.ofNullable(datatype);
  }

  /**
   * Gets the required class of every value (sh:class).
   *
   * @return the class IRI, if set
   */
  public Optional<Node> shClass() {
    return Optional.ofNullable(shClass);
  }

  public Optional<Pattern> pattern() {
    return Optional.ofNullable(pattern);
  }

  public Optional<Integer> minLength() {
    return Optional.ofNullable(minLength);
  }

  /**
   * Gets the enumeration of allowed values (sh:in).
   *
   * @return the allowed values; empty when not constrained
   */
  public List<Node> inList() {
    return inList;
  }

  public Optional<Node> hasValue() {
    return Optional.ofNullable(hasValue);
  }

  public Optional<BigDecimal> maxInclusive() {
    return Optional.ofNullable(maxInclusive);
  }

  public Optional<Node> qualifiedClass() {
    return Optional.ofNullable(qualifiedClass);
  }

  public Optional<Integer> qualifiedMinCount() {
    return Optional.ofNullable(qualifiedMinCount);
  }

  public Optional<String> message() {
    return Optional.ofNullable(message);
  }

  @Override
  public String toString() {
    return "PropertyShape{id=" + id + ", path=" + path + "}";
  }

  /**
   * Builder for {@link PropertyShape}.
   */
  public static final class Builder {
    private final Node id;
    private final Node path;
    private Integer minCount;
    private Integer maxCount;
    private Node datatype;
    private Node shClass;
    private Pattern pattern;
    private Integer minLength;
    private final List<Node> inList = new ArrayList<>();
    private Node hasValue;
    private BigDecimal maxInclusive;
    private Node qualifiedClass;
    private Integer qualifiedMinCount;
    private String message;

    private Builder(Node id, Node path) {
      this.id = Objects.requireNonNull(id, "Property shape id cannot be null");
      this.path = Objects.requireNonNull(path, "Property shape path cannot be null");
      if (!path.isURI()) {
        throw new IllegalArgumentException("Property shape path must be an IRI: " + path);
      }
    }

    public Builder minCount(int minCount) {
      this.minCount = requireNonNegative(minCount, "minCount");
      return this;
    }

    public Builder maxCount(int maxCount) {
      this.maxCount = requireNonNegative(maxCount, "maxCount");
      return this;
    }

    public Builder datatype(Node datatype) {
      this.datatype = Objects.requireNonNull(datatype, "datatype cannot be null");
      return this;
    }

    public Builder shClass(Node shClass) {
      this.shClass = Objects.requireNonNull(shClass, "class cannot be null");
      return this;
    }

    public Builder pattern(Pattern pattern) {
      this.pattern = Objects.requireNonNull(pattern, "pattern cannot be null");
      return this;
    }

    /**
     * Compiles and sets the pattern. Character classes are Unicode-aware.
     *
     * @param regex the regular expression
     * @return this builder
     * @throws java.util.regex.PatternSyntaxException if the expression is invalid
     */
    public Builder pattern(String regex) {
      Objects.requireNonNull(regex, "pattern cannot be null");
      return pattern(Pattern.compile(regex, Pattern.UNICODE_CHARACTER_CLASS));
    }

    public Builder minLength(int minLength) {
      this.minLength = requireNonNegative(minLength, "minLength");
      return this;
    }

    public Builder in(List<Node> allowedValues) {
      Objects.requireNonNull(allowedValues, "allowed values cannot be null");
      this.inList.addAll(allowedValues);
      return this;
    }

    public Builder hasValue(Node hasValue) {
      this.hasValue = Objects.requireNonNull(hasValue, "hasValue cannot be null");
      return this;
    }

    public Builder maxInclusive(BigDecimal maxInclusive) {
      this.maxInclusive = Objects.requireNonNull(maxInclusive, "maxInclusive cannot be null");
      return this;
    }

    public Builder maxInclusive(long maxInclusive) {
      return maxInclusive(BigDecimal.valueOf(maxInclusive));
    }

    public Builder qualifiedClass(Node qualifiedClass) {
      this.qualifiedClass =
          Objects.requireNonNull(qualifiedClass, "qualifiedClass cannot be null");
      return this;
    }

    public Builder qualifiedMinCount(int qualifiedMinCount) {
      this.qualifiedMinCount = requireNonNegative(qualifiedMinCount, "qualifiedMinCount");
      return this;
    }

    public Builder message(String message) {
      this.message = message;
      return this;
    }

    public PropertyShape build() {
      return new PropertyShape(this);
    }

    private static int requireNonNegative(int value, String field) {
      if (value < 0) {
        throw new IllegalArgumentException(field + " must be non-negative: " + value);
      }
      return value;
    }
  }
}
