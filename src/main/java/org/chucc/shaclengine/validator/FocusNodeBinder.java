package org.chucc.shaclengine.validator;

import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.apache.jena.graph.Node;
import org.apache.jena.sparql.util.FmtUtils;

/**
 * Binds a focus node into a rule query template.
 *
 * <p>Every {@code $this} placeholder is replaced with the focus node in
 * canonical form: {@code <iri>} for IRIs and {@code _:label} for blank nodes.
 * A constant is not a legal SELECT projection, so when {@code $this} is
 * projected it is projected as {@code ?this} and bound through a BIND at the
 * start of the WHERE block.</p>
 */
public final class FocusNodeBinder {

  private static final Pattern THIS = Pattern.compile("\\$this(?![\\w])");

  private static final Pattern PROJECTED_THIS = Pattern.compile(
      "(?i)\\b(SELECT(?:\\s+(?:DISTINCT|REDUCED))?(?:\\s+[?$]\\w+)*)\\s+\\$this(?![\\w])");

  private static final Pattern WHERE_OPEN = Pattern.compile("(?i)\\bWHERE\\s*\\{");

  private FocusNodeBinder() {
    // Utility class - prevent instantiation
  }

  /**
   * Produces the bound query for a focus node.
   *
   * @param template the query template containing {@code $this}
   * @param focusNode the focus node
   * @param prefixes prefix declarations to prepend, in order
   * @return the executable query string
   */
  public static String bind(String template, Node focusNode, Map<String, String> prefixes) {
    Objects.requireNonNull(template, "Template cannot be null");
    Objects.requireNonNull(focusNode, "Focus node cannot be null");

    String term = serialize(focusNode);
    String query = template;

    Matcher projection = PROJECTED_THIS.matcher(query);
    boolean projected = projection.find();
    if (projected) {
      query = projection.replaceFirst(Matcher.quoteReplacement(projection.group(1)) + " ?this");
    }

    query = THIS.matcher(query).replaceAll(Matcher.quoteReplacement(term));

    if (projected) {
      Matcher where = WHERE_OPEN.matcher(query);
      if (where.find()) {
        query = query.substring(0, where.end())
            + " BIND(" + term + " AS ?this) ."
            + query.substring(where.end());
      }
    }

    return prefixDeclarations(prefixes) + query;
  }

  /**
   * Serializes a focus node to its canonical query form.
   *
   * @param node the node
   * @return {@code <iri>}, {@code _:label}, or the literal in SPARQL syntax
   */
  public static String serialize(Node node) {
    if (node.isURI()) {
      return "<" + node.getURI() + ">";
    }
    if (node.isBlank()) {
      return "_:" + node.getBlankNodeLabel();
    }
    return FmtUtils.stringForNode(node);
  }

  private static String prefixDeclarations(Map<String, String> prefixes) {
    if (prefixes == null || prefixes.isEmpty()) {
      return "";
    }
    StringBuilder declarations = new StringBuilder();
    prefixes.forEach((prefix, namespace) -> declarations
        .append("PREFIX ").append(prefix).append(": <").append(namespace).append(">\n"));
    return declarations.toString();
  }
}
