package org.chucc.shaclengine.validator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.chucc.shaclengine.testutil.TestConstants.CLASS_C;
import static org.chucc.shaclengine.testutil.TestConstants.CLASS_D;
import static org.chucc.shaclengine.testutil.TestConstants.N1;
import static org.chucc.shaclengine.testutil.TestConstants.P;
import static org.chucc.shaclengine.testutil.TestConstants.PROPERTY_SHAPE;
import static org.chucc.shaclengine.testutil.TestConstants.XSD_INTEGER;
import static org.chucc.shaclengine.testutil.TestConstants.XSD_STRING;
import static org.chucc.shaclengine.testutil.TestConstants.graph;
import static org.chucc.shaclengine.testutil.TestConstants.integer;
import static org.chucc.shaclengine.testutil.TestConstants.iri;
import static org.chucc.shaclengine.testutil.TestConstants.string;
import static org.chucc.shaclengine.testutil.TestConstants.triple;
import static org.chucc.shaclengine.testutil.TestConstants.typed;

import java.util.List;
import org.apache.jena.graph.Node;
import org.apache.jena.graph.NodeFactory;
import org.apache.jena.vocabulary.RDFS;
import org.chucc.shaclengine.graph.DataGraph;
import org.chucc.shaclengine.model.PropertyShape;
import org.chucc.shaclengine.model.ShaclVocabulary;
import org.chucc.shaclengine.model.ValidationResult;
import org.junit.jupiter.api.Test;

class TypeValidatorTest {

  private final TypeValidator validator = new TypeValidator();

  private final PropertyShape integerShape = PropertyShape.builder(PROPERTY_SHAPE, P)
      .datatype(XSD_INTEGER)
      .build();

  private final PropertyShape classShape = PropertyShape.builder(PROPERTY_SHAPE, P)
      .shClass(CLASS_C)
      .build();

  @Test
  void validate_shouldReturnEmpty_whenNeitherDatatypeNorClassSet() {
    PropertyShape shape = PropertyShape.builder(PROPERTY_SHAPE, P).build();

    assertThat(validator.validate(graph(triple(N1, P, string("x"))), N1, shape)).isEmpty();
  }

  @Test
  void datatype_shouldAcceptMatchingLiteral() {
    DataGraph graph = graph(triple(N1, P, integer(42)));

    assertThat(validator.validate(graph, N1, integerShape)).isEmpty();
  }

  @Test
  void datatype_shouldRejectLiteralOfOtherDatatype() {
    DataGraph graph = graph(triple(N1, P, string("42")));

    List<ValidationResult> results = validator.validate(graph, N1, integerShape);

    assertThat(results).hasSize(1);
    assertThat(results.get(0).details())
        .containsEntry("constraint_component", ShaclVocabulary.DATATYPE_COMPONENT)
        .containsEntry("value", string("42"))
        .containsEntry("datatype", XSD_INTEGER);
  }

  @Test
  void datatype_shouldRejectIriValue() {
    DataGraph graph = graph(triple(N1, P, iri("thing")));

    assertThat(validator.validate(graph, N1, integerShape)).hasSize(1);
  }

  @Test
  void datatype_shouldReportEachOffendingValue() {
    DataGraph graph = graph(
        triple(N1, P, integer(1)),
        triple(N1, P, string("two")),
        triple(N1, P, iri("three")));

    assertThat(validator.validate(graph, N1, integerShape)).hasSize(2);
  }

  @Test
  void datatype_shouldTreatLanguageStringsAsLangString() {
    PropertyShape stringShape = PropertyShape.builder(PROPERTY_SHAPE, P)
        .datatype(XSD_STRING)
        .build();
    DataGraph graph = graph(triple(N1, P, NodeFactory.createLiteralLang("hallo", "de")));

    assertThat(validator.validate(graph, N1, stringShape)).hasSize(1);
  }

  @Test
  void class_shouldAcceptExplicitlyTypedValue() {
    Node value = iri("v1");
    DataGraph graph = graph(triple(N1, P, value), typed(value, CLASS_C));

    assertThat(validator.validate(graph, N1, classShape)).isEmpty();
  }

  @Test
  void class_shouldNotFollowSubclassHierarchy() {
    Node value = iri("v1");
    DataGraph graph = graph(
        triple(N1, P, value),
        typed(value, CLASS_D),
        triple(CLASS_D, RDFS.subClassOf.asNode(), CLASS_C));

    List<ValidationResult> results = validator.validate(graph, N1, classShape);

    assertThat(results).hasSize(1);
    assertThat(results.get(0).details()).containsEntry("class", CLASS_C);
  }

  @Test
  void class_shouldAlwaysRejectLiteral() {
    DataGraph graph = graph(triple(N1, P, string("C")));

    assertThat(validator.validate(graph, N1, classShape)).hasSize(1);
  }

  @Test
  void validate_shouldConcatenateDatatypeThenClassResults() {
    PropertyShape both = PropertyShape.builder(PROPERTY_SHAPE, P)
        .datatype(XSD_INTEGER)
        .shClass(CLASS_C)
        .build();
    DataGraph graph = graph(triple(N1, P, iri("untyped")));

    List<ValidationResult> results = validator.validate(graph, N1, both);

    assertThat(results).extracting(r -> r.details().get("constraint_component"))
        .containsExactly(ShaclVocabulary.DATATYPE_COMPONENT, ShaclVocabulary.CLASS_COMPONENT);
  }
}
