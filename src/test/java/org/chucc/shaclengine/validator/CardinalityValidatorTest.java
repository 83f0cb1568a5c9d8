package org.chucc.shaclengine.validator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.chucc.shaclengine.testutil.TestConstants.N1;
import static org.chucc.shaclengine.testutil.TestConstants.NAME;
import static org.chucc.shaclengine.testutil.TestConstants.PROPERTY_SHAPE;
import static org.chucc.shaclengine.testutil.TestConstants.graph;
import static org.chucc.shaclengine.testutil.TestConstants.string;
import static org.chucc.shaclengine.testutil.TestConstants.triple;

import java.util.List;
import org.chucc.shaclengine.graph.DataGraph;
import org.chucc.shaclengine.model.PropertyShape;
import org.chucc.shaclengine.model.Severity;
import org.chucc.shaclengine.model.ShaclVocabulary;
import org.chucc.shaclengine.model.ValidationResult;
import org.junit.jupiter.api.Test;

class CardinalityValidatorTest {

  private final CardinalityValidator validator = new CardinalityValidator();

  private final PropertyShape exactlyOne = PropertyShape.builder(PROPERTY_SHAPE, NAME)
      .minCount(1)
      .maxCount(1)
      .build();

  @Test
  void validate_shouldReturnEmpty_whenNoCountsSet() {
    PropertyShape shape = PropertyShape.builder(PROPERTY_SHAPE, NAME).build();
    DataGraph graph = graph(triple(N1, NAME, string("a")), triple(N1, NAME, string("b")));

    assertThat(validator.validate(graph, N1, shape)).isEmpty();
    assertThat(validator.validate(graph(), N1, shape)).isEmpty();
  }

  @Test
  void validate_shouldReportMinCount_whenNoValues() {
    List<ValidationResult> results = validator.validate(graph(), N1, exactlyOne);

    assertThat(results).hasSize(1);
    ValidationResult result = results.get(0);
    assertThat(result.severity()).isEqualTo(Severity.VIOLATION);
    assertThat(result.focusNode()).isEqualTo(N1);
    assertThat(result.path()).isEqualTo(NAME);
    assertThat(result.sourceShape()).isEqualTo(PROPERTY_SHAPE);
    assertThat(result.details())
        .containsEntry("constraint_component", ShaclVocabulary.MIN_COUNT_COMPONENT)
        .containsEntry("actual_count", 0)
        .containsEntry("min_count", 1);
  }

  @Test
  void validate_shouldReportSingleMaxCount_whenTwoValues() {
    DataGraph graph = graph(triple(N1, NAME, string("a")), triple(N1, NAME, string("b")));

    List<ValidationResult> results = validator.validate(graph, N1, exactlyOne);

    assertThat(results).hasSize(1);
    assertThat(results.get(0).details())
        .containsEntry("actual_count", 2)
        .containsEntry("max_count", 1)
        .doesNotContainKey("min_count");
  }

  @Test
  void validate_shouldReturnEmpty_whenExactlyOneValue() {
    DataGraph graph = graph(triple(N1, NAME, string("a")));

    assertThat(validator.validate(graph, N1, exactlyOne)).isEmpty();
  }

  @Test
  void validate_shouldReportBothBounds_whenMinExceedsMax() {
    PropertyShape contradictory = PropertyShape.builder(PROPERTY_SHAPE, NAME)
        .minCount(3)
        .maxCount(1)
        .build();
    DataGraph graph = graph(triple(N1, NAME, string("a")), triple(N1, NAME, string("b")));

    List<ValidationResult> results = validator.validate(graph, N1, contradictory);

    assertThat(results).hasSize(2);
    assertThat(results.get(0).details()).containsKey("min_count");
    assertThat(results.get(1).details()).containsKey("max_count");
  }

  @Test
  void validate_shouldTreatZeroMaxCountAsChecked() {
    PropertyShape forbidden = PropertyShape.builder(PROPERTY_SHAPE, NAME).maxCount(0).build();

    assertThat(validator.validate(graph(), N1, forbidden)).isEmpty();
    assertThat(validator.validate(graph(triple(N1, NAME, string("a"))), N1, forbidden))
        .hasSize(1);
  }

  @Test
  void validate_shouldUseShapeMessageVerbatim() {
    PropertyShape shape = PropertyShape.builder(PROPERTY_SHAPE, NAME)
        .minCount(1)
        .message("Module must have exactly one name")
        .build();

    List<ValidationResult> results = validator.validate(graph(), N1, shape);

    assertThat(results).extracting(ValidationResult::message)
        .containsExactly("Module must have exactly one name");
  }

  @Test
  void validate_shouldUseDefaultMessage_whenShapeHasNone() {
    List<ValidationResult> results = validator.validate(graph(), N1, exactlyOne);

    assertThat(results.get(0).message())
        .isEqualTo("Property has too few values (expected at least 1, found 0)");
  }
}
