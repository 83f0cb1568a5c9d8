package org.chucc.shaclengine.validator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.chucc.shaclengine.testutil.TestConstants.N1;
import static org.chucc.shaclengine.testutil.TestConstants.NAME;
import static org.chucc.shaclengine.testutil.TestConstants.PROPERTY_SHAPE;
import static org.chucc.shaclengine.testutil.TestConstants.graph;
import static org.chucc.shaclengine.testutil.TestConstants.integer;
import static org.chucc.shaclengine.testutil.TestConstants.iri;
import static org.chucc.shaclengine.testutil.TestConstants.string;
import static org.chucc.shaclengine.testutil.TestConstants.triple;

import java.util.List;
import org.chucc.shaclengine.exception.ShaclEngineException;
import org.chucc.shaclengine.model.PropertyShape;
import org.chucc.shaclengine.model.ShaclVocabulary;
import org.chucc.shaclengine.model.ValidationResult;
import org.junit.jupiter.api.Test;

class StringValidatorTest {

  private final StringValidator validator = new StringValidator();

  private final PropertyShape moduleName = PropertyShape.builder(PROPERTY_SHAPE, NAME)
      .pattern("^[A-Z][A-Za-z0-9_]*$")
      .build();

  @Test
  void validate_shouldReturnEmpty_whenNoStringConstraints() {
    PropertyShape shape = PropertyShape.builder(PROPERTY_SHAPE, NAME).build();

    assertThat(validator.validate(graph(triple(N1, NAME, iri("x"))), N1, shape)).isEmpty();
  }

  @Test
  void pattern_shouldAcceptMatchingLiteral() {
    assertThat(validator.validate(graph(triple(N1, NAME, string("MyModule"))), N1, moduleName))
        .isEmpty();
  }

  @Test
  void pattern_shouldRejectNonMatchingLiteral() {
    List<ValidationResult> results =
        validator.validate(graph(triple(N1, NAME, string("invalid_name"))), N1, moduleName);

    assertThat(results).hasSize(1);
    assertThat(results.get(0).details())
        .containsEntry("constraint_component", ShaclVocabulary.PATTERN_COMPONENT)
        .containsEntry("pattern", "^[A-Z][A-Za-z0-9_]*$");
  }

  @Test
  void pattern_shouldRequireWholeLexicalFormToMatch() {
    PropertyShape digits = PropertyShape.builder(PROPERTY_SHAPE, NAME).pattern("[0-9]+").build();

    assertThat(validator.validate(graph(triple(N1, NAME, string("abc123"))), N1, digits))
        .hasSize(1);
    assertThat(validator.validate(graph(triple(N1, NAME, string("123"))), N1, digits))
        .isEmpty();
  }

  @Test
  void pattern_shouldMatchUnicodeLetters() {
    PropertyShape letters = PropertyShape.builder(PROPERTY_SHAPE, NAME).pattern("\\w+").build();

    assertThat(validator.validate(graph(triple(N1, NAME, string("Grüße"))), N1, letters))
        .isEmpty();
  }

  @Test
  void pattern_shouldMatchLexicalFormOfTypedLiteral() {
    PropertyShape digits = PropertyShape.builder(PROPERTY_SHAPE, NAME).pattern("\\d+").build();

    assertThat(validator.validate(graph(triple(N1, NAME, integer(255))), N1, digits)).isEmpty();
  }

  @Test
  void pattern_shouldRejectIriValue() {
    assertThat(validator.validate(graph(triple(N1, NAME, iri("MyModule"))), N1, moduleName))
        .hasSize(1);
  }

  @Test
  void minLength_shouldAcceptLongEnoughLiteral() {
    PropertyShape shape = PropertyShape.builder(PROPERTY_SHAPE, NAME).minLength(3).build();

    assertThat(validator.validate(graph(triple(N1, NAME, string("abc"))), N1, shape)).isEmpty();
  }

  @Test
  void minLength_shouldRejectShortLiteral() {
    PropertyShape shape = PropertyShape.builder(PROPERTY_SHAPE, NAME).minLength(3).build();

    List<ValidationResult> results =
        validator.validate(graph(triple(N1, NAME, string("ab"))), N1, shape);

    assertThat(results).hasSize(1);
    assertThat(results.get(0).details())
        .containsEntry("min_length", 3)
        .containsEntry("actual_length", 2);
    assertThat(results.get(0).message())
        .isEqualTo("Value is too short (expected at least 3 characters, found 2)");
  }

  @Test
  void minLength_shouldCountCodePoints() {
    PropertyShape shape = PropertyShape.builder(PROPERTY_SHAPE, NAME).minLength(2).build();
    // Two emoji: four UTF-16 chars, two code points
    String twoEmoji = "😀😁";

    assertThat(validator.validate(graph(triple(N1, NAME, string(twoEmoji))), N1, shape))
        .isEmpty();
    assertThat(validator.validate(graph(triple(N1, NAME, string("😀"))), N1, shape))
        .hasSize(1);
  }

  @Test
  void minLength_shouldRejectIriValue() {
    PropertyShape shape = PropertyShape.builder(PROPERTY_SHAPE, NAME).minLength(1).build();

    List<ValidationResult> results =
        validator.validate(graph(triple(N1, NAME, iri("long-enough"))), N1, shape);

    assertThat(results).hasSize(1);
    assertThat(results.get(0).details()).doesNotContainKey("actual_length");
  }

  @Test
  void validate_shouldReportPatternThenMinLength() {
    PropertyShape shape = PropertyShape.builder(PROPERTY_SHAPE, NAME)
        .pattern("[a-z]+")
        .minLength(5)
        .build();

    List<ValidationResult> results =
        validator.validate(graph(triple(N1, NAME, string("AB"))), N1, shape);

    assertThat(results).extracting(r -> r.details().get("constraint_component"))
        .containsExactly(ShaclVocabulary.PATTERN_COMPONENT, ShaclVocabulary.MIN_LENGTH_COMPONENT);
  }

  @Test
  void pattern_shouldStopMatching_whenWorkerInterrupted() {
    Thread.currentThread().interrupt();
    try {
      assertThatThrownBy(() ->
          validator.validate(graph(triple(N1, NAME, string("MyModule"))), N1, moduleName))
          .isInstanceOf(ShaclEngineException.class)
          .hasMessageContaining("interrupted");
    } finally {
      Thread.interrupted();
    }
  }
}
