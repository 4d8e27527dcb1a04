package io.intellixity.dynattr.validation;

import io.intellixity.dynattr.error.DefinitionException;
import io.intellixity.dynattr.model.AttributeDefinition;
import io.intellixity.dynattr.model.AttributeDraft;
import io.intellixity.dynattr.model.AttributeType;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class DefinitionValidatorTest {
  private final DefinitionValidator validator = new DefinitionValidator();

  @Test
  void validDraftBecomesDefinition() {
    AttributeDefinition d = validator.validate(AttributeDraft.of("size", " Size ", "select")
        .required(true)
        .options(List.of("S", "M", "L")));
    assertNull(d.id());
    assertEquals("Size", d.label());
    assertEquals(AttributeType.SELECT, d.type());
    assertEquals(List.of("S", "M", "L"), d.options());
    assertTrue(d.required());
  }

  @Test
  void reportsEveryViolationAtOnce() {
    AttributeDraft draft = new AttributeDraft("9lives", "", "number", false, null,
        Map.of("min", "ten", "max", 5, "after", "today", "pattern", "x"));
    DefinitionException ex = assertThrows(DefinitionException.class, () -> validator.validate(draft));

    assertEquals(List.of("The name must start with a letter and contain only letters, numbers, and underscores."),
        ex.violations().get("name"));
    assertEquals(List.of("The label field is required."), ex.violations().get("label"));
    List<String> rules = ex.violations().get("validation");
    assertTrue(rules.contains("Number min value must be numeric."));
    assertTrue(rules.contains("after validation is only supported for date attributes."));
    assertTrue(rules.contains("Unknown validation rule: pattern"));
    assertEquals(5, ex.messages().size());
  }

  @Test
  void unknownTypeAndMissingType() {
    assertEquals(List.of("The type must be one of: text, number, date, boolean, select."),
        validator.violations(AttributeDraft.of("a", "A", "color")).get("type"));
    assertEquals(List.of("The type field is required."),
        validator.violations(AttributeDraft.of("a", "A", (String) null)).get("type"));
  }

  @Test
  void selectNeedsNonEmptyStringOptions() {
    assertEquals(List.of("Select attributes must have at least one option."),
        validator.violations(AttributeDraft.of("a", "A", "select")).get("options"));
    assertEquals(List.of("Option at index 1 must be a non-empty string.", "Option at index 2 must be a non-empty string."),
        validator.violations(AttributeDraft.of("a", "A", "select").options(Arrays.asList("x", " ", 3))).get("options"));
  }

  @Test
  void invertedBoundsAreRejected() {
    Map<String, List<String>> v = validator.violations(AttributeDraft.of("a", "A", "text")
        .rules(Map.of("min", 10, "max", 2, "min_length", 5, "max_length", 1)));
    assertEquals(List.of("Minimum value cannot be greater than maximum value.",
        "Minimum length cannot be greater than maximum length."), v.get("validation"));
  }

  @Test
  void textBoundsMustBeNonNegativeIntegers() {
    Map<String, List<String>> v = validator.violations(AttributeDraft.of("a", "A", "text")
        .rules(Map.of("max", -1)));
    assertEquals(List.of("Text max length must be a non-negative integer."), v.get("validation"));
  }

  @Test
  void dateRulesAcceptTodayOrDate() {
    assertTrue(validator.violations(AttributeDraft.of("d", "D", "date")
        .rules(Map.of("after", "today", "before", "2030-01-01"))).isEmpty());
    assertEquals(List.of("before must be 'today' or a valid date."),
        validator.violations(AttributeDraft.of("d", "D", "date").rules(Map.of("before", "someday"))).get("validation"));
  }
}
