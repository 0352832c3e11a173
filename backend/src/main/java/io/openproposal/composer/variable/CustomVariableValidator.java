package io.openproposal.composer.variable;

import io.openproposal.composer.exception.ContentValidationException;
import io.openproposal.composer.exception.ContentValidationException.Violation;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Checks a document's custom variable definitions and converts them to and from the persisted
 * name-to-default map.
 */
@Component
public class CustomVariableValidator {

  private static final Pattern NAME_PATTERN = Pattern.compile("[A-Za-z0-9_]+");

  /**
   * Validates names (syntax and case-insensitive uniqueness) of the given variables.
   *
   * @throws ContentValidationException listing every offending variable
   */
  public void validate(List<CustomVariable> variables) {
    var violations = new ArrayList<Violation>();
    var seen = new HashSet<String>();
    for (int i = 0; i < variables.size(); i++) {
      var variable = variables.get(i);
      String path = "variables[" + i + "].name";
      String name = variable.name();
      if (name == null || !NAME_PATTERN.matcher(name).matches()) {
        violations.add(
            new Violation(path, "must contain only letters, digits and underscores: " + name));
      } else if (!seen.add(name.toLowerCase(Locale.ROOT))) {
        violations.add(new Violation(path, "duplicate variable name: " + name));
      }
    }
    if (!violations.isEmpty()) {
      throw new ContentValidationException(violations);
    }
  }

  /** Validates and returns the persisted form, preserving definition order. */
  public Map<String, String> toDefaultValues(List<CustomVariable> variables) {
    validate(variables);
    var values = new LinkedHashMap<String, String>();
    for (var variable : variables) {
      values.put(variable.name(), variable.defaultValue() != null ? variable.defaultValue() : "");
    }
    return values;
  }

  /** Rebuilds definitions from the persisted map; descriptions are not persisted there. */
  public List<CustomVariable> fromDefaultValues(Map<String, String> values) {
    var variables = new ArrayList<CustomVariable>();
    if (values != null) {
      values.forEach((name, value) -> variables.add(new CustomVariable(name, value, null)));
    }
    return List.copyOf(variables);
  }
}
