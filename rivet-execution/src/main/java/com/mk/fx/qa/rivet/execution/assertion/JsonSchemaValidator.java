package com.mk.fx.qa.rivet.execution.assertion;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.HashSet;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Validates a document against a JSON schema and stops at the first violation.
 *
 * <p>Supported keywords: {@code type}, {@code enum}, {@code const}, {@code required}, {@code
 * properties}, {@code additionalProperties} (boolean), {@code items}, {@code minItems}, {@code
 * maxItems}, {@code minLength}, {@code maxLength}, {@code pattern}, {@code minimum}, {@code
 * maximum}. Unknown keywords are ignored.
 */
public final class JsonSchemaValidator {

  public Optional<SchemaViolation> validate(JsonNode schema, JsonNode instance) {
    return check(schema, instance, "");
  }

  private Optional<SchemaViolation> check(JsonNode schema, JsonNode node, String pointer) {
    if (schema == null || !schema.isObject()) {
      return Optional.empty();
    }

    var type = schema.get("type");
    if (type != null && !matchesType(type, node)) {
      return violation(pointer, "type", typeText(type), describeType(node));
    }

    var enumValues = schema.get("enum");
    if (enumValues != null && enumValues.isArray()) {
      var found = false;
      for (JsonNode candidate : enumValues) {
        if (JsonValues.sameValue(candidate, node)) {
          found = true;
          break;
        }
      }
      if (!found) {
        return violation(pointer, "enum", "one of " + enumValues, node.toString());
      }
    }

    var constValue = schema.get("const");
    if (constValue != null && !JsonValues.sameValue(constValue, node)) {
      return violation(pointer, "const", constValue.toString(), node.toString());
    }

    if (node.isObject()) {
      var result = checkObject(schema, node, pointer);
      if (result.isPresent()) {
        return result;
      }
    } else if (node.isArray()) {
      var result = checkArray(schema, node, pointer);
      if (result.isPresent()) {
        return result;
      }
    } else if (node.isTextual()) {
      var result = checkString(schema, node.textValue(), pointer);
      if (result.isPresent()) {
        return result;
      }
    } else if (node.isNumber()) {
      var result = checkNumber(schema, node, pointer);
      if (result.isPresent()) {
        return result;
      }
    }
    return Optional.empty();
  }

  private Optional<SchemaViolation> checkObject(JsonNode schema, JsonNode node, String pointer) {
    var required = schema.get("required");
    if (required != null && required.isArray()) {
      for (JsonNode name : required) {
        if (!node.has(name.asText())) {
          return violation(
              pointer, "required", "property '" + name.asText() + "'", "missing");
        }
      }
    }

    var properties = schema.get("properties");
    var declared = new HashSet<String>();
    if (properties != null && properties.isObject()) {
      Iterator<Map.Entry<String, JsonNode>> fields = properties.fields();
      while (fields.hasNext()) {
        var field = fields.next();
        declared.add(field.getKey());
        var value = node.get(field.getKey());
        if (value != null) {
          var result = check(field.getValue(), value, pointer + "/" + escape(field.getKey()));
          if (result.isPresent()) {
            return result;
          }
        }
      }
    }

    var additional = schema.get("additionalProperties");
    if (additional != null && additional.isBoolean() && !additional.booleanValue()) {
      Iterator<String> names = node.fieldNames();
      while (names.hasNext()) {
        var name = names.next();
        if (!declared.contains(name)) {
          return violation(
              pointer + "/" + escape(name), "additionalProperties", "no such property", name);
        }
      }
    }
    return Optional.empty();
  }

  private Optional<SchemaViolation> checkArray(JsonNode schema, JsonNode node, String pointer) {
    var minItems = schema.get("minItems");
    if (minItems != null && node.size() < minItems.asInt()) {
      return violation(
          pointer, "minItems", "at least " + minItems.asInt() + " items", node.size() + " items");
    }
    var maxItems = schema.get("maxItems");
    if (maxItems != null && node.size() > maxItems.asInt()) {
      return violation(
          pointer, "maxItems", "at most " + maxItems.asInt() + " items", node.size() + " items");
    }
    var items = schema.get("items");
    if (items != null && items.isObject()) {
      for (int i = 0; i < node.size(); i++) {
        var result = check(items, node.get(i), pointer + "/" + i);
        if (result.isPresent()) {
          return result;
        }
      }
    }
    return Optional.empty();
  }

  private Optional<SchemaViolation> checkString(JsonNode schema, String value, String pointer) {
    var length = value.codePointCount(0, value.length());
    var minLength = schema.get("minLength");
    if (minLength != null && length < minLength.asInt()) {
      return violation(
          pointer, "minLength", "at least " + minLength.asInt() + " characters", length + "");
    }
    var maxLength = schema.get("maxLength");
    if (maxLength != null && length > maxLength.asInt()) {
      return violation(
          pointer, "maxLength", "at most " + maxLength.asInt() + " characters", length + "");
    }
    var pattern = schema.get("pattern");
    if (pattern != null && pattern.isTextual()) {
      try {
        if (!Pattern.compile(pattern.textValue()).matcher(value).find()) {
          return violation(pointer, "pattern", "match " + pattern.textValue(), value);
        }
      } catch (PatternSyntaxException e) {
        return violation(
            pointer, "pattern", "valid pattern " + pattern.textValue(), e.getDescription());
      }
    }
    return Optional.empty();
  }

  private Optional<SchemaViolation> checkNumber(JsonNode schema, JsonNode node, String pointer) {
    var minimum = schema.get("minimum");
    if (minimum != null
        && minimum.isNumber()
        && node.decimalValue().compareTo(minimum.decimalValue()) < 0) {
      return violation(pointer, "minimum", ">= " + minimum.asText(), node.asText());
    }
    var maximum = schema.get("maximum");
    if (maximum != null
        && maximum.isNumber()
        && node.decimalValue().compareTo(maximum.decimalValue()) > 0) {
      return violation(pointer, "maximum", "<= " + maximum.asText(), node.asText());
    }
    return Optional.empty();
  }

  private static boolean matchesType(JsonNode type, JsonNode node) {
    if (type.isArray()) {
      for (JsonNode t : type) {
        if (matchesSingleType(t.asText(), node)) {
          return true;
        }
      }
      return false;
    }
    return matchesSingleType(type.asText(), node);
  }

  private static boolean matchesSingleType(String type, JsonNode node) {
    return switch (type) {
      case "object" -> node.isObject();
      case "array" -> node.isArray();
      case "string" -> node.isTextual();
      case "number" -> node.isNumber();
      case "integer" -> node.isIntegralNumber()
          || (node.isNumber() && node.decimalValue().stripTrailingZeros().scale() <= 0);
      case "boolean" -> node.isBoolean();
      case "null" -> node.isNull();
      default -> true;
    };
  }

  private static String typeText(JsonNode type) {
    return type.isArray() ? type.toString() : type.asText();
  }

  private static String describeType(JsonNode node) {
    if (node.isObject()) return "object";
    if (node.isArray()) return "array";
    if (node.isTextual()) return "string";
    if (node.isIntegralNumber()) return "integer";
    if (node.isNumber()) return "number";
    if (node.isBoolean()) return "boolean";
    if (node.isNull()) return "null";
    return node.getNodeType().name().toLowerCase();
  }

  private static String escape(String name) {
    return name.replace("~", "~0").replace("/", "~1");
  }

  private static Optional<SchemaViolation> violation(
      String pointer, String keyword, String expected, String actual) {
    return Optional.of(new SchemaViolation(pointer, keyword, expected, actual));
  }
}
