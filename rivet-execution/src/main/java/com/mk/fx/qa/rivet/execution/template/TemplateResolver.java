package com.mk.fx.qa.rivet.execution.template;

import com.mk.fx.qa.rivet.execution.assertion.Check;
import com.mk.fx.qa.rivet.execution.assertion.HeaderCheck;
import com.mk.fx.qa.rivet.execution.assertion.PathCheck;
import com.mk.fx.qa.rivet.execution.assertion.StatusCheck;
import com.mk.fx.qa.rivet.execution.model.DatasetRow;
import com.mk.fx.qa.rivet.execution.model.RequestTemplate;
import com.mk.fx.qa.rivet.rest.Request;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Substitutes {@code {{name}}} variables and {@code ${NAME:default}} environment lookups.
 *
 * <p>{@code {{name}}} resolves from the variable scope first and the environment second; unknown
 * names are left untouched. {@code ${NAME:default}} resolves from the environment first, the scope
 * second and falls back to the default (empty when omitted). Resolution is a pure function of its
 * inputs and the environment lookup.
 */
public class TemplateResolver {

  /** Exposes the selected environment name to templates. */
  public static final String ENVIRONMENT_VARIABLE = "RIVET_ENV";

  private static final Pattern VARIABLE = Pattern.compile("\\{\\{(\\w+)\\}\\}");
  private static final Pattern ENV_LOOKUP = Pattern.compile("\\$\\{([^:}]+)(?::([^}]*))?\\}");

  private final Function<String, String> environment;

  public TemplateResolver(Function<String, String> environment) {
    this.environment = Objects.requireNonNull(environment, "environment");
  }

  public static TemplateResolver systemEnvironment() {
    return new TemplateResolver(System::getenv);
  }

  public String resolve(String text, Map<String, String> scope) {
    if (text == null || text.isEmpty()) {
      return text;
    }
    var vars = scope == null ? Map.<String, String>of() : scope;

    var variables = VARIABLE.matcher(text);
    var sb = new StringBuilder();
    while (variables.find()) {
      var name = variables.group(1);
      var value = vars.containsKey(name) ? vars.get(name) : environment.apply(name);
      variables.appendReplacement(
          sb, Matcher.quoteReplacement(value != null ? value : variables.group()));
    }
    variables.appendTail(sb);

    var lookups = ENV_LOOKUP.matcher(sb.toString());
    var out = new StringBuilder();
    while (lookups.find()) {
      var name = lookups.group(1);
      var fallback = lookups.group(2) != null ? lookups.group(2) : "";
      var value = environment.apply(name);
      if (value == null) {
        value = vars.getOrDefault(name, fallback);
      }
      lookups.appendReplacement(out, Matcher.quoteReplacement(value));
    }
    lookups.appendTail(out);
    return out.toString();
  }

  public Map<String, String> resolveAll(Map<String, String> values, Map<String, String> scope) {
    if (values == null || values.isEmpty()) {
      return Map.of();
    }
    var resolved = new LinkedHashMap<String, String>();
    values.forEach((k, v) -> resolved.put(k, resolve(v, scope)));
    return Collections.unmodifiableMap(resolved);
  }

  /**
   * Builds the variable scope of one unit. Suite variables are expanded in declaration order, so a
   * value may reference any variable declared before it. Row values are taken verbatim and override
   * suite variables of the same name.
   *
   * @param environmentName selected environment, exposed as {@value #ENVIRONMENT_VARIABLE}
   */
  public Map<String, String> buildScope(
      Map<String, String> suiteVariables, DatasetRow row, String environmentName) {
    var scope = new LinkedHashMap<String, String>();
    if (environmentName != null && !environmentName.isBlank()) {
      scope.put(ENVIRONMENT_VARIABLE, environmentName);
    }
    if (suiteVariables != null) {
      suiteVariables.forEach((k, v) -> scope.put(k, resolve(v, scope)));
    }
    if (row != null) {
      scope.putAll(row.values());
    }
    return Collections.unmodifiableMap(scope);
  }

  public Request resolveRequest(RequestTemplate template, Map<String, String> scope) {
    var request = new Request();
    request.setMethod(template.method());
    request.setUrl(resolve(template.url(), scope));
    request.setHeaders(resolveAll(template.headers(), scope));
    request.setQuery(resolveAll(template.query(), scope));
    request.setBody(resolve(template.body(), scope));
    return request;
  }

  /**
   * Substitutes placeholders in expected values. A string path expectation that reads as an integer
   * or a boolean after substitution is compared as that type.
   */
  public List<Check> resolveChecks(List<Check> checks, Map<String, String> scope) {
    List<Check> resolved = new ArrayList<>(checks.size());
    for (Check check : checks) {
      resolved.add(
          switch (check.kind()) {
            case STATUS -> new StatusCheck(resolve(((StatusCheck) check).expected(), scope));
            case HEADER -> {
              var header = (HeaderCheck) check;
              yield new HeaderCheck(header.name(), resolve(header.expected(), scope));
            }
            case PATH -> {
              var path = (PathCheck) check;
              yield path.expected() instanceof String text
                  ? path.withExpected(coerce(resolve(text, scope)))
                  : path;
            }
            case SCHEMA -> check;
          });
    }
    return resolved;
  }

  static Object coerce(String value) {
    if ("true".equals(value) || "false".equals(value)) {
      return Boolean.valueOf(value);
    }
    try {
      return Long.parseLong(value);
    } catch (NumberFormatException e) {
      return value;
    }
  }
}
