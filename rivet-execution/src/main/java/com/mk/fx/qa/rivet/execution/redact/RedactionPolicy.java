package com.mk.fx.qa.rivet.execution.redact;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Scrubs secrets from anything that leaves the engine: captured headers, bodies, URLs and failure
 * messages. Header names and keys are matched case-insensitively.
 */
public final class RedactionPolicy {

  public static final String MASK = "[REDACTED]";

  public static final Set<String> DEFAULT_HEADERS =
      Set.of(
          "authorization",
          "proxy-authorization",
          "cookie",
          "set-cookie",
          "x-api-key",
          "api-key",
          "x-auth-token");

  public static final Set<String> DEFAULT_KEYS =
      Set.of(
          "password",
          "secret",
          "token",
          "access_token",
          "refresh_token",
          "api_key",
          "client_secret");

  public static final int DEFAULT_BODY_LIMIT = 2048;

  private static final Pattern BEARER =
      Pattern.compile("(?i)(bearer)\\s+[A-Za-z0-9\\-._~+/]+=*");

  private static final Pattern LAST_NAME = Pattern.compile("([A-Za-z0-9_\\-]+)['\"\\]]*$");

  private final Set<String> headers;
  private final Set<String> keys;
  private final int bodyLimit;
  private final Pattern jsonField;
  private final Pattern queryParam;

  public RedactionPolicy(Collection<String> headers, Collection<String> keys, int bodyLimit) {
    this.headers = lower(headers);
    this.keys = lower(keys);
    this.bodyLimit = Math.max(0, bodyLimit);
    var alternation =
        this.keys.stream().map(Pattern::quote).collect(Collectors.joining("|", "(?:", ")"));
    this.jsonField =
        Pattern.compile("(?i)(\"" + alternation + "\"\\s*:\\s*)\"(?:[^\"\\\\]|\\\\.)*\"");
    this.queryParam = Pattern.compile("(?i)([?&]" + alternation + "=)[^&#\\s]*");
  }

  public static RedactionPolicy defaults() {
    return new RedactionPolicy(DEFAULT_HEADERS, DEFAULT_KEYS, DEFAULT_BODY_LIMIT);
  }

  /** Returns a copy with sensitive header values masked. */
  public Map<String, String> headers(Map<String, String> values) {
    if (values == null || values.isEmpty()) {
      return Map.of();
    }
    var out = new LinkedHashMap<String, String>();
    values.forEach(
        (name, value) -> {
          if (name == null) {
            return;
          }
          out.put(name, headers.contains(name.toLowerCase(Locale.ROOT)) ? MASK : text(value));
        });
    return out;
  }

  /** Masks bearer tokens, sensitive JSON string fields and sensitive query parameters. */
  public String text(String value) {
    if (value == null || value.isEmpty()) {
      return value;
    }
    var result = BEARER.matcher(value).replaceAll("$1 " + Matcher.quoteReplacement(MASK));
    if (!keys.isEmpty()) {
      result = jsonField.matcher(result).replaceAll("$1\"" + Matcher.quoteReplacement(MASK) + "\"");
      result = queryParam.matcher(result).replaceAll("$1" + Matcher.quoteReplacement(MASK));
    }
    return result;
  }

  /** {@link #text(String)} followed by truncation to the configured body limit. */
  public String body(String value) {
    var masked = text(value);
    if (masked == null || masked.length() <= bodyLimit) {
      return masked;
    }
    return masked.substring(0, bodyLimit)
        + "...(truncated "
        + (masked.length() - bodyLimit)
        + " chars)";
  }

  /**
   * Whether a check locator points at a secret: a sensitive header, or a body path whose last
   * property is a sensitive key.
   */
  public boolean isSensitiveLocator(String locator) {
    if (locator == null || locator.isBlank()) {
      return false;
    }
    if (locator.regionMatches(true, 0, "header ", 0, 7)) {
      return headers.contains(locator.substring(7).trim().toLowerCase(Locale.ROOT));
    }
    var name = LAST_NAME.matcher(locator.trim());
    return name.find() && keys.contains(name.group(1).toLowerCase(Locale.ROOT));
  }

  public int bodyLimit() {
    return bodyLimit;
  }

  private static Set<String> lower(Collection<String> values) {
    if (values == null) {
      return Set.of();
    }
    return values.stream()
        .filter(v -> v != null && !v.isBlank())
        .map(v -> v.trim().toLowerCase(Locale.ROOT))
        .collect(Collectors.toUnmodifiableSet());
  }
}
