package io.openproposal.composer.variable;

import io.openproposal.composer.block.Block;
import io.openproposal.composer.block.TextBearing;
import io.openproposal.composer.config.ComposerProperties;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Resolves {@code {{name}}} merge fields. Caller-supplied custom values win over the built-in
 * catalogue; anything left unresolved is rendered as {@code [name]} so broken merge fields stay
 * visible in the output.
 */
@Component
public class VariableInterpolator {

  private static final Logger log = LoggerFactory.getLogger(VariableInterpolator.class);

  static final Pattern TOKEN_PATTERN =
      Pattern.compile(
          "\\{\\{\\s*([A-Za-z_][A-Za-z0-9_]*(?:\\.[A-Za-z_][A-Za-z0-9_]*)*)\\s*\\}\\}");

  private final Clock clock;
  private final DateTimeFormatter dateFormatter;

  public VariableInterpolator(Clock clock, ComposerProperties properties) {
    this.clock = clock;
    this.dateFormatter = properties.variables().dateFormatter();
  }

  /**
   * Replaces every merge field in {@code text}.
   *
   * @param text text containing merge fields; null yields an empty string
   * @param customValues author/sender supplied values by exact name; may be null
   * @param context values for the built-in catalogue; may be null
   * @return the interpolated text
   */
  public String interpolate(
      String text, Map<String, String> customValues, VariableContext context) {
    if (text == null || text.isEmpty()) {
      return "";
    }
    Map<String, String> custom = customValues != null ? customValues : Map.of();
    VariableContext ctx = context != null ? context : VariableContext.empty();
    var unresolved = new ArrayList<String>();

    String result =
        TOKEN_PATTERN
            .matcher(text)
            .replaceAll(
                match -> {
                  String name = match.group(1);
                  String value = resolve(name, custom, ctx);
                  if (value == null) {
                    unresolved.add(name);
                    value = "[" + name + "]";
                  }
                  return Matcher.quoteReplacement(value);
                });

    if (!unresolved.isEmpty()) {
      log.debug("Unresolved merge fields rendered as placeholders: names={}", unresolved);
    }
    return result;
  }

  /** Returns the distinct merge field names in {@code text}, in order of first appearance. */
  public Set<String> extractVariables(String text) {
    var names = new LinkedHashSet<String>();
    if (text == null) {
      return names;
    }
    Matcher matcher = TOKEN_PATTERN.matcher(text);
    while (matcher.find()) {
      names.add(matcher.group(1));
    }
    return names;
  }

  /** Splits names into those the built-in catalogue knows and author-defined ones. */
  public VariableClassification classify(Collection<String> names) {
    var builtIn = new ArrayList<String>();
    var custom = new ArrayList<String>();
    for (String name : names) {
      (BuiltInVariable.isBuiltIn(name) ? builtIn : custom).add(name);
    }
    return new VariableClassification(builtIn, custom);
  }

  /**
   * Interpolates every text-bearing block whose content contains a merge field. Other blocks are
   * returned as the same instances.
   */
  public List<Block> interpolateBlocks(
      List<Block> blocks, Map<String, String> customValues, VariableContext context) {
    return blocks.stream()
        .map(
            block -> {
              if (block instanceof TextBearing text
                  && text.content() != null
                  && text.content().contains("{{")) {
                return text.withContent(interpolate(text.content(), customValues, context));
              }
              return block;
            })
        .toList();
  }

  /** Collects and classifies the merge fields used across a document's text-bearing blocks. */
  public VariableClassification documentVariables(List<Block> blocks) {
    var names = new LinkedHashSet<String>();
    for (var block : blocks) {
      if (block instanceof TextBearing text) {
        names.addAll(extractVariables(text.content()));
      }
    }
    return classify(names);
  }

  private String resolve(String name, Map<String, String> custom, VariableContext ctx) {
    String customValue = custom.get(name);
    if (customValue != null) {
      return customValue;
    }
    return BuiltInVariable.fromKey(name).map(v -> resolveBuiltIn(v, ctx)).orElse(null);
  }

  private String resolveBuiltIn(BuiltInVariable variable, VariableContext ctx) {
    var recipient = ctx.recipient();
    var sender = ctx.sender();
    var document = ctx.document();
    return switch (variable) {
      case RECIPIENT_NAME -> recipient != null ? recipient.name() : null;
      case RECIPIENT_EMAIL -> recipient != null ? recipient.email() : null;
      case SENDER_NAME -> sender != null ? sender.name() : null;
      case SENDER_EMAIL -> sender != null ? sender.email() : null;
      case SENDER_COMPANY -> sender != null ? sender.company() : null;
      case DOCUMENT_TITLE -> document != null ? document.title() : null;
      case DATE_TODAY -> dateFormatter.format(Instant.now(clock));
      case DATE_EXPIRY ->
          document != null && document.expiresAt() != null
              ? dateFormatter.format(document.expiresAt())
              : null;
    };
  }
}
