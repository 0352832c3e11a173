package io.openproposal.composer.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the composition engine.
 *
 * @param builder undo history and lock policy for the builder state machine
 * @param variables formatting of the {@code date.*} built-in merge fields
 */
@Validated
@ConfigurationProperties(prefix = "composer")
public record ComposerProperties(
    @Valid @DefaultValue Builder builder, @Valid @DefaultValue Variables variables) {

  public static final int DEFAULT_HISTORY_LIMIT = 50;

  /** Properties with every value at its default, for wiring components by hand. */
  public static ComposerProperties defaults() {
    return new ComposerProperties(
        new Builder(DEFAULT_HISTORY_LIMIT, false), new Variables("MMMM d, yyyy", "en-US", "UTC"));
  }

  /**
   * @param historyLimit maximum number of undo snapshots kept; the oldest is evicted first
   * @param titleEditableWhenLocked whether SetTitle is accepted on a locked document
   */
  public record Builder(
      @Min(1) @DefaultValue("50") int historyLimit,
      @DefaultValue("false") boolean titleEditableWhenLocked) {}

  /**
   * @param datePattern {@link DateTimeFormatter} pattern for date.today and date.expiry
   * @param locale BCP 47 language tag used when formatting dates
   * @param zone time zone the dates are rendered in
   */
  public record Variables(
      @NotBlank @DefaultValue("MMMM d, yyyy") String datePattern,
      @NotBlank @DefaultValue("en-US") String locale,
      @NotBlank @DefaultValue("UTC") String zone) {

    public DateTimeFormatter dateFormatter() {
      return DateTimeFormatter.ofPattern(datePattern, Locale.forLanguageTag(locale))
          .withZone(ZoneId.of(zone));
    }
  }
}
