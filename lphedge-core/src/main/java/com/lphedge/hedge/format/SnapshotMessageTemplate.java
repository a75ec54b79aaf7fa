package com.lphedge.hedge.format;

import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Status report text with {@code {name}} placeholders. Placeholders without a value are left as-is.
 */
public record SnapshotMessageTemplate(String text) {

  public static final SnapshotMessageTemplate DEFAULT = new SnapshotMessageTemplate("""
      [{label}] {symbol} @ block {blockNumber}
      Holding: {baseAmount} {label} ({baseValueUsdt} USDT)
      Delta ratio: {deltaRatioPct}%
      Total value: {totalValueUsdt} USDT
      Collectable: {collectableBase} {label} ({collectableBaseValueUsdt} USDT) + {collectableUsdt} USDT = {collectableValueUsdt} USDT""");

  private static final Pattern PLACEHOLDER = Pattern.compile("\\{([A-Za-z][A-Za-z0-9]*)}");

  public SnapshotMessageTemplate {
    Objects.requireNonNull(text, "text");
  }

  public static SnapshotMessageTemplate ofNullable(String text) {
    if (text == null || text.isBlank()) {
      return DEFAULT;
    }
    return new SnapshotMessageTemplate(text);
  }

  public String render(Map<String, String> values) {
    Matcher m = PLACEHOLDER.matcher(text);
    return m.replaceAll(match -> {
      String value = values.get(match.group(1));
      return Matcher.quoteReplacement(value != null ? value : match.group());
    });
  }
}
