package com.lphedge.hedge.format;

import com.lphedge.hedge.PositionSnapshot;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Renders a {@link PositionSnapshot} into the status text pushed to chat. Amounts use four decimals,
 * the delta ratio is shown as a percentage with two.
 */
public final class SnapshotMessageFormatter {

  private final SnapshotMessageTemplate template;

  public SnapshotMessageFormatter() {
    this(SnapshotMessageTemplate.DEFAULT);
  }

  public SnapshotMessageFormatter(SnapshotMessageTemplate template) {
    this.template = Objects.requireNonNull(template, "template");
  }

  public String format(PositionSnapshot snapshot, String label) {
    return template.render(values(snapshot, label));
  }

  static Map<String, String> values(PositionSnapshot s, String label) {
    Map<String, String> v = new LinkedHashMap<>();
    v.put("label", label == null ? "" : label);
    v.put("symbol", s.symbol() == null ? "" : s.symbol());
    v.put("blockNumber", Long.toString(s.blockNumber()));
    v.put("baseAmount", amount(s.ammBaseAmount()));
    v.put("baseValueUsdt", amount(s.ammBaseValueUsdt()));
    v.put("deltaRatioPct", percent(s.baseDeltaRatio()));
    v.put("baseDelta", amount(s.baseDelta()));
    v.put("futuresPosition", amount(s.futuresPosition()));
    v.put("unrealizedPnl", amount(s.unrealizedPnl()));
    v.put("basePriceUsdt", amount(s.basePriceUsdt()));
    v.put("totalValueUsdt", amount(s.totalValueUsdt()));
    v.put("collectableBase", amount(s.ammCollectableBase()));
    v.put("collectableBaseValueUsdt", amount(s.ammCollectableBaseValueUsdt()));
    v.put("collectableUsdt", amount(s.ammCollectableUsdt()));
    v.put("collectableValueUsdt", amount(s.ammCollectableValueUsdt()));
    return v;
  }

  private static String amount(double value) {
    return String.format(Locale.ROOT, "%.4f", value);
  }

  private static String percent(double ratio) {
    return String.format(Locale.ROOT, "%.2f", ratio * 100.0);
  }
}
