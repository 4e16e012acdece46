package com.gentoro.onerag.retrieval;

import static com.gentoro.onerag.retrieval.AllowedStatus.ALLOWED;
import static com.gentoro.onerag.retrieval.AllowedStatus.BLOCKED;
import static com.gentoro.onerag.retrieval.AllowedStatus.PROMPT_REQUIRED;

import java.util.Locale;

/**
 * Governance mode gating risk-sensitive results. Each mode carries a score multiplier and an
 * allowed status per {@link RiskLevel}:
 *
 * <pre>
 *              safe        sensitive          dangerous
 * READ_ONLY    1.0 allowed 0.1 blocked        0.0 blocked
 * PERMISSION   1.0 allowed 0.8 prompt_required 0.5 prompt_required
 * BYPASS       1.0 allowed 1.0 allowed        1.0 allowed
 * </pre>
 */
public enum GovernanceMode {
  READ_ONLY(new double[] {1.0, 0.1, 0.0}, new AllowedStatus[] {ALLOWED, BLOCKED, BLOCKED}),
  PERMISSION(
      new double[] {1.0, 0.8, 0.5},
      new AllowedStatus[] {ALLOWED, PROMPT_REQUIRED, PROMPT_REQUIRED}),
  BYPASS(new double[] {1.0, 1.0, 1.0}, new AllowedStatus[] {ALLOWED, ALLOWED, ALLOWED});

  private static final org.slf4j.Logger log =
      com.gentoro.onerag.logging.LoggingService.getLogger(GovernanceMode.class);

  private final double[] multipliers;
  private final AllowedStatus[] statuses;

  GovernanceMode(double[] multipliers, AllowedStatus[] statuses) {
    this.multipliers = multipliers;
    this.statuses = statuses;
  }

  public double multiplier(RiskLevel risk) {
    return multipliers[risk.ordinal()];
  }

  public AllowedStatus allowedStatus(RiskLevel risk) {
    return statuses[risk.ordinal()];
  }

  /** Parses a mode name; unknown or missing names fall back to {@link #PERMISSION}. */
  public static GovernanceMode parse(String mode) {
    if (mode != null) {
      String normalized = mode.trim().toUpperCase(Locale.ROOT);
      for (GovernanceMode m : values()) {
        if (m.name().equals(normalized)) return m;
      }
    }
    log.warn("Unknown governance mode '{}', using PERMISSION", mode);
    return PERMISSION;
  }
}
