package com.earlywarning.analyzer.engine;

/**
 * Output of score fusion.
 *
 * @param threatScore fused score in [0.0, 1.0]
 * @param threatLevel tier of {@code threatScore}
 * @param confidence  agreement between the contributing signals
 *
 * @author Naveed Gung
 */
public record FusionResult(double threatScore, ThreatLevel threatLevel, Confidence confidence) {
}
