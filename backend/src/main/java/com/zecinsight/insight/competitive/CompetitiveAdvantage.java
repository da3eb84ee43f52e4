package com.zecinsight.insight.competitive;

/**
 * score is 0..100; level is Strong (70+), Moderate (40+) or Weak.
 */
public record CompetitiveAdvantage(int score, String level, String description) {
}
