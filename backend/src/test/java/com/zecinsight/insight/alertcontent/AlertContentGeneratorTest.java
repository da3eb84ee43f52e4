package com.zecinsight.insight.alertcontent;

import com.zecinsight.alert.Alert;
import com.zecinsight.alert.AlertSeverity;
import com.zecinsight.alert.AlertType;
import com.zecinsight.common.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AlertContentGeneratorTest {

    private static Alert alert(AlertType type, AlertSeverity severity, Map<String, Object> data) {
        return new Alert(type, severity, type.getValue(), "message", data, Instant.parse("2025-03-01T00:00:00Z"));
    }

    @Test
    @DisplayName("critical alerts open with P0 emergency items and end with a review item")
    void generateActionItems_critical() {
        List<ActionItem> items = AlertContentGenerator.generateActionItems(
                alert(AlertType.RETENTION_CRITICAL, AlertSeverity.CRITICAL, Map.of()));

        assertThat(items).hasSize(6);
        assertThat(items.get(0).priority()).isEqualTo("P0");
        assertThat(items.get(1).priority()).isEqualTo("P0");
        assertThat(items.get(2).action()).isEqualTo("Launch re-engagement email campaign");
        assertThat(items.get(2).priority()).isEqualTo("P0");
        assertThat(items.get(items.size() - 1).priority()).isEqualTo("P2");
    }

    @Test
    @DisplayName("non-critical retention alert has no P0 item")
    void generateActionItems_warning() {
        List<ActionItem> items = AlertContentGenerator.generateActionItems(
                alert(AlertType.RETENTION_DROP, AlertSeverity.WARNING, Map.of()));
        assertThat(items).hasSize(4).noneMatch(i -> i.priority().equals("P0"));
    }

    @Test
    @DisplayName("priority score adds severity, type, affected share and trend")
    void calculatePriorityScore_components() {
        Alert churn = alert(AlertType.CHURN_CRITICAL, AlertSeverity.CRITICAL, Map.of("churn_rate", 45.0));
        assertThat(AlertContentGenerator.calculatePriorityScore(churn, new AlertContext(Trend.WORSENING, null)))
                .isEqualTo(95);

        Alert funnel = alert(AlertType.FUNNEL_DROP_OFF, AlertSeverity.WARNING,
                Map.of("drop_off_percentage", 55.0, "to_stage", "feature_usage"));
        assertThat(AlertContentGenerator.calculatePriorityScore(funnel, AlertContext.none())).isEqualTo(68);

        Alert spike = alert(AlertType.SHIELDED_SPIKE, AlertSeverity.INFO, null);
        assertThat(AlertContentGenerator.calculatePriorityScore(spike, new AlertContext(Trend.STABLE, null)))
                .isEqualTo(35);
    }

    @Test
    @DisplayName("explicit affected percentage wins over alert data")
    void calculatePriorityScore_contextOverridesData() {
        Alert drop = alert(AlertType.RETENTION_DROP, AlertSeverity.WARNING, Map.of("drop_percentage", 20.0));
        assertThat(AlertContentGenerator.calculatePriorityScore(drop, new AlertContext(null, 5.0))).isEqualTo(58);
        assertThat(AlertContentGenerator.calculatePriorityScore(drop, AlertContext.none())).isEqualTo(63);
    }

    @Test
    @DisplayName("urgency is capped at 100 and mapped to a response level")
    void calculateUrgency_levels() {
        Urgency critical = AlertContentGenerator.calculateUrgency(
                alert(AlertType.CHURN_CRITICAL, AlertSeverity.CRITICAL, Map.of()), Trend.WORSENING);
        assertThat(critical.score()).isEqualTo(100);
        assertThat(critical.level()).isEqualTo("critical");

        Urgency high = AlertContentGenerator.calculateUrgency(
                alert(AlertType.LOW_CONVERSION, AlertSeverity.WARNING, Map.of()), null);
        assertThat(high.score()).isEqualTo(60);
        assertThat(high.level()).isEqualTo("high");

        Urgency low = AlertContentGenerator.calculateUrgency(
                alert(AlertType.SHIELDED_SPIKE, AlertSeverity.INFO, Map.of()), Trend.IMPROVING);
        assertThat(low.level()).isEqualTo("low");
        assertThat(low.rationale()).isEqualTo("Based on info severity and shielded_spike type");
    }

    @Test
    @DisplayName("funnel suggestions name the stage from the alert data")
    void generateSuggestions_funnelStage() {
        List<Suggestion> suggestions = AlertContentGenerator.generateSuggestions(alert(AlertType.FUNNEL_DROP_OFF,
                AlertSeverity.WARNING, Map.of("to_stage", "feature_usage")));
        assertThat(suggestions).hasSize(5);
        assertThat(suggestions.get(0).suggestion())
                .isEqualTo("Optimize the feature_usage stage to reduce friction and improve conversion");
    }

    @Test
    @DisplayName("critical churn adds an emergency suggestion")
    void generateSuggestions_criticalChurn() {
        assertThat(AlertContentGenerator.generateSuggestions(alert(AlertType.CHURN_CRITICAL, AlertSeverity.CRITICAL, Map.of())))
                .extracting(Suggestion::category).contains("emergency").hasSize(5);
        assertThat(AlertContentGenerator.generateSuggestions(alert(AlertType.HIGH_RISK_WALLETS, AlertSeverity.WARNING, Map.of())))
                .extracting(Suggestion::category).doesNotContain("emergency");
    }

    @Test
    @DisplayName("packages are ordered by priority score")
    void generateAlertPackages_sorted() {
        List<EnrichedAlert> out = AlertContentGenerator.generateAlertPackages(List.of(
                alert(AlertType.SHIELDED_SPIKE, AlertSeverity.INFO, Map.of()),
                alert(AlertType.CHURN_CRITICAL, AlertSeverity.CRITICAL, Map.of("churn_rate", 60.0))), null);

        assertThat(out).extracting(EnrichedAlert::type)
                .containsExactly(AlertType.CHURN_CRITICAL, AlertType.SHIELDED_SPIKE);
        assertThat(out.get(0).estimatedImpact().overall()).isEqualTo("High");
        assertThat(out.get(0).timeline().total()).isEqualTo("2-4 weeks");
    }

    @Test
    @DisplayName("trend parsing accepts known values and treats blank as absent")
    void trend_fromValue() {
        assertThat(Trend.fromValue(" Worsening ")).isEqualTo(Trend.WORSENING);
        assertThat(Trend.fromValue("")).isNull();
        assertThatThrownBy(() -> Trend.fromValue("sideways")).isInstanceOf(ValidationException.class);
    }
}
