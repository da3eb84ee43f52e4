package com.zecinsight.privacy;

import com.zecinsight.domain.PrivacyMode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AccessPolicyTest {

    @Test
    @DisplayName("owner always gets full data, whatever the mode")
    void owner_fullAccess() {
        for (PrivacyMode mode : PrivacyMode.values()) {
            AccessDecision d = AccessPolicy.decide(mode, "user-1", "user-1", false);
            assertThat(d.allowed()).isTrue();
            assertThat(d.dataLevel()).isEqualTo(DataLevel.FULL);
        }
    }

    @Test
    @DisplayName("private wallet denies non-owners without asking for payment")
    void private_deniesOthers() {
        AccessDecision d = AccessPolicy.decide(PrivacyMode.PRIVATE, "user-1", "user-2", true);
        assertThat(d.allowed()).isFalse();
        assertThat(d.requiresPayment()).isFalse();
        assertThat(d.dataLevel()).isNull();
    }

    @Test
    @DisplayName("public wallet grants aggregated data to anyone, anonymous included")
    void public_aggregatedForAnyone() {
        AccessDecision d = AccessPolicy.decide(PrivacyMode.PUBLIC, "user-1", null, false);
        assertThat(d.allowed()).isTrue();
        assertThat(d.dataLevel()).isEqualTo(DataLevel.AGGREGATED);
    }

    @Test
    @DisplayName("monetizable wallet requires payment, then grants full data")
    void monetizable_requiresPayment() {
        AccessDecision unpaid = AccessPolicy.decide(PrivacyMode.MONETIZABLE, "user-1", "buyer", false);
        assertThat(unpaid.allowed()).isFalse();
        assertThat(unpaid.requiresPayment()).isTrue();

        AccessDecision paid = AccessPolicy.decide(PrivacyMode.MONETIZABLE, "user-1", "buyer", true);
        assertThat(paid.allowed()).isTrue();
        assertThat(paid.dataLevel()).isEqualTo(DataLevel.FULL);
    }

    @Test
    @DisplayName("missing mode is treated as private")
    void nullMode_private() {
        AccessDecision d = AccessPolicy.decide(null, "user-1", "user-2", false);
        assertThat(d.allowed()).isFalse();
        assertThat(d.privacyMode()).isEqualTo(PrivacyMode.PRIVATE);
    }
}
