package com.zecinsight.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Append-only record of a privacy mode change.
 */
@Document(collection = "privacy_audit_log")
@NoArgsConstructor
@Getter
@Setter
public class PrivacyAuditEntry {

    @Id
    private String id;
    @Indexed
    private String walletId;
    private PrivacyMode previousMode;
    private PrivacyMode privacyMode;
    private Instant changedAt;
}
