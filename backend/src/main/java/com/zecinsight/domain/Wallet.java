package com.zecinsight.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Tracked wallet. Belongs to exactly one project; the project's user is the wallet owner.
 * CRUD is owned by the project service; this core only mutates {@link #privacyMode}.
 */
@Document(collection = "wallets")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Wallet {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    @Indexed
    private String projectId;
    private String address;
    private WalletType type;
    @Indexed
    private PrivacyMode privacyMode = PrivacyMode.PRIVATE;
    private boolean active = true;
    private Instant createdAt;
    private Instant updatedAt;
}
