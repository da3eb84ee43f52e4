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
 * Project owning a set of wallets. {@code userId} is the owner of every wallet in the project.
 * Category (defi, gamefi, social_fi, nft, ...) selects the peer benchmarks.
 */
@Document(collection = "projects")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Project {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    @Indexed
    private String userId;
    private String name;
    @Indexed
    private String category;
    private Instant createdAt;
}
