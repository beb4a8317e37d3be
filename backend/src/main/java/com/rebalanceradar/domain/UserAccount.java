package com.rebalanceradar.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Wallet-level activity roll-up across all chains. Key is the lowercased wallet address.
 * Only ever changed through {@link UserAccountRepositoryCustom}.
 */
@Document(collection = "users")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class UserAccount {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private long strategyCount;
    private long totalRebalances;
    private BigDecimal totalGasSpentWei;
    private Instant firstActivityAt;
    private Instant lastActivityAt;
}
