package org.rewardledger.dto;

import lombok.*;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class DistributionResult {
    private int processed;
    private long registrySize;
    private long percentProcessed;  // processed * 100 / registrySize, tronqué
    private long totalAccrued;
}
