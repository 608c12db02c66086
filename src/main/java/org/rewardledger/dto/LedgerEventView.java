package org.rewardledger.dto;

import lombok.*;
import org.rewardledger.model.LedgerEvent;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class LedgerEventView {
    private Long id;
    private String type;
    private String address;
    private String counterparty;
    private long amount;
    private Integer level;
    private long createdAtEpochMs;

    public static LedgerEventView fromEntity(LedgerEvent e) {
        return LedgerEventView.builder()
                .id(e.getId())
                .type(e.getType().name())
                .address(e.getAddress())
                .counterparty(e.getCounterparty())
                .amount(e.getAmount())
                .level(e.getLevel())
                .createdAtEpochMs(e.getCreatedAt().toEpochMilli())
                .build();
    }
}
