package org.rewardledger.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.rewardledger.model.Asset;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SweepRequest {
    private Asset asset;
    private String to;
    private long amount;
}
