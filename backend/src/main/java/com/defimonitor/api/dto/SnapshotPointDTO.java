package com.defimonitor.api.dto;

import com.defimonitor.model.ProtocolSnapshot;
import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;

@Data
@Builder
public class SnapshotPointDTO {
    private String timestamp;
    private BigDecimal tvl;
    private BigDecimal apy;
    private BigDecimal utilization;

    public static SnapshotPointDTO from(ProtocolSnapshot s) {
        return SnapshotPointDTO.builder()
                .timestamp(s.getTs() == null ? null : s.getTs().toString())
                .tvl(s.getTvlUsd())
                .apy(s.getApy7d())
                .utilization(s.getUtilizationRate())
                .build();
    }
}
