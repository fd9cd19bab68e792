package com.defimonitor.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;

@Data
@Builder
public class ProtocolStatusDTO {

    public static final String HEALTHY = "healthy";
    public static final String UNKNOWN = "unknown";

    private String name;
    private BigDecimal tvl;
    private BigDecimal apy;
    private BigDecimal utilization;
    /** healthy / warning / critical / unknown */
    private String status;
    @JsonProperty("last_updated")
    private String lastUpdated;
}
