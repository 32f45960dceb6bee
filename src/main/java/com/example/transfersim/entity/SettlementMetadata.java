package com.example.transfersim.entity;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.math.BigDecimal;

/**
 * 結算附加資訊（合約顯示用）
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class SettlementMetadata implements Serializable {
    private static final long serialVersionUID = 1L;

    @JsonProperty("contract_title")
    private String contractTitle;

    @JsonProperty("original_stake")
    private BigDecimal originalStake;

    @JsonProperty("winnings")
    private BigDecimal winnings;

    @JsonProperty("loser_display_name")
    private String loserDisplayName;

    @JsonProperty("winner_display_name")
    private String winnerDisplayName;
}
