package com.govcontracts.domain.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One row of the canonical contract schema exposed by every fact partition.
 *
 * Records are produced by the external ETL and never mutated here.
 * {@code searchText} is the lower-cased title concatenation used for keyword
 * matching only, so it is kept out of responses.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContractRecord {

    @JsonProperty("reference_id")
    private String referenceId;

    @JsonProperty("award_title")
    private String awardTitle;

    @JsonProperty("notice_title")
    private String noticeTitle;

    @JsonProperty("award_date")
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd")
    private LocalDate awardDate;

    @JsonProperty("awardee_name")
    private String awardeeName;

    @JsonProperty("organization_name")
    private String organizationName;

    @JsonProperty("business_category")
    private String businessCategory;

    @JsonProperty("area_of_delivery")
    private String areaOfDelivery;

    @JsonProperty("contract_amount")
    private BigDecimal contractAmount;

    @JsonProperty("award_status")
    private String awardStatus;

    @JsonProperty("partition_id")
    private String partitionId;

    @JsonIgnore
    private String searchText;
}
