package com.govcontracts.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Record-level export row. Column order is the CSV header order.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"reference_id", "contract_no", "award_title", "notice_title", "awardee_name",
        "organization_name", "area_of_delivery", "business_category", "contract_amount",
        "award_date", "award_status"})
public class ContractCsvRow {

    @JsonProperty("reference_id")
    private String referenceId;

    @JsonProperty("contract_no")
    private String contractNo;

    @JsonProperty("award_title")
    private String awardTitle;

    @JsonProperty("notice_title")
    private String noticeTitle;

    @JsonProperty("awardee_name")
    private String awardeeName;

    @JsonProperty("organization_name")
    private String organizationName;

    @JsonProperty("area_of_delivery")
    private String areaOfDelivery;

    @JsonProperty("business_category")
    private String businessCategory;

    @JsonProperty("contract_amount")
    private String contractAmount;

    @JsonProperty("award_date")
    private String awardDate;

    @JsonProperty("award_status")
    private String awardStatus;

    public static ContractCsvRow from(ContractRecord record) {
        return ContractCsvRow.builder()
                .referenceId(record.getReferenceId())
                .contractNo(record.getReferenceId())
                .awardTitle(record.getAwardTitle())
                .noticeTitle(record.getNoticeTitle())
                .awardeeName(record.getAwardeeName())
                .organizationName(record.getOrganizationName())
                .areaOfDelivery(record.getAreaOfDelivery())
                .businessCategory(record.getBusinessCategory())
                .contractAmount(record.getContractAmount() == null ? null : record.getContractAmount().toPlainString())
                .awardDate(record.getAwardDate() == null ? null : record.getAwardDate().toString())
                .awardStatus(record.getAwardStatus())
                .build();
    }
}
