package com.govcontracts.infrastructure.dataset;

import com.govcontracts.domain.model.ContractRecord;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;

/**
 * Maps a row of the canonical projection to a {@link ContractRecord}.
 */
public class ContractRecordMapper implements RowMapper<ContractRecord> {

    public static final ContractRecordMapper INSTANCE = new ContractRecordMapper();

    @Override
    public ContractRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
        String awardDate = rs.getString("award_date");
        return ContractRecord.builder()
                .referenceId(rs.getString("reference_id"))
                .awardTitle(rs.getString("award_title"))
                .noticeTitle(rs.getString("notice_title"))
                .awardDate(awardDate == null ? null : LocalDate.parse(awardDate))
                .awardeeName(rs.getString("awardee_name"))
                .organizationName(rs.getString("organization_name"))
                .businessCategory(rs.getString("business_category"))
                .areaOfDelivery(rs.getString("area_of_delivery"))
                .contractAmount(rs.getBigDecimal("contract_amount"))
                .awardStatus(rs.getString("award_status"))
                .searchText(rs.getString("search_text"))
                .partitionId(rs.getString("partition_id"))
                .build();
    }
}
