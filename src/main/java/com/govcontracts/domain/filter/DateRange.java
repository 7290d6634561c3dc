package com.govcontracts.domain.filter;

import com.govcontracts.domain.model.ContractRecord;
import lombok.Value;

import java.time.LocalDate;

/**
 * Inclusive award-date range. Yearly and quarterly filters compile to this too.
 */
@Value
public class DateRange implements FilterNode {

    LocalDate start;
    LocalDate end;

    public static DateRange ofYear(int year) {
        return new DateRange(LocalDate.of(year, 1, 1), LocalDate.of(year, 12, 31));
    }

    public static DateRange ofQuarter(int year, int quarter) {
        LocalDate start = LocalDate.of(year, (quarter - 1) * 3 + 1, 1);
        LocalDate end = start.plusMonths(3).minusDays(1);
        return new DateRange(start, end);
    }

    @Override
    public boolean matches(ContractRecord record) {
        LocalDate date = record.getAwardDate();
        return date != null && !date.isBefore(start) && !date.isAfter(end);
    }

    @Override
    public <R> R accept(FilterVisitor<R> visitor) {
        return visitor.visitDateRange(this);
    }
}
