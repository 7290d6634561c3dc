package com.govcontracts.domain.filter;

import com.govcontracts.domain.model.FilterRequest;
import com.govcontracts.domain.model.TimeRange;
import com.govcontracts.domain.model.ValueRange;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Compiles filter requests into predicate trees and validates sort input.
 *
 * Grammar:
 * - A chip is one user value; {@code &&} inside a chip ANDs its terms
 * - Chips of one dimension are ORed
 * - Dimensions, keywords, time ranges and the value range are ANDed
 * - A dimension's "All ..." placeholder lifts that dimension's constraint
 *
 * Time ranges are ORed. Invalid entries are skipped with a warning rather
 * than failing the request.
 */
@Slf4j
@Component
public class FilterCompiler {

    static final String CHIP_AND = "&&";

    public FilterNode compile(FilterRequest request) {
        List<FilterNode> constraints = new ArrayList<>();

        constraints.add(dimension(request.getContractors(), ContractField.AWARDEE_NAME, false, "All Contractors"));
        constraints.add(dimension(request.getAreas(), ContractField.AREA_OF_DELIVERY, false, "All Areas"));
        constraints.add(dimension(request.getOrganizations(), ContractField.ORGANIZATION_NAME, true, "All Organizations"));
        constraints.add(dimension(request.getBusinessCategories(), ContractField.BUSINESS_CATEGORY, false,
                "All Business Categories"));
        constraints.add(dimension(request.getKeywords(), ContractField.SEARCH_TEXT, false, null));
        constraints.add(timeRanges(request.getTimeRanges()));
        constraints.add(valueRange(request.getValueRange()));

        return AndNode.of(constraints);
    }

    /**
     * Resolve a sort request. The field must be on the allow-list; a missing
     * or unknown direction falls back to DESC.
     */
    public SortSpec compileSort(String sortBy, String sortDirection) {
        SortField field = SortField.resolve(sortBy);
        Optional<SortDirection> direction = SortDirection.parse(sortDirection);
        if (direction.isEmpty()) {
            if (sortDirection != null && !sortDirection.isBlank()) {
                log.warn("Unknown sort direction '{}', using DESC", sortDirection);
            }
            return new SortSpec(field, SortDirection.DESC, true);
        }
        return SortSpec.of(field, direction.get());
    }

    public SortDirection compileDirection(String sortDirection) {
        Optional<SortDirection> direction = SortDirection.parse(sortDirection);
        if (direction.isEmpty() && sortDirection != null && !sortDirection.isBlank()) {
            log.warn("Unknown sort direction '{}', using DESC", sortDirection);
        }
        return direction.orElse(SortDirection.DESC);
    }

    /**
     * Split a chip into its AND terms, trimmed, empties dropped.
     */
    static List<String> splitChip(String chip) {
        if (chip == null) {
            return List.of();
        }
        return Arrays.stream(chip.split(CHIP_AND, -1))
                .map(String::trim)
                .filter(term -> !term.isEmpty())
                .toList();
    }

    private FilterNode dimension(List<String> chips, ContractField field, boolean nullSafe, String sentinel) {
        List<FilterNode> alternatives = new ArrayList<>();
        for (String chip : chips) {
            if (chip == null || chip.isBlank()) {
                continue;
            }
            if (sentinel != null && sentinel.equalsIgnoreCase(chip.trim())) {
                return MatchAll.INSTANCE;
            }
            List<FilterNode> terms = splitChip(chip).stream()
                    .map(term -> (FilterNode) SubstringMatch.of(field, term, nullSafe))
                    .toList();
            if (!terms.isEmpty()) {
                alternatives.add(AndNode.of(terms));
            }
        }
        return OrNode.of(alternatives);
    }

    private FilterNode timeRanges(List<TimeRange> ranges) {
        List<FilterNode> valid = new ArrayList<>();
        for (TimeRange range : ranges) {
            toDateRange(range).ifPresent(valid::add);
        }
        return OrNode.of(valid);
    }

    private Optional<FilterNode> toDateRange(TimeRange range) {
        if (range == null || range.getType() == null) {
            log.warn("Skipping time range without type: {}", range);
            return Optional.empty();
        }
        return switch (range.getType()) {
            case YEARLY -> {
                if (!validYear(range.getYear())) {
                    log.warn("Skipping yearly time range with invalid year: {}", range);
                    yield Optional.empty();
                }
                yield Optional.of(DateRange.ofYear(range.getYear()));
            }
            case QUARTERLY -> {
                Integer quarter = range.getQuarter();
                if (!validYear(range.getYear()) || quarter == null || quarter < 1 || quarter > 4) {
                    log.warn("Skipping quarterly time range with invalid year or quarter: {}", range);
                    yield Optional.empty();
                }
                yield Optional.of(DateRange.ofQuarter(range.getYear(), quarter));
            }
            case CUSTOM -> customRange(range);
        };
    }

    private Optional<FilterNode> customRange(TimeRange range) {
        try {
            if (range.getStartDate() == null || range.getEndDate() == null) {
                log.warn("Skipping custom time range with missing bound: {}", range);
                return Optional.empty();
            }
            LocalDate start = LocalDate.parse(range.getStartDate().trim());
            LocalDate end = LocalDate.parse(range.getEndDate().trim());
            if (start.isAfter(end)) {
                log.warn("Skipping custom time range with start after end: {}", range);
                return Optional.empty();
            }
            return Optional.of(new DateRange(start, end));
        } catch (DateTimeParseException e) {
            log.warn("Skipping custom time range with unparseable date: {} ({})", range, e.getMessage());
            return Optional.empty();
        }
    }

    private FilterNode valueRange(ValueRange range) {
        if (range == null || range.isEmpty()) {
            return MatchAll.INSTANCE;
        }
        return new NumericRange(range.getMin(), range.getMax());
    }

    private static boolean validYear(Integer year) {
        return year != null && year >= 1 && year <= 9999;
    }
}
