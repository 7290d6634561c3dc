package com.govcontracts.infrastructure.dataset;

import com.govcontracts.domain.exception.ErrorKind;
import com.govcontracts.domain.exception.SearchException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Catalog of the Parquet partitions in the dataset directory.
 *
 * Layout:
 * - {@code facts_awards_all_time.parquet}: primary history, always scanned
 * - {@code facts_awards_<year>.parquet}: primary fallback when the all-time file is absent
 * - {@code facts_awards_flood_control.parquet}: supplementary, scanned on opt-in
 * - {@code agg_<entity>.parquet}: precomputed per-dimension rollups
 *
 * Every file's schema is probed before it is used. A fact file missing a core
 * column, or one DuckDB cannot read, is left out with a warning so one bad
 * file never takes the whole dataset down.
 */
@Slf4j
@Component
public class DatasetCatalog {

    static final Set<String> AGGREGATE_COLUMNS = Set.of("entity", "contract_count", "total_contract_value");

    private static final Pattern YEARLY_FILE = Pattern.compile("facts_awards_(\\d{4})\\.parquet");
    private static final String AGGREGATE_PREFIX = "agg_";

    private final DuckDbEngine engine;

    @Value("${app.dataset.dir:data/parquet}")
    private String dataDir;

    @Value("${app.dataset.primary-file:facts_awards_all_time.parquet}")
    private String primaryFile;

    @Value("${app.dataset.supplementary-file:facts_awards_flood_control.parquet}")
    private String supplementaryFile;

    private volatile Snapshot snapshot;

    public DatasetCatalog(DuckDbEngine engine) {
        this.engine = engine;
    }

    public List<Partition> partitions() {
        return current().partitions();
    }

    /**
     * Fact partitions a scan should read: the primaries, plus the
     * supplementary partition when requested and present.
     */
    public List<Partition> factPartitions(boolean includeSupplementary) {
        return partitions().stream()
                .filter(p -> p.getRole() == PartitionRole.PRIMARY
                        || (includeSupplementary && p.getRole() == PartitionRole.SUPPLEMENTARY))
                .toList();
    }

    public Optional<Partition> supplementaryPartition() {
        return partitions().stream()
                .filter(p -> p.getRole() == PartitionRole.SUPPLEMENTARY)
                .findFirst();
    }

    public Optional<Partition> aggregatePartition(String entity) {
        return partitions().stream()
                .filter(p -> p.getRole() == PartitionRole.PRECOMPUTED_AGGREGATE && p.getId().equals(entity))
                .findFirst();
    }

    /**
     * {@code UNION ALL} of the selected fact partitions, projected to the
     * canonical columns.
     *
     * @return empty when the dataset holds no fact partitions at all
     * @throws SearchException if primary files exist but none of them is usable
     */
    public Optional<String> unionSql(boolean includeSupplementary) {
        Snapshot current = current();
        List<Partition> selected = factPartitions(includeSupplementary);
        boolean hasPrimary = selected.stream().anyMatch(p -> p.getRole() == PartitionRole.PRIMARY);
        if (!hasPrimary && current.rejectedPrimaries() > 0) {
            throw new SearchException(ErrorKind.DATASET_UNAVAILABLE,
                    "No usable primary partition in " + dataDir + " (" + current.rejectedPrimaries() + " rejected)");
        }
        if (selected.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(selected.stream()
                .map(CanonicalProjection::select)
                .collect(Collectors.joining(" UNION ALL ")));
    }

    /**
     * Rescan the directory. Cheap when nothing changed: files are only
     * re-probed when their modification time moved.
     */
    @Scheduled(fixedDelayString = "${app.dataset.refresh-interval-ms:60000}",
            initialDelayString = "${app.dataset.refresh-interval-ms:60000}")
    public void refresh() {
        Snapshot previous = snapshot;
        Snapshot next = scan(previous);
        snapshot = next;
        if (previous == null || !previous.partitions().equals(next.partitions())) {
            log.info("Dataset catalog loaded {} partitions from {}: {}", next.partitions().size(), dataDir,
                    next.partitions().stream().map(p -> p.getId() + "/" + p.getRole()).toList());
        }
    }

    private Snapshot current() {
        Snapshot current = snapshot;
        if (current == null) {
            synchronized (this) {
                if (snapshot == null) {
                    refresh();
                }
                current = snapshot;
            }
        }
        return current;
    }

    private Snapshot scan(Snapshot previous) {
        Path dir = Paths.get(dataDir);
        if (!Files.isDirectory(dir)) {
            log.warn("Dataset directory {} does not exist, no partitions available", dir.toAbsolutePath());
            return new Snapshot(List.of(), 0);
        }

        List<Path> files;
        try (Stream<Path> listing = Files.list(dir)) {
            files = listing
                    .filter(Files::isRegularFile)
                    .filter(path -> path.getFileName().toString().endsWith(".parquet"))
                    .sorted(Comparator.comparing(path -> path.getFileName().toString()))
                    .toList();
        } catch (IOException e) {
            log.error("Error listing dataset directory {}: {}", dir, e.getMessage(), e);
            return previous != null ? previous : new Snapshot(List.of(), 0);
        }

        boolean hasAllTime = files.stream().anyMatch(path -> path.getFileName().toString().equals(primaryFile));
        List<Partition> partitions = new ArrayList<>();
        int rejectedPrimaries = 0;

        for (Path file : files) {
            String name = file.getFileName().toString();
            PartitionRole role;
            String id;
            Matcher yearly = YEARLY_FILE.matcher(name);

            if (name.equals(primaryFile)) {
                role = PartitionRole.PRIMARY;
                id = stem(name);
            } else if (name.equals(supplementaryFile)) {
                role = PartitionRole.SUPPLEMENTARY;
                id = stem(name);
            } else if (!hasAllTime && yearly.matches()) {
                role = PartitionRole.PRIMARY;
                id = stem(name);
            } else if (name.startsWith(AGGREGATE_PREFIX)) {
                role = PartitionRole.PRECOMPUTED_AGGREGATE;
                id = stem(name).substring(AGGREGATE_PREFIX.length());
            } else {
                log.debug("Ignoring unrecognized dataset file {}", name);
                continue;
            }

            Optional<Partition> partition = probe(file, id, role, previous);
            if (partition.isPresent()) {
                partitions.add(partition.get());
            } else if (role == PartitionRole.PRIMARY) {
                rejectedPrimaries++;
            }
        }
        return new Snapshot(List.copyOf(partitions), rejectedPrimaries);
    }

    private Optional<Partition> probe(Path file, String id, PartitionRole role, Snapshot previous) {
        Instant lastModified;
        try {
            lastModified = Files.getLastModifiedTime(file).toInstant();
        } catch (IOException e) {
            log.warn("Skipping partition {}: cannot stat file ({})", file, e.getMessage());
            return Optional.empty();
        }

        if (previous != null) {
            Optional<Partition> unchanged = previous.partitions().stream()
                    .filter(p -> p.getPath().equals(file) && p.getLastModified().equals(lastModified))
                    .findFirst();
            if (unchanged.isPresent()) {
                return unchanged;
            }
        }

        Set<String> columns;
        try {
            columns = new HashSet<>(engine.jdbc().queryForList(
                    "SELECT column_name FROM (DESCRIBE SELECT * FROM " + Partition.readParquet(file) + ")",
                    String.class));
        } catch (RuntimeException e) {
            log.warn("Skipping partition {}: schema probe failed ({})", file.getFileName(), e.getMessage());
            return Optional.empty();
        }

        Set<String> missing = role == PartitionRole.PRECOMPUTED_AGGREGATE
                ? missing(columns, AGGREGATE_COLUMNS)
                : CanonicalProjection.missingCoreColumns(columns);
        if (!missing.isEmpty()) {
            log.warn("Skipping partition {}: missing required columns {}", file.getFileName(), missing);
            return Optional.empty();
        }

        return Optional.of(new Partition(id, file, role, role == PartitionRole.PRIMARY, lastModified,
                Set.copyOf(columns)));
    }

    private static Set<String> missing(Set<String> columns, Set<String> required) {
        return required.stream()
                .filter(column -> !columns.contains(column))
                .collect(Collectors.toCollection(TreeSet::new));
    }

    private static String stem(String fileName) {
        return fileName.substring(0, fileName.length() - ".parquet".length());
    }

    private static final class Snapshot {

        private final List<Partition> partitions;
        private final int rejectedPrimaries;

        private Snapshot(List<Partition> partitions, int rejectedPrimaries) {
            this.partitions = partitions;
            this.rejectedPrimaries = rejectedPrimaries;
        }

        List<Partition> partitions() {
            return partitions;
        }

        int rejectedPrimaries() {
            return rejectedPrimaries;
        }
    }
}
