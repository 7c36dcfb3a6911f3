package com.bmsedge.hvi.service;

import com.bmsedge.hvi.dto.HviAnalysisReport;
import com.bmsedge.hvi.dto.HviAnalysisResponse;
import com.bmsedge.hvi.dto.SkippedPartition;
import com.bmsedge.hvi.exception.InsufficientDataException;
import com.bmsedge.hvi.model.PartitionType;
import com.bmsedge.hvi.model.Sample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Entry point of the report pipeline. Splits a sample set into the consolidated, per-machine and
 * per-classification partitions and analyses each one independently.
 */
@Service
public class HviReportService {

    private static final Logger logger = LoggerFactory.getLogger(HviReportService.class);

    @Autowired
    private PartitionAnalysisService partitionAnalysisService;

    @Autowired(required = false)
    @Qualifier("analysisExecutor")
    private Executor analysisExecutor;

    @Value("${hvi.analysis.parallel-partitions:false}")
    private boolean parallelPartitions;

    /**
     * Reports come back consolidated first, then machines, then classifications, each in the order
     * the partition key was first seen. Partitions without usable data are listed as skipped.
     */
    public HviAnalysisResponse analyze(List<Sample> samples) {
        if (samples == null || samples.isEmpty()) {
            logger.info("No samples supplied, nothing to analyse");
            return new HviAnalysisResponse();
        }

        long startTime = System.currentTimeMillis();
        List<Partition> partitions = plan(samples);
        logger.info("Analysing {} samples across {} partitions", samples.size(), partitions.size());

        List<PartitionOutcome> outcomes;
        if (parallelPartitions && analysisExecutor != null) {
            List<CompletableFuture<PartitionOutcome>> futures = partitions.stream()
                    .map(partition -> CompletableFuture.supplyAsync(() -> run(partition), analysisExecutor))
                    .collect(Collectors.toList());
            outcomes = futures.stream()
                    .map(CompletableFuture::join)
                    .collect(Collectors.toList());
        } else {
            outcomes = partitions.stream()
                    .map(this::run)
                    .collect(Collectors.toList());
        }

        List<HviAnalysisReport> reports = new ArrayList<>();
        List<SkippedPartition> skipped = new ArrayList<>();
        for (PartitionOutcome outcome : outcomes) {
            if (outcome.report != null) {
                reports.add(outcome.report);
            } else {
                skipped.add(outcome.skipped);
            }
        }

        long duration = System.currentTimeMillis() - startTime;
        logger.info("Analysis completed in {}ms. Reports: {}, Skipped: {}", duration, reports.size(), skipped.size());
        return new HviAnalysisResponse(reports, skipped);
    }

    List<Partition> plan(List<Sample> samples) {
        List<Partition> partitions = new ArrayList<>();
        partitions.add(new Partition(PartitionType.CONSOLIDATED, "ALL", sample -> true, samples));
        partitions.addAll(partitionsOf(PartitionType.MACHINE, samples));
        partitions.addAll(partitionsOf(PartitionType.COLOR, samples));
        return partitions;
    }

    private List<Partition> partitionsOf(PartitionType type, List<Sample> samples) {
        Set<String> keys = samples.stream()
                .map(type::keyOf)
                .collect(Collectors.toCollection(LinkedHashSet::new));

        return keys.stream()
                .map(key -> new Partition(type, key, sample -> key.equals(type.keyOf(sample)), samples))
                .collect(Collectors.toList());
    }

    private PartitionOutcome run(Partition partition) {
        List<Sample> members = partition.members();
        try {
            return PartitionOutcome.of(partitionAnalysisService.analyze(partition.label(), partition.type, members));
        } catch (InsufficientDataException e) {
            logger.warn("Skipping partition {}: {}", partition.label(), e.getMessage());
            return PartitionOutcome.skipped(new SkippedPartition(
                    partition.label(), partition.type, members.size(), e.getMessage()));
        }
    }

    /**
     * One slice of the sample set: its type, the key it was grouped under and the membership rule.
     */
    static class Partition {
        final PartitionType type;
        final String key;
        final Predicate<Sample> predicate;
        final List<Sample> source;

        Partition(PartitionType type, String key, Predicate<Sample> predicate, List<Sample> source) {
            this.type = type;
            this.key = key;
            this.predicate = predicate;
            this.source = source;
        }

        String label() {
            return type.labelFor(key);
        }

        List<Sample> members() {
            return source.stream().filter(predicate).collect(Collectors.toList());
        }
    }

    private static class PartitionOutcome {
        private HviAnalysisReport report;
        private SkippedPartition skipped;

        static PartitionOutcome of(HviAnalysisReport report) {
            PartitionOutcome outcome = new PartitionOutcome();
            outcome.report = report;
            return outcome;
        }

        static PartitionOutcome skipped(SkippedPartition skipped) {
            PartitionOutcome outcome = new PartitionOutcome();
            outcome.skipped = skipped;
            return outcome;
        }
    }
}
