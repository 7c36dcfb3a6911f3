package com.bmsedge.hvi.service;

import com.bmsedge.hvi.TestSamples;
import com.bmsedge.hvi.dto.HviAnalysisReport;
import com.bmsedge.hvi.dto.HviAnalysisResponse;
import com.bmsedge.hvi.dto.SkippedPartition;
import com.bmsedge.hvi.exception.InsufficientDataException;
import com.bmsedge.hvi.model.FiberParameter;
import com.bmsedge.hvi.model.PartitionType;
import com.bmsedge.hvi.model.Sample;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

import static com.bmsedge.hvi.TestSamples.sample;
import static com.bmsedge.hvi.TestSamples.sampleBuilder;
import static com.bmsedge.hvi.TestSamples.tagged;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class HviReportServiceTest {

    @Mock
    private PartitionAnalysisService partitionAnalysisService;

    @InjectMocks
    private HviReportService reportService;

    private List<Sample> samples;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);

        samples = new ArrayList<>();
        samples.add(tagged(sample("S1", 4.2, 1.12, 81.5, 29.8, 76.2, 8.4), "2", "#3b82f6"));
        samples.add(tagged(sample("S2", 4.4, 1.15, 82.1, 30.6, 75.8, 8.9), "1", "#3b82f6"));
        samples.add(tagged(sample("S3", 4.1, 1.10, 80.9, 29.1, 77.0, 8.1), null, ""));
        samples.add(tagged(sample("S4", 4.5, 1.18, 83.0, 31.4, 74.9, 9.3), " 2 ", "#ef4444"));

        when(partitionAnalysisService.analyze(anyString(), any(PartitionType.class), anyList()))
                .thenAnswer(invocation -> new HviAnalysisReport(invocation.getArgument(0), invocation.getArgument(1)));
    }

    private List<String> labels(HviAnalysisResponse response) {
        return response.getReports().stream()
                .map(HviAnalysisReport::getPartitionLabel)
                .collect(Collectors.toList());
    }

    @Test
    @DisplayName("Consolidated first, then machines, then classifications in first-seen order")
    void testPartitionOrder() {
        // Act
        HviAnalysisResponse response = reportService.analyze(samples);

        // Assert
        assertEquals(Arrays.asList(
                "GENERAL REPORT (CONSOLIDATED)",
                "MACHINE: 2",
                "MACHINE: 1",
                "MACHINE: UNIDENTIFIED MACHINE",
                "QUALITY: #3b82f6",
                "QUALITY: UNCLASSIFIED",
                "QUALITY: #ef4444"), labels(response));
        assertTrue(response.getSkippedPartitions().isEmpty());
        assertNotNull(response.getGeneratedAt());
    }

    @Test
    @DisplayName("Each partition receives only its own samples")
    @SuppressWarnings("unchecked")
    void testPartitionMembers() {
        // Arrange
        ArgumentCaptor<List<Sample>> captor = ArgumentCaptor.forClass(List.class);

        // Act
        reportService.analyze(samples);

        // Assert
        verify(partitionAnalysisService).analyze(eq("MACHINE: 2"), eq(PartitionType.MACHINE), captor.capture());
        List<String> ids = captor.getValue().stream().map(Sample::getId).collect(Collectors.toList());
        assertEquals(Arrays.asList("S1", "S4"), ids);

        verify(partitionAnalysisService).analyze(eq("GENERAL REPORT (CONSOLIDATED)"),
                eq(PartitionType.CONSOLIDATED), captor.capture());
        assertEquals(4, captor.getValue().size());
    }

    @Test
    @DisplayName("Partition without data is reported as skipped while the others continue")
    void testSkipsInsufficientPartition() {
        // Arrange
        when(partitionAnalysisService.analyze(eq("MACHINE: 1"), eq(PartitionType.MACHINE), anyList()))
                .thenThrow(new InsufficientDataException("MACHINE: 1", 0));

        // Act
        HviAnalysisResponse response = reportService.analyze(samples);

        // Assert
        assertEquals(6, response.getReports().size());
        assertFalse(labels(response).contains("MACHINE: 1"));
        assertEquals(1, response.getSkippedPartitions().size());
        SkippedPartition skipped = response.getSkippedPartitions().get(0);
        assertEquals("MACHINE: 1", skipped.getPartitionLabel());
        assertEquals(PartitionType.MACHINE, skipped.getPartitionType());
        assertEquals(1, skipped.getInitialCount());
        assertTrue(skipped.getReason().startsWith("Insufficient data for MACHINE: 1"));
    }

    @Test
    @DisplayName("Null or empty input yields an empty response")
    void testEmptyInput() {
        HviAnalysisResponse empty = reportService.analyze(Collections.emptyList());
        HviAnalysisResponse none = reportService.analyze(null);

        assertTrue(empty.getReports().isEmpty());
        assertTrue(empty.getSkippedPartitions().isEmpty());
        assertTrue(none.getReports().isEmpty());
        verifyNoInteractions(partitionAnalysisService);
    }

    @Test
    @DisplayName("Parallel execution keeps the partition order")
    void testParallelPartitions() {
        // Arrange
        Executor direct = Runnable::run;
        ReflectionTestUtils.setField(reportService, "analysisExecutor", direct);
        ReflectionTestUtils.setField(reportService, "parallelPartitions", true);

        // Act
        HviAnalysisResponse response = reportService.analyze(samples);

        // Assert
        assertEquals(7, response.getReports().size());
        assertEquals("GENERAL REPORT (CONSOLIDATED)", labels(response).get(0));
        assertEquals("QUALITY: #ef4444", labels(response).get(6));
        verify(partitionAnalysisService, times(7)).analyze(anyString(), any(PartitionType.class), anyList());
    }

    @Test
    @DisplayName("Plan exposes partition keys and predicates")
    void testPlan() {
        List<HviReportService.Partition> partitions = reportService.plan(samples);

        assertEquals(7, partitions.size());
        assertEquals(PartitionType.CONSOLIDATED, partitions.get(0).type);
        assertEquals("2", partitions.get(1).key);
        assertEquals(PartitionType.MISSING_KEY, partitions.get(3).key);
        assertEquals(1, partitions.get(3).members().size());
        assertEquals("S3", partitions.get(3).members().get(0).getId());
    }

    @Test
    @DisplayName("Samples without a machine stay apart from a machine literally named like the missing bucket")
    void testMissingMachineKeptApartFromLiteralName() {
        // Arrange
        List<Sample> lot = new ArrayList<>();
        lot.add(tagged(sample("L1", 4.2, 1.12, 81.5, 29.8, 76.2, 8.4), "UNIDENTIFIED MACHINE", "#3b82f6"));
        lot.add(tagged(sample("N1", 4.4, 1.15, 82.1, 30.6, 75.8, 8.9), null, "#3b82f6"));
        lot.add(tagged(sample("N2", 4.1, 1.10, 80.9, 29.1, 77.0, 8.1), " ", "#3b82f6"));

        // Act
        List<HviReportService.Partition> partitions = reportService.plan(lot);

        // Assert
        assertEquals(4, partitions.size());
        assertEquals("UNIDENTIFIED MACHINE", partitions.get(1).key);
        assertEquals(Arrays.asList("L1"),
                partitions.get(1).members().stream().map(Sample::getId).collect(Collectors.toList()));
        assertEquals(PartitionType.MISSING_KEY, partitions.get(2).key);
        assertEquals(Arrays.asList("N1", "N2"),
                partitions.get(2).members().stream().map(Sample::getId).collect(Collectors.toList()));
        assertEquals("MACHINE: UNIDENTIFIED MACHINE", partitions.get(2).label());
    }

    @Test
    @DisplayName("End to end with the real pipeline")
    void testRealPipeline() {
        // Arrange
        HviReportService service = new HviReportService();
        ReflectionTestUtils.setField(service, "partitionAnalysisService", TestSamples.partitionAnalysisService());
        List<Sample> lot = new ArrayList<>();
        for (Sample sample : TestSamples.typicalLot()) {
            lot.add(tagged(sample, "1", "#10b981"));
        }
        lot.add(tagged(sampleBuilder("X1").reading(FiberParameter.MIC, "-").build(), "2", "#10b981"));
        lot.add(tagged(new Sample("X2"), "2", "#10b981"));

        // Act
        HviAnalysisResponse response = service.analyze(lot);

        // Assert
        assertEquals(Arrays.asList("GENERAL REPORT (CONSOLIDATED)", "MACHINE: 1", "QUALITY: #10b981"),
                labels(response));
        HviAnalysisReport consolidated = response.getReports().get(0);
        assertEquals(10, consolidated.getInitialCount());
        assertEquals(8, consolidated.getCleanedCount());
        assertEquals(6, consolidated.getParameterAnalyses().size());

        assertEquals(1, response.getSkippedPartitions().size());
        assertEquals("MACHINE: 2", response.getSkippedPartitions().get(0).getPartitionLabel());
        assertEquals(2, response.getSkippedPartitions().get(0).getInitialCount());
    }
}
