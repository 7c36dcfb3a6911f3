package com.bmsedge.hvi.controller;

import com.bmsedge.hvi.dto.AnalysisRequest;
import com.bmsedge.hvi.dto.ColorGroupSummary;
import com.bmsedge.hvi.dto.HviAnalysisResponse;
import com.bmsedge.hvi.dto.PatternGroup;
import com.bmsedge.hvi.dto.SeriesStatistics;
import com.bmsedge.hvi.model.FiberParameter;
import com.bmsedge.hvi.service.HviReportService;
import com.bmsedge.hvi.service.PatternClassifier;
import com.bmsedge.hvi.service.PatternReportWriter;
import com.bmsedge.hvi.service.SampleSetSummaryService;
import jakarta.validation.Valid;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/hvi")
@CrossOrigin(origins = "*")
public class HviAnalysisController {

    @Autowired
    private HviReportService reportService;

    @Autowired
    private PatternClassifier patternClassifier;

    @Autowired
    private PatternReportWriter patternReportWriter;

    @Autowired
    private SampleSetSummaryService summaryService;

    // ============= REPORT PIPELINE =============

    /**
     * Consolidated, per-machine and per-classification reports for a sample set
     */
    @PostMapping("/reports")
    public ResponseEntity<HviAnalysisResponse> analyze(@Valid @RequestBody AnalysisRequest request) {
        return ResponseEntity.ok(reportService.analyze(request.getSamples()));
    }

    // ============= PATTERN CLASSIFICATION =============

    @PostMapping("/patterns")
    public ResponseEntity<List<PatternGroup>> classify(@Valid @RequestBody AnalysisRequest request) {
        return ResponseEntity.ok(patternClassifier.classify(request.getSamples()));
    }

    @PostMapping(value = "/patterns/summary", produces = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<String> patternSummary(@Valid @RequestBody AnalysisRequest request) {
        return ResponseEntity.ok(patternReportWriter.write(request.getSamples()));
    }

    // ============= TABLE STATISTICS =============

    @PostMapping("/statistics")
    public ResponseEntity<Map<FiberParameter, SeriesStatistics>> statistics(@Valid @RequestBody AnalysisRequest request) {
        return ResponseEntity.ok(summaryService.summarize(request.getSamples()));
    }

    @PostMapping("/statistics/{parameter}")
    public ResponseEntity<SeriesStatistics> parameterStatistics(@PathVariable String parameter,
                                                                @Valid @RequestBody AnalysisRequest request) {
        return ResponseEntity.ok(summaryService.summarize(request.getSamples(), FiberParameter.fromKey(parameter)));
    }

    @PostMapping("/statistics/colors")
    public ResponseEntity<List<ColorGroupSummary>> colorStatistics(@Valid @RequestBody AnalysisRequest request) {
        return ResponseEntity.ok(summaryService.summarizeByColor(request.getSamples()));
    }
}
