package com.bmsedge.hvi.dto;

import com.bmsedge.hvi.model.Sample;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;

import java.util.List;

@Setter
@Getter
public class AnalysisRequest {

    @NotNull
    @Valid
    private List<Sample> samples;

    public AnalysisRequest() {}

    public AnalysisRequest(List<Sample> samples) {
        this.samples = samples;
    }
}
