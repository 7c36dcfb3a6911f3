package com.bmsedge.hvi.model;

import com.bmsedge.hvi.util.DecimalReadingDeserializer;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Getter;
import lombok.Setter;

/**
 * One physical fiber sample as supplied by the laboratory.
 *
 * Readings are kept exactly as received (they may use ',' as decimal separator);
 * the analysis services normalize them through {@link com.bmsedge.hvi.util.DecimalReadings}
 * and never modify the sample.
 */
@Setter
@Getter
public class Sample {

    @NotBlank
    @Size(max = 100)
    private String id;

    @JsonDeserialize(using = DecimalReadingDeserializer.class)
    private String mic;

    @JsonDeserialize(using = DecimalReadingDeserializer.class)
    private String len;

    @JsonDeserialize(using = DecimalReadingDeserializer.class)
    private String unf;

    @JsonDeserialize(using = DecimalReadingDeserializer.class)
    private String str;

    @JsonDeserialize(using = DecimalReadingDeserializer.class)
    private String rd;

    @JsonDeserialize(using = DecimalReadingDeserializer.class)
    private String b;

    // HVI machine number, e.g. "2"
    @Size(max = 50)
    private String machineId;

    // Display colour the sample was classified under, e.g. "#3b82f6"
    @Size(max = 50)
    private String classificationTag;

    public Sample() {}

    public Sample(String id) {
        this.id = id;
    }

    public Sample(String id, String machineId, String classificationTag) {
        this.id = id;
        this.machineId = machineId;
        this.classificationTag = classificationTag;
    }

    public String getReading(FiberParameter parameter) {
        switch (parameter) {
            case MIC: return mic;
            case LEN: return len;
            case UNF: return unf;
            case STR: return str;
            case RD: return rd;
            case B: return b;
            default: throw new IllegalArgumentException("Unsupported parameter: " + parameter);
        }
    }

    @Override
    public String toString() {
        return "Sample{id='" + id + "', machineId='" + machineId + "', classificationTag='" + classificationTag + "'}";
    }
}
