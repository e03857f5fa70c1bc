package ru.hedge.dto.safety;

import lombok.Value;

import java.util.List;

@Value
public class ExposureReport {
    boolean balanced;
    List<String> issues;
    List<String> warnings;

    public static ExposureReport of(List<String> issues, List<String> warnings) {
        return new ExposureReport(issues.isEmpty(), List.copyOf(issues), List.copyOf(warnings));
    }
}
