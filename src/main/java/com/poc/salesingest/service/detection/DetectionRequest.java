package com.poc.salesingest.service.detection;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

@Data
@AllArgsConstructor
public class DetectionRequest {
    private String userId;
    private String signature;
    private List<List<String>> preview;
}
