package com.poc.salesingest.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class StrategyAttempt {
    private String strategy;
    private boolean success;
    private String message;
}
