package com.clinic.scheduling.dto;

public record GenerationResult(int createdCount, int skippedCount) {

    public String getMessage() {
        int total = createdCount + skippedCount;
        if (createdCount == 0) {
            return total == 0 ? "No slots fit the requested window" : "These slots already exist";
        }
        return createdCount + " of " + total + " slots created";
    }
}
