package com.propertyintel.gap.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * Summary of one collection run, logged on completion and served by the
 * status endpoint.
 */
@Data
@Builder
public class ScrapeRun {

    private String runId;           // UUID
    private double latitude;
    private double longitude;
    private int zoom;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private String status;          // RUNNING | SUCCESS | FAILED | SKIPPED
    private int markersFound;
    private int listingsFound;
    private int tradesFound;
    private int complexesVisited;
    private int detailsAttempted;
    private int detailsSkipped;
    private int detailsFailed;
    private int candidates;
    private int malformedResponses;
    private String outputFile;      // null when nothing was written
    private String errorMessage;    // null on success
}
