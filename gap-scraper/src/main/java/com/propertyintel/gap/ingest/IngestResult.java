package com.propertyintel.gap.ingest;

/**
 * What happened to one observed response.
 *
 * @param added new markers, listings or trades inserted
 */
public record IngestResult(ResponseChannel channel, Outcome outcome, int added) {

    public enum Outcome {
        ACCEPTED,
        CAPTURE_OFF,
        UNRECOGNISED,
        MALFORMED
    }

    public static IngestResult accepted(ResponseChannel channel, int added) {
        return new IngestResult(channel, Outcome.ACCEPTED, added);
    }

    public static IngestResult captureOff() {
        return new IngestResult(ResponseChannel.NONE, Outcome.CAPTURE_OFF, 0);
    }

    public static IngestResult unrecognised() {
        return new IngestResult(ResponseChannel.NONE, Outcome.UNRECOGNISED, 0);
    }

    public static IngestResult malformed(ResponseChannel channel) {
        return new IngestResult(channel, Outcome.MALFORMED, 0);
    }
}
