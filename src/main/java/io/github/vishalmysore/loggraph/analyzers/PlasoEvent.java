package io.github.vishalmysore.loggraph.analyzers;

import lombok.Builder;
import lombok.Value;

/**
 * One event of a Plaso forensic timeline. Every field is optional; files are
 * slash separated paths.
 */
@Value
@Builder
public class PlasoEvent {
    Long timestamp;      // Unix microseconds
    String description;
    String sourceFile;
    String targetFile;
    String sourceUrl;
    String targetUrl;
    String sourceIp;
    String targetIp;
}
