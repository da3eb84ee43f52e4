package com.zecinsight.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Map;

/**
 * Append-only history of triggered alerts. Alerts themselves are computed on demand; this is a log.
 */
@Document(collection = "alert_history")
@CompoundIndex(name = "project_detected", def = "{'projectId': 1, 'detectedAt': -1}")
@NoArgsConstructor
@Getter
@Setter
public class AlertRecord {

    @Id
    private String id;
    private String projectId;
    private String type;
    private String severity;
    private String message;
    private Map<String, Object> data;
    private Instant detectedAt;
}
