package com.riftinsight.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * One line of the NDJSON analysis stream.
 *
 * Wire shapes:
 * - {"type":"progress","stage":..,"message":..,"percent":..,"limits":{..},"queue":{..}}
 * - {"type":"progress","stage":"QUEUED",..,"queue":{..},"queuePosition":N}
 * - {"type":"error","message":..}
 * - {"type":"result","data":{..}}
 *
 * Absent fields are omitted rather than written as null.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ProgressEvent {

    public static final String TYPE_PROGRESS = "progress";
    public static final String TYPE_ERROR = "error";
    public static final String TYPE_RESULT = "result";

    private String type;
    private String stage;
    private String message;
    private Integer percent;
    private RateLimiterStats limits;
    private QueueStats queue;
    private Integer queuePosition;
    private Map<String, Object> data;

    public static ProgressEvent progress(AnalysisStage stage, String message, Object percent) {
        return ProgressEvent.builder()
                .type(TYPE_PROGRESS)
                .stage(stage.name())
                .message(message)
                .percent(clampPercent(percent))
                .build();
    }

    public static ProgressEvent queued(int position, QueueStats queue) {
        return ProgressEvent.builder()
                .type(TYPE_PROGRESS)
                .stage(AnalysisStage.QUEUED.name())
                .message("In queue — position " + position + " of " + queue.getQueued())
                .percent(0)
                .queue(queue)
                .queuePosition(position)
                .build();
    }

    public static ProgressEvent error(String message) {
        return ProgressEvent.builder()
                .type(TYPE_ERROR)
                .message(message)
                .build();
    }

    public static ProgressEvent result(Map<String, Object> data) {
        return ProgressEvent.builder()
                .type(TYPE_RESULT)
                .data(data)
                .build();
    }

    @JsonIgnore
    public boolean isTerminal() {
        return TYPE_ERROR.equals(type) || TYPE_RESULT.equals(type);
    }

    /**
     * Closest integer in [0, 100]. Non-finite or unparseable input becomes 0.
     */
    public static int clampPercent(Object value) {
        double n;
        if (value instanceof Number) {
            n = ((Number) value).doubleValue();
        } else if (value instanceof String) {
            try {
                n = Double.parseDouble(((String) value).trim());
            } catch (NumberFormatException e) {
                return 0;
            }
        } else {
            return 0;
        }
        if (!Double.isFinite(n)) {
            return 0;
        }
        return (int) Math.max(0, Math.min(100, Math.round(n)));
    }
}
