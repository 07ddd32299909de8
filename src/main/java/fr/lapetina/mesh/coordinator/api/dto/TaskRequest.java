package fr.lapetina.mesh.coordinator.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import fr.lapetina.mesh.coordinator.domain.model.TaskSubmission;

import java.time.Instant;
import java.util.Map;
import java.util.Set;

/**
 * Body of {@code POST /tasks}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class TaskRequest {

    private String idempotencyKey;
    private String type;
    private Map<String, Object> payload;
    private Set<String> requiredCapabilities;
    private int priority;
    private Instant deadline;

    public String getIdempotencyKey() { return idempotencyKey; }
    public void setIdempotencyKey(String idempotencyKey) { this.idempotencyKey = idempotencyKey; }

    public String getType() { return type; }
    public void setType(String type) { this.type = type; }

    public Map<String, Object> getPayload() { return payload; }
    public void setPayload(Map<String, Object> payload) { this.payload = payload; }

    public Set<String> getRequiredCapabilities() { return requiredCapabilities; }
    public void setRequiredCapabilities(Set<String> requiredCapabilities) { this.requiredCapabilities = requiredCapabilities; }

    public int getPriority() { return priority; }
    public void setPriority(int priority) { this.priority = priority; }

    public Instant getDeadline() { return deadline; }
    public void setDeadline(Instant deadline) { this.deadline = deadline; }

    /**
     * @throws IllegalArgumentException if the task type is missing
     */
    public TaskSubmission toSubmission() {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("Missing 'type' field");
        }
        return new TaskSubmission(idempotencyKey, type, payload, requiredCapabilities, priority, deadline);
    }
}
