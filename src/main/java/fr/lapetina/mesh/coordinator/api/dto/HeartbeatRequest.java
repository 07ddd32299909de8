package fr.lapetina.mesh.coordinator.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import fr.lapetina.mesh.coordinator.domain.model.NodeMetrics;

/**
 * Body of {@code POST /nodes/{id}/heartbeat}. All fields are optional.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class HeartbeatRequest {

    private double cpuPercent;
    private double memoryPercent;
    private int activeTasks;

    public double getCpuPercent() { return cpuPercent; }
    public void setCpuPercent(double cpuPercent) { this.cpuPercent = cpuPercent; }

    public double getMemoryPercent() { return memoryPercent; }
    public void setMemoryPercent(double memoryPercent) { this.memoryPercent = memoryPercent; }

    public int getActiveTasks() { return activeTasks; }
    public void setActiveTasks(int activeTasks) { this.activeTasks = activeTasks; }

    public NodeMetrics toMetrics() {
        return new NodeMetrics(cpuPercent, memoryPercent, activeTasks);
    }
}
