package fr.lapetina.mesh.coordinator.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import fr.lapetina.mesh.coordinator.domain.model.Node;
import fr.lapetina.mesh.coordinator.domain.model.NodeRole;

import java.time.Instant;
import java.util.Locale;
import java.util.Set;

/**
 * Body of {@code POST /nodes}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class NodeRequest {

    private String id;
    private String url;
    private String role = "EDGE";
    private Set<String> capabilities = Set.of();
    private int maxConcurrency = 4;
    private int cost = 1;

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getUrl() { return url; }
    public void setUrl(String url) { this.url = url; }

    public String getRole() { return role; }
    public void setRole(String role) { this.role = role; }

    public Set<String> getCapabilities() { return capabilities; }
    public void setCapabilities(Set<String> capabilities) { this.capabilities = capabilities; }

    public int getMaxConcurrency() { return maxConcurrency; }
    public void setMaxConcurrency(int maxConcurrency) { this.maxConcurrency = maxConcurrency; }

    public int getCost() { return cost; }
    public void setCost(int cost) { this.cost = cost; }

    /**
     * @throws IllegalArgumentException if id or url is missing, or the role is unknown
     */
    public Node toNode(Instant now) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Missing 'id' field");
        }
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("Missing 'url' field");
        }
        if (maxConcurrency < 1) {
            throw new IllegalArgumentException("'maxConcurrency' must be at least 1");
        }
        return Node.builder()
                .id(id)
                .address(url)
                .role(NodeRole.valueOf(role.trim().toUpperCase(Locale.ROOT)))
                .capabilities(capabilities != null ? capabilities : Set.of())
                .maxConcurrency(maxConcurrency)
                .cost(cost)
                .registeredAt(now)
                .build();
    }
}
