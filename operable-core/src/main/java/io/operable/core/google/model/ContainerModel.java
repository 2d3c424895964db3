package io.operable.core.google.model;

import java.util.List;
import java.util.Map;

// GKE (container.googleapis.com/v1) response shapes.
public final class ContainerModel {

    private ContainerModel() {
    }

    public record ClustersResponse(List<Cluster> clusters) {
        public ClustersResponse {
            clusters = clusters == null ? List.of() : clusters;
        }
    }

    public record Cluster(
        String name,
        String description,
        String location,
        String status,
        Integer currentNodeCount,
        String currentMasterVersion,
        String currentNodeVersion,
        String network,
        String subnetwork,
        String clusterIpv4Cidr,
        String servicesIpv4Cidr,
        String endpoint,
        String createTime,
        MaintenancePolicy maintenancePolicy,
        NetworkConfig networkConfig,
        AddonsConfig addonsConfig,
        List<String> locations,
        Map<String, String> resourceLabels
    ) {
        public Cluster {
            locations = locations == null ? List.of() : locations;
            resourceLabels = resourceLabels == null ? Map.of() : resourceLabels;
        }
    }

    public record MaintenancePolicy(MaintenanceWindow window) {
    }

    public record MaintenanceWindow(DailyMaintenanceWindow dailyMaintenanceWindow) {
    }

    public record DailyMaintenanceWindow(String startTime, String duration) {
    }

    public record NetworkConfig(String network, String subnetwork) {
    }

    public record AddonsConfig(
        AddonState httpLoadBalancing,
        AddonState horizontalPodAutoscaling,
        AddonState kubernetesDashboard,
        AddonState networkPolicyConfig
    ) {
    }

    public record AddonState(boolean disabled) {
    }

    public record NodePoolsResponse(List<NodePool> nodePools) {
        public NodePoolsResponse {
            nodePools = nodePools == null ? List.of() : nodePools;
        }
    }

    public record NodePool(
        String name,
        String status,
        NodeConfig config,
        Integer initialNodeCount,
        List<String> locations,
        String version,
        NodePoolAutoscaling autoscaling,
        NodeManagement management
    ) {
        public NodePool {
            locations = locations == null ? List.of() : locations;
        }
    }

    public record NodeConfig(
        String machineType,
        Integer diskSizeGb,
        List<String> oauthScopes,
        String serviceAccount,
        boolean preemptible,
        Map<String, String> labels
    ) {
        public NodeConfig {
            oauthScopes = oauthScopes == null ? List.of() : oauthScopes;
            labels = labels == null ? Map.of() : labels;
        }
    }

    public record NodePoolAutoscaling(boolean enabled, Integer minNodeCount, Integer maxNodeCount) {
    }

    public record NodeManagement(boolean autoUpgrade, boolean autoRepair) {
    }
}
