package io.operable.core.tool.impl;

import io.operable.core.google.GoogleApiClient;
import io.operable.core.google.model.ContainerModel.AddonState;
import io.operable.core.google.model.ContainerModel.AddonsConfig;
import io.operable.core.google.model.ContainerModel.Cluster;
import io.operable.core.google.model.ContainerModel.ClustersResponse;
import io.operable.core.google.model.ContainerModel.DailyMaintenanceWindow;
import io.operable.core.google.model.ContainerModel.NodeConfig;
import io.operable.core.google.model.ContainerModel.NodePool;
import io.operable.core.google.model.ContainerModel.NodePoolsResponse;
import io.operable.core.render.MarkdownReport;
import io.operable.core.render.Timestamps;
import io.operable.core.tool.CallResult;
import io.operable.core.tool.ParameterSchema;
import io.operable.core.tool.ParameterSpec;
import io.operable.core.tool.ToolArguments;
import io.operable.core.tool.ToolContext;
import io.operable.core.tool.ToolDefinition;
import io.operable.core.tool.ToolExecutionException;
import io.operable.core.tool.ToolGroup;
import java.util.List;
import okhttp3.HttpUrl;

/**
 * GKE cluster inventory: cluster listings, a single cluster's configuration, and its node pools.
 */
public final class KubernetesTools implements ToolGroup {
    private static final String API = "Container API";

    private final GoogleApiClient api;

    public KubernetesTools(GoogleApiClient api) {
        this.api = api;
    }

    @Override
    public String area() {
        return "clusters";
    }

    @Override
    public List<ToolDefinition> tools() {
        return List.of(
            new ToolDefinition(
                "list_clusters",
                "Lists GKE clusters in a project",
                ParameterSchema.of(
                    ParameterSpec.requiredString("project_id", "The Google Cloud project ID"),
                    ParameterSpec.optionalString("location",
                        "The location to list clusters from (optional, if not provided, all locations will be queried)")
                ),
                this::listClusters
            ),
            new ToolDefinition(
                "get_cluster_info",
                "Gets detailed information about a GKE cluster",
                ParameterSchema.of(
                    ParameterSpec.requiredString("project_id", "The Google Cloud project ID"),
                    ParameterSpec.requiredString("location", "The location of the cluster"),
                    ParameterSpec.requiredString("cluster_name", "The name of the cluster")
                ),
                this::getClusterInfo
            ),
            new ToolDefinition(
                "list_node_pools",
                "Lists node pools in a GKE cluster",
                ParameterSchema.of(
                    ParameterSpec.requiredString("project_id", "The Google Cloud project ID"),
                    ParameterSpec.requiredString("location", "The location of the cluster"),
                    ParameterSpec.requiredString("cluster_name", "The name of the cluster")
                ),
                this::listNodePools
            )
        );
    }

    CallResult listClusters(ToolContext context, ToolArguments args) throws ToolExecutionException {
        String projectId = args.string("project_id");
        String location = args.string("location");
        HttpUrl url = api.url(api.endpoints().container(),
            "projects", projectId, "locations", location.isEmpty() ? "-" : location, "clusters").build();
        ClustersResponse response = api.get(context, API, url, ClustersResponse.class);

        String scope = "project " + projectId + (location.isEmpty() ? "" : " in location " + location);
        List<Cluster> clusters = response.clusters();
        if (clusters.isEmpty()) {
            return CallResult.text("No GKE clusters found in " + scope + ".");
        }

        MarkdownReport report = new MarkdownReport()
            .paragraph("Found " + clusters.size() + " GKE clusters in " + scope + ":");
        for (int i = 0; i < clusters.size(); i++) {
            Cluster cluster = clusters.get(i);
            report.heading(3, (i + 1) + ". Cluster: " + nullToEmpty(cluster.name()))
                .field("Location", cluster.location())
                .field("Status", cluster.status())
                .field("Node Count", nodeCount(cluster))
                .field("Kubernetes Version", versions(cluster))
                .field("Endpoint", cluster.endpoint())
                .field("Network", cluster.network())
                .field("Subnetwork", cluster.subnetwork())
                .field("Pod CIDR", cluster.clusterIpv4Cidr())
                .field("Service CIDR", cluster.servicesIpv4Cidr())
                .field("Created", Timestamps.format(cluster.createTime()))
                .optionalField("Description", cluster.description());
        }
        return CallResult.text(report.render());
    }

    CallResult getClusterInfo(ToolContext context, ToolArguments args) throws ToolExecutionException {
        HttpUrl url = api.url(api.endpoints().container(),
            "projects", args.string("project_id"),
            "locations", args.string("location"),
            "clusters", args.string("cluster_name")).build();
        Cluster cluster = api.get(context, API, url, Cluster.class);

        MarkdownReport report = new MarkdownReport()
            .heading(1, "GKE Cluster: " + nullToEmpty(cluster.name()))
            .heading(2, "Basic Information")
            .field("Location", cluster.location())
            .field("Status", cluster.status())
            .field("Node Count", nodeCount(cluster))
            .field("Kubernetes Version", versions(cluster))
            .field("Endpoint", cluster.endpoint())
            .field("Created", Timestamps.format(cluster.createTime()))
            .optionalField("Description", cluster.description())
            .heading(2, "Network Configuration")
            .field("Network", cluster.network())
            .field("Subnetwork", cluster.subnetwork())
            .field("Pod CIDR", cluster.clusterIpv4Cidr())
            .field("Service CIDR", cluster.servicesIpv4Cidr());
        if (cluster.networkConfig() != null) {
            report.optionalField("VPC Network", cluster.networkConfig().network())
                .optionalField("VPC Subnetwork", cluster.networkConfig().subnetwork());
        }

        AddonsConfig addons = cluster.addonsConfig();
        if (addons != null) {
            report.heading(2, "Add-ons Configuration");
            addon(report, "HTTP Load Balancing", addons.httpLoadBalancing());
            addon(report, "Horizontal Pod Autoscaling", addons.horizontalPodAutoscaling());
            addon(report, "Kubernetes Dashboard", addons.kubernetesDashboard());
            addon(report, "Network Policy", addons.networkPolicyConfig());
        }

        if (!cluster.locations().isEmpty()) {
            report.heading(2, "Node Locations");
            cluster.locations().forEach(report::bullet);
        }
        if (!cluster.resourceLabels().isEmpty()) {
            report.heading(2, "Resource Labels");
            cluster.resourceLabels().forEach(report::field);
        }

        DailyMaintenanceWindow daily = dailyWindow(cluster);
        if (daily != null) {
            report.heading(2, "Maintenance Window")
                .field("Start Time", daily.startTime())
                .field("Duration", daily.duration());
        }
        return CallResult.text(report.render());
    }

    CallResult listNodePools(ToolContext context, ToolArguments args) throws ToolExecutionException {
        String location = args.string("location");
        String clusterName = args.string("cluster_name");
        HttpUrl url = api.url(api.endpoints().container(),
            "projects", args.string("project_id"),
            "locations", location,
            "clusters", clusterName, "nodePools").build();
        NodePoolsResponse response = api.get(context, API, url, NodePoolsResponse.class);

        List<NodePool> pools = response.nodePools();
        if (pools.isEmpty()) {
            return CallResult.text("No node pools found in cluster " + clusterName + " in location " + location + ".");
        }

        MarkdownReport report = new MarkdownReport().heading(1, "Node Pools in Cluster " + clusterName);
        for (int i = 0; i < pools.size(); i++) {
            NodePool pool = pools.get(i);
            report.heading(2, (i + 1) + ". Node Pool: " + nullToEmpty(pool.name()))
                .field("Status", pool.status())
                .field("Version", pool.version())
                .field("Initial Node Count", pool.initialNodeCount() == null ? 0 : pool.initialNodeCount());

            NodeConfig config = pool.config();
            if (config != null) {
                report.heading(3, "Machine Configuration")
                    .field("Machine Type", config.machineType())
                    .field("Disk Size", (config.diskSizeGb() == null ? 0 : config.diskSizeGb()) + " GB")
                    .field("Preemptible", config.preemptible())
                    .field("Service Account", config.serviceAccount())
                    .fieldList("OAuth Scopes", config.oauthScopes())
                    .fieldMap("Labels", config.labels());
            }

            report.heading(3, "Autoscaling");
            if (pool.autoscaling() != null && pool.autoscaling().enabled()) {
                report.field("Enabled", "Yes")
                    .field("Min Nodes", pool.autoscaling().minNodeCount() == null ? 0 : pool.autoscaling().minNodeCount())
                    .field("Max Nodes", pool.autoscaling().maxNodeCount() == null ? 0 : pool.autoscaling().maxNodeCount());
            } else {
                report.field("Enabled", "No");
            }

            if (pool.management() != null) {
                report.heading(3, "Management")
                    .field("Auto Upgrade", pool.management().autoUpgrade())
                    .field("Auto Repair", pool.management().autoRepair());
            }
            if (!pool.locations().isEmpty()) {
                report.heading(3, "Locations");
                pool.locations().forEach(report::bullet);
            }
        }
        return CallResult.text(report.render());
    }

    private static void addon(MarkdownReport report, String label, AddonState state) {
        if (state != null) {
            report.field(label, state.disabled() ? "Disabled" : "Enabled");
        }
    }

    private static DailyMaintenanceWindow dailyWindow(Cluster cluster) {
        if (cluster.maintenancePolicy() == null || cluster.maintenancePolicy().window() == null) {
            return null;
        }
        return cluster.maintenancePolicy().window().dailyMaintenanceWindow();
    }

    private static int nodeCount(Cluster cluster) {
        return cluster.currentNodeCount() == null ? 0 : cluster.currentNodeCount();
    }

    private static String versions(Cluster cluster) {
        return nullToEmpty(cluster.currentMasterVersion()) + " (master) / "
            + nullToEmpty(cluster.currentNodeVersion()) + " (nodes)";
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
