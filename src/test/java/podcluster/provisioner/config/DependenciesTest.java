package podcluster.provisioner.config;

import org.junit.jupiter.api.Test;
import podcluster.cloud.catalog.InstanceCatalog;
import podcluster.cloud.client.FakePodApi;
import podcluster.cloud.client.RecordingSleeper;
import podcluster.provisioner.model.ClusterInfo;
import podcluster.provisioner.model.ClusterStatus;
import podcluster.provisioner.model.NodeConfig;
import podcluster.provisioner.model.ProvisionRecord;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DependenciesTest {

    @Test
    void wiredServicesShareOneProvider() {
        FakePodApi api = new FakePodApi();
        RecordingSleeper sleeper = new RecordingSleeper();
        Dependencies deps = Dependencies.create(ProvisionerConfig.defaults(), api,
                new InstanceCatalog(Map.of("hyperstack__CPU_NODE__cpu__4", "n3-CPU-4")), sleeper);

        ProvisionRecord record = deps.reconciler().reconcile("demo", 2,
                new NodeConfig("hyperstack__CPU_NODE__cpu__4", 50), "PLACEHOLDER");
        ClusterInfo info = deps.assembler().assemble("demo");

        assertEquals(2, record.createdInstanceIds().size());
        assertEquals(record.headInstanceId(), info.headInstanceId());
        assertEquals(2, info.instances().size());
        assertEquals(Map.of("pod-1", ClusterStatus.UP, "pod-2", ClusterStatus.UP),
                deps.lifecycle().query("demo"));
        assertTrue(sleeper.sleeps().stream().allMatch(d -> d.equals(Duration.ofSeconds(5))));
    }

    @Test
    void configDefaultsAndOverrides() {
        ProvisionerConfig config = ProvisionerConfig.defaults();

        assertEquals("https://api.primeintellect.ai/api/v1", config.apiBaseUrl());
        assertEquals(Duration.ofSeconds(5), config.pollInterval());
        assertEquals(192, config.convergeMaxPolls());
        assertEquals(0, config.pendingMaxPolls());
        assertEquals(120, config.defaultDiskSizeGb());

        config.withApiEndpoint("http://localhost:8080/").withDefaultDiskSizeGb(40);

        assertEquals("http://localhost:8080/api/v1", config.apiBaseUrl());
        assertEquals(40, config.defaultDiskSizeGb());
    }
}
