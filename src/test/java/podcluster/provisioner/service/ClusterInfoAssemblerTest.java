package podcluster.provisioner.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import podcluster.cloud.client.FakePodApi;
import podcluster.cloud.client.RecordingSleeper;
import podcluster.cloud.creator.PodCreator;
import podcluster.cloud.manager.PodDirectory;
import podcluster.cloud.model.Pod;
import podcluster.cloud.model.PodStatus;
import podcluster.provisioner.config.ProvisionerConfig;
import podcluster.provisioner.exception.ReadinessTimeoutException;
import podcluster.provisioner.model.ClusterInfo;
import podcluster.provisioner.model.InstanceInfo;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ClusterInfoAssemblerTest {

    private FakePodApi api;
    private RecordingSleeper sleeper;
    private ClusterInfoAssembler assembler;

    @BeforeEach
    void setUp() {
        api = new FakePodApi();
        sleeper = new RecordingSleeper();
        assembler = new ClusterInfoAssembler(new PodDirectory(api), ProvisionerConfig.defaults(), sleeper);
    }

    @Test
    @DisplayName("SSH endpoint that appears on the 4th detail poll is used")
    void waitsForLateSshEndpoint() {
        api.sshAfterDetails(4)
                .seed(new Pod("d1", "sd-head", PodStatus.ACTIVE, "1.2.3.4", null, "runpod"), "root@1.2.3.4 -p 2222")
                .seed(new Pod("d2", "sd-worker", PodStatus.ACTIVE, "5.6.7.8", "root@5.6.7.8", "datacrunch"));

        ClusterInfo info = assembler.assemble("sd", Map.of("region", "PLACEHOLDER"));

        assertEquals(4, api.detailCalls());
        assertEquals(4, sleeper.count());
        sleeper.sleeps().forEach(d -> assertEquals(Duration.ofSeconds(10), d));

        InstanceInfo head = info.instances().get("d1").get(0);
        assertEquals(2222, head.sshPort());
        assertEquals("1.2.3.4", head.externalIp());
        assertEquals("NOT_SUPPORTED", head.internalIp());
        assertEquals(Map.of("provider", "runpod"), head.tags());

        InstanceInfo worker = info.instances().get("d2").get(0);
        assertEquals(22, worker.sshPort());
        assertEquals(Map.of("provider", "datacrunch"), worker.tags());

        assertEquals("d1", info.headInstanceId());
        assertEquals("root", info.sshUser());
        assertEquals("primeintellect", info.providerName());
        assertEquals("PLACEHOLDER", info.providerConfig().get("region"));
    }

    @Test
    void readyPodsNeedNoExtraReads() {
        api.seed(new Pod("r1", "rd-head", PodStatus.ACTIVE, "9.9.9.9", "ubuntu@9.9.9.9 -p 40022", "runpod"));

        ClusterInfo info = assembler.assemble("rd");

        assertEquals(0, api.detailCalls());
        assertEquals(0, sleeper.count());
        assertEquals(40022, info.instances().get("r1").get(0).sshPort());
        assertEquals("ubuntu", info.sshUser());
    }

    @Test
    void podThatNeverGetsSshFailsWholeAssembly() {
        api.sshAfterDetails(100)
                .seed(new Pod("ok", "nx-head", PodStatus.ACTIVE, "1.1.1.1", "root@1.1.1.1", "runpod"))
                .seed(new Pod("stuck", "nx-worker", PodStatus.ACTIVE, "2.2.2.2", null, "runpod"), "root@2.2.2.2");

        ReadinessTimeoutException e = assertThrows(ReadinessTimeoutException.class, () -> assembler.assemble("nx"));

        assertEquals("stuck", e.instanceId());
        assertEquals("nx", e.clusterName());
        assertTrue(e.getMessage().contains("after 6 attempts"));
        assertEquals(6, api.detailCalls());
        assertEquals(6, sleeper.count());
    }

    @Test
    void onlyActivePodsAreListed() {
        api.neverActivate()
                .seed(new Pod("a", "lst-head", PodStatus.ACTIVE, "1.1.1.1", "root@1.1.1.1", "runpod"))
                .seed(new Pod("p", "lst-worker", PodStatus.PENDING, null, null, "runpod"))
                .seed(new Pod("e", "lst-worker", PodStatus.ERROR, null, null, "runpod"));

        ClusterInfo info = assembler.assemble("lst");

        assertEquals(1, info.instances().size());
        assertTrue(info.instances().containsKey("a"));
    }

    @Test
    void clusterWithoutHeadHasNoSshUser() {
        api.seed(new Pod("w", "nh-worker", PodStatus.ACTIVE, "1.1.1.1", "root@1.1.1.1", "runpod"));

        ClusterInfo info = assembler.assemble("nh");

        assertNull(info.headInstanceId());
        assertNull(info.sshUser());
        assertEquals(1, info.instances().size());
    }

    @Test
    @DisplayName("Worker added to an existing head shows up next to it")
    void reconciledClusterAssemblesAllNodes() {
        api.seed(new Pod("h1", "sb-head", PodStatus.ACTIVE, "1.1.1.1", "root@1.1.1.1 -p 2200", "runpod"));
        ClusterReconciler reconciler = new ClusterReconciler(new PodDirectory(api),
                new PodCreator(api, ClusterReconcilerTest.CATALOG), ProvisionerConfig.defaults(), sleeper);

        reconciler.reconcile("sb", 2, ClusterReconcilerTest.NODE, "PLACEHOLDER");
        ClusterInfo info = assembler.assemble("sb");

        assertEquals(2, info.instances().size());
        assertEquals("h1", info.headInstanceId());
        assertEquals(2200, info.instances().get("h1").get(0).sshPort());
        assertEquals(2222, info.instances().get("pod-1").get(0).sshPort());
    }
}
