package podcluster.cloud.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class InstanceTypeTest {

    @Test
    void parsesGpuSpec() {
        InstanceType type = InstanceType.parse("lambdalabs__8xH100_80GB__cloud__208");

        assertEquals("lambdalabs", type.provider());
        assertEquals("H100_80GB", type.gpuType());
        assertEquals(8, type.gpuCount());
        assertEquals("lambdalabs__8xH100_80GB__cloud__208", type.toString());
    }

    @Test
    void cpuNodeCountsAsOneUnit() {
        InstanceType type = InstanceType.parse("hyperstack__CPU_NODE__cpu__4");

        assertEquals("CPU_NODE", type.gpuType());
        assertEquals(1, type.gpuCount());
    }

    @Test
    void gpuTypeKeepsEverythingAfterFirstX() {
        assertEquals("RTX6000xAda", InstanceType.parse("dc__2xRTX6000xAda__secure__10").gpuType());
    }

    @Test
    void rejectsMalformedNames() {
        assertThrows(IllegalArgumentException.class, () -> InstanceType.parse("runpod"));
        assertThrows(IllegalArgumentException.class, () -> InstanceType.parse("runpod__A100__x"));
        assertThrows(IllegalArgumentException.class, () -> InstanceType.parse("runpod__twoxA100__x"));
        assertThrows(IllegalArgumentException.class, () -> InstanceType.parse(""));
    }
}
