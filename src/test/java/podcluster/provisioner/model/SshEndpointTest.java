package podcluster.provisioner.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SshEndpointTest {

    @Test
    void parsesExplicitPort() {
        SshEndpoint endpoint = SshEndpoint.parse("root@1.2.3.4 -p 2222");

        assertEquals("root", endpoint.user());
        assertEquals("1.2.3.4", endpoint.host());
        assertEquals(2222, endpoint.port());
    }

    @Test
    void defaultsToPort22() {
        SshEndpoint endpoint = SshEndpoint.parse("root@1.2.3.4");

        assertEquals(22, endpoint.port());
        assertEquals("root", endpoint.user());
    }

    @Test
    void toleratesSurroundingWhitespace() {
        SshEndpoint endpoint = SshEndpoint.parse("  ubuntu@host.example -p  40022 \n");

        assertEquals("ubuntu", endpoint.user());
        assertEquals("host.example", endpoint.host());
        assertEquals(40022, endpoint.port());
    }

    @Test
    void rejectsGarbage() {
        assertThrows(IllegalArgumentException.class, () -> SshEndpoint.parse(""));
        assertThrows(IllegalArgumentException.class, () -> SshEndpoint.parse("root@h -p abc"));
    }
}
