package podcluster.provisioner.model;

/**
 * Parsed form of the provider's {@code sshConnection} string,
 * {@code "user@host -p port"} or {@code "user@host"}.
 */
public record SshEndpoint(String user, String host, int port) {

    public static final int DEFAULT_PORT = 22;
    private static final String PORT_MARKER = " -p ";

    public static SshEndpoint parse(String connection) {
        if (connection == null || connection.isBlank()) {
            throw new IllegalArgumentException("SSH connection string is empty");
        }
        String target = connection.strip();
        int port = DEFAULT_PORT;

        int marker = target.indexOf(PORT_MARKER);
        if (marker >= 0) {
            String portText = target.substring(marker + PORT_MARKER.length()).strip();
            target = target.substring(0, marker).strip();
            try {
                port = Integer.parseInt(portText);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Bad SSH port in '" + connection + "'", e);
            }
        }

        int at = target.indexOf('@');
        String user = at >= 0 ? target.substring(0, at).strip() : null;
        String host = at >= 0 ? target.substring(at + 1).strip() : target;
        return new SshEndpoint(user, host, port);
    }
}
