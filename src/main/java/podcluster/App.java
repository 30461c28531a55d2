package podcluster;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import podcluster.cloud.config.ClusterSpec;
import podcluster.cloud.config.IniLoader;
import podcluster.provisioner.config.Dependencies;
import podcluster.provisioner.config.ProvisionerConfig;
import podcluster.provisioner.model.ClusterInfo;
import podcluster.provisioner.model.NodeConfig;
import podcluster.provisioner.model.ProvisionRecord;

import java.io.File;
import java.io.PrintStream;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Command line entry point.
 * <pre>
 * up &lt;cluster.ini&gt;                   launch or reconcile a cluster and print its connection info
 * info &lt;cluster&gt;                     print connection info of a running cluster
 * status &lt;cluster&gt;                   print the status of every node
 * down &lt;cluster&gt; [--workers-only]    terminate a cluster
 * check                              verify API credentials
 * </pre>
 */
public final class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    private static final ObjectMapper JSON = Dependencies.objectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private App() {
    }

    public static void main(String[] args) {
        int code = run(args, System.out, System.err);
        if (code != 0) {
            System.exit(code);
        }
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        if (args.length == 0) {
            usage(err);
            return 2;
        }
        String command = args[0];
        List<String> rest = Arrays.asList(args).subList(1, args.length);
        try {
            ProvisionerConfig config = ProvisionerConfig.fromEnv();
            switch (command) {
                case "up" -> up(Dependencies.create(config), single(rest, "up <cluster.ini>"), out);
                case "info" -> print(out, Dependencies.create(config).assembler().assemble(single(rest, "info <cluster>")));
                case "status" -> print(out, Dependencies.create(config).lifecycle().query(single(rest, "status <cluster>"), true));
                case "down" -> down(Dependencies.create(config), rest, out);
                case "check" -> {
                    Optional<String> problem = Dependencies.create(config).providerCheck().check();
                    if (problem.isPresent()) {
                        err.println(problem.get());
                        return 1;
                    }
                    out.println("OK");
                }
                default -> {
                    usage(err);
                    return 2;
                }
            }
            return 0;
        } catch (IllegalArgumentException e) {
            err.println("[ERROR] " + e.getMessage());
            return 2;
        } catch (RuntimeException e) {
            log.error("Command '{}' failed", command, e);
            err.println("[ERROR] " + e.getMessage());
            return 1;
        }
    }

    private static void up(Dependencies deps, String iniPath, PrintStream out) {
        ClusterSpec spec = IniLoader.load(new File(iniPath), deps.config().defaultDiskSizeGb());
        log.info("Loaded {}", spec);

        if (spec.sshPublicKey() != null) {
            deps.sshKeyManager().getOrAdd(spec.sshPublicKey());
        }

        ProvisionRecord record = deps.reconciler().reconcile(
                spec.clusterName(),
                spec.nodes(),
                new NodeConfig(spec.instanceType(), spec.diskSizeGb()),
                spec.region());
        ClusterInfo info = deps.assembler().assemble(spec.clusterName());

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("provision", record);
        result.put("cluster", info);
        print(out, result);
    }

    private static void down(Dependencies deps, List<String> rest, PrintStream out) {
        if (rest.isEmpty() || rest.size() > 2 || (rest.size() == 2 && !"--workers-only".equals(rest.get(1)))) {
            throw new IllegalArgumentException("usage: down <cluster> [--workers-only]");
        }
        boolean workersOnly = rest.size() == 2;
        deps.lifecycle().terminate(rest.get(0), workersOnly);
        out.println("Terminated " + (workersOnly ? "workers of " : "") + rest.get(0));
    }

    private static String single(List<String> rest, String usage) {
        if (rest.size() != 1) {
            throw new IllegalArgumentException("usage: " + usage);
        }
        return rest.get(0);
    }

    private static void print(PrintStream out, Object value) {
        try {
            out.println(JSON.writeValueAsString(value));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot render output", e);
        }
    }

    private static void usage(PrintStream err) {
        err.println("usage: podcluster up <cluster.ini> | info <cluster> | status <cluster>"
                + " | down <cluster> [--workers-only] | check");
    }
}
