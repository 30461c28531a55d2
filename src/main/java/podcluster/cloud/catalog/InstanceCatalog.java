package podcluster.cloud.catalog;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import podcluster.cloud.model.InstanceType;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Read-only lookup from catalog instance type to the provider's upstream cloud id.
 * <p>
 * Built once at startup and handed to the launch path. The catalog CSV must have
 * {@code InstanceType} and {@code UpstreamCloudId} columns; other columns are ignored
 * and the first row wins when an instance type is listed for several regions.
 */
public final class InstanceCatalog {

    private static final Logger log = LoggerFactory.getLogger(InstanceCatalog.class);

    public static final String DEFAULT_RESOURCE = "/catalog/vms.csv";

    static final String INSTANCE_TYPE_COLUMN = "InstanceType";
    static final String CLOUD_ID_COLUMN = "UpstreamCloudId";

    private static final CSVFormat CSV_FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setTrim(true)
            .build();

    private final Map<String, String> cloudIds;

    public InstanceCatalog(Map<String, String> cloudIds) {
        this.cloudIds = Collections.unmodifiableMap(new LinkedHashMap<>(cloudIds));
    }

    /** Load the catalog bundled with the application. */
    public static InstanceCatalog fromClasspath() {
        return fromClasspath(DEFAULT_RESOURCE);
    }

    static InstanceCatalog fromClasspath(String resource) {
        InputStream in = InstanceCatalog.class.getResourceAsStream(resource);
        if (in == null) {
            throw new IllegalArgumentException("Catalog resource not found: " + resource);
        }
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            return fromCsv(reader);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read catalog " + resource, e);
        }
    }

    public static InstanceCatalog fromCsv(Reader source) throws IOException {
        Map<String, String> ids = new LinkedHashMap<>();
        try (CSVParser parser = CSV_FORMAT.parse(source)) {
            requireColumn(parser, INSTANCE_TYPE_COLUMN);
            requireColumn(parser, CLOUD_ID_COLUMN);

            for (CSVRecord record : parser) {
                if (!record.isSet(INSTANCE_TYPE_COLUMN) || !record.isSet(CLOUD_ID_COLUMN)) {
                    log.warn("Skipping short catalog record {}: {}", record.getRecordNumber(), record.size());
                    continue;
                }
                String type = record.get(INSTANCE_TYPE_COLUMN);
                String cloudId = record.get(CLOUD_ID_COLUMN);
                if (!type.isEmpty() && !cloudId.isEmpty()) {
                    ids.putIfAbsent(type, cloudId);
                }
            }
        }
        log.debug("Loaded instance catalog with {} instance types", ids.size());
        return new InstanceCatalog(ids);
    }

    /** A catalog entry: the decoded instance type and the id the provider knows it by. */
    public record Offering(InstanceType type, String cloudId) {
    }

    /**
     * Look up an instance type and decode it.
     *
     * @throws IllegalArgumentException if the type is unknown or malformed
     */
    public Offering resolve(String instanceType) {
        String cloudId = cloudIds.get(instanceType);
        if (cloudId == null) {
            throw new IllegalArgumentException("No upstream cloud id for instance type " + instanceType);
        }
        return new Offering(InstanceType.parse(instanceType), cloudId);
    }

    public int size() {
        return cloudIds.size();
    }

    private static void requireColumn(CSVParser parser, String name) {
        if (!parser.getHeaderNames().contains(name)) {
            throw new IllegalArgumentException("Catalog has no '" + name + "' column");
        }
    }
}
