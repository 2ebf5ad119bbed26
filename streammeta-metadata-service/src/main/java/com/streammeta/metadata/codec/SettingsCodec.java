package com.streammeta.metadata.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.streammeta.common.exception.MalformedSettingsException;
import com.streammeta.common.model.Schema;
import com.streammeta.common.model.StreamSettings;
import com.streammeta.common.util.JsonUtils;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Reads and writes {@link StreamSettings} in the {@code settings} entry of schema metadata.
 *
 * <p>The stored blob is a JSON object. Partition keys are stored as an object whose values are the
 * key names; their position in the decoded list is the byte order of the object's own keys, which
 * is how existing blobs ({@code {"L0": .., "L1": ..}}) express ordering. Any field with an
 * unexpected JSON type decodes to that field's default. A blob that is not a JSON object at all is
 * rejected, so a stream's configuration is never silently dropped.
 */
@Component
@RequiredArgsConstructor
public class SettingsCodec {

    static final String PARTITION_KEYS = "partition_keys";
    static final String FULL_TEXT_SEARCH_KEYS = "full_text_search_keys";
    static final String SKIP_SCHEMA_VALIDATION = "skip_schema_validation";
    static final String DATA_RETENTION = "data_retention";

    private static final String PARTITION_LABEL_PREFIX = "L";

    private static final Comparator<String> BYTE_ORDER = (a, b) -> Arrays.compareUnsigned(
            a.getBytes(StandardCharsets.UTF_8), b.getBytes(StandardCharsets.UTF_8));

    private final Clock clock;

    /**
     * Decode the settings carried by schema metadata.
     *
     * @return the all-default settings when there is no {@code settings} entry
     * @throws MalformedSettingsException if the entry exists but is not a JSON object
     */
    public StreamSettings decode(Map<String, String> metadata) {
        StreamSettings settings = new StreamSettings();
        String blob = metadata == null ? null : metadata.get(Schema.SETTINGS_KEY);
        if (blob == null) {
            return settings;
        }

        JsonNode root = parse(blob);
        settings.setPartitionKeys(readPartitionKeys(root.get(PARTITION_KEYS)));
        settings.setFullTextSearchKeys(readStringArray(root.get(FULL_TEXT_SEARCH_KEYS)));

        JsonNode skip = root.get(SKIP_SCHEMA_VALIDATION);
        settings.setSkipSchemaValidation(skip != null && skip.isBoolean() && skip.booleanValue());

        JsonNode retention = root.get(DATA_RETENTION);
        if (retention != null && retention.isIntegralNumber() && retention.canConvertToLong()) {
            settings.setDataRetention(retention.longValue());
        }
        return settings;
    }

    /**
     * Write settings into a copy of the metadata. A missing {@code created_at} is stamped with
     * the current time in microseconds; an existing one is kept.
     */
    public Map<String, String> encode(Map<String, String> metadata, StreamSettings settings) {
        Map<String, String> updated = metadata == null ? new HashMap<>() : new HashMap<>(metadata);
        updated.put(Schema.SETTINGS_KEY, JsonUtils.toJson(toJsonNode(settings)));
        if (!updated.containsKey(Schema.CREATED_AT_KEY)) {
            long micros = ChronoUnit.MICROS.between(Instant.EPOCH, clock.instant());
            updated.put(Schema.CREATED_AT_KEY, Long.toString(micros));
        }
        return updated;
    }

    /**
     * Full-text-search fields configured on a schema, without decoding the rest of the settings.
     */
    public List<String> fullTextSearchKeys(Schema schema) {
        String blob = schema.getMetadata() == null ? null : schema.getMetadata().get(Schema.SETTINGS_KEY);
        if (blob == null) {
            return new ArrayList<>();
        }
        return readStringArray(parse(blob).get(FULL_TEXT_SEARCH_KEYS));
    }

    private JsonNode parse(String blob) {
        JsonNode root;
        try {
            root = JsonUtils.readTree(blob);
        } catch (JsonProcessingException e) {
            throw new MalformedSettingsException("stream settings are not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedSettingsException("stream settings must be a JSON object");
        }
        return root;
    }

    private List<String> readPartitionKeys(JsonNode node) {
        if (node == null || !node.isObject()) {
            return new ArrayList<>();
        }
        TreeMap<String, String> byLabel = new TreeMap<>(BYTE_ORDER);
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!field.getValue().isTextual()) {
                return new ArrayList<>();
            }
            byLabel.put(field.getKey(), field.getValue().textValue());
        }
        return new ArrayList<>(byLabel.values());
    }

    private List<String> readStringArray(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node == null || !node.isArray()) {
            return values;
        }
        for (JsonNode item : node) {
            if (!item.isTextual()) {
                return new ArrayList<>();
            }
            values.add(item.textValue());
        }
        return values;
    }

    private ObjectNode toJsonNode(StreamSettings settings) {
        ObjectNode root = JsonUtils.getObjectMapper().createObjectNode();

        ObjectNode partitionKeys = root.putObject(PARTITION_KEYS);
        List<String> keys = settings.getPartitionKeys() == null ? List.of() : settings.getPartitionKeys();
        // labels are zero-padded so that byte order equals list order
        int width = Integer.toString(Math.max(keys.size() - 1, 0)).length();
        for (int i = 0; i < keys.size(); i++) {
            partitionKeys.put(PARTITION_LABEL_PREFIX + String.format("%0" + width + "d", i), keys.get(i));
        }

        ArrayNode fts = root.putArray(FULL_TEXT_SEARCH_KEYS);
        if (settings.getFullTextSearchKeys() != null) {
            settings.getFullTextSearchKeys().forEach(fts::add);
        }

        root.put(SKIP_SCHEMA_VALIDATION, settings.isSkipSchemaValidation());
        root.put(DATA_RETENTION, settings.getDataRetention());
        return root;
    }
}
