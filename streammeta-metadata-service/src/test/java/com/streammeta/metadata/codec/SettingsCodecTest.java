package com.streammeta.metadata.codec;

import com.streammeta.common.exception.MalformedSettingsException;
import com.streammeta.common.model.FieldType;
import com.streammeta.common.model.Schema;
import com.streammeta.common.model.SchemaField;
import com.streammeta.common.model.StreamSettings;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test for reading and writing stream settings in schema metadata
 */
public class SettingsCodecTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    private SettingsCodec codec;

    @BeforeEach
    void setUp() {
        codec = new SettingsCodec(Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void testMissingSettingsDecodeToDefaults() {
        assertEquals(new StreamSettings(), codec.decode(Map.of()));
        assertEquals(new StreamSettings(), codec.decode(Map.of("created_at", "1700000000000000")));
        assertEquals(new StreamSettings(), codec.decode(null));
    }

    @Test
    void testPartitionKeysFollowLexicalOrderOfTheirLabels() {
        StreamSettings settings = codec.decode(Map.of("settings",
                "{\"partition_keys\": {\"b\": \"region\", \"a\": \"tenant\"}}"));

        assertEquals(List.of("tenant", "region"), settings.getPartitionKeys());
    }

    @Test
    void testLegacyLabelsAboveNineSortAsText() {
        // L10 sorts between L1 and L2
        StreamSettings settings = codec.decode(Map.of("settings",
                "{\"partition_keys\": {\"L2\": \"c\", \"L10\": \"b\", \"L1\": \"a\"}}"));

        assertEquals(List.of("a", "b", "c"), settings.getPartitionKeys());
    }

    @Test
    void testDecodesEveryField() {
        StreamSettings settings = codec.decode(Map.of("settings", "{"
                + "\"partition_keys\": {\"L0\": \"k8s_namespace\"},"
                + "\"full_text_search_keys\": [\"message\", \"log\"],"
                + "\"skip_schema_validation\": true,"
                + "\"data_retention\": 30}"));

        assertEquals(List.of("k8s_namespace"), settings.getPartitionKeys());
        assertEquals(List.of("message", "log"), settings.getFullTextSearchKeys());
        assertTrue(settings.isSkipSchemaValidation());
        assertEquals(30L, settings.getDataRetention());
    }

    @Test
    void testMistypedFieldsFallBackToTheirDefaults() {
        StreamSettings settings = codec.decode(Map.of("settings", "{"
                + "\"partition_keys\": [\"tenant\"],"
                + "\"full_text_search_keys\": [\"message\", 42],"
                + "\"skip_schema_validation\": \"yes\","
                + "\"data_retention\": 7.5}"));

        assertEquals(new StreamSettings(), settings);
    }

    @Test
    void testOneMistypedFieldDoesNotAffectTheOthers() {
        StreamSettings settings = codec.decode(Map.of("settings",
                "{\"partition_keys\": {\"L0\": 1}, \"data_retention\": 14}"));

        assertTrue(settings.getPartitionKeys().isEmpty());
        assertEquals(14L, settings.getDataRetention());
    }

    @Test
    void testUnparseableSettingsAreRejected() {
        assertThrows(MalformedSettingsException.class,
                () -> codec.decode(Map.of("settings", "{not json")));
        assertThrows(MalformedSettingsException.class,
                () -> codec.decode(Map.of("settings", "[\"message\"]")));
        assertThrows(MalformedSettingsException.class,
                () -> codec.decode(Map.of("settings", "")));
        assertThrows(MalformedSettingsException.class,
                () -> codec.decode(Map.of("settings", "{\"data_retention\": 5} }garbage")));
        assertThrows(MalformedSettingsException.class,
                () -> codec.decode(Map.of("settings", "{\"data_retention\": 5}{\"data_retention\": 9}")));
    }

    @Test
    void testEncodeStampsCreatedAtOnlyOnce() {
        Map<String, String> first = codec.encode(new HashMap<>(), new StreamSettings());
        assertEquals("1767225600000000", first.get("created_at"));

        SettingsCodec later = new SettingsCodec(Clock.fixed(NOW.plusSeconds(3600), ZoneOffset.UTC));
        Map<String, String> second = later.encode(first, new StreamSettings());
        assertEquals("1767225600000000", second.get("created_at"));
    }

    @Test
    void testEncodeDoesNotMutateInputAndKeepsOtherEntries() {
        Map<String, String> metadata = new HashMap<>();
        metadata.put("owner", "ingest");

        Map<String, String> encoded = codec.encode(metadata, new StreamSettings());

        assertEquals(1, metadata.size());
        assertEquals("ingest", encoded.get("owner"));
        assertTrue(encoded.containsKey("settings"));
    }

    @Test
    void testEncodedSettingsDecodeToTheSameValue() {
        StreamSettings settings = StreamSettings.builder()
                .partitionKeys(List.of("tenant", "region"))
                .fullTextSearchKeys(List.of("message"))
                .skipSchemaValidation(true)
                .dataRetention(90)
                .build();

        assertEquals(settings, codec.decode(codec.encode(Map.of(), settings)));
    }

    @Test
    void testManyPartitionKeysKeepTheirOrder() {
        List<String> keys = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            keys.add("key_" + i);
        }
        StreamSettings settings = StreamSettings.builder().partitionKeys(keys).build();

        Map<String, String> encoded = codec.encode(Map.of(), settings);

        assertTrue(encoded.get("settings").contains("\"L00\":\"key_0\""), encoded.get("settings"));
        assertEquals(keys, codec.decode(encoded).getPartitionKeys());
    }

    @Test
    void testFewPartitionKeysUseLegacyLabels() {
        StreamSettings settings = StreamSettings.builder().partitionKeys(List.of("a", "b")).build();

        String blob = codec.encode(Map.of(), settings).get("settings");

        assertTrue(blob.contains("{\"L0\":\"a\",\"L1\":\"b\"}"), blob);
    }

    @Test
    void testFullTextSearchKeysOfSchema() {
        Schema bare = Schema.builder()
                .fields(List.of(new SchemaField("message", FieldType.UTF8)))
                .build();
        assertTrue(codec.fullTextSearchKeys(bare).isEmpty());

        Schema configured = bare.withMetadata(Map.of("settings", "{\"full_text_search_keys\": [\"message\"]}"));
        assertEquals(List.of("message"), codec.fullTextSearchKeys(configured));
    }
}
