package ai.lineage;

import static org.junit.jupiter.api.Assertions.*;

import ai.lineage.hierarchy.ParentSelectionPolicy;
import java.util.Map;
import java.util.Properties;
import org.junit.jupiter.api.Test;

class LineageConfigTest {

    private static Properties props(String... keyValues) {
        var props = new Properties();
        for (int i = 0; i < keyValues.length; i += 2) {
            props.setProperty(keyValues[i], keyValues[i + 1]);
        }
        return props;
    }

    @Test
    void testEmptySourcesGiveDefaults() {
        assertEquals(LineageConfig.defaults(), LineageConfig.from(new Properties(), Map.of()));
    }

    @Test
    void testBundledPropertiesMatchDefaults() {
        var config = LineageConfig.load();
        assertEquals(192, config.maxKeyLength());
        assertEquals(ParentSelectionPolicy.NEAREST_PRECEDING, config.parentSelectionPolicy());
    }

    @Test
    void testPropertiesAreRead() {
        var config = LineageConfig.from(
                props(
                        "lineage.maxKeyLength", "64",
                        "lineage.minPrefixLength", "12",
                        "lineage.registerFullTextFallback", "no",
                        "lineage.requireSameWorkspace", "false",
                        "lineage.parentSelectionPolicy", "longest-match"),
                Map.of());

        assertEquals(
                new LineageConfig(64, 12, false, false, ParentSelectionPolicy.LONGEST_MATCH), config);
    }

    @Test
    void testEnvironmentWinsOverProperties() {
        var config = LineageConfig.from(
                props("lineage.maxKeyLength", "64", "lineage.requireSameWorkspace", "true"),
                Map.of("LINEAGE_MAX_KEY_LENGTH", " 80 ", "LINEAGE_REQUIRE_SAME_WORKSPACE", "0"));

        assertEquals(80, config.maxKeyLength());
        assertFalse(config.requireSameWorkspace());
    }

    @Test
    void testInvalidValuesKeepDefaults() {
        var config = LineageConfig.from(
                props(
                        "lineage.maxKeyLength", "0",
                        "lineage.minPrefixLength", "lots",
                        "lineage.registerFullTextFallback", "perhaps",
                        "lineage.parentSelectionPolicy", "random"),
                Map.of());

        assertEquals(LineageConfig.defaults(), config);
    }

    @Test
    void testEnvironmentNames() {
        assertEquals("LINEAGE_MAX_KEY_LENGTH", LineageConfig.envName(LineageConfig.MAX_KEY_LENGTH));
        assertEquals(
                "LINEAGE_PARENT_SELECTION_POLICY", LineageConfig.envName(LineageConfig.PARENT_SELECTION_POLICY));
    }

    @Test
    void testConstructorRejectsBadBounds() {
        assertThrows(
                IllegalArgumentException.class,
                () -> new LineageConfig(0, 0, true, true, ParentSelectionPolicy.NEAREST_PRECEDING));
        assertThrows(
                IllegalArgumentException.class,
                () -> LineageConfig.defaults().withMinPrefixLength(-1));
    }
}
