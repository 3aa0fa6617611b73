package com.lanhub.collector.config;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class CollectorPropertiesGuardrailTest {

    @Test
    void blankValuesFallBackToDefaults() {
        CollectorProperties properties = new CollectorProperties();
        properties.getStorage().setRoot("  ");
        properties.getMerge().setSeparator("");
        properties.getMerge().setDefaultGroupByField(" ");
        properties.getCli().setDedupColumns(null);

        assertEquals("./data/collect", properties.getStorage().getRoot());
        assertEquals("|", properties.getMerge().getSeparator());
        assertEquals("所属部门", properties.getMerge().getDefaultGroupByField());
        assertEquals("", properties.getCli().getDedupColumns());
    }

    @Test
    void extensionsAreNormalized() {
        CollectorProperties properties = new CollectorProperties();
        properties.getStorage().setDefaultExtension("xlsx");
        properties.getMerge().setTabularExtension(null);

        assertEquals(".xlsx", properties.getStorage().getDefaultExtension());
        assertEquals(".csv", properties.getMerge().getTabularExtension());
    }

    @Test
    void allowedExtensionsAreNormalizedAndNeverEmpty() {
        CollectorProperties properties = new CollectorProperties();
        properties.getStorage().setAllowedExtensions(Arrays.asList("CSV", " ", null, ".TXT"));

        assertEquals(List.of(".csv", ".txt"), properties.getStorage().getAllowedExtensions());

        properties.getStorage().setAllowedExtensions(null);
        assertEquals(List.of(".csv"), properties.getStorage().getAllowedExtensions());
    }

    @Test
    void numericSettingsAreClamped() {
        CollectorProperties properties = new CollectorProperties();
        properties.getMerge().setHeaderRowIndex(-3);
        properties.getTasks().setSlugLength(2);
        properties.getTasks().setSlugMaxRetries(0);
        properties.getStorage().setMaxFileSizeBytes(-1);

        assertEquals(0, properties.getMerge().getHeaderRowIndex());
        assertEquals(6, properties.getTasks().getSlugLength());
        assertEquals(1, properties.getTasks().getSlugMaxRetries());
        assertEquals(1, properties.getStorage().getMaxFileSizeBytes());
    }
}
