package com.courtrag.service.index;

import com.courtrag.model.MetadataField;
import com.courtrag.model.MetadataRecord;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

class FacetCacheTest {

    private final FacetCache cache = new FacetCache();

    private static MetadataRecord judge(String name) {
        return MetadataRecord.builder().set(MetadataField.JUDGE, name).build();
    }

    @Test
    void shouldKeepValueWhileAnyDocumentBacksIt() {
        cache.register(judge("Kamran Əliyev"));
        cache.register(judge("Kamran Əliyev"));

        cache.release(judge("Kamran Əliyev"));
        assertEquals(List.of("Kamran Əliyev"), cache.values(MetadataField.JUDGE));
        assertEquals(1, cache.documentCount(MetadataField.JUDGE, "Kamran Əliyev"));

        cache.release(judge("Kamran Əliyev"));
        assertTrue(cache.values(MetadataField.JUDGE).isEmpty());
    }

    @Test
    void shouldSortValuesAlphabetically() {
        cache.register(judge("Şahin Quliyev"));
        cache.register(judge("Əli Məmmədov"));
        cache.register(judge("Kamran"));

        assertEquals(List.of("Əli Məmmədov", "Kamran", "Şahin Quliyev"), cache.values(MetadataField.JUDGE));
    }

    @Test
    void shouldRegisterEveryParty() {
        cache.register(MetadataRecord.builder()
            .parties(List.of("Həsənov Vüqar", "Aqro MMC"))
            .build());

        assertEquals(2, cache.size(MetadataField.PARTIES));
    }

    @Test
    void shouldRebuildFromSnapshots() {
        cache.register(judge("Köhnə Hakim"));

        cache.rebuild(() -> List.of(judge("Kamran"), judge("Kamran")));

        assertEquals(List.of("Kamran"), cache.values(MetadataField.JUDGE));
        assertEquals(2, cache.documentCount(MetadataField.JUDGE, "Kamran"));
        assertTrue(cache.snapshot().get(MetadataField.YEAR).isEmpty());
    }

    @Test
    void shouldCountCaseVariantsAsOneValue() {
        cache.register(judge("ƏLİ MƏMMƏDOV"));
        cache.register(judge("Əli Məmmədov"));

        assertEquals(List.of("Əli Məmmədov"), cache.values(MetadataField.JUDGE));
        assertEquals(2, cache.documentCount(MetadataField.JUDGE, "əli məmmədov"));

        cache.release(judge("Əli Məmmədov"));
        assertEquals(1, cache.size(MetadataField.JUDGE));
        cache.release(judge("ƏLİ MƏMMƏDOV"));
        assertEquals(0, cache.size(MetadataField.JUDGE));
    }

    @Test
    void shouldRunChangeBetweenReleaseAndRegister() {
        cache.register(judge("Kamran"));
        List<List<String>> seen = new ArrayList<>();

        cache.replace(judge("Kamran"), judge("Vüsal"), () -> seen.add(cache.values(MetadataField.JUDGE)));

        assertEquals(List.of(List.of()), seen);
        assertEquals(List.of("Vüsal"), cache.values(MetadataField.JUDGE));
    }
}
