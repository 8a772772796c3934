package com.courtrag.service.extraction;

import com.courtrag.support.TestFixtures;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class InstitutionCatalogTest {

    private final InstitutionCatalog catalog = TestFixtures.catalog();

    @Test
    void shouldCanonicalizeCaseAndOcrVariants() {
        assertEquals("Ağdam Rayon Məhkəməsi", catalog.canonicalCourt("AĞDAM RAYON MƏHKƏMƏSİ"));
        assertEquals("Ağdam Rayon Məhkəməsi", catalog.canonicalCourt("Agdam rayon mehkemesi"));
    }

    @Test
    void shouldCorrectSingleCharacterTypos() {
        assertEquals("Ağdam Rayon Məhkəməsi", catalog.canonicalCourt("Agdam Rayon Mehkemesl"));
    }

    @Test
    void shouldKeepUnknownNamesVerbatim() {
        assertEquals("Xankəndi Rayon Məhkəməsi", catalog.canonicalCourt("Xankəndi Rayon Məhkəməsi"));
        assertFalse(catalog.isKnownCourt("Xankəndi Rayon Məhkəməsi"));
        assertTrue(catalog.isKnownCourt("Nəsimi Rayon Məhkəməsi"));
    }

    @Test
    void shouldStripVenueWordFromDistrict() {
        assertEquals("Ağdam", catalog.canonicalDistrict("Ağdam rayonu"));
        assertEquals("Bakı", catalog.canonicalDistrict("BAKI"));
    }

    @Test
    void shouldFindCourtInRunningText() {
        assertEquals("Şirvan Apellyasiya Məhkəməsi",
            catalog.findCourtIn("İş Şirvan Apellyasiya Məhkəməsi tərəfindən baxılmışdır").orElseThrow());
        assertTrue(catalog.findCourtIn("heç bir məhkəmə adı yoxdur").isEmpty());
    }

    @Test
    void shouldDeriveDistrictFromCourt() {
        assertEquals("Nəsimi", catalog.districtOfCourt("Nəsimi Rayon Məhkəməsi").orElseThrow());
        assertTrue(catalog.districtOfCourt("Naməlum Məhkəmə").isEmpty());
    }

    @Test
    void shouldComputeEditDistance() {
        assertEquals(3, InstitutionCatalog.levenshtein("kitten", "sitting"));
        assertEquals(0, InstitutionCatalog.levenshtein("agdam", "agdam"));
    }
}
