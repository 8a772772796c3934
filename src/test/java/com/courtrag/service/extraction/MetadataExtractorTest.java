package com.courtrag.service.extraction;

import com.courtrag.model.MetadataField;
import com.courtrag.model.MetadataRecord;
import com.courtrag.support.TestFixtures;
import com.courtrag.util.TextNormalizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MetadataExtractorTest {

    private static final String RULING = String.join("\n",
        "AZƏRBAYCAN RESPUBLİKASI ADINDAN",
        "QƏTNAMƏ",
        "İş № 2(103)-1234/2023",
        "Məhkəmənin adı: Ağdam Rayon Məhkəməsi",
        "Hakim: Əli Məmmədov",
        "İşin növü: Mülki",
        "Qərarın tarixi: 15.03.2023",
        "İddiaçı: Həsənov Vüqar",
        "",
        "Məhkəmə iclasında tərəflərin izahatları dinlənildi.");

    private MetadataExtractor extractor;
    private final TextNormalizer normalizer = new TextNormalizer();

    @BeforeEach
    void setUp() {
        extractor = new MetadataExtractor(TestFixtures.catalog(), TestFixtures.FIXED_CLOCK);
    }

    @Test
    void shouldExtractJudgeAndYearFromLabels() {
        MetadataRecord record = extractor.extract("Hakim: Əli Məmmədov\nİl: 2023");

        assertEquals("Əli Məmmədov", record.get(MetadataField.JUDGE).orElseThrow());
        assertEquals("2023", record.get(MetadataField.YEAR).orElseThrow());
        assertFalse(record.isKnown(MetadataField.COURT_NAME));
        assertFalse(record.isPartiallyAmbiguous());
    }

    @Test
    void shouldTitleCaseJudgeTypedInCapitals() {
        MetadataRecord record = extractor.extract("Hakim: ƏLİ MƏMMƏDOV\nİl: 2023");

        assertEquals("Əli Məmmədov", record.get(MetadataField.JUDGE).orElseThrow());
    }

    @Test
    void shouldExtractFullHeader() {
        MetadataRecord record = extractor.extract(normalizer.normalize(RULING));

        assertEquals("Ağdam Rayon Məhkəməsi", record.get(MetadataField.COURT_NAME).orElseThrow());
        assertEquals("2(103)-1234/2023", record.get(MetadataField.CASE_NUMBER).orElseThrow());
        assertEquals("Əli Məmmədov", record.get(MetadataField.JUDGE).orElseThrow());
        assertEquals("Mülki", record.get(MetadataField.CASE_TYPE).orElseThrow());
        assertEquals("Ağdam", record.get(MetadataField.DISTRICT).orElseThrow());
        assertEquals("QƏTNAMƏ", record.get(MetadataField.DECISION_TYPE).orElseThrow());
        assertEquals("2023-03-15", record.get(MetadataField.DECISION_DATE).orElseThrow());
        assertEquals("2023", record.get(MetadataField.YEAR).orElseThrow());
        assertTrue(record.getParties().contains("Həsənov Vüqar"));
    }

    @Test
    void shouldMatchOcrCorruptedAnchors() {
        String text = "MEHKEMENIN ADI: Sirvan Apellyasiya Mehkemesi\nHakım: Kamran Əliyev\nIl: 2024";

        MetadataRecord record = extractor.extract(text);

        assertEquals("Şirvan Apellyasiya Məhkəməsi", record.get(MetadataField.COURT_NAME).orElseThrow());
        assertEquals("Kamran Əliyev", record.get(MetadataField.JUDGE).orElseThrow());
        assertEquals("2024", record.get(MetadataField.YEAR).orElseThrow());
        assertEquals("Şirvan", record.get(MetadataField.DISTRICT).orElseThrow());
    }

    @Test
    void shouldPreferDecisionDateYearAndFlagDisagreement() {
        MetadataRecord record = extractor.extract("İl: 2022\nQərarın tarixi: 10.05.2023");

        assertEquals("2023", record.get(MetadataField.YEAR).orElseThrow());
        assertEquals("2023-05-10", record.get(MetadataField.DECISION_DATE).orElseThrow());
        assertTrue(record.isPartiallyAmbiguous());
    }

    @Test
    void shouldFillYearFromDecisionDate() {
        MetadataRecord record = extractor.extract("Qərarın tarixi: 1 fevral 2021");

        assertEquals("2021-02-01", record.get(MetadataField.DECISION_DATE).orElseThrow());
        assertEquals("2021", record.get(MetadataField.YEAR).orElseThrow());
    }

    @Test
    void shouldLeaveEverythingUnknownForUnstructuredText() {
        MetadataRecord record = extractor.extract("@@@ ### 12 ::: —— ;;; |||");

        assertFalse(record.isKnown(MetadataField.JUDGE));
        assertFalse(record.isKnown(MetadataField.COURT_NAME));
        assertEquals(MetadataRecord.UNKNOWN, record.valueOrUnknown(MetadataField.CASE_NUMBER));
    }

    @Test
    void shouldReturnEmptyRecordForBlankText() {
        assertTrue(extractor.extract(null).isEmpty());
        assertTrue(extractor.extract("   ").isEmpty());
    }

    @Test
    void shouldIgnoreImplausibleYears() {
        MetadataRecord record = extractor.extract("İl: 2099");

        assertFalse(record.isKnown(MetadataField.YEAR));
    }
}
