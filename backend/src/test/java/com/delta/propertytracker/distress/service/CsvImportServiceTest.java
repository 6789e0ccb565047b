package com.delta.propertytracker.distress.service;

import com.delta.propertytracker.distress.model.ImportSummary;
import com.delta.propertytracker.distress.model.PropertyRecord;
import com.delta.propertytracker.distress.model.Stage;
import com.delta.propertytracker.distress.persistence.DistressJdbcRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.io.StringReader;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class CsvImportServiceTest {

    @Autowired
    private DistressJdbcRepository repository;
    @Autowired
    private CsvImportService importService;

    @BeforeEach
    void clearStore() {
        repository.deleteAll();
    }

    @Test
    void importsRowsAndCountsStages() {
        String csv = """
            Stage , Address,CITY,state,zip,apn,record_date,doc_type,source_url
            PRE_FORECLOSURE,9 Elm St,Winnemucca,NV,89445,,2025-01-02,Notice of Default,https://recorder.example/1
            reo,42 Bridge St,Winnemucca,NV,,,,,
            Sheriff Auction,1 Sale Way,Winnemucca,NV,,,,,
            """;

        ImportSummary summary = importService.importCsv(new StringReader(csv));

        assertThat(summary.inserted()).isEqualTo(3);
        assertThat(summary.stageCounts())
            .containsEntry(Stage.PRE_FORECLOSURE, 1)
            .containsEntry(Stage.REO, 1)
            .containsEntry(Stage.OTHER, 1);

        List<PropertyRecord> records = repository.findAllRecordsById();
        assertThat(records).hasSize(3);
        PropertyRecord first = records.get(0);
        assertThat(first.recordDate()).isEqualTo("2025-01-02");
        assertThat(first.docType()).isEqualTo("Notice of Default");
        assertThat(first.apn()).isNull();
        assertThat(records.get(1).zip()).isNull();
    }

    @Test
    void missingRequiredColumnRejectsImport() {
        String csv = "stage,address,city\nREO,42 Bridge St,Winnemucca\n";

        assertThatThrownBy(() -> importService.importCsv(new StringReader(csv)))
            .isInstanceOf(ImportValidationException.class)
            .hasMessageContaining("state");
        assertThat(repository.countTable("items")).isZero();
    }

    @Test
    void oneBadRowRejectsWholeFile() {
        String csv = """
            stage,address,city,state
            REO,42 Bridge St,Winnemucca,NV
            REO,,Winnemucca,NV
            """;

        assertThatThrownBy(() -> importService.importCsv(new StringReader(csv)))
            .isInstanceOfSatisfying(ImportValidationException.class, e ->
                assertThat(e.getProblems()).containsExactly("row 2 missing address"));
        assertThat(repository.countTable("items")).isZero();
    }

    @Test
    void trailingCommaInHeaderIsAccepted() {
        String csv = "stage,address,city,state,\nREO,1 A St,X,NV,\n";

        ImportSummary summary = importService.importCsv(new StringReader(csv));

        assertThat(summary.inserted()).isEqualTo(1);
        assertThat(repository.findAllRecordsById().get(0).address()).isEqualTo("1 A St");
    }

    @Test
    void byteOrderMarkOnFirstHeaderIsIgnored() {
        String csv = "\uFEFFstage,address,city,state\nREO,42 Bridge St,Winnemucca,NV\n";

        ImportSummary summary = importService.importCsv(new StringReader(csv));

        assertThat(summary.stageCounts()).containsEntry(Stage.REO, 1);
        assertThat(repository.findAllRecordsById().get(0).stage()).isEqualTo(Stage.REO);
    }

    @Test
    void emptyFileIsRejected() {
        assertThatThrownBy(() -> importService.importCsv(new StringReader("")))
            .isInstanceOf(ImportValidationException.class);
    }
}
