package com.filingsync.ingestion.client;

import com.filingsync.ingestion.domain.IssuerRecord;
import com.filingsync.ingestion.domain.ObservedFiling;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PortalCsvParserTest {

    private final PortalCsvParser parser = new PortalCsvParser();

    @Test
    void parsesFilingRowsAndReportsRejectedOnes() {
        String csv = """
            Issuer Number,Issuer Name,Document GUID,Filing Type,Document Type,Date Filed,Generate URL,Size,Amendment
            000012,Acme Mining Corp,GUID-1,Annual financial statements,Audited annual financial statements,2024-01-02 09:15:00,https://portal.example/doc/1,"1,024",
            000013,Borealis Energy,GUID-2,Material change report,Material change report,2024-01-02,https://portal.example/doc/2,,Y
            000014,No Identity Inc,,News release,News release,2024-01-02,https://portal.example/doc/3,10,
            000015,Bad Date Ltd,GUID-4,News release,News release,not-a-date,https://portal.example/doc/4,10,
            """;

        PortalCsvParser.Parsed<ObservedFiling> parsed = parser.parseFilings(csv);

        assertThat(parsed.rowCount()).isEqualTo(4);
        assertThat(parsed.items()).hasSize(2);
        assertThat(parsed.rejected()).satisfiesExactly(
            reason -> assertThat(reason).contains("missing Document GUID"),
            reason -> assertThat(reason).contains("(GUID-4)").contains("unparsable Date Filed 'not-a-date'")
        );

        ObservedFiling first = parsed.items().get(0);
        assertThat(first.issuerId()).isEqualTo("000012");
        assertThat(first.issuerName()).isEqualTo("Acme Mining Corp");
        assertThat(first.documentIdentity()).isEqualTo("GUID-1");
        assertThat(first.filedOn()).isEqualTo(LocalDate.of(2024, 1, 2));
        assertThat(first.sourceUrl()).isEqualTo("https://portal.example/doc/1");
        assertThat(first.sizeBytes()).isEqualTo(1024L);
        assertThat(first.amendment()).isFalse();

        ObservedFiling second = parsed.items().get(1);
        assertThat(second.sizeBytes()).isNull();
        assertThat(second.amendment()).isTrue();
    }

    @Test
    void emptyExportHasNoRows() {
        PortalCsvParser.Parsed<ObservedFiling> parsed = parser.parseFilings("");
        assertThat(parsed.rowCount()).isZero();
        assertThat(parsed.items()).isEmpty();
        assertThat(parsed.rejected()).isEmpty();
    }

    @Test
    void parsesIssuerExport() {
        String csv = """
            Issuer Number,Name,Jurisdiction(s),Type,In Default Flag,Active CTO Flag
            000012,Acme Mining Corp,"Ontario, Quebec",Reporting issuer,N,Y
            """;

        PortalCsvParser.Parsed<IssuerRecord> parsed = parser.parseIssuers(csv);

        assertThat(parsed.items()).singleElement().satisfies(issuer -> {
            assertThat(issuer.issuerId()).isEqualTo("000012");
            assertThat(issuer.jurisdiction()).isEqualTo("Ontario, Quebec");
            assertThat(issuer.inDefault()).isFalse();
            assertThat(issuer.activeRestriction()).isTrue();
        });
    }

    @Test
    void malformedCsvIsPermanent() {
        String csv = "Issuer Number,Document GUID,Date Filed\n000012,\"GUID-1,2024-01-02\n";

        assertThatThrownBy(() -> parser.parseFilings(csv))
            .isInstanceOf(PermanentFetchException.class)
            .hasMessageContaining("malformed CSV");
    }
}
