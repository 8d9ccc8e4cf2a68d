package com.filingsync.ingestion.client;

import com.filingsync.ingestion.domain.IssuerRecord;
import com.filingsync.ingestion.domain.ObservedFiling;
import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reads the portal's CSV exports. Filing rows missing an identity, an issuer or a parsable date are
 * rejected with a reason; they still count towards the page size, since the portal counted them too.
 */
@Component
public class PortalCsvParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(PortalCsvParser.class);

    private static final Set<String> TRUE_FLAGS = Set.of("y", "yes", "true", "1", "t");

    public record Parsed<T>(List<T> items, int rowCount, List<String> rejected) {

        public Parsed(List<T> items, int rowCount) {
            this(items, rowCount, List.of());
        }
    }

    public Parsed<ObservedFiling> parseFilings(String csv) {
        List<ObservedFiling> filings = new ArrayList<>();
        List<String> rejected = new ArrayList<>();
        int rows = 0;
        try (CSVParser parser = csvParser(csv)) {
            Map<String, String> headers = headerLookup(parser);
            for (CSVRecord record : parser) {
                rows++;
                String documentIdentity = column(record, headers, "Document GUID");
                String issuerId = column(record, headers, "Issuer Number");
                String rawDate = column(record, headers, "Date Filed");
                LocalDate filedOn = parseDate(rawDate);
                if (documentIdentity == null || issuerId == null || filedOn == null) {
                    rejected.add(describeRejection(record.getRecordNumber(), documentIdentity, issuerId, rawDate));
                    continue;
                }
                filings.add(new ObservedFiling(
                    issuerId,
                    column(record, headers, "Issuer Name", "Name"),
                    documentIdentity,
                    column(record, headers, "Filing Type"),
                    column(record, headers, "Document Type"),
                    filedOn,
                    column(record, headers, "Generate URL", "URL"),
                    parseLong(column(record, headers, "Size")),
                    isTrue(column(record, headers, "Amendment"))
                ));
            }
        } catch (IOException | UncheckedIOException | IllegalStateException | IllegalArgumentException e) {
            throw new PermanentFetchException("parse filings export", 0, "malformed CSV: " + e.getMessage(), e);
        }
        if (!rejected.isEmpty()) {
            LOGGER.warn("Rejected {} of {} filing rows without identity, issuer or filing date", rejected.size(), rows);
        }
        return new Parsed<>(filings, rows, rejected);
    }

    public Parsed<IssuerRecord> parseIssuers(String csv) {
        List<IssuerRecord> issuers = new ArrayList<>();
        int rows = 0;
        try (CSVParser parser = csvParser(csv)) {
            Map<String, String> headers = headerLookup(parser);
            for (CSVRecord record : parser) {
                rows++;
                String issuerId = column(record, headers, "Issuer Number");
                if (issuerId == null) {
                    continue;
                }
                issuers.add(new IssuerRecord(
                    issuerId,
                    column(record, headers, "Name"),
                    column(record, headers, "Jurisdiction(s)", "Jurisdiction"),
                    column(record, headers, "Type"),
                    isTrue(column(record, headers, "In Default Flag")),
                    isTrue(column(record, headers, "Active CTO Flag")),
                    null
                ));
            }
        } catch (IOException | UncheckedIOException | IllegalStateException | IllegalArgumentException e) {
            throw new PermanentFetchException("parse issuers export", 0, "malformed CSV: " + e.getMessage(), e);
        }
        return new Parsed<>(issuers, rows);
    }

    private CSVParser csvParser(String csv) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreSurroundingSpaces(true)
            .setIgnoreEmptyLines(true)
            .build();
        return format.parse(new StringReader(csv == null ? "" : csv));
    }

    private Map<String, String> headerLookup(CSVParser parser) {
        Map<String, String> lookup = new HashMap<>();
        Map<String, Integer> headerMap = parser.getHeaderMap();
        if (headerMap == null) {
            return lookup;
        }
        for (String header : headerMap.keySet()) {
            if (header != null) {
                lookup.put(header.trim().toLowerCase(Locale.ROOT), header);
            }
        }
        return lookup;
    }

    private String column(CSVRecord record, Map<String, String> headers, String... names) {
        for (String name : names) {
            String header = headers.get(name.toLowerCase(Locale.ROOT));
            if (header == null || !record.isSet(header)) {
                continue;
            }
            String value = record.get(header).trim();
            return value.isEmpty() ? null : value;
        }
        return null;
    }

    private String describeRejection(long rowNumber, String documentIdentity, String issuerId, String rawDate) {
        String problem;
        if (documentIdentity == null) {
            problem = "missing Document GUID";
        } else if (issuerId == null) {
            problem = "missing Issuer Number";
        } else if (rawDate == null) {
            problem = "missing Date Filed";
        } else {
            problem = "unparsable Date Filed '" + rawDate + "'";
        }
        return "row " + rowNumber + (documentIdentity == null ? "" : " (" + documentIdentity + ")") + ": " + problem;
    }

    private LocalDate parseDate(String raw) {
        if (raw == null || raw.length() < 10) {
            return null;
        }
        try {
            return LocalDate.parse(raw.substring(0, 10));
        } catch (DateTimeParseException e) {
            LOGGER.debug("Unparsable filing date {}", raw);
            return null;
        }
    }

    private Long parseLong(String raw) {
        if (raw == null) {
            return null;
        }
        try {
            return Long.parseLong(raw.replace(",", ""));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private boolean isTrue(String raw) {
        return raw != null && TRUE_FLAGS.contains(raw.toLowerCase(Locale.ROOT));
    }
}
