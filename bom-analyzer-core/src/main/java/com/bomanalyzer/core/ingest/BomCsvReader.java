package com.bomanalyzer.core.ingest;

import com.bomanalyzer.core.model.BomRow;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Reads a delimited BOM export into {@link BomRow}s using Jackson CSV.
 *
 * <p>The first line must be a header naming at least the configured {@link BomColumns}; extra
 * columns are ignored. One row is one product-component edge, or a bare product when the
 * component column is blank.
 *
 * <p><b>Numeric cleanup:</b> quantity and unit cost pass through {@link NumericCleaner}. Rows are
 * rejected, never coerced, when:
 * <ul>
 *   <li>a component is named but its quantity is blank, malformed, zero or negative</li>
 *   <li>the unit cost is malformed or negative (a blank unit cost reads as 0)</li>
 * </ul>
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * BomCsvReader reader = new BomCsvReader(BomColumns.defaults(), ',');
 * BomReadResult result = reader.read(Paths.get("items-bom-with-cost.csv"));
 * }</pre>
 */
public class BomCsvReader {

    private static final Logger log = LoggerFactory.getLogger(BomCsvReader.class);

    private final BomColumns columns;
    private final CsvMapper csvMapper;
    private final CsvSchema schema;

    /**
     * Creates a reader for the default export layout.
     */
    public BomCsvReader() {
        this(BomColumns.defaults(), ',');
    }

    /**
     * Creates a reader.
     *
     * @param columns header names to read
     * @param separator column separator
     */
    public BomCsvReader(BomColumns columns, char separator) {
        this.columns = Objects.requireNonNull(columns, "columns must not be null");
        this.csvMapper = new CsvMapper();
        this.csvMapper.enable(CsvParser.Feature.SKIP_EMPTY_LINES);
        this.csvMapper.disable(JsonParser.Feature.AUTO_CLOSE_SOURCE);
        this.schema = CsvSchema.emptySchema()
            .withHeader()
            .withColumnSeparator(separator);
    }

    /**
     * Reads a BOM export file (UTF-8).
     *
     * @param file export file
     * @return accepted and rejected rows
     * @throws IOException if the file cannot be read or is not a valid table
     */
    public BomReadResult read(Path file) throws IOException {
        log.debug("Reading BOM data from: {}", file);
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return read(reader);
        }
    }

    /**
     * Reads BOM rows from a character stream. The stream is not closed.
     *
     * @param reader source text
     * @return accepted and rejected rows
     * @throws IOException if the text cannot be read or is not a valid table
     */
    public BomReadResult read(Reader reader) throws IOException {
        List<BomRow> rows = new ArrayList<>();
        List<RejectedRow> rejected = new ArrayList<>();

        boolean headerChecked = false;
        long rowNumber = 0;
        try (MappingIterator<Map<String, String>> iterator = csvMapper
                .readerForMapOf(String.class)
                .with(schema)
                .readValues(reader)) {
            while (iterator.hasNextValue()) {
                if (!headerChecked) {
                    checkHeader(iterator);
                    headerChecked = true;
                }
                Map<String, String> values = iterator.nextValue();
                Optional<RejectedRow> rejection = rejectIfInvalid(rowNumber, values);
                if (rejection.isPresent()) {
                    rejected.add(rejection.get());
                } else {
                    rows.add(decode(rowNumber, values));
                }
                rowNumber++;
            }
            if (!headerChecked) {
                checkHeader(iterator);
            }
        } catch (RuntimeException e) {
            throw new BomFormatException("Malformed BOM data near row " + rowNumber + ": " + e.getMessage(), e);
        }

        rejected.forEach(r -> log.warn("{}", r));
        log.info("Read {} BOM rows ({} rejected)", rows.size(), rejected.size());
        return new BomReadResult(rows, rejected);
    }

    private void checkHeader(MappingIterator<Map<String, String>> iterator) throws BomFormatException {
        CsvSchema header = (CsvSchema) iterator.getParserSchema();
        if (header == null || header.size() == 0) {
            throw new BomFormatException("BOM data has no header row");
        }
        List<String> missing = columns.all().stream()
            .filter(name -> header.column(name) == null)
            .toList();
        if (!missing.isEmpty()) {
            throw new BomFormatException("BOM data is missing required columns: " + String.join(", ", missing));
        }
    }

    /**
     * Decodes a row that passed {@link #rejectIfInvalid(long, Map)}.
     */
    private BomRow decode(long rowNumber, Map<String, String> values) {
        String componentId = blankToNull(value(values, columns.componentId()));
        BigDecimal quantityPer = componentId == null
            ? null
            : NumericCleaner.clean(value(values, columns.quantityPer())).orElseThrow();
        BigDecimal unitCost = NumericCleaner.clean(value(values, columns.unitCost())).orElse(BigDecimal.ZERO);

        return new BomRow(
            rowNumber,
            value(values, columns.productId()),
            componentId,
            quantityPer,
            value(values, columns.replenishmentSystem()),
            unitCost
        );
    }

    private Optional<RejectedRow> rejectIfInvalid(long rowNumber, Map<String, String> values) {
        String componentId = blankToNull(value(values, columns.componentId()));
        if (componentId != null) {
            String rawQuantity = value(values, columns.quantityPer());
            try {
                Optional<BigDecimal> quantity = NumericCleaner.clean(rawQuantity);
                if (quantity.isEmpty()) {
                    return Optional.of(new RejectedRow(rowNumber,
                        "component " + componentId + " has no " + columns.quantityPer()));
                }
                if (quantity.get().signum() <= 0) {
                    return Optional.of(new RejectedRow(rowNumber,
                        columns.quantityPer() + " must be positive, was '" + rawQuantity + "'"));
                }
            } catch (NumberFormatException e) {
                return Optional.of(new RejectedRow(rowNumber,
                    "malformed " + columns.quantityPer() + " '" + rawQuantity + "'"));
            }
        }

        String rawCost = value(values, columns.unitCost());
        try {
            Optional<BigDecimal> cost = NumericCleaner.clean(rawCost);
            if (cost.isPresent() && cost.get().signum() < 0) {
                return Optional.of(new RejectedRow(rowNumber,
                    columns.unitCost() + " must not be negative, was '" + rawCost + "'"));
            }
        } catch (NumberFormatException e) {
            return Optional.of(new RejectedRow(rowNumber,
                "malformed " + columns.unitCost() + " '" + rawCost + "'"));
        }
        return Optional.empty();
    }

    private static String value(Map<String, String> values, String column) {
        String value = values.get(column);
        return value == null ? null : value.trim();
    }

    private static String blankToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}
