package dev.pekelund.receiptlens.analytics.export;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import dev.pekelund.receiptlens.records.ReceiptRecord;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serialises records as a JSON array or as CSV with a header row. Dates are written in ISO-8601 form.
 */
public class ReceiptRecordExporter {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReceiptRecordExporter.class);

    private final ObjectMapper jsonMapper;
    private final CsvMapper csvMapper;
    private final CsvSchema csvSchema;

    public ReceiptRecordExporter(ObjectMapper objectMapper) {
        this.jsonMapper = Objects.requireNonNull(objectMapper, "objectMapper").copy()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);
        this.csvMapper = new CsvMapper();
        this.csvMapper.findAndRegisterModules();
        this.csvMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.csvSchema = csvMapper.schemaFor(ExportRow.class).withHeader();
    }

    public String export(List<ReceiptRecord> records, ExportFormat format) {
        Objects.requireNonNull(format, "format");
        List<ExportRow> rows = records.stream().map(ExportRow::from).toList();
        try {
            String output = switch (format) {
                case JSON -> jsonMapper.writeValueAsString(rows);
                case CSV -> rows.isEmpty() ? headerLine() : csvMapper.writer(csvSchema).writeValueAsString(rows);
            };
            LOGGER.info("Exported {} receipt records as {}", rows.size(), format);
            return output;
        } catch (JsonProcessingException ex) {
            throw new ReceiptExportException("Failed to export receipt records as " + format, ex);
        }
    }

    private String headerLine() {
        List<String> names = new ArrayList<>();
        for (CsvSchema.Column column : csvSchema) {
            names.add(column.getName());
        }
        return String.join(String.valueOf(csvSchema.getColumnSeparator()), names) + "\n";
    }
}
