package com.example.statements.interfaces.api;

import com.example.statements.application.service.CsvExportService;
import com.example.statements.application.service.StatementExtractionService;
import com.example.statements.domain.model.ExtractionReport;
import com.example.statements.domain.model.StatementDiagnostics;
import com.example.statements.domain.model.StatementTable;
import com.example.statements.infrastructure.export.XlsxStatementWriter;
import com.example.statements.interfaces.api.dto.ExtractionResponse;
import com.example.statements.interfaces.api.dto.ValidationResponse;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Interfaces-layer REST controller that handles bank statement uploads and exports.
 */
@RestController
@RequestMapping("/api")
public class StatementController {

    private static final String DEFAULT_BASE_NAME = "releve";

    private final StatementExtractionService extractionService;
    private final CsvExportService csvExportService;
    private final XlsxStatementWriter xlsxWriter;

    /**
     * Creates the controller with the required application services.
     *
     * @param extractionService service running the extraction pipeline
     * @param csvExportService  service responsible for CSV generation
     * @param xlsxWriter        workbook renderer
     */
    public StatementController(StatementExtractionService extractionService,
                               CsvExportService csvExportService,
                               XlsxStatementWriter xlsxWriter) {
        this.extractionService = extractionService;
        this.csvExportService = csvExportService;
        this.xlsxWriter = xlsxWriter;
    }

    /**
     * Checks that an upload is a native statement from a supported bank.
     *
     * @param file uploaded PDF
     * @return verdict with the estimated number of transactions
     */
    @PostMapping(value = "/validate", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ValidationResponse> validate(@RequestParam("file") MultipartFile file) {
        return ResponseEntity.ok(ValidationResponse.from(extractionService.validate(file)));
    }

    /**
     * Runs the pipeline and returns the transactions as JSON.
     *
     * @param file uploaded PDF
     * @return 200 with transactions, or 422 with the failure
     */
    @PostMapping(value = "/extract", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ExtractionResponse> extract(@RequestParam("file") MultipartFile file) {
        ExtractionReport report = extractionService.extract(file);
        HttpStatus status = report.successful() ? HttpStatus.OK : HttpStatus.UNPROCESSABLE_ENTITY;
        return ResponseEntity.status(status).body(ExtractionResponse.from(report));
    }

    /**
     * Streams the normalized transactions as an Excel download.
     *
     * @param file uploaded PDF
     * @return {@code .xlsx} document
     */
    @PostMapping("/extract/xlsx")
    public ResponseEntity<byte[]> extractXlsx(@RequestParam("file") MultipartFile file) {
        StatementTable table = extractionService.extractTable(file);
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, attachment(file, ".xlsx"))
                .contentType(MediaType.parseMediaType(XlsxStatementWriter.CONTENT_TYPE))
                .body(xlsxWriter.write(table));
    }

    /**
     * Streams the normalized transactions as a CSV download.
     *
     * @param file uploaded PDF
     * @return CSV document
     */
    @PostMapping("/extract/csv")
    public ResponseEntity<byte[]> extractCsv(@RequestParam("file") MultipartFile file) {
        String csv = csvExportService.export(extractionService.extractTable(file));
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, attachment(file, ".csv"))
                .contentType(new MediaType(MediaType.parseMediaType(CsvExportService.CONTENT_TYPE), StandardCharsets.UTF_8))
                .body(csv.getBytes(StandardCharsets.UTF_8));
    }

    @GetMapping(value = "/supported-banks", produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, String> supportedBanks() {
        return extractionService.supportedBanks();
    }

    /**
     * Troubleshooting view of an upload's text layer.
     *
     * @param file uploaded PDF
     * @return diagnostics
     */
    @PostMapping(value = "/debug", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<StatementDiagnostics> debug(@RequestParam("file") MultipartFile file) {
        return ResponseEntity.ok(extractionService.diagnose(file));
    }

    private String attachment(MultipartFile file, String extension) {
        String name = file.getOriginalFilename();
        String baseName = DEFAULT_BASE_NAME;
        if (name != null && !name.isBlank()) {
            String stripped = name.replaceAll("(?i)\\.pdf$", "").replaceAll("[\\\\/\"]", "_");
            if (!stripped.isBlank()) {
                baseName = stripped;
            }
        }
        return "attachment; filename=\"" + baseName + extension + "\"";
    }
}
