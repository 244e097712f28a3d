package com.bulkvalidate.app;

import com.bulkvalidate.engine.BatchResult;
import com.bulkvalidate.engine.BatchValidator;
import com.bulkvalidate.engine.CancellationToken;
import com.bulkvalidate.engine.CustomerRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

public class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);
    private static final ObjectMapper M = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public static void main(String[] args) throws Exception {
        String configPath = args.length > 0 ? args[0] : "config.json";

        AppConfig cfg = M.readValue(Path.of(configPath).toFile(), AppConfig.class);
        log.info("Config: {} | input: {} | requested workers: {}", configPath, cfg.inputPath, cfg.workers);

        if (!Files.exists(Path.of(cfg.inputPath))) {
            log.error("Input file not found: {}", cfg.inputPath);
            System.exit(1);
        }

        BatchResponse response;
        try {
            response = run(cfg);
        } catch (IOException e) {
            log.error("Could not read input {}: {}", cfg.inputPath, e.getMessage());
            System.exit(1);
            return;
        }

        if (cfg.outputPath == null || cfg.outputPath.isBlank()) {
            System.out.println(M.writeValueAsString(response));
        } else {
            M.writeValue(Path.of(cfg.outputPath).toFile(), response);
            log.info("Wrote {} results to {}", response.results.size(), cfg.outputPath);
        }
    }

    static BatchResponse run(AppConfig cfg) throws IOException {
        List<CustomerRecord> records = readRecords(Path.of(cfg.inputPath));

        BatchValidator validator = new BatchValidator(cfg.pool);
        CancellationToken token = cfg.timeoutMs > 0
                ? CancellationToken.withTimeout(Duration.ofMillis(cfg.timeoutMs))
                : CancellationToken.none();
        BatchResult result = validator.validate(records, cfg.workers, token);
        return BatchResponse.from(result);
    }

    // one JSON object per line, blank lines skipped
    static List<CustomerRecord> readRecords(Path input) throws IOException {
        List<CustomerRecord> records = new ArrayList<>();
        try (BufferedReader br = Files.newBufferedReader(input, StandardCharsets.UTF_8)) {
            String line;
            int lineNo = 0;
            while ((line = br.readLine()) != null) {
                lineNo++;
                line = line.trim();
                if (line.isEmpty()) continue;
                try {
                    records.add(M.readValue(line, CustomerRecord.class));
                } catch (JsonProcessingException e) {
                    throw new IOException("line " + lineNo + ": " + e.getOriginalMessage(), e);
                }
            }
        }
        return records;
    }
}
