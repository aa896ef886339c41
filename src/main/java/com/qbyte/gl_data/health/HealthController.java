package com.qbyte.gl_data.health;

import com.qbyte.gl_data.stream.RecordBuffer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health and introspection endpoint for probes and the ingestion pipeline.
 * Unlike the Actuator health endpoint, this reports buffer counts.
 *
 * total_streamed counts every record buffered so far (historical and live);
 * total_records is historical_records + total_streamed, as the ingestion
 * pipeline has always read it.
 */
@RestController
public class HealthController {

    private final RecordBuffer buffer;
    private final String serviceName;
    private final String serviceVersion;

    public HealthController(RecordBuffer buffer,
                            @Value("${gl.service.name:QByte GL Data Service}") String serviceName,
                            @Value("${gl.service.version:1.0.0}") String serviceVersion) {
        this.buffer = buffer;
        this.serviceName = serviceName;
        this.serviceVersion = serviceVersion;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        int historical = buffer.historicalCount();
        int totalStreamed = buffer.size();

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", buffer.isSealed() ? "healthy" : "starting");
        response.put("service", serviceName);
        response.put("version", serviceVersion);
        response.put("historical_records", historical);
        response.put("total_streamed", totalStreamed);
        response.put("total_records", historical + totalStreamed);
        response.put("timestamp", Instant.now().toString());

        if (!buffer.isSealed()) {
            return ResponseEntity.status(503).body(response);
        }

        return ResponseEntity.ok(response);
    }
}
