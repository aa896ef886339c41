package com.qbyte.gl_data.api;

import com.qbyte.gl_data.account.AccountCatalog;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Service description, endpoint map and account-series legend.
 */
@RestController
public class ServiceInfoController {

    private final AccountCatalog accountCatalog;
    private final String serviceName;
    private final String serviceVersion;

    public ServiceInfoController(AccountCatalog accountCatalog,
                                 @Value("${gl.service.name:QByte GL Data Service}") String serviceName,
                                 @Value("${gl.service.version:1.0.0}") String serviceVersion) {
        this.accountCatalog = accountCatalog;
        this.serviceName = serviceName;
        this.serviceVersion = serviceVersion;
    }

    @GetMapping("/")
    public ResponseEntity<Map<String, Object>> info() {
        Map<String, String> endpoints = new LinkedHashMap<>();
        endpoints.put("/health", "Health check endpoint");
        endpoints.put("/get-gl", "Stream GL records (instant buffered records + real-time streaming)");
        endpoints.put("/get-gl?start_date=YYYY-MM-DD&end_date=YYYY-MM-DD", "Historical GL records in an inclusive date range");
        endpoints.put("/get-gl-batch", "Finite batch of GL records for ingestion (limit, after_id or date window)");
        endpoints.put("/actuator/prometheus", "Prometheus metrics");

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("service", serviceName);
        response.put("version", serviceVersion);
        response.put("description", "Streams QByte-style General Ledger data for oil & gas operations");
        response.put("endpoints", endpoints);
        response.put("account_types", accountCatalog.getAccountTypesInfo());

        return ResponseEntity.ok(response);
    }
}
