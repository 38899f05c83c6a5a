package com.dcruver.sheetanalytics.io;

import com.dcruver.sheetanalytics.domain.ColumnDescriptor;
import com.dcruver.sheetanalytics.domain.ColumnType;
import com.dcruver.sheetanalytics.domain.RawSnapshot;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriUtils;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Client for the Smartsheet REST API (2.0).
 *
 * Fetches a sheet's columns and first page of rows, or a workspace's sheet list,
 * and converts them into snapshots. Every failure (transport, HTTP status or
 * malformed body) is reported as a {@link SheetFetchException}.
 */
@Service
@Slf4j
public class SmartsheetApiClient implements SheetDataSource {

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final SmartsheetProperties properties;

    public SmartsheetApiClient(SmartsheetProperties properties) {
        this.properties = properties;
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofMillis(properties.getTimeoutMs()))
            .build();
        this.objectMapper = new ObjectMapper();

        log.info("SmartsheetApiClient initialized with base URL: {} (timeout: {}ms, row limit: {})",
            properties.getBaseUrl(), properties.getTimeoutMs(), properties.getRowLimit());
    }

    @Override
    public RawSnapshot fetchSnapshot(String sheetId) {
        String body = get(sheetId, "/sheets/" + pathSegment(sheetId) + "?pageSize=" + properties.getRowLimit() + "&page=1");
        return parseSnapshot(sheetId, body);
    }

    @Override
    public WorkspaceListing fetchWorkspace(String workspaceId) {
        String body = get(workspaceId, "/workspaces/" + pathSegment(workspaceId));
        return parseWorkspace(workspaceId, body);
    }

    /**
     * Convert a sheet response body into a snapshot keyed by column title.
     */
    RawSnapshot parseSnapshot(String sheetId, String body) {
        JsonNode sheet = readTree(sheetId, body);

        List<ColumnDescriptor> columns = new ArrayList<>();
        Map<String, String> titlesById = new HashMap<>();
        for (JsonNode column : sheet.path("columns")) {
            String title = column.path("title").asText();
            titlesById.put(column.path("id").asText(), title);
            columns.add(ColumnDescriptor.builder()
                .title(title)
                .declaredType(ColumnType.fromName(column.path("type").asText(null)))
                .primary(column.path("primary").asBoolean(false))
                .formula(column.path("formula").asText(null))
                .build());
        }

        List<Map<String, Object>> rows = new ArrayList<>();
        for (JsonNode row : sheet.path("rows")) {
            Map<String, Object> values = new LinkedHashMap<>();
            for (JsonNode cell : row.path("cells")) {
                String title = titlesById.get(cell.path("columnId").asText());
                if (title != null) {
                    values.put(title, cellValue(cell));
                }
            }
            rows.add(values);
        }

        int rowCount = sheet.path("totalRowCount").asInt(rows.size());
        log.debug("Parsed sheet {}: {} columns, {} of {} rows", sheetId, columns.size(), rows.size(), rowCount);

        return RawSnapshot.builder()
            .sheetId(sheetId)
            .name(sheet.path("name").asText(null))
            .modifiedAt(parseInstant(sheet.path("modifiedAt").asText(null)))
            .columns(columns)
            .rows(rows)
            .rowCount(rowCount)
            .build();
    }

    WorkspaceListing parseWorkspace(String workspaceId, String body) {
        JsonNode workspace = readTree(workspaceId, body);

        List<WorkspaceListing.SheetRef> sheets = new ArrayList<>();
        for (JsonNode sheet : workspace.path("sheets")) {
            sheets.add(WorkspaceListing.SheetRef.builder()
                .sheetId(sheet.path("id").asText())
                .name(sheet.path("name").asText(null))
                .modifiedAt(parseInstant(sheet.path("modifiedAt").asText(null)))
                .build());
        }

        return WorkspaceListing.builder()
            .workspaceId(workspaceId)
            .name(workspace.path("name").asText(null))
            .sheets(sheets)
            .build();
    }

    private String get(String resourceId, String path) {
        if (properties.getAccessToken() == null || properties.getAccessToken().isBlank()) {
            throw new SheetFetchException(resourceId, "No Smartsheet access token configured");
        }

        HttpRequest request;
        try {
            request = HttpRequest.newBuilder()
                .uri(URI.create(properties.getBaseUrl() + path))
                .timeout(Duration.ofMillis(properties.getTimeoutMs()))
                .header("Authorization", "Bearer " + properties.getAccessToken())
                .header("Accept", "application/json")
                .GET()
                .build();
        } catch (IllegalArgumentException e) {
            throw new SheetFetchException(resourceId, "Invalid Smartsheet request URI: " + e.getMessage(), e);
        }

        log.debug("Sending Smartsheet request: GET {}", path);

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new SheetFetchException(resourceId, "Smartsheet request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SheetFetchException(resourceId, "Smartsheet request interrupted", e);
        }

        if (response.statusCode() != 200) {
            throw new SheetFetchException(resourceId,
                "Smartsheet request failed with status: " + response.statusCode());
        }

        return response.body();
    }

    static String pathSegment(String id) {
        return UriUtils.encodePathSegment(id == null ? "" : id, StandardCharsets.UTF_8);
    }

    private JsonNode readTree(String resourceId, String body) {
        try {
            JsonNode node = objectMapper.readTree(body);
            if (node == null || !node.isObject()) {
                throw new SheetFetchException(resourceId, "Invalid sheet data structure received");
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new SheetFetchException(resourceId, "Malformed response body: " + e.getOriginalMessage(), e);
        }
    }

    private static Object cellValue(JsonNode cell) {
        JsonNode value = cell.path("value");
        if (value.isMissingNode() || value.isNull()) {
            // Multi-contact and multi-picklist cells only carry a display value
            return cell.path("displayValue").asText(null);
        }
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        if (value.isIntegralNumber()) {
            return value.longValue();
        }
        if (value.isNumber()) {
            return value.doubleValue();
        }
        if (value.isTextual()) {
            return value.textValue();
        }
        return cell.path("displayValue").asText(value.toString());
    }

    private static Instant parseInstant(String text) {
        if (text == null) {
            return null;
        }
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException e) {
            log.warn("Failed to parse modifiedAt timestamp: {}", text);
            return null;
        }
    }

    /**
     * Configuration properties for the Smartsheet API.
     */
    @Configuration
    @ConfigurationProperties(prefix = "analytics.smartsheet")
    @Data
    public static class SmartsheetProperties {
        private String baseUrl = "https://api.smartsheet.com/2.0";
        private String accessToken;
        private int timeoutMs = 30000;

        // Rows fetched per sheet; the total row count still comes from the API
        private int rowLimit = 500;
    }
}
