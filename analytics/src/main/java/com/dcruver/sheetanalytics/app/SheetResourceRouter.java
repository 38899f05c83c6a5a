package com.dcruver.sheetanalytics.app;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.function.BiFunction;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves {@code smartsheet://} resource URIs to analytics operations.
 */
@Component
@RequiredArgsConstructor
public class SheetResourceRouter {

    private final SheetAnalyticsService analyticsService;

    /**
     * Supported URI templates. The placeholder is a sheet id, or a workspace id for overview.
     */
    public enum ResourceTemplate {
        SUMMARY("summary", "Sheet summary with column analysis and insights",
            (service, id) -> service.summary(id)),
        GANTT_DATA("gantt-data", "Gantt timeline with milestones, dependencies and resources",
            (service, id) -> service.timeline(id)),
        OVERVIEW("overview", "Workspace overview with per-sheet health",
            (service, id) -> service.workspaceOverview(id)),
        DEPENDENCIES("dependencies", "Task dependency map and bottlenecks",
            (service, id) -> service.dependencyMap(id)),
        HEALTH_REPORT("health-report", "Sheet health score and recommendations",
            (service, id) -> service.healthReport(id));

        private final String suffix;
        private final String description;
        private final BiFunction<SheetAnalyticsService, String, Object> operation;

        ResourceTemplate(String suffix, String description,
                         BiFunction<SheetAnalyticsService, String, Object> operation) {
            this.suffix = suffix;
            this.description = description;
            this.operation = operation;
        }

        public String uriTemplate() {
            String placeholder = this == OVERVIEW ? "{workspace_id}" : "{sheet_id}";
            return "smartsheet://" + placeholder + "/" + suffix;
        }

        public String getDescription() {
            return description;
        }
    }

    private static final Pattern RESOURCE_URI = Pattern.compile("^smartsheet://([^/]+)/([^/]+)$");

    public List<ResourceTemplate> templates() {
        return Arrays.asList(ResourceTemplate.values());
    }

    /**
     * Read the view named by a resource URI.
     *
     * @throws UnknownResourceException if the URI matches no template
     */
    public Object read(String uri) {
        Matcher matcher = RESOURCE_URI.matcher(uri == null ? "" : uri.trim());
        if (!matcher.matches()) {
            throw new UnknownResourceException(uri);
        }

        String id = matcher.group(1);
        String suffix = matcher.group(2);
        for (ResourceTemplate template : ResourceTemplate.values()) {
            if (template.suffix.equals(suffix)) {
                return template.operation.apply(analyticsService, id);
            }
        }
        throw new UnknownResourceException(uri);
    }
}
