package com.dcruver.sheetanalytics.app;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

import java.util.function.Supplier;

/**
 * Spring Shell commands printing the analytics views as JSON.
 */
@ShellComponent
@Slf4j
@RequiredArgsConstructor
public class AnalyticsShellCommands {

    private final SheetAnalyticsService analyticsService;
    private final SheetResourceRouter resourceRouter;
    private final ObjectMapper objectMapper;

    @ShellMethod(key = "summary", value = "Summarize a sheet's structure and data")
    public String summary(@ShellOption(help = "Sheet ID") String sheetId) {
        return render("Summary", () -> analyticsService.summary(sheetId));
    }

    @ShellMethod(key = {"timeline", "gantt"}, value = "Show the Gantt timeline of a project sheet")
    public String timeline(@ShellOption(help = "Sheet ID") String sheetId) {
        return render("Timeline", () -> analyticsService.timeline(sheetId));
    }

    @ShellMethod(key = {"dependencies", "deps"}, value = "Map task dependencies and bottlenecks")
    public String dependencies(@ShellOption(help = "Sheet ID") String sheetId) {
        return render("Dependency map", () -> analyticsService.dependencyMap(sheetId));
    }

    @ShellMethod(key = {"health", "health-report"}, value = "Score a sheet's health")
    public String health(@ShellOption(help = "Sheet ID") String sheetId) {
        return render("Health report", () -> analyticsService.healthReport(sheetId));
    }

    @ShellMethod(key = "workspace", value = "Roll up sheet health across a workspace")
    public String workspace(@ShellOption(help = "Workspace ID") String workspaceId) {
        return render("Workspace overview", () -> analyticsService.workspaceOverview(workspaceId));
    }

    @ShellMethod(key = "read", value = "Read a smartsheet:// resource URI")
    public String read(@ShellOption(help = "Resource URI, e.g. smartsheet://123/summary") String uri) {
        return render("Resource read", () -> resourceRouter.read(uri));
    }

    @ShellMethod(key = "resources", value = "List resource URI templates")
    public String resources() {
        StringBuilder sb = new StringBuilder("Resource templates:\n");
        for (SheetResourceRouter.ResourceTemplate template : resourceRouter.templates()) {
            sb.append(String.format("- %-40s %s\n", template.uriTemplate(), template.getDescription()));
        }
        return sb.toString();
    }

    private String render(String operation, Supplier<Object> view) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(view.get());
        } catch (JsonProcessingException e) {
            log.error("{} could not be serialized", operation, e);
            return operation + " failed: " + e.getOriginalMessage();
        } catch (Exception e) {
            log.error("{} failed", operation, e);
            return operation + " failed: " + e.getMessage();
        }
    }
}
