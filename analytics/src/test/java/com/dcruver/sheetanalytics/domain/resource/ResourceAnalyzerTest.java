package com.dcruver.sheetanalytics.domain.resource;

import com.dcruver.sheetanalytics.domain.DerivedTask;
import com.dcruver.sheetanalytics.domain.Level;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ResourceAnalyzerTest {

    private ResourceAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new ResourceAnalyzer();
    }

    @Test
    void testUtilizationLevels() {
        List<DerivedTask> tasks = new ArrayList<>();
        addTasks(tasks, "alice@example.com", 6);
        addTasks(tasks, "bob@example.com", 3);
        addTasks(tasks, "carol@example.com", 2);
        addTasks(tasks, null, 4);

        ResourceAllocation allocation = analyzer.analyze(tasks);

        assertEquals(3, allocation.getTotalResources());
        List<ResourceUtilization> utilization = allocation.getResourceUtilization();
        assertEquals("alice@example.com", utilization.get(0).getResource());
        assertEquals(6, utilization.get(0).getAssignedTasks());
        assertEquals(Level.HIGH, utilization.get(0).getUtilizationLevel());
        assertEquals(Level.MEDIUM, utilization.get(1).getUtilizationLevel());
        assertEquals(Level.LOW, utilization.get(2).getUtilizationLevel());

        assertEquals(1, allocation.getOverallocatedResources().size());
        assertEquals("alice@example.com", allocation.getOverallocatedResources().get(0).getResource());
    }

    @Test
    void testFiveTasksIsNotOverallocated() {
        List<DerivedTask> tasks = new ArrayList<>();
        addTasks(tasks, "dave@example.com", 5);

        ResourceAllocation allocation = analyzer.analyze(tasks);

        assertEquals(Level.MEDIUM, allocation.getResourceUtilization().get(0).getUtilizationLevel());
        assertTrue(allocation.getOverallocatedResources().isEmpty());
    }

    @Test
    void testNoAssigneesGivesEmptyReport() {
        List<DerivedTask> tasks = new ArrayList<>();
        addTasks(tasks, null, 3);

        ResourceAllocation allocation = analyzer.analyze(tasks);

        assertEquals(0, allocation.getTotalResources());
        assertTrue(allocation.getResourceUtilization().isEmpty());
        assertTrue(allocation.getOverallocatedResources().isEmpty());
    }

    private static void addTasks(List<DerivedTask> tasks, String assignee, int count) {
        for (int i = 0; i < count; i++) {
            tasks.add(DerivedTask.builder()
                .id(tasks.size() + 1)
                .name("Task " + (tasks.size() + 1))
                .assignee(assignee)
                .build());
        }
    }
}
