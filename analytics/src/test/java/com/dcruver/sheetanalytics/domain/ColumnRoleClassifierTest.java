package com.dcruver.sheetanalytics.domain;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ColumnRoleClassifierTest {

    private ColumnRoleClassifier classifier;

    @BeforeEach
    void setUp() {
        classifier = new ColumnRoleClassifier();
    }

    @Test
    void testProjectPlanColumnsResolveEveryRole() {
        List<ColumnDescriptor> columns = List.of(
            ColumnDescriptor.builder().title("Name").declaredType(ColumnType.TEXT_NUMBER).primary(true).build(),
            ColumnDescriptor.of("Start Date", ColumnType.ABSTRACT_DATETIME),
            ColumnDescriptor.of("Finish Date", ColumnType.ABSTRACT_DATETIME),
            ColumnDescriptor.of("Duration", ColumnType.DURATION),
            ColumnDescriptor.of("Predecessors", ColumnType.PREDECESSOR),
            ColumnDescriptor.of("Assigned To", ColumnType.CONTACT_LIST),
            ColumnDescriptor.of("Status", ColumnType.PICKLIST),
            ColumnDescriptor.of("% Complete", ColumnType.TEXT_NUMBER)
        );

        ColumnRoleMap roles = classifier.classify(columns);

        assertEquals("Name", roles.titleOf(ColumnRole.TASK_NAME));
        assertEquals("Start Date", roles.titleOf(ColumnRole.START));
        assertEquals("Finish Date", roles.titleOf(ColumnRole.FINISH));
        assertEquals("Duration", roles.titleOf(ColumnRole.DURATION));
        assertEquals("Predecessors", roles.titleOf(ColumnRole.PREDECESSOR));
        assertEquals("Assigned To", roles.titleOf(ColumnRole.ASSIGNEE));
        assertEquals("Status", roles.titleOf(ColumnRole.STATUS));
        assertEquals("% Complete", roles.titleOf(ColumnRole.PROGRESS));
    }

    @Test
    void testPrimaryColumnWinsOverTaskTitle() {
        ColumnRoleMap roles = classifier.classify(List.of(
            ColumnDescriptor.of("Task Owner Notes", ColumnType.TEXT_NUMBER),
            ColumnDescriptor.builder().title("Item").declaredType(ColumnType.TEXT_NUMBER).primary(true).build()
        ));

        assertEquals("Item", roles.titleOf(ColumnRole.TASK_NAME));
    }

    @Test
    void testTaskTitleIsFallbackWithoutPrimary() {
        ColumnRoleMap roles = classifier.classify(List.of(
            ColumnDescriptor.of("Notes", ColumnType.TEXT_NUMBER),
            ColumnDescriptor.of("TASK", ColumnType.TEXT_NUMBER),
            ColumnDescriptor.of("Subtask", ColumnType.TEXT_NUMBER)
        ));

        assertEquals("TASK", roles.titleOf(ColumnRole.TASK_NAME));
    }

    @Test
    void testStartAndFinishRequireDateType() {
        ColumnRoleMap roles = classifier.classify(List.of(
            ColumnDescriptor.of("Start", ColumnType.TEXT_NUMBER),
            ColumnDescriptor.of("Finish", ColumnType.TEXT_NUMBER)
        ));

        assertFalse(roles.has(ColumnRole.START));
        assertFalse(roles.has(ColumnRole.FINISH));
    }

    @Test
    void testStatusTitleBeatsEarlierPicklist() {
        ColumnRoleMap roles = classifier.classify(List.of(
            ColumnDescriptor.of("Priority", ColumnType.PICKLIST),
            ColumnDescriptor.of("Task Status", ColumnType.TEXT_NUMBER)
        ));

        assertEquals("Task Status", roles.titleOf(ColumnRole.STATUS));
    }

    @Test
    void testFirstPicklistIsStatusFallback() {
        ColumnRoleMap roles = classifier.classify(List.of(
            ColumnDescriptor.of("Priority", ColumnType.PICKLIST),
            ColumnDescriptor.of("Phase", ColumnType.PICKLIST)
        ));

        assertEquals("Priority", roles.titleOf(ColumnRole.STATUS));
    }

    @Test
    void testMissingRolesAreAbsentNotErrors() {
        ColumnRoleMap roles = classifier.classify(List.of(
            ColumnDescriptor.of("Notes", ColumnType.TEXT_NUMBER)
        ));

        assertTrue(roles.asMap().isEmpty());
        assertTrue(roles.get(ColumnRole.TASK_NAME).isEmpty());
        assertNull(roles.titleOf(ColumnRole.ASSIGNEE));
    }

    @Test
    void testEmptyColumnList() {
        ColumnRoleMap roles = classifier.classify(List.of());

        for (ColumnRole role : ColumnRole.values()) {
            assertFalse(roles.has(role), role.name());
        }
    }
}
