package pvcmigrator.poll;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ResourceStatusTest {

    @Test
    void decodesNamedConditionAndFields() {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("conditions", List.of(
                Map.of("type", "Running", "status", "False", "reason", "Done"),
                Map.of("type", "Successful", "status", "True", "reason", "Successful")));
        raw.put("backupDirectory", "/backups/tower-openshift-backup-1");
        raw.put("backupClaim", "controller-backup-claim");

        ResourceStatus s = ResourceStatus.decode(raw, "Successful");

        assertEquals("True", s.conditionStatus());
        assertEquals("Successful", s.conditionReason());
        assertEquals("/backups/tower-openshift-backup-1", s.field("backupDirectory").orElseThrow());
        assertFalse(s.fields().containsKey("conditions"));
    }

    @Test
    void missingConditionLeavesNulls() {
        ResourceStatus s = ResourceStatus.decode(Map.of("restoreComplete", "true"), "Successful");

        assertNull(s.conditionStatus());
        assertNull(s.conditionReason());
        assertTrue(s.isTrue("restoreComplete"));
    }

    @Test
    void nullStatusIsEmpty() {
        assertSame(ResourceStatus.EMPTY, ResourceStatus.decode(null, "Successful"));
    }

    @Test
    void blankFieldIsAbsent() {
        ResourceStatus s = new ResourceStatus("True", "Successful", Map.of("backupClaim", "  "));

        assertTrue(s.field("backupClaim").isEmpty());
        assertTrue(s.field("nope").isEmpty());
    }

    @Test
    void isTrueAcceptsBooleanAndString() {
        assertTrue(new ResourceStatus(null, null, Map.of("x", Boolean.TRUE)).isTrue("x"));
        assertTrue(new ResourceStatus(null, null, Map.of("x", "TRUE")).isTrue("x"));
        assertFalse(new ResourceStatus(null, null, Map.of("x", "yes")).isTrue("x"));
        assertFalse(ResourceStatus.EMPTY.isTrue("x"));
    }

    @Test
    void describeSkipsNestedValues() {
        ResourceStatus s = new ResourceStatus(null, "Running", Map.of("nested", Map.of("a", 1)));

        assertEquals("status=<none> reason=Running", s.describe());
    }
}
