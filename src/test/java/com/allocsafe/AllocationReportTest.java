package com.allocsafe;

import org.junit.jupiter.api.Test;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

import static org.junit.jupiter.api.Assertions.*;

class AllocationReportTest {

    @Test
    void listsSitesWithPositions() {
        String code = String.join("\n",
                "void f(void) {",
                "  char *p = malloc(10);",
                "  char *q = strdup(\"x\");",
                "  if (!q) return;",
                "}");
        AllocationReport report = AllocationReport.build("f.c", code, FixerConfig.defaults());
        assertEquals(2, report.total());
        assertEquals(1, report.unchecked());

        JsonObject json = JsonParser.parseString(report.toJson()).getAsJsonObject();
        assertEquals("f.c", json.get("file").getAsString());
        JsonArray sites = json.getAsJsonArray("sites");
        assertEquals(2, sites.size());

        JsonObject first = sites.get(0).getAsJsonObject();
        assertEquals("malloc", first.get("allocator").getAsString());
        assertEquals(2, first.get("line").getAsInt());
        assertEquals(13, first.get("column").getAsInt());
        assertEquals("p", first.get("variable").getAsString());
        assertEquals("PTR_NULL", first.get("checkStyle").getAsString());
        assertFalse(first.get("checked").getAsBoolean());

        JsonObject second = sites.get(1).getAsJsonObject();
        assertEquals("strdup", second.get("allocator").getAsString());
        assertTrue(second.get("checked").getAsBoolean());
    }

    @Test
    void emptySourceGivesAnEmptyReport() {
        AllocationReport report = AllocationReport.build("empty.c", "", FixerConfig.defaults());
        assertEquals(0, report.total());
        assertTrue(report.toJson().contains("\"total\": 0"), report.toJson());
    }
}
