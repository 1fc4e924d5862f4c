package com.cgi.dataprofiler.engine.service;

import com.cgi.dataprofiler.engine.core.chunk.ColumnType;
import com.cgi.dataprofiler.engine.core.chunk.HeapChunk;
import com.cgi.dataprofiler.engine.core.chunk.HeapColumn;
import com.cgi.dataprofiler.engine.model.ProfileResult;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;

import static org.junit.Assert.*;

public class ProfileResultExporterTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private final ProfileResultExporter exporter = new ProfileResultExporter();

    @Test
    public void testJsonMirrorsResultMap() throws Exception {
        ProfileResult result = ProfilerFixtures.profiler().profileChunk("orders", HeapChunk.of(
                HeapColumn.ofLongs("id", 1L, 2L, null),
                HeapColumn.ofStrings("email", "a@b.com", "c@d.com", "e@f.com"),
                new HeapColumn("day", ColumnType.DATE,
                        List.of(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 2), LocalDate.of(2024, 1, 1)))));

        JsonNode json = new ObjectMapper().readTree(exporter.toJson(result));

        assertEquals("orders", json.get("source_name").asText());
        assertEquals("heap", json.get("backend").asText());
        assertEquals(3, json.get("row_count").asLong());
        JsonNode id = json.get("columns").get(0);
        assertEquals("id", id.get("name").asText());
        assertEquals(2, id.get("count").asLong());
        assertEquals(1, id.get("null_count").asLong());
        assertTrue(id.has("numeric_stats"));
        assertEquals("email", json.get("columns").get(1).get("semantic_type").asText());
        assertEquals("2024-01-01", json.get("columns").get(2).get("top_values").get(0).get("value").asText());
    }

    @Test
    public void testWritesFile() throws Exception {
        ProfileResult result = ProfilerFixtures.profiler().profileChunk("t",
                HeapChunk.of(HeapColumn.ofLongs("a", 1L)));
        Path target = folder.getRoot().toPath().resolve("profile.json");

        exporter.writeJson(result, target);

        assertTrue(Files.readString(target).contains("\"source_name\" : \"t\""));
    }
}
