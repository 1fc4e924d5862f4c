package com.cgi.dataprofiler.engine.service;

import com.cgi.dataprofiler.engine.exception.ExportException;
import com.cgi.dataprofiler.engine.model.ProfileResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Serializes profile results to JSON.
 */
@Slf4j
@Component
public class ProfileResultExporter {

    private final ObjectMapper objectMapper;

    @Autowired
    public ProfileResultExporter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ProfileResultExporter() {
        this(new ObjectMapper()
                .findAndRegisterModules()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS));
    }

    /**
     * Converts a result to pretty-printed JSON.
     *
     * @param result Profile result
     * @return JSON document
     */
    public String toJson(ProfileResult result) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(result.toMap());
        } catch (JsonProcessingException e) {
            throw new ExportException("Failed to serialize profile of " + result.getSourceName(), e);
        }
    }

    /**
     * Writes a result as JSON to a file.
     *
     * @param result Profile result
     * @param target Target file
     */
    public void writeJson(ProfileResult result, Path target) {
        try {
            Files.writeString(target, toJson(result));
            log.info("Profile of {} written to {}", result.getSourceName(), target);
        } catch (IOException e) {
            throw new ExportException("Failed to write profile to " + target, e);
        }
    }
}
