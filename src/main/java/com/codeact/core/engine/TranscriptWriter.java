package com.codeact.core.engine;

import com.codeact.core.model.Transcript;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Serializes transcripts as pretty-printed JSON with ISO-8601 timestamps.
 */
@Component
public class TranscriptWriter {

    private static final Logger log = LoggerFactory.getLogger(TranscriptWriter.class);

    private final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);

    public String toJson(Transcript transcript) {
        try {
            return mapper.writeValueAsString(transcript);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize transcript " + transcript.taskId(), e);
        }
    }

    public void write(Transcript transcript, Path target) {
        try {
            if (target.getParent() != null) {
                Files.createDirectories(target.getParent());
            }
            Files.writeString(target, toJson(transcript), StandardCharsets.UTF_8);
            log.info("Transcript for {} written to {}", transcript.taskId(), target);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not write transcript to " + target, e);
        }
    }
}
