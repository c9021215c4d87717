package com.dingdangmaoup.contentpool.storage;

import com.dingdangmaoup.contentpool.model.ContentManifest;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * JSON codec for persisted manifest records.
 * Unknown fields are ignored on read so that newer records stay readable.
 */
@Component
public class ManifestSerializer {

    private final ObjectMapper objectMapper;

    public ManifestSerializer() {
        this.objectMapper = JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT)
                .serializationInclusion(JsonInclude.Include.NON_NULL)
                .build();
    }

    public byte[] toJson(ContentManifest manifest) {
        try {
            return objectMapper.writeValueAsBytes(manifest);
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to serialize manifest", manifest.getId(), e);
        }
    }

    /**
     * @throws IOException if the content is not a valid manifest document
     */
    public ContentManifest fromJson(byte[] content) throws IOException {
        ContentManifest manifest = objectMapper.readValue(content, ContentManifest.class);
        if (manifest == null) {
            throw new IOException("Manifest document is empty");
        }
        return manifest;
    }
}
