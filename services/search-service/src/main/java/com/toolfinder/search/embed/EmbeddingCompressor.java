package com.toolfinder.search.embed;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * GZIP over the JSON form of a vector.
 */
public class EmbeddingCompressor {
    private static final TypeReference<List<Double>> VECTOR_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public EmbeddingCompressor(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper == null ? new ObjectMapper() : objectMapper;
    }

    public byte[] compress(List<Double> embedding) {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (GZIPOutputStream gzip = new GZIPOutputStream(buffer)) {
            gzip.write(objectMapper.writeValueAsBytes(embedding));
        } catch (IOException e) {
            throw new CacheException("embedding compression failed", e);
        }
        return buffer.toByteArray();
    }

    public List<Double> decompress(byte[] compressed) {
        if (compressed == null || compressed.length == 0) {
            throw new CacheException("embedding decompression failed", new IOException("empty payload"));
        }
        try (InputStream gzip = new GZIPInputStream(new ByteArrayInputStream(compressed))) {
            return objectMapper.readValue(gzip, VECTOR_TYPE);
        } catch (IOException e) {
            throw new CacheException("embedding decompression failed", e);
        }
    }
}
