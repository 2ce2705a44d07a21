package com.toolfinder.search.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

public final class CacheKeyUtil {
    private CacheKeyUtil() {
    }

    /**
     * Copy of {@code mapper} that writes map keys in sorted order, so equal inputs hash equally.
     */
    public static ObjectMapper canonicalMapper(ObjectMapper mapper) {
        ObjectMapper base = mapper == null ? new ObjectMapper() : mapper.copy();
        return base.configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
    }

    public static String hashJson(ObjectMapper canonicalMapper, Object value) {
        try {
            return sha256(canonicalMapper.writeValueAsString(value));
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    public static String normalizeText(String text) {
        if (text == null) {
            return null;
        }
        return text.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    public static String sha256(String value) {
        if (value == null) {
            return null;
        }
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
