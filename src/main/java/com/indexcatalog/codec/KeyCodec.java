package com.indexcatalog.codec;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Derives partition keys and content keys from field values. Pure and deterministic.
 * <p>
 * Partition key: {@code {n}_{field}{value}}, both lower-cased, where {@code n} is the
 * length of the lower-cased field name. The decimal length ends at the first
 * {@code _}, and the field is exactly the next {@code n} characters, so two distinct
 * (field, value) pairs never share a key even when {@code field + value} concatenates
 * to the same string.
 * <p>
 * Content key: {@code {primaryValue}:{fingerprint}}, where the fingerprint is the first
 * {@value #FINGERPRINT_LENGTH} hex characters of MD5 over the lower-cased index-key values
 * in field-name order. The fingerprint only disambiguates; it is not a security boundary.
 */
public final class KeyCodec {
    public static final int FINGERPRINT_LENGTH = 8;

    static final char CONTENT_KEY_SEPARATOR = ':';
    private static final char VALUE_SEPARATOR = '\u001F';
    private static final String FINGERPRINT_CEILING = ":z";
    private static final HexFormat HEX = HexFormat.of();

    private KeyCodec() {
    }

    public static String partitionKey(String field, String value) {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(value, "value");
        String normalizedField = normalize(field);
        return normalizedField.length() + "_" + normalizedField + normalize(value);
    }

    /**
     * @throws IllegalArgumentException if the record lacks the primary field or any index key
     */
    public static String contentKey(Map<String, String> record, String primaryField, List<String> indexKeys) {
        String primaryValue = require(record, primaryField);

        List<String> sortedKeys = new ArrayList<>(indexKeys);
        sortedKeys.sort(null);

        StringBuilder joined = new StringBuilder();
        for (int i = 0; i < sortedKeys.size(); i++) {
            if (i > 0) {
                joined.append(VALUE_SEPARATOR);
            }
            joined.append(normalize(require(record, sortedKeys.get(i))));
        }

        return primaryValue + CONTENT_KEY_SEPARATOR + fingerprint(joined.toString());
    }

    /**
     * Inclusive lower row bound selecting content keys whose primary value is at least {@code rowFrom}.
     */
    public static String contentKeyLowerBound(String rowFrom) {
        return rowFrom + CONTENT_KEY_SEPARATOR;
    }

    /**
     * Inclusive upper row bound selecting content keys whose primary value is at most {@code rowTo}.
     * Fingerprints are lower-case hex, so every one of them sorts below {@code z}.
     */
    public static String contentKeyUpperBound(String rowTo) {
        return rowTo + FINGERPRINT_CEILING;
    }

    static String fingerprint(String joinedValues) {
        try {
            MessageDigest md5 = MessageDigest.getInstance("MD5");
            byte[] digest = md5.digest(joinedValues.getBytes(StandardCharsets.UTF_8));
            return HEX.formatHex(digest).substring(0, FINGERPRINT_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships MD5
            throw new IllegalStateException("MD5 not available", e);
        }
    }

    private static String normalize(String s) {
        return s.toLowerCase(Locale.ROOT);
    }

    private static String require(Map<String, String> record, String field) {
        String value = record.get(field);
        if (value == null) {
            throw new IllegalArgumentException("Record has no value for key field '" + field + "'");
        }
        return value;
    }
}
