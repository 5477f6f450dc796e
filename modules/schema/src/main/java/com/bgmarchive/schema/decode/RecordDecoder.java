package com.bgmarchive.schema.decode;

import com.bgmarchive.schema.api.FieldKind;
import com.bgmarchive.schema.api.FieldSpec;
import com.bgmarchive.schema.api.FieldValues;
import com.bgmarchive.schema.api.Schema;
import com.bgmarchive.util.io.Utf8;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.nio.charset.CharacterCodingException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Decodes one line of a member file against a {@link Schema}.
 *
 * <p>Checks run in a fixed order over the whole record: UTF-8 decoding, JSON syntax,
 * presence and kind of every declared field, enumeration membership, and finally
 * undeclared fields when the schema is strict. The first failure found is returned.
 * Nested objects are decoded recursively with their own schema; failure paths are
 * reported relative to the root ({@code favorite.wish}, {@code tags[1].count}).
 *
 * <p>Deterministic and free of I/O. Instances are immutable and may be shared.
 */
public class RecordDecoder {

    private static final int MAX_RAW_LENGTH = 512;
    private static final Pattern DIGITS = Pattern.compile("\\d{1,10}");

    private final ObjectMapper mapper;

    public RecordDecoder() {
        this(defaultMapper());
    }

    public RecordDecoder(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper cannot be null");
    }

    /**
     * Mapper used when none is supplied: rejects trailing content after the JSON value
     * and duplicate member names.
     */
    public static ObjectMapper defaultMapper() {
        return JsonMapper.builder()
                .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                .enable(StreamReadFeature.STRICT_DUPLICATE_DETECTION)
                .build();
    }

    /**
     * Decodes raw line bytes.
     */
    public <T> DecodeResult<T> decode(byte[] line, Schema<T> schema) {
        String text;
        try {
            text = Utf8.decode(line);
        } catch (CharacterCodingException e) {
            return DecodeResult.failed(DecodeFailure.of(FailureKind.ENCODING, null,
                    abbreviate(Utf8.lenient(line)), "Malformed UTF-8 input: " + e.getMessage()));
        }
        return decode(text, schema);
    }

    /**
     * Decodes a line that is already text.
     */
    public <T> DecodeResult<T> decode(String line, Schema<T> schema) {
        JsonNode root;
        try {
            root = mapper.readTree(line);
        } catch (JsonProcessingException e) {
            return DecodeResult.failed(DecodeFailure.of(FailureKind.SYNTAX, null,
                    abbreviate(line), e.getOriginalMessage()));
        }
        if (root == null || root.isMissingNode()) {
            return DecodeResult.failed(DecodeFailure.of(FailureKind.SYNTAX, null,
                    abbreviate(line), "No JSON value on line"));
        }
        if (!root.isObject()) {
            return DecodeResult.failed(DecodeFailure.of(FailureKind.SCHEMA_VIOLATION, "$",
                    abbreviate(root.toString()), "Expected a JSON object for " + schema.entityName()));
        }
        return decodeObject((ObjectNode) root, schema, "");
    }

    private <T> DecodeResult<T> decodeObject(ObjectNode node, Schema<T> schema, String path) {
        Map<String, Object> values = new LinkedHashMap<>();

        // presence and kind
        for (FieldSpec spec : schema.fields()) {
            JsonNode value = node.get(spec.name());
            String fieldPath = path + spec.name();

            if (value == null || value.isNull()) {
                if (spec.required()) {
                    return value == null
                            ? violation(fieldPath, null, "Missing required field")
                            : violation(fieldPath, "null", "Required field is null");
                }
                values.put(spec.name(), spec.kind().isList() ? List.of() : null);
                continue;
            }

            Object converted = convert(spec, value, fieldPath);
            if (converted instanceof DecodeFailure failure) {
                return DecodeResult.failed(failure);
            }
            values.put(spec.name(), converted);
        }

        // enumeration membership
        for (FieldSpec spec : schema.fields()) {
            if (spec.kind() != FieldKind.ENUM) continue;
            Object code = values.get(spec.name());
            if (code == null) continue;

            Optional<?> member = spec.domain().lookup((Integer) code);
            if (member.isEmpty()) {
                return DecodeResult.failed(DecodeFailure.of(FailureKind.UNKNOWN_ENUM_VALUE,
                        path + spec.name(), String.valueOf(code),
                        "Code " + code + " is not a member of " + spec.domain().name()));
            }
            values.put(spec.name(), member.get());
        }

        // undeclared fields
        if (schema.isStrict()) {
            Iterator<Map.Entry<String, JsonNode>> it = node.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> entry = it.next();
                if (!schema.declares(entry.getKey())) {
                    return DecodeResult.failed(DecodeFailure.of(FailureKind.UNEXPECTED_FIELD,
                            path + entry.getKey(), abbreviate(entry.getValue().toString()),
                            "Field is not declared by " + schema));
                }
            }
        }

        try {
            return DecodeResult.decoded(schema.bind(new FieldValues(values)));
        } catch (IllegalArgumentException | NullPointerException e) {
            return violation(path.isEmpty() ? "$" : stripDot(path), null,
                    "Record rejected by " + schema.entityName() + ": " + e.getMessage());
        }
    }

    /**
     * Converts a present, non-null value to its Java form, or returns the {@link DecodeFailure}.
     */
    private Object convert(FieldSpec spec, JsonNode value, String fieldPath) {
        switch (spec.kind()) {
            case INTEGER:
                if (value.isIntegralNumber() && value.canConvertToInt()) {
                    return value.intValue();
                }
                if (spec.coerceDigits() && value.isTextual() && DIGITS.matcher(value.textValue()).matches()) {
                    long parsed = Long.parseLong(value.textValue());
                    if (parsed <= Integer.MAX_VALUE) {
                        return (int) parsed;
                    }
                }
                return failure(fieldPath, value, "Expected a 32-bit integer");

            case NUMBER:
                return value.isNumber() ? (Object) value.doubleValue()
                        : failure(fieldPath, value, "Expected a number");

            case STRING:
                return value.isTextual() ? value.textValue()
                        : failure(fieldPath, value, "Expected a string");

            case BOOLEAN:
                return value.isBoolean() ? (Object) value.booleanValue()
                        : failure(fieldPath, value, "Expected a boolean");

            case ENUM:
                if (value.isIntegralNumber() && value.canConvertToInt()) {
                    return value.intValue();
                }
                return failure(fieldPath, value, "Expected an integer code of " + spec.domain().name());

            case STRING_LIST:
                if (!value.isArray()) {
                    return failure(fieldPath, value, "Expected an array of strings");
                }
                List<String> strings = new ArrayList<>(value.size());
                for (int i = 0; i < value.size(); i++) {
                    JsonNode element = value.get(i);
                    if (!element.isTextual()) {
                        return failure(fieldPath + "[" + i + "]", element, "Expected a string");
                    }
                    strings.add(element.textValue());
                }
                return List.copyOf(strings);

            case OBJECT:
                if (!value.isObject()) {
                    return failure(fieldPath, value, "Expected an object");
                }
                return unwrap(decodeObject((ObjectNode) value, spec.nested(), fieldPath + "."));

            case OBJECT_LIST:
                if (!value.isArray()) {
                    return failure(fieldPath, value, "Expected an array of objects");
                }
                List<Object> objects = new ArrayList<>(value.size());
                for (int i = 0; i < value.size(); i++) {
                    JsonNode element = value.get(i);
                    String elementPath = fieldPath + "[" + i + "]";
                    if (!element.isObject()) {
                        return failure(elementPath, element, "Expected an object");
                    }
                    Object bound = unwrap(decodeObject((ObjectNode) element, spec.nested(), elementPath + "."));
                    if (bound instanceof DecodeFailure) {
                        return bound;
                    }
                    objects.add(bound);
                }
                return List.copyOf(objects);

            default:
                throw new IllegalStateException("Unhandled field kind: " + spec.kind());
        }
    }

    private static Object unwrap(DecodeResult<?> result) {
        if (result instanceof DecodeResult.Failed<?> failed) {
            return failed.failure();
        }
        return ((DecodeResult.Decoded<?>) result).record();
    }

    private static DecodeFailure failure(String fieldPath, JsonNode value, String message) {
        return DecodeFailure.of(FailureKind.SCHEMA_VIOLATION, fieldPath, abbreviate(value.toString()), message);
    }

    private static <T> DecodeResult<T> violation(String fieldPath, String offendingValue, String message) {
        return DecodeResult.failed(DecodeFailure.of(FailureKind.SCHEMA_VIOLATION, fieldPath, offendingValue, message));
    }

    private static String stripDot(String path) {
        return path.endsWith(".") ? path.substring(0, path.length() - 1) : path;
    }

    static String abbreviate(String raw) {
        if (raw == null || raw.length() <= MAX_RAW_LENGTH) return raw;
        return raw.substring(0, MAX_RAW_LENGTH) + "...";
    }
}
