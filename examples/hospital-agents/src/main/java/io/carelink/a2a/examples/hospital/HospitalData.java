package io.carelink.a2a.examples.hospital;

import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.core.type.TypeReference;
import io.carelink.a2a.util.Utils;

/**
 * Converts the hospital records into data part payloads.
 */
final class HospitalData {

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private HospitalData() {
    }

    static Map<String, Object> toMap(Object record) {
        return Utils.OBJECT_MAPPER.convertValue(record, MAP_TYPE);
    }
}
