package com.phillippitts.n8nsync.util;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * Shared Jackson configuration for workflow files, the state file and the remote API.
 *
 * <p>Files written through {@link #newMapper()} are pretty-printed with ISO-8601 dates so
 * they diff cleanly under version control.
 */
public final class Jsons {

    private Jsons() {
    }

    public static ObjectMapper newMapper() {
        return JsonMapper.builder()
                .findAndAddModules()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();
    }
}
