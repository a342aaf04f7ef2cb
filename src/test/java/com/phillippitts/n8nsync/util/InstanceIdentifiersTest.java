package com.phillippitts.n8nsync.util;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class InstanceIdentifiersTest {

    @ParameterizedTest
    @CsvSource({
            "http://localhost:5678, local_5678",
            "https://acme.app.n8n.cloud, acme_cloud",
            "https://prod.example.com, prod_example",
            "https://n8n.internal.io/, n8n_internal"
    })
    void derivesHostSlug(String host, String expected) {
        assertThat(InstanceIdentifiers.hostSlug(host)).isEqualTo(expected);
    }

    @Test
    void fallbackIdentifierAppendsKeyDigestPrefix() {
        String id = InstanceIdentifiers.fallbackIdentifier("http://localhost:5678", "secret");

        assertThat(id).matches("local_5678_[0-9a-f]{6}");
        assertThat(InstanceIdentifiers.fallbackIdentifier("http://localhost:5678", "secret")).isEqualTo(id);
        assertThat(InstanceIdentifiers.fallbackIdentifier("http://localhost:5678", "other")).isNotEqualTo(id);
    }

    @Test
    void nullHostAndKeyAreTolerated() {
        assertThat(InstanceIdentifiers.hostSlug(null)).isEmpty();
        assertThat(InstanceIdentifiers.fallbackIdentifier(null, null)).matches("_[0-9a-f]{6}");
    }
}
