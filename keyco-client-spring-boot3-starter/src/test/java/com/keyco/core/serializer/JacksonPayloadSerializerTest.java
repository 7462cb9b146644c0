package com.keyco.core.serializer;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JacksonPayloadSerializerTest {

    private final JacksonPayloadSerializer serializer = new JacksonPayloadSerializer();

    @Test
    void shouldOmitNullFieldsFromRequestBody() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("text", "hi");
        fields.put("preset", null);

        assertThat(serializer.writeBody(fields)).isEqualTo("{\"text\":\"hi\"}");
    }

    @Test
    void shouldReturnNullForNonObjectJson() {
        assertThat(serializer.readObject("[1,2]")).isNull();
        assertThat(serializer.readObject("\"text\"")).isNull();
        assertThat(serializer.readObject(null)).isNull();
    }

    @Test
    void shouldFailOnMalformedJson() {
        assertThatThrownBy(() -> serializer.readObject("{\"text\":"))
                .isInstanceOf(IllegalStateException.class);
    }
}
