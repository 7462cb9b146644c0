package com.keyco.core.http;

import com.keyco.core.serializer.JacksonPayloadSerializer;
import com.keyco.exception.HttpStatusException;
import com.keyco.exception.InvalidResponseException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResponseParserTest {

    private final ResponseParser parser = new ResponseParser(new JacksonPayloadSerializer());

    @Test
    void shouldTrimReturnedText() {
        assertThat(parser.parseSuccess(200, "{\"text\":\"  Hello there.\\n\"}")).isEqualTo("Hello there.");
    }

    @Test
    void shouldIgnoreUnknownFields() {
        assertThat(parser.parseSuccess(200, "{\"text\":\"ok\",\"model\":\"x\",\"usage\":{\"tokens\":3}}"))
                .isEqualTo("ok");
    }

    @Test
    void shouldFlagEmptyBody() {
        assertThatThrownBy(() -> parser.parseSuccess(200, ""))
                .isInstanceOfSatisfying(InvalidResponseException.class, e -> assertThat(e.isEmpty()).isTrue());
    }

    @Test
    void shouldRejectBodyWithoutText() {
        assertThatThrownBy(() -> parser.parseSuccess(200, "{\"result\":\"x\"}"))
                .isInstanceOfSatisfying(InvalidResponseException.class, e -> assertThat(e.isEmpty()).isFalse());
    }

    @Test
    void shouldRejectNonObjectBodies() {
        assertThatThrownBy(() -> parser.parseSuccess(200, "[\"text\"]")).isInstanceOf(InvalidResponseException.class);
        assertThatThrownBy(() -> parser.parseSuccess(200, "<html>")).isInstanceOf(InvalidResponseException.class);
    }

    @Test
    void shouldSurfaceErrorCarriedInSuccessfulResponse() {
        assertThatThrownBy(() -> parser.parseSuccess(200, "{\"error\":\"quota\",\"details\":\"monthly limit\"}"))
                .isInstanceOfSatisfying(HttpStatusException.class, e -> {
                    assertThat(e.getStatusCode()).isEqualTo(200);
                    assertThat(e.getDetail()).isEqualTo("monthly limit");
                });
    }

    @Test
    void shouldExtractErrorMessagePreferringError() {
        assertThat(parser.extractErrorMessage("{\"error\":\"bad\",\"details\":\"d\"}")).isEqualTo("bad");
        assertThat(parser.extractErrorMessage("{\"details\":\"only details\"}")).isEqualTo("only details");
        assertThat(parser.extractErrorMessage("Service Unavailable")).isEmpty();
        assertThat(parser.extractErrorMessage(null)).isEmpty();
    }
}
