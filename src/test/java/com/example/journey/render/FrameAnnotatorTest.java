package com.example.journey.render;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;

class FrameAnnotatorTest {

    @Test
    void mjpegPartCarriesBoundaryHeadersAndPayload() throws Exception {
        byte[] jpeg = {(byte) 0xFF, (byte) 0xD8, 1, 2, 3, (byte) 0xFF, (byte) 0xD9};

        byte[] part = FrameAnnotator.toMjpegPart(jpeg);
        String header = "--frame\r\nContent-Type: image/jpeg\r\nContent-Length: 7\r\n\r\n";

        assertThat(new String(part, 0, header.length(), StandardCharsets.US_ASCII)).isEqualTo(header);
        assertThat(Arrays.copyOfRange(part, header.length(), header.length() + jpeg.length)).isEqualTo(jpeg);
        assertThat(new String(part, part.length - 2, 2, StandardCharsets.US_ASCII)).isEqualTo("\r\n");
        assertThat(part).hasSize(header.length() + jpeg.length + 2);
    }
}
