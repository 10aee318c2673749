package com.propertyintel.ingest.extract;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CoderResult;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Picks the first candidate charset that decodes the head of a file without errors.
 * A UTF-8 byte order mark short-circuits to UTF-8.
 */
@Slf4j
final class TextEncodingDetector {

    private final List<Charset> candidates;
    private final int sampleSize;

    TextEncodingDetector(List<String> encodings, int sampleSize) {
        this.candidates = encodings.stream().map(Charset::forName).toList();
        this.sampleSize = sampleSize;
    }

    Charset detect(Path file) throws IOException {
        byte[] sample;
        boolean wholeFile;
        try (InputStream in = Files.newInputStream(file)) {
            sample = in.readNBytes(sampleSize);
            wholeFile = in.read() == -1;
        }

        if (sample.length >= 3
                && (sample[0] & 0xFF) == 0xEF && (sample[1] & 0xFF) == 0xBB && (sample[2] & 0xFF) == 0xBF) {
            return StandardCharsets.UTF_8;
        }

        for (Charset charset : candidates) {
            if (decodesCleanly(charset, sample, wholeFile)) {
                return charset;
            }
            log.debug("{} does not decode {}", charset, file);
        }
        return StandardCharsets.UTF_8;
    }

    /** A multi-byte sequence cut off at the end of a partial sample is not an error. */
    private static boolean decodesCleanly(Charset charset, byte[] sample, boolean endOfInput) {
        CharsetDecoder decoder = charset.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        CharBuffer out = CharBuffer.allocate(sample.length + 16);
        CoderResult result = decoder.decode(ByteBuffer.wrap(sample), out, endOfInput);
        if (result.isError()) {
            return false;
        }
        return !endOfInput || !decoder.flush(out).isError();
    }
}
