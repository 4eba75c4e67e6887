package io.github.eutro.pathprof.runner;

import io.github.eutro.pathprof.ir.LinearIR;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.Map;

class TestPrograms {
    static LinearIR get(String name) {
        try (InputStream is = TestPrograms.class.getResourceAsStream(name)) {
            if (is == null) throw new IllegalArgumentException("no such resource: " + name);
            ByteArrayOutputStream bytes = new ByteArrayOutputStream();
            byte[] buf = new byte[4096];
            int n;
            while ((n = is.read(buf)) != -1) {
                bytes.write(buf, 0, n);
            }
            return LinearIR.parse(new String(bytes.toByteArray(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    static Path path(String name) {
        try {
            return Paths.get(TestPrograms.class.getResource(name).toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }

    static Map<String, Long> param(String name, long value) {
        return Collections.singletonMap(name, value);
    }
}
