package org.schemadiff.cli;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Captures System.out / System.err around a command run.
 */
abstract class CliTestSupport {

    static final String USER_V1 = """
            {"type": "object",
             "properties": {"id": {"type": "integer"}, "name": {"type": "string"}},
             "required": ["id"]}
            """;

    static final String USER_V2_ADDITIVE = """
            {"type": "object",
             "properties": {"id": {"type": "integer"}, "name": {"type": "string"}, "email": {"type": "string"}},
             "required": ["id"]}
            """;

    static final String USER_V2_BREAKING = """
            {"type": "object", "properties": {"id": {"type": "integer"}}, "required": ["id"]}
            """;

    ByteArrayOutputStream outContent;
    ByteArrayOutputStream errContent;
    private PrintStream originalOut;
    private PrintStream originalErr;

    void captureOutput() {
        outContent = new ByteArrayOutputStream();
        errContent = new ByteArrayOutputStream();
        originalOut = System.out;
        originalErr = System.err;
        System.setOut(new PrintStream(outContent, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(errContent, true, StandardCharsets.UTF_8));
    }

    void restoreOutput() {
        System.setOut(originalOut);
        System.setErr(originalErr);
    }

    String out() {
        return outContent.toString(StandardCharsets.UTF_8);
    }

    String err() {
        return errContent.toString(StandardCharsets.UTF_8);
    }

    static Path write(Path dir, String name, String content) throws IOException {
        Path file = dir.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }
}
