package org.schemadiff.cli;

import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;

import static org.assertj.core.api.Assertions.assertThat;

class SchemaDiffCliTest {

    @Test
    void help_listsSubcommands() {
        StringWriter out = new StringWriter();

        int exitCode = new CommandLine(new SchemaDiffCli()).setOut(new PrintWriter(out)).execute("--help");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("analyze").contains("migrate").contains("validate");
    }

    @Test
    void version_isPrinted() {
        StringWriter out = new StringWriter();

        int exitCode = new CommandLine(new SchemaDiffCli()).setOut(new PrintWriter(out)).execute("--version");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("schemadiff 0.1.0");
    }

    @Test
    void missingRequiredOption_isUsageError() {
        StringWriter err = new StringWriter();

        int exitCode = new CommandLine(new SchemaDiffCli()).setErr(new PrintWriter(err)).execute("analyze", "--old", "a.json");

        assertThat(exitCode).isEqualTo(CommandLine.ExitCode.USAGE);
        assertThat(err.toString()).contains("--new");
    }
}
