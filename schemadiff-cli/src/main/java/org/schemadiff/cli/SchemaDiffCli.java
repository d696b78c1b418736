package org.schemadiff.cli;

import picocli.CommandLine;

/**
 * Main CLI entry point for schemadiff.
 * Compares two versions of a schema and reports compatibility and migration steps.
 */
@CommandLine.Command(
        name = "schemadiff",
        mixinStandardHelpOptions = true,
        version = "schemadiff 0.1.0",
        description = "스키마 버전 간 호환성 분석 및 마이그레이션 계획 도구",
        subcommands = {
                AnalyzeCommand.class,
                MigrateCommand.class,
                ValidateCommand.class
        }
)
public class SchemaDiffCli {

    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;
    static final int EXIT_INCOMPATIBLE = 2;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new SchemaDiffCli()).execute(args);
        System.exit(exitCode);
    }
}
