package org.schemadiff.cli;

import org.schemadiff.cli.service.ReportWriter;
import org.schemadiff.exception.SchemaDiffException;
import org.schemadiff.model.CompatibilityReport;
import picocli.CommandLine;

import java.util.concurrent.Callable;

/**
 * Compares two schema versions and prints the compatibility report.
 * Exit code 0 when compatible, 2 when not, 1 on error.
 */
@CommandLine.Command(
        name = "analyze",
        mixinStandardHelpOptions = true,
        showDefaultValues = true,
        description = "두 스키마 버전의 호환성을 분석합니다."
)
public class AnalyzeCommand extends SchemaPairCommand implements Callable<Integer> {

    @CommandLine.Option(names = "--json", description = "보고서를 JSON으로 출력합니다.")
    boolean json;

    @Override
    public Integer call() {
        try {
            CompatibilityReport report = createAnalyzer().analyzeCompatibility(loadOld(), loadNew());
            ReportWriter writer = new ReportWriter();
            System.out.println(json ? writer.toJson(report) : writer.toText(report));
            return report.isCompatible() ? SchemaDiffCli.EXIT_OK : SchemaDiffCli.EXIT_INCOMPATIBLE;
        } catch (SchemaDiffException e) {
            System.err.println("Analysis failed: " + e.getMessage());
            return SchemaDiffCli.EXIT_ERROR;
        }
    }
}
