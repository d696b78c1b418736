package org.schemadiff.cli;

import org.schemadiff.SchemaAnalyzer;
import org.schemadiff.cli.service.ReportWriter;
import org.schemadiff.cli.service.SchemaIoService;
import org.schemadiff.config.ConfigurationLoader;
import org.schemadiff.exception.SchemaDiffException;
import org.schemadiff.format.FormatRegistry;
import org.schemadiff.model.Change;
import org.schemadiff.model.SchemaFormat;
import org.schemadiff.validate.ValidationResult;
import picocli.CommandLine;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Checks a previously exported change list (JSON) for consistency.
 */
@CommandLine.Command(
        name = "validate",
        mixinStandardHelpOptions = true,
        description = "변경 목록(JSON)의 분류가 일관적인지 검증합니다."
)
public class ValidateCommand implements Callable<Integer> {

    @CommandLine.Option(names = "--changes", required = true, description = "변경 목록 JSON 파일")
    private Path changesFile;

    @CommandLine.Option(names = {"-f", "--format"}, description = "변경이 속한 스키마 포맷. 생략 시 기본 규칙으로 검증")
    private String formatName;

    @CommandLine.Option(names = "--profile", description = "사용할 설정 프로파일 (dev, prod, test 등)")
    private String profile;

    @CommandLine.Option(names = "--json", description = "결과를 JSON으로 출력합니다.")
    private boolean json;

    @Override
    public Integer call() {
        try {
            List<Change> changes = new SchemaIoService().readChanges(changesFile);
            SchemaAnalyzer analyzer = new SchemaAnalyzer(FormatRegistry.defaults(),
                    new ConfigurationLoader().loadPolicy(profile));
            ValidationResult result = formatName == null
                    ? analyzer.validateChanges(changes)
                    : analyzer.validateChanges(SchemaFormat.fromName(formatName), changes);

            ReportWriter writer = new ReportWriter();
            System.out.println(json ? writer.toJson(result) : writer.toText(result));
            return result.isValid() ? SchemaDiffCli.EXIT_OK : SchemaDiffCli.EXIT_INCOMPATIBLE;
        } catch (SchemaDiffException e) {
            System.err.println("Validation failed: " + e.getMessage());
            return SchemaDiffCli.EXIT_ERROR;
        }
    }
}
