package org.schemadiff.cli;

import org.schemadiff.cli.service.ReportWriter;
import org.schemadiff.exception.SchemaDiffException;
import org.schemadiff.migration.MigrationPlan;
import picocli.CommandLine;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Generates the ordered migration steps between two schema versions.
 */
@CommandLine.Command(
        name = "migrate",
        mixinStandardHelpOptions = true,
        showDefaultValues = true,
        description = "두 스키마 버전 사이의 마이그레이션 단계를 생성합니다."
)
public class MigrateCommand extends SchemaPairCommand implements Callable<Integer> {

    @CommandLine.Option(names = "--out", description = "마이그레이션 단계를 저장할 파일 (생략 시 표준 출력)")
    Path outputFile;

    @CommandLine.Option(names = "--json", description = "계획을 JSON으로 출력합니다.")
    boolean json;

    @Override
    public Integer call() {
        try {
            MigrationPlan plan = createAnalyzer().generateMigrationPath(loadOld(), loadNew());
            if (plan.isEmpty()) {
                System.out.println("No changes detected.");
                return SchemaDiffCli.EXIT_OK;
            }

            ReportWriter writer = new ReportWriter();
            String rendered = json ? writer.toJson(plan) : writer.toText(plan);
            if (outputFile == null) {
                System.out.println(rendered);
            } else {
                schemaIo.writeText(outputFile, rendered);
                System.out.println("Migration plan with " + plan.getSteps().size() + " step(s) written to " + outputFile);
            }
            return SchemaDiffCli.EXIT_OK;
        } catch (SchemaDiffException e) {
            System.err.println("Migration planning failed: " + e.getMessage());
            return SchemaDiffCli.EXIT_ERROR;
        }
    }
}
