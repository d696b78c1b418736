package org.schemadiff.cli;

import org.schemadiff.SchemaAnalyzer;
import org.schemadiff.cli.service.SchemaIoService;
import org.schemadiff.config.AnalysisPolicy;
import org.schemadiff.config.ConfigurationLoader;
import org.schemadiff.exception.SchemaDiffException;
import org.schemadiff.format.FormatRegistry;
import org.schemadiff.model.Schema;
import org.schemadiff.model.SchemaFormat;
import picocli.CommandLine;

import java.nio.file.Path;

/**
 * Options shared by the commands that compare an old and a new schema file.
 */
abstract class SchemaPairCommand {

    @CommandLine.Option(names = "--old", required = true, description = "이전 버전 스키마 파일")
    Path oldFile;

    @CommandLine.Option(names = "--new", required = true, description = "새 버전 스키마 파일")
    Path newFile;

    @CommandLine.Option(names = {"-f", "--format"}, description = "스키마 포맷 (json-schema, openapi, protobuf, sql). 생략 시 확장자로 판단")
    String formatName;

    @CommandLine.Option(names = "--old-version", description = "이전 스키마 버전 (semver)", defaultValue = "0.0.0")
    String oldVersion;

    @CommandLine.Option(names = "--new-version", description = "새 스키마 버전 (semver)", defaultValue = "0.0.0")
    String newVersion;

    @CommandLine.Option(names = "--profile", description = "사용할 설정 프로파일 (dev, prod, test 등)")
    String profile;

    final SchemaIoService schemaIo = new SchemaIoService();

    SchemaAnalyzer createAnalyzer() {
        AnalysisPolicy policy = new ConfigurationLoader().loadPolicy(profile);
        return new SchemaAnalyzer(FormatRegistry.defaults(), policy);
    }

    Schema loadOld() throws SchemaDiffException {
        return schemaIo.loadSchema(oldFile, explicitFormat(), oldVersion);
    }

    Schema loadNew() throws SchemaDiffException {
        return schemaIo.loadSchema(newFile, explicitFormat(), newVersion);
    }

    private SchemaFormat explicitFormat() throws SchemaDiffException {
        return formatName == null ? null : SchemaFormat.fromName(formatName);
    }
}
