package org.schemadiff.format.protobuf;

import com.google.protobuf.DescriptorProtos.FileDescriptorProto;
import com.google.protobuf.TextFormat;
import lombok.extern.slf4j.Slf4j;
import org.schemadiff.exception.FormatSpecificException;
import org.schemadiff.exception.SchemaDiffException;
import org.schemadiff.format.FormatAdapter;
import org.schemadiff.migration.MigrationInstruction;
import org.schemadiff.migration.RenderContext;
import org.schemadiff.model.Schema;
import org.schemadiff.model.SchemaFormat;
import org.schemadiff.model.SchemaNode;
import org.schemadiff.rules.RuleTable;

import java.util.regex.Pattern;

/**
 * Protocol Buffers schemas, given either as {@code .proto} source or as a
 * {@code FileDescriptorProto} in protobuf text format.
 */
@Slf4j
public class ProtobufAdapter implements FormatAdapter {

    private static final Pattern TEXT_FORMAT = Pattern.compile("(?m)^\\s*(message_type|enum_type)\\s*[:{]");

    private final RuleTable ruleTable = ProtobufRules.table();

    @Override
    public SchemaFormat format() {
        return SchemaFormat.PROTOBUF;
    }

    @Override
    public void checkSyntax(String content) throws SchemaDiffException {
        parse(content);
    }

    @Override
    public SchemaNode normalize(Schema schema) throws SchemaDiffException {
        FileDescriptorProto file = parse(schema.getContent());
        log.debug("Parsed {} top-level message(s) and {} enum(s)", file.getMessageTypeCount(), file.getEnumTypeCount());
        return new ProtoNormalizer().normalize(file);
    }

    @Override
    public RuleTable ruleTable() {
        return ruleTable;
    }

    @Override
    public String render(MigrationInstruction instruction, RenderContext context) {
        return ProtoRenderer.render(instruction);
    }

    FileDescriptorProto parse(String content) throws SchemaDiffException {
        if (!TEXT_FORMAT.matcher(content).find()) {
            return ProtoIdlParser.parse(content);
        }
        FileDescriptorProto.Builder builder = FileDescriptorProto.newBuilder();
        try {
            TextFormat.merge(content, builder);
        } catch (TextFormat.ParseException e) {
            throw new FormatSpecificException(SchemaFormat.PROTOBUF, "Invalid descriptor text: " + e.getMessage(), e);
        }
        return builder.build();
    }
}
