package org.schemadiff.format.protobuf;

import com.google.protobuf.DescriptorProtos.DescriptorProto;
import com.google.protobuf.DescriptorProtos.EnumDescriptorProto;
import com.google.protobuf.DescriptorProtos.EnumValueDescriptorProto;
import com.google.protobuf.DescriptorProtos.FieldDescriptorProto;
import com.google.protobuf.DescriptorProtos.FileDescriptorProto;
import org.schemadiff.model.ArrayNode;
import org.schemadiff.model.Constraint;
import org.schemadiff.model.NodeMetadata;
import org.schemadiff.model.ObjectNode;
import org.schemadiff.model.PrimitiveKind;
import org.schemadiff.model.ReferenceNode;
import org.schemadiff.model.ScalarNode;
import org.schemadiff.model.SchemaFormat;
import org.schemadiff.model.SchemaNode;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps a {@link FileDescriptorProto} onto the node model.
 * <p>
 * Every message and enum of the file is a root member, nested ones named
 * {@code Outer.Inner}. Fields carry their number as identity, so renumbering is a
 * remove plus an add while renaming keeps the field matched.
 */
final class ProtoNormalizer {

    static final String KIND = "kind";
    static final String KIND_MESSAGE = "message";
    static final String KIND_ENUM = "enum";
    static final String LABEL = "label";
    static final String ONEOF = "oneof";
    static final String DEFAULT = "default";
    static final String JSON_NAME = "json_name";
    static final String MAP = "map";
    static final String RESERVED_NUMBERS = "reserved-numbers";
    static final String RESERVED_NAMES = "reserved-names";
    static final String PACKAGE = "package";
    static final String SYNTAX = "syntax";

    private static final SchemaFormat FORMAT = SchemaFormat.PROTOBUF;

    private final Map<String, DescriptorProto> mapEntries = new HashMap<>();
    private String packagePrefix = "";

    SchemaNode normalize(FileDescriptorProto file) {
        packagePrefix = file.getPackage().isEmpty() ? "." : "." + file.getPackage() + ".";
        mapEntries.clear();
        for (DescriptorProto message : file.getMessageTypeList()) {
            collectMapEntries(message, "");
        }

        ObjectNode.ObjectNodeBuilder root = ObjectNode.builder();
        for (DescriptorProto message : file.getMessageTypeList()) {
            addMessage(root, message, "");
        }
        for (EnumDescriptorProto enumType : file.getEnumTypeList()) {
            root.field(enumType.getName(), enumNode(enumType));
        }

        NodeMetadata metadata = NodeMetadata.empty()
                .with(FORMAT, SYNTAX, file.getSyntax().isEmpty() ? "proto2" : file.getSyntax());
        if (!file.getPackage().isEmpty()) {
            metadata = metadata.with(FORMAT, PACKAGE, file.getPackage());
        }
        return root.metadata(metadata).build();
    }

    private void collectMapEntries(DescriptorProto message, String scope) {
        String name = scope + message.getName();
        for (DescriptorProto nested : message.getNestedTypeList()) {
            if (nested.getOptions().getMapEntry()) {
                mapEntries.put(name + "." + nested.getName(), nested);
            } else {
                collectMapEntries(nested, name + ".");
            }
        }
    }

    private void addMessage(ObjectNode.ObjectNodeBuilder root, DescriptorProto message, String scope) {
        String name = scope + message.getName();
        root.field(name, messageNode(message));
        for (DescriptorProto nested : message.getNestedTypeList()) {
            if (!nested.getOptions().getMapEntry()) {
                addMessage(root, nested, name + ".");
            }
        }
        for (EnumDescriptorProto enumType : message.getEnumTypeList()) {
            root.field(name + "." + enumType.getName(), enumNode(enumType));
        }
    }

    private ObjectNode messageNode(DescriptorProto message) {
        ObjectNode.ObjectNodeBuilder object = ObjectNode.builder();
        for (FieldDescriptorProto field : message.getFieldList()) {
            object.field(field.getName(), fieldNode(field, message));
            if (field.getLabel() == FieldDescriptorProto.Label.LABEL_REQUIRED) {
                object.requiredField(field.getName());
            }
        }

        NodeMetadata metadata = NodeMetadata.empty().with(FORMAT, KIND, KIND_MESSAGE);
        if (message.getOptions().getDeprecated()) {
            metadata = metadata.with(FORMAT, NodeMetadata.DEPRECATED, "true");
        }
        if (message.getReservedRangeCount() > 0) {
            metadata = metadata.with(FORMAT, RESERVED_NUMBERS, message.getReservedRangeList().stream()
                    .map(r -> r.getEnd() - 1 == r.getStart() ? String.valueOf(r.getStart()) : r.getStart() + "-" + (r.getEnd() - 1))
                    .collect(Collectors.joining(",")));
        }
        if (message.getReservedNameCount() > 0) {
            metadata = metadata.with(FORMAT, RESERVED_NAMES, String.join(",", message.getReservedNameList()));
        }
        return object.metadata(metadata).build();
    }

    private SchemaNode fieldNode(FieldDescriptorProto field, DescriptorProto owner) {
        NodeMetadata metadata = NodeMetadata.identity(String.valueOf(field.getNumber()));
        String label = label(field);
        if (label != null) {
            metadata = metadata.with(FORMAT, LABEL, label);
        }
        if (field.getOptions().getDeprecated()) {
            metadata = metadata.with(FORMAT, NodeMetadata.DEPRECATED, "true");
        }
        if (field.hasOneofIndex() && !field.getProto3Optional()) {
            metadata = metadata.with(FORMAT, ONEOF, owner.getOneofDecl(field.getOneofIndex()).getName());
        }
        if (field.hasDefaultValue()) {
            metadata = metadata.with(FORMAT, DEFAULT, field.getDefaultValue());
        }
        if (field.hasJsonName()) {
            metadata = metadata.with(FORMAT, JSON_NAME, field.getJsonName());
        }

        DescriptorProto entry = field.getType() == FieldDescriptorProto.Type.TYPE_MESSAGE
                ? mapEntries.get(relativeName(field.getTypeName()))
                : null;
        if (entry != null) {
            ObjectNode pair = ObjectNode.builder()
                    .field("key", typeNode(entry.getField(0)))
                    .field("value", typeNode(entry.getField(1)))
                    .requiredField("key")
                    .requiredField("value")
                    .build();
            return ArrayNode.of(pair).withMetadata(metadata.with(FORMAT, MAP, "true"));
        }

        SchemaNode type = typeNode(field);
        if (field.getLabel() == FieldDescriptorProto.Label.LABEL_REPEATED) {
            return ArrayNode.of(type).withMetadata(metadata);
        }
        return type.withMetadata(metadata);
    }

    private static String label(FieldDescriptorProto field) {
        return switch (field.getLabel()) {
            case LABEL_REQUIRED -> "required";
            case LABEL_REPEATED -> "repeated";
            // proto3에서 label 없는 필드는 implicit presence
            case LABEL_OPTIONAL -> field.getProto3Optional() || field.hasOneofIndex() ? "optional" : null;
        };
    }

    SchemaNode typeNode(FieldDescriptorProto field) {
        return switch (field.getType()) {
            case TYPE_DOUBLE, TYPE_FLOAT -> ScalarNode.of(PrimitiveKind.NUMBER, typeName(field.getType()));
            case TYPE_INT32, TYPE_INT64, TYPE_UINT32, TYPE_UINT64, TYPE_SINT32, TYPE_SINT64,
                 TYPE_FIXED32, TYPE_FIXED64, TYPE_SFIXED32, TYPE_SFIXED64 ->
                    ScalarNode.of(PrimitiveKind.INTEGER, typeName(field.getType()));
            case TYPE_BOOL -> ScalarNode.of(PrimitiveKind.BOOLEAN, "bool");
            case TYPE_STRING -> ScalarNode.of(PrimitiveKind.STRING, "string");
            case TYPE_BYTES -> ScalarNode.of(PrimitiveKind.BYTES, "bytes");
            case TYPE_ENUM, TYPE_MESSAGE, TYPE_GROUP -> ReferenceNode.of(relativeName(field.getTypeName()));
        };
    }

    static String typeName(FieldDescriptorProto.Type type) {
        return type.name().substring("TYPE_".length()).toLowerCase(Locale.ROOT);
    }

    private ScalarNode enumNode(EnumDescriptorProto enumType) {
        List<String> values = new ArrayList<>();
        for (EnumValueDescriptorProto value : enumType.getValueList()) {
            values.add(value.getName() + "=" + value.getNumber());
        }
        NodeMetadata metadata = NodeMetadata.empty().with(FORMAT, KIND, KIND_ENUM);
        if (enumType.getOptions().getDeprecated()) {
            metadata = metadata.with(FORMAT, NodeMetadata.DEPRECATED, "true");
        }
        return ScalarNode.builder()
                .primitive(PrimitiveKind.INTEGER)
                .typeName(KIND_ENUM)
                .constraint(Constraint.ENUM, List.copyOf(values))
                .metadata(metadata)
                .build();
    }

    /**
     * {@code .pkg.Outer.Inner} becomes {@code Outer.Inner}; names from other packages
     * keep their package.
     */
    private String relativeName(String typeName) {
        if (typeName.startsWith(packagePrefix)) {
            return typeName.substring(packagePrefix.length());
        }
        return typeName.startsWith(".") ? typeName.substring(1) : typeName;
    }
}
