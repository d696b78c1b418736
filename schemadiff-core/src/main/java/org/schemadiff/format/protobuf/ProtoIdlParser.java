package org.schemadiff.format.protobuf;

import com.google.protobuf.DescriptorProtos.DescriptorProto;
import com.google.protobuf.DescriptorProtos.EnumDescriptorProto;
import com.google.protobuf.DescriptorProtos.EnumValueDescriptorProto;
import com.google.protobuf.DescriptorProtos.EnumValueOptions;
import com.google.protobuf.DescriptorProtos.FieldDescriptorProto;
import com.google.protobuf.DescriptorProtos.FieldOptions;
import com.google.protobuf.DescriptorProtos.FileDescriptorProto;
import com.google.protobuf.DescriptorProtos.MessageOptions;
import com.google.protobuf.DescriptorProtos.OneofDescriptorProto;
import lombok.extern.slf4j.Slf4j;
import org.schemadiff.exception.SchemaParseException;
import org.schemadiff.format.protobuf.ProtoTokenizer.Token;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Recursive descent parser for {@code .proto} files (proto2 and proto3), producing the
 * same {@link FileDescriptorProto} that {@code protoc} would emit for the messages and
 * enums of a single file. Services, extensions and custom options are skipped.
 */
@Slf4j
final class ProtoIdlParser {

    static final int MAX_FIELD_NUMBER = 536_870_911;

    private static final Map<String, FieldDescriptorProto.Type> SCALARS = Map.ofEntries(
            Map.entry("double", FieldDescriptorProto.Type.TYPE_DOUBLE),
            Map.entry("float", FieldDescriptorProto.Type.TYPE_FLOAT),
            Map.entry("int32", FieldDescriptorProto.Type.TYPE_INT32),
            Map.entry("int64", FieldDescriptorProto.Type.TYPE_INT64),
            Map.entry("uint32", FieldDescriptorProto.Type.TYPE_UINT32),
            Map.entry("uint64", FieldDescriptorProto.Type.TYPE_UINT64),
            Map.entry("sint32", FieldDescriptorProto.Type.TYPE_SINT32),
            Map.entry("sint64", FieldDescriptorProto.Type.TYPE_SINT64),
            Map.entry("fixed32", FieldDescriptorProto.Type.TYPE_FIXED32),
            Map.entry("fixed64", FieldDescriptorProto.Type.TYPE_FIXED64),
            Map.entry("sfixed32", FieldDescriptorProto.Type.TYPE_SFIXED32),
            Map.entry("sfixed64", FieldDescriptorProto.Type.TYPE_SFIXED64),
            Map.entry("bool", FieldDescriptorProto.Type.TYPE_BOOL),
            Map.entry("string", FieldDescriptorProto.Type.TYPE_STRING),
            Map.entry("bytes", FieldDescriptorProto.Type.TYPE_BYTES)
    );

    private final List<Token> tokens;
    private int index;
    private String syntax = "proto2";
    private final Set<String> enumNames = new HashSet<>();
    private final Set<String> messageNames = new HashSet<>();

    private ProtoIdlParser(List<Token> tokens) {
        this.tokens = tokens;
    }

    static FileDescriptorProto parse(String source) throws SchemaParseException {
        return new ProtoIdlParser(ProtoTokenizer.tokenize(source)).parseFile();
    }

    private FileDescriptorProto parseFile() throws SchemaParseException {
        FileDescriptorProto.Builder file = FileDescriptorProto.newBuilder();
        boolean first = true;
        while (!peek().type().equals(ProtoTokenizer.Type.EOF)) {
            Token token = next();
            if (token.is(";")) {
                continue;
            }
            switch (token.text()) {
                case "syntax" -> {
                    if (!first) {
                        throw error(token, "'syntax' must be the first statement");
                    }
                    expect("=");
                    syntax = expectString();
                    expect(";");
                    file.setSyntax(syntax);
                }
                case "package" -> {
                    file.setPackage(expectIdent());
                    expect(";");
                }
                case "import" -> {
                    if (peek().is("public") || peek().is("weak")) next();
                    file.addDependency(expectString());
                    expect(";");
                }
                case "option" -> skipOption();
                case "message" -> file.addMessageType(parseMessage(scopeOf(file.getPackage())));
                case "enum" -> file.addEnumType(parseEnum(scopeOf(file.getPackage())));
                case "service", "extend" -> {
                    log.debug("Skipping {} block at {}", token.text(), token.position());
                    expectIdent();
                    skipBlock();
                }
                default -> throw error(token, "Unexpected '" + token.text() + "'");
            }
            first = false;
        }

        resolveTypes(file, file.getPackage());
        return file.build();
    }

    private DescriptorProto parseMessage(String scope) throws SchemaParseException {
        String name = expectIdent();
        String fullName = scope + "." + name;
        messageNames.add(fullName);
        DescriptorProto.Builder message = DescriptorProto.newBuilder().setName(name);
        expect("{");
        while (!peek().is("}")) {
            Token token = peek();
            switch (token.text()) {
                case ";" -> next();
                case "message" -> {
                    next();
                    message.addNestedType(parseMessage(fullName));
                }
                case "enum" -> {
                    next();
                    message.addEnumType(parseEnum(fullName));
                }
                case "option" -> {
                    next();
                    String option = optionName();
                    expect("=");
                    String value = constant();
                    expect(";");
                    if ("deprecated".equals(option)) {
                        message.setOptions(MessageOptions.newBuilder(message.getOptions()).setDeprecated(Boolean.parseBoolean(value)));
                    }
                }
                case "reserved" -> {
                    next();
                    parseReserved(message);
                }
                case "extensions" -> {
                    next();
                    skipStatement();
                }
                case "extend" -> {
                    next();
                    expectIdent();
                    skipBlock();
                }
                case "oneof" -> {
                    next();
                    parseOneof(message);
                }
                case "map" -> {
                    if (lookahead(1).is("<")) {
                        next();
                        parseMapField(message, fullName);
                    } else {
                        message.addField(parseField(null));
                    }
                }
                default -> message.addField(parseField(null));
            }
        }
        expect("}");
        return message.build();
    }

    private FieldDescriptorProto parseField(Integer oneofIndex) throws SchemaParseException {
        FieldDescriptorProto.Builder field = FieldDescriptorProto.newBuilder();
        Token first = peek();
        FieldDescriptorProto.Label label = FieldDescriptorProto.Label.LABEL_OPTIONAL;
        if (oneofIndex == null) {
            switch (first.text()) {
                case "required" -> {
                    next();
                    label = FieldDescriptorProto.Label.LABEL_REQUIRED;
                }
                case "repeated" -> {
                    next();
                    label = FieldDescriptorProto.Label.LABEL_REPEATED;
                }
                case "optional" -> {
                    next();
                    if ("proto3".equals(syntax)) {
                        field.setProto3Optional(true);
                    }
                }
                default -> {
                    if ("proto2".equals(syntax)) {
                        throw error(first, "Field requires a label (optional, required or repeated) in proto2");
                    }
                }
            }
        }
        field.setLabel(label);

        Token typeToken = next();
        if (typeToken.type() != ProtoTokenizer.Type.IDENT) {
            throw error(typeToken, "Expected a field type");
        }
        if ("group".equals(typeToken.text())) {
            throw error(typeToken, "Groups are not supported");
        }
        applyType(field, typeToken.text());

        field.setName(expectIdent());
        expect("=");
        field.setNumber(fieldNumber());
        if (oneofIndex != null) {
            field.setOneofIndex(oneofIndex);
        }
        if (peek().is("[")) {
            parseFieldOptions(field);
        }
        expect(";");
        return field.build();
    }

    private void parseMapField(DescriptorProto.Builder message, String messageScope) throws SchemaParseException {
        expect("<");
        String keyType = expectIdent();
        if (!SCALARS.containsKey(keyType) || keyType.equals("double") || keyType.equals("float") || keyType.equals("bytes")) {
            throw error(peek(), "Invalid map key type '" + keyType + "'");
        }
        expect(",");
        String valueType = expectIdent();
        expect(">");
        String fieldName = expectIdent();
        expect("=");
        int number = fieldNumber();

        String entryName = toCamel(fieldName) + "Entry";
        messageNames.add(messageScope + "." + entryName);
        FieldDescriptorProto.Builder key = FieldDescriptorProto.newBuilder()
                .setName("key").setNumber(1).setLabel(FieldDescriptorProto.Label.LABEL_OPTIONAL);
        applyType(key, keyType);
        FieldDescriptorProto.Builder value = FieldDescriptorProto.newBuilder()
                .setName("value").setNumber(2).setLabel(FieldDescriptorProto.Label.LABEL_OPTIONAL);
        applyType(value, valueType);
        message.addNestedType(DescriptorProto.newBuilder()
                .setName(entryName)
                .addField(key)
                .addField(value)
                .setOptions(MessageOptions.newBuilder().setMapEntry(true)));

        FieldDescriptorProto.Builder field = FieldDescriptorProto.newBuilder()
                .setName(fieldName)
                .setNumber(number)
                .setLabel(FieldDescriptorProto.Label.LABEL_REPEATED)
                .setType(FieldDescriptorProto.Type.TYPE_MESSAGE)
                .setTypeName(entryName);
        if (peek().is("[")) {
            parseFieldOptions(field);
        }
        expect(";");
        message.addField(field);
    }

    private void parseOneof(DescriptorProto.Builder message) throws SchemaParseException {
        String name = expectIdent();
        int oneofIndex = message.getOneofDeclCount();
        message.addOneofDecl(OneofDescriptorProto.newBuilder().setName(name));
        expect("{");
        while (!peek().is("}")) {
            if (peek().is(";")) {
                next();
            } else if (peek().is("option")) {
                next();
                skipOption();
            } else {
                message.addField(parseField(oneofIndex));
            }
        }
        expect("}");
    }

    private void parseFieldOptions(FieldDescriptorProto.Builder field) throws SchemaParseException {
        expect("[");
        FieldOptions.Builder options = FieldOptions.newBuilder();
        boolean touched = false;
        while (true) {
            String name = optionName();
            expect("=");
            String value = constant();
            switch (name) {
                case "deprecated" -> {
                    options.setDeprecated(Boolean.parseBoolean(value));
                    touched = true;
                }
                case "packed" -> {
                    options.setPacked(Boolean.parseBoolean(value));
                    touched = true;
                }
                case "default" -> field.setDefaultValue(value);
                case "json_name" -> field.setJsonName(value);
                default -> log.debug("Ignoring field option {}", name);
            }
            if (peek().is(",")) {
                next();
                continue;
            }
            break;
        }
        expect("]");
        if (touched) {
            field.setOptions(options);
        }
    }

    private void parseReserved(DescriptorProto.Builder message) throws SchemaParseException {
        if (peek().type() == ProtoTokenizer.Type.STRING) {
            do {
                message.addReservedName(expectString());
            } while (consume(","));
        } else {
            do {
                int start = integer();
                int end = start;
                if (peek().is("to")) {
                    next();
                    end = peek().is("max") ? maxAndNext() : integer();
                }
                // descriptor의 reserved range는 end exclusive
                message.addReservedRange(DescriptorProto.ReservedRange.newBuilder().setStart(start).setEnd(end + 1));
            } while (consume(","));
        }
        expect(";");
    }

    private EnumDescriptorProto parseEnum(String scope) throws SchemaParseException {
        String name = expectIdent();
        enumNames.add(scope + "." + name);
        EnumDescriptorProto.Builder enumType = EnumDescriptorProto.newBuilder().setName(name);
        expect("{");
        while (!peek().is("}")) {
            Token token = peek();
            if (token.is(";")) {
                next();
            } else if (token.is("option")) {
                next();
                skipOption();
            } else if (token.is("reserved")) {
                next();
                skipStatement();
            } else {
                EnumValueDescriptorProto.Builder value = EnumValueDescriptorProto.newBuilder().setName(expectIdent());
                expect("=");
                value.setNumber(integer());
                if (peek().is("[")) {
                    next();
                    do {
                        String option = optionName();
                        expect("=");
                        String optionValue = constant();
                        if ("deprecated".equals(option)) {
                            value.setOptions(EnumValueOptions.newBuilder().setDeprecated(Boolean.parseBoolean(optionValue)));
                        }
                    } while (consume(","));
                    expect("]");
                }
                expect(";");
                enumType.addValue(value);
            }
        }
        expect("}");
        return enumType.build();
    }

    // 메시지/enum 이름은 파일 전체를 읽은 뒤에야 알 수 있으므로 마지막에 타입을 확정한다
    private void resolveTypes(FileDescriptorProto.Builder file, String pkg) {
        String scope = scopeOf(pkg);
        for (DescriptorProto.Builder message : file.getMessageTypeBuilderList()) {
            resolveTypes(message, scope + "." + message.getName());
        }
    }

    private void resolveTypes(DescriptorProto.Builder message, String scope) {
        for (FieldDescriptorProto.Builder field : message.getFieldBuilderList()) {
            if (field.hasType() && field.getType() != FieldDescriptorProto.Type.TYPE_MESSAGE) {
                continue;
            }
            String resolved = resolveName(field.getTypeName(), scope);
            field.setTypeName(resolved);
            field.setType(enumNames.contains(resolved)
                    ? FieldDescriptorProto.Type.TYPE_ENUM
                    : FieldDescriptorProto.Type.TYPE_MESSAGE);
        }
        for (DescriptorProto.Builder nested : message.getNestedTypeBuilderList()) {
            resolveTypes(nested, scope + "." + nested.getName());
        }
    }

    /**
     * protobuf scoping: search from the innermost scope outwards.
     */
    private String resolveName(String name, String scope) {
        if (name.startsWith(".")) {
            return name;
        }
        String current = scope;
        while (true) {
            String candidate = current + "." + name;
            if (messageNames.contains(candidate) || enumNames.contains(candidate)) {
                return candidate;
            }
            if (current.isEmpty()) {
                // 다른 파일(import)에 정의된 타입
                return name;
            }
            int dot = current.lastIndexOf('.');
            current = dot < 0 ? "" : current.substring(0, dot);
        }
    }

    private void applyType(FieldDescriptorProto.Builder field, String type) {
        FieldDescriptorProto.Type scalar = SCALARS.get(type);
        if (scalar != null) {
            field.setType(scalar);
        } else {
            field.setTypeName(type);
        }
    }

    private static String scopeOf(String pkg) {
        return pkg == null || pkg.isEmpty() ? "" : "." + pkg;
    }

    private int fieldNumber() throws SchemaParseException {
        Token token = peek();
        int number = integer();
        if (number < 1 || number > MAX_FIELD_NUMBER) {
            throw error(token, "Field number " + number + " is out of range");
        }
        if (number >= 19_000 && number <= 19_999) {
            throw error(token, "Field number " + number + " is reserved for the protobuf implementation");
        }
        return number;
    }

    private int integer() throws SchemaParseException {
        boolean negative = consume("-");
        Token token = next();
        if (token.type() != ProtoTokenizer.Type.NUMBER) {
            throw error(token, "Expected an integer");
        }
        try {
            String text = token.text().toLowerCase(Locale.ROOT);
            long value = text.startsWith("0x") ? Long.parseLong(text.substring(2), 16)
                    : text.length() > 1 && text.startsWith("0") ? Long.parseLong(text.substring(1), 8)
                    : Long.parseLong(text);
            value = negative ? -value : value;
            if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
                throw error(token, "Integer out of range: " + token.text());
            }
            return (int) value;
        } catch (NumberFormatException e) {
            throw new SchemaParseException("Invalid integer '" + token.text() + "' at " + token.position(), e);
        }
    }

    private int maxAndNext() {
        next();
        return MAX_FIELD_NUMBER;
    }

    private String optionName() throws SchemaParseException {
        if (consume("(")) {
            String name = "(" + expectIdent() + ")";
            expect(")");
            if (peek().type() == ProtoTokenizer.Type.IDENT && peek().text().startsWith(".")) {
                name += next().text();
            }
            return name;
        }
        return expectIdent();
    }

    private String constant() throws SchemaParseException {
        Token token = next();
        if (token.is("-") || token.is("+")) {
            Token number = next();
            return (token.is("-") ? "-" : "") + number.text();
        }
        if (token.is("{")) {
            // aggregate option value
            int depth = 1;
            while (depth > 0) {
                Token t = next();
                if (t.type() == ProtoTokenizer.Type.EOF) throw error(t, "Unterminated option value");
                if (t.is("{")) depth++;
                if (t.is("}")) depth--;
            }
            return "{}";
        }
        if (token.type() == ProtoTokenizer.Type.SYMBOL || token.type() == ProtoTokenizer.Type.EOF) {
            throw error(token, "Expected a constant");
        }
        return token.text();
    }

    private void skipOption() throws SchemaParseException {
        optionName();
        expect("=");
        constant();
        expect(";");
    }

    private void skipStatement() throws SchemaParseException {
        while (!peek().is(";")) {
            if (peek().type() == ProtoTokenizer.Type.EOF) throw error(peek(), "Expected ';'");
            next();
        }
        next();
    }

    private void skipBlock() throws SchemaParseException {
        expect("{");
        int depth = 1;
        while (depth > 0) {
            Token t = next();
            if (t.type() == ProtoTokenizer.Type.EOF) throw error(t, "Unterminated block");
            if (t.is("{")) depth++;
            if (t.is("}")) depth--;
        }
    }

    private static String toCamel(String name) {
        StringBuilder sb = new StringBuilder();
        boolean upper = true;
        for (char c : name.toCharArray()) {
            if (c == '_') {
                upper = true;
            } else {
                sb.append(upper ? Character.toUpperCase(c) : c);
                upper = false;
            }
        }
        return sb.toString();
    }

    private Token peek() {
        return tokens.get(index);
    }

    private Token lookahead(int offset) {
        return tokens.get(Math.min(index + offset, tokens.size() - 1));
    }

    private Token next() {
        Token token = tokens.get(index);
        if (index < tokens.size() - 1) {
            index++;
        }
        return token;
    }

    private boolean consume(String symbol) {
        if (peek().is(symbol)) {
            next();
            return true;
        }
        return false;
    }

    private void expect(String symbol) throws SchemaParseException {
        Token token = next();
        if (!token.is(symbol)) {
            throw error(token, "Expected '" + symbol + "' but found '" + token.text() + "'");
        }
    }

    private String expectIdent() throws SchemaParseException {
        Token token = next();
        if (token.type() != ProtoTokenizer.Type.IDENT) {
            throw error(token, "Expected an identifier but found '" + token.text() + "'");
        }
        return token.text();
    }

    private String expectString() throws SchemaParseException {
        Token token = next();
        if (token.type() != ProtoTokenizer.Type.STRING) {
            throw error(token, "Expected a string literal but found '" + token.text() + "'");
        }
        return token.text();
    }

    private static SchemaParseException error(Token token, String message) {
        return new SchemaParseException(message + " at " + token.position());
    }
}
