package org.schemadiff.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class SchemaPathTest {

    @Test
    @DisplayName("root는 '/'로 표현된다")
    void root_rendersAsSlash() {
        assertThat(SchemaPath.root().toString()).isEqualTo("/");
        assertThat(SchemaPath.root().isRoot()).isTrue();
        assertThat(SchemaPath.root().depth()).isZero();
        assertThat(SchemaPath.root().leaf()).isEmpty();
    }

    @Test
    void child_appendsSegment() {
        SchemaPath path = SchemaPath.root().child("users").child("email");

        assertThat(path.toString()).isEqualTo("/users/email");
        assertThat(path.depth()).isEqualTo(2);
        assertThat(path.leaf()).isEqualTo("email");
        assertThat(path.parent()).isEqualTo(SchemaPath.of("users"));
    }

    @Test
    @DisplayName("배열 원소와 union 대안은 전용 segment를 쓴다")
    void elementAndAlternative_useReservedSegments() {
        SchemaPath path = SchemaPath.of("User", "tags").element().alternative(1);

        assertThat(path.toString()).isEqualTo("/User/tags/[]/|1");
        assertThat(path.contains(SchemaPath.ELEMENT)).isTrue();
    }

    @Test
    void segmentsWithSlash_areEscapedLikeJsonPointer() {
        SchemaPath path = SchemaPath.of("paths", "/users/{id}", "get");

        assertThat(path.toString()).isEqualTo("/paths/~1users~1{id}/get");
        assertThat(SchemaPath.parse(path.toString())).isEqualTo(path);
    }

    @ParameterizedTest
    @ValueSource(strings = {"/a/b", "/a~0b/c", "/paths/~1pets/post/requestBody"})
    void parse_isInverseOfToString(String text) {
        assertThat(SchemaPath.parse(text).toString()).isEqualTo(text);
    }

    @Test
    void parse_emptyOrSlash_isRoot() {
        assertThat(SchemaPath.parse("")).isEqualTo(SchemaPath.root());
        assertThat(SchemaPath.parse("/")).isEqualTo(SchemaPath.root());
        assertThat(SchemaPath.parse(null)).isEqualTo(SchemaPath.root());
    }

    @Test
    void startsWith_matchesWholeSegmentsOnly() {
        SchemaPath users = SchemaPath.of("users");

        assertThat(SchemaPath.of("users", "email").startsWith(users)).isTrue();
        assertThat(users.startsWith(users)).isTrue();
        assertThat(SchemaPath.of("usersArchive", "email").startsWith(users)).isFalse();
        assertThat(SchemaPath.of("users").startsWith(SchemaPath.root())).isTrue();
    }

    @Test
    void parentOfRoot_isRoot() {
        assertThat(SchemaPath.root().parent()).isEqualTo(SchemaPath.root());
    }
}
