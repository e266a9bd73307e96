package org.routeflow.http.routing;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GroupPrefixStackTest {

    private final GroupPrefixStack stack = new GroupPrefixStack();

    @Test
    void emptyStackOnlyNormalizesLeadingSlash() {
        assertThat(stack.apply("")).isEqualTo("/");
        assertThat(stack.apply("users")).isEqualTo("/users");
        assertThat(stack.apply("/users")).isEqualTo("/users");
    }

    @Test
    void prefixesConcatenateInPushOrder() {
        try (GroupPrefixStack.Scope outer = stack.open("/api")) {
            try (GroupPrefixStack.Scope inner = stack.open("/v1")) {
                assertThat(stack.apply("/users")).isEqualTo("/api/v1/users");
            }
            assertThat(stack.apply("/users")).isEqualTo("/api/users");
        }
        assertThat(stack.apply("/users")).isEqualTo("/users");
    }

    @Test
    void normalizationRunsAfterPrefixing() {
        try (GroupPrefixStack.Scope ignored = stack.open("admin")) {
            assertThat(stack.apply("/users")).isEqualTo("/admin/users");
        }
    }

    @Test
    void closingTwiceIsHarmless() {
        GroupPrefixStack.Scope scope = stack.open("/a");
        scope.close();
        scope.close();

        assertThat(stack.apply("/b")).isEqualTo("/b");
    }

    @Test
    void closingOutOfOrderIsRejected() {
        GroupPrefixStack.Scope outer = stack.open("/a");
        stack.open("/b");

        assertThatThrownBy(outer::close).isInstanceOf(IllegalStateException.class);
        assertThat(stack.apply("/c")).isEqualTo("/a/b/c");
    }

}
