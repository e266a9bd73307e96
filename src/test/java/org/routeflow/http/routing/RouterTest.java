package org.routeflow.http.routing;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.routeflow.configuration.RouterProperties;
import org.routeflow.exception.HandlerException;
import org.routeflow.http.common.HttpMethod;
import org.routeflow.http.handler.RouteHandler;
import org.routeflow.http.handler.SimpleControllerRegistry;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RouterTest {

    private Router router;

    @BeforeEach
    void setUp() {
        router = new Router();
    }

    @Nested
    class Registration {

        @Test
        void routesKeepRegistrationOrderPerMethod() {
            router.get("/a", RouteHandler.of(() -> "a"))
                    .get("/b", RouteHandler.of(() -> "b"))
                    .post("/a", RouteHandler.of(() -> "post"));

            Map<HttpMethod, List<RouteDefinition>> routes = router.getRoutes();

            assertThat(routes).containsOnlyKeys(HttpMethod.values());
            assertThat(routes.get(HttpMethod.GET)).extracting(RouteDefinition::originalPath).containsExactly("/a", "/b");
            assertThat(routes.get(HttpMethod.POST)).extracting(RouteDefinition::originalPath).containsExactly("/a");
            assertThat(routes.get(HttpMethod.DELETE)).isEmpty();
        }

        @Test
        void pathsAreNormalizedToLeadingSlash() {
            router.get("", RouteHandler.of(() -> "root"))
                    .get("health", RouteHandler.of(() -> "ok"));

            assertThat(router.getRoutes().get(HttpMethod.GET))
                    .extracting(RouteDefinition::originalPath)
                    .containsExactly("/", "/health");
            assertThat(router.handle("GET", "/health")).isEqualTo("ok");
            assertThat(router.handle("GET", "/")).isEqualTo("root");
        }

        @Test
        void nestedGroupsComposePrefixes() {
            router.group("/a", r -> r.group("/b", inner -> inner.get("/c", RouteHandler.of(() -> "abc"))));

            assertThat(router.getRoutes().get(HttpMethod.GET))
                    .extracting(RouteDefinition::originalPath)
                    .containsExactly("/a/b/c");
            assertThat(router.handle("GET", "/a/b/c")).isEqualTo("abc");
        }

        @Test
        void groupPrefixWithoutSlashStillYieldsAbsolutePath() {
            router.group("admin", r -> r.get("/users", RouteHandler.of(() -> "users")));

            assertThat(router.getRoutes().get(HttpMethod.GET).get(0).originalPath()).isEqualTo("/admin/users");
        }

        @Test
        void groupPrefixIsDroppedWhenBodyThrows() {
            assertThatThrownBy(() -> router.group("/broken", r -> {
                r.get("/one", RouteHandler.of(() -> "one"));
                throw new IllegalStateException("boom");
            })).isInstanceOf(IllegalStateException.class).hasMessage("boom");

            router.get("/two", RouteHandler.of(() -> "two"));

            assertThat(router.getRoutes().get(HttpMethod.GET))
                    .extracting(RouteDefinition::originalPath)
                    .containsExactly("/broken/one", "/two");
        }

        @Test
        void anyRegistersSeparateEntryForEveryMethod() {
            RouteHandler handler = RouteHandler.of(() -> "any");
            router.any("/ping", handler);

            for (HttpMethod method : HttpMethod.values()) {
                List<RouteDefinition> routes = router.getRoutes().get(method);
                assertThat(routes).hasSize(1);
                assertThat(routes.get(0).method()).isEqualTo(method);
                assertThat(routes.get(0).handler()).isSameAs(handler);
                assertThat(router.handle(method.name(), "/ping")).isEqualTo("any");
            }
        }

        @Test
        void routeTableSnapshotIsReadOnly() {
            router.get("/a", RouteHandler.of(() -> "a"));

            assertThatThrownBy(() -> router.getRoutes().get(HttpMethod.GET).clear())
                    .isInstanceOf(UnsupportedOperationException.class);
        }

        @Test
        void routeDefinitionExposesParamNames() {
            router.put("/users/{id}/roles/{role}", RouteHandler.of((id, role) -> id + role));

            assertThat(router.getRoutes().get(HttpMethod.PUT).get(0).paramNames()).containsExactly("id", "role");
        }
    }

    @Nested
    class Dispatch {

        @Test
        void extractsNamedParameters() {
            router.get("/users/{id}", RouteHandler.of(id -> id));

            DispatchResult result = router.dispatch("GET", "/users/42");

            assertThat(result).isInstanceOf(RouteMatch.class);
            assertThat(((RouteMatch) result).pathParams()).containsExactly(Map.entry("id", "42"));
            assertThat(router.handle("GET", "/users/42")).isEqualTo("42");
        }

        @Test
        void trailingSegmentWithoutRouteIsNotFound() {
            router.get("/users/{id}", RouteHandler.of(id -> id));

            assertThat(router.dispatch("GET", "/users/42/edit")).isSameAs(NotFound.INSTANCE);
        }

        @Test
        void firstRegisteredRouteWins() {
            router.get("/users/{id}", RouteHandler.of(id -> "by-id"))
                    .get("/users/me", RouteHandler.of(() -> "me"));

            assertThat(router.handle("GET", "/users/me")).isEqualTo("by-id");
        }

        @Test
        void queryStringAndFragmentAreIgnored() {
            router.get("/search/{term}", RouteHandler.of(term -> term));

            assertThat(router.handle("GET", "/search/java?page=2#results")).isEqualTo("java");
            assertThat(router.handle("GET", "/search/java#top")).isEqualTo("java");
        }

        @Test
        void absoluteUrlIsReducedToPath() {
            router.get("/", RouteHandler.of(() -> "root"))
                    .get("/docs/{page}", RouteHandler.of(page -> page));

            assertThat(router.handle("GET", "http://example.com/docs/intro?x=1")).isEqualTo("intro");
            assertThat(router.handle("GET", "https://example.com")).isEqualTo("root");
        }

        @Test
        void postWithOverrideFieldUsesOverriddenMethod() {
            router.delete("/users/{id}", RouteHandler.of(id -> "deleted " + id))
                    .post("/users/{id}", RouteHandler.of(id -> "posted " + id));

            Object result = router.handle("POST", "/users/5", FormFields.of(Map.of("_method", "delete")));

            assertThat(result).isEqualTo("deleted 5");
            assertThat(router.handle("POST", "/users/5")).isEqualTo("posted 5");
        }

        @Test
        void overrideFieldIsOnlyHonouredForPost() {
            router.get("/x", RouteHandler.of(() -> "get"));

            assertThat(router.handle("GET", "/x", FormFields.of(Map.of("_method", "DELETE")))).isEqualTo("get");
        }

        @Test
        void unsupportedOverrideValueIsNotFound() {
            router.any("/x", RouteHandler.of(() -> "x"));

            assertThat(router.dispatch("POST", "/x", FormFields.of(Map.of("_method", "options"))))
                    .isSameAs(NotFound.INSTANCE);
            assertThat(router.dispatch("POST", "/x", FormFields.of(Map.of("_method", ""))))
                    .isSameAs(NotFound.INSTANCE);
        }

        @Test
        void overrideCanBeDisabled() {
            Router plain = new Router(RouterProperties.builder().methodOverrideEnabled(false).build());
            plain.post("/x", RouteHandler.of(() -> "post"))
                    .delete("/x", RouteHandler.of(() -> "delete"));

            assertThat(plain.handle("POST", "/x", FormFields.of(Map.of("_method", "DELETE")))).isEqualTo("post");
        }

        @Test
        void overrideFieldNameIsConfigurable() {
            Router custom = new Router(RouterProperties.builder().methodOverrideField("verb").build());
            custom.patch("/x", RouteHandler.of(() -> "patched"));

            assertThat(custom.handle("POST", "/x", FormFields.of(Map.of("verb", "PATCH")))).isEqualTo("patched");
        }

        @Test
        void unsupportedMethodIsAlwaysNotFound() {
            router.any("/x", RouteHandler.of(() -> "x"));

            assertThat(router.dispatch("OPTIONS", "/x")).isSameAs(NotFound.INSTANCE);
            assertThat(router.dispatch("HEAD", "/x")).isSameAs(NotFound.INSTANCE);
            assertThat(router.dispatch("get", "/x")).isSameAs(NotFound.INSTANCE);
        }

        @Test
        void slashInsidePlaceholderValueDoesNotMatch() {
            router.get("/files/{name}", RouteHandler.of(name -> name));

            assertThat(router.dispatch("GET", "/files/a/b").matched()).isFalse();
        }

        @Test
        void findRouteWorksOnTypedMethodAndBarePath() {
            router.patch("/items/{sku}", RouteHandler.of(sku -> sku));

            assertThat(router.findRoute(HttpMethod.PATCH, "/items/abc"))
                    .map(RouteMatch::pathParams)
                    .contains(Map.of("sku", "abc"));
            assertThat(router.findRoute(HttpMethod.GET, "/items/abc")).isEmpty();
        }

        @Test
        void findRouteRejectsMissingMethod() {
            assertThatThrownBy(() -> router.findRoute(null, "/items/abc"))
                    .isInstanceOf(NullPointerException.class)
                    .hasMessage("method");
        }
    }

    @Nested
    class Handling {

        @Test
        void boundHandlerReceivesParametersInPlaceholderOrder() {
            router.get("/{b}/{a}", RouteHandler.of((first, second) -> first + "," + second));

            assertThat(router.handle("GET", "/one/two")).isEqualTo("one,two");
        }

        @Test
        void defaultNotFoundResponse() {
            Object result = router.handle("GET", "/missing");

            assertThat(result).isEqualTo(new NotFoundResponse(404, "application/json", "{\"error\":\"Route not found\"}"));
        }

        @Test
        void notFoundMessageIsConfigurable() {
            Router custom = new Router(RouterProperties.builder().notFoundMessage("Nothing here").build());

            assertThat(((NotFoundResponse) custom.handle("GET", "/missing")).body())
                    .isEqualTo("{\"error\":\"Nothing here\"}");
        }

        @Test
        void customNotFoundHandlerIsUsed() {
            router.setNotFoundHandler(() -> "custom 404");

            assertThat(router.handle("GET", "/missing")).isEqualTo("custom 404");
            assertThat(router.handle("OPTIONS", "/missing")).isEqualTo("custom 404");
        }

        @Test
        void controllerMethodHandlerIsResolvedThroughRegistry() {
            SimpleControllerRegistry registry = new SimpleControllerRegistry()
                    .register("users", UserController::new);
            Router withControllers = new Router(RouterProperties.defaults(), registry);
            withControllers.get("/users/{id}", RouteHandler.controller("users", "show"));

            assertThat(withControllers.handle("GET", "/users/9")).isEqualTo("user 9");
        }

        @Test
        void unknownControllerTypeFailsWithoutFallingThrough() {
            router.get("/users/{id}", RouteHandler.controller("missing", "show"))
                    .get("/users/{id}", RouteHandler.of(id -> "fallback"));

            assertThatThrownBy(() -> router.handle("GET", "/users/1"))
                    .isInstanceOf(HandlerException.class)
                    .hasMessageContaining("missing");
        }

        @Test
        void nullHandlerIsInvalid() {
            router.get("/x", null);

            assertThatThrownBy(() -> router.handle("GET", "/x"))
                    .isInstanceOf(HandlerException.class)
                    .hasMessage("Invalid route handler");
        }

        @Test
        void handlerExceptionPropagatesUnchanged() {
            router.get("/fail", RouteHandler.of(() -> {
                throw new IllegalArgumentException("bad input");
            }));

            assertThatThrownBy(() -> router.handle("GET", "/fail"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("bad input");
        }
    }

    public static class UserController {

        public String show(String id) {
            return "user " + id;
        }
    }

}
