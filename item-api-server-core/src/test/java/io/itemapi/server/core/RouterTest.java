package io.itemapi.server.core;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RouterTest {

    private static final RequestHandler LIST = (req, params) -> ServerResponse.text(200, "list");
    private static final RequestHandler GET = (req, params) -> ServerResponse.text(200, "get");
    private static final RequestHandler DELETE = (req, params) -> ServerResponse.text(204, "delete");

    private final Router router = new Router()
            .route(HttpMethod.GET, "/items", LIST)
            .route(HttpMethod.GET, "/items/{id}", GET)
            .route(HttpMethod.DELETE, "/items/{id}", DELETE);

    @Test
    void resolvesLiteralRoute() {
        Router.Resolution r = router.resolve(HttpMethod.GET, "/items");
        assertThat(r).isInstanceOf(Router.Resolution.Found.class);
        Router.Resolution.Found found = (Router.Resolution.Found) r;
        assertThat(found.handler()).isSameAs(LIST);
        assertThatThrownBy(() -> found.params().require("id")).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void extractsPathParameter() {
        Router.Resolution.Found found = (Router.Resolution.Found) router.resolve(HttpMethod.DELETE, "/items/42");
        assertThat(found.handler()).isSameAs(DELETE);
        assertThat(found.params().require("id")).isEqualTo("42");
        assertThatThrownBy(() -> found.params().require("other")).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void parameterKeepsNonNumericSegments() {
        Router.Resolution.Found found = (Router.Resolution.Found) router.resolve(HttpMethod.GET, "/items/abc");
        assertThat(found.params().require("id")).isEqualTo("abc");
    }

    @Test
    void unknownPathIsNotFound() {
        assertThat(router.resolve(HttpMethod.GET, "/things")).isInstanceOf(Router.Resolution.NotFound.class);
        assertThat(router.resolve(HttpMethod.GET, "/items/1/extra")).isInstanceOf(Router.Resolution.NotFound.class);
        assertThat(router.resolve(HttpMethod.GET, "/")).isInstanceOf(Router.Resolution.NotFound.class);
    }

    @Test
    void emptyParameterSegmentDoesNotMatch() {
        assertThat(router.resolve(HttpMethod.GET, "/items/")).isInstanceOf(Router.Resolution.NotFound.class);
    }

    @Test
    void wrongMethodReportsAllowedMethods() {
        Router.Resolution r = router.resolve(HttpMethod.PUT, "/items/1");
        assertThat(r).isInstanceOf(Router.Resolution.MethodNotAllowed.class);
        assertThat(((Router.Resolution.MethodNotAllowed) r).allowed())
                .isEqualTo(Set.of(HttpMethod.GET, HttpMethod.HEAD, HttpMethod.DELETE));
    }

    @Test
    void headFallsBackToGet() {
        Router.Resolution.Found found = (Router.Resolution.Found) router.resolve(HttpMethod.HEAD, "/items/7");
        assertThat(found.handler()).isSameAs(GET);
    }

    @Test
    void literalSegmentWinsOverParameter() {
        RequestHandler special = (req, params) -> ServerResponse.text(200, "special");
        Router r = new Router()
                .route(HttpMethod.GET, "/items/{id}", GET)
                .route(HttpMethod.GET, "/items/special", special);

        assertThat(((Router.Resolution.Found) r.resolve(HttpMethod.GET, "/items/special")).handler()).isSameAs(special);
        assertThat(((Router.Resolution.Found) r.resolve(HttpMethod.GET, "/items/3")).handler()).isSameAs(GET);
    }

    @Test
    void rejectsDuplicateRegistration() {
        assertThatThrownBy(() -> router.route(HttpMethod.GET, "/items/{id}", GET))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsMalformedPatterns() {
        assertThatThrownBy(() -> new Router().route(HttpMethod.GET, "items", LIST))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Router().route(HttpMethod.GET, "/items//x", LIST))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Router().route(HttpMethod.GET, "/items/{}", LIST))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
