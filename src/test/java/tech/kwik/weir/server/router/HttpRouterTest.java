/*
 * Copyright © 2025, 2026 Peter Doornbosch
 *
 * This file is part of Weir, an embeddable HTTP/1.1 server engine
 *
 * Weir is free software: you can redistribute it and/or modify it under
 * the terms of the GNU Lesser General Public License as published by the
 * Free Software Foundation, either version 3 of the License, or (at your option)
 * any later version.
 *
 * Weir is distributed in the hope that it will be useful, but
 * WITHOUT ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or
 * FITNESS FOR A PARTICULAR PURPOSE. See the GNU Lesser General Public License for
 * more details.
 *
 * You should have received a copy of the GNU Lesser General Public License
 * along with this program. If not, see <http://www.gnu.org/licenses/>.
 */
package tech.kwik.weir.server.router;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

class HttpRouterTest {

    private final Endpoint first = mock(Endpoint.class);
    private final Endpoint second = mock(Endpoint.class);

    @Test
    void literalPathShouldMatchExactly() {
        // Given
        HttpRouter router = new HttpRouter().route("GET", "/users", first);

        // Then
        assertThat(router.getRoute("GET", "/users")).isPresent();
        assertThat(router.getRoute("GET", "/users/1")).isEmpty();
        assertThat(router.getRoute("POST", "/users")).isEmpty();
    }

    @Test
    void pathVariablesShouldBeBound() {
        // Given
        HttpRouter router = new HttpRouter().route("GET", "/users/{id}/posts/{post}", first);

        // When
        Optional<RouteMatch> match = router.getRoute("GET", "/users/42/posts/7");

        // Then
        assertThat(match).isPresent();
        assertThat(match.get().endpoint()).isSameAs(first);
        assertThat(match.get().pathVariables())
                .containsEntry("id", "42")
                .containsEntry("post", "7");
    }

    @Test
    void wildcardShouldMatchRemainderOfPath() {
        // Given
        HttpRouter router = new HttpRouter().route("GET", "/static/*", first);

        // When
        Optional<RouteMatch> match = router.getRoute("GET", "/static/css/site.css");

        // Then
        assertThat(match).isPresent();
        assertThat(match.get().pathVariables()).containsEntry("*", "css/site.css");
    }

    @Test
    void firstRegisteredMatchShouldWin() {
        // Given
        HttpRouter router = new HttpRouter()
                .route("GET", "/items/{id}", first)
                .route("GET", "/items/special", second);

        // When
        Optional<RouteMatch> match = router.getRoute("GET", "/items/special");

        // Then
        assertThat(match.get().endpoint()).isSameAs(first);
    }

    @Test
    void emptySegmentShouldNotBindVariable() {
        HttpRouter router = new HttpRouter().route("GET", "/users/{id}", first);

        assertThat(router.getRoute("GET", "/users/")).isEmpty();
    }

    @Test
    void wildcardThatIsNotLastShouldBeRejected() {
        assertThatThrownBy(() -> new HttpRouter().route("GET", "/a/*/b", first))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rootTemplateShouldMatchRootPath() {
        HttpRouter router = new HttpRouter().route("GET", "/", first);

        assertThat(router.getRoute("GET", "/")).isPresent();
        assertThat(router.getRoute("GET", "/x")).isEmpty();
    }
}
