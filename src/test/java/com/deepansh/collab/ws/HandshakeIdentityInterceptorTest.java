package com.deepansh.collab.ws;

import com.deepansh.collab.model.UserIdentity;
import org.junit.jupiter.api.Test;
import org.springframework.http.server.ServletServerHttpRequest;
import org.springframework.http.server.ServletServerHttpResponse;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class HandshakeIdentityInterceptorTest {

    private final HandshakeIdentityInterceptor interceptor = new HandshakeIdentityInterceptor();
    private final MockHttpServletResponse servletResponse = new MockHttpServletResponse();
    private final Map<String, Object> attributes = new HashMap<>();

    @Test
    void beforeHandshake_headers_storeIdentity() {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/ws/collab");
        request.addHeader("X-User-Id", "user-42");
        request.addHeader("X-Display-Name", "Luna");
        request.addHeader("X-Zodiac-Sign", "pisces");

        boolean accepted = handshake(request);

        assertThat(accepted).isTrue();
        assertThat(attributes.get(HandshakeIdentityInterceptor.IDENTITY_ATTRIBUTE))
                .isEqualTo(new UserIdentity("user-42", "Luna", "pisces"));
    }

    @Test
    void beforeHandshake_queryParams_areDecoded() {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/ws/collab");
        request.setQueryString("userId=user-7&displayName=Star%20Gazer");

        boolean accepted = handshake(request);

        assertThat(accepted).isTrue();
        UserIdentity identity = (UserIdentity) attributes.get(HandshakeIdentityInterceptor.IDENTITY_ATTRIBUTE);
        assertThat(identity.userId()).isEqualTo("user-7");
        assertThat(identity.displayName()).isEqualTo("Star Gazer");
        assertThat(identity.zodiacSign()).isNull();
    }

    @Test
    void beforeHandshake_headerWinsOverQuery() {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/ws/collab");
        request.addHeader("X-User-Id", "from-header");
        request.setQueryString("userId=from-query");

        handshake(request);

        assertThat(((UserIdentity) attributes.get(HandshakeIdentityInterceptor.IDENTITY_ATTRIBUTE)).userId())
                .isEqualTo("from-header");
    }

    @Test
    void beforeHandshake_missingUserId_isRefusedWith401() {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/ws/collab");
        request.addHeader("X-Display-Name", "Anonymous");

        boolean accepted = handshake(request);

        assertThat(accepted).isFalse();
        assertThat(servletResponse.getStatus()).isEqualTo(401);
        assertThat(attributes).isEmpty();
    }

    private boolean handshake(MockHttpServletRequest request) {
        return interceptor.beforeHandshake(new ServletServerHttpRequest(request),
                new ServletServerHttpResponse(servletResponse), null, attributes);
    }
}
