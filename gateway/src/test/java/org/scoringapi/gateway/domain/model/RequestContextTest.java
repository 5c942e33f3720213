package org.scoringapi.gateway.domain.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RequestContextTest {

    @Test
    void keepsGivenRequestId() {
        assertThat(RequestContext.withRequestId(" abc ").getRequestId()).isEqualTo("abc");
    }

    @Test
    void generatesIdWhenMissing() {
        String first = RequestContext.withRequestId(null).getRequestId();
        String second = RequestContext.withRequestId("  ").getRequestId();

        assertThat(first).hasSize(32).matches("[0-9a-f]+");
        assertThat(second).isNotEqualTo(first);
    }

    @Test
    void attributesAppearInToString() {
        RequestContext context = new RequestContext("r1");
        context.put("nclients", 2);

        assertThat(context.getAttributes()).containsEntry("nclients", 2);
        assertThat(context.toString()).isEqualTo("{request_id=r1, nclients=2}");
    }
}
