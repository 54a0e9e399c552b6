package io.ledgerrest.api.envelope;

import static org.junit.jupiter.api.Assertions.*;

import io.ledgerrest.api.http.GatewayRequest;
import org.junit.jupiter.api.Test;

class MetadataTest {

    private static GatewayRequest get(String uri) {
        return GatewayRequest.of("GET", "http", "localhost:8080", uri, null, new byte[0]);
    }

    @Test
    void testHeadComesFirstThenOtherPairsInOrder() {
        Metadata metadata = Metadata.compute(get("/state?address=000000&head=abc"), "abc");

        assertEquals("abc", metadata.head());
        assertEquals("http://localhost:8080/state?head=abc&address=000000", metadata.link());
    }

    @Test
    void testReportedHeadReplacesRequestedOne() {
        Metadata metadata = Metadata.compute(get("/blocks?head=old&id=1,2&wait=5"), "new");

        assertEquals("http://localhost:8080/blocks?head=new&id=1,2&wait=5", metadata.link());
    }

    @Test
    void testHeadWithoutQuery() {
        assertEquals("http://localhost:8080/blocks?head=abc",
                Metadata.compute(get("/blocks"), "abc").link());
    }

    @Test
    void testWithoutHeadLinkIsRequestUrl() {
        Metadata metadata = Metadata.compute(get("/batch_status?id=aaa,bbb"), null);

        assertNull(metadata.head());
        assertEquals("http://localhost:8080/batch_status?id=aaa,bbb", metadata.link());
    }

    @Test
    void testEmptyHeadCountsAsAbsent() {
        Metadata metadata = Metadata.compute(get("/state?address=1c"), "");

        assertNull(metadata.head());
        assertEquals("http://localhost:8080/state?address=1c", metadata.link());
    }

    @Test
    void testHeadlessEnvelopeHasOnlyLink() {
        String body = Envelope.wrap(null, Metadata.compute(get("/batch_status?id=aaa,bbb"), null)).body();
        assertEquals("""
                {
                  "link": "http://localhost:8080/batch_status?id=aaa,bbb"
                }""", body);
    }
}
