package io.ledgerrest.api.expand;

import static io.ledgerrest.api.LedgerFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.ledgerrest.api.internal.JsonSupport;
import io.ledgerrest.api.internal.ProtoJson;
import io.ledgerrest.core.error.WireFormatException;
import io.ledgerrest.core.protobuf.Block;
import io.ledgerrest.core.protobuf.Transaction;
import java.util.Base64;
import org.junit.jupiter.api.Test;

class HeaderExpanderTest {

    private static Block sampleBlock() {
        return block(id('a'), 7,
                batch(id('b'), transaction(id('1')), transaction(id('2'))),
                batch(id('c'), transaction(id('3'))));
    }

    @Test
    void testExpandBlockLeavesNoEncodedHeaderAtAnyDepth() {
        ObjectNode block = HeaderExpander.expandBlock(ProtoJson.toTree(sampleBlock()));

        assertTrue(block.get("header").isObject());
        assertEquals(id('a'), block.get("header_signature").asText());
        assertEquals(2, block.get("batches").size());
        assertEquals(2, block.get("batches").get(0).get("transactions").size());
        assertEquals(1, block.get("batches").get(1).get("transactions").size());

        for (JsonNode batch : block.get("batches")) {
            assertTrue(batch.get("header").isObject());
            for (JsonNode txn : batch.get("transactions")) {
                assertTrue(txn.get("header").isObject());
                assertEquals("intkey", txn.get("header").get("family_name").asText());
            }
        }
    }

    @Test
    void testBlockNumIsRenderedAsString() {
        ObjectNode block = HeaderExpander.expandBlock(ProtoJson.toTree(sampleBlock()));

        JsonNode blockNum = block.get("header").get("block_num");
        assertTrue(blockNum.isTextual(), blockNum.toString());
        assertEquals("7", blockNum.asText());
        assertEquals(Base64.getEncoder().encodeToString("Devmode".getBytes()),
                block.get("header").get("consensus").asText());
    }

    @Test
    void testBinaryHeaderNodeIsExpanded() {
        Transaction txn = transaction(id('1'));
        ObjectNode node = JsonSupport.MAPPER.createObjectNode();
        node.put("header", txn.getHeader().toByteArray());
        node.put("header_signature", txn.getHeaderSignature());
        assertTrue(node.get("header").isBinary());

        ObjectNode expanded = HeaderExpander.expandTransaction(node);

        assertEquals("nonce-1", expanded.get("header").get("nonce").asText());
    }

    @Test
    void testExpandedHeaderUsesSnakeCaseFields() {
        ObjectNode batch = HeaderExpander.expandBatch(ProtoJson.toTree(batch(id('b'), transaction(id('1')))));

        JsonNode header = batch.get("header");
        assertEquals("02" + "b".repeat(64), header.get("signer_pubkey").asText());
        assertEquals(id('1'), header.get("transaction_ids").get(0).asText());
    }

    @Test
    void testEmptyHeaderFieldsAreStillWritten() {
        ObjectNode txn = HeaderExpander.expandTransaction(ProtoJson.toTree(transaction(id('1'))));

        assertTrue(txn.get("header").get("dependencies").isArray());
        assertEquals(0, txn.get("header").get("dependencies").size());
    }

    @Test
    void testTransactionPayloadStaysEncoded() {
        ObjectNode txn = HeaderExpander.expandTransaction(ProtoJson.toTree(transaction(id('1'))));

        assertEquals("payload-1", new String(Base64.getDecoder().decode(txn.get("payload").asText())));
        assertEquals("application/cbor", txn.get("header").get("payload_encoding").asText());
    }

    @Test
    void testMalformedBase64Fails() {
        ObjectNode block = ProtoJson.toTree(sampleBlock());
        ((ObjectNode) block.get("batches").get(1)).put("header", "not base64!");

        assertThrows(WireFormatException.class, () -> HeaderExpander.expandBlock(block));
    }

    @Test
    void testUndecodableHeaderFails() {
        ObjectNode txn = ProtoJson.toTree(transaction(id('1')));
        txn.put("header", Base64.getEncoder().encodeToString(new byte[] {(byte) 0xC5, 0x01}));

        WireFormatException ex = assertThrows(WireFormatException.class, () -> HeaderExpander.expandTransaction(txn));
        assertTrue(ex.getMessage().startsWith("Malformed TransactionHeader"), ex.getMessage());
    }

    @Test
    void testMissingHeaderFails() {
        ObjectNode batch = ProtoJson.toTree(batch(id('b')));
        batch.remove("header");

        assertThrows(WireFormatException.class, () -> HeaderExpander.expandBatch(batch));
    }

    @Test
    void testNonBinaryHeaderFails() {
        ObjectNode batch = ProtoJson.toTree(batch(id('b')));
        batch.put("header", 12);

        assertThrows(WireFormatException.class, () -> HeaderExpander.expandBatch(batch));
    }

    @Test
    void testRecordWithoutChildrenFieldIsExpanded() {
        ObjectNode block = ProtoJson.toTree(block(id('a'), 1));
        block.remove("batches");

        ObjectNode expanded = HeaderExpander.expand(RecordKind.BLOCK, block);
        assertTrue(expanded.get("header").isObject());
        assertFalse(expanded.has("batches"));
    }
}
