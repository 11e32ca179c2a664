package io.chainindex.core.query;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.Test;

import static io.chainindex.core.TestChain.hashX;
import static io.chainindex.core.TestChain.scriptHash;
import static org.junit.jupiter.api.Assertions.*;

class QueryArgumentsTest {

    @Test
    void scriptHashesMapToHashX() {
        assertEquals(hashX(3), QueryArguments.scriptHash(new TextNode(scriptHash(3))));
    }

    @Test
    void fullwidthDigitsAreNotHex() {
        String valid = scriptHash(3);
        // swap the first character for FULLWIDTH DIGIT ZERO
        TextNode mangled = new TextNode("０" + valid.substring(1));
        BadRequestException e = assertThrows(BadRequestException.class, () -> QueryArguments.scriptHash(mangled));
        assertTrue(e.getMessage().contains("is not a valid script hash"));
        assertThrows(BadRequestException.class, () -> QueryArguments.txHash(mangled));
        assertThrows(BadRequestException.class, () -> QueryArguments.hexString(new TextNode("０１")));
    }

    @Test
    void wrongJsonTypesAreRejected() {
        assertThrows(BadRequestException.class,
                () -> QueryArguments.nonNegativeInteger(JsonNodeFactory.instance.textNode("5")));
        assertThrows(BadRequestException.class,
                () -> QueryArguments.nonNegativeInteger(JsonNodeFactory.instance.numberNode(-1)));
        assertEquals(7, QueryArguments.nonNegativeInteger(null, 7));
        assertTrue(QueryArguments.bool(JsonNodeFactory.instance.booleanNode(true)));
    }
}
