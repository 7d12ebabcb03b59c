package dumb.lambdamesh.net;

import com.fasterxml.jackson.core.JsonProcessingException;
import dumb.lambdamesh.LambdaExpression;
import dumb.lambdamesh.Proof;
import dumb.lambdamesh.Vote;
import dumb.lambdamesh.util.Json;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MessageTest {

    @Test
    void messagesAreTaggedByType() throws Exception {
        var json = Message.encode(new Message.Ping("a", 42));
        var node = Json.the.readTree(json);
        assertEquals("PING", node.get("type").asText());
        assertEquals("a", node.get("senderId").asText());
        assertFalse(json.contains("\n"));
    }

    @Test
    void decodesHandWrittenRequest() throws Exception {
        var m = Message.decode("""
                {"type":"VERIFY_REQUEST","senderId":"n1","timestamp":1,"requestId":"n1-7",
                 "expr":{"text":"λx.x","hash":"abc","metadata":{"names":["id"]}},"unknownField":true}""");
        var req = assertInstanceOf(Message.VerifyRequest.class, m);
        assertEquals(Message.Type.VERIFY_REQUEST, req.type());
        assertEquals("λx.x", req.expr().text());
        assertEquals("id", req.expr().metadata().names().get(0));
    }

    @Test
    void votesCarryProofsAcrossTheWire() throws Exception {
        var proof = new Proof.Builder().add(Proof.RULE_BETA, "(λx.x) y", "y", "substitute").build("y", "h", "reduced");
        var vote = Vote.equivalent("n2", "n1-7", 1, "h", "Equivalent to identity", proof);
        var back = assertInstanceOf(Message.VerifyVote.class,
                Message.decode(Message.encode(new Message.VerifyVote("n2", 5, "n1-7", vote))));
        assertEquals(vote, back.vote());
        assertTrue(back.vote().proof().usesRule(Proof.RULE_BETA));
    }

    @Test
    void syncResponseMayOmitMorphism() throws Exception {
        var json = Message.encode(new Message.MorphismSyncResponse("n3", 1, "h", null, null));
        assertFalse(json.contains("morphism\""), json);
        var back = assertInstanceOf(Message.MorphismSyncResponse.class, Message.decode(json));
        assertEquals("h", back.hash());
    }

    @Test
    void malformedInputIsAnError() {
        assertThrows(JsonProcessingException.class, () -> Message.decode("{\"type\":\"NOPE\",\"senderId\":\"x\"}"));
        assertThrows(JsonProcessingException.class, () -> Message.decode("not json"));
    }

    @Test
    void expressionHashIgnoresSpelling() {
        assertEquals(LambdaExpression.hash("λx.x"), LambdaExpression.hash("  \\x .  x "));
        assertEquals(LambdaExpression.hash("λx.x"), LambdaExpression.hash("\\lambda x => x"));
        assertEquals("(f x)", LambdaExpression.normalize("( f   x )"));
    }
}
