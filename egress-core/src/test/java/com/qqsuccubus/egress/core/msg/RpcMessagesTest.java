package com.qqsuccubus.egress.core.msg;

import com.qqsuccubus.egress.core.error.EgressException;
import com.qqsuccubus.egress.core.error.ErrorCode;
import com.qqsuccubus.egress.core.model.EgressInfo;
import com.qqsuccubus.egress.core.model.EgressStatus;
import com.qqsuccubus.egress.core.model.RequestKind;
import com.qqsuccubus.egress.core.util.JsonUtils;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RpcMessagesTest {

    @Test
    void testStartRequest_PayloadVariantSurvivesJson() {
        RpcRequest request = RpcRequest.builder()
            .requestId("RQ_1")
            .replyTo(Topics.responseTopicFor("client-a"))
            .type(RpcRequest.Type.START)
            .start(new StartEgressRequest("room-1", "ws://media:7880",
                new EgressPayload.TrackComposite("room-1", "TR_audio", "TR_video", "/out/room-1.mp4")))
            .ts(42L)
            .build();

        String json = JsonUtils.writeValueAsString(request);
        assertTrue(json.contains("\"kind\":\"TRACK_COMPOSITE\""), json);

        RpcRequest decoded = JsonUtils.readValue(json, RpcRequest.class);
        assertEquals("egress.responses.client-a", decoded.getReplyTo());
        assertEquals(RequestKind.TRACK_COMPOSITE, decoded.getStart().getKind());

        EgressPayload.TrackComposite payload =
            assertInstanceOf(EgressPayload.TrackComposite.class, decoded.getStart().getPayload());
        assertEquals("TR_video", payload.videoTrackId());
    }

    @Test
    void testStartRequest_MissingPayloadHasNoKind() {
        StartEgressRequest request = JsonUtils.readValue("{\"roomId\":\"room-1\"}", StartEgressRequest.class);

        assertNull(request.getPayload());
        assertNull(request.getKind());
    }

    @Test
    void testUnknownPayloadKindRejected() {
        assertThrows(IllegalArgumentException.class, () -> JsonUtils.readValue(
            "{\"roomId\":\"r\",\"payload\":{\"kind\":\"SEGMENTS\"}}", StartEgressRequest.class));
    }

    @Test
    void testFailureResponse_RebuildsException() {
        RpcResponse response = RpcResponse.failure("RQ_2", "node-1",
            EgressException.resourceExhausted("not enough cpu for web"));

        RpcResponse decoded = JsonUtils.readValue(JsonUtils.writeValueAsString(response), RpcResponse.class);

        assertTrue(decoded.isError());
        assertNull(decoded.getInfo());
        assertTrue(decoded.getInfos().isEmpty());
        EgressException error = decoded.toException();
        assertEquals(ErrorCode.RESOURCE_EXHAUSTED, error.getCode());
        assertEquals("not enough cpu for web", error.getMessage());
    }

    @Test
    void testInfoDefaultsErrorToEmpty() {
        EgressInfo info = EgressInfo.builder()
            .egressId("EG_1")
            .roomId("room-1")
            .requestKind(RequestKind.WEB)
            .status(EgressStatus.ACTIVE)
            .build();

        assertEquals("", info.getError());
        assertFalse(info.hasError());
        assertTrue(info.withError("boom").hasError());
    }
}
