package com.qqsuccubus.egress.core.msg;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.qqsuccubus.egress.core.model.RequestKind;

/**
 * Kind-specific part of a start request.
 * <p>
 * The variant only selects the CPU cost category on the control plane; its fields are handed
 * to the pipeline untouched. The JSON discriminator is the {@link RequestKind} name.
 * </p>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
@JsonSubTypes({
    @JsonSubTypes.Type(value = EgressPayload.RoomComposite.class, name = "ROOM_COMPOSITE"),
    @JsonSubTypes.Type(value = EgressPayload.Web.class, name = "WEB"),
    @JsonSubTypes.Type(value = EgressPayload.TrackComposite.class, name = "TRACK_COMPOSITE"),
    @JsonSubTypes.Type(value = EgressPayload.Track.class, name = "TRACK")
})
public sealed interface EgressPayload {

    @JsonIgnore
    RequestKind kind();

    /**
     * Composite recording of a whole room rendered with a layout template.
     */
    record RoomComposite(String roomName, String layout, boolean audioOnly, String filepath)
        implements EgressPayload {
        @Override
        public RequestKind kind() {
            return RequestKind.ROOM_COMPOSITE;
        }
    }

    /**
     * Recording of an arbitrary web page.
     */
    record Web(String url, boolean audioOnly, String filepath) implements EgressPayload {
        @Override
        public RequestKind kind() {
            return RequestKind.WEB;
        }
    }

    /**
     * One audio and/or one video track muxed into a single output.
     */
    record TrackComposite(String roomName, String audioTrackId, String videoTrackId, String filepath)
        implements EgressPayload {
        @Override
        public RequestKind kind() {
            return RequestKind.TRACK_COMPOSITE;
        }
    }

    /**
     * A single track exported without transcoding.
     */
    record Track(String roomName, String trackId, String filepath) implements EgressPayload {
        @Override
        public RequestKind kind() {
            return RequestKind.TRACK;
        }
    }
}
